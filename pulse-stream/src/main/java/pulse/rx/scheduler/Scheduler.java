/*
 * Copyright (c) 2011-2014 Pivotal Software, Inc.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package pulse.rx.scheduler;

import pulse.rx.Subscription;

/**
 * Strategy deciding when deferred work runs. Time-sensitive operators and generator sources take one explicitly.
 */
public interface Scheduler {

	/**
	 * Run the action after the scheduler's default delay.
	 *
	 * @param action the work
	 * @return a handle cancelling the action if it has not run yet
	 */
	Subscription schedule(Runnable action);

	/**
	 * Run the action after the given delay.
	 *
	 * @param action the work
	 * @param delay  the delay, in the scheduler's time unit
	 * @return a handle cancelling the action if it has not run yet
	 */
	Subscription schedule(Runnable action, long delay);

	/**
	 * Drive the given task, first resumed after the given delay, then according to the {@link TaskStep} each
	 * resumption returns.
	 *
	 * @param task  the resumable work
	 * @param delay the delay before the first resumption
	 * @return a handle removing the task
	 */
	Subscription schedule(Task task, long delay);

	/**
	 * Cancel work previously scheduled on this scheduler.
	 *
	 * @param handle a handle returned by one of the {@code schedule} methods
	 */
	void unschedule(Subscription handle);

}
