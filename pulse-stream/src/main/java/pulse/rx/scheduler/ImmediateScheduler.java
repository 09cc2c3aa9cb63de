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

import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.rx.Subscription;

/**
 * Runs everything synchronously on the calling thread. Delays are ignored and a task is resumed in a loop until
 * it finishes, so by the time {@code schedule} returns there is nothing left to cancel. Failures propagate to the
 * caller.
 */
public class ImmediateScheduler extends AbstractScheduler {

	public ImmediateScheduler() {
		super(0L);
	}

	@Override
	public Subscription schedule(Task task, long delay) {
		Assert.notNull(task, "task");
		try {
			while (!task.resume().isFinished()) {
				// ignore the requested sleep
			}
		} catch (Exception e) {
			throw Exceptions.propagate(e);
		}
		return Subscription.empty();
	}

	@Override
	public void unschedule(Subscription handle) {
	}

	@Override
	public String toString() {
		return "ImmediateScheduler";
	}

}
