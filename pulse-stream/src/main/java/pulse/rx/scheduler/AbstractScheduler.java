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

import pulse.core.support.Assert;
import pulse.rx.Subscription;

/**
 * Base {@link Scheduler} running plain actions as single-step tasks.
 */
public abstract class AbstractScheduler implements Scheduler {

	private final long defaultDelay;

	protected AbstractScheduler(long defaultDelay) {
		this.defaultDelay = defaultDelay;
	}

	public long getDefaultDelay() {
		return defaultDelay;
	}

	@Override
	public Subscription schedule(Runnable action) {
		return schedule(action, defaultDelay);
	}

	@Override
	public Subscription schedule(Runnable action, long delay) {
		return schedule(new RunnableTask(Assert.notNull(action, "action")), delay);
	}

	@Override
	public void unschedule(Subscription handle) {
		if (handle != null) {
			handle.unsubscribe();
		}
	}

	private static final class RunnableTask implements Task {

		private final Runnable action;

		RunnableTask(Runnable action) {
			this.action = action;
		}

		@Override
		public TaskStep resume() {
			action.run();
			return TaskStep.finished();
		}

		@Override
		public String toString() {
			return action.toString();
		}
	}

}
