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

/**
 * The outcome of one {@link Task#resume()} call.
 */
public final class TaskStep {

	private static final TaskStep FINISHED = new TaskStep(true, 0L);
	private static final TaskStep PROCEED  = new TaskStep(false, 0L);

	private final boolean finished;
	private final long    delay;

	private TaskStep(boolean finished, long delay) {
		this.finished = finished;
		this.delay = delay;
	}

	/**
	 * @return the step of a task with nothing left to do
	 */
	public static TaskStep finished() {
		return FINISHED;
	}

	/**
	 * @return the step of a task to resume as soon as the scheduler allows
	 */
	public static TaskStep proceed() {
		return PROCEED;
	}

	/**
	 * @param delay time to wait before the next resumption, in the scheduler's time unit
	 * @return the step of a suspended task
	 */
	public static TaskStep sleep(long delay) {
		return delay == 0L ? PROCEED : new TaskStep(false, delay);
	}

	public boolean isFinished() {
		return finished;
	}

	public long getDelay() {
		return delay;
	}

	@Override
	public String toString() {
		return finished ? "TaskStep{finished}" : "TaskStep{sleep=" + delay + "}";
	}

}
