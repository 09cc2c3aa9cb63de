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
 * Factories for the built-in {@link Scheduler Schedulers}.
 */
public final class Schedulers {

	private static final ImmediateScheduler IMMEDIATE = new ImmediateScheduler();

	private Schedulers() {
	}

	/**
	 * @return the shared synchronous scheduler
	 */
	public static ImmediateScheduler immediate() {
		return IMMEDIATE;
	}

	/**
	 * @return a scheduler on the global timer, configured from {@code pulse.scheduler.timeout.*}
	 */
	public static TimeoutScheduler timeout() {
		return new TimeoutScheduler();
	}

	/**
	 * @param defaultDelay delay applied when none is given, in milliseconds
	 * @return a scheduler on the global timer
	 */
	public static TimeoutScheduler timeout(long defaultDelay) {
		return new TimeoutScheduler(defaultDelay);
	}

	/**
	 * @return a new virtual-time scheduler starting at 0
	 */
	public static CooperativeScheduler cooperative() {
		return new CooperativeScheduler();
	}

}
