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
package pulse.core.timer;

import pulse.fn.Consumer;
import pulse.fn.Pausable;

import java.util.concurrent.TimeUnit;

/**
 * A queue of deferred and periodic callbacks. Callbacks receive the current time in milliseconds.
 */
public interface Timer {

	/**
	 * Schedule a recurring task. The given {@link Consumer} will be invoked once every N time units
	 * after the given delay.
	 *
	 * @param consumer            the {@code Consumer} to invoke each period
	 * @param period              the amount of time that should elapse between invocations of the given {@code
	 *                            Consumer}
	 * @param timeUnit            the unit of time the {@code period} is to be measured in
	 * @param delayInMilliseconds a number of milliseconds in which to delay any execution of the given {@code
	 *                            Consumer}
	 * @return a {@link Pausable} that can be used to {@link Pausable#cancel() cancel}, {@link Pausable#pause() pause}
	 * or {@link Pausable#resume() resume} the given task.
	 */
	Pausable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit, long delayInMilliseconds);

	/**
	 * Schedule a recurring task. The given {@link Consumer} will be invoked on the next tick, then
	 * once every N time units.
	 *
	 * @param consumer the {@code Consumer} to invoke each period
	 * @param period   the amount of time that should elapse between invocations of the given {@code Consumer}
	 * @param timeUnit the unit of time the {@code period} is to be measured in
	 * @return a {@link Pausable} that can be used to cancel, pause or resume the given task.
	 */
	Pausable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit);

	/**
	 * Submit a task for arbitrary execution after the given time delay. The delay is rounded up to the
	 * next multiple of the timer's resolution.
	 *
	 * @param consumer the {@code Consumer} to invoke
	 * @param delay    the amount of time that should elapse before invocations of the given {@code Consumer}
	 * @param timeUnit the unit of time the {@code delay} is to be measured in
	 * @return a {@link Pausable} that can be used to cancel the pending invocation.
	 */
	Pausable submit(Consumer<Long> consumer, long delay, TimeUnit timeUnit);

	/**
	 * Submit a task for execution on the next tick of the timer.
	 *
	 * @param consumer the {@code Consumer} to invoke
	 * @return a {@link Pausable} that can be used to cancel the pending invocation.
	 */
	Pausable submit(Consumer<Long> consumer);

	/**
	 * Start the timer if it is not running yet.
	 */
	void start();

	/**
	 * Cancel this timer by interrupting the task thread. No more tasks can be submitted to this timer after
	 * cancellation.
	 */
	void cancel();

	/**
	 * @return {@literal true} once {@link #cancel()} has been called
	 */
	boolean isCancelled();

	/**
	 * Get the resolution of this timer.
	 *
	 * @return the length of a tick in milliseconds
	 */
	long getResolution();

}
