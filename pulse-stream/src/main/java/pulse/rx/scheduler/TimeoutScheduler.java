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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulse.core.config.PropertiesConfigurationReader;
import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.core.timer.Timer;
import pulse.core.timer.Timers;
import pulse.fn.Consumer;
import pulse.fn.Pausable;
import pulse.rx.Subscription;

import java.util.concurrent.TimeUnit;

/**
 * Delegates delays to a {@link Timer}: every resumption of a task is a one-shot timer submission, in milliseconds.
 * Work runs on the timer's thread, where there is no caller to report to, so failures are logged and end the task.
 */
public class TimeoutScheduler extends AbstractScheduler {

	private static final Logger log = LoggerFactory.getLogger(TimeoutScheduler.class);

	private final Timer timer;

	/**
	 * A scheduler on the global timer, with the default delay read from {@code pulse.scheduler.timeout.defaultDelay}.
	 */
	public TimeoutScheduler() {
		this(Timers.global(), new PropertiesConfigurationReader().read().getTimeoutSchedulerDefaultDelay());
	}

	/**
	 * @param defaultDelay delay applied by {@link #schedule(Runnable)}, in milliseconds
	 */
	public TimeoutScheduler(long defaultDelay) {
		this(Timers.global(), defaultDelay);
	}

	/**
	 * @param timer        the timer queue to submit to
	 * @param defaultDelay delay applied by {@link #schedule(Runnable)}, in milliseconds
	 */
	public TimeoutScheduler(Timer timer, long defaultDelay) {
		super(defaultDelay);
		Assert.isTrue(defaultDelay >= 0, "Default delay cannot be negative");
		this.timer = Assert.notNull(timer, "timer");
	}

	@Override
	public Subscription schedule(Task task, long delay) {
		TimerTask handle = new TimerTask(Assert.notNull(task, "task"));
		handle.submit(delay);
		return handle;
	}

	public Timer getTimer() {
		return timer;
	}

	@Override
	public String toString() {
		return "TimeoutScheduler{defaultDelay=" + getDefaultDelay() + ", timer=" + timer + "}";
	}

	private final class TimerTask extends Subscription implements Consumer<Long> {

		private final Task task;

		private volatile Pausable pending;

		TimerTask(Task task) {
			this.task = task;
		}

		void submit(long delay) {
			pending = timer.submit(this, Math.max(0L, delay), TimeUnit.MILLISECONDS);
			if (isUnsubscribed()) {
				pending.cancel();
			}
		}

		@Override
		public void accept(Long now) {
			if (isUnsubscribed()) {
				return;
			}
			TaskStep step;
			try {
				step = task.resume();
				if (step == null) {
					throw new NullPointerException("Task " + task + " returned a null step");
				}
			} catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				log.error("Scheduled task " + task + " failed", t);
				unsubscribe();
				return;
			}
			if (step.isFinished()) {
				unsubscribe();
			} else {
				submit(step.getDelay());
			}
		}

		@Override
		protected void doUnsubscribe() {
			Pausable p = pending;
			if (p != null) {
				p.cancel();
			}
		}
	}

}
