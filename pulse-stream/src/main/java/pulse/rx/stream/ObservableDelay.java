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
package pulse.rx.stream;

import pulse.core.support.Assert;
import pulse.fn.Supplier;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;
import pulse.rx.scheduler.Scheduler;

/**
 * Shift every signal, terminal ones included, by a delay read from a {@link Supplier} each time a signal arrives.
 * Unsubscribing cancels the signals still pending.
 *
 * @since 1.0
 */
public final class ObservableDelay<T> extends ObservableBarrier<T, T> {

	private final Supplier<Long> delay;
	private final Scheduler      scheduler;

	public ObservableDelay(StreamSource<? extends T> source, Supplier<Long> delay, Scheduler scheduler) {
		super(source);
		this.delay = Assert.notNull(delay, "delay");
		this.scheduler = Assert.notNull(scheduler, "scheduler");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new DelayBarrier<T>(observer, delay, scheduler);
	}

	static final class DelayBarrier<T> extends ObserverBarrier<T, T> {

		private final Supplier<Long> delay;
		private final Scheduler      scheduler;

		DelayBarrier(Observer<? super T> subscriber, Supplier<Long> delay, Scheduler scheduler) {
			super(subscriber);
			this.delay = delay;
			this.scheduler = scheduler;
		}

		@Override
		protected void doNext(final T value) {
			delay(new Runnable() {
				@Override
				public void run() {
					emitNext(value);
				}
			});
		}

		@Override
		protected void doError(final Throwable error) {
			delay(new Runnable() {
				@Override
				public void run() {
					emitError(error);
				}
			});
		}

		@Override
		protected void doComplete() {
			delay(new Runnable() {
				@Override
				public void run() {
					emitComplete();
				}
			});
		}

		private void delay(Runnable signal) {
			Long time = delay.get();
			DelayedSignal delayed = new DelayedSignal(signal);
			Subscription handle = scheduler.schedule(delayed, time == null ? 0L : time);
			if (!delayed.fired) {
				delayed.handle = own(handle);
			}
		}

		final class DelayedSignal implements Runnable {

			private final Runnable signal;

			volatile boolean fired;
			Subscription handle;

			DelayedSignal(Runnable signal) {
				this.signal = signal;
			}

			@Override
			public void run() {
				fired = true;
				if (handle != null) {
					disown(handle);
				}
				if (isStopped()) {
					return;
				}
				try {
					signal.run();
				} catch (Throwable t) {
					fail(t);
				}
			}
		}
	}
}
