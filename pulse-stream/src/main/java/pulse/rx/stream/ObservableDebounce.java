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
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;
import pulse.rx.scheduler.Scheduler;

/**
 * Hold every signal for {@code time} and deliver it only if no signal of the same kind arrived in the meantime.
 * Values, errors and completion are debounced independently.
 *
 * @since 1.0
 */
public final class ObservableDebounce<T> extends ObservableBarrier<T, T> {

	private final long      time;
	private final Scheduler scheduler;

	public ObservableDebounce(StreamSource<? extends T> source, long time, Scheduler scheduler) {
		super(source);
		Assert.isTrue(time >= 0, "Debounce time cannot be negative");
		this.time = time;
		this.scheduler = Assert.notNull(scheduler, "scheduler");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new DebounceBarrier<T>(observer, time, scheduler);
	}

	static final class DebounceBarrier<T> extends ObserverBarrier<T, T> {

		private static final int NEXT     = 0;
		private static final int ERROR    = 1;
		private static final int COMPLETE = 2;

		private final long      time;
		private final Scheduler scheduler;

		private final Subscription[] pending = new Subscription[3];

		DebounceBarrier(Observer<? super T> subscriber, long time, Scheduler scheduler) {
			super(subscriber);
			this.time = time;
			this.scheduler = scheduler;
		}

		@Override
		protected void doNext(final T value) {
			arm(NEXT, new Runnable() {
				@Override
				public void run() {
					emitNext(value);
				}
			});
		}

		@Override
		protected void doError(final Throwable error) {
			arm(ERROR, new Runnable() {
				@Override
				public void run() {
					emitError(error);
				}
			});
		}

		@Override
		protected void doComplete() {
			arm(COMPLETE, new Runnable() {
				@Override
				public void run() {
					emitComplete();
				}
			});
		}

		private void arm(int kind, Runnable signal) {
			Subscription previous = pending[kind];
			if (previous != null) {
				disown(previous);
				scheduler.unschedule(previous);
			}
			DebouncedSignal debounced = new DebouncedSignal(kind, signal);
			Subscription handle = scheduler.schedule(debounced, time);
			if (!debounced.fired) {
				pending[kind] = own(handle);
			}
		}

		final class DebouncedSignal implements Runnable {

			private final int      kind;
			private final Runnable signal;

			volatile boolean fired;

			DebouncedSignal(int kind, Runnable signal) {
				this.kind = kind;
				this.signal = signal;
			}

			@Override
			public void run() {
				fired = true;
				Subscription handle = pending[kind];
				if (handle != null) {
					pending[kind] = null;
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
