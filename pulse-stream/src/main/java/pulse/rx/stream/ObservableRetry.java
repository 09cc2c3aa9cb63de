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
import pulse.rx.subscription.SerialSubscription;

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * Resubscribe to the source when it fails, at most {@code count} times, so that the source is subscribed up to
 * {@code count + 1} times. The error following the last attempt is forwarded. Synchronous sources failing on
 * subscribe are retried in a loop rather than recursively.
 *
 * @since 1.0
 */
public final class ObservableRetry<T> extends ObservableBarrier<T, T> {

	private final long count;

	public ObservableRetry(StreamSource<? extends T> source, long count) {
		super(source);
		Assert.isTrue(count >= 0, "count >= 0 required but it was " + count);
		this.count = count;
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		RetryBarrier<T> barrier = new RetryBarrier<T>(observer, source, count);
		barrier.resubscribe();
		return barrier;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new RetryBarrier<T>(observer, source, count);
	}

	static final class RetryBarrier<T> extends ObserverBarrier<T, T> {

		@SuppressWarnings("rawtypes")
		private static final AtomicIntegerFieldUpdater<RetryBarrier> WIP =
				AtomicIntegerFieldUpdater.newUpdater(RetryBarrier.class, "wip");

		private final StreamSource<? extends T> source;
		private final long                      count;
		private final SerialSubscription        current;

		private long retries;

		private volatile int wip;

		RetryBarrier(Observer<? super T> subscriber, StreamSource<? extends T> source, long count) {
			super(subscriber);
			this.source = source;
			this.count = count;
			this.current = own(new SerialSubscription());
		}

		void resubscribe() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			do {
				if (isStopped()) {
					return;
				}
				current.set(source.subscribe(this));
			}
			while (WIP.decrementAndGet(this) != 0);
		}

		@Override
		protected void doError(Throwable error) {
			if (++retries > count) {
				emitError(error);
			} else {
				resubscribe();
			}
		}
	}
}
