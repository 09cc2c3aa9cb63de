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

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;

/**
 * Expose a {@link StreamSource} as a Reactive Streams {@link Publisher}. The source knows nothing about demand:
 * its values are queued and handed to the {@link Subscriber} as it requests them. Reactive Streams forbids
 * {@code null} values, so a {@code null} from the source terminates the subscriber with a
 * {@link NullPointerException}.
 *
 * @since 1.0
 */
public final class ObservablePublisher<T> implements Publisher<T> {

	private final StreamSource<? extends T> source;

	public ObservablePublisher(StreamSource<? extends T> source) {
		this.source = Assert.notNull(source, "source");
	}

	@Override
	public void subscribe(Subscriber<? super T> subscriber) {
		if (subscriber == null) {
			throw new NullPointerException("The subscriber cannot be null");
		}
		DemandSubscription<T> subscription = new DemandSubscription<T>(subscriber);
		subscriber.onSubscribe(subscription);
		subscription.setUpstream(source.subscribe(subscription));
	}

	@Override
	public String toString() {
		return "{source: " + source + "}";
	}

	static final class DemandSubscription<T> implements org.reactivestreams.Subscription, Observer<T> {

		@SuppressWarnings("rawtypes")
		private static final AtomicLongFieldUpdater<DemandSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(DemandSubscription.class, "requested");

		@SuppressWarnings("rawtypes")
		private static final AtomicIntegerFieldUpdater<DemandSubscription> WIP =
				AtomicIntegerFieldUpdater.newUpdater(DemandSubscription.class, "wip");

		private final Subscriber<? super T> actual;
		private final Queue<T>              queue = new ConcurrentLinkedQueue<T>();

		private volatile long requested;
		private volatile int  wip;

		private volatile boolean      done;
		private volatile boolean      cancelled;
		private volatile Throwable    error;
		private volatile Subscription upstream;

		DemandSubscription(Subscriber<? super T> actual) {
			this.actual = actual;
		}

		void setUpstream(Subscription s) {
			upstream = s;
			if (cancelled || done) {
				s.unsubscribe();
			}
		}

		@Override
		public void request(long n) {
			if (n <= 0) {
				cancel();
				actual.onError(new IllegalArgumentException("Request must be strictly positive but was " + n));
				return;
			}
			long r, u;
			do {
				r = requested;
				if (r == Long.MAX_VALUE) {
					break;
				}
				u = r + n;
				if (u < 0L) {
					u = Long.MAX_VALUE;
				}
			}
			while (!REQUESTED.compareAndSet(this, r, u));
			drain();
		}

		@Override
		public void cancel() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			release();
			if (WIP.getAndIncrement(this) == 0) {
				queue.clear();
			}
		}

		@Override
		public void onNext(T value) {
			if (isStopped()) {
				return;
			}
			if (value == null) {
				onError(new NullPointerException("Null values cannot be published"));
				return;
			}
			queue.offer(value);
			drain();
		}

		@Override
		public void onError(Throwable t) {
			if (isStopped()) {
				Exceptions.onErrorDropped(t);
				return;
			}
			error = t;
			done = true;
			release();
			drain();
		}

		@Override
		public void onCompleted() {
			if (isStopped()) {
				return;
			}
			done = true;
			release();
			drain();
		}

		@Override
		public boolean isStopped() {
			return done || cancelled;
		}

		private void release() {
			Subscription s = upstream;
			if (s != null) {
				s.unsubscribe();
			}
		}

		private void drain() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			int missed = 1;
			for (; ; ) {
				long r = requested;
				long emitted = 0L;

				while (emitted != r) {
					if (cancelled) {
						queue.clear();
						return;
					}
					boolean d = done;
					T v = queue.poll();
					if (v == null) {
						if (d) {
							terminate();
							return;
						}
						break;
					}
					actual.onNext(v);
					emitted++;
				}

				if (cancelled) {
					queue.clear();
					return;
				}
				if (done && queue.isEmpty()) {
					terminate();
					return;
				}

				if (emitted != 0L && r != Long.MAX_VALUE) {
					REQUESTED.addAndGet(this, -emitted);
				}

				missed = WIP.addAndGet(this, -missed);
				if (missed == 0) {
					break;
				}
			}
		}

		private void terminate() {
			cancelled = true;
			Throwable e = error;
			if (e != null) {
				actual.onError(e);
			} else {
				actual.onComplete();
			}
		}
	}
}
