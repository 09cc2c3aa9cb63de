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
import pulse.fn.tuple.Tuple;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

import java.util.List;

/**
 * Combine every value of the source with the latest value of each other source into a {@link Tuple}
 * {@code (value, latest1, latest2, ...)}. A side that has not produced anything yet contributes {@code null}.
 * Errors of the other sources are forwarded, their completion is ignored.
 *
 * @since 1.0
 */
public final class ObservableWithLatestFrom<T> extends ObservableBarrier<T, Tuple> {

	private final StreamSource<?>[] others;

	public ObservableWithLatestFrom(StreamSource<? extends T> source, List<? extends StreamSource<?>> others) {
		super(source);
		Assert.notNull(others, "others");
		this.others = others.toArray(new StreamSource<?>[others.size()]);
		for (StreamSource<?> other : this.others) {
			Assert.notNull(other, "Sources cannot be null");
		}
	}

	@Override
	protected ObserverBarrier<T, Tuple> apply(Observer<? super Tuple> observer) {
		WithLatestFromBarrier<T> barrier = new WithLatestFromBarrier<T>(observer, others.length);
		barrier.start(others);
		return barrier;
	}

	static final class WithLatestFromBarrier<T> extends ObserverBarrier<T, Tuple> {

		private final Object[] latest;

		WithLatestFromBarrier(Observer<? super Tuple> subscriber, int n) {
			super(subscriber);
			this.latest = new Object[n];
		}

		void start(StreamSource<?>[] others) {
			for (int i = 0; i < others.length && !isStopped(); i++) {
				own(others[i].subscribe(new LatestObserver(i)));
			}
		}

		@Override
		protected void doNext(T value) {
			Object[] payload = new Object[latest.length + 1];
			payload[0] = value;
			System.arraycopy(latest, 0, payload, 1, latest.length);
			emitNext(Tuple.from(payload));
		}

		final class LatestObserver implements Observer<Object> {

			private final int index;

			LatestObserver(int index) {
				this.index = index;
			}

			@Override
			public void onNext(Object value) {
				latest[index] = value;
			}

			@Override
			public void onError(Throwable error) {
				WithLatestFromBarrier.this.onError(error);
			}

			@Override
			public void onCompleted() {
				// keep the latest value
			}

			@Override
			public boolean isStopped() {
				return WithLatestFromBarrier.this.isStopped();
			}
		}
	}
}
