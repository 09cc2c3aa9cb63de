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

import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Forward the first {@code n} values, then complete and release the source. A non-positive {@code n} completes
 * before subscribing to the source.
 *
 * @since 1.0
 */
public final class ObservableTake<T> extends ObservableBarrier<T, T> {

	private final long n;

	public ObservableTake(StreamSource<? extends T> source, long n) {
		super(source);
		this.n = n;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		TakeBarrier<T> barrier = new TakeBarrier<T>(observer, n);
		if (n <= 0) {
			barrier.onCompleted();
		}
		return barrier;
	}

	static final class TakeBarrier<T> extends ObserverBarrier<T, T> {

		private long remaining;

		TakeBarrier(Observer<? super T> subscriber, long n) {
			super(subscriber);
			this.remaining = n;
		}

		@Override
		protected void doNext(T value) {
			emitNext(value);
			if (--remaining <= 0) {
				emitComplete();
			}
		}
	}
}
