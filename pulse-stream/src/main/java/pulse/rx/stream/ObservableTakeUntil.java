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
import pulse.rx.observer.ObserverBarrier;

/**
 * Forward the source until the other source signals anything, value, error or completion alike, then complete.
 * The other source is subscribed first.
 *
 * @since 1.0
 */
public final class ObservableTakeUntil<T> extends ObservableBarrier<T, T> {

	private final StreamSource<?> other;

	public ObservableTakeUntil(StreamSource<? extends T> source, StreamSource<?> other) {
		super(source);
		this.other = Assert.notNull(other, "other");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		TakeUntilBarrier<T> barrier = new TakeUntilBarrier<T>(observer);
		barrier.start(other);
		return barrier;
	}

	static final class TakeUntilBarrier<T> extends ObserverBarrier<T, T> {

		TakeUntilBarrier(Observer<? super T> subscriber) {
			super(subscriber);
		}

		void start(StreamSource<?> other) {
			own(other.subscribe(new UntilObserver()));
		}

		final class UntilObserver implements Observer<Object> {

			@Override
			public void onNext(Object value) {
				TakeUntilBarrier.this.onCompleted();
			}

			@Override
			public void onError(Throwable error) {
				TakeUntilBarrier.this.onCompleted();
			}

			@Override
			public void onCompleted() {
				TakeUntilBarrier.this.onCompleted();
			}

			@Override
			public boolean isStopped() {
				return TakeUntilBarrier.this.isStopped();
			}
		}
	}
}
