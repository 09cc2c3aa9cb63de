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
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

/**
 * Subscribe to every inner source as it arrives and forward all their values as they come. The sequence completes
 * once the outer source and every inner source have completed; the first error from any of them terminates it.
 *
 * @since 1.0
 */
public final class ObservableFlatten<T> extends ObservableBarrier<StreamSource<? extends T>, T> {

	public ObservableFlatten(StreamSource<? extends StreamSource<? extends T>> source) {
		super(source);
	}

	@Override
	protected ObserverBarrier<StreamSource<? extends T>, T> apply(Observer<? super T> observer) {
		return new FlattenBarrier<T>(observer);
	}

	static final class FlattenBarrier<T> extends ObserverBarrier<StreamSource<? extends T>, T> {

		// the outer source counts as one
		private int remaining = 1;

		FlattenBarrier(Observer<? super T> subscriber) {
			super(subscriber);
		}

		@Override
		protected void doNext(StreamSource<? extends T> inner) {
			if (inner == null) {
				throw new NullPointerException("The inner source is null");
			}
			remaining++;
			InnerObserver observer = new InnerObserver();
			Subscription s = inner.subscribe(observer);
			if (!observer.done) {
				observer.subscription = own(s);
			}
		}

		@Override
		protected void doComplete() {
			release();
		}

		void release() {
			if (--remaining == 0) {
				emitComplete();
			}
		}

		final class InnerObserver implements Observer<T> {

			boolean      done;
			Subscription subscription;

			@Override
			public void onNext(T value) {
				if (isStopped()) {
					return;
				}
				try {
					emitNext(value);
				} catch (Throwable t) {
					fail(t);
				}
			}

			@Override
			public void onError(Throwable error) {
				done = true;
				FlattenBarrier.this.onError(error);
			}

			@Override
			public void onCompleted() {
				if (done || isStopped()) {
					return;
				}
				done = true;
				if (subscription != null) {
					disown(subscription);
				}
				release();
			}

			@Override
			public boolean isStopped() {
				return FlattenBarrier.this.isStopped();
			}
		}
	}
}
