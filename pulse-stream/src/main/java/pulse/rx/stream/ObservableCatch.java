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

import pulse.fn.Function;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;
import pulse.rx.subscription.SerialSubscription;

/**
 * Replace an error of the source with the signals of a fallback source.
 * <ul>
 * <li>Without handler, the error is swallowed and the sequence completes.</li>
 * <li>A handler returning {@code null} lets the original error through.</li>
 * <li>A handler failing terminates the sequence with its own failure.</li>
 * </ul>
 * Errors of the fallback itself are not caught.
 *
 * @since 1.0
 */
public final class ObservableCatch<T> extends ObservableBarrier<T, T> {

	private final Function<? super Throwable, ? extends StreamSource<? extends T>> handler;

	public ObservableCatch(StreamSource<? extends T> source,
	                       Function<? super Throwable, ? extends StreamSource<? extends T>> handler) {
		super(source);
		this.handler = handler;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new CatchBarrier<T>(observer, handler);
	}

	static final class CatchBarrier<T> extends ObserverBarrier<T, T> {

		private final Function<? super Throwable, ? extends StreamSource<? extends T>> handler;

		private final SerialSubscription fallback;

		CatchBarrier(Observer<? super T> subscriber,
		             Function<? super Throwable, ? extends StreamSource<? extends T>> handler) {
			super(subscriber);
			this.handler = handler;
			this.fallback = own(new SerialSubscription());
		}

		@Override
		protected void doError(Throwable error) {
			if (handler == null) {
				emitComplete();
				return;
			}
			StreamSource<? extends T> next = handler.apply(error);
			if (next == null) {
				emitError(error);
				return;
			}
			Subscription s = next.subscribe(new FallbackObserver());
			fallback.set(s);
		}

		final class FallbackObserver implements Observer<T> {

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
				emitError(error);
			}

			@Override
			public void onCompleted() {
				emitComplete();
			}

			@Override
			public boolean isStopped() {
				return CatchBarrier.this.isStopped();
			}
		}
	}
}
