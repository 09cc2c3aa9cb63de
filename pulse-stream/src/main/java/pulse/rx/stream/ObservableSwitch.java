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
import pulse.rx.subscription.SerialSubscription;

/**
 * Mirror the most recent inner source: each new inner source unsubscribes the previous one. Completion of an inner
 * source is ignored and completion of the outer source completes the sequence. Errors of any of them are
 * forwarded.
 *
 * @since 1.0
 */
public final class ObservableSwitch<T> extends ObservableBarrier<StreamSource<? extends T>, T> {

	public ObservableSwitch(StreamSource<? extends StreamSource<? extends T>> source) {
		super(source);
	}

	@Override
	protected ObserverBarrier<StreamSource<? extends T>, T> apply(Observer<? super T> observer) {
		return new SwitchBarrier<T>(observer);
	}

	static final class SwitchBarrier<T> extends ObserverBarrier<StreamSource<? extends T>, T> {

		private final SerialSubscription current;

		private long generation;

		SwitchBarrier(Observer<? super T> subscriber) {
			super(subscriber);
			this.current = own(new SerialSubscription());
		}

		@Override
		protected void doNext(StreamSource<? extends T> inner) {
			if (inner == null) {
				throw new NullPointerException("The inner source is null");
			}
			current.set(null);
			SwitchObserver observer = new SwitchObserver(++generation);
			current.set(inner.subscribe(observer));
		}

		final class SwitchObserver implements Observer<T> {

			private final long id;

			SwitchObserver(long id) {
				this.id = id;
			}

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
				if (id == generation) {
					SwitchBarrier.this.onError(error);
				}
			}

			@Override
			public void onCompleted() {
				// the outer source decides when the sequence ends
			}

			@Override
			public boolean isStopped() {
				return id != generation || SwitchBarrier.this.isStopped();
			}
		}
	}
}
