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

/**
 * Drop the values of the source until the other source signals anything, then forward them. Errors and completion
 * of the source are forwarded whether or not the gate is open. The other source is released once it has opened
 * the gate.
 *
 * @since 1.0
 */
public final class ObservableSkipUntil<T> extends ObservableBarrier<T, T> {

	private final StreamSource<?> other;

	public ObservableSkipUntil(StreamSource<? extends T> source, StreamSource<?> other) {
		super(source);
		this.other = Assert.notNull(other, "other");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		SkipUntilBarrier<T> barrier = new SkipUntilBarrier<T>(observer);
		barrier.start(other);
		return barrier;
	}

	static final class SkipUntilBarrier<T> extends ObserverBarrier<T, T> {

		private volatile boolean      open;
		private volatile Subscription gate;

		SkipUntilBarrier(Observer<? super T> subscriber) {
			super(subscriber);
		}

		void start(StreamSource<?> other) {
			Subscription s = other.subscribe(new GateObserver());
			if (open) {
				s.unsubscribe();
			} else {
				gate = own(s);
			}
		}

		void openGate() {
			if (open) {
				return;
			}
			open = true;
			Subscription s = gate;
			if (s != null) {
				disown(s);
				s.unsubscribe();
			}
		}

		@Override
		protected void doNext(T value) {
			if (open) {
				emitNext(value);
			}
		}

		final class GateObserver implements Observer<Object> {

			@Override
			public void onNext(Object value) {
				openGate();
			}

			@Override
			public void onError(Throwable error) {
				openGate();
			}

			@Override
			public void onCompleted() {
				openGate();
			}

			@Override
			public boolean isStopped() {
				return open || SkipUntilBarrier.this.isStopped();
			}
		}
	}
}
