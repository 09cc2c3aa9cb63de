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

import pulse.fn.Consumer;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Run side effects before forwarding each signal. A hook that throws replaces the signal it observed with an
 * {@code onError} carrying the hook failure.
 *
 * @since 1.0
 */
public final class ObservableTap<T> extends ObservableBarrier<T, T> {

	private final Consumer<? super T>         onNext;
	private final Consumer<? super Throwable> onError;
	private final Runnable                    onCompleted;

	public ObservableTap(StreamSource<? extends T> source,
	                     Consumer<? super T> onNext,
	                     Consumer<? super Throwable> onError,
	                     Runnable onCompleted) {
		super(source);
		this.onNext = onNext;
		this.onError = onError;
		this.onCompleted = onCompleted;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new TapBarrier<T>(observer, onNext, onError, onCompleted);
	}

	static final class TapBarrier<T> extends ObserverBarrier<T, T> {

		private final Consumer<? super T>         onNext;
		private final Consumer<? super Throwable> onError;
		private final Runnable                    onCompleted;

		TapBarrier(Observer<? super T> subscriber,
		           Consumer<? super T> onNext,
		           Consumer<? super Throwable> onError,
		           Runnable onCompleted) {
			super(subscriber);
			this.onNext = onNext;
			this.onError = onError;
			this.onCompleted = onCompleted;
		}

		@Override
		protected void doNext(T value) {
			if (onNext != null) {
				onNext.accept(value);
			}
			emitNext(value);
		}

		@Override
		protected void doError(Throwable error) {
			if (onError != null) {
				onError.accept(error);
			}
			emitError(error);
		}

		@Override
		protected void doComplete() {
			if (onCompleted != null) {
				onCompleted.run();
			}
			emitComplete();
		}
	}
}
