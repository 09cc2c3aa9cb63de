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
 * Emit the last value, if any, on completion.
 *
 * @since 1.0
 */
public final class ObservableLast<T> extends ObservableBarrier<T, T> {

	public ObservableLast(StreamSource<? extends T> source) {
		super(source);
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new LastBarrier<T>(observer);
	}

	static final class LastBarrier<T> extends ObserverBarrier<T, T> {

		private T       last;
		private boolean hasValue;

		LastBarrier(Observer<? super T> subscriber) {
			super(subscriber);
		}

		@Override
		protected void doNext(T value) {
			last = value;
			hasValue = true;
		}

		@Override
		protected void doComplete() {
			if (hasValue) {
				emitNext(last);
			}
			emitComplete();
		}
	}
}
