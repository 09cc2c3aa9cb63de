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
 * @since 1.0
 */
public final class ObservableDefaultIfEmpty<T> extends ObservableBarrier<T, T> {

	private final T defaultValue;

	public ObservableDefaultIfEmpty(StreamSource<? extends T> source, T defaultValue) {
		super(source);
		this.defaultValue = defaultValue;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new DefaultIfEmptyBarrier<T>(observer, defaultValue);
	}

	static final class DefaultIfEmptyBarrier<T> extends ObserverBarrier<T, T> {

		private final T defaultValue;

		private boolean hasValues;

		DefaultIfEmptyBarrier(Observer<? super T> subscriber, T defaultValue) {
			super(subscriber);
			this.defaultValue = defaultValue;
		}

		@Override
		protected void doNext(T value) {
			hasValues = true;
			emitNext(value);
		}

		@Override
		protected void doComplete() {
			if (!hasValues) {
				emitNext(defaultValue);
			}
			emitComplete();
		}
	}
}
