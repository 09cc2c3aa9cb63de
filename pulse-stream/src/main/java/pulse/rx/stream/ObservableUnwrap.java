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

import pulse.fn.tuple.Tuple;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

import java.lang.reflect.Array;

/**
 * Emit each element of {@link Tuple}, {@link Iterable} and array values individually. Any other value is forwarded
 * as is.
 *
 * @since 1.0
 */
public final class ObservableUnwrap<T> extends ObservableBarrier<T, Object> {

	public ObservableUnwrap(StreamSource<? extends T> source) {
		super(source);
	}

	@Override
	protected ObserverBarrier<T, Object> apply(Observer<? super Object> observer) {
		return new UnwrapBarrier<T>(observer);
	}

	static final class UnwrapBarrier<T> extends ObserverBarrier<T, Object> {

		UnwrapBarrier(Observer<? super Object> subscriber) {
			super(subscriber);
		}

		@Override
		protected void doNext(T value) {
			if (value instanceof Iterable) {
				for (Object o : (Iterable<?>) value) {
					if (isStopped()) {
						return;
					}
					emitNext(o);
				}
			} else if (value != null && value.getClass().isArray()) {
				int length = Array.getLength(value);
				for (int i = 0; i < length && !isStopped(); i++) {
					emitNext(Array.get(value, i));
				}
			} else {
				emitNext(value);
			}
		}
	}
}
