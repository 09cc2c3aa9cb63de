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
import pulse.fn.Function;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * @since 1.0
 */
public final class ObservableMap<T, V> extends ObservableBarrier<T, V> {

	private final Function<? super T, ? extends V> fn;

	public ObservableMap(StreamSource<? extends T> source, Function<? super T, ? extends V> fn) {
		super(source);
		this.fn = Assert.notNull(fn, "Map function cannot be null");
	}

	@Override
	protected ObserverBarrier<T, V> apply(Observer<? super V> observer) {
		return new MapBarrier<T, V>(observer, fn);
	}

	static final class MapBarrier<T, V> extends ObserverBarrier<T, V> {

		private final Function<? super T, ? extends V> fn;

		MapBarrier(Observer<? super V> subscriber, Function<? super T, ? extends V> fn) {
			super(subscriber);
			this.fn = fn;
		}

		@Override
		protected void doNext(T value) {
			emitNext(fn.apply(value));
		}
	}
}
