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
import pulse.fn.tuple.Tuple;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Extract a nested property of every value. Each key looks up a {@link Map} entry, or an index in a {@link List},
 * a {@link Tuple} or an array. A value that cannot be navigated terminates the sequence with an
 * {@link IllegalArgumentException}.
 *
 * @since 1.0
 */
public final class ObservablePluck<T, V> extends ObservableBarrier<T, V> {

	private final Object[] keys;

	public ObservablePluck(StreamSource<? extends T> source, Object... keys) {
		super(source);
		Assert.isTrue(keys != null && keys.length > 0, "At least one key is required");
		for (Object key : keys) {
			Assert.notNull(key, "Keys cannot be null");
		}
		this.keys = keys.clone();
	}

	@Override
	protected ObserverBarrier<T, V> apply(Observer<? super V> observer) {
		return new PluckBarrier<T, V>(observer, keys);
	}

	@Override
	public String toString() {
		return "{keys: " + Arrays.toString(keys) + ", source: " + source + "}";
	}

	static Object select(Object target, Object key) {
		if (target instanceof Map) {
			return ((Map<?, ?>) target).get(key);
		}
		if (!(key instanceof Integer)) {
			throw new IllegalArgumentException("Cannot pluck key '" + key + "' from " + describe(target));
		}
		int index = (Integer) key;
		if (target instanceof List) {
			return ((List<?>) target).get(index);
		}
		if (target instanceof Tuple) {
			return ((Tuple) target).get(index);
		}
		if (target != null && target.getClass().isArray()) {
			return Array.get(target, index);
		}
		throw new IllegalArgumentException("Cannot pluck index " + index + " from " + describe(target));
	}

	private static String describe(Object target) {
		return target == null ? "null" : target.getClass().getName();
	}

	static final class PluckBarrier<T, V> extends ObserverBarrier<T, V> {

		private final Object[] keys;

		PluckBarrier(Observer<? super V> subscriber, Object[] keys) {
			super(subscriber);
			this.keys = keys;
		}

		@Override
		@SuppressWarnings("unchecked")
		protected void doNext(T value) {
			Object current = value;
			for (Object key : keys) {
				current = select(current, key);
			}
			emitNext((V) current);
		}
	}
}
