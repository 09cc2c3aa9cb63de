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
package pulse.fn;

import java.util.Objects;

/**
 * Helper methods to provide syntax sugar for working with functional components.
 */
public abstract class Functions {

	@SuppressWarnings("rawtypes")
	private static final Function IDENTITY = new Function() {
		@Override
		public Object apply(Object o) {
			return o;
		}
	};

	@SuppressWarnings("rawtypes")
	private static final Consumer NOOP = new Consumer() {
		@Override
		public void accept(Object o) {
		}
	};

	@SuppressWarnings("rawtypes")
	private static final BiPredicate EQUALITY = new BiPredicate() {
		@Override
		public boolean test(Object o1, Object o2) {
			return Objects.equals(o1, o2);
		}
	};

	protected Functions() {
	}

	/**
	 * A {@link Function} returning its argument.
	 *
	 * @param <T> the type of the argument
	 * @return the identity function
	 */
	@SuppressWarnings("unchecked")
	public static <T> Function<T, T> identity() {
		return (Function<T, T>) IDENTITY;
	}

	/**
	 * A {@link Function} ignoring its argument and always returning the given value.
	 *
	 * @param value the value to return
	 * @param <T>   the type of the ignored argument
	 * @param <V>   the type of the value
	 * @return the constant function
	 */
	public static <T, V> Function<T, V> constant(final V value) {
		return new Function<T, V>() {
			@Override
			public V apply(T t) {
				return value;
			}
		};
	}

	/**
	 * A {@link Consumer} that does nothing.
	 *
	 * @param <T> the type of values to accept
	 * @return the no-op consumer
	 */
	@SuppressWarnings("unchecked")
	public static <T> Consumer<T> noop() {
		return (Consumer<T>) NOOP;
	}

	/**
	 * A {@link BiPredicate} matching equal (or both {@code null}) arguments.
	 *
	 * @param <T> the type of the arguments
	 * @return the equality predicate
	 */
	@SuppressWarnings("unchecked")
	public static <T> BiPredicate<T, T> equality() {
		return (BiPredicate<T, T>) EQUALITY;
	}

	/**
	 * Negate the given {@link Predicate}.
	 *
	 * @param predicate the predicate to negate
	 * @param <T>       the type of the tested values
	 * @return a predicate accepting what {@code predicate} rejects
	 */
	public static <T> Predicate<T> not(final Predicate<? super T> predicate) {
		return new Predicate<T>() {
			@Override
			public boolean test(T t) {
				return !predicate.test(t);
			}
		};
	}

}
