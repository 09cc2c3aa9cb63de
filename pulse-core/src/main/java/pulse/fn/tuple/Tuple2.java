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
package pulse.fn.tuple;

/**
 * A tuple that holds two values
 *
 * @param <T1> The type of the first value held by this tuple
 * @param <T2> The type of the second value held by this tuple
 */
public class Tuple2<T1, T2> extends Tuple {

	Tuple2(Object... values) {
		super(values);
	}

	/**
	 * Type-safe way to get the first object of this {@link Tuple}.
	 *
	 * @return The first object, cast to the correct type.
	 */
	@SuppressWarnings("unchecked")
	public T1 getT1() {
		return (T1) get(0);
	}

	/**
	 * Type-safe way to get the second object of this {@link Tuple}.
	 *
	 * @return The second object, cast to the correct type.
	 */
	@SuppressWarnings("unchecked")
	public T2 getT2() {
		return (T2) get(1);
	}

}
