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

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A {@literal Tuple} is an immutable, fixed-size sequence of objects, each of which can be of an arbitrary type.
 * Entries may be {@code null}; the size is kept explicitly so trailing {@code null} entries still count.
 */
@SuppressWarnings({"rawtypes"})
public class Tuple implements Iterable {

	protected final List<Object> entries;
	protected final int          size;

	public Tuple(@Nonnull Collection<?> values) {
		this.entries = Arrays.asList(values.toArray());
		this.size = entries.size();
	}

	public Tuple(Object... values) {
		this.entries = Arrays.asList(values.clone());
		this.size = values.length;
	}

	/**
	 * Create a {@link Tuple2} with the given objects.
	 *
	 * @param t1   The first value in the tuple.
	 * @param t2   The second value in the tuple.
	 * @param <T1> The type of the first value.
	 * @param <T2> The type of the second value.
	 * @return The new {@link Tuple2}.
	 */
	public static <T1, T2> Tuple2<T1, T2> of(T1 t1, T2 t2) {
		return new Tuple2<T1, T2>(t1, t2);
	}

	/**
	 * Create a {@link Tuple3} with the given objects.
	 *
	 * @param t1   The first value in the tuple.
	 * @param t2   The second value in the tuple.
	 * @param t3   The third value in the tuple.
	 * @param <T1> The type of the first value.
	 * @param <T2> The type of the second value.
	 * @param <T3> The type of the third value.
	 * @return The new {@link Tuple3}.
	 */
	public static <T1, T2, T3> Tuple3<T1, T2, T3> of(T1 t1, T2 t2, T3 t3) {
		return new Tuple3<T1, T2, T3>(t1, t2, t3);
	}

	/**
	 * Create a {@link Tuple} of any arity from the given array. The array is copied.
	 *
	 * @param values The values of the tuple.
	 * @return The new {@link Tuple}.
	 */
	public static Tuple from(Object[] values) {
		return new Tuple(values);
	}

	/**
	 * Get the object at the given index.
	 *
	 * @param index The index of the object to retrieve. Starts at 0.
	 * @return The object or {@literal null} if out of bounds.
	 */
	public Object get(int index) {
		return index >= 0 && size > index ? entries.get(index) : null;
	}

	/**
	 * Turn this {@literal Tuple} into a plain Object array.
	 *
	 * @return A new Object array.
	 */
	public Object[] toArray() {
		return entries.toArray();
	}

	/**
	 * @return an unmodifiable view of the entries
	 */
	public List<Object> toList() {
		return Collections.unmodifiableList(entries);
	}

	/**
	 * Return the number of elements in this {@literal Tuple}.
	 *
	 * @return The size of this {@literal Tuple}.
	 */
	public int size() {
		return size;
	}

	@Override
	@Nonnull
	public Iterator<?> iterator() {
		return toList().iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Tuple)) {
			return false;
		}
		Tuple other = (Tuple) o;
		return size == other.size && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return 31 * size + entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

}
