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

import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

public class TupleTests {

	@Test
	public void tupleProvidesTypeSafeMethods() {
		Tuple3<String, Long, Integer> t3 = Tuple.of("string", 1L, 10);

		assertThat("first value is a string", String.class.isInstance(t3.getT1()));
		assertThat("second value is a long", Long.class.isInstance(t3.getT2()));
		assertThat("third value is an int", Integer.class.isInstance(t3.getT3()));
	}

	@Test
	public void trailingNullsCountTowardsSize() {
		Tuple t = Tuple.from(new Object[]{1, null, null});

		assertThat(t.size(), is(3));
		assertThat(t.get(2), is(nullValue()));
		assertThat(t.get(3), is(nullValue()));
		assertThat(t, is(not(Tuple.from(new Object[]{1}))));
	}

	@Test
	public void tupleIsIndependentOfSourceArray() {
		Object[] values = {"a", "b"};
		Tuple t = Tuple.from(values);
		values[0] = "changed";

		assertThat(t.get(0), is((Object) "a"));
		assertThat(t.toList(), contains((Object) "a", "b"));
	}

	@Test
	public void tuplesWithSameEntriesAreEqual() {
		assertThat(Tuple.of(1, "a"), is(Tuple.of(1, "a")));
		assertThat(new Tuple(Arrays.<Object>asList(1, null)), is(Tuple.from(new Object[]{1, null})));
		assertThat(Tuple.of(1, null).hashCode(), is(Tuple.of(1, null).hashCode()));
	}

}
