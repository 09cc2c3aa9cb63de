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
package pulse.rx;

import org.junit.Test;
import pulse.fn.tuple.Tuple;
import pulse.fn.tuple.Tuple2;
import pulse.rx.scheduler.CooperativeScheduler;
import pulse.rx.scheduler.Schedulers;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ObservablesTests {

	@Test
	public void ofEmitsEachValueThenCompletes() {
		TestObserver<String> ts = new TestObserver<>();

		Observables.of("a", null, "c").subscribe(ts);

		ts.assertValues("a", null, "c").assertCompleted();
	}

	@Test
	public void emptyNeverAndError() {
		TestObserver<Integer> empty = new TestObserver<>();
		TestObserver<Integer> never = new TestObserver<>();
		TestObserver<Integer> error = new TestObserver<>();

		Observables.<Integer>empty().subscribe(empty);
		Observables.<Integer>never().subscribe(never);
		Observables.<Integer>error("failed").subscribe(error);

		empty.assertNoValues().assertCompleted();
		never.assertNoValues().assertNotTerminated();
		error.assertNoValues().assertErrorMessage("failed");
	}

	@Test
	public void rangeIsInclusive() {
		TestObserver<Integer> oneBased = new TestObserver<>();
		TestObserver<Integer> bounded = new TestObserver<>();
		TestObserver<Integer> descending = new TestObserver<>();
		TestObserver<Integer> none = new TestObserver<>();

		Observables.fromRange(3).subscribe(oneBased);
		Observables.fromRange(2, 4).subscribe(bounded);
		Observables.fromRange(5, 1, -2).subscribe(descending);
		Observables.fromRange(1, 0).subscribe(none);

		oneBased.assertValues(1, 2, 3).assertCompleted();
		bounded.assertValues(2, 3, 4).assertCompleted();
		descending.assertValues(5, 3, 1).assertCompleted();
		none.assertNoValues().assertCompleted();
	}

	@Test
	public void rangeStopsAtTheLargestInteger() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.fromRange(Integer.MAX_VALUE - 1, Integer.MAX_VALUE).subscribe(ts);

		ts.assertValues(Integer.MAX_VALUE - 1, Integer.MAX_VALUE).assertCompleted();
	}

	@Test(expected = IllegalArgumentException.class)
	public void rangeRejectsZeroStep() {
		Observables.fromRange(1, 10, 0);
	}

	@Test
	public void fromIterableAndMaps() {
		Map<String, Integer> map = new LinkedHashMap<>();
		map.put("one", 1);
		map.put("two", 2);
		TestObserver<Integer> values = new TestObserver<>();
		TestObserver<Tuple2<Integer, String>> entries = new TestObserver<>();
		TestObserver<String> list = new TestObserver<>();

		Observables.fromMap(map).subscribe(values);
		Observables.fromMap(map, true).subscribe(entries);
		Observables.fromIterable(Arrays.asList("x", "y")).subscribe(list);

		values.assertValues(1, 2).assertCompleted();
		entries.assertValues(Tuple.of(1, "one"), Tuple.of(2, "two")).assertCompleted();
		list.assertValues("x", "y").assertCompleted();
	}

	@Test
	public void fromIterableWithCustomTraversal() {
		TestObserver<Character> ts = new TestObserver<>();

		Observables.<String, Character>fromIterable("abc", s -> Arrays.asList(s.charAt(2), s.charAt(0)).iterator())
		           .subscribe(ts);

		ts.assertValues('c', 'a').assertCompleted();
	}

	@Test
	public void infiniteReplicateStopsWhenTheObserverStops() {
		TestObserver<String> bounded = new TestObserver<>();
		TestObserver<String> unbounded = new TestObserver<>();

		Observables.replicate("x", 2).subscribe(bounded);
		Observables.replicate("y").take(3).subscribe(unbounded);

		bounded.assertValues("x", "x").assertCompleted();
		unbounded.assertValues("y", "y", "y").assertCompleted();
	}

	@Test
	public void createEnforcesTheSignalGrammar() {
		TestObserver<Integer> ts = new TestObserver<>();
		AtomicBoolean released = new AtomicBoolean();

		Observables.<Integer>create(o -> {
			o.onNext(1);
			o.onCompleted();
			o.onNext(2);
			o.onError(new IllegalStateException("late"));
			return Subscription.create(() -> released.set(true));
		}).subscribe(ts);

		ts.assertValues(1).assertCompleted();
		assertThat(released.get(), is(true));
	}

	@Test
	public void unsubscribingReleasesTheProducerResources() {
		TestObserver<Integer> ts = new TestObserver<>();
		AtomicBoolean released = new AtomicBoolean();

		Subscription s = Observables.<Integer>create(o -> {
			o.onNext(1);
			return Subscription.create(() -> released.set(true));
		}).subscribe(ts);

		assertThat(released.get(), is(false));
		s.unsubscribe();
		assertThat(released.get(), is(true));
		ts.assertValues(1).assertNotTerminated();
	}

	@Test
	public void failingProducerSignalsAnError() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.<Integer>create(o -> {
			o.onNext(1);
			throw new IllegalStateException("producer failed");
		}).subscribe(ts);

		ts.assertValues(1).assertErrorMessage("producer failed");
	}

	@Test
	public void deferCallsTheFactoryForEachSubscription() {
		AtomicInteger calls = new AtomicInteger();
		Observable<Integer> deferred = Observables.defer(() -> Observables.of(calls.incrementAndGet()));
		TestObserver<Integer> first = new TestObserver<>();
		TestObserver<Integer> second = new TestObserver<>();

		deferred.subscribe(first);
		deferred.subscribe(second);

		first.assertValues(1).assertCompleted();
		second.assertValues(2).assertCompleted();
	}

	@Test
	public void deferFailsOnNullSource() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.<Integer>defer(() -> null).subscribe(ts);

		ts.assertError(IllegalStateException.class);
	}

	@Test
	public void generatorOnImmediateSchedulerRunsToCompletion() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.fromGenerator(Arrays.asList(1, 2, 3).iterator(), Schedulers.immediate()).subscribe(ts);

		ts.assertValues(1, 2, 3).assertCompleted();
	}

	@Test
	public void generatorProducesOneValuePerTick() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		List<Integer> source = Arrays.asList(1, 2);
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.fromGenerator(source::iterator, scheduler).subscribe(ts);
		ts.assertNoValues();

		scheduler.update(0);
		ts.assertValues(1);
		scheduler.update(0);
		ts.assertValues(1, 2).assertNotTerminated();
		scheduler.update(0);
		ts.assertCompleted();
		assertThat(scheduler.isEmpty(), is(true));
	}

	@Test
	public void failingGeneratorSignalsAnError() {
		TestObserver<Integer> ts = new TestObserver<>();
		Iterator<Integer> broken = new Iterator<Integer>() {
			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public Integer next() {
				throw new IllegalStateException("exhausted");
			}
		};

		Observables.fromGenerator(broken, Schedulers.immediate()).subscribe(ts);

		ts.assertNoValues().assertErrorMessage("exhausted");
	}

	@Test
	public void unsubscribedGeneratorIsRemovedFromTheScheduler() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		TestObserver<Integer> ts = new TestObserver<>();

		Subscription s = Observables.fromGenerator(Arrays.asList(1, 2, 3).iterator(), scheduler).subscribe(ts);
		scheduler.update(0);
		s.unsubscribe();
		scheduler.update(0);

		ts.assertValues(1).assertNotTerminated();
		assertThat(scheduler.isEmpty(), is(true));
	}

	@Test
	public void chainsCanBeSubscribedSeveralTimes() {
		Observable<Integer> doubled = Observables.fromRange(3).map(v -> v * 2);
		TestObserver<Integer> first = new TestObserver<>();
		TestObserver<Integer> second = new TestObserver<>();

		doubled.subscribe(first);
		doubled.subscribe(second);

		first.assertValues(2, 4, 6).assertCompleted();
		second.assertValues(2, 4, 6).assertCompleted();
	}

}
