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
import pulse.fn.tuple.Tuple2;
import pulse.rx.subject.Subject;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ObservableFilteringTests {

	@Test
	public void filterAndReject() {
		TestObserver<Integer> even = new TestObserver<>();
		TestObserver<Integer> odd = new TestObserver<>();

		Observables.fromRange(6).filter(v -> v % 2 == 0).subscribe(even);
		Observables.fromRange(6).reject(v -> v % 2 == 0).subscribe(odd);

		even.assertValues(2, 4, 6).assertCompleted();
		odd.assertValues(1, 3, 5).assertCompleted();
	}

	@Test
	public void compactDropsNullAndFalse() {
		TestObserver<Object> ts = new TestObserver<>();

		Observables.<Object>of(0, null, false, "", true).compact().subscribe(ts);

		ts.assertValues(0, "", true).assertCompleted();
	}

	@Test
	public void distinctValues() {
		TestObserver<Integer> distinct = new TestObserver<>();
		TestObserver<Integer> untilChanged = new TestObserver<>();

		Observables.of(1, 2, 1, 3, 2).distinct().subscribe(distinct);
		Observables.of(1, 1, 2, 2, 1).distinctUntilChanged().subscribe(untilChanged);

		distinct.assertValues(1, 2, 3).assertCompleted();
		untilChanged.assertValues(1, 2, 1).assertCompleted();
	}

	@Test
	public void distinctUntilChangedWithComparator() {
		TestObserver<String> ts = new TestObserver<>();

		Observables.of("a", "A", "b", "B", "a").distinctUntilChanged(String::equalsIgnoreCase).subscribe(ts);

		ts.assertValues("a", "b", "a").assertCompleted();
	}

	@Test
	public void firstFindAndLast() {
		TestObserver<Integer> first = new TestObserver<>();
		TestObserver<Integer> found = new TestObserver<>();
		TestObserver<Integer> last = new TestObserver<>();
		TestObserver<Integer> none = new TestObserver<>();

		Observables.of(4, 5, 6).first().subscribe(first);
		Observables.of(4, 5, 6).find(v -> v > 4).subscribe(found);
		Observables.of(4, 5, 6).last().subscribe(last);
		Observables.<Integer>empty().first().subscribe(none);

		first.assertValues(4).assertCompleted();
		found.assertValues(5).assertCompleted();
		last.assertValues(6).assertCompleted();
		none.assertNoValues().assertCompleted();
	}

	@Test
	public void firstStopsTheSource() {
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		subject.first().subscribe(ts);

		subject.onNext(1);

		ts.assertValues(1).assertCompleted();
		assertThat(subject.size(), is(0));
	}

	@Test
	public void elementAtIsZeroBased() {
		TestObserver<String> found = new TestObserver<>();
		TestObserver<String> missing = new TestObserver<>();

		Observables.of("a", "b", "c").elementAt(1).subscribe(found);
		Observables.of("a", "b", "c").elementAt(3).subscribe(missing);

		found.assertValues("b").assertCompleted();
		missing.assertNoValues().assertCompleted();
	}

	@Test
	public void takeAndSkip() {
		TestObserver<Integer> take = new TestObserver<>();
		TestObserver<Integer> skip = new TestObserver<>();
		TestObserver<Integer> takeLast = new TestObserver<>();
		TestObserver<Integer> skipLast = new TestObserver<>();

		Observables.fromRange(5).take(2).subscribe(take);
		Observables.fromRange(5).skip(2).subscribe(skip);
		Observables.fromRange(5).takeLast(2).subscribe(takeLast);
		Observables.fromRange(5).skipLast(2).subscribe(skipLast);

		take.assertValues(1, 2).assertCompleted();
		skip.assertValues(3, 4, 5).assertCompleted();
		takeLast.assertValues(4, 5).assertCompleted();
		skipLast.assertValues(1, 2, 3).assertCompleted();
	}

	@Test
	public void takeZeroCompletesWithoutSubscribing() {
		AtomicInteger subscriptions = new AtomicInteger();
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.<Integer>create(o -> {
			subscriptions.incrementAndGet();
			o.onNext(1);
			return null;
		}).take(0).subscribe(ts);

		ts.assertNoValues().assertCompleted();
		assertThat(subscriptions.get(), is(0));
	}

	@Test
	public void takeWhileAndSkipWhile() {
		TestObserver<Integer> takeWhile = new TestObserver<>();
		TestObserver<Integer> skipWhile = new TestObserver<>();

		Observables.of(1, 2, 3, 1).takeWhile(v -> v < 3).subscribe(takeWhile);
		Observables.of(1, 2, 3, 1).skipWhile(v -> v < 3).subscribe(skipWhile);

		takeWhile.assertValues(1, 2).assertCompleted();
		skipWhile.assertValues(3, 1).assertCompleted();
	}

	@Test
	public void takeUntilCompletesWhenTheOtherSignals() {
		Subject<Integer> source = Subject.create();
		Subject<String> stop = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		source.takeUntil(stop).subscribe(ts);

		source.onNext(1);
		stop.onNext("stop");
		source.onNext(2);

		ts.assertValues(1).assertCompleted();
		assertThat(source.size(), is(0));
		assertThat(stop.size(), is(0));
	}

	@Test
	public void skipUntilForwardsOnceTheOtherSignals() {
		Subject<Integer> source = Subject.create();
		Subject<String> start = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		source.skipUntil(start).subscribe(ts);

		source.onNext(1);
		start.onNext("go");
		source.onNext(2);
		source.onCompleted();

		ts.assertValues(2).assertCompleted();
		assertThat(start.size(), is(0));
	}

	@Test
	public void partitionSplitsTheSequence() {
		TestObserver<Integer> small = new TestObserver<>();
		TestObserver<Integer> large = new TestObserver<>();

		Tuple2<Observable<Integer>, Observable<Integer>> parts = Observables.of(1, 5, 2, 6).partition(v -> v < 3);
		parts.getT1().subscribe(small);
		parts.getT2().subscribe(large);

		small.assertValues(1, 2).assertCompleted();
		large.assertValues(5, 6).assertCompleted();
	}

	@Test
	public void ignoreElementsKeepsTheTerminalSignal() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.of(1, 2).ignoreElements().subscribe(ts);

		ts.assertNoValues().assertCompleted();
	}

}
