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
import pulse.rx.subject.Subject;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ObservableCombinationTests {

	@Test
	public void concatSubscribesInSequence() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.of(1, 2).concat(Observables.<Integer>empty(), Observables.of(3)).subscribe(ts);

		ts.assertValues(1, 2, 3).assertCompleted();
	}

	@Test
	public void concatWaitsForTheCurrentSource() {
		Subject<Integer> first = Subject.create();
		Subject<Integer> second = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		Observables.concat(first, second).subscribe(ts);

		second.onNext(0);
		first.onNext(1);
		assertThat(second.size(), is(0));
		first.onCompleted();
		second.onNext(2);
		second.onCompleted();

		ts.assertValues(1, 2).assertCompleted();
	}

	@Test
	public void concatOfManySynchronousSourcesDoesNotOverflow() {
		List<Observable<Integer>> sources = new ArrayList<>();
		for (int i = 0; i < 10000; i++) {
			sources.add(Observables.of(i));
		}
		TestObserver<Long> ts = new TestObserver<>();

		Observables.concat(sources).count().subscribe(ts);

		ts.assertValues(10000L).assertCompleted();
	}

	@Test
	public void concatStopsAtTheFirstError() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.concat(Observables.of(1), Observables.<Integer>error("failed"), Observables.of(2)).subscribe(ts);

		ts.assertValues(1).assertErrorMessage("failed");
	}

	@Test
	public void startWithPrependsValues() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.of(3).startWith(1, 2).subscribe(ts);

		ts.assertValues(1, 2, 3).assertCompleted();
	}

	@Test
	public void mergeInterleavesAndCompletesWhenAllComplete() {
		Subject<String> a = Subject.create();
		Subject<String> b = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		a.merge(b).subscribe(ts);

		a.onNext("a1");
		b.onNext("b1");
		a.onCompleted();
		b.onNext("b2");
		ts.assertValues("a1", "b1", "b2").assertNotTerminated();

		b.onCompleted();
		ts.assertCompleted();
	}

	@Test
	public void mergeFailsOnTheFirstError() {
		Subject<String> a = Subject.create();
		Subject<String> b = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		Observables.merge(a, b).subscribe(ts);

		a.onError(new IllegalStateException("failed"));
		b.onNext("ignored");

		ts.assertNoValues().assertErrorMessage("failed");
		assertThat(b.size(), is(0));
	}

	@Test
	public void ambMirrorsTheFirstSourceToSignal() {
		Subject<String> a = Subject.create();
		Subject<String> b = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		a.amb(b).subscribe(ts);

		b.onNext("b1");
		a.onNext("a1");
		b.onCompleted();

		ts.assertValues("b1").assertCompleted();
		assertThat(a.size(), is(0));
	}

	@Test
	public void ambWithSynchronousSourcePicksIt() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.amb(Observables.of(1, 2), Observables.of(3)).subscribe(ts);

		ts.assertValues(1, 2).assertCompleted();
	}

	@Test
	public void zipPairsValuesByIndex() {
		TestObserver<Tuple2<Integer, String>> pairs = new TestObserver<>();
		TestObserver<String> combined = new TestObserver<>();

		Observables.zip(Observables.of(1, 2, 3), Observables.of("a", "b")).subscribe(pairs);
		Observables.of(1, 2, 3).zip(Observables.of("a", "b"), (n, s) -> s + n).subscribe(combined);

		pairs.assertValues(Tuple.of(1, "a"), Tuple.of(2, "b")).assertCompleted();
		combined.assertValues("a1", "b2").assertCompleted();
	}

	@Test
	public void zipCompletesOnceASourceIsDrained() {
		Subject<Integer> a = Subject.create();
		Subject<Integer> b = Subject.create();
		TestObserver<Tuple> ts = new TestObserver<>();
		a.zip(b).subscribe(ts);

		a.onNext(1);
		a.onNext(2);
		a.onCompleted();
		b.onNext(10);
		ts.assertValues(Tuple.of(1, 10)).assertNotTerminated();

		b.onNext(20);
		ts.assertValues(Tuple.of(1, 10), Tuple.of(2, 20)).assertCompleted();
		assertThat(b.size(), is(0));
	}

	@Test
	public void zipCompletesWhenASourceCompletesWithAnEmptyQueue() {
		Subject<Integer> a = Subject.create();
		Subject<Integer> b = Subject.create();
		TestObserver<Tuple> ts = new TestObserver<>();
		a.zip(b).subscribe(ts);

		b.onNext(10);
		b.onNext(20);
		a.onNext(1);
		a.onCompleted();

		ts.assertValues(Tuple.of(1, 10)).assertCompleted();
	}

	@Test
	public void combineLatestWaitsForEverySource() {
		Subject<String> letters = Subject.create();
		Subject<Integer> numbers = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		letters.combineLatest(numbers, (l, n) -> l + n).subscribe(ts);

		letters.onNext("a");
		letters.onNext("b");
		numbers.onNext(1);
		letters.onNext("c");
		numbers.onNext(2);
		letters.onCompleted();
		ts.assertValues("b1", "c1", "c2").assertNotTerminated();

		numbers.onCompleted();
		ts.assertCompleted();
	}

	@Test
	public void combineLatestAsTuples() {
		Subject<String> a = Subject.create();
		Subject<String> b = Subject.create();
		TestObserver<Tuple> ts = new TestObserver<>();
		a.combineLatest(b).subscribe(ts);

		a.onNext("a1");
		b.onNext("b1");
		b.onNext("b2");

		ts.assertValues(Tuple.of("a1", "b1"), Tuple.of("a1", "b2"));
	}

	@Test
	public void withSamplesTheLatestSideValues() {
		Subject<String> main = Subject.create();
		Subject<Integer> side = Subject.create();
		TestObserver<Tuple> ts = new TestObserver<>();
		main.with(side).subscribe(ts);

		main.onNext("before");
		side.onNext(1);
		side.onNext(2);
		main.onNext("after");
		side.onCompleted();
		main.onNext("still");

		ts.assertValues(Tuple.of("before", null), Tuple.of("after", 2), Tuple.of("still", 2));
		ts.assertNotTerminated();
	}

	@Test
	public void withForwardsSideErrors() {
		Subject<String> main = Subject.create();
		Subject<Integer> side = Subject.create();
		TestObserver<Tuple> ts = new TestObserver<>();
		main.with(side).subscribe(ts);

		side.onError(new IllegalStateException("side failed"));

		ts.assertErrorMessage("side failed");
		assertThat(main.size(), is(0));
	}

	@Test
	public void flatMapMergesInnerSources() {
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.of(1, 2).flatMap(v -> Observables.of(v, v * 10)).subscribe(ts);

		ts.assertValues(1, 10, 2, 20).assertCompleted();
	}

	@Test
	public void flattenWaitsForInnerSources() {
		Subject<Observable<String>> outer = Subject.create();
		Subject<String> inner = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		outer.<String>flatten().subscribe(ts);

		outer.onNext(inner);
		outer.onNext(Observables.of("sync"));
		outer.onCompleted();
		inner.onNext("async");
		ts.assertValues("sync", "async").assertNotTerminated();

		inner.onCompleted();
		ts.assertCompleted();
	}

	@Test
	public void switchLatestDropsThePreviousInnerSource() {
		Subject<Observable<String>> outer = Subject.create();
		Subject<String> first = Subject.create();
		Subject<String> second = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		outer.<String>switchLatest().subscribe(ts);

		outer.onNext(first);
		first.onNext("1a");
		outer.onNext(second);
		first.onNext("1b");
		second.onNext("2a");
		second.onCompleted();
		ts.assertValues("1a", "2a").assertNotTerminated();
		assertThat(first.size(), is(0));

		outer.onCompleted();
		ts.assertCompleted();
	}

	@Test
	public void flatMapLatestMapsThenSwitches() {
		Subject<Integer> source = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		source.flatMapLatest(v -> Observables.replicate(v, v)).subscribe(ts);

		source.onNext(1);
		source.onNext(2);
		source.onCompleted();

		ts.assertValues(1, 2, 2).assertCompleted();
	}

}
