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
package pulse.rx.subject;

import org.junit.Test;
import pulse.rx.Subscription;
import pulse.rx.TestObserver;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class SubjectTests {

	@Test
	public void broadcastsToCurrentObservers() {
		Subject<String> subject = Subject.create();
		TestObserver<String> first = new TestObserver<>();
		TestObserver<String> second = new TestObserver<>();

		subject.onNext("lost");
		subject.subscribe(first);
		subject.onNext("a");
		subject.subscribe(second);
		subject.onNext("b");
		subject.onCompleted();

		first.assertValues("a", "b").assertCompleted();
		second.assertValues("b").assertCompleted();
		assertThat(subject.size(), is(0));
		assertThat(subject.isStopped(), is(true));
	}

	@Test
	public void mostRecentObserverIsNotifiedFirst() {
		Subject<Integer> subject = Subject.create();
		List<String> order = new ArrayList<>();
		subject.subscribe(v -> order.add("first"));
		subject.subscribe(v -> order.add("second"));

		subject.onNext(1);

		assertThat(order, contains("second", "first"));
	}

	@Test
	public void unsubscribeRemovesTheObserver() {
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		Subscription s = subject.subscribe(ts);

		subject.onNext(1);
		s.unsubscribe();
		subject.onNext(2);

		ts.assertValues(1).assertNotTerminated();
		assertThat(subject.size(), is(0));
	}

	@Test
	public void observerRemovedDuringBroadcastStillReceivesTheCurrentValue() {
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		Subscription s = subject.subscribe(ts);
		subject.subscribe(v -> s.unsubscribe());

		subject.onNext(1);
		subject.onNext(2);

		ts.assertValues(1);
	}

	@Test
	public void lateObserverReceivesTheTerminalSignal() {
		Subject<Integer> subject = Subject.create();
		subject.onError(new IllegalStateException("failed"));
		TestObserver<Integer> ts = new TestObserver<>();

		Subscription s = subject.subscribe(ts);

		ts.assertNoValues().assertErrorMessage("failed");
		s.unsubscribe();
	}

	@Test
	public void terminatesOnlyOnce() {
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		subject.subscribe(ts);

		subject.onCompleted();
		subject.onError(new IllegalStateException("late"));
		subject.onNext(3);
		subject.onCompleted();

		ts.assertNoValues().assertCompleted();
	}

	@Test
	public void canBeSubscribedToAnObservable() {
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		subject.map(v -> v * 10).subscribe(ts);

		pulse.rx.Observables.of(1, 2).subscribe(subject);

		ts.assertValues(10, 20).assertCompleted();
	}

}
