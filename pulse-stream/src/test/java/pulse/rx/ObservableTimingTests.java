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
import pulse.rx.scheduler.CooperativeScheduler;
import pulse.rx.scheduler.Schedulers;
import pulse.rx.subject.Subject;

import java.util.Arrays;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ObservableTimingTests {

	@Test
	public void debounceDeliversOnlyAfterSilence() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		Subject<Integer> subject = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		subject.debounce(10, scheduler).subscribe(ts);

		subject.onNext(1);
		scheduler.update(5);
		subject.onNext(2);
		scheduler.update(5);
		ts.assertNoValues();

		scheduler.update(5);
		ts.assertValues(2);

		subject.onNext(3);
		subject.onCompleted();
		scheduler.update(10);
		ts.assertValues(2, 3).assertCompleted();
		assertThat(scheduler.isEmpty(), is(true));
	}

	@Test
	public void delayShiftsEverySignal() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		Subject<String> subject = Subject.create();
		TestObserver<String> ts = new TestObserver<>();
		subject.delay(10, scheduler).subscribe(ts);

		subject.onNext("a");
		scheduler.update(5);
		subject.onNext("b");
		subject.onCompleted();
		scheduler.update(5);
		ts.assertValues("a").assertNotTerminated();

		scheduler.update(5);
		ts.assertValues("a", "b").assertCompleted();
	}

	@Test
	public void delayReadsTheDelayForEachSignal() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		Iterator<Long> delays = Arrays.asList(20L, 5L, 30L).iterator();
		TestObserver<Integer> ts = new TestObserver<>();

		Observables.of(1, 2).delay(delays::next, scheduler).subscribe(ts);
		scheduler.update(10);
		ts.assertValues(2);

		scheduler.update(10);
		ts.assertValues(2, 1).assertNotTerminated();

		scheduler.update(10);
		ts.assertCompleted();
	}

	@Test
	public void unsubscribingCancelsPendingSignals() {
		CooperativeScheduler scheduler = Schedulers.cooperative();
		TestObserver<Integer> ts = new TestObserver<>();

		Subscription s = Observables.of(1, 2).delay(10, scheduler).subscribe(ts);
		assertThat(scheduler.size(), is(3));

		s.unsubscribe();
		scheduler.update(10);

		ts.assertNoValues().assertNotTerminated();
		assertThat(scheduler.isEmpty(), is(true));
	}

	@Test
	public void sampleEmitsTheLatestValueOnEachTick() {
		Subject<Integer> source = Subject.create();
		Subject<String> sampler = Subject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		source.sample(sampler).subscribe(ts);

		sampler.onNext("tick");
		source.onNext(1);
		source.onNext(2);
		sampler.onNext("tick");
		sampler.onNext("tick");
		source.onCompleted();
		ts.assertValues(2, 2).assertNotTerminated();

		sampler.onCompleted();
		ts.assertCompleted();
	}

	@Test
	public void delayOnTheTimeoutScheduler() throws InterruptedException {
		TestObserver<Integer> ts = new TestObserver<>();

		AtomicLong delay = new AtomicLong();

		Observables.of(1, 2).delay(() -> delay.addAndGet(30), Schedulers.timeout()).subscribe(ts);

		assertThat(ts.await(5, TimeUnit.SECONDS), is(true));
		ts.assertValues(1, 2).assertCompleted();
	}

}
