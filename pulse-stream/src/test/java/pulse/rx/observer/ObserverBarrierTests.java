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
package pulse.rx.observer;

import org.junit.Test;
import pulse.rx.Subscription;
import pulse.rx.TestObserver;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ObserverBarrierTests {

	@Test
	public void signalsAfterTerminationAreIgnored() {
		TestObserver<Integer> ts = new TestObserver<>();
		ObserverBarrier<Integer, Integer> barrier = new ObserverBarrier<>(ts);

		barrier.onNext(1);
		barrier.onCompleted();
		barrier.onNext(2);
		barrier.onCompleted();
		barrier.onError(new IllegalStateException("late"));

		ts.assertValues(1).assertCompleted();
		assertThat(barrier.isTerminated(), is(true));
	}

	@Test
	public void terminationReleasesUpstreamAndOwnedResources() {
		TestObserver<Integer> ts = new TestObserver<>();
		ObserverBarrier<Integer, Integer> barrier = new ObserverBarrier<>(ts);
		Subscription upstream = Subscription.empty();
		barrier.setUpstream(upstream);

		barrier.onError(new IllegalStateException("boom"));

		assertThat(upstream.isUnsubscribed(), is(true));
		assertThat(barrier.isUnsubscribed(), is(true));
		ts.assertErrorMessage("boom");
	}

	@Test
	public void upstreamAttachedAfterUnsubscribeIsReleased() {
		ObserverBarrier<Integer, Integer> barrier = new ObserverBarrier<>(new TestObserver<Integer>());
		barrier.unsubscribe();

		Subscription upstream = Subscription.empty();
		barrier.setUpstream(upstream);

		assertThat(upstream.isUnsubscribed(), is(true));
		assertThat(barrier.isStopped(), is(true));
		assertThat(barrier.isTerminated(), is(false));
	}

	@Test
	public void failingHookBecomesAnError() {
		TestObserver<String> ts = new TestObserver<>();
		ObserverBarrier<Integer, String> barrier = new ObserverBarrier<Integer, String>(ts) {
			@Override
			protected void doNext(Integer value) {
				throw new IllegalArgumentException("rejected " + value);
			}
		};

		barrier.onNext(7);
		barrier.onNext(8);

		ts.assertNoValues().assertErrorMessage("rejected 7");
	}

	@Test
	public void unsubscribeRunsTheCancelHookOnce() {
		final int[] cancels = {0};
		ObserverBarrier<Integer, Integer> barrier = new ObserverBarrier<Integer, Integer>(new TestObserver<Integer>()) {
			@Override
			protected void doCancel() {
				cancels[0]++;
			}
		};

		barrier.unsubscribe();
		barrier.onCompleted();
		barrier.unsubscribe();

		assertThat(cancels[0], is(1));
	}

}
