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
import pulse.rx.TestObserver;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;

public class BehaviorSubjectTests {

	@Test
	public void newObserverReceivesTheSeed() {
		BehaviorSubject<String> subject = BehaviorSubject.create("seed");
		TestObserver<String> ts = new TestObserver<>();

		subject.subscribe(ts);
		subject.onNext("next");

		ts.assertValues("seed", "next").assertNotTerminated();
	}

	@Test
	public void newObserverReceivesTheCurrentValue() {
		BehaviorSubject<Integer> subject = BehaviorSubject.create();
		subject.onNext(1);
		subject.onNext(2);
		TestObserver<Integer> ts = new TestObserver<>();

		subject.subscribe(ts);

		ts.assertValues(2);
		assertThat(subject.getValue(), is(2));
	}

	@Test
	public void unseededSubjectHasNoValue() {
		BehaviorSubject<Integer> subject = BehaviorSubject.create();
		TestObserver<Integer> ts = new TestObserver<>();

		subject.subscribe(ts);

		ts.assertNoValues();
		assertThat(subject.hasValue(), is(false));
		assertThat(subject.getValue(), is(nullValue()));
	}

	@Test
	public void terminatedSubjectOnlyReplaysTheTerminalSignal() {
		BehaviorSubject<Integer> subject = BehaviorSubject.create(1);
		subject.onCompleted();
		TestObserver<Integer> ts = new TestObserver<>();

		subject.subscribe(ts);

		ts.assertNoValues().assertCompleted();
	}

}
