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
import static org.junit.Assert.assertThat;

public class AsyncSubjectTests {

	@Test
	public void emitsOnlyTheLastValueOnCompletion() {
		AsyncSubject<Integer> subject = AsyncSubject.create();
		TestObserver<Integer> ts = new TestObserver<>();
		subject.subscribe(ts);

		subject.onNext(1);
		subject.onNext(2);
		ts.assertNoValues();

		subject.onCompleted();
		ts.assertValues(2).assertCompleted();
		assertThat(subject.getValue(), is(2));
	}

	@Test
	public void lateObserverReceivesTheLastValue() {
		AsyncSubject<String> subject = AsyncSubject.create();
		subject.onNext("x");
		subject.onCompleted();

		TestObserver<String> ts = new TestObserver<>();
		subject.subscribe(ts);

		ts.assertValues("x").assertCompleted();
	}

	@Test
	public void completesEmptyWithoutValue() {
		AsyncSubject<String> subject = AsyncSubject.create();
		TestObserver<String> ts = new TestObserver<>();
		subject.subscribe(ts);

		subject.onCompleted();

		ts.assertNoValues().assertCompleted();
		assertThat(subject.hasValue(), is(false));
	}

	@Test
	public void errorDiscardsTheValue() {
		AsyncSubject<String> subject = AsyncSubject.create();
		TestObserver<String> early = new TestObserver<>();
		subject.subscribe(early);
		subject.onNext("x");
		subject.onError(new IllegalStateException("failed"));

		TestObserver<String> late = new TestObserver<>();
		subject.subscribe(late);

		early.assertNoValues().assertErrorMessage("failed");
		late.assertNoValues().assertErrorMessage("failed");
	}

}
