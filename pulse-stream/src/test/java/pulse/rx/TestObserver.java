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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

/**
 * Observer capturing every signal for assertion. Signals received after termination are recorded too, so that
 * tests can verify that nothing follows a terminal signal.
 */
public class TestObserver<T> implements Observer<T> {

	private final List<T>         values      = new CopyOnWriteArrayList<T>();
	private final List<Throwable> errors      = new CopyOnWriteArrayList<Throwable>();
	private final AtomicInteger   completions = new AtomicInteger();
	private final CountDownLatch  terminated  = new CountDownLatch(1);

	private volatile boolean stopped;

	@Override
	public void onNext(T value) {
		values.add(value);
	}

	@Override
	public void onError(Throwable error) {
		errors.add(error);
		stopped = true;
		terminated.countDown();
	}

	@Override
	public void onCompleted() {
		completions.incrementAndGet();
		stopped = true;
		terminated.countDown();
	}

	@Override
	public boolean isStopped() {
		return stopped;
	}

	/**
	 * Behave as an observer that no longer wants signals.
	 */
	public void stop() {
		stopped = true;
	}

	public List<T> values() {
		return new ArrayList<T>(values);
	}

	public List<Throwable> errors() {
		return new ArrayList<Throwable>(errors);
	}

	public int completions() {
		return completions.get();
	}

	public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
		return terminated.await(timeout, unit);
	}

	@SafeVarargs
	public final TestObserver<T> assertValues(T... expected) {
		assertEquals(Arrays.asList(expected), values());
		return this;
	}

	public TestObserver<T> assertNoValues() {
		assertTrue("Expected no value but received " + values, values.isEmpty());
		return this;
	}

	public TestObserver<T> assertCompleted() {
		assertEquals("Errors received: " + errors, 0, errors.size());
		assertEquals("Expected exactly one completion", 1, completions.get());
		return this;
	}

	public TestObserver<T> assertNotTerminated() {
		assertEquals("Errors received: " + errors, 0, errors.size());
		assertEquals("Completion received", 0, completions.get());
		return this;
	}

	public Throwable assertError(Class<? extends Throwable> type) {
		assertEquals("Expected exactly one error", 1, errors.size());
		assertEquals("Completion received", 0, completions.get());
		Throwable error = errors.get(0);
		assertThat(error, is(instanceOf(type)));
		return error;
	}

	public TestObserver<T> assertErrorMessage(String message) {
		assertEquals(message, assertError(Throwable.class).getMessage());
		return this;
	}

}
