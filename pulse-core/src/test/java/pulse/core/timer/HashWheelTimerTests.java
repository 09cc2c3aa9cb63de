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
package pulse.core.timer;

import org.junit.After;
import org.junit.Test;
import pulse.core.config.PropertiesConfigurationReader;
import pulse.fn.Consumer;
import pulse.fn.Pausable;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class HashWheelTimerTests {

	private static int tolerance      = 20;
	private static int wheelPrecision = 10;
	private static int wheelSize      = 8;

	private HashWheelTimer timer;

	@After
	public void cleanup() {
		if (timer != null) {
			timer.cancel();
		}
		Timers.unregisterGlobal();
	}

	@Test
	public void submitForSingleExecution() throws InterruptedException {
		int delay = 500;
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final CountDownLatch latch = new CountDownLatch(1);
		final long start = System.currentTimeMillis();
		final long[] elapsed = {0};

		timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				elapsed[0] = System.currentTimeMillis() - start;
				latch.countDown();
			}
		}, delay, TimeUnit.MILLISECONDS);

		assertTrue(latch.await(1500, TimeUnit.MILLISECONDS));
		assertThat(elapsed[0], greaterThanOrEqualTo((long) delay - wheelPrecision));
		assertThat(elapsed[0], lessThan((long) delay * 2));
	}

	@Test
	public void submitLongerThanOneTurnOfTheWheel() throws InterruptedException {
		// 8 slots of 10ms: a 250ms delay needs three turns
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final CountDownLatch latch = new CountDownLatch(1);
		final long start = System.currentTimeMillis();
		final long[] elapsed = {0};

		timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				elapsed[0] = System.currentTimeMillis() - start;
				latch.countDown();
			}
		}, 250, TimeUnit.MILLISECONDS);

		assertTrue(latch.await(1000, TimeUnit.MILLISECONDS));
		assertThat(elapsed[0], greaterThanOrEqualTo(250L - wheelPrecision));
	}

	@Test
	public void cancelledSubmissionNeverRuns() throws InterruptedException {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final AtomicInteger count = new AtomicInteger(0);

		Pausable p = timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				count.incrementAndGet();
			}
		}, 100, TimeUnit.MILLISECONDS);
		p.cancel();

		Thread.sleep(300);
		assertThat(count.get(), is(0));
		assertTrue(p.isCancelled());
	}

	@Test
	public void scheduleRepeatsUntilCancelled() throws InterruptedException {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final CountDownLatch latch = new CountDownLatch(10);
		final AtomicInteger count = new AtomicInteger(0);

		Pausable p = timer.schedule(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				count.incrementAndGet();
				latch.countDown();
			}
		}, 20, TimeUnit.MILLISECONDS);

		assertTrue(latch.await(1000, TimeUnit.MILLISECONDS));
		p.cancel();
		Thread.sleep(tolerance * 3);
		int afterCancel = count.get();
		Thread.sleep(200);

		assertThat(count.get(), is(afterCancel));
	}

	@Test
	public void pausedTaskDoesNotRunUntilResumed() throws InterruptedException {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final AtomicInteger count = new AtomicInteger(0);

		Pausable p = timer.schedule(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				count.incrementAndGet();
			}
		}, 10, TimeUnit.MILLISECONDS);

		Thread.sleep(100);
		p.pause();
		Thread.sleep(tolerance * 3);
		int paused = count.get();
		Thread.sleep(200);
		assertThat(count.get(), is(paused));

		p.resume();
		Thread.sleep(200);
		assertTrue(count.get() > paused);
	}

	@Test
	public void failingTaskDoesNotStopTheTimer() throws InterruptedException {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		final CountDownLatch latch = new CountDownLatch(1);

		timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				throw new IllegalStateException("expected");
			}
		});
		timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
				latch.countDown();
			}
		}, 50, TimeUnit.MILLISECONDS);

		assertTrue(latch.await(1000, TimeUnit.MILLISECONDS));
	}

	@Test(expected = IllegalArgumentException.class)
	public void periodMustBeAMultipleOfResolution() {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		timer.schedule(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
			}
		}, 15, TimeUnit.MILLISECONDS);
	}

	@Test(expected = IllegalStateException.class)
	public void cancelledTimerRejectsSubmissions() {
		timer = new HashWheelTimer(wheelPrecision, wheelSize, new HashWheelTimer.SleepWait());
		timer.cancel();
		timer.submit(new Consumer<Long>() {
			@Override
			public void accept(Long now) {
			}
		});
	}

	@Test(expected = IllegalArgumentException.class)
	public void wheelSizeMustBeAPowerOfTwo() {
		timer = new HashWheelTimer(wheelPrecision, 10, new HashWheelTimer.SleepWait());
	}

	@Test
	public void globalTimerIsSharedUntilCancelled() {
		Timer global = Timers.global();
		assertThat(Timers.global(), is(sameInstance(global)));
		assertThat(global.getResolution(), is((long) new PropertiesConfigurationReader().read().getTimerResolution()));

		global.cancel();
		assertThat(Timers.available(), is(false));
		assertTrue(Timers.global() != global);
	}

}
