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
package pulse.rx.scheduler;

import org.junit.Test;
import pulse.core.timer.Timer;
import pulse.fn.Consumer;
import pulse.fn.Pausable;
import pulse.rx.Subscription;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class TimeoutSchedulerTests {

	@Test
	public void runsActionAfterDelay() throws InterruptedException {
		TimeoutScheduler scheduler = Schedulers.timeout();
		CountDownLatch latch = new CountDownLatch(1);
		long start = System.currentTimeMillis();

		scheduler.schedule(latch::countDown, 50);

		assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
		assertThat(System.currentTimeMillis() - start >= 40, is(true));
	}

	@Test
	public void resumesSleepingTaskOnTheTimer() throws InterruptedException {
		TimeoutScheduler scheduler = new TimeoutScheduler(0);
		CountDownLatch latch = new CountDownLatch(3);

		scheduler.schedule(() -> {
			latch.countDown();
			return latch.getCount() == 0 ? TaskStep.finished() : TaskStep.sleep(10);
		}, 0);

		assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
	}

	@Test
	public void unscheduledActionDoesNotRun() throws InterruptedException {
		TimeoutScheduler scheduler = Schedulers.timeout();
		AtomicInteger runs = new AtomicInteger();
		CountDownLatch marker = new CountDownLatch(1);

		Subscription handle = scheduler.schedule(runs::incrementAndGet, 100);
		scheduler.unschedule(handle);
		scheduler.schedule(marker::countDown, 300);

		assertThat(marker.await(5, TimeUnit.SECONDS), is(true));
		assertThat(runs.get(), is(0));
	}

	@Test
	public void failingTaskDoesNotStopTheTimer() throws InterruptedException {
		TimeoutScheduler scheduler = Schedulers.timeout();
		CountDownLatch latch = new CountDownLatch(1);

		scheduler.schedule(() -> {
			throw new IllegalStateException("expected failure, logged");
		}, 0);
		scheduler.schedule(latch::countDown, 20);

		assertThat(latch.await(5, TimeUnit.SECONDS), is(true));
	}

	@Test
	public void keepsTheGivenDefaultDelay() {
		assertThat(Schedulers.timeout(25).getDefaultDelay(), is(25L));
	}

	@Test
	public void taskReturningNoStepEnds() {
		TimeoutScheduler scheduler = new TimeoutScheduler(new InlineTimer(), 0);

		Subscription handle = scheduler.schedule((Task) () -> null, 0);

		assertThat(handle.isUnsubscribed(), is(true));
	}

	@Test
	public void fatalErrorsEscapeTheTimerCallback() {
		TimeoutScheduler scheduler = new TimeoutScheduler(new InlineTimer(), 0);
		Task fatal = () -> {
			throw new NoClassDefFoundError("missing");
		};

		try {
			scheduler.schedule(fatal, 0);
			fail("a linkage error must not be swallowed");
		} catch (NoClassDefFoundError e) {
			assertThat(e.getMessage(), is("missing"));
		}
	}

	/**
	 * Runs every submission on the calling thread.
	 */
	static final class InlineTimer implements Timer {

		@Override
		public Pausable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit, long delayInMilliseconds) {
			throw new UnsupportedOperationException();
		}

		@Override
		public Pausable schedule(Consumer<Long> consumer, long period, TimeUnit timeUnit) {
			throw new UnsupportedOperationException();
		}

		@Override
		public Pausable submit(Consumer<Long> consumer, long delay, TimeUnit timeUnit) {
			consumer.accept(System.currentTimeMillis());
			return new Pausable() {
				@Override
				public Pausable cancel() {
					return this;
				}

				@Override
				public Pausable pause() {
					return this;
				}

				@Override
				public Pausable resume() {
					return this;
				}

				@Override
				public boolean isCancelled() {
					return false;
				}
			};
		}

		@Override
		public Pausable submit(Consumer<Long> consumer) {
			return submit(consumer, 0, TimeUnit.MILLISECONDS);
		}

		@Override
		public void start() {
		}

		@Override
		public void cancel() {
		}

		@Override
		public boolean isCancelled() {
			return false;
		}

		@Override
		public long getResolution() {
			return 1L;
		}
	}

}
