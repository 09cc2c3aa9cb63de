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

import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.RingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulse.core.support.Assert;
import pulse.core.support.NamedDaemonThreadFactory;
import pulse.fn.Consumer;
import pulse.fn.Pausable;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hash Wheel Timer, as per the paper:
 * <p>
 * Hashed and hierarchical timing wheels:
 * http://www.cs.columbia.edu/~nahum/w6998/papers/ton97-timing-wheels.pdf
 * <p>
 * Hash Wheel timer is an approximated timer that allows performant execution of
 * larger amount of tasks with better performance compared to traditional scheduling.
 * <p>
 * The wheel is a {@link RingBuffer} of registration sets. A worker thread advances the cursor once per
 * resolution tick; registrations due on the visited slot are handed to a single-threaded executor, the others
 * count down one round.
 */
public class HashWheelTimer implements Timer {

	public static final  int    DEFAULT_WHEEL_SIZE = 512;
	public static final  int    DEFAULT_RESOLUTION = 10;
	private static final String DEFAULT_TIMER_NAME = "hash-wheel-timer";

	private static final Logger log = LoggerFactory.getLogger(HashWheelTimer.class);

	private final RingBuffer<Set<TimerPausable>> wheel;
	private final int                            resolution;
	private final Thread                         loop;
	private final Executor                       executor;
	private final WaitStrategy                   waitStrategy;
	private final AtomicBoolean                  started   = new AtomicBoolean();
	private final AtomicBoolean                  cancelled = new AtomicBoolean();

	/**
	 * Create a new {@code HashWheelTimer} with the default resolution and wheel size.
	 */
	public HashWheelTimer() {
		this(DEFAULT_RESOLUTION, DEFAULT_WHEEL_SIZE, new SleepWait());
	}

	/**
	 * Create a new {@code HashWheelTimer} using the given timer resolution. All times will rounded up to the closest
	 * multiple of this resolution.
	 *
	 * @param resolution the resolution of this timer, in milliseconds
	 */
	public HashWheelTimer(int resolution) {
		this(resolution, DEFAULT_WHEEL_SIZE, new SleepWait());
	}

	/**
	 * Create a new {@code HashWheelTimer} using the given timer {@code res} and {@code wheelSize}. All times will
	 * rounded up to the closest multiple of this resolution.
	 *
	 * @param res          resolution of this timer in milliseconds
	 * @param wheelSize    size of the Ring Buffer supporting the Timer, the larger the wheel, the less the lookup time
	 *                     is for sparse timeouts. Must be a power of 2.
	 * @param waitStrategy strategy for waiting for the next tick
	 */
	public HashWheelTimer(int res, int wheelSize, WaitStrategy waitStrategy) {
		this(DEFAULT_TIMER_NAME, res, wheelSize, waitStrategy, null);
	}

	/**
	 * Create a new {@code HashWheelTimer} using the given timer {@code res} and {@code wheelSize}. All times
	 * will rounded up to the closest multiple of this resolution.
	 *
	 * @param name      name for daemon thread factory to be displayed
	 * @param res       resolution of this timer in milliseconds
	 * @param wheelSize size of the Ring Buffer supporting the Timer. Must be a power of 2.
	 * @param strategy  strategy for waiting for the next tick
	 * @param exec      Executor instance to submit tasks to, or {@code null} for a dedicated thread
	 */
	public HashWheelTimer(String name, int res, int wheelSize, WaitStrategy strategy, Executor exec) {
		Assert.isTrue(res > 0, "Timer resolution must be positive");
		Assert.isTrue(Integer.bitCount(wheelSize) == 1, "Wheel size must be a power of 2");
		this.waitStrategy = Assert.notNull(strategy, "Wait strategy cannot be null");

		this.wheel = RingBuffer.createSingleProducer(new EventFactory<Set<TimerPausable>>() {
			@Override
			public Set<TimerPausable> newInstance() {
				return ConcurrentHashMap.newKeySet();
			}
		}, wheelSize);

		if (exec == null) {
			this.executor = Executors.newSingleThreadExecutor(new NamedDaemonThreadFactory(name + "-run"));
		} else {
			this.executor = exec;
		}

		this.resolution = res;
		this.loop = new NamedDaemonThreadFactory(name).newThread(new Runnable() {
			@Override
			public void run() {
				long deadline = System.currentTimeMillis();

				while (!Thread.currentThread().isInterrupted()) {
					Set<TimerPausable> registrations = wheel.get(wheel.getCursor());

					for (TimerPausable r : registrations) {
						if (r.isCancelled()) {
							registrations.remove(r);
						} else if (r.ready()) {
							registrations.remove(r);
							executor.execute(r);

							if (!r.isCancelAfterUse()) {
								reschedule(r);
							}
						} else if (r.isPaused()) {
							registrations.remove(r);
							reschedule(r);
						} else {
							r.decrement();
						}
					}

					deadline += resolution;

					try {
						waitStrategy.waitUntil(deadline);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						return;
					}

					wheel.publish(wheel.next());
				}
			}
		});

		this.start();
	}

	@Override
	public long getResolution() {
		return resolution;
	}

	@Override
	public Pausable schedule(Consumer<Long> consumer,
	                         long period,
	                         TimeUnit timeUnit,
	                         long delayInMilliseconds) {
		Assert.state(!cancelled.get(), "Cannot submit tasks to this timer as it has been cancelled.");
		long ms = TimeUnit.MILLISECONDS.convert(period, timeUnit);
		checkResolution(ms, resolution);
		return schedule(ms, delayInMilliseconds, consumer);
	}

	@Override
	public Pausable schedule(Consumer<Long> consumer,
	                         long period,
	                         TimeUnit timeUnit) {
		return schedule(consumer, period, timeUnit, 0);
	}

	@Override
	public Pausable submit(Consumer<Long> consumer,
	                       long delay,
	                       TimeUnit timeUnit) {
		Assert.state(!cancelled.get(), "Cannot submit tasks to this timer as it has been cancelled.");
		long ms = TimeUnit.MILLISECONDS.convert(delay, timeUnit);
		return schedule(0, ms, consumer).cancelAfterUse();
	}

	@Override
	public Pausable submit(Consumer<Long> consumer) {
		return submit(consumer, resolution, TimeUnit.MILLISECONDS);
	}

	private TimerPausable schedule(long recurringTimeout,
	                               long firstDelay,
	                               Consumer<Long> consumer) {
		Assert.notNull(consumer, "Consumer cannot be null");
		Assert.isTrue(firstDelay >= 0, "Delay cannot be negative");

		long offset = ticks(recurringTimeout);
		long firstFireOffset = ticks(firstDelay);

		TimerPausable r = new TimerPausable(rounds(firstFireOffset), offset, consumer, rounds(offset));
		wheel.get(wheel.getCursor() + firstFireOffset).add(r);
		return r;
	}

	// A slot is first visited within wheel-size ticks, then once per full turn.
	private long ticks(long millis) {
		return Math.max(1L, (millis + resolution - 1) / resolution);
	}

	private long rounds(long ticks) {
		return (ticks - 1) / wheel.getBufferSize();
	}

	/**
	 * Reschedule a {@link TimerPausable} for the next fire
	 *
	 * @param registration the registration to place back on the wheel
	 */
	private void reschedule(TimerPausable registration) {
		registration.rounds.set(registration.rescheduleRounds);
		wheel.get(wheel.getCursor() + registration.getOffset()).add(registration);
	}

	/**
	 * Start the Timer
	 */
	@Override
	public void start() {
		if (started.compareAndSet(false, true)) {
			wheel.publish(wheel.next());
			this.loop.start();
			log.debug("Started {}", this);
		}
	}

	/**
	 * Cancel current Timer
	 */
	@Override
	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			this.loop.interrupt();
			if (executor instanceof ExecutorService) {
				((ExecutorService) executor).shutdown();
			}
			log.debug("Cancelled {}", this);
		}
	}

	@Override
	public boolean isCancelled() {
		return cancelled.get();
	}

	@Override
	public String toString() {
		return String.format("HashWheelTimer { Buffer Size: %d, Resolution: %d }",
		  wheel.getBufferSize(),
		  resolution);
	}

	static void checkResolution(long time, long resolution) {
		if (time <= 0 || time % resolution != 0) {
			throw new IllegalArgumentException(
			  "Period must be a positive multiple of Timer resolution (e.g. period % resolution == 0 ). " +
				"Resolution for this Timer is: " + resolution + "ms");
		}
	}

	/**
	 * Resolve a named wait strategy: {@code sleep}, {@code yield} or {@code busySpin}.
	 *
	 * @param name the strategy name
	 * @return a new strategy instance
	 */
	public static WaitStrategy waitStrategy(String name) {
		if ("sleep".equals(name)) {
			return new SleepWait();
		} else if ("yield".equals(name)) {
			return new YieldingWait();
		} else if ("busySpin".equals(name)) {
			return new BusySpinWait();
		}
		throw new IllegalArgumentException("Unknown timer wait strategy '" + name + "'");
	}

	/**
	 * Wait strategy for the timer
	 */
	public interface WaitStrategy {

		/**
		 * Wait until the given deadline
		 *
		 * @param deadlineMilliseconds deadline to wait for, in milliseconds
		 * @throws InterruptedException if the timer thread is interrupted
		 */
		void waitUntil(long deadlineMilliseconds) throws InterruptedException;
	}

	/**
	 * Timer Registration
	 */
	static final class TimerPausable implements Runnable, Pausable {

		static final int STATUS_PAUSED    = 1;
		static final int STATUS_CANCELLED = -1;
		static final int STATUS_READY     = 0;

		private final Consumer<Long> delegate;
		private final long           rescheduleRounds;
		private final long           scheduleOffset;
		private final AtomicLong     rounds;
		private final AtomicInteger  status;
		private final AtomicBoolean  cancelAfterUse;

		/**
		 * @param rounds           amount of full wheel turns the registration waits before its first run
		 * @param offset           distance in slots between two runs of a periodic registration
		 * @param delegate         delegate that will be ran whenever the timer is elapsed
		 * @param rescheduleRounds full wheel turns between two runs of a periodic registration
		 */
		TimerPausable(long rounds, long offset, Consumer<Long> delegate, long rescheduleRounds) {
			this.rescheduleRounds = rescheduleRounds;
			this.scheduleOffset = offset;
			this.delegate = delegate;
			this.rounds = new AtomicLong(rounds);
			this.status = new AtomicInteger(STATUS_READY);
			this.cancelAfterUse = new AtomicBoolean(false);
		}

		void decrement() {
			rounds.decrementAndGet();
		}

		boolean ready() {
			return status.get() == STATUS_READY && rounds.get() <= 0;
		}

		@Override
		public void run() {
			if (isCancelled()) {
				return;
			}
			try {
				delegate.accept(System.currentTimeMillis());
			} catch (Throwable t) {
				log.error("Timer task " + delegate + " failed", t);
			}
		}

		@Override
		public TimerPausable cancel() {
			this.status.set(STATUS_CANCELLED);
			return this;
		}

		@Override
		public boolean isCancelled() {
			return status.get() == STATUS_CANCELLED;
		}

		@Override
		public TimerPausable pause() {
			this.status.compareAndSet(STATUS_READY, STATUS_PAUSED);
			return this;
		}

		boolean isPaused() {
			return this.status.get() == STATUS_PAUSED;
		}

		@Override
		public TimerPausable resume() {
			if (this.status.compareAndSet(STATUS_PAUSED, STATUS_READY)) {
				this.rounds.set(rescheduleRounds);
			}
			return this;
		}

		TimerPausable cancelAfterUse() {
			cancelAfterUse.set(true);
			return this;
		}

		boolean isCancelAfterUse() {
			return this.cancelAfterUse.get();
		}

		long getOffset() {
			return scheduleOffset;
		}

		@Override
		public String toString() {
			return String.format("HashWheelTimer { Rounds left: %d, Status: %d }", rounds.get(), status.get());
		}
	}

	/**
	 * Yielding wait strategy.
	 * <p>
	 * Spins in the loop, until the deadline is reached. Releases the flow control
	 * by means of Thread.yield() call. This strategy is less precise than BusySpin
	 * one, but is more scheduler-friendly.
	 */
	public static class YieldingWait implements WaitStrategy {

		@Override
		public void waitUntil(long deadlineMilliseconds) throws InterruptedException {
			while (deadlineMilliseconds >= System.currentTimeMillis()) {
				Thread.yield();
				if (Thread.currentThread().isInterrupted()) {
					throw new InterruptedException();
				}
			}
		}
	}

	/**
	 * BusySpin wait strategy.
	 * <p>
	 * Spins in the loop until the deadline is reached. In a multi-core environment,
	 * will occupy an entire core.
	 */
	public static class BusySpinWait implements WaitStrategy {

		@Override
		public void waitUntil(long deadlineMilliseconds) throws InterruptedException {
			while (deadlineMilliseconds >= System.currentTimeMillis()) {
				if (Thread.currentThread().isInterrupted()) {
					throw new InterruptedException();
				}
			}
		}
	}

	/**
	 * Sleep wait strategy.
	 * <p>
	 * Will release the flow control, giving other threads a possibility of execution
	 * on the same processor. Uses less resources than BusySpin wait, but is less
	 * precise.
	 */
	public static class SleepWait implements WaitStrategy {

		@Override
		public void waitUntil(long deadlineMilliseconds) throws InterruptedException {
			long sleepTimeMs = deadlineMilliseconds - System.currentTimeMillis();
			if (sleepTimeMs > 0) {
				Thread.sleep(sleepTimeMs);
			}
		}
	}

}
