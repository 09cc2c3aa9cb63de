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
package pulse.rx.stream;

import com.lmax.disruptor.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A logging interceptor tracing the signals crossing it, and the subscribe/unsubscribe calls of each observer.
 *
 * @since 1.0
 */
public final class ObservableLog<T> extends ObservableBarrier<T, T> {

	public static final int SUBSCRIBE      = 0b0100000;
	public static final int ON_NEXT        = 0b0010000;
	public static final int ON_ERROR       = 0b0001000;
	public static final int ON_COMPLETED   = 0b0000100;
	public static final int UNSUBSCRIBE    = 0b0000010;
	public static final int NUMBER_ON_NEXT = 0b0000001;
	public static final int TERMINAL       = UNSUBSCRIBE | ON_COMPLETED | ON_ERROR;

	public static final int ALL = TERMINAL | ON_NEXT | SUBSCRIBE;

	private final Logger log;
	private final int    options;

	private final AtomicLong uniqueId = new AtomicLong();

	public ObservableLog(StreamSource<? extends T> source, String category, int options) {
		super(source);
		this.log = category != null && !category.isEmpty() ? LoggerFactory.getLogger(category) :
				LoggerFactory.getLogger(ObservableLog.class);
		this.options = options;
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		if ((options & SUBSCRIBE) == SUBSCRIBE && log.isInfoEnabled()) {
			log.info("subscribe: [{}] {}", uniqueId.get() + 1, observer.getClass().getSimpleName());
		}
		return super.subscribe(observer);
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new LogBarrier<T>(observer, log, options, uniqueId.incrementAndGet());
	}

	static final class LogBarrier<T> extends ObserverBarrier<T, T> {

		private final Logger   log;
		private final int      options;
		private final long     id;
		private final Sequence sequence;

		LogBarrier(Observer<? super T> subscriber, Logger log, int options, long id) {
			super(subscriber);
			this.log = log;
			this.options = options;
			this.id = id;
			this.sequence = (options & NUMBER_ON_NEXT) == NUMBER_ON_NEXT ? new Sequence(0L) : null;
		}

		private String position() {
			return sequence != null ? " [" + sequence.get() + "]" : "";
		}

		@Override
		protected void doNext(T value) {
			if (sequence != null) {
				sequence.incrementAndGet();
			}
			if ((options & ON_NEXT) == ON_NEXT && log.isInfoEnabled()) {
				log.info("[{}].onNext({}){}", id, value, position());
			}
			emitNext(value);
		}

		@Override
		protected void doError(Throwable error) {
			if ((options & ON_ERROR) == ON_ERROR && log.isErrorEnabled()) {
				log.error("[" + id + "].onError(" + error + ")" + position(), error);
			}
			emitError(error);
		}

		@Override
		protected void doComplete() {
			if ((options & ON_COMPLETED) == ON_COMPLETED && log.isInfoEnabled()) {
				log.info("[{}].onCompleted(){}", id, position());
			}
			emitComplete();
		}

		@Override
		protected void doCancel() {
			if (!isTerminated() && (options & UNSUBSCRIBE) == UNSUBSCRIBE && log.isInfoEnabled()) {
				log.info("[{}].unsubscribe(){}", id, position());
			}
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "{id=" + id + ", logger=" + log.getName() + "}";
		}
	}
}
