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

import pulse.core.support.Assert;
import pulse.fn.BiFunction;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Emit the final accumulation on completion. A seeded reduction of an empty source emits the seed; an unseeded one
 * completes without value.
 *
 * @since 1.0
 */
public final class ObservableReduce<T, A> extends ObservableBarrier<T, A> {

	private final BiFunction<A, ? super T, A> accumulator;
	private final A                           seed;
	private final boolean                     seeded;

	public static <T> ObservableReduce<T, T> unseeded(StreamSource<? extends T> source,
	                                                   BiFunction<T, ? super T, T> accumulator) {
		return new ObservableReduce<T, T>(source, accumulator, null, false);
	}

	public ObservableReduce(StreamSource<? extends T> source, A seed, BiFunction<A, ? super T, A> accumulator) {
		this(source, accumulator, seed, true);
	}

	private ObservableReduce(StreamSource<? extends T> source, BiFunction<A, ? super T, A> accumulator, A seed,
	                         boolean seeded) {
		super(source);
		this.accumulator = Assert.notNull(accumulator, "Accumulator cannot be null");
		this.seed = seed;
		this.seeded = seeded;
	}

	@Override
	protected ObserverBarrier<T, A> apply(Observer<? super A> observer) {
		return new ReduceBarrier<T, A>(observer, accumulator, seed, seeded);
	}

	static final class ReduceBarrier<T, A> extends ObserverBarrier<T, A> {

		private final BiFunction<A, ? super T, A> accumulator;

		private A       acc;
		private boolean hasValue;

		ReduceBarrier(Observer<? super A> subscriber, BiFunction<A, ? super T, A> accumulator, A seed,
		              boolean seeded) {
			super(subscriber);
			this.accumulator = accumulator;
			this.acc = seed;
			this.hasValue = seeded;
		}

		@Override
		@SuppressWarnings("unchecked")
		protected void doNext(T value) {
			if (hasValue) {
				acc = accumulator.apply(acc, value);
			} else {
				acc = (A) value;
				hasValue = true;
			}
		}

		@Override
		protected void doComplete() {
			if (hasValue) {
				emitNext(acc);
			}
			emitComplete();
		}
	}
}
