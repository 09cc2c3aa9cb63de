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
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;
import pulse.rx.subscription.SerialSubscription;

import java.util.List;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * Subscribe to each source in turn, moving to the next one when the current one completes.
 *
 * @since 1.0
 */
public final class ObservableConcat<T> extends Observable<T> {

	private final StreamSource<? extends T>[] sources;

	@SuppressWarnings("unchecked")
	public ObservableConcat(List<? extends StreamSource<? extends T>> sources) {
		Assert.notNull(sources, "sources");
		this.sources = sources.toArray(new StreamSource[sources.size()]);
		for (StreamSource<? extends T> source : this.sources) {
			Assert.notNull(source, "Sources cannot be null");
		}
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		ConcatBarrier<T> barrier = new ConcatBarrier<T>(observer, sources);
		barrier.next();
		return barrier;
	}

	static final class ConcatBarrier<T> extends ObserverBarrier<T, T> {

		@SuppressWarnings("rawtypes")
		private static final AtomicIntegerFieldUpdater<ConcatBarrier> WIP =
				AtomicIntegerFieldUpdater.newUpdater(ConcatBarrier.class, "wip");

		private final StreamSource<? extends T>[] sources;
		private final SerialSubscription          current;

		private int index;

		private volatile int wip;

		ConcatBarrier(Observer<? super T> subscriber, StreamSource<? extends T>[] sources) {
			super(subscriber);
			this.sources = sources;
			this.current = own(new SerialSubscription());
		}

		void next() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			do {
				if (isStopped()) {
					return;
				}
				if (index == sources.length) {
					emitComplete();
					return;
				}
				current.set(sources[index++].subscribe(this));
			}
			while (WIP.decrementAndGet(this) != 0);
		}

		@Override
		protected void doComplete() {
			next();
		}
	}
}
