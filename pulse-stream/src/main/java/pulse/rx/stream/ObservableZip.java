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
import pulse.fn.Function;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

import java.util.LinkedList;
import java.util.List;

/**
 * Combine the n-th values of every source. Values are queued per source until every source has one available.
 * <p>
 * The sequence completes once every source has completed, or as soon as a completed source has no value left in
 * its queue, since no further combination can be produced from it.
 *
 * @since 1.0
 */
public final class ObservableZip<R> extends Observable<R> {

	private final StreamSource<?>[]                 sources;
	private final Function<Object[], ? extends R> combinator;

	public ObservableZip(List<? extends StreamSource<?>> sources, Function<Object[], ? extends R> combinator) {
		Assert.notNull(sources, "sources");
		this.sources = sources.toArray(new StreamSource<?>[sources.size()]);
		for (StreamSource<?> source : this.sources) {
			Assert.notNull(source, "Sources cannot be null");
		}
		this.combinator = Assert.notNull(combinator, "combinator");
	}

	@Override
	public Subscription subscribe(Observer<? super R> observer) {
		Assert.notNull(observer, "observer");
		ZipBarrier<R> barrier = new ZipBarrier<R>(observer, sources.length, combinator);
		barrier.start(sources);
		return barrier;
	}

	static final class ZipBarrier<R> extends ObserverBarrier<Object, R> {

		private final Function<Object[], ? extends R> combinator;
		private final LinkedList<Object>[]            queues;
		private final boolean[]                       completed;

		private int active;

		@SuppressWarnings("unchecked")
		ZipBarrier(Observer<? super R> subscriber, int n, Function<Object[], ? extends R> combinator) {
			super(subscriber);
			this.combinator = combinator;
			this.queues = new LinkedList[n];
			for (int i = 0; i < n; i++) {
				queues[i] = new LinkedList<Object>();
			}
			this.completed = new boolean[n];
			this.active = n;
		}

		void start(StreamSource<?>[] sources) {
			if (sources.length == 0) {
				onCompleted();
				return;
			}
			for (int i = 0; i < sources.length && !isStopped(); i++) {
				own(sources[i].subscribe(new ZipObserver(i)));
			}
		}

		void drain() {
			for (LinkedList<Object> queue : queues) {
				if (queue.isEmpty()) {
					return;
				}
			}
			Object[] payload = new Object[queues.length];
			for (int i = 0; i < queues.length; i++) {
				payload[i] = queues[i].removeFirst();
			}
			emitNext(combinator.apply(payload));
			for (int i = 0; i < queues.length; i++) {
				if (completed[i] && queues[i].isEmpty()) {
					emitComplete();
					return;
				}
			}
		}

		final class ZipObserver implements Observer<Object> {

			private final int index;

			ZipObserver(int index) {
				this.index = index;
			}

			@Override
			public void onNext(Object value) {
				if (isStopped()) {
					return;
				}
				queues[index].addLast(value);
				try {
					drain();
				} catch (Throwable t) {
					fail(t);
				}
			}

			@Override
			public void onError(Throwable error) {
				ZipBarrier.this.onError(error);
			}

			@Override
			public void onCompleted() {
				if (completed[index]) {
					return;
				}
				completed[index] = true;
				active--;
				if (active == 0 || queues[index].isEmpty()) {
					ZipBarrier.this.onCompleted();
				}
			}

			@Override
			public boolean isStopped() {
				return ZipBarrier.this.isStopped();
			}
		}
	}
}
