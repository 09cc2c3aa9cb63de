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

import java.util.List;

/**
 * Once every source has produced a value, combine the latest value of each source whenever any of them emits.
 * The sequence completes when all sources have completed.
 *
 * @since 1.0
 */
public final class ObservableCombineLatest<R> extends Observable<R> {

	private final StreamSource<?>[]               sources;
	private final Function<Object[], ? extends R> combinator;

	public ObservableCombineLatest(List<? extends StreamSource<?>> sources,
	                               Function<Object[], ? extends R> combinator) {
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
		CombineLatestBarrier<R> barrier = new CombineLatestBarrier<R>(observer, sources.length, combinator);
		barrier.start(sources);
		return barrier;
	}

	static final class CombineLatestBarrier<R> extends ObserverBarrier<Object, R> {

		private final Function<Object[], ? extends R> combinator;
		private final Object[]                        latest;
		private final boolean[]                       present;

		private int missing;
		private int active;

		CombineLatestBarrier(Observer<? super R> subscriber, int n, Function<Object[], ? extends R> combinator) {
			super(subscriber);
			this.combinator = combinator;
			this.latest = new Object[n];
			this.present = new boolean[n];
			this.missing = n;
			this.active = n;
		}

		void start(StreamSource<?>[] sources) {
			if (sources.length == 0) {
				onCompleted();
				return;
			}
			for (int i = 0; i < sources.length && !isStopped(); i++) {
				own(sources[i].subscribe(new LatestObserver(i)));
			}
		}

		final class LatestObserver implements Observer<Object> {

			private final int index;

			LatestObserver(int index) {
				this.index = index;
			}

			@Override
			public void onNext(Object value) {
				if (isStopped()) {
					return;
				}
				latest[index] = value;
				if (!present[index]) {
					present[index] = true;
					missing--;
				}
				if (missing == 0) {
					try {
						emitNext(combinator.apply(latest.clone()));
					} catch (Throwable t) {
						fail(t);
					}
				}
			}

			@Override
			public void onError(Throwable error) {
				CombineLatestBarrier.this.onError(error);
			}

			@Override
			public void onCompleted() {
				if (--active == 0) {
					CombineLatestBarrier.this.onCompleted();
				}
			}

			@Override
			public boolean isStopped() {
				return CombineLatestBarrier.this.isStopped();
			}
		}
	}
}
