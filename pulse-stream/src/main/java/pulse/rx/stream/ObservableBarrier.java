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

/**
 * An {@link Observable} decorating a single upstream source. Each subscription creates a fresh
 * {@link ObserverBarrier} through {@link #apply(Observer)}, subscribes it to the source unless it has already
 * stopped, and returns the barrier itself as the {@link Subscription}.
 *
 * @param <I> the type of values produced by the source
 * @param <O> the type of values produced by this observable
 */
public abstract class ObservableBarrier<I, O> extends Observable<O> {

	protected final StreamSource<? extends I> source;

	protected ObservableBarrier(StreamSource<? extends I> source) {
		this.source = Assert.notNull(source, "source");
	}

	@Override
	public Subscription subscribe(Observer<? super O> observer) {
		Assert.notNull(observer, "observer");
		ObserverBarrier<I, O> barrier = apply(observer);
		if (!barrier.isStopped()) {
			barrier.setUpstream(source.subscribe(barrier));
		}
		return barrier;
	}

	/**
	 * Create the per-subscription state of this operator. Operators observing secondary sources subscribe to them
	 * here, before the main source.
	 *
	 * @param observer the downstream observer
	 * @return the barrier to subscribe to the source
	 */
	protected abstract ObserverBarrier<I, O> apply(Observer<? super O> observer);

	public final StreamSource<? extends I> upstream() {
		return source;
	}

	@Override
	public String toString() {
		return "{source: " + source + "}";
	}

}
