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
import pulse.rx.Observers;
import pulse.rx.Subscription;

import java.util.Iterator;

/**
 * Emit the elements obtained by traversing a source object, then complete. The traversal is run afresh for each
 * observer.
 *
 * @param <S> the type of the traversed object
 * @param <T> the type of values emitted
 * @since 1.0
 */
public final class IterableObservable<S, T> extends Observable<T> {

	private final S                                                source;
	private final Function<? super S, ? extends Iterator<? extends T>> traversal;

	public IterableObservable(S source, Function<? super S, ? extends Iterator<? extends T>> traversal) {
		this.source = Assert.notNull(source, "source");
		this.traversal = Assert.notNull(traversal, "traversal");
	}

	@Override
	public Subscription subscribe(final Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		Observers.runGuarded(observer, new Runnable() {
			@Override
			public void run() {
				Iterator<? extends T> it = traversal.apply(source);
				if (it == null) {
					throw new IllegalStateException("The traversal returned a null iterator");
				}
				while (!observer.isStopped() && it.hasNext()) {
					observer.onNext(it.next());
				}
				if (!observer.isStopped()) {
					observer.onCompleted();
				}
			}
		});
		return Subscription.empty();
	}

	@Override
	public String toString() {
		return "{source: " + source + "}";
	}

}
