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
import pulse.fn.BiPredicate;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Filters out values equal to the previous one. The first value is always forwarded.
 *
 * @since 1.0
 */
public final class ObservableDistinctUntilChanged<T> extends ObservableBarrier<T, T> {

	private final BiPredicate<? super T, ? super T> comparator;

	public ObservableDistinctUntilChanged(StreamSource<? extends T> source,
	                                      BiPredicate<? super T, ? super T> comparator) {
		super(source);
		this.comparator = Assert.notNull(comparator, "Comparator cannot be null");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new DistinctUntilChangedBarrier<T>(observer, comparator);
	}

	static final class DistinctUntilChangedBarrier<T> extends ObserverBarrier<T, T> {

		private final BiPredicate<? super T, ? super T> comparator;

		private T       last;
		private boolean hasLast;

		DistinctUntilChangedBarrier(Observer<? super T> subscriber, BiPredicate<? super T, ? super T> comparator) {
			super(subscriber);
			this.comparator = comparator;
		}

		@Override
		protected void doNext(T value) {
			if (hasLast && comparator.test(last, value)) {
				return;
			}
			last = value;
			hasLast = true;
			emitNext(value);
		}
	}
}
