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
import pulse.fn.Predicate;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Forward values while the predicate holds, complete on the first value failing it.
 *
 * @since 1.0
 */
public final class ObservableTakeWhile<T> extends ObservableBarrier<T, T> {

	private final Predicate<? super T> predicate;

	public ObservableTakeWhile(StreamSource<? extends T> source, Predicate<? super T> predicate) {
		super(source);
		this.predicate = Assert.notNull(predicate, "predicate");
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new TakeWhileBarrier<T>(observer, predicate);
	}

	static final class TakeWhileBarrier<T> extends ObserverBarrier<T, T> {

		private final Predicate<? super T> predicate;

		TakeWhileBarrier(Observer<? super T> subscriber, Predicate<? super T> predicate) {
			super(subscriber);
			this.predicate = predicate;
		}

		@Override
		protected void doNext(T value) {
			if (predicate.test(value)) {
				emitNext(value);
			} else {
				emitComplete();
			}
		}
	}
}
