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
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * Emit the value at a zero-based position, then complete. A source too short for the index completes without
 * value.
 *
 * @since 1.0
 */
public final class ObservableElementAt<T> extends ObservableBarrier<T, T> {

	private final long index;

	public ObservableElementAt(StreamSource<? extends T> source, long index) {
		super(source);
		Assert.isTrue(index >= 0, "index >= 0 required but it was " + index);
		this.index = index;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new ElementAtBarrier<T>(observer, index);
	}

	static final class ElementAtBarrier<T> extends ObserverBarrier<T, T> {

		private final long index;

		private long position;

		ElementAtBarrier(Observer<? super T> subscriber, long index) {
			super(subscriber);
			this.index = index;
		}

		@Override
		protected void doNext(T value) {
			if (position++ == index) {
				emitNext(value);
				emitComplete();
			}
		}
	}
}
