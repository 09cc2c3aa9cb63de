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

import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.observer.ObserverBarrier;

/**
 * @since 1.0
 */
public final class ObservableSkip<T> extends ObservableBarrier<T, T> {

	private final long n;

	public ObservableSkip(StreamSource<? extends T> source, long n) {
		super(source);
		this.n = n;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new SkipBarrier<T>(observer, n);
	}

	static final class SkipBarrier<T> extends ObserverBarrier<T, T> {

		private long remaining;

		SkipBarrier(Observer<? super T> subscriber, long n) {
			super(subscriber);
			this.remaining = n;
		}

		@Override
		protected void doNext(T value) {
			if (remaining > 0) {
				remaining--;
				return;
			}
			emitNext(value);
		}
	}
}
