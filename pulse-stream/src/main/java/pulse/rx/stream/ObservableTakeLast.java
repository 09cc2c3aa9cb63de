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

import java.util.ArrayDeque;

/**
 * Emit the last {@code n} values on completion, oldest first.
 *
 * @since 1.0
 */
public final class ObservableTakeLast<T> extends ObservableBarrier<T, T> {

	private final int n;

	public ObservableTakeLast(StreamSource<? extends T> source, int n) {
		super(source);
		Assert.isTrue(n >= 0, "n >= 0 required but it was " + n);
		this.n = n;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new TakeLastBarrier<T>(observer, n);
	}

	static final class TakeLastBarrier<T> extends ObserverBarrier<T, T> {

		private final int n;

		// ArrayDeque rejects null values
		private final ArrayDeque<Object[]> buffer = new ArrayDeque<Object[]>();

		TakeLastBarrier(Observer<? super T> subscriber, int n) {
			super(subscriber);
			this.n = n;
		}

		@Override
		protected void doNext(T value) {
			if (n == 0) {
				return;
			}
			if (buffer.size() == n) {
				buffer.poll();
			}
			buffer.offer(new Object[]{value});
		}

		@Override
		@SuppressWarnings("unchecked")
		protected void doComplete() {
			Object[] slot;
			while ((slot = buffer.poll()) != null && !isStopped()) {
				emitNext((T) slot[0]);
			}
			emitComplete();
		}

		@Override
		protected void doCancel() {
			buffer.clear();
		}
	}
}
