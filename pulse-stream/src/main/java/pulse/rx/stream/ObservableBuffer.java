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

import java.util.ArrayList;
import java.util.List;

/**
 * Group values into lists of {@code size}. A partial list is flushed before the terminal signal.
 *
 * @since 1.0
 */
public final class ObservableBuffer<T> extends ObservableBarrier<T, List<T>> {

	private final int size;

	public ObservableBuffer(StreamSource<? extends T> source, int size) {
		super(source);
		Assert.isTrue(size > 0, "Buffer size must be strictly positive but was " + size);
		this.size = size;
	}

	@Override
	protected ObserverBarrier<T, List<T>> apply(Observer<? super List<T>> observer) {
		return new BufferBarrier<T>(observer, size);
	}

	static final class BufferBarrier<T> extends ObserverBarrier<T, List<T>> {

		private final int size;

		private List<T> buffer;

		BufferBarrier(Observer<? super List<T>> subscriber, int size) {
			super(subscriber);
			this.size = size;
			this.buffer = new ArrayList<T>(Math.min(size, 16));
		}

		@Override
		protected void doNext(T value) {
			buffer.add(value);
			if (buffer.size() >= size) {
				flush();
			}
		}

		@Override
		protected void doError(Throwable error) {
			flush();
			emitError(error);
		}

		@Override
		protected void doComplete() {
			flush();
			emitComplete();
		}

		private void flush() {
			if (buffer.isEmpty()) {
				return;
			}
			List<T> full = buffer;
			buffer = new ArrayList<T>(Math.min(size, 16));
			emitNext(full);
		}
	}
}
