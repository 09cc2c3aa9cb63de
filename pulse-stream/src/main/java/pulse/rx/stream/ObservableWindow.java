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
import java.util.LinkedList;
import java.util.List;

/**
 * Sliding window: once {@code size} values have been seen, every value emits the list of the last {@code size}
 * values, oldest first.
 *
 * @since 1.0
 */
public final class ObservableWindow<T> extends ObservableBarrier<T, List<T>> {

	private final int size;

	public ObservableWindow(StreamSource<? extends T> source, int size) {
		super(source);
		Assert.isTrue(size > 0, "Window size must be strictly positive but was " + size);
		this.size = size;
	}

	@Override
	protected ObserverBarrier<T, List<T>> apply(Observer<? super List<T>> observer) {
		return new WindowBarrier<T>(observer, size);
	}

	static final class WindowBarrier<T> extends ObserverBarrier<T, List<T>> {

		private final int           size;
		private final LinkedList<T> window = new LinkedList<T>();

		WindowBarrier(Observer<? super List<T>> subscriber, int size) {
			super(subscriber);
			this.size = size;
		}

		@Override
		protected void doNext(T value) {
			window.addLast(value);
			if (window.size() >= size) {
				List<T> copy = new ArrayList<T>(window);
				window.removeFirst();
				emitNext(copy);
			}
		}
	}
}
