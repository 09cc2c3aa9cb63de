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
package pulse.rx.subject;

import pulse.core.support.Assert;
import pulse.rx.Observer;

import java.util.LinkedList;

/**
 * A {@link Subject} remembering the values pushed to it, all of them or only the most recent ones, and replaying
 * them oldest first to every new observer, followed by the terminal signal if the subject has terminated.
 *
 * @param <T> the type of values
 */
public class ReplaySubject<T> extends Subject<T> {

	/**
	 * @param <T> the type of values
	 * @return a {@link ReplaySubject} remembering every value
	 */
	public static <T> ReplaySubject<T> create() {
		return new ReplaySubject<T>(new ReplayPolicy<T>(-1));
	}

	/**
	 * @param bufferSize the number of most recent values to remember
	 * @param <T>        the type of values
	 * @return a bounded {@link ReplaySubject}
	 */
	public static <T> ReplaySubject<T> create(int bufferSize) {
		Assert.isTrue(bufferSize > 0, "Buffer size must be strictly positive but was " + bufferSize);
		return new ReplaySubject<T>(new ReplayPolicy<T>(bufferSize));
	}

	private ReplaySubject(ReplayPolicy<T> policy) {
		super(policy);
	}

	static final class ReplayPolicy<T> extends SubjectPolicy<T> {

		private final int           bufferSize;
		private final LinkedList<T> buffer = new LinkedList<T>();

		ReplayPolicy(int bufferSize) {
			this.bufferSize = bufferSize;
		}

		@Override
		void record(T value) {
			buffer.addLast(value);
			if (bufferSize > 0 && buffer.size() > bufferSize) {
				buffer.removeFirst();
			}
		}

		@Override
		void replay(Observer<? super T> observer, boolean terminated, Throwable error) {
			for (T value : buffer) {
				if (observer.isStopped()) {
					return;
				}
				observer.onNext(value);
			}
		}
	}
}
