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

import pulse.rx.Observer;

/**
 * A {@link Subject} emitting only its last value, together with completion. Values are not broadcast as they
 * arrive. An observer subscribing after completion receives the last value, if any, and completion; after an
 * error it receives the error only.
 *
 * @param <T> the type of values
 */
public class AsyncSubject<T> extends Subject<T> {

	private final AsyncPolicy<T> policy;

	public static <T> AsyncSubject<T> create() {
		return new AsyncSubject<T>(new AsyncPolicy<T>());
	}

	private AsyncSubject(AsyncPolicy<T> policy) {
		super(policy);
		this.policy = policy;
	}

	/**
	 * @return the last value received, {@code null} if none
	 */
	public T getValue() {
		return policy.value;
	}

	public boolean hasValue() {
		return policy.hasValue;
	}

	static final class AsyncPolicy<T> extends SubjectPolicy<T> {

		T       value;
		boolean hasValue;

		@Override
		void record(T value) {
			this.value = value;
			this.hasValue = true;
		}

		@Override
		boolean broadcastsValues() {
			return false;
		}

		@Override
		void replay(Observer<? super T> observer, boolean terminated, Throwable error) {
			if (terminated && error == null && hasValue && !observer.isStopped()) {
				observer.onNext(value);
			}
		}

		@Override
		void beforeCompletion(Observer<? super T> observer) {
			if (hasValue && !observer.isStopped()) {
				observer.onNext(value);
			}
		}
	}
}
