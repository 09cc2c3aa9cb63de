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
 * A {@link Subject} holding a current value, delivered to every new observer as soon as it subscribes. The value
 * is the seed, if any, until the first value is pushed. Once terminated, new observers only receive the terminal
 * signal.
 *
 * @param <T> the type of values
 */
public class BehaviorSubject<T> extends Subject<T> {

	private final BehaviorPolicy<T> policy;

	/**
	 * @param <T> the type of values
	 * @return a new {@link BehaviorSubject} without current value
	 */
	public static <T> BehaviorSubject<T> create() {
		return new BehaviorSubject<T>(new BehaviorPolicy<T>());
	}

	/**
	 * @param seed the initial current value
	 * @param <T>  the type of values
	 * @return a new {@link BehaviorSubject}
	 */
	public static <T> BehaviorSubject<T> create(T seed) {
		BehaviorPolicy<T> policy = new BehaviorPolicy<T>();
		policy.record(seed);
		return new BehaviorSubject<T>(policy);
	}

	private BehaviorSubject(BehaviorPolicy<T> policy) {
		super(policy);
		this.policy = policy;
	}

	/**
	 * @return the current value, {@code null} if none
	 */
	public T getValue() {
		return policy.value;
	}

	public boolean hasValue() {
		return policy.hasValue;
	}

	static final class BehaviorPolicy<T> extends SubjectPolicy<T> {

		T       value;
		boolean hasValue;

		@Override
		void record(T value) {
			this.value = value;
			this.hasValue = true;
		}

		@Override
		void replay(Observer<? super T> observer, boolean terminated, Throwable error) {
			if (!terminated && hasValue) {
				observer.onNext(value);
			}
		}
	}
}
