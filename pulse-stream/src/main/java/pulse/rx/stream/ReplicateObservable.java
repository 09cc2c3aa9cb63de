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
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Observers;
import pulse.rx.Subscription;

/**
 * Emit the same value {@code count} times, or until the observer stops if no count is given.
 *
 * @since 1.0
 */
public final class ReplicateObservable<T> extends Observable<T> {

	private final T    value;
	private final long count;

	/**
	 * @param value the value to repeat
	 * @param count the number of emissions, or a negative number to repeat indefinitely
	 */
	public ReplicateObservable(T value, long count) {
		this.value = value;
		this.count = count;
	}

	@Override
	public Subscription subscribe(final Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		Observers.runGuarded(observer, new Runnable() {
			@Override
			public void run() {
				for (long i = 0; count < 0 || i < count; i++) {
					if (observer.isStopped()) {
						return;
					}
					observer.onNext(value);
				}
				if (!observer.isStopped()) {
					observer.onCompleted();
				}
			}
		});
		return Subscription.empty();
	}

	@Override
	public String toString() {
		return "{value: " + value + ", count: " + (count < 0 ? "unbounded" : count) + "}";
	}

}
