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
import pulse.rx.Subscription;

/**
 * Completes immediately.
 *
 * @since 1.0
 */
public final class EmptyObservable<T> extends Observable<T> {

	@SuppressWarnings("rawtypes")
	private static final EmptyObservable INSTANCE = new EmptyObservable();

	@SuppressWarnings("unchecked")
	public static <T> EmptyObservable<T> instance() {
		return (EmptyObservable<T>) INSTANCE;
	}

	private EmptyObservable() {
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		if (!observer.isStopped()) {
			observer.onCompleted();
		}
		return Subscription.empty();
	}

	@Override
	public String toString() {
		return "EmptyObservable";
	}

}
