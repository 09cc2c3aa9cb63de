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

import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.fn.Function;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

/**
 * An {@link Observable} running a user producer for each observer. The producer receives an observer enforcing the
 * signal grammar and may return a {@link Subscription} releasing its resources, or {@code null} if it holds none.
 * A producer failure is delivered as {@code onError}.
 *
 * @since 1.0
 */
public final class ProducerObservable<T> extends Observable<T> {

	private final Function<Observer<? super T>, Subscription> producer;

	public ProducerObservable(Function<Observer<? super T>, Subscription> producer) {
		this.producer = Assert.notNull(producer, "producer");
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		ObserverBarrier<T, T> safe = new ObserverBarrier<T, T>(observer);
		Subscription s;
		try {
			s = producer.apply(safe);
		} catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			if (safe.isStopped()) {
				throw Exceptions.propagate(t);
			}
			safe.onError(t);
			return safe;
		}
		safe.setUpstream(s);
		return safe;
	}

	@Override
	public String toString() {
		return "{producer: " + producer + "}";
	}

}
