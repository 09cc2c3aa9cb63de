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
import pulse.fn.Supplier;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;

/**
 * Create the actual source for each observer at subscription time.
 *
 * @since 1.0
 */
public final class DeferredObservable<T> extends Observable<T> {

	private final Supplier<? extends StreamSource<? extends T>> factory;

	public DeferredObservable(Supplier<? extends StreamSource<? extends T>> factory) {
		this.factory = Assert.notNull(factory, "factory");
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		StreamSource<? extends T> source;
		try {
			source = factory.get();
		} catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			observer.onError(t);
			return Subscription.empty();
		}
		if (source == null) {
			observer.onError(new IllegalStateException("The deferred factory returned a null source"));
			return Subscription.empty();
		}
		return source.subscribe(observer);
	}

	@Override
	public String toString() {
		return "{factory: " + factory + "}";
	}

}
