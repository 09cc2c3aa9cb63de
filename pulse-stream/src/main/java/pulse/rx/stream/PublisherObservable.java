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

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import pulse.core.support.Assert;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

/**
 * A Reactive Streams {@link Publisher} seen as an {@link Observable}. The publisher is asked for unbounded demand as
 * soon as it calls {@code onSubscribe}; unsubscribing cancels the Reactive Streams subscription.
 *
 * @since 1.0
 */
public final class PublisherObservable<T> extends Observable<T> {

	private final Publisher<? extends T> publisher;

	public PublisherObservable(Publisher<? extends T> publisher) {
		this.publisher = Assert.notNull(publisher, "publisher");
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		PublisherBridge<T> bridge = new PublisherBridge<T>(observer);
		publisher.subscribe(bridge);
		return bridge;
	}

	@Override
	public String toString() {
		return "{publisher: " + publisher + "}";
	}

	static final class PublisherBridge<T> extends ObserverBarrier<T, T> implements Subscriber<T> {

		private volatile org.reactivestreams.Subscription subscription;

		PublisherBridge(Observer<? super T> subscriber) {
			super(subscriber);
		}

		@Override
		public void onSubscribe(final org.reactivestreams.Subscription s) {
			if (s == null) {
				throw new NullPointerException("The subscription cannot be null");
			}
			if (subscription != null) {
				s.cancel();
				return;
			}
			subscription = s;
			setUpstream(Subscription.create(new Runnable() {
				@Override
				public void run() {
					s.cancel();
				}
			}));
			if (!isStopped()) {
				s.request(Long.MAX_VALUE);
			}
		}

		@Override
		public void onComplete() {
			onCompleted();
		}
	}
}
