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
package pulse.rx.observer;

import pulse.core.error.Exceptions;
import pulse.fn.Consumer;
import pulse.rx.Observer;
import pulse.rx.Subscription;

/**
 * The terminal {@link Observer} built from plain callbacks. It accepts any number of values and exactly one
 * terminal signal; everything after that is ignored. A missing error callback turns {@code onError} into an
 * {@link Exceptions.ErrorCallbackNotImplemented} thrown to the emitter.
 * <p>
 * Unsubscribing it stops it and releases the subscription it observes.
 *
 * @param <T> the type of values observed
 */
public class CallbackObserver<T> extends Subscription implements Observer<T> {

	private final Consumer<? super T>         nextConsumer;
	private final Consumer<? super Throwable> errorConsumer;
	private final Runnable                    completeConsumer;

	private volatile boolean      stopped;
	private volatile Subscription upstream;

	/**
	 * @param nextConsumer     called for every value, may be {@code null}
	 * @param errorConsumer    called on error, may be {@code null}
	 * @param completeConsumer called on completion, may be {@code null}
	 */
	public CallbackObserver(Consumer<? super T> nextConsumer,
	                        Consumer<? super Throwable> errorConsumer,
	                        Runnable completeConsumer) {
		this.nextConsumer = nextConsumer;
		this.errorConsumer = errorConsumer;
		this.completeConsumer = completeConsumer;
	}

	public final void setUpstream(Subscription s) {
		if (s == null) {
			return;
		}
		this.upstream = s;
		if (isUnsubscribed()) {
			s.unsubscribe();
		}
	}

	@Override
	public void onNext(T value) {
		if (isStopped()) {
			return;
		}
		if (nextConsumer != null) {
			nextConsumer.accept(value);
		}
	}

	@Override
	public void onError(Throwable error) {
		if (isStopped()) {
			Exceptions.onErrorDropped(error);
			return;
		}
		stopped = true;
		if (errorConsumer == null) {
			throw new Exceptions.ErrorCallbackNotImplemented(error);
		}
		errorConsumer.accept(error);
	}

	@Override
	public void onCompleted() {
		if (isStopped()) {
			return;
		}
		stopped = true;
		if (completeConsumer != null) {
			completeConsumer.run();
		}
	}

	@Override
	public boolean isStopped() {
		return stopped || isUnsubscribed();
	}

	@Override
	protected void doUnsubscribe() {
		stopped = true;
		Subscription s = upstream;
		if (s != null) {
			s.unsubscribe();
		}
	}

}
