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
import pulse.core.support.Assert;
import pulse.rx.Observer;
import pulse.rx.Subscription;
import pulse.rx.subscription.CompositeSubscription;

/**
 * An {@link Observer} with an asymmetric typed wrapped observer, the base of every operator. It is also the
 * {@link Subscription} of the relationship it represents: unsubscribing it stops it, releases its upstream and
 * every resource it {@link #own owns}.
 * <p>
 * Signals are routed to the {@link #doNext}, {@link #doError} and {@link #doComplete} hooks. A failure raised by
 * a hook becomes an {@code onError} towards the wrapped observer, unless the wrapped observer has already
 * stopped, in which case it is rethrown to the emitter. Once stopped, the barrier ignores {@code onNext} and
 * {@code onCompleted} and reports late errors to {@link Exceptions#onErrorDropped(Throwable)}.
 *
 * @param <I> the type of values received
 * @param <O> the type of values forwarded
 */
public class ObserverBarrier<I, O> extends Subscription implements Observer<I> {

	protected final Observer<? super O> subscriber;

	private final CompositeSubscription resources = new CompositeSubscription();

	private volatile Subscription upstream;
	private volatile boolean      done;

	public ObserverBarrier(Observer<? super O> subscriber) {
		this.subscriber = Assert.notNull(subscriber, "observer");
	}

	/**
	 * Attach the subscription of the source feeding this barrier. If the barrier is already unsubscribed, the
	 * given subscription is released right away.
	 *
	 * @param s the upstream subscription
	 */
	public final void setUpstream(Subscription s) {
		if (s == null) {
			return;
		}
		this.upstream = s;
		if (isUnsubscribed()) {
			s.unsubscribe();
		}
	}

	/**
	 * Tie the lifetime of the given subscription to this barrier.
	 *
	 * @param s   a subscription on a secondary source or a scheduled action
	 * @param <S> the subscription type
	 * @return the same subscription
	 */
	protected final <S extends Subscription> S own(S s) {
		resources.add(s);
		return s;
	}

	/**
	 * Stop tracking a subscription previously passed to {@link #own}, without unsubscribing it.
	 *
	 * @param s the subscription to forget
	 */
	protected final void disown(Subscription s) {
		resources.remove(s);
	}

	@Override
	public final void onNext(I value) {
		if (isStopped()) {
			return;
		}
		try {
			doNext(value);
		} catch (Throwable throwable) {
			fail(throwable);
		}
	}

	@SuppressWarnings("unchecked")
	protected void doNext(I value) {
		subscriber.onNext((O) value);
	}

	@Override
	public final void onError(Throwable error) {
		if (isStopped()) {
			Exceptions.onErrorDropped(error);
			return;
		}
		try {
			doError(error);
		} catch (Throwable throwable) {
			fail(throwable);
		}
	}

	protected void doError(Throwable error) {
		emitError(error);
	}

	@Override
	public final void onCompleted() {
		if (isStopped()) {
			return;
		}
		try {
			doComplete();
		} catch (Throwable throwable) {
			fail(throwable);
		}
	}

	protected void doComplete() {
		emitComplete();
	}

	/**
	 * Route a failure raised while handling a signal: it terminates the wrapped observer, or is rethrown if that
	 * observer has already stopped.
	 *
	 * @param throwable the failure
	 */
	protected final void fail(Throwable throwable) {
		Exceptions.throwIfFatal(throwable);
		if (isStopped()) {
			throw Exceptions.propagate(throwable);
		}
		emitError(throwable);
	}

	/**
	 * Forward a value. Must only be called while handling a signal.
	 *
	 * @param value the value
	 */
	protected final void emitNext(O value) {
		subscriber.onNext(value);
	}

	/**
	 * Terminate with an error: stop, release upstream and owned resources, then notify the wrapped observer.
	 *
	 * @param error the failure
	 */
	protected final void emitError(Throwable error) {
		if (done) {
			Exceptions.onErrorDropped(error);
			return;
		}
		done = true;
		unsubscribe();
		subscriber.onError(error);
	}

	/**
	 * Terminate successfully: stop, release upstream and owned resources, then notify the wrapped observer.
	 */
	protected final void emitComplete() {
		if (done) {
			return;
		}
		done = true;
		unsubscribe();
		subscriber.onCompleted();
	}

	/**
	 * @return {@literal true} once a terminal signal has been forwarded
	 */
	public final boolean isTerminated() {
		return done;
	}

	@Override
	public boolean isStopped() {
		return done || isUnsubscribed() || subscriber.isStopped();
	}

	@Override
	protected final void doUnsubscribe() {
		Subscription s = upstream;
		if (s != null) {
			s.unsubscribe();
		}
		resources.unsubscribe();
		doCancel();
	}

	/**
	 * Hook run once when this barrier is unsubscribed or terminates.
	 */
	protected void doCancel() {
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{done=" + done + ", unsubscribed=" + isUnsubscribed() + "}";
	}

}
