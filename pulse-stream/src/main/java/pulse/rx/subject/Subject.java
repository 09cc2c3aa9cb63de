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

import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Subscription;

import java.util.ArrayList;
import java.util.List;

/**
 * Both an {@link Observer} and an {@link Observable}: every signal pushed to it is broadcast to the observers
 * subscribed at that time, most recently subscribed first.
 * <p>
 * A terminal signal stops the subject for good and releases every observer. Observers subscribing afterwards
 * receive the terminal signal right away. A subject is not thread safe; callers pushing from several threads must
 * serialize their calls.
 *
 * @param <T> the type of values
 */
public class Subject<T> extends Observable<T> implements Observer<T> {

	private final SubjectPolicy<T>          policy;
	private final List<Observer<? super T>> observers = new ArrayList<Observer<? super T>>();

	private boolean   stopped;
	private Throwable error;

	/**
	 * @param <T> the type of values
	 * @return a new {@link Subject} without memory
	 */
	public static <T> Subject<T> create() {
		return new Subject<T>(new SubjectPolicy<T>());
	}

	Subject(SubjectPolicy<T> policy) {
		this.policy = policy;
	}

	@Override
	public Subscription subscribe(final Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		policy.replay(observer, stopped, error);
		if (stopped) {
			if (observer.isStopped()) {
				return Subscription.empty();
			}
			if (error != null) {
				observer.onError(error);
			} else {
				observer.onCompleted();
			}
			return Subscription.empty();
		}
		observers.add(observer);
		return Subscription.create(new Runnable() {
			@Override
			public void run() {
				remove(observer);
			}
		});
	}

	private void remove(Observer<? super T> observer) {
		for (int i = 0; i < observers.size(); i++) {
			if (observers.get(i) == observer) {
				observers.remove(i);
				return;
			}
		}
	}

	@Override
	public void onNext(T value) {
		if (stopped) {
			return;
		}
		policy.record(value);
		if (!policy.broadcastsValues()) {
			return;
		}
		List<Observer<? super T>> snapshot = new ArrayList<Observer<? super T>>(observers);
		for (int i = snapshot.size() - 1; i >= 0; i--) {
			snapshot.get(i).onNext(value);
		}
	}

	@Override
	public void onError(Throwable error) {
		Assert.notNull(error, "error");
		if (stopped) {
			Exceptions.onErrorDropped(error);
			return;
		}
		this.stopped = true;
		this.error = error;
		List<Observer<? super T>> snapshot = new ArrayList<Observer<? super T>>(observers);
		observers.clear();
		for (int i = snapshot.size() - 1; i >= 0; i--) {
			snapshot.get(i).onError(error);
		}
	}

	@Override
	public void onCompleted() {
		if (stopped) {
			return;
		}
		this.stopped = true;
		List<Observer<? super T>> snapshot = new ArrayList<Observer<? super T>>(observers);
		observers.clear();
		for (int i = snapshot.size() - 1; i >= 0; i--) {
			Observer<? super T> observer = snapshot.get(i);
			policy.beforeCompletion(observer);
			observer.onCompleted();
		}
	}

	@Override
	public boolean isStopped() {
		return stopped;
	}

	/**
	 * @return the number of registered observers
	 */
	public int size() {
		return observers.size();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{observers=" + observers.size() + ", stopped=" + stopped + "}";
	}

}
