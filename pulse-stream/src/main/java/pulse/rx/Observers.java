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
package pulse.rx;

import pulse.core.error.Exceptions;
import pulse.fn.Consumer;
import pulse.rx.observer.CallbackObserver;

/**
 * Static helpers to create and drive {@link Observer Observers}.
 */
public final class Observers {

	private Observers() {
	}

	/**
	 * @param onNext called for every value
	 * @param <T>    the type of values observed
	 * @return an observer raising {@link Exceptions.ErrorCallbackNotImplemented} on error
	 */
	public static <T> Observer<T> create(Consumer<? super T> onNext) {
		return new CallbackObserver<T>(onNext, null, null);
	}

	public static <T> Observer<T> create(Consumer<? super T> onNext, Consumer<? super Throwable> onError) {
		return new CallbackObserver<T>(onNext, onError, null);
	}

	/**
	 * Any callback may be {@code null}. A {@code null} error callback makes errors surface as
	 * {@link Exceptions.ErrorCallbackNotImplemented}.
	 *
	 * @param onNext      called for every value
	 * @param onError     called on error
	 * @param onCompleted called on completion
	 * @param <T>         the type of values observed
	 * @return a new terminal observer
	 */
	public static <T> Observer<T> create(Consumer<? super T> onNext,
	                                     Consumer<? super Throwable> onError,
	                                     Runnable onCompleted) {
		return new CallbackObserver<T>(onNext, onError, onCompleted);
	}

	/**
	 * Run the given action and forward anything it raises to {@code observer.onError}. If the observer has already
	 * stopped, the failure cannot be delivered and is rethrown instead.
	 *
	 * @param observer the observer to notify of failures
	 * @param action   the action to run
	 * @return {@literal true} if the action completed normally
	 */
	public static boolean runGuarded(Observer<?> observer, Runnable action) {
		try {
			action.run();
			return true;
		} catch (Throwable throwable) {
			Exceptions.throwIfFatal(throwable);
			if (observer.isStopped()) {
				throw Exceptions.propagate(throwable);
			}
			observer.onError(throwable);
			return false;
		}
	}

}
