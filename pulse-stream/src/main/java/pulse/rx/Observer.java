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

/**
 * Receiver of the signals of an {@link Observable}: any number of {@link #onNext} calls followed by at most one
 * terminal {@link #onError} or {@link #onCompleted}.
 *
 * @param <T> the type of values observed
 */
public interface Observer<T> {

	/**
	 * Receive a value.
	 *
	 * @param value the value, possibly {@code null}
	 */
	void onNext(T value);

	/**
	 * Receive the terminal failure of the sequence.
	 *
	 * @param error the failure
	 */
	void onError(Throwable error);

	/**
	 * Receive the successful termination of the sequence.
	 */
	void onCompleted();

	/**
	 * Producers emitting in a synchronous loop poll this between emissions and stop early once it returns
	 * {@literal true}.
	 *
	 * @return {@literal true} if this observer will ignore any further signal
	 */
	boolean isStopped();

}
