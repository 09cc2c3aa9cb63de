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

import pulse.rx.Observer;

/**
 * What distinguishes the {@link Subject} variants: which values are remembered, whether they are broadcast as
 * they arrive, and what a new observer is given before joining. The default policy remembers nothing.
 *
 * @param <T> the type of values
 */
class SubjectPolicy<T> {

	/**
	 * Record a value pushed to the subject, before it is broadcast.
	 */
	void record(T value) {
	}

	boolean broadcastsValues() {
		return true;
	}

	/**
	 * Deliver the remembered values to a new observer.
	 *
	 * @param observer   the new observer
	 * @param terminated whether the subject has already terminated
	 * @param error      the terminal failure, {@code null} if none
	 */
	void replay(Observer<? super T> observer, boolean terminated, Throwable error) {
	}

	/**
	 * Called for each registered observer right before it receives {@code onCompleted}.
	 */
	void beforeCompletion(Observer<? super T> observer) {
	}

}
