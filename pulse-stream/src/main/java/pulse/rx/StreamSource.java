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
 * Anything an {@link Observer} can subscribe to.
 *
 * @param <T> the type of values produced
 */
public interface StreamSource<T> {

	/**
	 * Attach the given observer. Synchronous producers deliver their signals before this method returns.
	 *
	 * @param observer the observer to notify
	 * @return a {@link Subscription} detaching the observer, never {@code null}
	 */
	Subscription subscribe(Observer<? super T> observer);

}
