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
package pulse.rx.subscription;

import pulse.rx.Subscription;

/**
 * A {@link Subscription} holding one replaceable child. Setting a new child unsubscribes the previous one; once this
 * holder has been unsubscribed, any child set is unsubscribed right away.
 */
public class SerialSubscription extends Subscription {

	private Subscription current;

	/**
	 * @param next the new child, may be {@code null} to only release the current one
	 */
	public void set(Subscription next) {
		Subscription previous;
		boolean release;
		synchronized (this) {
			release = isUnsubscribed();
			previous = current;
			current = release ? null : next;
		}
		if (previous != null && previous != next) {
			previous.unsubscribe();
		}
		if (release && next != null) {
			next.unsubscribe();
		}
	}

	public synchronized Subscription get() {
		return current;
	}

	@Override
	protected void doUnsubscribe() {
		Subscription previous;
		synchronized (this) {
			previous = current;
			current = null;
		}
		if (previous != null) {
			previous.unsubscribe();
		}
	}

}
