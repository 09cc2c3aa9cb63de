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

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link Subscription} owning a group of child subscriptions, all released together. Children added after the
 * composite has been unsubscribed are released immediately.
 */
public class CompositeSubscription extends Subscription {

	private final List<Subscription> subscriptions = new ArrayList<Subscription>();

	public CompositeSubscription(Subscription... subscriptions) {
		for (Subscription s : subscriptions) {
			add(s);
		}
	}

	/**
	 * @param subscription the child to own
	 * @return the same child
	 */
	public Subscription add(Subscription subscription) {
		if (subscription == null) {
			return null;
		}
		boolean release;
		synchronized (subscriptions) {
			release = isUnsubscribed();
			if (!release) {
				subscriptions.add(subscription);
			}
		}
		if (release) {
			subscription.unsubscribe();
		}
		return subscription;
	}

	/**
	 * Stop owning the given child without unsubscribing it.
	 *
	 * @param subscription the child to forget
	 */
	public void remove(Subscription subscription) {
		synchronized (subscriptions) {
			subscriptions.remove(subscription);
		}
	}

	public int size() {
		synchronized (subscriptions) {
			return subscriptions.size();
		}
	}

	@Override
	protected void doUnsubscribe() {
		Subscription[] children;
		synchronized (subscriptions) {
			children = subscriptions.toArray(new Subscription[subscriptions.size()]);
			subscriptions.clear();
		}
		for (Subscription child : children) {
			child.unsubscribe();
		}
	}

}
