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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * A handle on an observation relationship. {@link #unsubscribe()} runs the cleanup action at most once; later calls
 * are no-ops, even if the first cleanup failed.
 * <p>
 * Subclasses holding their own resources override {@link #doUnsubscribe()}.
 */
public class Subscription {

	private static final AtomicIntegerFieldUpdater<Subscription> UNSUBSCRIBED =
			AtomicIntegerFieldUpdater.newUpdater(Subscription.class, "unsubscribed");

	private final Runnable action;

	private volatile int unsubscribed;

	protected Subscription() {
		this(null);
	}

	public Subscription(Runnable action) {
		this.action = action;
	}

	/**
	 * @param action the cleanup to run on the first {@link #unsubscribe()}
	 * @return a new {@link Subscription}
	 */
	public static Subscription create(Runnable action) {
		return new Subscription(action);
	}

	/**
	 * @return a new {@link Subscription} with nothing to clean up
	 */
	public static Subscription empty() {
		return new Subscription();
	}

	/**
	 * Stop receiving signals and release the associated resources.
	 */
	public final void unsubscribe() {
		if (UNSUBSCRIBED.compareAndSet(this, 0, 1)) {
			doUnsubscribe();
		}
	}

	public final boolean isUnsubscribed() {
		return unsubscribed == 1;
	}

	protected void doUnsubscribe() {
		if (action != null) {
			action.run();
		}
	}

}
