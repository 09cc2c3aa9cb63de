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
package pulse.rx.stream;

import pulse.core.support.Assert;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Observers;
import pulse.rx.Subscription;

/**
 * Emit the integers from {@code start} to {@code stop} inclusive, {@code step} apart. A negative step counts down;
 * a range whose step leads away from {@code stop} is empty.
 *
 * @since 1.0
 */
public final class RangeObservable extends Observable<Integer> {

	private final int start;
	private final int stop;
	private final int step;

	public RangeObservable(int start, int stop, int step) {
		Assert.isTrue(step != 0, "Range step cannot be 0");
		this.start = start;
		this.stop = stop;
		this.step = step;
	}

	@Override
	public Subscription subscribe(final Observer<? super Integer> observer) {
		Assert.notNull(observer, "observer");
		Observers.runGuarded(observer, new Runnable() {
			@Override
			public void run() {
				// long counter, stepping past Integer.MAX_VALUE must end the loop
				for (long i = start; step > 0 ? i <= stop : i >= stop; i += step) {
					if (observer.isStopped()) {
						return;
					}
					observer.onNext((int) i);
				}
				if (!observer.isStopped()) {
					observer.onCompleted();
				}
			}
		});
		return Subscription.empty();
	}

	@Override
	public String toString() {
		return "{start: " + start + ", stop: " + stop + ", step: " + step + "}";
	}

}
