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

import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class SubscriptionTests {

	@Test
	public void actionRunsOnlyOnce() {
		AtomicInteger calls = new AtomicInteger();
		Subscription s = Subscription.create(calls::incrementAndGet);

		assertThat(s.isUnsubscribed(), is(false));
		s.unsubscribe();
		s.unsubscribe();

		assertThat(calls.get(), is(1));
		assertThat(s.isUnsubscribed(), is(true));
	}

	@Test
	public void emptySubscriptionCanBeReleased() {
		Subscription s = Subscription.empty();
		s.unsubscribe();
		assertThat(s.isUnsubscribed(), is(true));
	}

}
