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
package pulse.rx.scheduler;

import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class ImmediateSchedulerTests {

	@Test
	public void runsSynchronouslyIgnoringDelays() {
		AtomicInteger runs = new AtomicInteger();

		Schedulers.immediate().schedule(runs::incrementAndGet, 1000);

		assertThat(runs.get(), is(1));
	}

	@Test
	public void resumesUntilFinished() {
		AtomicInteger resumes = new AtomicInteger();

		Schedulers.immediate().schedule(() -> resumes.incrementAndGet() < 4 ? TaskStep.sleep(50) : TaskStep.finished(), 0);

		assertThat(resumes.get(), is(4));
	}

	@Test(expected = IllegalStateException.class)
	public void failuresReachTheCaller() {
		Schedulers.immediate().schedule(() -> {
			throw new IllegalStateException("broken");
		}, 0);
	}

}
