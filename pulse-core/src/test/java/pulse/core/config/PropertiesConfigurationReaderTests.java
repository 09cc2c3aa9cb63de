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
package pulse.core.config;

import org.junit.After;
import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class PropertiesConfigurationReaderTests {

	@After
	public void clearSystemProperties() {
		System.clearProperty("pulse.profiles.active");
		System.clearProperty(PulseConfiguration.TIMER_RESOLUTION);
	}

	@Test
	public void defaultProfileIsLoaded() {
		PulseConfiguration configuration = new PropertiesConfigurationReader().read();

		assertThat(configuration.getTimerResolution(), is(10));
		assertThat(configuration.getTimerWheelSize(), is(512));
		assertThat(configuration.getTimerName(), is("pulse-timer"));
		assertThat(configuration.getTimerWaitStrategy(), is("sleep"));
		assertThat(configuration.getTimeoutSchedulerDefaultDelay(), is(0L));
	}

	@Test
	public void activeProfilesOverrideDefaults() {
		System.setProperty("pulse.profiles.active", "test");
		PulseConfiguration configuration = new PropertiesConfigurationReader().read();

		assertThat(configuration.getTimerWheelSize(), is(64));
		assertThat(configuration.getTimeoutSchedulerDefaultDelay(), is(5L));
		assertThat(configuration.getTimerResolution(), is(10));
	}

	@Test
	public void systemPropertiesOverrideProfiles() {
		System.setProperty("pulse.profiles.active", "test");
		System.setProperty(PulseConfiguration.TIMER_RESOLUTION, "20");
		PulseConfiguration configuration = new PropertiesConfigurationReader().read();

		assertThat(configuration.getTimerResolution(), is(20));
		assertThat(configuration.getTimerWheelSize(), is(64));
	}

	@Test
	public void missingProfileIsIgnored() {
		System.setProperty("pulse.profiles.active", "does-not-exist");
		PulseConfiguration configuration = new PropertiesConfigurationReader().read();

		assertThat(configuration.getTimerWheelSize(), is(512));
	}

	@Test(expected = IllegalArgumentException.class)
	public void malformedNumbersAreRejected() {
		System.setProperty(PulseConfiguration.TIMER_RESOLUTION, "fast");
		new PropertiesConfigurationReader().read().getTimerResolution();
	}

}
