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

import pulse.core.support.Assert;

import java.util.Properties;

/**
 * Typed view over the merged {@code pulse.*} properties.
 */
public class PulseConfiguration {

	public static final String TIMER_RESOLUTION         = "pulse.timer.resolution";
	public static final String TIMER_WHEEL_SIZE         = "pulse.timer.wheelSize";
	public static final String TIMER_NAME               = "pulse.timer.name";
	public static final String TIMER_WAIT_STRATEGY      = "pulse.timer.waitStrategy";
	public static final String TIMEOUT_SCHEDULER_DELAY  = "pulse.scheduler.timeout.defaultDelay";

	static final int    DEFAULT_TIMER_RESOLUTION    = 10;
	static final int    DEFAULT_TIMER_WHEEL_SIZE    = 512;
	static final String DEFAULT_TIMER_NAME          = "pulse-timer";
	static final String DEFAULT_TIMER_WAIT_STRATEGY = "sleep";

	private final Properties properties;

	public PulseConfiguration(Properties properties) {
		Assert.notNull(properties, "'properties' must not be null");
		this.properties = properties;
	}

	/**
	 * @return the tick length of the global timer, in milliseconds
	 */
	public int getTimerResolution() {
		return getInt(TIMER_RESOLUTION, DEFAULT_TIMER_RESOLUTION);
	}

	/**
	 * @return the number of slots of the global timer wheel, a power of two
	 */
	public int getTimerWheelSize() {
		return getInt(TIMER_WHEEL_SIZE, DEFAULT_TIMER_WHEEL_SIZE);
	}

	public String getTimerName() {
		return properties.getProperty(TIMER_NAME, DEFAULT_TIMER_NAME);
	}

	/**
	 * @return one of {@code sleep}, {@code yield} or {@code busySpin}
	 */
	public String getTimerWaitStrategy() {
		return properties.getProperty(TIMER_WAIT_STRATEGY, DEFAULT_TIMER_WAIT_STRATEGY);
	}

	/**
	 * @return the delay, in milliseconds, the timeout scheduler applies when none is given
	 */
	public long getTimeoutSchedulerDefaultDelay() {
		String value = properties.getProperty(TIMEOUT_SCHEDULER_DELAY);
		return value == null ? 0L : Long.parseLong(value.trim());
	}

	/**
	 * All configuration properties. Never {@code null}.
	 *
	 * @return The merged configuration properties.
	 */
	public Properties getProperties() {
		return properties;
	}

	private int getInt(String name, int defaultValue) {
		String value = properties.getProperty(name);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Property '" + name + "' must be an integer but was '" + value + "'", e);
		}
	}

}
