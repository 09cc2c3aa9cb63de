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
package pulse.core.timer;

import pulse.core.config.PropertiesConfigurationReader;
import pulse.core.config.PulseConfiguration;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Access to the process-wide {@link Timer}, created lazily from the {@code pulse.timer.*} configuration.
 */
public final class Timers {

	private static final AtomicReference<Timer> globalTimer = new AtomicReference<Timer>();

	private Timers() {
	}

	/**
	 * Read if the global timer has been created
	 *
	 * @return true if the global timer is initialized
	 */
	public static boolean available() {
		return globalTimer.get() != null;
	}

	/**
	 * Obtain the global timer. The timer is created lazily so it is preferable to fetch it out of the critical
	 * path. Cancelling it unregisters it, a later call creates a fresh one.
	 *
	 * @return the global timer, a {@link HashWheelTimer}
	 */
	public static Timer global() {
		if (null == globalTimer.get()) {
			synchronized (globalTimer) {
				if (null == globalTimer.get()) {
					globalTimer.set(create(new PropertiesConfigurationReader().read()));
				}
			}
		}
		return globalTimer.get();
	}

	/**
	 * Create a new timer configured from the given configuration. The caller owns the returned timer.
	 *
	 * @param configuration the configuration to read {@code pulse.timer.*} settings from
	 * @return a started {@link HashWheelTimer}
	 */
	public static Timer create(PulseConfiguration configuration) {
		return new HashWheelTimer(configuration.getTimerName(),
		  configuration.getTimerResolution(),
		  configuration.getTimerWheelSize(),
		  HashWheelTimer.waitStrategy(configuration.getTimerWaitStrategy()),
		  null) {
			@Override
			public void cancel() {
				globalTimer.compareAndSet(this, null);
				super.cancel();
			}
		};
	}

	/**
	 * Clean current global timer references and cancel the respective {@link Timer}.
	 * A new global timer can be assigned later with {@link #global()}.
	 */
	public static void unregisterGlobal() {
		Timer timer;
		while ((timer = globalTimer.getAndSet(null)) != null) {
			timer.cancel();
		}
	}

}
