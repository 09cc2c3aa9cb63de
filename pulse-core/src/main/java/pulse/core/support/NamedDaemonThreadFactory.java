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
package pulse.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link ThreadFactory} creating daemon threads named {@code prefix-N}. Errors escaping a thread's
 * {@link Runnable} are logged rather than printed to {@code System.err}.
 */
public class NamedDaemonThreadFactory implements ThreadFactory {

	private static final Logger        log     = LoggerFactory.getLogger(NamedDaemonThreadFactory.class);
	private static final AtomicInteger COUNTER = new AtomicInteger(0);

	private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER = new Thread.UncaughtExceptionHandler() {
		@Override
		public void uncaughtException(Thread t, Throwable e) {
			log.error("Uncaught error on thread " + t.getName(), e);
		}
	};

	private final String prefix;

	public NamedDaemonThreadFactory(String prefix) {
		this.prefix = Assert.notNull(prefix, "Thread name prefix cannot be null");
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread t = new Thread(runnable);
		t.setName(prefix + "-" + COUNTER.incrementAndGet());
		t.setDaemon(true);
		t.setUncaughtExceptionHandler(LOGGING_HANDLER);
		return t;
	}

}
