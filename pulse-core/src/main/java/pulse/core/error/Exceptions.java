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
package pulse.core.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static helpers to classify, propagate and report errors raised while signalling.
 */
public final class Exceptions {

	private static final Logger log = LoggerFactory.getLogger(Exceptions.class);

	private Exceptions() {
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
	 * varieties are as follows:
	 * <ul>
	 * <li>{@code StackOverflowError}</li>
	 * <li>{@code VirtualMachineError}</li>
	 * <li>{@code ThreadDeath}</li>
	 * <li>{@code LinkageError}</li>
	 * </ul>
	 * Fatal errors are never turned into {@code onError} signals.
	 *
	 * @param t the error to inspect
	 */
	@SuppressWarnings("deprecation")
	public static void throwIfFatal(Throwable t) {
		if (t instanceof StackOverflowError) {
			throw (StackOverflowError) t;
		} else if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		} else if (t instanceof ThreadDeath) {
			throw (ThreadDeath) t;
		} else if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	/**
	 * Rethrow the given error unchecked, wrapping checked exceptions in a {@link RuntimeException}.
	 *
	 * @param t the error to propagate
	 * @return never returns, declared so callers can write {@code throw Exceptions.propagate(e)}
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfFatal(t);
		if (t instanceof RuntimeException) {
			throw (RuntimeException) t;
		}
		if (t instanceof Error) {
			throw (Error) t;
		}
		throw new RuntimeException(t);
	}

	/**
	 * Report an error that arrived after its receiver had already terminated and so cannot be delivered.
	 *
	 * @param t the undeliverable error
	 */
	public static void onErrorDropped(Throwable t) {
		throwIfFatal(t);
		log.error("Error signalled after termination has been dropped", t);
	}

	/**
	 * Raised when an {@code onError} signal reaches an observer that registered no error callback.
	 */
	public static final class ErrorCallbackNotImplemented extends RuntimeException {

		private static final long serialVersionUID = 2491425227432776143L;

		public ErrorCallbackNotImplemented(Throwable cause) {
			super("No error callback was provided for the observer", cause);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}
	}

}
