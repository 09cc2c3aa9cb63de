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

import org.junit.Test;

import java.io.IOException;

import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class ExceptionsTests {

	@Test
	public void nonFatalErrorsAreNotThrown() {
		Exceptions.throwIfFatal(new IllegalStateException("recoverable"));
	}

	@Test(expected = StackOverflowError.class)
	public void fatalErrorsAreThrown() {
		Exceptions.throwIfFatal(new StackOverflowError());
	}

	@Test
	public void propagateRethrowsRuntimeExceptionsAsIs() {
		IllegalStateException error = new IllegalStateException("boom");
		try {
			throw Exceptions.propagate(error);
		} catch (IllegalStateException e) {
			assertThat(e, is(sameInstance(error)));
		}
	}

	@Test
	public void propagateWrapsCheckedExceptions() {
		IOException error = new IOException("io");
		try {
			throw Exceptions.propagate(error);
		} catch (RuntimeException e) {
			assertThat(e.getCause(), is(sameInstance((Throwable) error)));
		}
	}

	@Test
	public void droppedErrorsAreLoggedNotThrown() {
		try {
			Exceptions.onErrorDropped(new IllegalArgumentException("late"));
		} catch (Throwable t) {
			fail("dropped error escaped: " + t);
		}
	}

	@Test
	public void missingErrorCallbackKeepsCause() {
		Exception cause = new Exception("unhandled");
		Exceptions.ErrorCallbackNotImplemented e = new Exceptions.ErrorCallbackNotImplemented(cause);
		assertThat(e.getCause(), is(sameInstance((Throwable) cause)));
		assertThat(e, is(instanceOf(RuntimeException.class)));
	}

}
