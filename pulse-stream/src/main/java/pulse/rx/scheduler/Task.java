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

/**
 * A resumable unit of work driven by a {@link Scheduler}. Each call to {@link #resume()} runs the task up to its
 * next suspension point and reports whether, and after how long, it wants to be resumed again.
 */
public interface Task {

	/**
	 * Run the task until it yields or finishes.
	 *
	 * @return {@link TaskStep#finished()}, {@link TaskStep#proceed()} or {@link TaskStep#sleep(long)}
	 * @throws Exception if the task fails; the scheduler stops driving it
	 */
	TaskStep resume() throws Exception;

}
