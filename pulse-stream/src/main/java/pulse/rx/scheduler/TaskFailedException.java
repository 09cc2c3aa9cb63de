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
 * Raised by {@link CooperativeScheduler#update(long)} when a task fails while being resumed. The failed task has
 * been removed from the queue; the other tasks are left as they were.
 */
public class TaskFailedException extends RuntimeException {

	private static final long serialVersionUID = -6409328826454935421L;

	private final transient Task task;

	public TaskFailedException(Task task, Throwable cause) {
		super("Task " + task + " failed", cause);
		this.task = task;
	}

	/**
	 * @return the task that failed
	 */
	public Task getTask() {
		return task;
	}

}
