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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.rx.Subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Drives {@link Task Tasks} against a virtual clock advanced by the caller through {@link #update(long)}. Nothing
 * runs in the background.
 * <p>
 * A task is resumed only once the clock has reached its due time. After a resumption that does not finish, its due
 * time becomes {@code max(due + requestedSleep, currentTime)}. A task that fails is removed and the failure is
 * rethrown to the caller of {@code update} as a {@link TaskFailedException}; the rest of the queue is untouched and
 * tasks not visited yet during that tick remain due.
 */
public class CooperativeScheduler extends AbstractScheduler {

	private static final Logger log = LoggerFactory.getLogger(CooperativeScheduler.class);

	private final List<ScheduledTask> tasks = new ArrayList<ScheduledTask>();

	private long currentTime;

	public CooperativeScheduler() {
		this(0L);
	}

	/**
	 * @param currentTime the initial virtual time
	 */
	public CooperativeScheduler(long currentTime) {
		super(0L);
		this.currentTime = currentTime;
	}

	@Override
	public Subscription schedule(Task task, long delay) {
		ScheduledTask entry = new ScheduledTask(Assert.notNull(task, "task"), currentTime + delay);
		tasks.add(entry);
		return entry;
	}

	/**
	 * Advance the virtual clock by {@code delta} and resume every due task once. Tasks scheduled while the tick
	 * runs are visited in the same tick, and run if already due.
	 *
	 * @param delta the amount of virtual time to advance
	 * @throws TaskFailedException if a resumed task fails
	 */
	public void update(long delta) {
		currentTime += delta;

		Set<ScheduledTask> visited = Collections.newSetFromMap(new IdentityHashMap<ScheduledTask, Boolean>());
		boolean pending = true;
		while (pending) {
			pending = false;
			for (ScheduledTask entry : new ArrayList<ScheduledTask>(tasks)) {
				if (!visited.add(entry)) {
					continue;
				}
				pending = true;
				if (!entry.isUnsubscribed() && currentTime >= entry.due) {
					resume(entry);
				}
			}
		}
	}

	private void resume(ScheduledTask entry) {
		TaskStep step;
		try {
			step = entry.task.resume();
			if (step == null) {
				throw new NullPointerException("Task " + entry.task + " returned a null step");
			}
		} catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			entry.unsubscribe();
			log.debug("Removed failed task {} at virtual time {}", entry.task, currentTime);
			throw new TaskFailedException(entry.task, t);
		}
		if (step.isFinished()) {
			entry.unsubscribe();
		} else {
			entry.due = Math.max(entry.due + step.getDelay(), currentTime);
		}
	}

	/**
	 * @return {@literal true} if no task remains queued
	 */
	public boolean isEmpty() {
		return tasks.isEmpty();
	}

	/**
	 * @return the number of queued tasks
	 */
	public int size() {
		return tasks.size();
	}

	public long getCurrentTime() {
		return currentTime;
	}

	@Override
	public String toString() {
		return "CooperativeScheduler{currentTime=" + currentTime + ", tasks=" + tasks.size() + "}";
	}

	private final class ScheduledTask extends Subscription {

		final Task task;
		long due;

		ScheduledTask(Task task, long due) {
			this.task = task;
			this.due = due;
		}

		@Override
		protected void doUnsubscribe() {
			tasks.remove(this);
		}
	}

}
