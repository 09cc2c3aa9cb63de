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
package pulse.rx.stream;

import pulse.core.error.Exceptions;
import pulse.core.support.Assert;
import pulse.fn.Supplier;
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;
import pulse.rx.scheduler.Scheduler;
import pulse.rx.scheduler.Task;
import pulse.rx.scheduler.TaskStep;

import java.util.Iterator;

/**
 * Pull values from an {@link Iterator} one at a time, each pull being a resumption of a {@link Task} driven by a
 * {@link Scheduler}. The sequence completes when the iterator is exhausted and fails if the iterator throws.
 * <p>
 * The iterator is obtained from a {@link Supplier} for each observer; an iterator passed directly is shared, so
 * its progress is shared by every observer.
 *
 * @since 1.0
 */
public final class GeneratorObservable<T> extends Observable<T> {

	private final Supplier<? extends Iterator<? extends T>> generator;
	private final Scheduler                                  scheduler;

	public GeneratorObservable(Supplier<? extends Iterator<? extends T>> generator, Scheduler scheduler) {
		this.generator = Assert.notNull(generator, "generator");
		this.scheduler = Assert.notNull(scheduler, "scheduler");
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		ObserverBarrier<T, T> safe = new ObserverBarrier<T, T>(observer);
		safe.setUpstream(scheduler.schedule(new GeneratorTask<T>(safe, generator), 0L));
		return safe;
	}

	@Override
	public String toString() {
		return "{generator: " + generator + ", scheduler: " + scheduler + "}";
	}

	static final class GeneratorTask<T> implements Task {

		private final Observer<? super T>                       observer;
		private final Supplier<? extends Iterator<? extends T>> generator;

		private Iterator<? extends T> iterator;

		GeneratorTask(Observer<? super T> observer, Supplier<? extends Iterator<? extends T>> generator) {
			this.observer = observer;
			this.generator = generator;
		}

		@Override
		public TaskStep resume() {
			if (observer.isStopped()) {
				return TaskStep.finished();
			}
			T next;
			try {
				if (iterator == null) {
					iterator = generator.get();
					if (iterator == null) {
						throw new IllegalStateException("The generator returned a null iterator");
					}
				}
				if (!iterator.hasNext()) {
					observer.onCompleted();
					return TaskStep.finished();
				}
				next = iterator.next();
			} catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				observer.onError(t);
				return TaskStep.finished();
			}
			observer.onNext(next);
			return observer.isStopped() ? TaskStep.finished() : TaskStep.proceed();
		}
	}

}
