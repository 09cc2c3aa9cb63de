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

import pulse.core.support.Assert;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

/**
 * Emit the most recent value of the source each time the sampler emits, if the source has produced any value.
 * The same value may be emitted several times. Completion of the source is ignored; completion of the sampler
 * completes the sequence. Errors of either are forwarded.
 *
 * @since 1.0
 */
public final class ObservableSample<T> extends ObservableBarrier<T, T> {

	private final StreamSource<?> sampler;

	public ObservableSample(StreamSource<? extends T> source, StreamSource<?> sampler) {
		super(source);
		this.sampler = Assert.notNull(sampler, "sampler");
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		SampleBarrier<T> barrier = new SampleBarrier<T>(observer);
		barrier.setUpstream(source.subscribe(barrier));
		barrier.start(sampler);
		return barrier;
	}

	@Override
	protected ObserverBarrier<T, T> apply(Observer<? super T> observer) {
		return new SampleBarrier<T>(observer);
	}

	static final class SampleBarrier<T> extends ObserverBarrier<T, T> {

		private T       latest;
		private boolean hasValue;

		SampleBarrier(Observer<? super T> subscriber) {
			super(subscriber);
		}

		void start(StreamSource<?> sampler) {
			if (!isStopped()) {
				own(sampler.subscribe(new SamplerObserver()));
			}
		}

		@Override
		protected void doNext(T value) {
			latest = value;
			hasValue = true;
		}

		@Override
		protected void doComplete() {
			// the sampler decides when the sequence ends
		}

		void sample() {
			if (hasValue) {
				emitNext(latest);
			}
		}

		final class SamplerObserver implements Observer<Object> {

			@Override
			public void onNext(Object value) {
				if (isStopped()) {
					return;
				}
				try {
					sample();
				} catch (Throwable t) {
					fail(t);
				}
			}

			@Override
			public void onError(Throwable error) {
				SampleBarrier.this.onError(error);
			}

			@Override
			public void onCompleted() {
				if (!isStopped()) {
					emitComplete();
				}
			}

			@Override
			public boolean isStopped() {
				return SampleBarrier.this.isStopped();
			}
		}
	}
}
