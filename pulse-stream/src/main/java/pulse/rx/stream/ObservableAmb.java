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
import pulse.rx.Observable;
import pulse.rx.Observer;
import pulse.rx.StreamSource;
import pulse.rx.Subscription;
import pulse.rx.observer.ObserverBarrier;

import java.util.List;

/**
 * Mirror the first source to signal anything and unsubscribe from all the others.
 *
 * @since 1.0
 */
public final class ObservableAmb<T> extends Observable<T> {

	private final StreamSource<? extends T>[] sources;

	@SuppressWarnings("unchecked")
	public ObservableAmb(List<? extends StreamSource<? extends T>> sources) {
		Assert.notNull(sources, "sources");
		this.sources = sources.toArray(new StreamSource[sources.size()]);
		for (StreamSource<? extends T> source : this.sources) {
			Assert.notNull(source, "Sources cannot be null");
		}
	}

	@Override
	public Subscription subscribe(Observer<? super T> observer) {
		Assert.notNull(observer, "observer");
		AmbBarrier<T> barrier = new AmbBarrier<T>(observer, sources.length);
		barrier.start(sources);
		return barrier;
	}

	static final class AmbBarrier<T> extends ObserverBarrier<T, T> {

		private final Subscription[] subscriptions;

		private int winner = -1;

		AmbBarrier(Observer<? super T> subscriber, int n) {
			super(subscriber);
			this.subscriptions = new Subscription[n];
		}

		void start(StreamSource<? extends T>[] sources) {
			if (sources.length == 0) {
				onCompleted();
				return;
			}
			for (int i = 0; i < sources.length && winner == -1 && !isStopped(); i++) {
				Subscription s = sources[i].subscribe(new AmbObserver(i));
				if (winner == -1 || winner == i) {
					subscriptions[i] = own(s);
				} else {
					s.unsubscribe();
				}
			}
		}

		boolean win(int index) {
			if (winner == -1) {
				winner = index;
				for (int i = 0; i < subscriptions.length; i++) {
					Subscription s = subscriptions[i];
					if (i != index && s != null) {
						subscriptions[i] = null;
						disown(s);
						s.unsubscribe();
					}
				}
				return true;
			}
			return winner == index;
		}

		final class AmbObserver implements Observer<T> {

			private final int index;

			AmbObserver(int index) {
				this.index = index;
			}

			@Override
			public void onNext(T value) {
				if (win(index)) {
					AmbBarrier.this.onNext(value);
				}
			}

			@Override
			public void onError(Throwable error) {
				if (win(index)) {
					AmbBarrier.this.onError(error);
				}
			}

			@Override
			public void onCompleted() {
				if (win(index)) {
					AmbBarrier.this.onCompleted();
				}
			}

			@Override
			public boolean isStopped() {
				return (winner != -1 && winner != index) || AmbBarrier.this.isStopped();
			}
		}
	}
}
