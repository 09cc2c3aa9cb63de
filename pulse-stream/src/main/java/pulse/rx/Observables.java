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
package pulse.rx;

import org.reactivestreams.Publisher;
import pulse.core.support.Assert;
import pulse.fn.BiFunction;
import pulse.fn.Function;
import pulse.fn.Supplier;
import pulse.fn.tuple.Tuple;
import pulse.fn.tuple.Tuple2;
import pulse.rx.scheduler.Scheduler;
import pulse.rx.stream.ArrayObservable;
import pulse.rx.stream.DeferredObservable;
import pulse.rx.stream.EmptyObservable;
import pulse.rx.stream.ErrorObservable;
import pulse.rx.stream.GeneratorObservable;
import pulse.rx.stream.IterableObservable;
import pulse.rx.stream.NeverObservable;
import pulse.rx.stream.ObservableAmb;
import pulse.rx.stream.ObservableCombineLatest;
import pulse.rx.stream.ObservableConcat;
import pulse.rx.stream.ObservableFlatten;
import pulse.rx.stream.ObservableZip;
import pulse.rx.stream.ProducerObservable;
import pulse.rx.stream.PublisherObservable;
import pulse.rx.stream.RangeObservable;
import pulse.rx.stream.ReplicateObservable;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A public factory to build {@link Observable}.
 * <p>
 * Every source is cold: subscribing runs it again for the new observer. Sources emitting from a loop stop as soon
 * as their observer reports {@link Observer#isStopped()}.
 */
public final class Observables {

	private Observables() {
	}

	/**
	 * Build an {@link Observable} from a producer run for each observer. The producer may emit synchronously or
	 * keep the observer for later, and returns a {@link Subscription} releasing its resources, or {@code null}.
	 * A producer that throws terminates the observer with its failure.
	 *
	 * @param producer the subscription logic
	 * @param <T>      the type of values produced
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> create(@Nonnull Function<Observer<? super T>, Subscription> producer) {
		return new ProducerObservable<T>(producer);
	}

	/**
	 * @param <T> the type of values, never produced
	 * @return an {@link Observable} completing immediately
	 */
	public static <T> Observable<T> empty() {
		return EmptyObservable.instance();
	}

	/**
	 * @param <T> the type of values, never produced
	 * @return an {@link Observable} that never signals
	 */
	public static <T> Observable<T> never() {
		return NeverObservable.instance();
	}

	/**
	 * @param error the failure to signal
	 * @param <T>   the type of values, never produced
	 * @return an {@link Observable} failing immediately
	 */
	public static <T> Observable<T> error(@Nonnull Throwable error) {
		return new ErrorObservable<T>(error);
	}

	/**
	 * @param message the message of the {@link IllegalStateException} signalled
	 * @param <T>     the type of values, never produced
	 * @return an {@link Observable} failing immediately
	 */
	public static <T> Observable<T> error(String message) {
		return error(new IllegalStateException(message));
	}

	/**
	 * @param values the values to emit, {@code null} allowed
	 * @param <T>    the type of values
	 * @return an {@link Observable} emitting each value then completing
	 */
	@SafeVarargs
	public static <T> Observable<T> of(T... values) {
		return new ArrayObservable<T>(values);
	}

	/**
	 * @param stop the last value
	 * @return an {@link Observable} emitting 1 to {@code stop} inclusive
	 */
	public static Observable<Integer> fromRange(int stop) {
		return fromRange(1, stop, 1);
	}

	/**
	 * @param start the first value
	 * @param stop  the last value
	 * @return an {@link Observable} emitting {@code start} to {@code stop} inclusive
	 */
	public static Observable<Integer> fromRange(int start, int stop) {
		return fromRange(start, stop, 1);
	}

	/**
	 * Emit {@code start}, {@code start + step}, ... as long as {@code stop} is not passed. A negative step counts
	 * down.
	 *
	 * @param start the first value
	 * @param stop  the inclusive bound
	 * @param step  the increment, not 0
	 * @return a new {@link Observable}
	 */
	public static Observable<Integer> fromRange(int start, int stop, int step) {
		return new RangeObservable(start, stop, step);
	}

	/**
	 * @param values the values to emit
	 * @param <T>    the type of values
	 * @return an {@link Observable} emitting each element then completing
	 */
	public static <T> Observable<T> fromIterable(@Nonnull Iterable<? extends T> values) {
		return new IterableObservable<Iterable<? extends T>, T>(values,
				new Function<Iterable<? extends T>, Iterator<? extends T>>() {
					@Override
					public Iterator<? extends T> apply(Iterable<? extends T> it) {
						return it.iterator();
					}
				});
	}

	/**
	 * Emit the elements produced by a caller-supplied traversal of {@code source}.
	 *
	 * @param source    the object to traverse
	 * @param traversal produces a fresh iterator over the source, for each observer
	 * @param <S>       the type of the traversed object
	 * @param <T>       the type of values
	 * @return a new {@link Observable}
	 */
	public static <S, T> Observable<T> fromIterable(@Nonnull S source,
	                                                @Nonnull Function<? super S, ? extends Iterator<? extends T>>
			                                                traversal) {
		return new IterableObservable<S, T>(source, traversal);
	}

	/**
	 * @param map the entries to emit
	 * @param <K> the type of keys
	 * @param <V> the type of values
	 * @return an {@link Observable} emitting the values of the map
	 */
	public static <K, V> Observable<V> fromMap(@Nonnull Map<K, V> map) {
		Assert.notNull(map, "map");
		return fromIterable(map.values());
	}

	/**
	 * @param map         the entries to emit
	 * @param includeKeys whether the key of each value is emitted along with it
	 * @param <K>         the type of keys
	 * @param <V>         the type of values
	 * @return an {@link Observable} emitting {@code (value, key)} pairs, the key being {@code null} unless requested
	 */
	public static <K, V> Observable<Tuple2<V, K>> fromMap(@Nonnull Map<K, V> map, final boolean includeKeys) {
		return fromIterable(map, new Function<Map<K, V>, Iterator<Tuple2<V, K>>>() {
			@Override
			public Iterator<Tuple2<V, K>> apply(Map<K, V> m) {
				final Iterator<Map.Entry<K, V>> entries = m.entrySet().iterator();
				return new Iterator<Tuple2<V, K>>() {
					@Override
					public boolean hasNext() {
						return entries.hasNext();
					}

					@Override
					public Tuple2<V, K> next() {
						Map.Entry<K, V> entry = entries.next();
						return Tuple.of(entry.getValue(), includeKeys ? entry.getKey() : null);
					}
				};
			}
		});
	}

	/**
	 * Pull one value from the iterator at each resumption of a task driven by the scheduler. The iterator is
	 * shared: every observer continues where the previous one stopped.
	 *
	 * @param generator the values to pull
	 * @param scheduler drives the pulls
	 * @param <T>       the type of values
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> fromGenerator(@Nonnull final Iterator<? extends T> generator,
	                                              @Nonnull Scheduler scheduler) {
		Assert.notNull(generator, "generator");
		return fromGenerator(new Supplier<Iterator<? extends T>>() {
			@Override
			public Iterator<? extends T> get() {
				return generator;
			}
		}, scheduler);
	}

	/**
	 * Pull one value at each resumption of a task driven by the scheduler, from an iterator created for each
	 * observer.
	 *
	 * @param generator creates the iterator of each observer
	 * @param scheduler drives the pulls
	 * @param <T>       the type of values
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> fromGenerator(@Nonnull Supplier<? extends Iterator<? extends T>> generator,
	                                              @Nonnull Scheduler scheduler) {
		return new GeneratorObservable<T>(generator, scheduler);
	}

	/**
	 * @param factory creates the source of each observer
	 * @param <T>     the type of values
	 * @return an {@link Observable} delegating to a source created at subscription time
	 */
	public static <T> Observable<T> defer(@Nonnull Supplier<? extends StreamSource<? extends T>> factory) {
		return new DeferredObservable<T>(factory);
	}

	/**
	 * @param value the value to repeat
	 * @param <T>   the type of the value
	 * @return an {@link Observable} emitting the value until its observer stops
	 */
	public static <T> Observable<T> replicate(T value) {
		return new ReplicateObservable<T>(value, -1L);
	}

	/**
	 * @param value the value to repeat
	 * @param count the number of emissions
	 * @param <T>   the type of the value
	 * @return an {@link Observable} emitting the value {@code count} times then completing
	 */
	public static <T> Observable<T> replicate(T value, long count) {
		Assert.isTrue(count >= 0, "count >= 0 required but it was " + count);
		return new ReplicateObservable<T>(value, count);
	}

	/**
	 * @param publisher a Reactive Streams publisher
	 * @param <T>       the type of values
	 * @return an {@link Observable} requesting unbounded demand from the publisher
	 */
	public static <T> Observable<T> fromPublisher(@Nonnull Publisher<? extends T> publisher) {
		return new PublisherObservable<T>(publisher);
	}

	/**
	 * @param sources the sources to merge
	 * @param <T>     the type of values
	 * @return an {@link Observable} interleaving the values of every source, completing once all have completed
	 */
	@SafeVarargs
	public static <T> Observable<T> merge(@Nonnull StreamSource<? extends T>... sources) {
		Assert.notNull(sources, "sources");
		return merge(Arrays.asList(sources));
	}

	/**
	 * @param sources the sources to merge
	 * @param <T>     the type of values
	 * @return an {@link Observable} interleaving the values of every source, completing once all have completed
	 */
	public static <T> Observable<T> merge(@Nonnull List<? extends StreamSource<? extends T>> sources) {
		Assert.notNull(sources, "sources");
		for (StreamSource<? extends T> source : sources) {
			Assert.notNull(source, "Sources cannot be null");
		}
		List<StreamSource<? extends T>> copy = new ArrayList<StreamSource<? extends T>>(sources);
		return new ObservableFlatten<T>(fromIterable(copy));
	}

	/**
	 * @param sources the sources to concatenate
	 * @param <T>     the type of values
	 * @return an {@link Observable} emitting the values of each source in turn
	 */
	@SafeVarargs
	public static <T> Observable<T> concat(@Nonnull StreamSource<? extends T>... sources) {
		Assert.notNull(sources, "sources");
		return concat(Arrays.asList(sources));
	}

	/**
	 * @param sources the sources to concatenate
	 * @param <T>     the type of values
	 * @return an {@link Observable} emitting the values of each source in turn
	 */
	public static <T> Observable<T> concat(@Nonnull List<? extends StreamSource<? extends T>> sources) {
		return new ObservableConcat<T>(sources);
	}

	/**
	 * @param sources the competing sources
	 * @param <T>     the type of values
	 * @return an {@link Observable} mirroring the first source to signal
	 */
	@SafeVarargs
	public static <T> Observable<T> amb(@Nonnull StreamSource<? extends T>... sources) {
		Assert.notNull(sources, "sources");
		return amb(Arrays.asList(sources));
	}

	/**
	 * @param sources the competing sources
	 * @param <T>     the type of values
	 * @return an {@link Observable} mirroring the first source to signal
	 */
	public static <T> Observable<T> amb(@Nonnull List<? extends StreamSource<? extends T>> sources) {
		return new ObservableAmb<T>(sources);
	}

	/**
	 * @param source1 the first source
	 * @param source2 the second source
	 * @param <T1>    the type of values of the first source
	 * @param <T2>    the type of values of the second source
	 * @return an {@link Observable} pairing the n-th values of both sources
	 */
	@SuppressWarnings("unchecked")
	public static <T1, T2> Observable<Tuple2<T1, T2>> zip(@Nonnull StreamSource<? extends T1> source1,
	                                                      @Nonnull StreamSource<? extends T2> source2) {
		return zip(Arrays.<StreamSource<?>>asList(source1, source2), new Function<Object[], Tuple2<T1, T2>>() {
			@Override
			public Tuple2<T1, T2> apply(Object[] values) {
				return Tuple.of((T1) values[0], (T2) values[1]);
			}
		});
	}

	/**
	 * @param sources the sources to zip
	 * @return an {@link Observable} emitting a {@link Tuple} of the n-th values of every source
	 */
	public static Observable<Tuple> zip(@Nonnull List<? extends StreamSource<?>> sources) {
		return zip(sources, TUPLE_COMBINATOR);
	}

	/**
	 * @param sources    the sources to zip
	 * @param combinator builds the emitted value from the n-th values, in source order
	 * @param <R>        the type of combined values
	 * @return an {@link Observable} combining the n-th values of every source
	 */
	public static <R> Observable<R> zip(@Nonnull List<? extends StreamSource<?>> sources,
	                                    @Nonnull Function<Object[], ? extends R> combinator) {
		return new ObservableZip<R>(sources, combinator);
	}

	/**
	 * @param source1    the first source
	 * @param source2    the second source
	 * @param combinator builds the emitted value from the latest pair
	 * @param <T1>       the type of values of the first source
	 * @param <T2>       the type of values of the second source
	 * @param <R>        the type of combined values
	 * @return an {@link Observable} combining the latest values of both sources
	 */
	@SuppressWarnings("unchecked")
	public static <T1, T2, R> Observable<R> combineLatest(@Nonnull StreamSource<? extends T1> source1,
	                                                      @Nonnull StreamSource<? extends T2> source2,
	                                                      @Nonnull final BiFunction<? super T1, ? super T2, ? extends R>
			                                                      combinator) {
		Assert.notNull(combinator, "combinator");
		return combineLatest(Arrays.<StreamSource<?>>asList(source1, source2), new Function<Object[], R>() {
			@Override
			public R apply(Object[] values) {
				return combinator.apply((T1) values[0], (T2) values[1]);
			}
		});
	}

	/**
	 * @param sources the sources to combine
	 * @return an {@link Observable} emitting a {@link Tuple} of the latest value of every source
	 */
	public static Observable<Tuple> combineLatest(@Nonnull List<? extends StreamSource<?>> sources) {
		return combineLatest(sources, TUPLE_COMBINATOR);
	}

	/**
	 * @param sources    the sources to combine
	 * @param combinator builds the emitted value from the latest values, in source order
	 * @param <R>        the type of combined values
	 * @return an {@link Observable} combining the latest values of every source
	 */
	public static <R> Observable<R> combineLatest(@Nonnull List<? extends StreamSource<?>> sources,
	                                              @Nonnull Function<Object[], ? extends R> combinator) {
		return new ObservableCombineLatest<R>(sources, combinator);
	}

	private static final Function<Object[], Tuple> TUPLE_COMBINATOR = new Function<Object[], Tuple>() {
		@Override
		public Tuple apply(Object[] values) {
			return Tuple.from(values);
		}
	};

}
