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
import pulse.fn.BiPredicate;
import pulse.fn.Consumer;
import pulse.fn.Function;
import pulse.fn.Functions;
import pulse.fn.Predicate;
import pulse.fn.Supplier;
import pulse.fn.tuple.Tuple;
import pulse.fn.tuple.Tuple2;
import pulse.rx.observer.CallbackObserver;
import pulse.rx.scheduler.Scheduler;
import pulse.rx.stream.ArrayObservable;
import pulse.rx.stream.ObservableAll;
import pulse.rx.stream.ObservableAny;
import pulse.rx.stream.ObservableBuffer;
import pulse.rx.stream.ObservableCatch;
import pulse.rx.stream.ObservableDebounce;
import pulse.rx.stream.ObservableDefaultIfEmpty;
import pulse.rx.stream.ObservableDelay;
import pulse.rx.stream.ObservableDistinct;
import pulse.rx.stream.ObservableDistinctUntilChanged;
import pulse.rx.stream.ObservableElementAt;
import pulse.rx.stream.ObservableFilter;
import pulse.rx.stream.ObservableFlatten;
import pulse.rx.stream.ObservableLast;
import pulse.rx.stream.ObservableLog;
import pulse.rx.stream.ObservableMap;
import pulse.rx.stream.ObservablePluck;
import pulse.rx.stream.ObservablePublisher;
import pulse.rx.stream.ObservableReduce;
import pulse.rx.stream.ObservableRetry;
import pulse.rx.stream.ObservableSample;
import pulse.rx.stream.ObservableScan;
import pulse.rx.stream.ObservableSkip;
import pulse.rx.stream.ObservableSkipLast;
import pulse.rx.stream.ObservableSkipUntil;
import pulse.rx.stream.ObservableSkipWhile;
import pulse.rx.stream.ObservableSwitch;
import pulse.rx.stream.ObservableTake;
import pulse.rx.stream.ObservableTakeLast;
import pulse.rx.stream.ObservableTakeUntil;
import pulse.rx.stream.ObservableTakeWhile;
import pulse.rx.stream.ObservableTap;
import pulse.rx.stream.ObservableUnwrap;
import pulse.rx.stream.ObservableWindow;
import pulse.rx.stream.ObservableWithLatestFrom;

import javax.annotation.Nonnull;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * A push-based sequence of values: any number of {@code onNext} signals followed by at most one {@code onError} or
 * {@code onCompleted}, delivered to each subscribed {@link Observer}.
 * <p>
 * Every operator returns a new {@link Observable} and leaves this one untouched. Subscribing runs the producer
 * synchronously; operators keep per-subscription state, so one chain can be subscribed any number of times.
 * Built-in sources check {@link Observer#isStopped()} between emissions, so {@code replicate(x).take(3)}
 * terminates.
 *
 * @param <T> the type of values in the sequence
 */
public abstract class Observable<T> implements StreamSource<T> {

	protected Observable() {
	}

	/**
	 * Attach an {@link Observer}. The observer is used as is, which makes it possible to subscribe a
	 * {@link pulse.rx.subject.Subject}.
	 *
	 * @param observer the observer to notify
	 * @return a {@link Subscription} detaching the observer, never {@code null}
	 */
	@Override
	public abstract Subscription subscribe(Observer<? super T> observer);

	/**
	 * Subscribe and ignore every value. An error is rethrown as an
	 * {@link pulse.core.error.Exceptions.ErrorCallbackNotImplemented} to the emitter.
	 *
	 * @return a {@link Subscription} detaching the new observer
	 */
	public final Subscription subscribe() {
		return subscribe(null, null, null);
	}

	/**
	 * @param onNext called for every value
	 * @return a {@link Subscription} detaching the new observer
	 */
	public final Subscription subscribe(Consumer<? super T> onNext) {
		return subscribe(onNext, null, null);
	}

	/**
	 * @param onNext  called for every value
	 * @param onError called on error
	 * @return a {@link Subscription} detaching the new observer
	 */
	public final Subscription subscribe(Consumer<? super T> onNext, Consumer<? super Throwable> onError) {
		return subscribe(onNext, onError, null);
	}

	/**
	 * Subscribe a {@link CallbackObserver} built from the given callbacks, any of which may be {@code null}.
	 *
	 * @param onNext      called for every value
	 * @param onError     called on error
	 * @param onCompleted called on completion
	 * @return a {@link Subscription} detaching the new observer
	 */
	public final Subscription subscribe(Consumer<? super T> onNext,
	                                    Consumer<? super Throwable> onError,
	                                    Runnable onCompleted) {
		CallbackObserver<T> observer = new CallbackObserver<T>(onNext, onError, onCompleted);
		observer.setUpstream(subscribe(observer));
		return observer;
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Transformation                                                                                              */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Transform every value with the given function.
	 *
	 * @param fn  the transformation
	 * @param <V> the type of transformed values
	 * @return {@literal new Observable}
	 */
	public final <V> Observable<V> map(@Nonnull final Function<? super T, ? extends V> fn) {
		return new ObservableMap<T, V>(this, fn);
	}

	/**
	 * Cast every value to the given type, failing the sequence with a {@link ClassCastException} otherwise.
	 *
	 * @param type the target type
	 * @param <V>  the target type
	 * @return {@literal new Observable}
	 */
	public final <V> Observable<V> cast(@Nonnull final Class<V> type) {
		Assert.notNull(type, "type");
		return map(new Function<T, V>() {
			@Override
			public V apply(T t) {
				return type.cast(t);
			}
		});
	}

	/**
	 * Emit every intermediate accumulation, starting with the first value.
	 *
	 * @param accumulator combines the accumulation so far with the next value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> scan(@Nonnull final BiFunction<T, ? super T, T> accumulator) {
		return ObservableScan.unseeded(this, accumulator);
	}

	/**
	 * Emit every intermediate accumulation, starting from {@code seed}. The seed itself is not emitted.
	 *
	 * @param seed        the initial accumulation
	 * @param accumulator combines the accumulation so far with the next value
	 * @param <A>         the type of the accumulation
	 * @return {@literal new Observable}
	 */
	public final <A> Observable<A> scan(A seed, @Nonnull final BiFunction<A, ? super T, A> accumulator) {
		return new ObservableScan<T, A>(this, seed, accumulator);
	}

	/**
	 * Emit the final accumulation of the values on completion, starting with the first value. An empty sequence
	 * completes without value.
	 *
	 * @param accumulator combines the accumulation so far with the next value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> reduce(@Nonnull final BiFunction<T, ? super T, T> accumulator) {
		return ObservableReduce.unseeded(this, accumulator);
	}

	/**
	 * Emit the final accumulation of the values on completion, starting from {@code seed}. An empty sequence emits
	 * the seed.
	 *
	 * @param seed        the initial accumulation
	 * @param accumulator combines the accumulation so far with the next value
	 * @param <A>         the type of the accumulation
	 * @return {@literal new Observable}
	 */
	public final <A> Observable<A> reduce(A seed, @Nonnull final BiFunction<A, ? super T, A> accumulator) {
		return new ObservableReduce<T, A>(this, seed, accumulator);
	}

	/**
	 * Extract a nested property of every value. Each key is a {@link java.util.Map} key, or an {@link Integer}
	 * index into a {@link List}, a {@link Tuple} or an array.
	 *
	 * @param keys the path to the property
	 * @param <V>  the type of the property
	 * @return {@literal new Observable}
	 */
	public final <V> Observable<V> pluck(@Nonnull Object... keys) {
		return new ObservablePluck<T, V>(this, keys);
	}

	/**
	 * Turn every value into a {@link Tuple}: arrays and iterables are spread into the tuple, tuples are kept and
	 * any other value becomes a tuple of one.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<Tuple> pack() {
		return map(new Function<T, Tuple>() {
			@Override
			public Tuple apply(T t) {
				if (t instanceof Tuple) {
					return (Tuple) t;
				}
				return Tuple.from(elements(t));
			}
		});
	}

	/**
	 * Turn every {@link Tuple}, iterable or array value into the list of its elements. Any other value becomes a
	 * list of one.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<List<Object>> unpack() {
		return map(new Function<T, List<Object>>() {
			@Override
			public List<Object> apply(T t) {
				return Arrays.asList(elements(t));
			}
		});
	}

	/**
	 * Emit the elements of {@link Tuple}, iterable and array values one by one.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<Object> unwrap() {
		return new ObservableUnwrap<T>(this);
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Filtering                                                                                                   */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Forward the values matching the predicate.
	 *
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> filter(@Nonnull final Predicate<? super T> predicate) {
		return new ObservableFilter<T>(this, predicate);
	}

	/**
	 * Forward the values failing the predicate.
	 *
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> reject(@Nonnull final Predicate<? super T> predicate) {
		Assert.notNull(predicate, "predicate");
		return filter(Functions.<T>not(predicate));
	}

	/**
	 * Drop {@code null} and {@link Boolean#FALSE} values.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> compact() {
		return filter(new Predicate<T>() {
			@Override
			public boolean test(T t) {
				return t != null && !Boolean.FALSE.equals(t);
			}
		});
	}

	/**
	 * @return {@literal new Observable} without the values already seen
	 */
	public final Observable<T> distinct() {
		return new ObservableDistinct<T>(this);
	}

	/**
	 * @return {@literal new Observable} without the values equal to their predecessor
	 */
	public final Observable<T> distinctUntilChanged() {
		return distinctUntilChanged(Functions.<T>equality());
	}

	/**
	 * @param comparator decides whether a value is equal to its predecessor
	 * @return {@literal new Observable} without the values equal to their predecessor
	 */
	public final Observable<T> distinctUntilChanged(@Nonnull BiPredicate<? super T, ? super T> comparator) {
		return new ObservableDistinctUntilChanged<T>(this, comparator);
	}

	/**
	 * Emit the first value matching the predicate, then complete.
	 *
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> find(@Nonnull Predicate<? super T> predicate) {
		return filter(predicate).first();
	}

	/**
	 * @return {@literal new Observable} emitting the first value, if any, then completing
	 */
	public final Observable<T> first() {
		return take(1);
	}

	/**
	 * @return {@literal new Observable} emitting the last value, if any, on completion
	 */
	public final Observable<T> last() {
		return new ObservableLast<T>(this);
	}

	/**
	 * Emit the value at the given zero-based position, then complete. A shorter sequence completes without value.
	 *
	 * @param index the position, starting at 0
	 * @return {@literal new Observable}
	 */
	public final Observable<T> elementAt(long index) {
		return new ObservableElementAt<T>(this, index);
	}

	/**
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable} completing on the first value failing the predicate
	 */
	public final Observable<T> takeWhile(@Nonnull Predicate<? super T> predicate) {
		return new ObservableTakeWhile<T>(this, predicate);
	}

	/**
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable} dropping values until one fails the predicate
	 */
	public final Observable<T> skipWhile(@Nonnull Predicate<? super T> predicate) {
		return new ObservableSkipWhile<T>(this, predicate);
	}

	/**
	 * Forward the first {@code n} values, then complete. A non-positive {@code n} completes immediately.
	 *
	 * @param n the number of values to take
	 * @return {@literal new Observable}
	 */
	public final Observable<T> take(long n) {
		return new ObservableTake<T>(this, n);
	}

	/**
	 * @param n the number of values to drop
	 * @return {@literal new Observable} dropping the first {@code n} values
	 */
	public final Observable<T> skip(long n) {
		return new ObservableSkip<T>(this, n);
	}

	/**
	 * @param n the number of values to keep
	 * @return {@literal new Observable} emitting the last {@code n} values on completion
	 */
	public final Observable<T> takeLast(int n) {
		return new ObservableTakeLast<T>(this, n);
	}

	/**
	 * @param n the number of values to drop
	 * @return {@literal new Observable} dropping the last {@code n} values
	 */
	public final Observable<T> skipLast(int n) {
		return new ObservableSkipLast<T>(this, n);
	}

	/**
	 * Forward values until {@code other} signals anything, then complete.
	 *
	 * @param other the source ending the sequence
	 * @return {@literal new Observable}
	 */
	public final Observable<T> takeUntil(@Nonnull StreamSource<?> other) {
		return new ObservableTakeUntil<T>(this, other);
	}

	/**
	 * Drop values until {@code other} signals anything.
	 *
	 * @param other the source opening the sequence
	 * @return {@literal new Observable}
	 */
	public final Observable<T> skipUntil(@Nonnull StreamSource<?> other) {
		return new ObservableSkipUntil<T>(this, other);
	}

	/**
	 * Split the sequence in two: the values matching the predicate and the others. Each side subscribes to this
	 * observable on its own.
	 *
	 * @param predicate the test applied to every value
	 * @return the accepted and rejected sequences
	 */
	public final Tuple2<Observable<T>, Observable<T>> partition(@Nonnull Predicate<? super T> predicate) {
		return Tuple.of(filter(predicate), reject(predicate));
	}

	/**
	 * @return {@literal new Observable} forwarding only the terminal signal
	 */
	public final Observable<T> ignoreElements() {
		return filter(new Predicate<T>() {
			@Override
			public boolean test(T t) {
				return false;
			}
		});
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Aggregation                                                                                                 */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * @return {@literal new Observable} emitting the number of values on completion
	 */
	public final Observable<Long> count() {
		return reduce(0L, new BiFunction<Long, T, Long>() {
			@Override
			public Long apply(Long acc, T t) {
				return acc + 1L;
			}
		});
	}

	/**
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable} emitting the number of values matching the predicate on completion
	 */
	public final Observable<Long> count(@Nonnull Predicate<? super T> predicate) {
		return filter(predicate).count();
	}

	/**
	 * Sum {@link Number} values as doubles. An empty sequence sums to 0.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<Double> sum() {
		return reduce(0d, new BiFunction<Double, T, Double>() {
			@Override
			public Double apply(Double acc, T t) {
				return acc + ((Number) t).doubleValue();
			}
		});
	}

	/**
	 * Average {@link Number} values as doubles. An empty sequence completes without value.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<Double> average() {
		return reduce(Tuple.of(0d, 0L), new BiFunction<Tuple2<Double, Long>, T, Tuple2<Double, Long>>() {
			@Override
			public Tuple2<Double, Long> apply(Tuple2<Double, Long> acc, T t) {
				return Tuple.of(acc.getT1() + ((Number) t).doubleValue(), acc.getT2() + 1L);
			}
		}).filter(new Predicate<Tuple2<Double, Long>>() {
			@Override
			public boolean test(Tuple2<Double, Long> acc) {
				return acc.getT2() > 0L;
			}
		}).map(new Function<Tuple2<Double, Long>, Double>() {
			@Override
			public Double apply(Tuple2<Double, Long> acc) {
				return acc.getT1() / acc.getT2();
			}
		});
	}

	/**
	 * Smallest value in natural order. Values must be {@link Comparable}.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> min() {
		return min(Observable.<T>naturalOrder());
	}

	/**
	 * @param comparator the ordering
	 * @return {@literal new Observable} emitting the smallest value on completion
	 */
	public final Observable<T> min(@Nonnull final Comparator<? super T> comparator) {
		Assert.notNull(comparator, "comparator");
		return reduce(new BiFunction<T, T, T>() {
			@Override
			public T apply(T acc, T t) {
				return comparator.compare(t, acc) < 0 ? t : acc;
			}
		});
	}

	/**
	 * Largest value in natural order. Values must be {@link Comparable}.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> max() {
		return max(Observable.<T>naturalOrder());
	}

	/**
	 * @param comparator the ordering
	 * @return {@literal new Observable} emitting the largest value on completion
	 */
	public final Observable<T> max(@Nonnull final Comparator<? super T> comparator) {
		Assert.notNull(comparator, "comparator");
		return reduce(new BiFunction<T, T, T>() {
			@Override
			public T apply(T acc, T t) {
				return comparator.compare(t, acc) > 0 ? t : acc;
			}
		});
	}

	/**
	 * Emit {@literal true} if every value matches the predicate. Stops at the first failing value.
	 *
	 * @param predicate the test applied to every value
	 * @return {@literal new Observable}
	 */
	public final Observable<Boolean> all(@Nonnull Predicate<? super T> predicate) {
		return new ObservableAll<T>(this, predicate);
	}

	/**
	 * Emit {@literal true} as soon as a value equals the given one, {@literal false} if none does.
	 *
	 * @param value the value to look for, may be {@code null}
	 * @return {@literal new Observable}
	 */
	public final Observable<Boolean> contains(final Object value) {
		final BiPredicate<Object, Object> equality = Functions.equality();
		return new ObservableAny<T>(this, new Predicate<T>() {
			@Override
			public boolean test(T t) {
				return equality.test(value, t);
			}
		});
	}

	/**
	 * @param defaultValue emitted if the sequence completes without value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> defaultIfEmpty(T defaultValue) {
		return new ObservableDefaultIfEmpty<T>(this, defaultValue);
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Combination                                                                                                 */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Emit the values of this observable, then of each other source in turn.
	 *
	 * @param others the sources to append
	 * @return {@literal new Observable}
	 */
	@SafeVarargs
	public final Observable<T> concat(@Nonnull StreamSource<? extends T>... others) {
		return Observables.concat(prepend(this, others));
	}

	/**
	 * Emit the given values before the values of this observable.
	 *
	 * @param values the values to emit first
	 * @return {@literal new Observable}
	 */
	@SafeVarargs
	public final Observable<T> startWith(T... values) {
		List<StreamSource<? extends T>> sources = new ArrayList<StreamSource<? extends T>>(2);
		sources.add(new ArrayObservable<T>(values));
		sources.add(this);
		return Observables.concat(sources);
	}

	/**
	 * Interleave the values of this observable and the other sources as they come.
	 *
	 * @param others the sources to merge
	 * @return {@literal new Observable}
	 */
	@SafeVarargs
	public final Observable<T> merge(@Nonnull StreamSource<? extends T>... others) {
		return Observables.merge(prepend(this, others));
	}

	/**
	 * Mirror whichever of this observable and the other sources signals first.
	 *
	 * @param others the competing sources
	 * @return {@literal new Observable}
	 */
	@SafeVarargs
	public final Observable<T> amb(@Nonnull StreamSource<? extends T>... others) {
		return Observables.amb(prepend(this, others));
	}

	/**
	 * Combine the latest values of this observable and the other sources into a {@link Tuple}, once each has
	 * emitted.
	 *
	 * @param others the sources to combine with
	 * @return {@literal new Observable}
	 */
	public final Observable<Tuple> combineLatest(@Nonnull StreamSource<?>... others) {
		return Observables.combineLatest(withSelf(others));
	}

	/**
	 * @param other      the source to combine with
	 * @param combinator builds the emitted value from the latest pair
	 * @param <U>        the type of values of the other source
	 * @param <R>        the type of combined values
	 * @return {@literal new Observable}
	 */
	public final <U, R> Observable<R> combineLatest(@Nonnull StreamSource<? extends U> other,
	                                                @Nonnull BiFunction<? super T, ? super U, ? extends R> combinator) {
		return Observables.<T, U, R>combineLatest(this, other, combinator);
	}

	/**
	 * Combine the n-th values of this observable and the other sources into a {@link Tuple}.
	 *
	 * @param others the sources to zip with
	 * @return {@literal new Observable}
	 */
	public final Observable<Tuple> zip(@Nonnull StreamSource<?>... others) {
		return Observables.zip(withSelf(others));
	}

	/**
	 * @param other      the source to zip with
	 * @param combinator builds the emitted value from each pair
	 * @param <U>        the type of values of the other source
	 * @param <R>        the type of combined values
	 * @return {@literal new Observable}
	 */
	public final <U, R> Observable<R> zip(@Nonnull StreamSource<? extends U> other,
	                                      @Nonnull final BiFunction<? super T, ? super U, ? extends R> combinator) {
		Assert.notNull(combinator, "combinator");
		return Observables.<T, U>zip(this, other).map(new Function<Tuple2<T, U>, R>() {
			@Override
			public R apply(Tuple2<T, U> pair) {
				return combinator.apply(pair.getT1(), pair.getT2());
			}
		});
	}

	/**
	 * Emit a {@link Tuple} of every value of this observable followed by the latest value of each other source,
	 * {@code null} for a source that has not emitted yet.
	 *
	 * @param others the sources to sample
	 * @return {@literal new Observable}
	 */
	public final Observable<Tuple> with(@Nonnull StreamSource<?>... others) {
		return new ObservableWithLatestFrom<T>(this, Arrays.asList(others));
	}

	/**
	 * Merge the inner sources emitted by this observable.
	 *
	 * @param <V> the type of values of the inner sources
	 * @return {@literal new Observable}
	 */
	@SuppressWarnings("unchecked")
	public final <V> Observable<V> flatten() {
		return new ObservableFlatten<V>((StreamSource<? extends StreamSource<? extends V>>) this);
	}

	/**
	 * Map every value to a source and merge their values.
	 *
	 * @param fn  the mapping to inner sources
	 * @param <V> the type of values of the inner sources
	 * @return {@literal new Observable}
	 */
	public final <V> Observable<V> flatMap(@Nonnull Function<? super T, ? extends StreamSource<? extends V>> fn) {
		return new ObservableFlatten<V>(map(fn));
	}

	/**
	 * Map every value to a source and mirror the most recent one.
	 *
	 * @param fn  the mapping to inner sources
	 * @param <V> the type of values of the inner sources
	 * @return {@literal new Observable}
	 */
	public final <V> Observable<V> flatMapLatest(@Nonnull Function<? super T, ? extends StreamSource<? extends V>> fn) {
		return new ObservableSwitch<V>(map(fn));
	}

	/**
	 * Mirror the most recent inner source emitted by this observable.
	 *
	 * @param <V> the type of values of the inner sources
	 * @return {@literal new Observable}
	 */
	@SuppressWarnings("unchecked")
	public final <V> Observable<V> switchLatest() {
		return new ObservableSwitch<V>((StreamSource<? extends StreamSource<? extends V>>) this);
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Time and grouping                                                                                          */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Deliver a signal only once {@code time} has passed without another signal of the same kind.
	 *
	 * @param time      the quiet period, in the scheduler's time unit
	 * @param scheduler the scheduler running the delayed signals
	 * @return {@literal new Observable}
	 */
	public final Observable<T> debounce(long time, @Nonnull Scheduler scheduler) {
		return new ObservableDebounce<T>(this, time, scheduler);
	}

	/**
	 * Shift every signal by {@code time}.
	 *
	 * @param time      the delay, in the scheduler's time unit
	 * @param scheduler the scheduler running the delayed signals
	 * @return {@literal new Observable}
	 */
	public final Observable<T> delay(final long time, @Nonnull Scheduler scheduler) {
		return delay(new Supplier<Long>() {
			@Override
			public Long get() {
				return time;
			}
		}, scheduler);
	}

	/**
	 * Shift every signal by a delay computed when the signal arrives.
	 *
	 * @param time      supplies the delay of each signal
	 * @param scheduler the scheduler running the delayed signals
	 * @return {@literal new Observable}
	 */
	public final Observable<T> delay(@Nonnull Supplier<Long> time, @Nonnull Scheduler scheduler) {
		return new ObservableDelay<T>(this, time, scheduler);
	}

	/**
	 * Emit the latest value of this observable each time the sampler emits.
	 *
	 * @param sampler the source deciding when to sample
	 * @return {@literal new Observable}
	 */
	public final Observable<T> sample(@Nonnull StreamSource<?> sampler) {
		return new ObservableSample<T>(this, sampler);
	}

	/**
	 * @param size the number of values per list
	 * @return {@literal new Observable} emitting lists of {@code size} values, the last one possibly shorter
	 */
	public final Observable<List<T>> buffer(int size) {
		return new ObservableBuffer<T>(this, size);
	}

	/**
	 * @param size the number of values per window
	 * @return {@literal new Observable} emitting a sliding window of the last {@code size} values
	 */
	public final Observable<List<T>> window(int size) {
		return new ObservableWindow<T>(this, size);
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Errors and side effects                                                                                     */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Complete instead of failing.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> catchError() {
		return new ObservableCatch<T>(this, null);
	}

	/**
	 * Continue with the given source when this observable fails.
	 *
	 * @param fallback the source to switch to
	 * @return {@literal new Observable}
	 */
	public final Observable<T> catchError(@Nonnull StreamSource<? extends T> fallback) {
		Assert.notNull(fallback, "fallback");
		return catchError(Functions.<Throwable, StreamSource<? extends T>>constant(fallback));
	}

	/**
	 * Continue with the source returned by the handler when this observable fails. A {@code null} source lets the
	 * error through.
	 *
	 * @param handler maps the error to a fallback source
	 * @return {@literal new Observable}
	 */
	public final Observable<T> catchError(@Nonnull Function<? super Throwable, ? extends StreamSource<? extends T>>
			handler) {
		Assert.notNull(handler, "handler");
		return new ObservableCatch<T>(this, handler);
	}

	/**
	 * Resubscribe on every error.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> retry() {
		return retry(Long.MAX_VALUE);
	}

	/**
	 * Resubscribe on error, at most {@code count} times.
	 *
	 * @param count the number of retries
	 * @return {@literal new Observable}
	 */
	public final Observable<T> retry(long count) {
		return new ObservableRetry<T>(this, count);
	}

	/**
	 * @param onNext called before forwarding each value
	 * @return {@literal new Observable}
	 */
	public final Observable<T> tap(@Nonnull Consumer<? super T> onNext) {
		return tap(onNext, null, null);
	}

	/**
	 * Run side effects before forwarding each signal. Any callback may be {@code null}; a failing callback turns
	 * into an error.
	 *
	 * @param onNext      called before forwarding each value
	 * @param onError     called before forwarding an error
	 * @param onCompleted called before forwarding completion
	 * @return {@literal new Observable}
	 */
	public final Observable<T> tap(Consumer<? super T> onNext,
	                               Consumer<? super Throwable> onError,
	                               Runnable onCompleted) {
		return new ObservableTap<T>(this, onNext, onError, onCompleted);
	}

	/**
	 * Log every signal at INFO level, errors at ERROR level, under this class's category.
	 *
	 * @return {@literal new Observable}
	 */
	public final Observable<T> log() {
		return log(null);
	}

	/**
	 * @param category the logger name, or {@code null} for the default one
	 * @return {@literal new Observable} logging every signal
	 */
	public final Observable<T> log(String category) {
		return log(category, ObservableLog.ALL);
	}

	/**
	 * @param category the logger name, or {@code null} for the default one
	 * @param options  the signals to log, a combination of the {@link ObservableLog} flags
	 * @return {@literal new Observable} logging the selected signals
	 */
	public final Observable<T> log(String category, int options) {
		return new ObservableLog<T>(this, category, options);
	}

	/* ---------------------------------------------------------------------------------------------------------- */
	/* Interop                                                                                                     */
	/* ---------------------------------------------------------------------------------------------------------- */

	/**
	 * Expose this observable as a Reactive Streams {@link Publisher} honouring demand by queueing.
	 *
	 * @return {@literal new Publisher}
	 */
	public final Publisher<T> toPublisher() {
		return new ObservablePublisher<T>(this);
	}

	@SuppressWarnings("unchecked")
	private static <T> Comparator<T> naturalOrder() {
		return new Comparator<T>() {
			@Override
			public int compare(T o1, T o2) {
				return ((Comparable<Object>) o1).compareTo(o2);
			}
		};
	}

	private static Object[] elements(Object value) {
		if (value instanceof Tuple) {
			return ((Tuple) value).toArray();
		}
		if (value instanceof Iterable) {
			List<Object> list = new ArrayList<Object>();
			for (Object o : (Iterable<?>) value) {
				list.add(o);
			}
			return list.toArray();
		}
		if (value != null && value.getClass().isArray()) {
			Object[] array = new Object[Array.getLength(value)];
			for (int i = 0; i < array.length; i++) {
				array[i] = Array.get(value, i);
			}
			return array;
		}
		return new Object[]{value};
	}

	private static <T> List<StreamSource<? extends T>> prepend(StreamSource<? extends T> first,
	                                                          StreamSource<? extends T>[] others) {
		Assert.notNull(others, "others");
		List<StreamSource<? extends T>> sources = new ArrayList<StreamSource<? extends T>>(others.length + 1);
		sources.add(first);
		sources.addAll(Arrays.asList(others));
		return sources;
	}

	private List<StreamSource<?>> withSelf(StreamSource<?>[] others) {
		Assert.notNull(others, "others");
		List<StreamSource<?>> sources = new ArrayList<StreamSource<?>>(others.length + 1);
		sources.add(this);
		sources.addAll(Arrays.asList(others));
		return sources;
	}

}
