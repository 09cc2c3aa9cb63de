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
package pulse.fn;

/**
 * A function that takes two arguments and returns a result.
 *
 * @param <T1> the type of the first argument
 * @param <T2> the type of the second argument
 * @param <R>  the type of the result
 */
public interface BiFunction<T1, T2, R> {

	R apply(T1 t1, T2 t2);

}
