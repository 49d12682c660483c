/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package retlog.util;

/**
 * Interface to permit the use of a lambda that supplies a result, and also throws a checked exception.
 *
 * @param <T> Type supplied by the supplier; analogous to {@code Supplier<T>}
 * @param <E> Type of the exception thrown
 */
public interface CheckedSupplier<T, E extends Throwable> {

  T get() throws E;
}
