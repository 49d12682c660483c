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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Uninterruptibles;
import org.jetbrains.annotations.NotNull;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

public class RetlogFutures {
  private RetlogFutures() {
  }

  /**
   * When the future completes, hand its value or its failure cause to a callback running on the fiber.
   */
  public static <V> void addCallback(@NotNull ListenableFuture<V> future,
                                     @NotNull Consumer<? super V> onValue,
                                     @NotNull Consumer<Throwable> onFailure,
                                     @NotNull Fiber fiber) {
    future.addListener(() -> {
      V value;
      try {
        value = Uninterruptibles.getUninterruptibly(future);
      } catch (ExecutionException e) {
        onFailure.accept(e.getCause());
        return;
      } catch (RuntimeException e) {
        onFailure.accept(e);
        return;
      }
      onValue.accept(value);
    }, fiber);
  }
}
