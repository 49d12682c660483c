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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An executor which accepts tasks each with an associated string key, and guarantees that all
 * tasks associated with a given key run one at a time, in the order they are submitted. Tasks
 * with different keys may run concurrently, bounded only by the underlying thread pool.
 * <p>
 * Maintenance uses this with the shard name as key, so that one shard never has two passes in
 * flight while many shards share a small, fixed pool of threads.
 */
public interface KeySerializingExecutor {
  /**
   * Submit a task for execution.
   *
   * @param key  Key associated with the task; the task will not be executed until all previously-submitted
   *             tasks with the same key have finished execution.
   * @param task A supplier of some result, which may throw an exception.
   * @param <T>  The type of the result produced by the task.
   * @return A future which will produce the result of the task, or else an exception.
   */
  <T> ListenableFuture<T> submit(String key, CheckedSupplier<T, Exception> task);

  /**
   * Number of tasks submitted under the key that have not yet completed.
   */
  int pendingTasks(String key);

  /**
   * Shut down the executor. After calling this method, any call to submit will result in an exception. This
   * method blocks until all previously submitted tasks complete, or until the time limit expires, in which
   * case a TimeoutException is thrown.
   */
  void shutdownAndAwaitTermination(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException;
}
