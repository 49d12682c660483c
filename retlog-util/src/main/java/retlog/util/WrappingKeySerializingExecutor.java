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
import com.google.common.util.concurrent.SettableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * KeySerializingExecutor that keeps one queue per key and hands the head of each queue to a wrapped
 * ExecutorService. When a task finishes, the next task for the same key (if any) is handed over.
 * <p>
 * All queue bookkeeping happens under the instance monitor; task bodies never run while it is held.
 */
public class WrappingKeySerializingExecutor implements KeySerializingExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(WrappingKeySerializingExecutor.class);

  private final ExecutorService executorService;
  private final Map<String, ArrayDeque<Runnable>> keyQueues = new HashMap<>();
  private boolean shutdown = false;

  public WrappingKeySerializingExecutor(ExecutorService executorService) {
    this.executorService = executorService;
  }

  @Override
  public <T> ListenableFuture<T> submit(String key, CheckedSupplier<T, Exception> task) {
    final SettableFuture<T> result = SettableFuture.create();
    final Runnable runner = () -> {
      try {
        result.set(task.get());
      } catch (Throwable t) {
        LOG.error("Error executing task for key {}", key, t);
        result.setException(t);
      } finally {
        taskFinished(key);
      }
    };

    final boolean runNow;
    synchronized (this) {
      if (shutdown) {
        throw new RejectedExecutionException("WrappingKeySerializingExecutor already shut down");
      }
      ArrayDeque<Runnable> queue = keyQueues.computeIfAbsent(key, k -> new ArrayDeque<>());
      runNow = queue.isEmpty();
      queue.addLast(runner);
    }

    if (runNow) {
      executorService.execute(runner);
    }
    return result;
  }

  @Override
  public synchronized int pendingTasks(String key) {
    ArrayDeque<Runnable> queue = keyQueues.get(key);
    return queue == null ? 0 : queue.size();
  }

  @Override
  public void shutdownAndAwaitTermination(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);

    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;

      while (!keyQueues.isEmpty()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          throw new TimeoutException("WrappingKeySerializingExecutor#shutdownAndAwaitTermination");
        }
        TimeUnit.NANOSECONDS.timedWait(this, remaining);
      }
    }

    executorService.shutdown();
    if (!executorService.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
      throw new TimeoutException("WrappingKeySerializingExecutor#shutdownAndAwaitTermination");
    }
  }

  private void taskFinished(String key) {
    final Runnable next;
    synchronized (this) {
      ArrayDeque<Runnable> queue = keyQueues.get(key);
      queue.removeFirst();
      next = queue.peekFirst();
      if (next == null) {
        keyQueues.remove(key);
        notifyAll();
      }
    }

    if (next != null) {
      executorService.execute(next);
    }
  }
}
