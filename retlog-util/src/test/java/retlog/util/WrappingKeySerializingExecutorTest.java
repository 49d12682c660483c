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
import com.google.common.util.concurrent.MoreExecutors;
import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static retlog.FutureMatchers.resultsIn;
import static retlog.FutureMatchers.resultsInException;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;

public class WrappingKeySerializingExecutorTest {
  private static final int NUM_TASKS = 20;

  @Rule
  public JUnitRuleMockery context = new JUnitRuleMockery();

  @SuppressWarnings("unchecked")
  private final CheckedSupplier<Integer, Exception> task = context.mock(CheckedSupplier.class);

  private final ExecutorService fixedThreadExecutor = Executors.newFixedThreadPool(3);

  @After
  public void shutdownPool() {
    fixedThreadExecutor.shutdownNow();
  }

  @Test
  public void runsTasksSubmittedToItAndReturnsTheirResult() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(MoreExecutors.newDirectExecutorService());

    context.checking(new Expectations() {{
      oneOf(task).get();
      will(returnValue(3));
    }});

    assertThat(executor.submit("shard-a", task), resultsIn(equalTo(3)));
  }

  @Test
  public void returnsFuturesSetWithTheExceptionsThrownBySubmittedTasks() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(MoreExecutors.newDirectExecutorService());

    context.checking(new Expectations() {{
      oneOf(task).get();
      will(throwException(new ArithmeticException("Expected as part of test")));
    }});

    assertThat(executor.submit("shard-a", task), resultsInException(ArithmeticException.class));
  }

  @Test(timeout = 3000)
  public void executesTasksAllHavingTheSameKeyInSeries() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    final List<Integer> log = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger maxRunning = new AtomicInteger();

    ListenableFuture<Integer> last = null;
    for (int i = 0; i < NUM_TASKS; i++) {
      final int taskNumber = i;
      last = executor.submit("shard-a", () -> {
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        log.add(taskNumber);
        running.decrementAndGet();
        return taskNumber;
      });
    }

    assertThat(last, resultsIn(equalTo(NUM_TASKS - 1)));
    assertThat(log, is(equalTo(ascendingIntegers(NUM_TASKS))));
    assertThat(maxRunning.get(), is(lessThanOrEqualTo(1)));
  }

  @Test(timeout = 3000)
  public void runsTasksForDifferentKeysConcurrently() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    final CountDownLatch bothStarted = new CountDownLatch(2);

    ListenableFuture<Boolean> first = executor.submit("shard-a", () -> {
      bothStarted.countDown();
      return bothStarted.await(2, TimeUnit.SECONDS);
    });
    ListenableFuture<Boolean> second = executor.submit("shard-b", () -> {
      bothStarted.countDown();
      return bothStarted.await(2, TimeUnit.SECONDS);
    });

    assertThat(first, resultsIn(equalTo(true)));
    assertThat(second, resultsIn(equalTo(true)));
  }

  @Test
  public void countsPendingTasksPerKey() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    final CountDownLatch release = new CountDownLatch(1);

    executor.submit("shard-a", () -> release.await(2, TimeUnit.SECONDS));
    ListenableFuture<Integer> queued = executor.submit("shard-a", () -> 1);

    assertThat(executor.pendingTasks("shard-a"), is(equalTo(2)));
    assertThat(executor.pendingTasks("shard-b"), is(equalTo(0)));

    release.countDown();
    assertThat(queued, resultsIn(equalTo(1)));
  }

  @Test(expected = RejectedExecutionException.class)
  public void throwsAnExceptionIfATaskIsSubmittedAfterShutdownIsCalled() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    executor.shutdownAndAwaitTermination(1, TimeUnit.SECONDS);
    executor.submit("shard-a", () -> null);
  }

  @Test
  public void onShutdownCompletesAllTasksThatHadBeenSubmittedPriorToShutdown() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    final List<Integer> log = Collections.synchronizedList(new ArrayList<>());

    for (int i = 0; i < NUM_TASKS; i++) {
      final int taskNumber = i;
      executor.submit("shard-a", () -> log.add(taskNumber));
    }
    executor.shutdownAndAwaitTermination(2, TimeUnit.SECONDS);

    assertThat(log, is(equalTo(ascendingIntegers(NUM_TASKS))));
  }

  @Test
  public void shutsDownIdempotently() throws Exception {
    KeySerializingExecutor executor = new WrappingKeySerializingExecutor(fixedThreadExecutor);
    executor.shutdownAndAwaitTermination(1, TimeUnit.SECONDS);
    executor.shutdownAndAwaitTermination(1, TimeUnit.SECONDS);

    assertThat(fixedThreadExecutor.isShutdown(), is(true));
  }

  private static List<Integer> ascendingIntegers(int howMany) {
    List<Integer> list = new ArrayList<>();
    for (int i = 0; i < howMany; i++) {
      list.add(i);
    }
    return list;
  }
}
