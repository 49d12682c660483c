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

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;

import java.util.function.Consumer;

/**
 * Runs a fiber's batch, passing anything a task throws to a handler on the same thread and
 * carrying on with the rest of the batch.
 */
public class ExceptionHandlingBatchExecutor implements BatchExecutor {
  private final Consumer<Throwable> onTaskFailure;

  public ExceptionHandlingBatchExecutor(Consumer<Throwable> onTaskFailure) {
    this.onTaskFailure = onTaskFailure;
  }

  @Override
  public void execute(EventReader batch) {
    int size = batch.size();
    for (int i = 0; i < size; i++) {
      Runnable task = batch.get(i);
      try {
        task.run();
      } catch (Throwable t) {
        onTaskFailure.accept(t);
      }
    }
  }
}
