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

import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;

import java.util.function.Consumer;

/**
 * FiberSupplier giving each fiber its own daemon thread, with an {@link ExceptionHandlingBatchExecutor}
 * routing task exceptions to the caller's handler.
 */
public class ThreadFiberSupplier implements FiberSupplier {
  @Override
  public Fiber getNewFiber(String name, Consumer<Throwable> throwableHandler) {
    return new ThreadFiber(
        new RunnableExecutorImpl(new ExceptionHandlingBatchExecutor(throwableHandler)),
        name,
        true);
  }
}
