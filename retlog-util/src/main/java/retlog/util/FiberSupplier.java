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

import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Source of Jetlang fibers. Components that own a fiber (streaming sessions, the maintenance
 * scheduler) take one of these rather than constructing fibers themselves, so tests can decide
 * how fibers are threaded and how their exceptions are reported.
 */
public interface FiberSupplier {
  /**
   * Create a new, unstarted fiber.
   *
   * @param name             Name for the fiber's thread, for diagnostics.
   * @param throwableHandler Receives any exception thrown by a task executing on the fiber.
   */
  Fiber getNewFiber(String name, Consumer<Throwable> throwableHandler);
}
