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

package retlog.interfaces.log;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only cursor over entries in sequence order. It holds resources, such as open files or
 * pinned segments, until closed.
 */
public interface SequentialEntryIterator<E extends SequentialEntry> extends Closeable {
  boolean hasNext() throws IOException;

  E next() throws IOException;
}
