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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Turns entries into bytes and back. Each encoded entry carries whatever length prefix and
 * checksum it needs to be read back from a stream on its own; a checksum mismatch surfaces as an
 * unchecked exception.
 */
public interface SequentialEntryCodec<E extends SequentialEntry> {
  ByteBuffer[] encode(E entry);

  /**
   * @throws java.io.EOFException if the stream ends partway through an entry.
   */
  E decode(InputStream inputStream) throws IOException;

  /**
   * Read past one entry without materializing it.
   *
   * @return the sequence number of the entry skipped.
   */
  long skipEntryAndReturnSeqNum(InputStream inputStream) throws IOException;
}
