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

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Checksum;

/**
 * InputStream decorator which feeds every byte read, and every byte skipped, into a running
 * checksum. The checksum object is passed in on construction. No buffering is done, so the
 * underlying stream's position always corresponds to what has been checksummed.
 */
@SuppressWarnings("NullableProblems")
public class CrcInputStream extends FilterInputStream {
  private static final int SKIP_BUFFER_SIZE = 512;

  private final Checksum crc;

  public CrcInputStream(InputStream inputStream, Checksum crc) {
    super(inputStream);
    this.crc = crc;
  }

  public long getValue() {
    return crc.getValue();
  }

  public void resetChecksum() {
    crc.reset();
  }

  @Override
  public int read() throws IOException {
    int b = super.read();
    if (b >= 0) {
      crc.update(b);
    }
    return b;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    int bytesRead = super.read(b, off, len);
    if (bytesRead > 0) {
      crc.update(b, off, bytesRead);
    }
    return bytesRead;
  }

  /**
   * Skipped bytes still count toward the checksum; they are read and discarded.
   */
  @Override
  public long skip(long n) throws IOException {
    final byte[] discard = new byte[SKIP_BUFFER_SIZE];
    long remaining = n;
    while (remaining > 0) {
      int bytesRead = read(discard, 0, (int) Math.min(discard.length, remaining));
      if (bytesRead < 0) {
        break;
      }
      remaining -= bytesRead;
    }
    return n - remaining;
  }

  @Override
  public boolean markSupported() {
    return false;
  }
}
