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

package retlog.log;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;
import static retlog.log.LogPersistenceService.BytePersistence;
import static retlog.log.LogPersistenceService.PersistenceReader;

/**
 * One segment file. Writes always go to the current end of the file; each reader gets its own
 * channel, so readers never disturb the writer's position or each other.
 */
public class FilePersistence implements BytePersistence {
  private final Path path;
  private final FileChannel writeChannel;
  private long end;

  public FilePersistence(Path path) throws IOException {
    this.path = path;
    this.writeChannel = FileChannel.open(path, CREATE, WRITE);
    this.end = writeChannel.size();
  }

  @Override
  public boolean isEmpty() {
    return end == 0;
  }

  @Override
  public long size() {
    return end;
  }

  @Override
  public void append(ByteBuffer[] buffers) throws IOException {
    for (ByteBuffer buffer : buffers) {
      while (buffer.hasRemaining()) {
        end += writeChannel.write(buffer, end);
      }
    }
  }

  @Override
  public PersistenceReader getReader() throws IOException {
    final FileChannel readChannel = FileChannel.open(path, READ);
    return new PersistenceReader() {
      @Override
      public long position() throws IOException {
        return readChannel.position();
      }

      @Override
      public void position(long newPos) throws IOException {
        readChannel.position(newPos);
      }

      @Override
      public int read(ByteBuffer dst) throws IOException {
        return readChannel.read(dst);
      }

      @Override
      public boolean isOpen() {
        return readChannel.isOpen();
      }

      @Override
      public void close() throws IOException {
        readChannel.close();
      }
    };
  }

  /**
   * Cut the file back to the given size, e.g. to drop a torn trailing record.
   */
  @Override
  public void truncate(long size) throws IOException {
    if (size > end) {
      throw new IllegalArgumentException("Cannot truncate " + path + " to " + size + ": it is only " + end + " bytes");
    }
    writeChannel.truncate(size);
    end = size;
  }

  @Override
  public void sync() throws IOException {
    writeChannel.force(true);
  }

  @Override
  public void close() throws IOException {
    writeChannel.close();
  }

  @Override
  public String toString() {
    return "FilePersistence{" + path + ", " + end + " bytes}";
  }
}
