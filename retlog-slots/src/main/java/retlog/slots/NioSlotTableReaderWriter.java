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

package retlog.slots;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import retlog.RetentionConstants;
import retlog.interfaces.slots.RetentionSlot;
import retlog.log.EntryEncodingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static retlog.log.EntryEncodingUtil.decodeAndCheckCrc;
import static retlog.log.EntryEncodingUtil.encodeWithLengthAndCrc;

/**
 * Keeps the slot table in a single CRC-checked file, replaced by writing a temporary file,
 * forcing it, and renaming it over the old one.
 */
public class NioSlotTableReaderWriter implements SlotTablePersistence {
  private static final String TEMPORARY_FILE_SUFFIX = ".tmp";

  private final Path slotDirectory;

  public NioSlotTableReaderWriter(Path basePath) {
    this.slotDirectory = basePath.resolve(RetentionConstants.SLOT_DIRECTORY_RELATIVE_PATH);
  }

  @Override
  public ImmutableList<RetentionSlot> readSlots() throws IOException {
    try (InputStream input = Files.newInputStream(tablePath())) {
      return ImmutableList.copyOf(decodeAndCheckCrc(input, SlotTableMessage.getSchema()).toSlots());
    } catch (NoSuchFileException ex) {
      return ImmutableList.of();
    }
  }

  @Override
  public void writeSlots(Collection<RetentionSlot> slots) throws IOException {
    Files.createDirectories(slotDirectory);

    final Path tempPath = slotDirectory.resolve(RetentionConstants.SLOT_TABLE_FILE_NAME + TEMPORARY_FILE_SUFFIX);
    final List<ByteBuffer> serialized = encodeWithLengthAndCrc(SlotTableMessage.getSchema(),
        SlotTableMessage.fromSlots(slots));

    try (FileChannel channel = FileChannel.open(tempPath, CREATE, TRUNCATE_EXISTING, WRITE)) {
      final ByteBuffer[] buffers = Iterables.toArray(serialized, ByteBuffer.class);
      final long toWrite = EntryEncodingUtil.sumRemaining(serialized);
      long written = 0;
      while (written < toWrite) {
        written += channel.write(buffers);
      }
      channel.force(true);
    }

    Files.move(tempPath, tablePath(), StandardCopyOption.ATOMIC_MOVE);
  }

  private Path tablePath() {
    return slotDirectory.resolve(RetentionConstants.SLOT_TABLE_FILE_NAME);
  }
}
