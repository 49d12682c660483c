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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.LogConstants;
import retlog.interfaces.log.SegmentDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static retlog.log.EntryEncodingUtil.decodeAndCheckCrc;
import static retlog.log.EntryEncodingUtil.encodeWithLengthAndCrc;

/**
 * LogPersistenceService keeping each segment in its own file, next to an index file that
 * is replaced by write-to-temporary, force, and atomic rename.
 */
public class SegmentFileService implements LogPersistenceService<FilePersistence> {
  private static final Logger LOG = LoggerFactory.getLogger(SegmentFileService.class);

  private final Path logRootDir;

  public SegmentFileService(Path basePath) throws IOException {
    this.logRootDir = basePath.resolve(LogConstants.LOG_ROOT_DIRECTORY_RELATIVE_PATH);

    Files.createDirectories(logRootDir);
  }

  @NotNull
  @Override
  public FilePersistence create(long segmentId) throws IOException {
    final Path path = logRootDir.resolve(fileNameFor(segmentId));
    if (Files.exists(path)) {
      throw new FileAlreadyExistsException(path.toString());
    }
    return new FilePersistence(path);
  }

  @NotNull
  @Override
  public FilePersistence open(String fileName) throws IOException {
    final Path path = logRootDir.resolve(fileName);
    if (!Files.exists(path)) {
      throw new IOException("Segment file " + path + " is missing");
    }
    return new FilePersistence(path);
  }

  @Override
  public String fileNameFor(long segmentId) {
    return String.format("%020d%s", segmentId, LogConstants.SEGMENT_FILE_SUFFIX);
  }

  @Override
  public void delete(String fileName) throws IOException {
    Files.deleteIfExists(logRootDir.resolve(fileName));
  }

  @Override
  public ImmutableList<String> listSegmentFiles() throws IOException {
    final List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(logRootDir, "*" + LogConstants.SEGMENT_FILE_SUFFIX)) {
      for (Path file : files) {
        names.add(file.getFileName().toString());
      }
    }
    Collections.sort(names);
    return ImmutableList.copyOf(names);
  }

  @Override
  public void writeIndex(List<SegmentDescriptor> segments) throws IOException {
    final Path indexPath = indexPath();
    final Path tempPath = logRootDir.resolve(LogConstants.SEGMENT_INDEX_FILE_NAME + LogConstants.TEMPORARY_FILE_SUFFIX);
    final List<ByteBuffer> serialized =
        encodeWithLengthAndCrc(SegmentIndexMessage.getSchema(), SegmentIndexMessage.fromDescriptors(segments));

    try (FileChannel channel = FileChannel.open(tempPath, CREATE, TRUNCATE_EXISTING, WRITE)) {
      final ByteBuffer[] buffers = Iterables.toArray(serialized, ByteBuffer.class);
      final long toWrite = EntryEncodingUtil.sumRemaining(serialized);
      long written = 0;
      while (written < toWrite) {
        written += channel.write(buffers);
      }
      channel.force(true);
    }

    Files.move(tempPath, indexPath, StandardCopyOption.ATOMIC_MOVE);
    LOG.debug("Wrote segment index listing {} segments", segments.size());
  }

  @Override
  public ImmutableList<SegmentDescriptor> readIndex() throws IOException {
    final Path indexPath = indexPath();
    if (!Files.exists(indexPath)) {
      return ImmutableList.of();
    }

    try (InputStream input = Files.newInputStream(indexPath)) {
      return ImmutableList.copyOf(decodeAndCheckCrc(input, SegmentIndexMessage.getSchema()).toDescriptors());
    }
  }

  private Path indexPath() {
    return logRootDir.resolve(LogConstants.SEGMENT_INDEX_FILE_NAME);
  }
}
