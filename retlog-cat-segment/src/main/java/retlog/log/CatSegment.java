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

import com.google.common.base.Splitter;
import io.protostuff.ProtobufIOUtil;
import retlog.interfaces.log.RecordKind;
import retlog.util.CrcInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Formatter;
import java.util.Locale;
import java.util.zip.Adler32;

import static retlog.log.EntryEncodingUtil.decodeAndCheckCrc;
import static retlog.log.LogPersistenceService.PersistenceReader;

public class CatSegment {
  private static final int HEX_ADDRESS_DIGITS = 8;
  private static final int LONG_DIGITS = 8;
  private static final int INT_DIGITS = 8;

  /**
   * Output to System.out the contents of a segment file, with one record on each line.
   *
   * @param args Accepts only one argument, the name of the segment file.
   * @throws IOException
   */
  public static void main(String args[]) throws IOException {
    if (args.length != 1) {
      System.err.println("Usage: CatSegment filename");
      System.exit(-1);
    }

    Path segmentFile = Paths.get(args[0]);

    if (!Files.isRegularFile(segmentFile)) {
      System.err.println("File does not exist, or is a directory");
      System.exit(-1);
    }

    describeSegmentFile(segmentFile, System.out);
  }

  static void describeSegmentFile(Path segmentFile, PrintStream out) throws IOException {
    openFileAndParseRecords(segmentFile,
        (header, validCrc) ->
            out.println(formatSegmentHeader(header, validCrc)),
        (address, record) -> {
          out.print(toHex(address) + ": ");
          out.println(formatRecord(record));
        });
  }

  private static void openFileAndParseRecords(Path segmentFile,
                                              HeaderWithCrcValidity doWithHeader,
                                              RecordWithAddress doForEach) throws IOException {
    try (FilePersistence persistence = new FilePersistence(segmentFile);
         PersistenceReader reader = persistence.getReader();
         InputStream inputStream = Channels.newInputStream(reader)) {

      decodeAndUseSegmentHeader(inputStream, doWithHeader);

      RecordDescription record;
      do {
        long address = reader.position();
        record = RecordDescription.decode(inputStream);
        doForEach.accept(address, record);
      } while (record.isReadable());
    } catch (EOFException ignore) {
    }
  }

  private interface RecordWithAddress {
    void accept(long address, RecordDescription record);
  }

  private interface HeaderWithCrcValidity {
    void accept(SegmentHeader header, boolean validCrc);
  }

  private static String toHex(long address) {
    return String.join(" ",
        Splitter
            .fixedLength(4)
            .split(String.format("%0" + HEX_ADDRESS_DIGITS + "x", address)));
  }

  private static String formatSegmentHeader(SegmentHeader header, boolean validCrc) {
    StringBuilder sb = new StringBuilder();
    Formatter formatter = new Formatter(sb, Locale.US);

    formatter.format("HEADER [segment: %" + LONG_DIGITS + "d]", header.getSegmentId());
    formatter.format(" [base seq: %" + LONG_DIGITS + "d]", header.getBaseSeqNum());

    if (!validCrc) {
      formatter.format(" <invalid segment header CRC>");
    }

    return formatter.toString();
  }

  private static String formatRecord(RecordDescription record) {
    StringBuilder sb = new StringBuilder();
    Formatter formatter = new Formatter(sb, Locale.US);

    formatter.format(" [seq: %" + LONG_DIGITS + "d]", record.header.getSeqNum());
    formatter.format(" [kind: %-10s]", kindName(record.header.getKind()));
    formatter.format(" [length: %" + INT_DIGITS + "d]", record.header.getContentLength());

    if (!record.headerCrcValid) {
      formatter.format(" <invalid header CRC>");
    }

    if (!record.contentCrcValid) {
      formatter.format(" <invalid content CRC>");
    }

    if (!record.isReadable()) {
      formatter.format(" <unreadable content length; stopping>");
    }

    return formatter.toString();
  }

  private static String kindName(int code) {
    try {
      return RecordKind.fromCode(code).name();
    } catch (IllegalArgumentException e) {
      return "?" + code;
    }
  }

  private static void decodeAndUseSegmentHeader(InputStream inputStream, HeaderWithCrcValidity doWithHeader)
      throws IOException {
    SegmentHeader header;
    boolean validCrc = true;
    try {
      header = decodeAndCheckCrc(inputStream, SegmentHeader.getSchema());
    } catch (EntryEncodingUtil.CrcError e) {
      validCrc = false;
      header = SegmentHeader.getSchema().newMessage();
    }

    doWithHeader.accept(header, validCrc);
  }

  /**
   * One record as found on disk, whether or not its checksums hold.
   */
  private static class RecordDescription {
    final RecordHeader header;
    final boolean headerCrcValid;
    final boolean contentCrcValid;

    private RecordDescription(RecordHeader header, boolean headerCrcValid, boolean contentCrcValid) {
      this.header = header;
      this.headerCrcValid = headerCrcValid;
      this.contentCrcValid = contentCrcValid;
    }

    static RecordDescription decode(InputStream inputStream) throws IOException {
      final RecordHeader header = RecordHeader.getSchema().newMessage();
      final CrcInputStream crcStream = new CrcInputStream(inputStream, new Adler32());
      ProtobufIOUtil.mergeDelimitedFrom(crcStream, header, RecordHeader.getSchema());
      final boolean headerCrcValid = EntryEncodingUtil.readCrc(inputStream) == crcStream.getValue();

      if (header.getContentLength() < 0) {
        return new RecordDescription(header, headerCrcValid, false);
      }

      boolean contentCrcValid = true;
      try {
        EntryEncodingUtil.getAndCheckContent(inputStream, header.getContentLength());
      } catch (EntryEncodingUtil.CrcError e) {
        contentCrcValid = false;
      }
      return new RecordDescription(header, headerCrcValid, contentCrcValid);
    }

    boolean isReadable() {
      return header.getContentLength() >= 0;
    }
  }
}
