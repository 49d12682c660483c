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

package retlog.interfaces.maintenance;

/**
 * Opaque resume point of a dead-row scan.
 */
public final class ScanPosition {
  public static final ScanPosition START = new ScanPosition(0);

  private final long offset;

  public ScanPosition(long offset) {
    this.offset = offset;
  }

  public long getOffset() {
    return offset;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScanPosition && ((ScanPosition) o).offset == offset;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(offset);
  }

  @Override
  public String toString() {
    return "ScanPosition{" + offset + '}';
  }
}
