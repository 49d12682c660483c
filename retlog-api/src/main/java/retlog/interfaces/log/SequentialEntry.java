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

/**
 * An entry identified by a position in a sequence. Sequence numbers of successive entries
 * in a log are consecutive.
 */
public abstract class SequentialEntry {
  protected final long seqNum;

  protected SequentialEntry(long seqNum) {
    this.seqNum = seqNum;
  }

  public long getSeqNum() {
    return seqNum;
  }
}
