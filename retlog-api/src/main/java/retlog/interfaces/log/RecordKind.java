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
 * Kind of a record appended to the log. The numeric code is what is persisted.
 */
public enum RecordKind {
  DATA(1),
  COMMIT(2),
  CHECKPOINT(3),
  ABORT(4);

  private final int code;

  RecordKind(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static RecordKind fromCode(int code) {
    for (RecordKind kind : values()) {
      if (kind.code == code) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown record kind code " + code);
  }
}
