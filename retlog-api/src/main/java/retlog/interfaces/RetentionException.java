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

package retlog.interfaces;

/**
 * Base of every error a retention, decoding or streaming component reports to its caller. Each
 * subclass carries a stable {@link ErrorKind}, so that callers and operators can tell a condition
 * worth retrying apart from one that needs a configuration change or a re-synchronization.
 */
public abstract class RetentionException extends Exception {
  private final ErrorKind kind;

  protected RetentionException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected RetentionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return kind + ": " + getMessage();
  }
}
