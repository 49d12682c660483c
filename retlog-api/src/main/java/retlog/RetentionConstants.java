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

package retlog;

import java.nio.file.Path;
import java.nio.file.Paths;

public class RetentionConstants {
  public static final Path DEFAULT_DATA_DIRECTORY = Paths.get("retlog-data");
  public static final Path SLOT_DIRECTORY_RELATIVE_PATH = Paths.get("slots");
  public static final String SLOT_TABLE_FILE_NAME = "slots.tbl";

  public static final long DEFAULT_SEGMENT_SIZE_BYTES = 16L * 1024 * 1024;

  public static final long DEFAULT_COST_LIMIT = 200;
  public static final long DEFAULT_COST_SLEEP_MILLIS = 20;
  public static final long DEFAULT_NAPTIME_MILLIS = 60_000;
  public static final int DEFAULT_MAINTENANCE_WORKERS = 3;
  public static final int MAINTENANCE_CLOSE_TIMEOUT_SECONDS = 15;

  public static final long DEFAULT_MAX_RETAINED_BYTES = 1024L * 1024 * 1024;
  public static final long DEFAULT_MAX_RETAINED_AGE_MILLIS = 0;

  public static final long DEFAULT_PHYSICAL_SLOT_LAG = 0;
  public static final int DEFAULT_MAX_TRANSACTION_CHANGES = 100_000;

  public static final long DEFAULT_STREAM_POLL_INTERVAL_MILLIS = 50;
  public static final long DEFAULT_CHANNEL_RETRY_BASE_MILLIS = 10;
  public static final long DEFAULT_CHANNEL_RETRY_MAX_MILLIS = 1000;
  public static final int DEFAULT_CONSUMER_CHANNEL_CAPACITY = 1024;
  public static final int SESSION_CLOSE_TIMEOUT_SECONDS = 5;
  public static final int COMMAND_TIMEOUT_SECONDS = 10;
}
