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

package retlog.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.RetentionConstants;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings for a {@link RetentionService}. Each setting is read from a {@code retlog.*} property;
 * a missing or unusable value falls back to the default in {@link RetentionConstants}.
 */
public class RetentionConfiguration {
  private static final Logger LOG = LoggerFactory.getLogger(RetentionConfiguration.class);

  public static final String DATA_DIRECTORY = "retlog.dataDirectory";
  public static final String SEGMENT_SIZE_BYTES = "retlog.segmentSizeBytes";
  public static final String COST_LIMIT = "retlog.costLimit";
  public static final String COST_SLEEP_MILLIS = "retlog.costSleepMillis";
  public static final String NAPTIME_MILLIS = "retlog.naptimeMillis";
  public static final String MAINTENANCE_WORKERS = "retlog.maintenanceWorkers";
  public static final String MAX_RETAINED_BYTES = "retlog.maxRetainedBytes";
  public static final String MAX_RETAINED_AGE_MILLIS = "retlog.maxRetainedAgeMillis";
  public static final String PHYSICAL_SLOT_LAG = "retlog.physicalSlotLag";
  public static final String MAX_TRANSACTION_CHANGES = "retlog.maxTransactionChanges";
  public static final String STREAM_POLL_INTERVAL_MILLIS = "retlog.streamPollIntervalMillis";
  public static final String CHANNEL_RETRY_BASE_MILLIS = "retlog.channelRetryBaseMillis";
  public static final String CHANNEL_RETRY_MAX_MILLIS = "retlog.channelRetryMaxMillis";
  public static final String CONSUMER_CHANNEL_CAPACITY = "retlog.consumerChannelCapacity";

  public final Path dataDirectory;
  public final long segmentSizeBytes;
  public final long costLimit;
  public final long costSleepMillis;
  public final long naptimeMillis;
  public final int maintenanceWorkers;
  public final long maxRetainedBytes;
  public final long maxRetainedAgeMillis;
  public final long physicalSlotLag;
  public final int maxTransactionChanges;
  public final long streamPollIntervalMillis;
  public final long channelRetryBaseMillis;
  public final long channelRetryMaxMillis;
  public final int consumerChannelCapacity;

  private RetentionConfiguration(Properties properties) {
    dataDirectory = pathValue(properties, DATA_DIRECTORY, RetentionConstants.DEFAULT_DATA_DIRECTORY);
    segmentSizeBytes = longValue(properties, SEGMENT_SIZE_BYTES, RetentionConstants.DEFAULT_SEGMENT_SIZE_BYTES, 1);
    costLimit = longValue(properties, COST_LIMIT, RetentionConstants.DEFAULT_COST_LIMIT, 1);
    costSleepMillis = longValue(properties, COST_SLEEP_MILLIS, RetentionConstants.DEFAULT_COST_SLEEP_MILLIS, 0);
    naptimeMillis = longValue(properties, NAPTIME_MILLIS, RetentionConstants.DEFAULT_NAPTIME_MILLIS, 1);
    maintenanceWorkers = intValue(properties, MAINTENANCE_WORKERS, RetentionConstants.DEFAULT_MAINTENANCE_WORKERS, 1);
    maxRetainedBytes = longValue(properties, MAX_RETAINED_BYTES, RetentionConstants.DEFAULT_MAX_RETAINED_BYTES, 0);
    maxRetainedAgeMillis = longValue(properties, MAX_RETAINED_AGE_MILLIS,
        RetentionConstants.DEFAULT_MAX_RETAINED_AGE_MILLIS, 0);
    physicalSlotLag = longValue(properties, PHYSICAL_SLOT_LAG, RetentionConstants.DEFAULT_PHYSICAL_SLOT_LAG, 0);
    maxTransactionChanges = intValue(properties, MAX_TRANSACTION_CHANGES,
        RetentionConstants.DEFAULT_MAX_TRANSACTION_CHANGES, 1);
    streamPollIntervalMillis = longValue(properties, STREAM_POLL_INTERVAL_MILLIS,
        RetentionConstants.DEFAULT_STREAM_POLL_INTERVAL_MILLIS, 1);
    channelRetryBaseMillis = longValue(properties, CHANNEL_RETRY_BASE_MILLIS,
        RetentionConstants.DEFAULT_CHANNEL_RETRY_BASE_MILLIS, 1);
    channelRetryMaxMillis = longValue(properties, CHANNEL_RETRY_MAX_MILLIS,
        Math.max(channelRetryBaseMillis, RetentionConstants.DEFAULT_CHANNEL_RETRY_MAX_MILLIS), channelRetryBaseMillis);
    consumerChannelCapacity = intValue(properties, CONSUMER_CHANNEL_CAPACITY,
        RetentionConstants.DEFAULT_CONSUMER_CHANNEL_CAPACITY, 1);
  }

  public static RetentionConfiguration fromProperties(Properties properties) {
    return new RetentionConfiguration(properties);
  }

  public static RetentionConfiguration fromSystemProperties() {
    return new RetentionConfiguration(System.getProperties());
  }

  public static RetentionConfiguration defaults() {
    return new RetentionConfiguration(new Properties());
  }

  private static int intValue(Properties properties, String key, int defaultValue, int minimum) {
    return (int) rangeValue(properties, key, defaultValue, minimum, Integer.MAX_VALUE);
  }

  private static long longValue(Properties properties, String key, long defaultValue, long minimum) {
    return rangeValue(properties, key, defaultValue, minimum, Long.MAX_VALUE);
  }

  private static long rangeValue(Properties properties, String key, long defaultValue, long minimum, long maximum) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      final long parsed = Long.parseLong(value.trim());
      if (parsed < minimum || parsed > maximum) {
        LOG.warn("Ignoring {}={}: must be between {} and {}; using {}", key, value, minimum, maximum, defaultValue);
        return defaultValue;
      }
      return parsed;
    } catch (NumberFormatException e) {
      LOG.warn("Ignoring {}={}: not a number; using {}", key, value, defaultValue);
      return defaultValue;
    }
  }

  private static Path pathValue(Properties properties, String key, Path defaultValue) {
    final String value = properties.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Paths.get(value.trim());
    } catch (InvalidPathException e) {
      LOG.warn("Ignoring {}={}: {}; using {}", key, value, e.getMessage(), defaultValue);
      return defaultValue;
    }
  }

  @Override
  public String toString() {
    return "RetentionConfiguration{" +
        "dataDirectory=" + dataDirectory +
        ", segmentSizeBytes=" + segmentSizeBytes +
        ", costLimit=" + costLimit +
        ", costSleepMillis=" + costSleepMillis +
        ", naptimeMillis=" + naptimeMillis +
        ", maintenanceWorkers=" + maintenanceWorkers +
        ", maxRetainedBytes=" + maxRetainedBytes +
        ", maxRetainedAgeMillis=" + maxRetainedAgeMillis +
        ", physicalSlotLag=" + physicalSlotLag +
        ", maxTransactionChanges=" + maxTransactionChanges +
        ", streamPollIntervalMillis=" + streamPollIntervalMillis +
        ", channelRetryBaseMillis=" + channelRetryBaseMillis +
        ", channelRetryMaxMillis=" + channelRetryMaxMillis +
        ", consumerChannelCapacity=" + consumerChannelCapacity +
        '}';
  }
}
