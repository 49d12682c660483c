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

import org.junit.Test;
import retlog.RetentionConstants;

import java.nio.file.Paths;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class RetentionConfigurationTest {

  @Test
  public void usesDefaultsForMissingKeys() {
    RetentionConfiguration configuration = RetentionConfiguration.defaults();

    assertThat(configuration.dataDirectory, is(equalTo(RetentionConstants.DEFAULT_DATA_DIRECTORY)));
    assertThat(configuration.segmentSizeBytes, is(equalTo(RetentionConstants.DEFAULT_SEGMENT_SIZE_BYTES)));
    assertThat(configuration.costLimit, is(equalTo(RetentionConstants.DEFAULT_COST_LIMIT)));
    assertThat(configuration.maintenanceWorkers, is(equalTo(RetentionConstants.DEFAULT_MAINTENANCE_WORKERS)));
    assertThat(configuration.consumerChannelCapacity, is(equalTo(RetentionConstants.DEFAULT_CONSUMER_CHANNEL_CAPACITY)));
  }

  @Test
  public void readsEveryKey() {
    Properties properties = new Properties();
    properties.setProperty("retlog.dataDirectory", "/var/lib/retlog");
    properties.setProperty("retlog.segmentSizeBytes", "4096");
    properties.setProperty("retlog.costLimit", "50");
    properties.setProperty("retlog.costSleepMillis", "0");
    properties.setProperty("retlog.naptimeMillis", "1000");
    properties.setProperty("retlog.maintenanceWorkers", "2");
    properties.setProperty("retlog.maxRetainedBytes", "0");
    properties.setProperty("retlog.maxRetainedAgeMillis", "3600000");
    properties.setProperty("retlog.physicalSlotLag", "16");
    properties.setProperty("retlog.maxTransactionChanges", "10");
    properties.setProperty("retlog.streamPollIntervalMillis", "7");
    properties.setProperty("retlog.channelRetryBaseMillis", "3");
    properties.setProperty("retlog.channelRetryMaxMillis", "300");
    properties.setProperty("retlog.consumerChannelCapacity", "8");

    RetentionConfiguration configuration = RetentionConfiguration.fromProperties(properties);

    assertThat(configuration.dataDirectory, is(equalTo(Paths.get("/var/lib/retlog"))));
    assertThat(configuration.segmentSizeBytes, is(equalTo(4096L)));
    assertThat(configuration.costLimit, is(equalTo(50L)));
    assertThat(configuration.costSleepMillis, is(equalTo(0L)));
    assertThat(configuration.naptimeMillis, is(equalTo(1000L)));
    assertThat(configuration.maintenanceWorkers, is(equalTo(2)));
    assertThat(configuration.maxRetainedBytes, is(equalTo(0L)));
    assertThat(configuration.maxRetainedAgeMillis, is(equalTo(3600000L)));
    assertThat(configuration.physicalSlotLag, is(equalTo(16L)));
    assertThat(configuration.maxTransactionChanges, is(equalTo(10)));
    assertThat(configuration.streamPollIntervalMillis, is(equalTo(7L)));
    assertThat(configuration.channelRetryBaseMillis, is(equalTo(3L)));
    assertThat(configuration.channelRetryMaxMillis, is(equalTo(300L)));
    assertThat(configuration.consumerChannelCapacity, is(equalTo(8)));
  }

  @Test
  public void fallsBackToDefaultsForUnusableValues() {
    Properties properties = new Properties();
    properties.setProperty("retlog.segmentSizeBytes", "big");
    properties.setProperty("retlog.costLimit", "0");
    properties.setProperty("retlog.maintenanceWorkers", "-1");
    properties.setProperty("retlog.consumerChannelCapacity", "99999999999");

    RetentionConfiguration configuration = RetentionConfiguration.fromProperties(properties);

    assertThat(configuration.segmentSizeBytes, is(equalTo(RetentionConstants.DEFAULT_SEGMENT_SIZE_BYTES)));
    assertThat(configuration.costLimit, is(equalTo(RetentionConstants.DEFAULT_COST_LIMIT)));
    assertThat(configuration.maintenanceWorkers, is(equalTo(RetentionConstants.DEFAULT_MAINTENANCE_WORKERS)));
    assertThat(configuration.consumerChannelCapacity, is(equalTo(RetentionConstants.DEFAULT_CONSUMER_CHANNEL_CAPACITY)));
  }

  @Test
  public void keepsTheRetryCeilingAboveTheBase() {
    Properties properties = new Properties();
    properties.setProperty("retlog.channelRetryBaseMillis", "500");
    properties.setProperty("retlog.channelRetryMaxMillis", "100");

    RetentionConfiguration configuration = RetentionConfiguration.fromProperties(properties);

    assertThat(configuration.channelRetryBaseMillis, is(equalTo(500L)));
    assertThat(configuration.channelRetryMaxMillis, is(equalTo(RetentionConstants.DEFAULT_CHANNEL_RETRY_MAX_MILLIS)));
  }
}
