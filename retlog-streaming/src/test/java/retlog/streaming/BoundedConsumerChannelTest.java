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

package retlog.streaming;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.streaming.ConsumerChannel;

import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

public class BoundedConsumerChannelTest {
  private final BoundedConsumerChannel channel = new BoundedConsumerChannel(2);

  @Test
  public void handsBatchesToTheConsumerInPushOrder() throws Exception {
    ChangeBatch first = aBatch(1);
    ChangeBatch second = aBatch(2);
    channel.push(first);
    channel.push(second);

    assertThat(channel.poll(1, TimeUnit.SECONDS), is(sameInstance(first)));
    assertThat(channel.poll(1, TimeUnit.SECONDS), is(sameInstance(second)));
  }

  @Test(expected = ConsumerChannel.ConsumerBackpressure.class)
  public void reportsBackpressureWhenFull() throws Exception {
    channel.push(aBatch(1));
    channel.push(aBatch(2));
    channel.push(aBatch(3));
  }

  @Test
  public void acceptsAgainOnceTheConsumerCatchesUp() throws Exception {
    channel.push(aBatch(1));
    channel.push(aBatch(2));
    channel.poll(1, TimeUnit.SECONDS);

    channel.push(aBatch(3));
    assertThat(channel.size(), is(equalTo(2)));
  }

  @Test(expected = ConsumerChannel.ChannelIOError.class)
  public void refusesPushesOnceClosed() throws Exception {
    channel.close();
    channel.push(aBatch(1));
  }

  private static ChangeBatch aBatch(long commitSeq) {
    return new ChangeBatch(commitSeq, commitSeq, commitSeq, commitSeq, ImmutableList.of());
  }
}
