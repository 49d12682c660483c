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

package retlog.interfaces.streaming;

import com.google.common.collect.ImmutableList;

import java.io.IOException;

/**
 * Supplies the current contents of the data store, for the initial synchronization of a new
 * consumer. The rows returned must reflect every change committed up to the moment of the call.
 */
public interface SnapshotSource {

  ImmutableList<SnapshotRow> snapshot() throws IOException;

  final class SnapshotRow {
    public final String entity;
    public final byte[] image;

    public SnapshotRow(String entity, byte[] image) {
      this.entity = entity;
      this.image = image;
    }
  }
}
