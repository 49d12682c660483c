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

package retlog.decoding;

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Payload of a DATA record: one row-level change made by a transaction.
 */
public class ChangePayload {
  private static final Schema<ChangePayload> SCHEMA = RuntimeSchema.getSchema(ChangePayload.class);

  private long transactionId;
  private String entity;
  private int operation;
  private byte[] beforeImage;
  private byte[] afterImage;

  public ChangePayload() {
  }

  public ChangePayload(long transactionId, String entity, int operation, byte[] beforeImage, byte[] afterImage) {
    this.transactionId = transactionId;
    this.entity = entity;
    this.operation = operation;
    this.beforeImage = beforeImage;
    this.afterImage = afterImage;
  }

  public static Schema<ChangePayload> getSchema() {
    return SCHEMA;
  }

  public long getTransactionId() {
    return transactionId;
  }

  public String getEntity() {
    return entity;
  }

  public int getOperation() {
    return operation;
  }

  public byte[] getBeforeImage() {
    return beforeImage;
  }

  public byte[] getAfterImage() {
    return afterImage;
  }

  @Override
  public String toString() {
    return "ChangePayload{" +
        "transactionId=" + transactionId +
        ", entity='" + entity + '\'' +
        ", operation=" + operation +
        '}';
  }
}
