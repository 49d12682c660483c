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

package retlog.interfaces.decoding;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Declarative filter of the entities and operation kinds exposed to consumers. Immutable; a
 * publication is redefined by replacing it.
 */
public final class Publication {
  private final String name;
  private final boolean allEntities;
  private final ImmutableSet<String> entities;
  private final ImmutableSet<Operation> operations;

  private Publication(String name, boolean allEntities, ImmutableSet<String> entities,
                      ImmutableSet<Operation> operations) {
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Publication name must not be empty");
    }
    this.name = name;
    this.allEntities = allEntities;
    this.entities = entities;
    this.operations = operations;
  }

  public static Publication forAllEntities(@NotNull String name, @NotNull Collection<Operation> operations) {
    return new Publication(name, true, ImmutableSet.of(), Sets.immutableEnumSet(operations));
  }

  public static Publication forEntities(@NotNull String name,
                                        @NotNull Collection<String> entities,
                                        @NotNull Collection<Operation> operations) {
    return new Publication(name, false, ImmutableSet.copyOf(entities), Sets.immutableEnumSet(operations));
  }

  public String getName() {
    return name;
  }

  public boolean isAllEntities() {
    return allEntities;
  }

  /**
   * The entities published, or an empty set if the publication covers all entities.
   */
  public ImmutableSet<String> getEntities() {
    return entities;
  }

  public ImmutableSet<Operation> getOperations() {
    return operations;
  }

  public boolean includesEntity(String entity) {
    return allEntities || entities.contains(entity);
  }

  public boolean includes(String entity, Operation operation) {
    return operations.contains(operation) && includesEntity(entity);
  }

  @Override
  public String toString() {
    return "Publication{" +
        "name='" + name + '\'' +
        ", entities=" + (allEntities ? "ALL" : entities) +
        ", operations=" + operations +
        '}';
  }
}
