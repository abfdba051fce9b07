/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.arbor.storage.memory;

import ai.floedb.arbor.storage.model.PermissionRecord;
import ai.floedb.arbor.storage.spi.PermissionStore;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Singleton
public class InMemoryPermissionStore implements PermissionStore {
  private final ConcurrentSkipListMap<String, PermissionRecord> records =
      new ConcurrentSkipListMap<>();

  @Override
  public Optional<PermissionRecord> get(String principal) {
    if (principal == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(principal));
  }

  @Override
  public void put(PermissionRecord record) {
    Objects.requireNonNull(record, "record");
    records.put(record.principal(), record);
  }

  @Override
  public boolean delete(String principal) {
    return principal != null && records.remove(principal) != null;
  }

  @Override
  public List<PermissionRecord> list() {
    return new ArrayList<>(records.values());
  }
}
