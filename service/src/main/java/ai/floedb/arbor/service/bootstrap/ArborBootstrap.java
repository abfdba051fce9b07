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

package ai.floedb.arbor.service.bootstrap;

import ai.floedb.arbor.service.config.ArborConfig;
import ai.floedb.arbor.service.security.PermissionGate;
import ai.floedb.arbor.service.tree.AncestryOracle;
import ai.floedb.arbor.service.tree.NamespaceEngine;
import ai.floedb.arbor.storage.file.FileTreeStore;
import ai.floedb.arbor.storage.memory.InMemoryIdAllocator;
import ai.floedb.arbor.storage.memory.InMemoryPermissionStore;
import ai.floedb.arbor.storage.memory.InMemoryTreeStore;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.EntryKind;
import ai.floedb.arbor.storage.model.PermissionRecord;
import ai.floedb.arbor.storage.spi.PermissionStore;
import ai.floedb.arbor.storage.spi.TreeStore;
import java.util.LinkedHashMap;
import org.jboss.logging.Logger;

/** Wires store, allocators, gate, oracle and engine from an {@link ArborConfig}. */
public final class ArborBootstrap {
  private static final Logger LOG = Logger.getLogger(ArborBootstrap.class);

  private ArborBootstrap() {}

  public static Arbor open() {
    return open(ArborConfig.load());
  }

  public static Arbor open(ArborConfig config) {
    return open(config, openStore(config));
  }

  /**
   * Wires around an already open {@code store}. Allocators start above the highest id the store
   * holds, so identifiers are not reissued across restarts of a durable store.
   */
  public static Arbor open(ArborConfig config, TreeStore store) {
    if (!store.directoryExists(DirectoryId.ROOT)) {
      store.close();
      throw new IllegalStateException("tree store has no root directory");
    }
    var directoryIds = new InMemoryIdAllocator("directory", store.maxId(EntryKind.DIRECTORY));
    var noteIds = new InMemoryIdAllocator("note", store.maxId(EntryKind.NOTE));

    var gate = new PermissionGate(seedPermissions(config));
    var oracle = new AncestryOracle(store);
    var engine = new NamespaceEngine(store, oracle, gate, directoryIds, noteIds);

    LOG.infof(
        "arbor ready store=%s directories=%d notes=%d nextDirectoryId=%d nextNoteId=%d",
        config.storeKind(),
        store.directoryCount(),
        store.noteCount(),
        directoryIds.lastIssued() + 1,
        noteIds.lastIssued() + 1);
    return new Arbor(store, engine, oracle, gate);
  }

  private static TreeStore openStore(ArborConfig config) {
    return switch (config.storeKind()) {
      case MEMORY -> new InMemoryTreeStore(config.lockTimeout());
      case FILE -> FileTreeStore.open(config.storePath().orElseThrow(), config.lockTimeout());
    };
  }

  private static PermissionStore seedPermissions(ArborConfig config) {
    var records = new LinkedHashMap<String, PermissionRecord>();
    for (var principal : config.editors()) {
      records.merge(
          principal, PermissionRecord.none(principal).withEdit(true), (a, b) -> a.withEdit(true));
    }
    for (var principal : config.feedbackRecipients()) {
      records.merge(
          principal,
          PermissionRecord.none(principal).withReceiveFeedback(true),
          (a, b) -> a.withReceiveFeedback(true));
    }
    var store = new InMemoryPermissionStore();
    records.values().forEach(store::put);
    return store;
  }
}
