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

import ai.floedb.arbor.service.security.PermissionGate;
import ai.floedb.arbor.service.tree.AncestryOracle;
import ai.floedb.arbor.service.tree.NamespaceEngine;
import ai.floedb.arbor.storage.spi.TreeStore;

/** A wired namespace store. Closing it closes the underlying tree store. */
public final class Arbor implements AutoCloseable {
  private final TreeStore store;
  private final NamespaceEngine engine;
  private final AncestryOracle oracle;
  private final PermissionGate gate;

  Arbor(TreeStore store, NamespaceEngine engine, AncestryOracle oracle, PermissionGate gate) {
    this.store = store;
    this.engine = engine;
    this.oracle = oracle;
    this.gate = gate;
  }

  public NamespaceEngine engine() {
    return engine;
  }

  public AncestryOracle oracle() {
    return oracle;
  }

  public PermissionGate gate() {
    return gate;
  }

  @Override
  public void close() {
    store.close();
  }
}
