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

package ai.floedb.arbor.service.security;

import ai.floedb.arbor.service.error.NamespaceErrors;
import ai.floedb.arbor.storage.model.PermissionRecord;
import ai.floedb.arbor.storage.spi.PermissionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Per-principal capability lookup. A principal without a record has no capabilities; so does a
 * {@code null} principal.
 */
@ApplicationScoped
public class PermissionGate {
  private static final Logger LOG = Logger.getLogger(PermissionGate.class);

  private final PermissionStore store;

  @Inject
  public PermissionGate(PermissionStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public boolean canEdit(String principal) {
    return has(principal, Capability.EDIT);
  }

  public boolean canReceiveFeedback(String principal) {
    return has(principal, Capability.RECEIVE_FEEDBACK);
  }

  public boolean has(String principal, Capability capability) {
    if (principal == null) {
      return false;
    }
    return store.get(principal).map(capability::grantedBy).orElse(false);
  }

  /**
   * @throws ai.floedb.arbor.service.error.NamespaceException with {@code PERMISSION_DENIED}
   */
  public void require(String principal, Capability capability) {
    if (!has(principal, capability)) {
      LOG.debugf("denied principal=%s capability=%s", principal, capability.key());
      throw NamespaceErrors.permissionDenied(principal, capability);
    }
  }

  /** Principals that receive feedback, ordered by principal. */
  public List<String> feedbackRecipients() {
    var out = new ArrayList<String>();
    for (var record : store.list()) {
      if (record.canReceiveFeedback()) {
        out.add(record.principal());
      }
    }
    return out;
  }

  public void grant(PermissionRecord record) {
    store.put(record);
    LOG.infof(
        "permissions principal=%s edit=%s feedback=%s",
        record.principal(), record.canEdit(), record.canReceiveFeedback());
  }

  public boolean revoke(String principal) {
    boolean removed = store.delete(principal);
    if (removed) {
      LOG.infof("permissions revoked principal=%s", principal);
    }
    return removed;
  }
}
