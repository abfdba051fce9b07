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

import ai.floedb.arbor.storage.model.PermissionRecord;

public enum Capability {
  EDIT("edit"),
  RECEIVE_FEEDBACK("receive-feedback");

  private final String key;

  Capability(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  boolean grantedBy(PermissionRecord record) {
    return switch (this) {
      case EDIT -> record.canEdit();
      case RECEIVE_FEEDBACK -> record.canReceiveFeedback();
    };
  }
}
