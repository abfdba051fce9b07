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

package ai.floedb.arbor.storage.model;

import java.util.Objects;

public record PermissionRecord(String principal, boolean canEdit, boolean canReceiveFeedback) {

  public PermissionRecord {
    Objects.requireNonNull(principal, "principal");
    if (principal.isBlank()) {
      throw new IllegalArgumentException("principal must not be blank");
    }
  }

  public static PermissionRecord none(String principal) {
    return new PermissionRecord(principal, false, false);
  }

  public PermissionRecord withEdit(boolean value) {
    return new PermissionRecord(principal, value, canReceiveFeedback);
  }

  public PermissionRecord withReceiveFeedback(boolean value) {
    return new PermissionRecord(principal, canEdit, value);
  }
}
