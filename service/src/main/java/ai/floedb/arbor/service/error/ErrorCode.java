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

package ai.floedb.arbor.service.error;

public enum ErrorCode {
  UNKNOWN_PARENT(true),
  DUPLICATE_NAME(true),
  SELF_PARENT(true),
  CYCLE_REJECTED(true),
  ROOT_UNDELETABLE(true),
  ROOT_IMMUTABLE(true),
  PERMISSION_DENIED(true),
  NOT_FOUND(true),
  INVALID_NAME(true),
  INVALID_ARGUMENT(true),
  STORAGE_FAILURE(false);

  private final boolean recoverable;

  ErrorCode(boolean recoverable) {
    this.recoverable = recoverable;
  }

  /**
   * Recoverable codes are validation outcomes: the caller can report them and nothing was written.
   */
  public boolean recoverable() {
    return recoverable;
  }
}
