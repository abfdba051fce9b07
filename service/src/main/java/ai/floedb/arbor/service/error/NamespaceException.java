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

import java.util.Map;

/** The single failure type surfaced by the namespace engine, its oracle and its gate. */
public class NamespaceException extends RuntimeException {
  private final ErrorCode code;
  private final String messageKey;
  private final Map<String, String> params;

  public NamespaceException(
      ErrorCode code, String messageKey, Map<String, String> params, String message, Throwable t) {
    super(message, t);
    this.code = code;
    this.messageKey = messageKey == null ? "" : messageKey;
    this.params = Map.copyOf(params);
  }

  public ErrorCode code() {
    return code;
  }

  /** Variant suffix used to select a more specific catalog template; blank for the base one. */
  public String messageKey() {
    return messageKey;
  }

  public Map<String, String> params() {
    return params;
  }
}
