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

import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;

/**
 * Renders user-facing text for an error from the {@code errors} bundle. Lookup tries {@code
 * CODE.key}, then {@code CODE}, then a built-in template; {@code {param}} placeholders are
 * replaced from the parameter map.
 */
public final class MessageCatalog {
  private static final String BUNDLE = "errors";

  private final ResourceBundle bundle;

  public MessageCatalog() {
    this(Locale.ROOT);
  }

  public MessageCatalog(Locale locale) {
    this.bundle = ResourceBundle.getBundle(BUNDLE, locale);
  }

  public String render(ErrorCode code, String messageKey, Map<String, String> params) {
    String base = code.name();
    String key = messageKey != null && !messageKey.isBlank() ? base + "." + messageKey : base;

    String template =
        bundle.containsKey(key)
            ? bundle.getString(key)
            : (bundle.containsKey(base) ? bundle.getString(base) : defaultTemplate(code));

    return format(template, params);
  }

  public String render(NamespaceException e) {
    return render(e.code(), e.messageKey(), e.params());
  }

  private static String defaultTemplate(ErrorCode code) {
    return switch (code) {
      case UNKNOWN_PARENT -> "Parent directory {parent} does not exist.";
      case DUPLICATE_NAME -> "A {kind} named \"{name}\" already exists in directory {parent}.";
      case SELF_PARENT -> "Directory {directory} cannot contain itself.";
      case CYCLE_REJECTED -> "Moving directory {directory} into {target} would create a cycle.";
      case ROOT_UNDELETABLE -> "The root directory cannot be deleted.";
      case ROOT_IMMUTABLE -> "The root directory cannot be renamed.";
      case PERMISSION_DENIED -> "You do not have permission to perform this operation.";
      case NOT_FOUND -> "The {resource} was not found: {id}.";
      case INVALID_NAME -> "Invalid name: \"{name}\".";
      case INVALID_ARGUMENT -> "Invalid value for {field}.";
      case STORAGE_FAILURE -> "Storage is unavailable.";
    };
  }

  private static String format(String template, Map<String, String> params) {
    String formattedMessage = template;
    for (var e : params.entrySet()) {
      formattedMessage = formattedMessage.replace("{" + e.getKey() + "}", e.getValue());
    }
    return formattedMessage;
  }
}
