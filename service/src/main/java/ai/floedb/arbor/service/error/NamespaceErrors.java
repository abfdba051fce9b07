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

import ai.floedb.arbor.service.security.Capability;
import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.errors.TreeConstraintException;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.EntryKind;
import java.util.LinkedHashMap;
import java.util.Map;

public final class NamespaceErrors {
  private static final MessageCatalog CATALOG = new MessageCatalog();

  private NamespaceErrors() {}

  public static NamespaceException unknownParent(DirectoryId parent) {
    return build(ErrorCode.UNKNOWN_PARENT, null, Map.of("parent", parent.toString()), null);
  }

  public static NamespaceException duplicateName(DirectoryId parent, EntryKind kind, String name) {
    return build(
        ErrorCode.DUPLICATE_NAME,
        kind.label(),
        params("parent", parent.toString(), "kind", kind.label(), "name", name),
        null);
  }

  public static NamespaceException selfParent(DirectoryId directory) {
    return build(ErrorCode.SELF_PARENT, null, Map.of("directory", directory.toString()), null);
  }

  public static NamespaceException cycleRejected(DirectoryId directory, DirectoryId target) {
    return build(
        ErrorCode.CYCLE_REJECTED,
        directory.equals(target) ? "self" : null,
        params("directory", directory.toString(), "target", target.toString()),
        null);
  }

  public static NamespaceException rootUndeletable() {
    return build(ErrorCode.ROOT_UNDELETABLE, null, Map.of(), null);
  }

  public static NamespaceException rootImmutable() {
    return build(ErrorCode.ROOT_IMMUTABLE, null, Map.of(), null);
  }

  public static NamespaceException permissionDenied(String principal, Capability capability) {
    return build(
        ErrorCode.PERMISSION_DENIED,
        capability.key(),
        params("principal", String.valueOf(principal), "capability", capability.key()),
        null);
  }

  public static NamespaceException notFound(EntryKind kind, long id) {
    return build(
        ErrorCode.NOT_FOUND,
        kind.label(),
        params("resource", kind.label(), "id", Long.toString(id)),
        null);
  }

  public static NamespaceException invalidName(String name, String reason) {
    return build(ErrorCode.INVALID_NAME, reason, Map.of("name", String.valueOf(name)), null);
  }

  public static NamespaceException invalidArgument(String field) {
    return build(ErrorCode.INVALID_ARGUMENT, null, Map.of("field", field), null);
  }

  public static NamespaceException storageFailure(String op, StorageException cause) {
    return build(
        ErrorCode.STORAGE_FAILURE,
        null,
        params("op", op, "detail", String.valueOf(cause.getMessage())),
        cause);
  }

  /** Translates a store-level constraint violation into the matching engine error. */
  public static NamespaceException fromConstraint(TreeConstraintException e) {
    NamespaceException mapped;
    if (e instanceof TreeConstraintException.DuplicateName dup) {
      mapped = duplicateName(dup.parent(), dup.kind(), dup.name());
    } else if (e instanceof TreeConstraintException.UnknownParent up) {
      mapped = unknownParent(up.parent());
    } else if (e instanceof TreeConstraintException.SelfParent sp) {
      mapped = selfParent(sp.directory());
    } else if (e instanceof TreeConstraintException.UnknownEntry ue) {
      mapped = notFound(ue.kind(), ue.id());
    } else if (e instanceof TreeConstraintException.PermanentRoot) {
      mapped = rootUndeletable();
    } else {
      return build(
          ErrorCode.STORAGE_FAILURE,
          "constraint",
          params("op", "constraint", "detail", String.valueOf(e.getMessage())),
          e);
    }
    return new NamespaceException(
        mapped.code(), mapped.messageKey(), mapped.params(), mapped.getMessage(), e);
  }

  private static Map<String, String> params(String... kv) {
    var m = new LinkedHashMap<String, String>();
    for (int i = 0; i < kv.length; i += 2) {
      m.put(kv[i], kv[i + 1]);
    }
    return m;
  }

  private static NamespaceException build(
      ErrorCode code, String messageKey, Map<String, String> params, Throwable t) {
    String message = CATALOG.render(code, messageKey, params);
    return new NamespaceException(code, messageKey, params, message, t);
  }
}
