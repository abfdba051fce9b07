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

/**
 * One row of either child-edge table: {@code (parent_id, child_id, child_name)}. The child id is
 * unique within its table, so an edge is addressed by {@code (kind, childId)}.
 */
public record ChildEdge(DirectoryId parent, EntryKind kind, long childId, String childName) {

  public ChildEdge {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(childName, "childName");
  }

  public static ChildEdge ofDirectory(DirectoryId parent, DirectoryId child, String name) {
    return new ChildEdge(parent, EntryKind.DIRECTORY, child.value(), name);
  }

  public static ChildEdge ofNote(DirectoryId parent, NoteId child, String name) {
    return new ChildEdge(parent, EntryKind.NOTE, child.value(), name);
  }
}
