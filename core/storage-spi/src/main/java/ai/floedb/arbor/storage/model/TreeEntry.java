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

/** A named child of some directory, as seen through one of the two edge namespaces. */
public record TreeEntry(EntryKind kind, long id, String name) {

  public TreeEntry {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
  }

  public static TreeEntry directory(DirectoryId id, String name) {
    return new TreeEntry(EntryKind.DIRECTORY, id.value(), name);
  }

  public static TreeEntry note(NoteId id, String name) {
    return new TreeEntry(EntryKind.NOTE, id.value(), name);
  }

  public boolean isNote() {
    return kind == EntryKind.NOTE;
  }

  public boolean isDirectory() {
    return kind == EntryKind.DIRECTORY;
  }

  public DirectoryId directoryId() {
    if (kind != EntryKind.DIRECTORY) {
      throw new IllegalStateException("entry is a note: " + name);
    }
    return DirectoryId.of(id);
  }

  public NoteId noteId() {
    if (kind != EntryKind.NOTE) {
      throw new IllegalStateException("entry is a directory: " + name);
    }
    return NoteId.of(id);
  }
}
