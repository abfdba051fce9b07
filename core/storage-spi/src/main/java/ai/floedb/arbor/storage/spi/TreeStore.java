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

package ai.floedb.arbor.storage.spi;

import ai.floedb.arbor.storage.model.ChildEdge;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.DirectoryListing;
import ai.floedb.arbor.storage.model.EntryKind;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.model.TreeEntry;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rows for notes and directories plus the two child-edge tables.
 *
 * <p>Every method is atomic on its own. {@link #atomically} runs several calls as one exclusive
 * unit: other callers, readers included, see either none or all of its effects. {@link #snapshot}
 * runs several reads against one stable state. Edge removal never cascades; callers remove
 * descendants themselves.
 *
 * <p>Writes throw {@link ai.floedb.arbor.storage.errors.TreeConstraintException} subtypes and leave
 * the store unchanged when a constraint would break. Any method may throw {@link
 * ai.floedb.arbor.storage.errors.StorageException}.
 */
public interface TreeStore extends AutoCloseable {

  <T> T atomically(Supplier<T> work);

  <T> T snapshot(Supplier<T> work);

  /**
   * Durability point for the enclosing {@link #atomically} block. Must be called from inside one. A
   * failure leaves durable state as it was before the block; the in-memory view still holds the
   * block's writes until the caller undoes them.
   */
  void commit();

  boolean directoryExists(DirectoryId id);

  void insertDirectory(DirectoryId id);

  boolean removeDirectory(DirectoryId id);

  boolean noteExists(NoteId id);

  void insertNote(NoteId id, String content);

  Optional<String> noteContent(NoteId id);

  /** Returns the previous content. */
  String updateNoteContent(NoteId id, String content);

  /** Returns the removed content, or empty if the note did not exist. */
  Optional<String> removeNote(NoteId id);

  void insertNoteEdge(DirectoryId parent, NoteId child, String name);

  void insertDirEdge(DirectoryId parent, DirectoryId child, String name);

  /** Idempotent. Returns the removed edge, or empty if the note had none. */
  Optional<ChildEdge> removeNoteEdge(NoteId child);

  /** Idempotent. Children of {@code child} keep their edges. */
  Optional<ChildEdge> removeDirEdge(DirectoryId child);

  Optional<ChildEdge> noteEdge(NoteId child);

  Optional<ChildEdge> dirEdge(DirectoryId child);

  /** Looks in the directory namespace first, then the note namespace. */
  Optional<TreeEntry> lookupChild(DirectoryId parent, String name);

  Optional<TreeEntry> lookupChild(DirectoryId parent, String name, EntryKind kind);

  /** Name-ordered children; empty when {@code parent} does not exist. */
  DirectoryListing listChildren(DirectoryId parent);

  List<DirectoryId> childDirectories(DirectoryId parent);

  List<NoteId> childNotes(DirectoryId parent);

  int directoryCount();

  int noteCount();

  /**
   * Highest id ever inserted for {@code kind}, rows since removed included; {@code 0} when none.
   * Durable stores keep this mark across restarts.
   */
  long maxId(EntryKind kind);

  @Override
  void close();
}
