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

package ai.floedb.arbor.storage.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.EntryKind;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.model.TreeEntry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileTreeStoreTest {

  @TempDir Path tmp;

  private static void seed(FileTreeStore store) {
    store.atomically(
        () -> {
          store.insertDirectory(DirectoryId.of(1));
          store.insertDirEdge(DirectoryId.ROOT, DirectoryId.of(1), "projects");
          store.insertNote(NoteId.of(1), "first draft");
          store.insertNoteEdge(DirectoryId.of(1), NoteId.of(1), "readme");
          store.commit();
          return null;
        });
  }

  @Test
  void missingFileStartsWithRootOnly() {
    var file = tmp.resolve("tree.json");
    try (var store = FileTreeStore.open(file)) {
      assertThat(store.directoryCount()).isEqualTo(1);
      assertThat(store.noteCount()).isZero();
    }
    assertThat(file).doesNotExist();
  }

  @Test
  void committedStateSurvivesReopen() throws Exception {
    var file = tmp.resolve("nested/dir/tree.json");
    try (var store = FileTreeStore.open(file)) {
      seed(store);
    }
    assertThat(file).exists();

    try (var reopened = FileTreeStore.open(file)) {
      assertThat(reopened.lookupChild(DirectoryId.ROOT, "projects"))
          .contains(TreeEntry.directory(DirectoryId.of(1), "projects"));
      assertThat(reopened.lookupChild(DirectoryId.of(1), "readme"))
          .contains(TreeEntry.note(NoteId.of(1), "readme"));
      assertThat(reopened.noteContent(NoteId.of(1))).contains("first draft");
      assertThat(reopened.maxId(EntryKind.DIRECTORY)).isEqualTo(1L);
      assertThat(reopened.maxId(EntryKind.NOTE)).isEqualTo(1L);
    }
    try (var stream = Files.list(file.getParent())) {
      assertThat(stream).containsExactly(file);
    }
  }

  @Test
  void uncommittedWritesAreNotDurable() {
    var file = tmp.resolve("tree.json");
    try (var store = FileTreeStore.open(file)) {
      seed(store);
      store.atomically(
          () -> {
            store.insertDirectory(DirectoryId.of(2));
            store.insertDirEdge(DirectoryId.ROOT, DirectoryId.of(2), "scratch");
            return null;
          });
    }
    try (var reopened = FileTreeStore.open(file)) {
      assertThat(reopened.lookupChild(DirectoryId.ROOT, "scratch")).isEmpty();
      assertThat(reopened.directoryCount()).isEqualTo(2);
    }
  }

  @Test
  void snapshotUsesDocumentedFieldNames() throws Exception {
    var file = tmp.resolve("tree.json");
    try (var store = FileTreeStore.open(file)) {
      seed(store);
    }
    var json = Files.readString(file);
    assertThat(json)
        .contains("\"version\"")
        .contains("\"noteChildren\"")
        .contains("\"dirChildren\"")
        .contains("\"childName\" : \"readme\"");
  }

  @Test
  void cyclicSnapshotIsRejected() throws Exception {
    var file = tmp.resolve("tree.json");
    Files.writeString(
        file,
        "{\"version\":1,\"notes\":[],\"directories\":[{\"id\":0},{\"id\":1},{\"id\":2}],"
            + "\"noteChildren\":[],"
            + "\"dirChildren\":[{\"parentId\":1,\"childId\":2,\"childName\":\"a\"},"
            + "{\"parentId\":2,\"childId\":1,\"childName\":\"b\"}]}",
        StandardCharsets.UTF_8);

    assertThatThrownBy(() -> FileTreeStore.open(file)).isInstanceOf(StorageException.class);
  }

  @Test
  void malformedOrUnknownVersionIsRejected() throws Exception {
    var file = tmp.resolve("tree.json");
    Files.writeString(file, "{not json", StandardCharsets.UTF_8);
    assertThatThrownBy(() -> FileTreeStore.open(file))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("failed to read");

    Files.writeString(
        file,
        "{\"version\":9,\"notes\":[],\"directories\":[],\"noteChildren\":[],\"dirChildren\":[]}",
        StandardCharsets.UTF_8);
    assertThatThrownBy(() -> FileTreeStore.open(file))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("version");
  }

  @Test
  void failedWriteSurfacesAsStorageException() throws Exception {
    var file = tmp.resolve("tree.json");
    try (var store = FileTreeStore.open(file)) {
      // occupy the target with a non-empty directory so the final rename cannot replace it
      Files.createDirectories(file);
      Files.writeString(file.resolve("blocker"), "x");

      assertThatThrownBy(
              () ->
                  store.atomically(
                      () -> {
                        store.commit();
                        return null;
                      }))
          .isInstanceOf(StorageException.class);
    }
    try (var stream = Files.list(tmp)) {
      assertThat(stream).containsExactly(file);
    }
  }
}
