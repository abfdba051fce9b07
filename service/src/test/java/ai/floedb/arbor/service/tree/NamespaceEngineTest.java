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

package ai.floedb.arbor.service.tree;

import static ai.floedb.arbor.service.testsupport.EngineFixture.EDITOR;
import static ai.floedb.arbor.service.testsupport.EngineFixture.READER;
import static ai.floedb.arbor.service.testsupport.EngineFixture.assertCode;
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.arbor.service.error.ErrorCode;
import ai.floedb.arbor.service.testsupport.EngineFixture;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.model.TreeEntry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NamespaceEngineTest {
  private static final DirectoryId ROOT = DirectoryId.ROOT;

  private EngineFixture fx;
  private NamespaceEngine engine;

  @BeforeEach
  void setUp() {
    fx = new EngineFixture();
    engine = fx.engine;
  }

  @Test
  void moveIntoOwnSubtreeIsRejectedThenCascadeDeleteRemovesBoth() {
    var a = engine.createDirectory(EDITOR, ROOT, "A");
    var b = engine.createDirectory(EDITOR, a, "B");
    assertThat(a).isEqualTo(DirectoryId.of(1));
    assertThat(b).isEqualTo(DirectoryId.of(2));

    assertCode(() -> engine.moveDirectory(EDITOR, a, b, "a"), ErrorCode.CYCLE_REJECTED);
    assertThat(engine.parentOfDirectory(a)).contains(ROOT);

    var summary = engine.deleteDirectory(EDITOR, a);

    assertThat(summary).isEqualTo(new DeletionSummary(2, 0));
    assertThat(fx.store.directoryExists(a)).isFalse();
    assertThat(fx.store.directoryExists(b)).isFalse();
    assertThat(engine.lookupChild(ROOT, "A")).isEmpty();
  }

  @Test
  void noteLifecycle() {
    var id = engine.createNote(EDITOR, ROOT, "readme", "hello");

    var found = engine.lookupChild(ROOT, "readme").orElseThrow();
    assertThat(found).isEqualTo(TreeEntry.note(id, "readme"));
    assertThat(engine.readNote(found.noteId()).content()).isEqualTo("hello");

    engine.deleteNote(EDITOR, id);

    assertThat(engine.lookupChild(ROOT, "readme")).isEmpty();
    assertCode(() -> engine.readNote(id), ErrorCode.NOT_FOUND);
  }

  @Test
  void lookupNoteReturnsContentAndSkipsDirectories() {
    var id = engine.createNote(EDITOR, ROOT, "readme", "hello");
    engine.createDirectory(EDITOR, ROOT, "docs");

    assertThat(engine.lookupNote(ROOT, "readme")).contains(new Note(id, "hello"));
    assertThat(engine.lookupNote(ROOT, "docs")).isEmpty();
    assertThat(engine.lookupNote(ROOT, "missing")).isEmpty();
  }

  @Test
  void contentWithUnpairedSurrogateIsRejectedBeforeAnyWrite() {
    var id = engine.createNote(EDITOR, ROOT, "emoji", "ok \uD83D\uDE00");
    var before = fx.store.tables();

    assertCode(
        () -> engine.createNote(EDITOR, ROOT, "broken", "x\uD83D"), ErrorCode.INVALID_ARGUMENT);
    assertCode(() -> engine.updateNote(EDITOR, id, "\uDE00y"), ErrorCode.INVALID_ARGUMENT);

    assertThat(fx.store.tables()).isEqualTo(before);
    assertThat(engine.readNote(id).content()).isEqualTo("ok \uD83D\uDE00");
  }

  @Test
  void duplicateDirectoryNameIsRejected() {
    engine.createDirectory(EDITOR, ROOT, "x");
    assertCode(() -> engine.createDirectory(EDITOR, ROOT, "x"), ErrorCode.DUPLICATE_NAME);
    assertThat(fx.store.directoryCount()).isEqualTo(2);
  }

  @Test
  void directoryAndNoteMayShareANameUnderOneParent() {
    var dir = engine.createDirectory(EDITOR, ROOT, "shared");
    var note = engine.createNote(EDITOR, ROOT, "shared", "body");

    var listing = engine.listChildren(ROOT);
    assertThat(listing.directories()).containsExactly(TreeEntry.directory(dir, "shared"));
    assertThat(listing.notes()).containsExactly(TreeEntry.note(note, "shared"));
    // directory namespace wins for untyped lookup and path resolution
    assertThat(engine.lookupChild(ROOT, "shared")).contains(TreeEntry.directory(dir, "shared"));
    assertCode(() -> engine.createNote(EDITOR, ROOT, "shared", "again"), ErrorCode.DUPLICATE_NAME);
  }

  @Test
  void rootCanNeverBeDeleted() {
    assertCode(() -> engine.deleteDirectory(EDITOR, ROOT), ErrorCode.ROOT_UNDELETABLE);
    assertCode(() -> engine.deleteDirectory(READER, ROOT), ErrorCode.ROOT_UNDELETABLE);
    assertCode(() -> engine.deleteDirectory(null, ROOT), ErrorCode.ROOT_UNDELETABLE);
    assertThat(fx.store.directoryExists(ROOT)).isTrue();
  }

  @Test
  void rootCannotBeMovedOrRenamed() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    assertCode(() -> engine.moveDirectory(EDITOR, ROOT, a, "root"), ErrorCode.CYCLE_REJECTED);
    assertCode(() -> engine.moveDirectory(EDITOR, ROOT, ROOT, "root"), ErrorCode.CYCLE_REJECTED);
    assertCode(() -> engine.renameDirectory(EDITOR, ROOT, "top"), ErrorCode.ROOT_IMMUTABLE);
  }

  @Test
  void moveOntoItselfIsACycle() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    assertCode(() -> engine.moveDirectory(EDITOR, a, a, "a"), ErrorCode.CYCLE_REJECTED);
  }

  @Test
  void createUnderMissingParentIsUnknownParent() {
    assertCode(
        () -> engine.createDirectory(EDITOR, DirectoryId.of(99), "x"), ErrorCode.UNKNOWN_PARENT);
    assertCode(
        () -> engine.createNote(EDITOR, DirectoryId.of(99), "x", ""), ErrorCode.UNKNOWN_PARENT);
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    assertCode(
        () -> engine.moveDirectory(EDITOR, a, DirectoryId.of(99), "a"), ErrorCode.UNKNOWN_PARENT);
  }

  @Test
  void writesWithoutEditCapabilityAreDeniedAndLeaveNoTrace() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var n = engine.createNote(EDITOR, a, "n", "text");
    var before = fx.store.tables();

    assertCode(() -> engine.createDirectory(READER, ROOT, "b"), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.createNote("mallory", ROOT, "b", ""), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.moveDirectory(READER, a, ROOT, "c"), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.renameNote(READER, n, "m"), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.updateNote(READER, n, "x"), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.deleteNote(READER, n), ErrorCode.PERMISSION_DENIED);
    assertCode(() -> engine.deleteDirectory(READER, a), ErrorCode.PERMISSION_DENIED);

    assertThat(fx.store.tables()).isEqualTo(before);
  }

  @Test
  void invalidNamesAreRejectedBeforeAnyWrite() {
    assertCode(() -> engine.createDirectory(EDITOR, ROOT, ""), ErrorCode.INVALID_NAME);
    assertCode(() -> engine.createDirectory(EDITOR, ROOT, "  "), ErrorCode.INVALID_NAME);
    assertCode(() -> engine.createDirectory(EDITOR, ROOT, null), ErrorCode.INVALID_NAME);
    assertCode(() -> engine.createNote(EDITOR, ROOT, "a/b", "x"), ErrorCode.INVALID_NAME);
    assertCode(() -> engine.createNote(EDITOR, ROOT, "ok", null), ErrorCode.INVALID_ARGUMENT);
    assertCode(() -> engine.createDirectory(EDITOR, null, "x"), ErrorCode.INVALID_ARGUMENT);
    assertThat(fx.store.directoryCount()).isEqualTo(1);
    assertThat(fx.store.noteCount()).isZero();
  }

  @Test
  void moveDirectoryCarriesItsSubtree() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var b = engine.createDirectory(EDITOR, ROOT, "b");
    var c = engine.createDirectory(EDITOR, a, "c");
    var n = engine.createNote(EDITOR, c, "n", "deep");

    engine.moveDirectory(EDITOR, a, b, "a2");

    assertThat(engine.pathOf(c)).containsExactly("b", "a2", "c");
    assertThat(engine.resolvePath(List.of("b", "a2", "c", "n")))
        .contains(TreeEntry.note(n, "n"));
    assertThat(engine.lookupChild(ROOT, "a")).isEmpty();
    assertThat(fx.oracle.isAncestor(b, c)).isTrue();
  }

  @Test
  void moveToOccupiedNameIsDuplicate() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var b = engine.createDirectory(EDITOR, ROOT, "b");
    engine.createDirectory(EDITOR, b, "taken");

    assertCode(() -> engine.moveDirectory(EDITOR, a, b, "taken"), ErrorCode.DUPLICATE_NAME);
    assertThat(engine.parentOfDirectory(a)).contains(ROOT);
    assertThat(engine.nameOfDirectory(a)).contains("a");
  }

  @Test
  void moveToCurrentPlaceIsANoOp() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    engine.moveDirectory(EDITOR, a, ROOT, "a");
    engine.renameDirectory(EDITOR, a, "a");
    assertThat(engine.nameOfDirectory(a)).contains("a");
  }

  @Test
  void renameDirectoryKeepsParentAndChildren() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var inner = engine.createDirectory(EDITOR, a, "inner");
    engine.createDirectory(EDITOR, ROOT, "other");

    engine.renameDirectory(EDITOR, a, "renamed");

    assertThat(engine.pathOf(inner)).containsExactly("renamed", "inner");
    assertCode(() -> engine.renameDirectory(EDITOR, a, "other"), ErrorCode.DUPLICATE_NAME);
    assertCode(
        () -> engine.renameDirectory(EDITOR, DirectoryId.of(50), "x"), ErrorCode.NOT_FOUND);
  }

  @Test
  void noteMoveRenameAndUpdate() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var n = engine.createNote(EDITOR, ROOT, "draft", "v1");
    engine.createNote(EDITOR, a, "final", "other");

    assertCode(() -> engine.moveNote(EDITOR, n, a, "final"), ErrorCode.DUPLICATE_NAME);
    engine.moveNote(EDITOR, n, a, "draft");
    engine.renameNote(EDITOR, n, "v1.txt");
    engine.updateNote(EDITOR, n, "v2");

    assertThat(engine.parentOfNote(n)).isEqualTo(a);
    assertThat(engine.nameOfNote(n)).isEqualTo("v1.txt");
    assertThat(engine.readNote(n)).isEqualTo(new Note(n, "v2"));
    assertCode(() -> engine.moveNote(EDITOR, NoteId.of(77), a, "x"), ErrorCode.NOT_FOUND);
    assertCode(() -> engine.moveNote(EDITOR, n, DirectoryId.of(77), "x"), ErrorCode.UNKNOWN_PARENT);
    assertCode(() -> engine.updateNote(EDITOR, NoteId.of(77), "x"), ErrorCode.NOT_FOUND);
  }

  @Test
  void cascadeDeleteRemovesEveryOwnedNote() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var b = engine.createDirectory(EDITOR, a, "b");
    var c = engine.createDirectory(EDITOR, b, "c");
    var sibling = engine.createDirectory(EDITOR, ROOT, "sibling");
    var n1 = engine.createNote(EDITOR, a, "n1", "1");
    var n2 = engine.createNote(EDITOR, c, "n2", "2");
    var kept = engine.createNote(EDITOR, sibling, "kept", "3");

    var summary = engine.deleteDirectory(EDITOR, a);

    assertThat(summary).isEqualTo(new DeletionSummary(3, 2));
    assertThat(fx.oracle.descendants(a)).isEmpty();
    assertThat(fx.oracle.ownedNotes(a)).isEmpty();
    for (var dir : List.of(a, b, c)) {
      assertThat(fx.store.directoryExists(dir)).isFalse();
    }
    assertThat(fx.store.noteExists(n1)).isFalse();
    assertThat(fx.store.noteExists(n2)).isFalse();
    assertThat(engine.readNote(kept).content()).isEqualTo("3");
    assertCode(() -> engine.deleteDirectory(EDITOR, a), ErrorCode.NOT_FOUND);
  }

  @Test
  void identifiersAreNeverReused() {
    var a = engine.createDirectory(EDITOR, ROOT, "a");
    var n = engine.createNote(EDITOR, ROOT, "n", "");
    engine.deleteDirectory(EDITOR, a);
    engine.deleteNote(EDITOR, n);

    assertThat(engine.createDirectory(EDITOR, ROOT, "a").value()).isGreaterThan(a.value());
    assertThat(engine.createNote(EDITOR, ROOT, "n", "").value()).isGreaterThan(n.value());
  }

  @Test
  void rejectedCreateDoesNotCauseIdCollisions() {
    var first = engine.createDirectory(EDITOR, ROOT, "a");
    assertCode(() -> engine.createDirectory(EDITOR, ROOT, "a"), ErrorCode.DUPLICATE_NAME);
    var second = engine.createDirectory(EDITOR, ROOT, "b");
    assertThat(second.value()).isGreaterThan(first.value());
  }

  @Test
  void readsOfMissingEntitiesAreNotFound() {
    assertCode(() -> engine.listChildren(DirectoryId.of(5)), ErrorCode.NOT_FOUND);
    assertCode(() -> engine.parentOfDirectory(DirectoryId.of(5)), ErrorCode.NOT_FOUND);
    assertCode(() -> engine.parentOfNote(NoteId.of(5)), ErrorCode.NOT_FOUND);
    assertCode(() -> engine.nameOfNote(NoteId.of(5)), ErrorCode.NOT_FOUND);
    assertCode(() -> engine.pathOf(DirectoryId.of(5)), ErrorCode.NOT_FOUND);
    assertThat(engine.lookupChild(DirectoryId.of(5), "x")).isEmpty();
  }

  @Test
  void rootHasNoParentNoNameAndEmptyPath() {
    assertThat(engine.parentOfDirectory(ROOT)).isEmpty();
    assertThat(engine.nameOfDirectory(ROOT)).isEmpty();
    assertThat(engine.pathOf(ROOT)).isEmpty();
    assertThat(engine.resolvePath(List.of())).contains(TreeEntry.directory(ROOT, ""));
  }

  @Test
  void resolvePathStopsAtNotes() {
    engine.createNote(EDITOR, ROOT, "file", "x");
    assertThat(engine.resolvePath(List.of("file", "below"))).isEmpty();
    assertThat(engine.resolvePath(List.of("missing"))).isEmpty();
  }

  @Test
  void listChildrenIsOrderedByName() {
    engine.createDirectory(EDITOR, ROOT, "b");
    engine.createDirectory(EDITOR, ROOT, "a");
    engine.createNote(EDITOR, ROOT, "z", "");
    engine.createNote(EDITOR, ROOT, "m", "");

    var listing = engine.listChildren(ROOT);
    assertThat(listing.directories()).extracting(TreeEntry::name).containsExactly("a", "b");
    assertThat(listing.notes()).extracting(TreeEntry::name).containsExactly("m", "z");
  }
}
