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

import ai.floedb.arbor.service.common.LogHelper;
import ai.floedb.arbor.service.error.NamespaceErrors;
import ai.floedb.arbor.service.error.NamespaceException;
import ai.floedb.arbor.service.security.Capability;
import ai.floedb.arbor.service.security.PermissionGate;
import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.errors.TreeConstraintException;
import ai.floedb.arbor.storage.model.ChildEdge;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.DirectoryListing;
import ai.floedb.arbor.storage.model.EntryKind;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.model.TreeEntry;
import ai.floedb.arbor.storage.spi.IdAllocator;
import ai.floedb.arbor.storage.spi.TreeStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Applies namespace mutations. Each mutation checks the caller's {@code EDIT} capability, then
 * validates and applies its writes inside one {@link TreeStore#atomically} block, so validation
 * through commit is serialized against every other mutation and hidden from readers until done.
 * Every write records its inverse; if anything fails before the commit returns, the inverses are
 * replayed and the store is left exactly as it was.
 *
 * <p>Reads run against a store snapshot and need no capability.
 */
@ApplicationScoped
public class NamespaceEngine {
  private static final Logger LOG = Logger.getLogger(NamespaceEngine.class);

  static final String PATH_SEPARATOR = "/";

  private final TreeStore store;
  private final AncestryOracle oracle;
  private final PermissionGate gate;
  private final IdAllocator directoryIds;
  private final IdAllocator noteIds;

  @Inject
  public NamespaceEngine(
      TreeStore store,
      AncestryOracle oracle,
      PermissionGate gate,
      @Named("directory-ids") IdAllocator directoryIds,
      @Named("note-ids") IdAllocator noteIds) {
    this.store = Objects.requireNonNull(store, "store");
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.directoryIds = Objects.requireNonNull(directoryIds, "directoryIds");
    this.noteIds = Objects.requireNonNull(noteIds, "noteIds");
  }

  public DirectoryId createDirectory(String principal, DirectoryId parent, String name) {
    requireArg(parent, "parent");
    requireName(name);
    return mutate(
        "CreateDirectory",
        principal,
        undo -> {
          requireParent(parent);
          requireFreeName(parent, EntryKind.DIRECTORY, name);
          var id = DirectoryId.of(directoryIds.allocate());
          store.insertDirectory(id);
          undo.record(() -> store.removeDirectory(id));
          store.insertDirEdge(parent, id, name);
          undo.record(() -> store.removeDirEdge(id));
          return id;
        });
  }

  public NoteId createNote(String principal, DirectoryId parent, String name, String content) {
    requireArg(parent, "parent");
    requireName(name);
    requireContent(content);
    return mutate(
        "CreateNote",
        principal,
        undo -> {
          requireParent(parent);
          requireFreeName(parent, EntryKind.NOTE, name);
          var id = NoteId.of(noteIds.allocate());
          store.insertNote(id, content);
          undo.record(() -> store.removeNote(id));
          store.insertNoteEdge(parent, id, name);
          undo.record(() -> store.removeNoteEdge(id));
          return id;
        });
  }

  /**
   * Reparents {@code dir} under {@code newParent} as {@code newName}. Rejected with {@code
   * CYCLE_REJECTED} when {@code newParent} is {@code dir} or lies below it; the root is an ancestor
   * of every directory, so moving it is always rejected that way.
   */
  public void moveDirectory(
      String principal, DirectoryId dir, DirectoryId newParent, String newName) {
    requireArg(dir, "directory");
    requireArg(newParent, "newParent");
    requireName(newName);
    mutate(
        "MoveDirectory",
        principal,
        undo -> {
          requireDirectory(dir);
          requireParent(newParent);
          if (oracle.isAncestorLocked(dir, newParent)) {
            throw NamespaceErrors.cycleRejected(dir, newParent);
          }
          relinkDirectory(undo, dir, newParent, newName);
          return null;
        });
  }

  public void renameDirectory(String principal, DirectoryId dir, String newName) {
    requireArg(dir, "directory");
    requireName(newName);
    if (dir.isRoot()) {
      throw NamespaceErrors.rootImmutable();
    }
    mutate(
        "RenameDirectory",
        principal,
        undo -> {
          requireDirectory(dir);
          var edge =
              store.dirEdge(dir).orElseThrow(() -> detached(EntryKind.DIRECTORY, dir.value()));
          relinkDirectory(undo, dir, edge.parent(), newName);
          return null;
        });
  }

  public void moveNote(String principal, NoteId note, DirectoryId newParent, String newName) {
    requireArg(note, "note");
    requireArg(newParent, "newParent");
    requireName(newName);
    mutate(
        "MoveNote",
        principal,
        undo -> {
          requireNote(note);
          requireParent(newParent);
          relinkNote(undo, note, newParent, newName);
          return null;
        });
  }

  public void renameNote(String principal, NoteId note, String newName) {
    requireArg(note, "note");
    requireName(newName);
    mutate(
        "RenameNote",
        principal,
        undo -> {
          requireNote(note);
          var edge = store.noteEdge(note).orElseThrow(() -> detached(EntryKind.NOTE, note.value()));
          relinkNote(undo, note, edge.parent(), newName);
          return null;
        });
  }

  public void updateNote(String principal, NoteId note, String content) {
    requireArg(note, "note");
    requireContent(content);
    mutate(
        "UpdateNote",
        principal,
        undo -> {
          requireNote(note);
          var previous = store.updateNoteContent(note, content);
          undo.record(() -> store.updateNoteContent(note, previous));
          return null;
        });
  }

  public void deleteNote(String principal, NoteId note) {
    requireArg(note, "note");
    mutate(
        "DeleteNote",
        principal,
        undo -> {
          requireNote(note);
          removeNote(undo, note);
          return null;
        });
  }

  /**
   * Removes {@code dir}, every directory below it and every note owned anywhere in that subtree,
   * as one unit. The root check comes before the capability check, so deleting the root is always
   * {@code ROOT_UNDELETABLE}.
   */
  public DeletionSummary deleteDirectory(String principal, DirectoryId dir) {
    requireArg(dir, "directory");
    if (dir.isRoot()) {
      throw NamespaceErrors.rootUndeletable();
    }
    return mutate(
        "DeleteDirectory",
        principal,
        undo -> {
          requireDirectory(dir);
          var directories = oracle.descendantsLocked(dir);
          var notes = oracle.ownedNotesLocked(directories);
          for (var note : notes) {
            removeNote(undo, note);
          }
          // children before parents, dir itself last
          var ordered = new ArrayList<>(directories);
          for (int i = ordered.size() - 1; i >= 0; i--) {
            removeDirectory(undo, ordered.get(i));
          }
          return new DeletionSummary(directories.size(), notes.size());
        });
  }

  public Optional<TreeEntry> lookupChild(DirectoryId parent, String name) {
    requireArg(parent, "parent");
    return read("LookupChild", () -> store.lookupChild(parent, name));
  }

  /** The note named {@code name} under {@code parent}, with its content, read in one snapshot. */
  public Optional<Note> lookupNote(DirectoryId parent, String name) {
    requireArg(parent, "parent");
    return read(
        "LookupNote",
        () ->
            store
                .lookupChild(parent, name, EntryKind.NOTE)
                .flatMap(
                    entry ->
                        store
                            .noteContent(entry.noteId())
                            .map(content -> new Note(entry.noteId(), content))));
  }

  /**
   * @throws NamespaceException {@code NOT_FOUND} when {@code dir} does not exist
   */
  public DirectoryListing listChildren(DirectoryId dir) {
    requireArg(dir, "directory");
    return read(
        "ListChildren",
        () -> {
          requireDirectory(dir);
          return store.listChildren(dir);
        });
  }

  public Note readNote(NoteId note) {
    requireArg(note, "note");
    return read(
        "ReadNote",
        () ->
            store
                .noteContent(note)
                .map(content -> new Note(note, content))
                .orElseThrow(() -> NamespaceErrors.notFound(EntryKind.NOTE, note.value())));
  }

  /** Empty for the root. */
  public Optional<DirectoryId> parentOfDirectory(DirectoryId dir) {
    requireArg(dir, "directory");
    return read(
        "ParentOfDirectory",
        () -> {
          requireDirectory(dir);
          return store.dirEdge(dir).map(ChildEdge::parent);
        });
  }

  public DirectoryId parentOfNote(NoteId note) {
    return noteEdge("ParentOfNote", note).parent();
  }

  /** Empty for the root. */
  public Optional<String> nameOfDirectory(DirectoryId dir) {
    requireArg(dir, "directory");
    return read(
        "NameOfDirectory",
        () -> {
          requireDirectory(dir);
          return store.dirEdge(dir).map(ChildEdge::childName);
        });
  }

  public String nameOfNote(NoteId note) {
    return noteEdge("NameOfNote", note).childName();
  }

  /** Names from the root down to {@code dir}. */
  public List<String> pathOf(DirectoryId dir) {
    requireArg(dir, "directory");
    return oracle
        .pathOf(dir)
        .orElseThrow(() -> NamespaceErrors.notFound(EntryKind.DIRECTORY, dir.value()));
  }

  /**
   * Follows {@code segments} down from the root. Every segment but the last must name a directory;
   * the last may name either kind, directories first. An empty list resolves to the root.
   */
  public Optional<TreeEntry> resolvePath(List<String> segments) {
    requireArg(segments, "segments");
    return read(
        "ResolvePath",
        () -> {
          Optional<TreeEntry> current = Optional.of(TreeEntry.directory(DirectoryId.ROOT, ""));
          for (var segment : segments) {
            if (current.isEmpty() || !current.get().isDirectory()) {
              return Optional.<TreeEntry>empty();
            }
            current = store.lookupChild(current.get().directoryId(), segment);
          }
          return current;
        });
  }

  private ChildEdge noteEdge(String op, NoteId note) {
    requireArg(note, "note");
    return read(
        op,
        () -> {
          requireNote(note);
          return store.noteEdge(note).orElseThrow(() -> detached(EntryKind.NOTE, note.value()));
        });
  }

  private void relinkDirectory(
      UndoLog undo, DirectoryId dir, DirectoryId newParent, String newName) {
    var old = store.dirEdge(dir).orElseThrow(() -> detached(EntryKind.DIRECTORY, dir.value()));
    if (old.parent().equals(newParent) && old.childName().equals(newName)) {
      return;
    }
    requireFreeName(newParent, EntryKind.DIRECTORY, newName);
    store.removeDirEdge(dir);
    undo.record(() -> store.insertDirEdge(old.parent(), dir, old.childName()));
    store.insertDirEdge(newParent, dir, newName);
    undo.record(() -> store.removeDirEdge(dir));
  }

  private void relinkNote(UndoLog undo, NoteId note, DirectoryId newParent, String newName) {
    var old = store.noteEdge(note).orElseThrow(() -> detached(EntryKind.NOTE, note.value()));
    if (old.parent().equals(newParent) && old.childName().equals(newName)) {
      return;
    }
    requireFreeName(newParent, EntryKind.NOTE, newName);
    store.removeNoteEdge(note);
    undo.record(() -> store.insertNoteEdge(old.parent(), note, old.childName()));
    store.insertNoteEdge(newParent, note, newName);
    undo.record(() -> store.removeNoteEdge(note));
  }

  private void removeNote(UndoLog undo, NoteId note) {
    var edge = store.removeNoteEdge(note);
    edge.ifPresent(
        e -> undo.record(() -> store.insertNoteEdge(e.parent(), note, e.childName())));
    var content = store.removeNote(note);
    content.ifPresent(c -> undo.record(() -> store.insertNote(note, c)));
  }

  private void removeDirectory(UndoLog undo, DirectoryId dir) {
    var edge = store.removeDirEdge(dir);
    edge.ifPresent(e -> undo.record(() -> store.insertDirEdge(e.parent(), dir, e.childName())));
    if (store.removeDirectory(dir)) {
      undo.record(() -> store.insertDirectory(dir));
    }
  }

  private <T> T mutate(String op, String principal, Function<UndoLog, T> body) {
    var log = LogHelper.start(LOG, op);
    try {
      gate.require(principal, Capability.EDIT);
      T result =
          store.atomically(
              () -> {
                var undo = new UndoLog();
                try {
                  T r = body.apply(undo);
                  store.commit();
                  return r;
                } catch (Throwable e) {
                  undo.rollback(e);
                  throw e;
                }
              });
      log.ok();
      return result;
    } catch (NamespaceException e) {
      log.rejected(e);
      throw e;
    } catch (TreeConstraintException e) {
      var mapped = NamespaceErrors.fromConstraint(e);
      log.rejected(mapped);
      throw mapped;
    } catch (StorageException e) {
      log.fail(e);
      throw NamespaceErrors.storageFailure(op, e);
    } catch (RuntimeException | Error e) {
      log.fail(e);
      throw e;
    }
  }

  private <T> T read(String op, Supplier<T> body) {
    try {
      return store.snapshot(body);
    } catch (StorageException e) {
      LOG.errorf(e, "op=%s fail", op);
      throw NamespaceErrors.storageFailure(op, e);
    }
  }

  private void requireParent(DirectoryId parent) {
    if (!store.directoryExists(parent)) {
      throw NamespaceErrors.unknownParent(parent);
    }
  }

  private void requireDirectory(DirectoryId dir) {
    if (!store.directoryExists(dir)) {
      throw NamespaceErrors.notFound(EntryKind.DIRECTORY, dir.value());
    }
  }

  private void requireNote(NoteId note) {
    if (!store.noteExists(note)) {
      throw NamespaceErrors.notFound(EntryKind.NOTE, note.value());
    }
  }

  private void requireFreeName(DirectoryId parent, EntryKind kind, String name) {
    if (store.lookupChild(parent, name, kind).isPresent()) {
      throw NamespaceErrors.duplicateName(parent, kind, name);
    }
  }

  private static void requireArg(Object value, String field) {
    if (value == null) {
      throw NamespaceErrors.invalidArgument(field);
    }
  }

  /** Content must be well-formed UTF-16: every surrogate belongs to a pair. */
  private static void requireContent(String content) {
    requireArg(content, "content");
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      if (Character.isHighSurrogate(c)
          && i + 1 < content.length()
          && Character.isLowSurrogate(content.charAt(i + 1))) {
        i++;
      } else if (Character.isSurrogate(c)) {
        throw NamespaceErrors.invalidArgument("content");
      }
    }
  }

  private static void requireName(String name) {
    if (name == null || name.isBlank()) {
      throw NamespaceErrors.invalidName(name, "blank");
    }
    if (name.contains(PATH_SEPARATOR)) {
      throw NamespaceErrors.invalidName(name, "separator");
    }
  }

  private static StorageException detached(EntryKind kind, long id) {
    return new StorageException(kind.label() + " " + id + " has no parent edge");
  }
}
