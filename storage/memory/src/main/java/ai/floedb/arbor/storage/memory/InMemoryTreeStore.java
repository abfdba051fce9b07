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

package ai.floedb.arbor.storage.memory;

import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.errors.StorageLockTimeoutException;
import ai.floedb.arbor.storage.errors.TreeConstraintException;
import ai.floedb.arbor.storage.model.ChildEdge;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.DirectoryListing;
import ai.floedb.arbor.storage.model.EntryKind;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.model.TreeEntry;
import ai.floedb.arbor.storage.spi.TreeStore;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Arena of directory and note rows keyed by id. Each directory row carries the reverse adjacency
 * for both child namespaces, ordered by name, so listing and descendant walks never scan the whole
 * arena.
 */
@Singleton
public class InMemoryTreeStore implements TreeStore {
  private static final Logger LOG = Logger.getLogger(InMemoryTreeStore.class);

  public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(30);

  private static final class DirectoryRow {
    final long id;
    ChildEdge parentEdge;
    final NavigableMap<String, Long> dirChildren = new TreeMap<>();
    final NavigableMap<String, Long> noteChildren = new TreeMap<>();

    DirectoryRow(long id) {
      this.id = id;
    }

    NavigableMap<String, Long> children(EntryKind kind) {
      return kind == EntryKind.DIRECTORY ? dirChildren : noteChildren;
    }
  }

  private static final class NoteRow {
    final long id;
    String content;
    ChildEdge parentEdge;

    NoteRow(long id, String content) {
      this.id = id;
      this.content = content;
    }
  }

  private final Map<Long, DirectoryRow> directories = new HashMap<>();
  private final Map<Long, NoteRow> notes = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Duration lockTimeout;
  private long lastDirectoryId;
  private long lastNoteId;

  public InMemoryTreeStore() {
    this(DEFAULT_LOCK_TIMEOUT);
  }

  public InMemoryTreeStore(Duration lockTimeout) {
    this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    directories.put(DirectoryId.ROOT.value(), new DirectoryRow(DirectoryId.ROOT.value()));
  }

  @Override
  public <T> T atomically(Supplier<T> work) {
    return withWrite(work);
  }

  @Override
  public <T> T snapshot(Supplier<T> work) {
    return withRead(work);
  }

  @Override
  public void commit() {
    requireWriteHeld("commit");
  }

  protected final void requireWriteHeld(String op) {
    if (!lock.isWriteLockedByCurrentThread()) {
      throw new IllegalStateException(op + " outside of atomically()");
    }
  }

  @Override
  public boolean directoryExists(DirectoryId id) {
    return withRead(() -> directories.containsKey(id.value()));
  }

  @Override
  public void insertDirectory(DirectoryId id) {
    withWrite(
        () -> {
          if (directories.containsKey(id.value())) {
            throw new TreeConstraintException.DuplicateId(EntryKind.DIRECTORY, id.value());
          }
          directories.put(id.value(), new DirectoryRow(id.value()));
          lastDirectoryId = Math.max(lastDirectoryId, id.value());
          return null;
        });
  }

  @Override
  public boolean removeDirectory(DirectoryId id) {
    return withWrite(
        () -> {
          if (id.isRoot()) {
            throw new TreeConstraintException.PermanentRoot("removed");
          }
          var row = directories.get(id.value());
          if (row == null) {
            return false;
          }
          if (row.parentEdge != null) {
            throw new TreeConstraintException.StillLinked(
                EntryKind.DIRECTORY, id.value(), "parent edge under " + row.parentEdge.parent());
          }
          if (!row.dirChildren.isEmpty() || !row.noteChildren.isEmpty()) {
            throw new TreeConstraintException.StillLinked(
                EntryKind.DIRECTORY,
                id.value(),
                (row.dirChildren.size() + row.noteChildren.size()) + " child edges");
          }
          directories.remove(id.value());
          return true;
        });
  }

  @Override
  public boolean noteExists(NoteId id) {
    return withRead(() -> notes.containsKey(id.value()));
  }

  @Override
  public void insertNote(NoteId id, String content) {
    Objects.requireNonNull(content, "content");
    withWrite(
        () -> {
          if (notes.containsKey(id.value())) {
            throw new TreeConstraintException.DuplicateId(EntryKind.NOTE, id.value());
          }
          notes.put(id.value(), new NoteRow(id.value(), content));
          lastNoteId = Math.max(lastNoteId, id.value());
          return null;
        });
  }

  @Override
  public Optional<String> noteContent(NoteId id) {
    return withRead(() -> Optional.ofNullable(notes.get(id.value())).map(n -> n.content));
  }

  @Override
  public String updateNoteContent(NoteId id, String content) {
    Objects.requireNonNull(content, "content");
    return withWrite(
        () -> {
          var row = notes.get(id.value());
          if (row == null) {
            throw new TreeConstraintException.UnknownEntry(EntryKind.NOTE, id.value());
          }
          var previous = row.content;
          row.content = content;
          return previous;
        });
  }

  @Override
  public Optional<String> removeNote(NoteId id) {
    return withWrite(
        () -> {
          var row = notes.get(id.value());
          if (row == null) {
            return Optional.empty();
          }
          if (row.parentEdge != null) {
            throw new TreeConstraintException.StillLinked(
                EntryKind.NOTE, id.value(), "parent edge under " + row.parentEdge.parent());
          }
          notes.remove(id.value());
          return Optional.of(row.content);
        });
  }

  @Override
  public void insertNoteEdge(DirectoryId parent, NoteId child, String name) {
    Objects.requireNonNull(name, "name");
    withWrite(
        () -> {
          var parentRow = requireParent(parent);
          var childRow = notes.get(child.value());
          if (childRow == null) {
            throw new TreeConstraintException.UnknownEntry(EntryKind.NOTE, child.value());
          }
          if (childRow.parentEdge != null) {
            throw new TreeConstraintException.AlreadyParented(
                EntryKind.NOTE, child.value(), childRow.parentEdge.parent());
          }
          if (parentRow.noteChildren.containsKey(name)) {
            throw new TreeConstraintException.DuplicateName(parent, EntryKind.NOTE, name);
          }
          var edge = ChildEdge.ofNote(parent, child, name);
          parentRow.noteChildren.put(name, child.value());
          childRow.parentEdge = edge;
          return null;
        });
  }

  @Override
  public void insertDirEdge(DirectoryId parent, DirectoryId child, String name) {
    Objects.requireNonNull(name, "name");
    withWrite(
        () -> {
          if (parent.equals(child)) {
            throw new TreeConstraintException.SelfParent(child);
          }
          var parentRow = requireParent(parent);
          if (child.isRoot()) {
            throw new TreeConstraintException.PermanentRoot("parented");
          }
          var childRow = directories.get(child.value());
          if (childRow == null) {
            throw new TreeConstraintException.UnknownEntry(EntryKind.DIRECTORY, child.value());
          }
          if (childRow.parentEdge != null) {
            throw new TreeConstraintException.AlreadyParented(
                EntryKind.DIRECTORY, child.value(), childRow.parentEdge.parent());
          }
          if (parentRow.dirChildren.containsKey(name)) {
            throw new TreeConstraintException.DuplicateName(parent, EntryKind.DIRECTORY, name);
          }
          var edge = ChildEdge.ofDirectory(parent, child, name);
          parentRow.dirChildren.put(name, child.value());
          childRow.parentEdge = edge;
          return null;
        });
  }

  @Override
  public Optional<ChildEdge> removeNoteEdge(NoteId child) {
    return withWrite(
        () -> {
          var row = notes.get(child.value());
          if (row == null || row.parentEdge == null) {
            return Optional.empty();
          }
          var edge = row.parentEdge;
          detach(edge);
          row.parentEdge = null;
          return Optional.of(edge);
        });
  }

  @Override
  public Optional<ChildEdge> removeDirEdge(DirectoryId child) {
    return withWrite(
        () -> {
          var row = directories.get(child.value());
          if (row == null || row.parentEdge == null) {
            return Optional.empty();
          }
          var edge = row.parentEdge;
          detach(edge);
          row.parentEdge = null;
          return Optional.of(edge);
        });
  }

  private void detach(ChildEdge edge) {
    var parentRow = directories.get(edge.parent().value());
    if (parentRow != null) {
      parentRow.children(edge.kind()).remove(edge.childName());
    }
  }

  @Override
  public Optional<ChildEdge> noteEdge(NoteId child) {
    return withRead(
        () -> Optional.ofNullable(notes.get(child.value())).map(row -> row.parentEdge));
  }

  @Override
  public Optional<ChildEdge> dirEdge(DirectoryId child) {
    return withRead(
        () -> Optional.ofNullable(directories.get(child.value())).map(row -> row.parentEdge));
  }

  @Override
  public Optional<TreeEntry> lookupChild(DirectoryId parent, String name) {
    return withRead(
        () -> {
          var dir = lookupLocked(parent, name, EntryKind.DIRECTORY);
          return dir.isPresent() ? dir : lookupLocked(parent, name, EntryKind.NOTE);
        });
  }

  @Override
  public Optional<TreeEntry> lookupChild(DirectoryId parent, String name, EntryKind kind) {
    return withRead(() -> lookupLocked(parent, name, kind));
  }

  private Optional<TreeEntry> lookupLocked(DirectoryId parent, String name, EntryKind kind) {
    var row = directories.get(parent.value());
    if (row == null || name == null) {
      return Optional.empty();
    }
    var childId = row.children(kind).get(name);
    return childId == null ? Optional.empty() : Optional.of(new TreeEntry(kind, childId, name));
  }

  @Override
  public DirectoryListing listChildren(DirectoryId parent) {
    return withRead(
        () -> {
          var row = directories.get(parent.value());
          if (row == null) {
            return DirectoryListing.EMPTY;
          }
          return new DirectoryListing(
              entries(row.dirChildren, EntryKind.DIRECTORY),
              entries(row.noteChildren, EntryKind.NOTE));
        });
  }

  private static List<TreeEntry> entries(NavigableMap<String, Long> children, EntryKind kind) {
    var out = new ArrayList<TreeEntry>(children.size());
    for (var e : children.entrySet()) {
      out.add(new TreeEntry(kind, e.getValue(), e.getKey()));
    }
    return out;
  }

  @Override
  public List<DirectoryId> childDirectories(DirectoryId parent) {
    return withRead(
        () -> {
          var row = directories.get(parent.value());
          if (row == null) {
            return List.<DirectoryId>of();
          }
          var out = new ArrayList<DirectoryId>(row.dirChildren.size());
          for (long id : row.dirChildren.values()) {
            out.add(DirectoryId.of(id));
          }
          return out;
        });
  }

  @Override
  public List<NoteId> childNotes(DirectoryId parent) {
    return withRead(
        () -> {
          var row = directories.get(parent.value());
          if (row == null) {
            return List.<NoteId>of();
          }
          var out = new ArrayList<NoteId>(row.noteChildren.size());
          for (long id : row.noteChildren.values()) {
            out.add(NoteId.of(id));
          }
          return out;
        });
  }

  @Override
  public int directoryCount() {
    return withRead(directories::size);
  }

  @Override
  public int noteCount() {
    return withRead(notes::size);
  }

  @Override
  public long maxId(EntryKind kind) {
    return withRead(() -> kind == EntryKind.DIRECTORY ? lastDirectoryId : lastNoteId);
  }

  /** Copies every row and edge out of the arena. */
  public TreeTables tables() {
    return withRead(
        () -> {
          var noteRows = new ArrayList<TreeTables.NoteRow>(notes.size());
          var noteEdges = new ArrayList<ChildEdge>();
          for (var row : notes.values()) {
            noteRows.add(new TreeTables.NoteRow(row.id, row.content));
            if (row.parentEdge != null) {
              noteEdges.add(row.parentEdge);
            }
          }
          var dirIds = new ArrayList<Long>(directories.keySet());
          var dirEdges = new ArrayList<ChildEdge>();
          for (var row : directories.values()) {
            if (row.parentEdge != null) {
              dirEdges.add(row.parentEdge);
            }
          }
          noteRows.sort((a, b) -> Long.compare(a.id(), b.id()));
          Collections.sort(dirIds);
          noteEdges.sort((a, b) -> Long.compare(a.childId(), b.childId()));
          dirEdges.sort((a, b) -> Long.compare(a.childId(), b.childId()));
          return new TreeTables(
              noteRows, dirIds, noteEdges, dirEdges, lastDirectoryId, lastNoteId);
        });
  }

  /**
   * Replaces the whole arena with {@code tables}. The directory edges must form a tree rooted at
   * directory 0 with no detached directories or notes. Anything else is rejected and the arena is
   * left as it was.
   */
  public void restore(TreeTables tables) {
    withWrite(
        () -> {
          var savedDirs = new HashMap<>(directories);
          var savedNotes = new HashMap<>(notes);
          long savedLastDirectoryId = lastDirectoryId;
          long savedLastNoteId = lastNoteId;
          directories.clear();
          notes.clear();
          directories.put(DirectoryId.ROOT.value(), new DirectoryRow(DirectoryId.ROOT.value()));
          lastDirectoryId = 0L;
          lastNoteId = 0L;
          try {
            for (long id : tables.directories()) {
              if (id != DirectoryId.ROOT.value()) {
                insertDirectory(DirectoryId.of(id));
              }
            }
            for (var note : tables.notes()) {
              insertNote(NoteId.of(note.id()), note.content());
            }
            for (var edge : tables.dirEdges()) {
              insertDirEdge(edge.parent(), DirectoryId.of(edge.childId()), edge.childName());
            }
            for (var edge : tables.noteEdges()) {
              insertNoteEdge(edge.parent(), NoteId.of(edge.childId()), edge.childName());
            }
            verifyForestLocked();
            lastDirectoryId = Math.max(lastDirectoryId, tables.lastDirectoryId());
            lastNoteId = Math.max(lastNoteId, tables.lastNoteId());
          } catch (RuntimeException e) {
            directories.clear();
            directories.putAll(savedDirs);
            notes.clear();
            notes.putAll(savedNotes);
            lastDirectoryId = savedLastDirectoryId;
            lastNoteId = savedLastNoteId;
            throw new StorageException("rejected tree tables: " + e.getMessage(), e);
          }
          LOG.debugf(
              "restored %d directories, %d notes", directories.size() - 1, notes.size());
          return null;
        });
  }

  private void verifyForestLocked() {
    Set<Long> seen = new HashSet<>();
    var work = new ArrayDeque<Long>();
    work.push(DirectoryId.ROOT.value());
    while (!work.isEmpty()) {
      long id = work.pop();
      if (!seen.add(id)) {
        throw new IllegalStateException("directory reached twice: " + id);
      }
      for (long child : directories.get(id).dirChildren.values()) {
        work.push(child);
      }
    }
    if (seen.size() != directories.size()) {
      throw new IllegalStateException(
          (directories.size() - seen.size()) + " directories unreachable from root");
    }
    for (var note : notes.values()) {
      if (note.parentEdge == null) {
        throw new IllegalStateException("note without parent: " + note.id);
      }
    }
  }

  @Override
  public void close() {}

  private DirectoryRow requireParent(DirectoryId parent) {
    var row = directories.get(parent.value());
    if (row == null) {
      throw new TreeConstraintException.UnknownParent(parent);
    }
    return row;
  }

  private <T> T withRead(Supplier<T> body) {
    acquire(lock.readLock(), "read");
    try {
      return body.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  private <T> T withWrite(Supplier<T> body) {
    acquire(lock.writeLock(), "write");
    try {
      return body.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void acquire(Lock l, String mode) {
    try {
      if (!l.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new StorageLockTimeoutException(mode, lockTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageException("interrupted waiting for store " + mode + " lock", e);
    }
  }
}
