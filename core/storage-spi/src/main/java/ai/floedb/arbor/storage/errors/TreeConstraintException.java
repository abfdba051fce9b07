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

package ai.floedb.arbor.storage.errors;

import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.EntryKind;

/**
 * A tree store write would break one of the table constraints. The store is left unchanged when
 * one of these is thrown.
 */
public abstract class TreeConstraintException extends RuntimeException {

  protected TreeConstraintException(String msg) {
    super(msg);
  }

  /** {@code (parent, name)} is already taken within the edge table of {@code kind}. */
  public static final class DuplicateName extends TreeConstraintException {
    private final DirectoryId parent;
    private final EntryKind kind;
    private final String name;

    public DuplicateName(DirectoryId parent, EntryKind kind, String name) {
      super(kind.label() + " name already used under " + parent + ": " + name);
      this.parent = parent;
      this.kind = kind;
      this.name = name;
    }

    public DirectoryId parent() {
      return parent;
    }

    public EntryKind kind() {
      return kind;
    }

    public String name() {
      return name;
    }
  }

  public static final class UnknownParent extends TreeConstraintException {
    private final DirectoryId parent;

    public UnknownParent(DirectoryId parent) {
      super("no such directory: " + parent);
      this.parent = parent;
    }

    public DirectoryId parent() {
      return parent;
    }
  }

  public static final class SelfParent extends TreeConstraintException {
    private final DirectoryId directory;

    public SelfParent(DirectoryId directory) {
      super("directory cannot be its own parent: " + directory);
      this.directory = directory;
    }

    public DirectoryId directory() {
      return directory;
    }
  }

  /** The child already hangs under some parent; a child has at most one edge. */
  public static final class AlreadyParented extends TreeConstraintException {
    private final EntryKind kind;
    private final long childId;

    public AlreadyParented(EntryKind kind, long childId, DirectoryId currentParent) {
      super(kind.label() + " " + childId + " already has parent " + currentParent);
      this.kind = kind;
      this.childId = childId;
    }

    public EntryKind kind() {
      return kind;
    }

    public long childId() {
      return childId;
    }
  }

  /** The referenced row does not exist. */
  public static final class UnknownEntry extends TreeConstraintException {
    private final EntryKind kind;
    private final long id;

    public UnknownEntry(EntryKind kind, long id) {
      super("no such " + kind.label() + ": " + id);
      this.kind = kind;
      this.id = id;
    }

    public EntryKind kind() {
      return kind;
    }

    public long id() {
      return id;
    }
  }

  /** A row cannot be inserted twice. */
  public static final class DuplicateId extends TreeConstraintException {
    public DuplicateId(EntryKind kind, long id) {
      super(kind.label() + " id already present: " + id);
    }
  }

  /** The root directory row and edges pointing at it as a child. */
  public static final class PermanentRoot extends TreeConstraintException {
    public PermanentRoot(String operation) {
      super("root directory cannot be " + operation);
    }
  }

  /**
   * A row is still referenced by an edge. Removing a directory requires it to have no children and
   * no parent edge; removing a note requires its edge to be gone first.
   */
  public static final class StillLinked extends TreeConstraintException {
    public StillLinked(EntryKind kind, long id, String detail) {
      super(kind.label() + " " + id + " still linked: " + detail);
    }
  }
}
