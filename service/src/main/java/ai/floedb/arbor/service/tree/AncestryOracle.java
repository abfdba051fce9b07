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

import ai.floedb.arbor.service.error.NamespaceErrors;
import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.NoteId;
import ai.floedb.arbor.storage.spi.TreeStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Closure queries over the directory-parent relation. Every query runs against one store snapshot,
 * and every walk uses an explicit worklist.
 */
@ApplicationScoped
public class AncestryOracle {

  private final TreeStore store;

  @Inject
  public AncestryOracle(TreeStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * True iff {@code candidate} lies on the path from {@code target} up to the root, {@code target}
   * itself included. False when {@code target} does not exist.
   */
  public boolean isAncestor(DirectoryId candidate, DirectoryId target) {
    return read("isAncestor", () -> isAncestorLocked(candidate, target));
  }

  boolean isAncestorLocked(DirectoryId candidate, DirectoryId target) {
    if (!store.directoryExists(target)) {
      return false;
    }
    int budget = store.directoryCount();
    DirectoryId cur = target;
    while (true) {
      if (cur.equals(candidate)) {
        return true;
      }
      var edge = store.dirEdge(cur);
      if (edge.isEmpty()) {
        return false;
      }
      cur = edge.get().parent();
      if (--budget < 0) {
        throw new StorageException("directory parent chain does not end at root: " + target);
      }
    }
  }

  /**
   * Every directory in the subtree rooted at {@code root}, {@code root} first. Iteration order puts
   * each directory before its children. Empty when {@code root} does not exist.
   */
  public Set<DirectoryId> descendants(DirectoryId root) {
    return read("descendants", () -> Collections.unmodifiableSet(descendantsLocked(root)));
  }

  LinkedHashSet<DirectoryId> descendantsLocked(DirectoryId root) {
    var out = new LinkedHashSet<DirectoryId>();
    if (!store.directoryExists(root)) {
      return out;
    }
    var work = new ArrayDeque<DirectoryId>();
    work.add(root);
    while (!work.isEmpty()) {
      var dir = work.poll();
      if (!out.add(dir)) {
        throw new StorageException("directory reached twice below " + root + ": " + dir);
      }
      work.addAll(store.childDirectories(dir));
    }
    return out;
  }

  /** Notes owned anywhere in the subtree rooted at {@code root}. */
  public Set<NoteId> ownedNotes(DirectoryId root) {
    return read(
        "ownedNotes", () -> Collections.unmodifiableSet(ownedNotesLocked(descendantsLocked(root))));
  }

  LinkedHashSet<NoteId> ownedNotesLocked(Set<DirectoryId> directories) {
    var out = new LinkedHashSet<NoteId>();
    for (var dir : directories) {
      out.addAll(store.childNotes(dir));
    }
    return out;
  }

  /**
   * Names from the root down to {@code dir}; empty list for the root itself, empty optional when
   * {@code dir} does not exist.
   */
  public Optional<List<String>> pathOf(DirectoryId dir) {
    return read(
        "pathOf",
        () -> {
          if (!store.directoryExists(dir)) {
            return Optional.<List<String>>empty();
          }
          var names = new ArrayList<String>();
          int budget = store.directoryCount();
          var edge = store.dirEdge(dir);
          while (edge.isPresent()) {
            names.add(edge.get().childName());
            edge = store.dirEdge(edge.get().parent());
            if (--budget < 0) {
              throw new StorageException("directory parent chain does not end at root: " + dir);
            }
          }
          Collections.reverse(names);
          return Optional.<List<String>>of(List.copyOf(names));
        });
  }

  private <T> T read(String op, Supplier<T> body) {
    try {
      return store.snapshot(body);
    } catch (StorageException e) {
      throw NamespaceErrors.storageFailure(op, e);
    }
  }
}
