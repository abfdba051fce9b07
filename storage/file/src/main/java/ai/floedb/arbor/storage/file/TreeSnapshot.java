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

import ai.floedb.arbor.storage.memory.TreeTables;
import ai.floedb.arbor.storage.model.ChildEdge;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.EntryKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.List;

/** On-disk form of {@link TreeTables}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
record TreeSnapshot(
    int version,
    long lastDirectoryId,
    long lastNoteId,
    List<NoteJson> notes,
    List<DirectoryJson> directories,
    List<EdgeJson> noteChildren,
    List<EdgeJson> dirChildren) {

  static final int CURRENT_VERSION = 1;

  record NoteJson(long id, String content) {}

  record DirectoryJson(long id) {}

  record EdgeJson(long parentId, long childId, String childName) {}

  static TreeSnapshot of(TreeTables tables) {
    var notes = new ArrayList<NoteJson>(tables.notes().size());
    for (var row : tables.notes()) {
      notes.add(new NoteJson(row.id(), row.content()));
    }
    var dirs = new ArrayList<DirectoryJson>(tables.directories().size());
    for (long id : tables.directories()) {
      dirs.add(new DirectoryJson(id));
    }
    return new TreeSnapshot(
        CURRENT_VERSION,
        tables.lastDirectoryId(),
        tables.lastNoteId(),
        notes,
        dirs,
        edges(tables.noteEdges()),
        edges(tables.dirEdges()));
  }

  private static List<EdgeJson> edges(List<ChildEdge> in) {
    var out = new ArrayList<EdgeJson>(in.size());
    for (var e : in) {
      out.add(new EdgeJson(e.parent().value(), e.childId(), e.childName()));
    }
    return out;
  }

  TreeTables toTables() {
    if (version != CURRENT_VERSION) {
      throw new IllegalArgumentException("unsupported snapshot version " + version);
    }
    var noteRows = new ArrayList<TreeTables.NoteRow>();
    for (var n : nullSafe(notes)) {
      if (n.content() == null) {
        throw new IllegalArgumentException("note " + n.id() + " has no content");
      }
      noteRows.add(new TreeTables.NoteRow(n.id(), n.content()));
    }
    var dirIds = new ArrayList<Long>();
    for (var d : nullSafe(directories)) {
      dirIds.add(d.id());
    }
    return new TreeTables(
        noteRows,
        dirIds,
        toEdges(noteChildren, EntryKind.NOTE),
        toEdges(dirChildren, EntryKind.DIRECTORY),
        lastDirectoryId,
        lastNoteId);
  }

  private static List<ChildEdge> toEdges(List<EdgeJson> in, EntryKind kind) {
    var out = new ArrayList<ChildEdge>();
    for (var e : nullSafe(in)) {
      if (e.childName() == null) {
        throw new IllegalArgumentException(kind.label() + " edge " + e.childId() + " has no name");
      }
      out.add(new ChildEdge(DirectoryId.of(e.parentId()), kind, e.childId(), e.childName()));
    }
    return out;
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
