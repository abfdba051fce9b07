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

import ai.floedb.arbor.storage.model.ChildEdge;
import java.util.List;

/**
 * Row-level copy of the four tree tables, ordered by id, plus the highest id ever inserted per
 * kind. The marks may exceed every id present when the newest rows were deleted.
 */
public record TreeTables(
    List<NoteRow> notes,
    List<Long> directories,
    List<ChildEdge> noteEdges,
    List<ChildEdge> dirEdges,
    long lastDirectoryId,
    long lastNoteId) {

  public TreeTables {
    notes = List.copyOf(notes);
    directories = List.copyOf(directories);
    noteEdges = List.copyOf(noteEdges);
    dirEdges = List.copyOf(dirEdges);
  }

  public TreeTables(
      List<NoteRow> notes,
      List<Long> directories,
      List<ChildEdge> noteEdges,
      List<ChildEdge> dirEdges) {
    this(notes, directories, noteEdges, dirEdges, 0L, 0L);
  }

  public record NoteRow(long id, String content) {}
}
