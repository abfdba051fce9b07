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

import java.util.ArrayList;
import java.util.List;

/** Children of one directory, each namespace ordered by name. */
public record DirectoryListing(List<TreeEntry> directories, List<TreeEntry> notes) {
  public static final DirectoryListing EMPTY = new DirectoryListing(List.of(), List.of());

  public DirectoryListing {
    directories = List.copyOf(directories);
    notes = List.copyOf(notes);
  }

  public boolean isEmpty() {
    return directories.isEmpty() && notes.isEmpty();
  }

  public int size() {
    return directories.size() + notes.size();
  }

  /** Directories first, then notes. */
  public List<TreeEntry> all() {
    var out = new ArrayList<TreeEntry>(size());
    out.addAll(directories);
    out.addAll(notes);
    return out;
  }
}
