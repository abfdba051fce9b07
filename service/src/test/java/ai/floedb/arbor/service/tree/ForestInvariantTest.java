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
import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.arbor.service.error.ErrorCode;
import ai.floedb.arbor.service.error.NamespaceException;
import ai.floedb.arbor.service.testsupport.EngineFixture;
import ai.floedb.arbor.service.testsupport.TreeAssertions;
import ai.floedb.arbor.storage.model.DirectoryId;
import ai.floedb.arbor.storage.model.NoteId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Random create / move / delete sequences never break the forest rooted at directory 0. */
class ForestInvariantTest {
  private static final Set<ErrorCode> VALIDATION =
      EnumSet.of(
          ErrorCode.CYCLE_REJECTED,
          ErrorCode.DUPLICATE_NAME,
          ErrorCode.NOT_FOUND,
          ErrorCode.UNKNOWN_PARENT,
          ErrorCode.ROOT_UNDELETABLE);

  @ParameterizedTest
  @ValueSource(longs = {1L, 7L, 42L, 2026L})
  void randomSequencesPreserveForest(long seed) {
    var fx = new EngineFixture();
    var rnd = new Random(seed);
    List<DirectoryId> dirs = new ArrayList<>(List.of(DirectoryId.ROOT));
    List<NoteId> notes = new ArrayList<>();

    for (int step = 0; step < 600; step++) {
      var dir = dirs.get(rnd.nextInt(dirs.size()));
      var other = dirs.get(rnd.nextInt(dirs.size()));
      String name = "n" + rnd.nextInt(6);
      try {
        switch (rnd.nextInt(6)) {
          case 0, 1 -> dirs.add(fx.engine.createDirectory(EDITOR, dir, name));
          case 2 -> notes.add(fx.engine.createNote(EDITOR, dir, name, "s" + step));
          case 3 -> {
            boolean cycle = fx.oracle.isAncestor(dir, other);
            try {
              fx.engine.moveDirectory(EDITOR, dir, other, name);
              assertThat(cycle).as("move %s under %s", dir, other).isFalse();
            } catch (NamespaceException e) {
              if (cycle) {
                assertThat(e.code()).isEqualTo(ErrorCode.CYCLE_REJECTED);
              }
              throw e;
            }
          }
          case 4 -> {
            var removedDirs = fx.oracle.descendants(dir);
            var removedNotes = fx.oracle.ownedNotes(dir);
            fx.engine.deleteDirectory(EDITOR, dir);
            assertThat(fx.oracle.descendants(dir)).isEmpty();
            for (var gone : removedDirs) {
              assertThat(fx.store.directoryExists(gone)).isFalse();
            }
            for (var gone : removedNotes) {
              assertThat(fx.store.noteExists(gone)).isFalse();
            }
            dirs.removeAll(removedDirs);
            notes.removeAll(removedNotes);
          }
          default -> {
            if (!notes.isEmpty()) {
              var note = notes.remove(rnd.nextInt(notes.size()));
              fx.engine.deleteNote(EDITOR, note);
            }
          }
        }
      } catch (NamespaceException e) {
        assertThat(VALIDATION).contains(e.code());
      }
      TreeAssertions.assertForest(fx.store.tables());
    }

    assertThat(fx.store.directoryCount()).isEqualTo(dirs.size());
    assertThat(fx.store.noteCount()).isEqualTo(notes.size());
  }
}
