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

import java.util.ArrayDeque;
import java.util.Deque;
import org.jboss.logging.Logger;

/**
 * Compensating actions for the writes of one engine operation. Each successful store write records
 * its inverse; {@link #rollback} replays them newest first.
 */
final class UndoLog {
  private static final Logger LOG = Logger.getLogger(UndoLog.class);

  private final Deque<Runnable> undo = new ArrayDeque<>();

  void record(Runnable inverse) {
    undo.push(inverse);
  }

  int size() {
    return undo.size();
  }

  /**
   * Runs every recorded inverse. A failing inverse does not stop the rest; its exception is
   * attached to {@code cause} as suppressed.
   */
  void rollback(Throwable cause) {
    if (undo.isEmpty()) {
      return;
    }
    LOG.warnf("rolling back %d writes after %s", undo.size(), cause.toString());
    while (!undo.isEmpty()) {
      var inverse = undo.pop();
      try {
        inverse.run();
      } catch (Throwable e) {
        LOG.errorf(e, "undo step failed");
        cause.addSuppressed(e);
      }
    }
  }
}
