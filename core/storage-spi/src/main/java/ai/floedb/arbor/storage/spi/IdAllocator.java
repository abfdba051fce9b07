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

package ai.floedb.arbor.storage.spi;

/**
 * Issues strictly increasing identifiers. Concurrent callers always get distinct values and a value
 * is never issued twice by one allocator, even if the row it was meant for is never committed.
 */
public interface IdAllocator {

  /**
   * @throws ai.floedb.arbor.storage.errors.StorageException when the identifier space is exhausted
   */
  long allocate();

  /** Last value handed out, or the seed if none yet. */
  long lastIssued();
}
