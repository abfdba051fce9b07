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
import ai.floedb.arbor.storage.spi.IdAllocator;
import java.util.concurrent.atomic.AtomicLong;

public final class InMemoryIdAllocator implements IdAllocator {
  private final String name;
  private final AtomicLong last;

  /**
   * @param seed highest value already in use; the first {@link #allocate()} returns {@code seed +
   *     1}
   */
  public InMemoryIdAllocator(String name, long seed) {
    if (seed < 0) {
      throw new IllegalArgumentException("seed must be >= 0: " + seed);
    }
    this.name = name;
    this.last = new AtomicLong(seed);
  }

  @Override
  public long allocate() {
    long next =
        last.getAndUpdate(
            v -> {
              if (v == Long.MAX_VALUE) {
                return v;
              }
              return v + 1;
            });
    if (next == Long.MAX_VALUE) {
      throw new StorageException(name + " id space exhausted");
    }
    return next + 1;
  }

  @Override
  public long lastIssued() {
    return last.get();
  }

  @Override
  public String toString() {
    return "InMemoryIdAllocator{" + name + "@" + last.get() + "}";
  }
}
