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

/** Identity of a directory row. Id {@code 0} is the root and exists from store initialization. */
public record DirectoryId(long value) implements Comparable<DirectoryId> {
  public static final DirectoryId ROOT = new DirectoryId(0L);

  public DirectoryId {
    if (value < 0L) {
      throw new IllegalArgumentException("directory id must be >= 0: " + value);
    }
  }

  public static DirectoryId of(long value) {
    return value == 0L ? ROOT : new DirectoryId(value);
  }

  public boolean isRoot() {
    return value == 0L;
  }

  @Override
  public int compareTo(DirectoryId other) {
    return Long.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
