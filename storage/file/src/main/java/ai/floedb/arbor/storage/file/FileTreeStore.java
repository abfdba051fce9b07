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

import ai.floedb.arbor.storage.errors.StorageException;
import ai.floedb.arbor.storage.memory.InMemoryTreeStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Tree store that serves reads from memory and writes the whole four-table snapshot to one JSON
 * file on every {@link #commit()}. The file is replaced atomically, so a crash leaves either the
 * old or the new snapshot on disk.
 */
public final class FileTreeStore extends InMemoryTreeStore {
  private static final Logger LOG = Logger.getLogger(FileTreeStore.class);

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

  private final Path path;

  private FileTreeStore(Path path, Duration lockTimeout) {
    super(lockTimeout);
    this.path = path;
  }

  public static FileTreeStore open(Path path) {
    return open(path, DEFAULT_LOCK_TIMEOUT);
  }

  /**
   * Loads {@code path} if it exists. A missing file means an empty tree holding only the root; it
   * is first written by the first commit.
   *
   * @throws StorageException if the file cannot be read or does not describe a valid tree
   */
  public static FileTreeStore open(Path path, Duration lockTimeout) {
    Objects.requireNonNull(path, "path");
    var store = new FileTreeStore(path.toAbsolutePath(), lockTimeout);
    if (Files.exists(store.path)) {
      store.load();
    } else {
      LOG.infof("no snapshot at %s, starting with an empty tree", store.path);
    }
    return store;
  }

  private void load() {
    TreeSnapshot snapshot;
    try {
      snapshot = MAPPER.readValue(path.toFile(), TreeSnapshot.class);
    } catch (IOException e) {
      throw new StorageException("failed to read snapshot " + path, e);
    }
    if (snapshot == null) {
      throw new StorageException("empty snapshot " + path);
    }
    try {
      restore(snapshot.toTables());
    } catch (IllegalArgumentException e) {
      throw new StorageException("invalid snapshot " + path + ": " + e.getMessage(), e);
    }
    LOG.infof(
        "loaded snapshot %s directories=%d notes=%d", path, directoryCount(), noteCount());
  }

  @Override
  public void commit() {
    requireWriteHeld("commit");
    byte[] bytes;
    try {
      bytes = MAPPER.writeValueAsBytes(TreeSnapshot.of(tables()));
    } catch (JsonProcessingException e) {
      throw new StorageException("failed to encode snapshot", e);
    }
    write(bytes);
  }

  private void write(byte[] bytes) {
    var dir = path.getParent();
    var tmp =
        dir.resolve(path.getFileName() + ".tmp-" + UUID.randomUUID().toString().replace("-", ""));
    try {
      Files.createDirectories(dir);
      Files.write(tmp, bytes);
      try {
        Files.move(
            tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      LOG.errorf(e, "snapshot write to %s failed", path);
      throw new StorageException("failed to write snapshot " + path, e);
    }
  }
}
