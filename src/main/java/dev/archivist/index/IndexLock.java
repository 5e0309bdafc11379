package dev.archivist.index;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.jspecify.annotations.Nullable;

/**
 * Exclusive lease on the index, held for the duration of one mutating operation. Guards against a
 * second process mutating the same index directory.
 */
final class IndexLock implements AutoCloseable {

  private final FileChannel channel;
  private final FileLock lock;

  private IndexLock(FileChannel channel, FileLock lock) {
    this.channel = channel;
    this.lock = lock;
  }

  /**
   * Takes the lease without waiting.
   *
   * @throws IndexConflictException if the lease is held elsewhere
   */
  static IndexLock acquire(Path lockFile) throws IOException {
    Files.createDirectories(lockFile.getParent());
    FileChannel channel = FileChannel.open(lockFile,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    @Nullable FileLock lock;
    try {
      lock = channel.tryLock();
    } catch (OverlappingFileLockException e) {
      lock = null;
    }
    if (lock == null) {
      channel.close();
      throw new IndexConflictException("Index is locked by another operation: " + lockFile);
    }
    return new IndexLock(channel, lock);
  }

  @Override
  public void close() throws IOException {
    try {
      lock.release();
    } finally {
      channel.close();
    }
  }
}
