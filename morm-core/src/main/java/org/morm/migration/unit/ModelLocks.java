package org.morm.migration.unit;

import org.morm.exception.MormException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Coarse lock per model around writing units and applying them. Held in-process by a
 * {@link ReentrantLock} and across processes by a file lock on {@code <model>/.lock}.
 */
public class ModelLocks {

    public static final String LOCK_FILE = ".lock";

    // file locks are held per JVM, so the in-process side must be JVM wide as well;
    // an entry lives only while some thread holds or waits for it
    private static final ConcurrentMap<Path, LockEntry> LOCKS = new ConcurrentHashMap<>();

    private final Path basePath;

    public ModelLocks(Path basePath) {
        this.basePath = basePath;
    }

    public <T> T withLock(String model, Supplier<T> action) {
        Path lockFile = lockFile(model);
        LockEntry entry = LOCKS.compute(lockFile, (path, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });
        try {
            entry.lock.lock();
            try {
                if (entry.lock.getHoldCount() > 1) {
                    return action.get();
                }
                Files.createDirectories(lockFile.getParent());
                try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    return action.get();
                }
            } catch (IOException e) {
                throw new MormException("Failed to lock model " + model + " at " + lockFile, e);
            } finally {
                entry.lock.unlock();
            }
        } finally {
            LOCKS.computeIfPresent(lockFile, (path, e) -> --e.users == 0 ? null : e);
        }
    }

    /**
     * Whether some thread of this JVM currently holds or waits for the lock of {@code model}.
     */
    boolean isTracked(String model) {
        return LOCKS.containsKey(lockFile(model));
    }

    private Path lockFile(String model) {
        return basePath.resolve(model).resolve(LOCK_FILE).toAbsolutePath().normalize();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute functions
        private int users;
    }
}
