package com.veriheal.core.patch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive locks around read-validate-write of source files.
 *
 * With {@link LockScope#FILE} every normalised path has its own lock; with
 * {@link LockScope#TREE} all patches serialise on a single tree-wide lock,
 * for patches whose effects cross file boundaries.
 */
@Component
public class FileLockManager {

    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);

    static final String TREE_KEY = "<tree>";

    public enum LockScope { FILE, TREE }

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockScope scope;
    private final long timeoutMs;

    public FileLockManager(
            @Value("${veriheal.patch.lock-scope:FILE}") LockScope scope,
            @Value("${veriheal.patch.lock-timeout-ms:30000}") long timeoutMs
    ) {
        this.scope = scope;
        this.timeoutMs = timeoutMs;
        log.info("[FileLock] Lock scope: {}, timeout: {}ms", scope, timeoutMs);
    }

    public LockScope getScope() {
        return scope;
    }

    public String lockKeyFor(String normalizedPath) {
        return scope == LockScope.TREE ? TREE_KEY : normalizedPath;
    }

    /**
     * Blocks up to the configured timeout for the lock guarding
     * {@code normalizedPath}.
     *
     * @throws PatchLockTimeoutException if the lock is not obtained in time
     */
    public Lease acquire(String normalizedPath) throws PatchLockTimeoutException {
        String key = lockKeyFor(normalizedPath);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("[FileLock] Timed out waiting for {}", key);
                throw new PatchLockTimeoutException(key, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PatchLockTimeoutException(key, timeoutMs);
        }
        log.debug("[FileLock] Acquired {}", key);
        return new Lease(key, lock);
    }

    /**
     * Held lock; release with try-with-resources.
     */
    public static final class Lease implements AutoCloseable {
        private final String key;
        private final ReentrantLock lock;

        private Lease(String key, ReentrantLock lock) {
            this.key = key;
            this.lock = lock;
        }

        public String getKey() {
            return key;
        }

        @Override
        public void close() {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("[FileLock] Released {}", key);
            }
        }
    }
}
