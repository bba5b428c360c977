package com.mesh.registry.store;

import com.mesh.registry.config.AppProperties;
import com.mesh.registry.exception.RegistryBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock around read-modify-commit of the registry document.
 *
 * <p>Threads of this process queue on a mutex; other processes are kept out by an
 * OS lock on a sidecar lock file. Both waits share one deadline, after which
 * {@link RegistryBusyException} is thrown. Use with try-with-resources:
 *
 * <pre>{@code
 * try (RegistryLock.Handle ignored = registryLock.acquire()) {
 *     Registry registry = registryStore.load();
 *     ...
 *     registryStore.commit(registry);
 * }
 * }</pre>
 */
@Slf4j
@Component
public class RegistryLock {

    private static final long POLL_MILLIS = 25;

    private final ReentrantLock mutex = new ReentrantLock(true);
    private final Path lockFile;
    private final Duration timeout;

    @Autowired
    public RegistryLock(AppProperties props) {
        this(props.getRegistry().lockPath(), props.getRegistry().getLockTimeout());
    }

    public RegistryLock(Path lockFile, Duration timeout) {
        this.lockFile = lockFile;
        this.timeout = timeout;
    }

    public Handle acquire() {
        if (mutex.isHeldByCurrentThread()) {
            throw new IllegalStateException("Registry lock is not reentrant");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean locked;
        try {
            locked = mutex.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryBusyException("Interrupted while waiting for the registry lock", e);
        }
        if (!locked) {
            throw busy();
        }

        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lockFile(channel, deadline);
            return new Handle(channel);
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(channel, e);
            mutex.unlock();
            if (e instanceof IOException io) {
                throw new UncheckedIOException("Failed to open registry lock file " + lockFile, io);
            }
            throw (RuntimeException) e;
        }
    }

    private void lockFile(FileChannel channel, long deadline) throws IOException {
        while (true) {
            try {
                if (channel.tryLock() != null) {
                    return;
                }
            } catch (OverlappingFileLockException e) {
                log.debug("Lock file {} is held by another registry lock in this process", lockFile);
            }
            if (System.nanoTime() >= deadline) {
                throw busy();
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RegistryBusyException("Interrupted while waiting for the registry lock", e);
            }
        }
    }

    private RegistryBusyException busy() {
        log.warn("Registry lock {} not acquired within {}", lockFile, timeout);
        return new RegistryBusyException("Registry is busy: lock not acquired within " + timeout);
    }

    private static void closeAfterFailure(FileChannel channel, Exception failure) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /** Held lock; closing the channel drops the file lock, then the mutex is released. */
    public final class Handle implements AutoCloseable {
        private final FileChannel channel;
        private boolean released;

        private Handle(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                channel.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to release registry lock " + lockFile, e);
            } finally {
                mutex.unlock();
            }
        }
    }
}
