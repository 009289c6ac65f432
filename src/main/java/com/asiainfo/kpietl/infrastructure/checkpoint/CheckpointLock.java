package com.asiainfo.kpietl.infrastructure.checkpoint;

import com.asiainfo.kpietl.shared.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 断点文件的独占锁（&lt;checkpoint&gt;.lock）
 * 跨进程互斥：同一时刻只允许一个抽取运行写断点文件，拿不到锁立即失败
 */
public final class CheckpointLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointLock.class);

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private CheckpointLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    public static Path lockFileFor(Path checkpointFile) {
        return checkpointFile.resolveSibling(checkpointFile.getFileName() + ".lock");
    }

    public static CheckpointLock acquire(Path checkpointFile) {
        Path lockFile = lockFileFor(checkpointFile);
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                lock = null;
            }
            if (lock == null) {
                channel.close();
                throw new PipelineException("Another extraction run holds " + lockFile);
            }
            log.info("[Checkpoint] Acquired lock {}", lockFile);
            return new CheckpointLock(lockFile, channel, lock);
        } catch (IOException e) {
            if (channel != null) {
                try {
                    channel.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new PipelineException("Failed to lock " + lockFile, e);
        }
    }

    @Override
    public void close() {
        try {
            lock.release();
            channel.close();
            log.info("[Checkpoint] Released lock {}", lockFile);
        } catch (IOException e) {
            log.warn("[Checkpoint] Failed to release lock {}: {}", lockFile, e.getMessage());
        }
    }
}
