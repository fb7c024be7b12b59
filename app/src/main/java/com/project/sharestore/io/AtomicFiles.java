package com.project.sharestore.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Crash-safe file writes. The filesystem's link and rename operations are the only
 * synchronization between concurrent writers, in this process or any other.
 *
 * Readers never observe a partially written destination: bytes land in a temp file in the
 * same directory first and are forced to disk before being published.
 */
public final class AtomicFiles {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFiles.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    /** Suffix of in-flight temp files; listings must skip them. */
    public static final String TEMP_SUFFIX = ".tmp";

    private static final int MAX_PARENT_ATTEMPTS = 3;

    private AtomicFiles() {
    }

    /**
     * Publish {@code data} at {@code target} unless something is already there.
     *
     * @return true if this call created the file, false if the destination already existed
     * @throws IOException on any failure other than "already exists"
     */
    public static boolean createUnique(Path target, byte[] data) throws IOException {
        return createUnique(target, data, Files::createLink);
    }

    /**
     * @param linker publishes the temp file at the target; {@code Files::createLink} outside tests
     */
    static boolean createUnique(Path target, byte[] data, Linker linker) throws IOException {
        Path tmp = writeTemp(target, data);
        try {
            linker.link(target, tmp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (FileSystemException | UnsupportedOperationException e) {
            // vfat, exFAT and many SMB/FUSE mounts refuse hard links with EPERM or EACCES
            LOG.debug("Hard link refused for {} ({}), falling back to exclusive create", target, e.toString());
            return createExclusive(target, data);
        } finally {
            cleanup(tmp);
        }
    }

    /**
     * Atomically replace the contents of {@code target}, creating it if absent.
     */
    public static void replace(Path target, byte[] data) throws IOException {
        Path tmp = writeTemp(target, data);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            cleanup(tmp);
            throw e;
        }
    }

    public static boolean isTempFile(Path path) {
        return path.getFileName().toString().endsWith(TEMP_SUFFIX);
    }

    static Path tempSibling(Path target) {
        byte[] token = new byte[6];
        RANDOM.nextBytes(token);
        String name = target.getFileName() + "." + System.currentTimeMillis() + "."
                + HexFormat.of().formatHex(token) + TEMP_SUFFIX;
        return target.resolveSibling(name);
    }

    /**
     * Write {@code data} to a fresh temp sibling of {@code target}, creating parent directories.
     * Empty blob shard directories are pruned concurrently, so a parent that vanishes between
     * creation and use is recreated.
     */
    private static Path writeTemp(Path target, byte[] data) throws IOException {
        for (int attempt = 1; ; attempt++) {
            Files.createDirectories(target.getParent());
            Path tmp = tempSibling(target);
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
                return tmp;
            } catch (NoSuchFileException e) {
                if (attempt >= MAX_PARENT_ATTEMPTS) {
                    throw e;
                }
                LOG.debug("Parent of {} disappeared, retrying", target);
            } catch (IOException e) {
                cleanup(tmp);
                throw e;
            }
        }
    }

    // Not atomic for readers; only used where the filesystem cannot link.
    private static boolean createExclusive(Path target, byte[] data) throws IOException {
        try {
            Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Publishes an already written file under a new name, failing if the name is taken.
     */
    @FunctionalInterface
    interface Linker {
        void link(Path target, Path existing) throws IOException;
    }

    private static void cleanup(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Failed to remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
