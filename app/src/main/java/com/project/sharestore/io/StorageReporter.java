package com.project.sharestore.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a store root and summarizes links, blobs and legacy records.
 */
public class StorageReporter {

    private final Path rootDirectory;

    public StorageReporter(Path rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    public StorageReport collect() throws IOException {
        Path linksDir = rootDirectory.resolve(LinkStore.LINKS_DIR_NAME);
        Path blobsDir = rootDirectory.resolve(BlobStore.BLOBS_DIR_NAME);

        List<Path> linkFiles = walkFiles(linksDir);
        List<Path> blobFiles = walkFiles(blobsDir);
        List<Path> legacyFiles = walkFiles(rootDirectory).stream()
                .filter(file -> !file.startsWith(linksDir) && !file.startsWith(blobsDir))
                .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(LinkStore.LINK_SUFFIX))
                .collect(Collectors.toList());

        return new StorageReport(
                rootDirectory,
                linkFiles.size(), totalSize(linkFiles),
                blobFiles.size(), totalSize(blobFiles),
                legacyFiles.size(), totalSize(legacyFiles));
    }

    private static List<Path> walkFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.find(directory, Integer.MAX_VALUE,
                (path, attrs) -> attrs.isRegularFile() && !AtomicFiles.isTempFile(path))) {
            return files.collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        }
    }

    private static long totalSize(List<Path> files) throws IOException {
        long total = 0;
        for (Path file : files) {
            total += sizeOf(file);
        }
        return total;
    }

    static long sizeOf(Path file) throws IOException {
        try {
            return Files.readAttributes(file, BasicFileAttributes.class).size();
        } catch (NoSuchFileException e) {
            // deleted by GC after the listing
            return 0L;
        }
    }
}
