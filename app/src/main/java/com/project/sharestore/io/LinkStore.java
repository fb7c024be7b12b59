package com.project.sharestore.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.sharestore.core.CorruptRecordException;
import com.project.sharestore.core.InputValidator;
import com.project.sharestore.core.ShareLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One JSON file per share: {@code <root>/links/<shareId>.json}.
 *
 * Records are created with create-if-absent semantics and only ever rewritten to set
 * {@code revoked=true}.
 */
public class LinkStore {

    private static final Logger LOG = LoggerFactory.getLogger(LinkStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String LINKS_DIR_NAME = "links";
    static final String LINK_SUFFIX = ".json";

    private final Path rootDirectory;
    private final Path linksDirectory;

    public LinkStore(Path rootDirectory) {
        this.rootDirectory = rootDirectory;
        this.linksDirectory = rootDirectory.resolve(LINKS_DIR_NAME);
    }

    /**
     * Write a new link record.
     *
     * @return true if created, false if the share id is already taken
     */
    public boolean create(ShareLink link) throws IOException {
        ShareLink validated = validate(link, null);
        if (Files.exists(legacyPathFor(validated.shareId()))) {
            return false;
        }
        boolean created = AtomicFiles.createUnique(pathFor(validated.shareId()), encode(validated));
        if (created) {
            LOG.debug("Created link {} -> blob {}", validated.shareId(), validated.effectiveBlobHash());
        }
        return created;
    }

    /**
     * A share id is taken when either a link record or a pre-link legacy record uses it.
     */
    public boolean isTaken(String shareId) {
        InputValidator.validateShareId(shareId);
        return Files.exists(pathFor(shareId)) || Files.exists(legacyPathFor(shareId));
    }

    /**
     * @return empty if no record exists for {@code shareId}
     * @throws CorruptRecordException if the record exists but is malformed
     */
    public Optional<ShareLink> get(String shareId) throws IOException {
        InputValidator.validateShareId(shareId);
        return read(pathFor(shareId));
    }

    /**
     * Read and validate the record at {@code path}.
     */
    public Optional<ShareLink> read(Path path) throws IOException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        ShareLink parsed;
        try {
            parsed = MAPPER.readValue(raw, ShareLink.class);
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException(path, "Invalid share link metadata", e);
        }
        if (parsed == null) {
            throw new CorruptRecordException(path, "Empty share link metadata");
        }
        return Optional.of(validate(parsed, path));
    }

    /**
     * Rewrite a record in place with {@code revoked=true}.
     */
    public ShareLink markRevoked(ShareLink link) throws IOException {
        ShareLink revoked = validate(link, null).asRevoked();
        AtomicFiles.replace(pathFor(revoked.shareId()), encode(revoked));
        LOG.debug("Marked link {} revoked", revoked.shareId());
        return revoked;
    }

    /**
     * Paths of all link records, skipping in-flight temp files.
     */
    public List<Path> list() throws IOException {
        try (Stream<Path> entries = Files.list(linksDirectory)) {
            return entries
                .filter(path -> path.getFileName().toString().endsWith(LINK_SUFFIX))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return List.of();
        }
    }

    public byte[] encode(ShareLink link) {
        try {
            return MAPPER.writeValueAsBytes(link);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize share link " + link.shareId(), e);
        }
    }

    public Path pathFor(String shareId) {
        return linksDirectory.resolve(shareId + LINK_SUFFIX);
    }

    public Path directory() {
        return linksDirectory;
    }

    Path legacyPathFor(String shareId) {
        return rootDirectory.resolve(shareId + LINK_SUFFIX);
    }

    /**
     * Normalize and check every field. {@code source} is null for records about to be written,
     * whose problems are caller errors rather than corruption.
     */
    private static ShareLink validate(ShareLink link, Path source) {
        try {
            if (link.version() != ShareLink.CURRENT_VERSION) {
                throw new InputValidator.InvalidInputException("Unsupported link version " + link.version());
            }
            String shareId = link.shareId() == null ? null : link.shareId().trim();
            InputValidator.validateShareId(shareId);
            if (source != null && !source.getFileName().toString().equals(shareId + LINK_SUFFIX)) {
                throw new InputValidator.InvalidInputException("Share ID " + shareId + " does not match its file name");
            }
            String contentHash = InputValidator.requireSha256Hex(link.contentHash(), "contentHash");
            String blobHash = isBlank(link.blobHash()) ? null
                : InputValidator.requireSha256Hex(link.blobHash(), "blobHash");
            if (link.createdAt() == null) {
                throw new InputValidator.InvalidInputException("createdAt must not be null");
            }
            String editTokenHash = isBlank(link.editTokenHash()) ? null
                : InputValidator.requireSha256Hex(link.editTokenHash(), "editTokenHash");
            return new ShareLink(link.version(), shareId, contentHash, blobHash, link.createdAt(),
                link.revoked(), editTokenHash);
        } catch (InputValidator.InvalidInputException e) {
            if (source == null) {
                throw e;
            }
            throw new CorruptRecordException(source, "Invalid share link metadata (" + e.getMessage() + ")", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
