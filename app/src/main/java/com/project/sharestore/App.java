package com.project.sharestore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.sharestore.core.CreateResult;
import com.project.sharestore.core.EncryptedEnvelope;
import com.project.sharestore.core.GarbageCollector;
import com.project.sharestore.core.RevokeResult;
import com.project.sharestore.core.ShareService;
import com.project.sharestore.core.SharedRecord;
import com.project.sharestore.core.StoreConfig;
import com.project.sharestore.io.StorageReport;
import com.project.sharestore.io.StorageReporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Operator command line for a share store.
 *
 * The store root and limits come from the environment (see {@link StoreConfig}).
 *
 * Usage:
 *   App report
 *   App gc
 *   App read &lt;shareId&gt;
 *   App revoke &lt;shareId&gt; &lt;editToken&gt;
 *   App create &lt;envelope.json&gt; &lt;contentHash&gt; [--revocable]
 */
public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final StoreConfig config;
    private final PrintStream out;
    private final PrintStream err;

    App(StoreConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        App app = new App(StoreConfig.fromEnvironment(), System.out, System.err);
        System.exit(app.run(args));
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "report":
                    return report();
                case "gc":
                    return sweep();
                case "read":
                    return args.length == 2 ? read(args[1]) : usage();
                case "revoke":
                    return args.length == 3 ? revoke(args[1], args[2]) : usage();
                case "create":
                    return args.length == 3 || args.length == 4 ? create(args) : usage();
                default:
                    return usage();
            }
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int report() throws IOException {
        StorageReport report = new StorageReporter(config.dataDirectory()).collect();
        out.println(report.format());
        return EXIT_OK;
    }

    private int sweep() throws IOException {
        GarbageCollector.SweepResult result = ShareService.open(config).garbageCollector().sweep(config.sweepMinAge());
        if (result.aborted()) {
            err.println("Orphan sweep aborted: link records could not be read");
            return EXIT_FAILURE;
        }
        out.printf("Scanned %d blobs: deleted %d, retained %d%n", result.scanned(), result.deleted(), result.retained());
        return EXIT_OK;
    }

    private int read(String shareId) throws IOException {
        Optional<SharedRecord> record = ShareService.open(config).readShareRecord(shareId);
        if (record.isEmpty()) {
            err.println("Shared playlist not found: " + shareId);
            return EXIT_FAILURE;
        }
        out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(record.get()));
        return EXIT_OK;
    }

    private int revoke(String shareId, String editToken) throws IOException {
        RevokeResult result = ShareService.open(config).revokeShare(shareId, editToken);
        out.println(result);
        return result == RevokeResult.OK || result == RevokeResult.ALREADY_REVOKED ? EXIT_OK : EXIT_FAILURE;
    }

    private int create(String[] args) throws IOException {
        boolean revocable = args.length == 4;
        if (revocable && !"--revocable".equals(args[3])) {
            return usage();
        }
        Path envelopeFile = Paths.get(args[1]);
        EncryptedEnvelope envelope = MAPPER.readValue(envelopeFile.toFile(), EncryptedEnvelope.class);
        CreateResult result = ShareService.open(config).createShare(envelope, args[2], revocable);
        out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        return EXIT_OK;
    }

    private int usage() {
        printUsage();
        return EXIT_USAGE;
    }

    private void printUsage() {
        err.println("Usage: App <command>");
        err.println("  report                                       storage summary");
        err.println("  gc                                           delete orphaned blobs");
        err.println("  read <shareId>                               print a share's envelope");
        err.println("  revoke <shareId> <editToken>                 revoke a share");
        err.println("  create <envelope.json> <contentHash> [--revocable]");
        err.println("Store root: $" + StoreConfig.DATA_DIR_ENV + " (currently " + config.dataDirectory() + ")");
    }
}
