package com.project.sharestore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.sharestore.core.StoreConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private App app;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        app = new App(StoreConfig.forDirectory(tempDir.resolve("store")),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        String text = out.toString(StandardCharsets.UTF_8);
        out.reset();
        return text;
    }

    private JsonNode createShare(String label, boolean revocable) throws IOException {
        Path envelopeFile = tempDir.resolve(label + ".json");
        MAPPER.writeValue(envelopeFile.toFile(), TestEnvelopes.envelope(label));
        String[] args = revocable
            ? new String[] {"create", envelopeFile.toString(), TestEnvelopes.contentHash(label), "--revocable"}
            : new String[] {"create", envelopeFile.toString(), TestEnvelopes.contentHash(label)};
        assertEquals(App.EXIT_OK, app.run(args), err.toString(StandardCharsets.UTF_8));
        return MAPPER.readTree(stdout());
    }

    @Test
    void createReadRevokeRoundTrip() throws IOException {
        JsonNode created = createShare("cli", true);
        String shareId = created.get("shareId").asText();
        String editToken = created.get("editToken").asText();
        assertTrue(created.get("blobCreated").asBoolean());

        assertEquals(App.EXIT_OK, app.run(new String[] {"read", shareId}));
        JsonNode record = MAPPER.readTree(stdout());
        assertEquals(TestEnvelopes.envelope("cli").ciphertext(), record.at("/envelope/ciphertext").asText());
        assertEquals(shareId, record.get("shareId").asText());

        assertEquals(App.EXIT_FAILURE, app.run(new String[] {"revoke", shareId, "wrong-token-wrong-token"}));
        assertEquals("FORBIDDEN", stdout().trim());

        assertEquals(App.EXIT_OK, app.run(new String[] {"revoke", shareId, editToken}));
        assertEquals("OK", stdout().trim());

        assertEquals(App.EXIT_FAILURE, app.run(new String[] {"read", shareId}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("not found"));
    }

    @Test
    void permanentShareHasNoEditToken() throws IOException {
        JsonNode created = createShare("permanent", false);
        assertFalse(created.has("editToken"));
    }

    @Test
    void reportSummarizesStore() throws IOException {
        createShare("one", false);
        createShare("one", false);

        assertEquals(App.EXIT_OK, app.run(new String[] {"report"}));
        String report = stdout();
        assertTrue(report.contains("Links: 2"), report);
        assertTrue(report.contains("Blobs: 1"), report);
    }

    @Test
    void gcKeepsReferencedBlobs() throws IOException {
        createShare("kept", false);

        assertEquals(App.EXIT_OK, app.run(new String[] {"gc"}));
        assertTrue(stdout().contains("Scanned 1 blobs: deleted 0, retained 1"));
    }

    @Test
    void malformedInputReportsError() throws IOException {
        Path envelopeFile = tempDir.resolve("bad.json");
        Files.writeString(envelopeFile, "{\"version\":1,\"alg\":\"A256GCM\",\"iv\":\"x\",\"ciphertext\":\"y\"}");

        assertEquals(App.EXIT_FAILURE,
            app.run(new String[] {"create", envelopeFile.toString(), TestEnvelopes.contentHash("bad")}));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: "));
    }

    @Test
    void usageErrors() {
        assertEquals(App.EXIT_USAGE, app.run(new String[0]));
        assertEquals(App.EXIT_USAGE, app.run(new String[] {"read"}));
        assertEquals(App.EXIT_USAGE, app.run(new String[] {"frobnicate"}));
        assertEquals(App.EXIT_USAGE, app.run(new String[] {"create", "a.json", "hash", "--forever"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}
