package com.mtg.decksync;

import com.mtg.decksync.config.SyncSettings;
import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.DeckDocumentParser;
import com.mtg.decksync.remote.FakeMoxfieldServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs the CLI end to end against a fake Moxfield.
 */
class MainTest {

    private static final String DECK = "# Hakbal\n\n"
            + "| | |\n|---|---|\n"
            + "| **Commander** | Hakbal of the Surging Soul |\n"
            + "| **Date** | 2026-01-01 |\n\n"
            + "```\n1 Hakbal of the Surging Soul\n1 Sol Ring\n30 Island\n```\n";

    @TempDir
    Path dir;

    private FakeMoxfieldServer server;
    private Path envFile;
    private Path decks;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeMoxfieldServer.start();
        envFile = dir.resolve(".env");
        Files.writeString(envFile, SyncSettings.TOKEN_VAR + "=cli-token\n"
                + SyncSettings.USERNAME_VAR + "=someone\n"
                + SyncSettings.API_BASE_VAR + "=" + server.baseUri() + "\n");
        decks = dir.resolve("decks");
        Files.createDirectories(decks);
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        server.close();
    }

    private int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testSyncCreatesThenReportsUnchanged() throws Exception {
        Path deck = decks.resolve("hakbal.md");
        Files.writeString(deck, DECK);

        assertEquals(0, run("sync", deck.toString(), "--env-file", envFile.toString()));
        assertTrue(output().contains("Done: 1 created, 0 unchanged, 0 superseded, 0 failed"), output());
        assertEquals("pub-1", DeckDocumentParser.readRemoteId(Files.readString(deck)));
        assertEquals("Bearer cli-token", server.requests().get(0).header("Authorization"));

        long posts = server.count("POST");
        assertEquals(0, run("sync", "--all", "--decks-dir", decks.toString(), "--env-file", envFile.toString()));
        assertTrue(output().contains("Done: 0 created, 1 unchanged"), output());
        assertEquals(posts, server.count("POST"));
    }

    @Test
    void testDryRunWritesNothing() throws Exception {
        Path deck = decks.resolve("hakbal.md");
        Files.writeString(deck, DECK);

        assertEquals(0, run("sync", "--dry-run", deck.toString(), "--env-file", envFile.toString()));

        assertTrue(output().contains("[CREATE] hakbal.md"), output());
        assertTrue(server.requests().isEmpty());
        assertEquals(DECK, Files.readString(deck));
    }

    @Test
    void testExpiredTokenFailsRun() throws Exception {
        Files.writeString(decks.resolve("a.md"), DECK.replace("| **Date** | 2026-01-01 |",
                "| **Date** | 2026-01-01 |\n| **Moxfield ID** | A1 |"));
        Files.writeString(decks.resolve("b.md"), DECK);
        server.script("GET", "/v3/decks/all/A1", 401, "{}");

        int exit = run("sync", "--all", "--decks-dir", decks.toString(), "--env-file", envFile.toString());

        assertEquals(1, exit);
        assertTrue(output().contains("b.md  NOT PROCESSED"), output());
        assertEquals(0, server.count("POST"));
    }

    @Test
    void testMissingTokenFails() throws Exception {
        assumeTrue(System.getenv(SyncSettings.TOKEN_VAR) == null);
        Path deck = decks.resolve("hakbal.md");
        Files.writeString(deck, DECK);
        Files.writeString(envFile, SyncSettings.API_BASE_VAR + "=" + server.baseUri() + "\n");

        assertEquals(1, run("sync", deck.toString(), "--env-file", envFile.toString()));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void testSyncNeedsFilesOrAll() {
        assertEquals(CommandLine.ExitCode.USAGE, run("sync", "--env-file", envFile.toString()));
    }

    @Test
    void testListRemote() {
        server.addDeck("A1", "a", "Hakbal Merfolk", List.of(CardLine.main(1, "Sol Ring")));

        assertEquals(0, run("list-remote", "--env-file", envFile.toString()));

        assertTrue(output().contains("Hakbal Merfolk"), output());
        assertTrue(output().contains("id=A1"), output());
        assertTrue(output().contains("1 deck(s) total"), output());
    }

    @Test
    void testPullThenRetryImportOnLinkedDeck() throws Exception {
        server.addDeck("A1", "a", "Hakbal Merfolk", List.of(
                CardLine.commander("Hakbal of the Surging Soul"), CardLine.main(1, "Sol Ring")));

        assertEquals(0, run("pull", "--decks-dir", decks.toString(), "--env-file", envFile.toString()));

        Path pulled = decks.resolve("hakbal-merfolk.md");
        assertTrue(Files.exists(pulled));
        assertEquals("A1", DeckDocumentParser.readRemoteId(Files.readString(pulled)));
        assertTrue(output().contains("Pulled 1, skipped 0"), output());

        assertEquals(0, run("retry-import", pulled.toString(), "--env-file", envFile.toString()));
        assertEquals(0, server.count("POST"));
    }

    @Test
    void testRetryImportMissingFile() {
        assertEquals(1, run("retry-import", dir.resolve("nope.md").toString(), "--env-file", envFile.toString()));
    }
}
