package com.mtg.decksync;

import com.mtg.decksync.config.ConfigException;
import com.mtg.decksync.config.SyncSettings;
import com.mtg.decksync.diff.CardChange;
import com.mtg.decksync.remote.MoxfieldClient;
import com.mtg.decksync.remote.RemoteDeckSummary;
import com.mtg.decksync.remote.RemoteDecks;
import com.mtg.decksync.remote.RemoteException;
import com.mtg.decksync.sync.DeckStore;
import com.mtg.decksync.sync.PullResult;
import com.mtg.decksync.sync.SyncOrchestrator;
import com.mtg.decksync.sync.SyncOutcome;
import com.mtg.decksync.sync.SyncPlan;
import com.mtg.decksync.sync.SyncReport;
import com.mtg.decksync.sync.SyncState;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * MTG Deck Sync CLI - Main entry point.
 * Pushes local Markdown decks to Moxfield and pulls remote decks back.
 */
@Command(name = "mtg-decksync",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Sync local MTG decks with Moxfield",
        subcommands = {
                Main.SyncCommand.class,
                Main.ListRemoteCommand.class,
                Main.PullCommand.class,
                Main.RetryImportCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SYNC COMMAND ==========
    @Command(name = "sync", description = "Push local decks to Moxfield")
    static class SyncCommand implements Callable<Integer> {
        @Parameters(arity = "0..*", description = "Deck file(s) to sync")
        List<Path> deckFiles = new ArrayList<>();

        @Option(names = {"-a", "--all"}, description = "Sync every deck in the decks directory")
        boolean all;

        @Option(names = {"-d", "--decks-dir"}, defaultValue = "decks",
                description = "Directory holding deck files")
        Path decksDir;

        @Option(names = {"-n", "--dry-run"}, description = "Show what would happen without writing anything")
        boolean dryRun;

        @Option(names = {"--env-file"}, defaultValue = ".env", description = "Path to .env file")
        Path envFile;

        @Spec
        Model.CommandSpec commandSpec;

        @Override
        public Integer call() throws Exception {
            DeckStore store = new DeckStore();
            List<Path> files;
            if (all) {
                files = store.listDecks(decksDir);
            } else if (!deckFiles.isEmpty()) {
                files = deckFiles;
            } else {
                throw new ParameterException(commandSpec.commandLine(), "Specify --all or provide deck file(s)");
            }
            if (files.isEmpty()) {
                System.err.println("No deck files found.");
                return 1;
            }

            RemoteDecks remote;
            try {
                remote = connect(envFile);
            } catch (ConfigException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            SyncOrchestrator orchestrator = new SyncOrchestrator(remote, store);

            if (dryRun) {
                return printPlans(orchestrator, files);
            }

            System.out.println("\n=== Syncing " + files.size() + " deck(s) to Moxfield ===\n");
            SyncReport report = orchestrator.syncAll(files);
            printReport(report);
            return report.exitCode();
        }
    }

    private static int printPlans(SyncOrchestrator orchestrator, List<Path> files) {
        System.out.println("\n=== DRY RUN (no changes) ===\n");
        int failed = 0;
        for (Path file : files) {
            SyncPlan plan = orchestrator.plan(file);
            System.out.println("[" + plan.action() + "] " + plan.deck());
            if (plan.displayName() != null) {
                System.out.println("    Moxfield name : " + plan.displayName());
            }
            System.out.println("    Moxfield ID   : " + (plan.remoteId() == null ? "-" : plan.remoteId()));
            System.out.println("    Cards         : " + plan.totalCards());
            for (CardChange change : plan.changes()) {
                System.out.println("      " + change);
            }
            if (plan.error() != null) {
                System.out.println("    Error         : " + plan.error());
                failed++;
            }
        }
        System.out.println("\n(dry run - nothing was changed)");
        return failed == 0 ? 0 : 1;
    }

    private static void printReport(SyncReport report) {
        for (SyncOutcome outcome : report.outcomes()) {
            System.out.println(outcome.summaryLine());
        }
        for (Path skipped : report.notProcessed()) {
            System.out.println("- " + skipped.getFileName() + "  NOT PROCESSED (run aborted)");
        }
        System.out.printf("%nDone: %d created, %d unchanged, %d superseded, %d failed%n",
                report.count(SyncState.CREATED), report.count(SyncState.UNCHANGED),
                report.count(SyncState.SUPERSEDED), report.count(SyncState.FAILED));
        if (!report.orphanedRemoteIds().isEmpty()) {
            System.out.println("Orphaned Moxfield decks (delete by hand if unwanted): "
                    + String.join(", ", report.orphanedRemoteIds()));
        }
        if (report.aborted()) {
            System.err.println("✗ Run aborted: authentication failed");
        }
    }

    // ========== LIST-REMOTE COMMAND ==========
    @Command(name = "list-remote", description = "List your decks on Moxfield")
    static class ListRemoteCommand implements Callable<Integer> {
        @Option(names = {"--env-file"}, defaultValue = ".env", description = "Path to .env file")
        Path envFile;

        @Override
        public Integer call() throws Exception {
            List<RemoteDeckSummary> decks;
            String owner;
            try {
                SyncSettings settings = SyncSettings.load(envFile);
                owner = settings.requireUsername();
                decks = new MoxfieldClient(settings.client(), settings.requireToken()).listOwnedDecks(owner);
            } catch (ConfigException | RemoteException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            System.out.println("Moxfield decks for " + owner + ":\n");
            for (RemoteDeckSummary deck : decks) {
                System.out.printf("  %-30s  id=%s  fmt=%s%n", deck.name(), deck.publicId(),
                        deck.format() == null ? "?" : deck.format());
            }
            System.out.println("\n" + decks.size() + " deck(s) total");
            return 0;
        }
    }

    // ========== PULL COMMAND ==========
    @Command(name = "pull", description = "Pull Moxfield decks not yet linked locally into deck files")
    static class PullCommand implements Callable<Integer> {
        @Parameters(arity = "0..*", description = "Only pull decks whose name contains one of these")
        List<String> names = new ArrayList<>();

        @Option(names = {"-d", "--decks-dir"}, defaultValue = "decks",
                description = "Directory holding deck files")
        Path decksDir;

        @Option(names = {"--env-file"}, defaultValue = ".env", description = "Path to .env file")
        Path envFile;

        @Override
        public Integer call() throws Exception {
            PullResult result;
            try {
                SyncSettings settings = SyncSettings.load(envFile);
                String owner = settings.requireUsername();
                RemoteDecks remote = new MoxfieldClient(settings.client(), settings.requireToken());
                System.out.println("Pulling decks from Moxfield for " + owner + "...");
                result = new SyncOrchestrator(remote, new DeckStore()).pull(owner, names, decksDir);
            } catch (ConfigException | RemoteException | IOException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            for (String name : result.skipped()) {
                System.out.println("  ⏭ " + name + " - already linked locally, skipping");
            }
            for (Path file : result.pulled()) {
                System.out.println("  ✓ " + file);
            }
            System.out.println("\nPulled " + result.pulled().size() + ", skipped " + result.skipped().size());
            return 0;
        }
    }

    // ========== RETRY-IMPORT COMMAND ==========
    @Command(name = "retry-import", description = "Import cards into a deck whose first import failed")
    static class RetryImportCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Deck file")
        Path deckFile;

        @Option(names = {"--env-file"}, defaultValue = ".env", description = "Path to .env file")
        Path envFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(deckFile)) {
                System.err.println("✗ File not found: " + deckFile);
                return 1;
            }
            RemoteDecks remote;
            try {
                remote = connect(envFile);
            } catch (ConfigException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            SyncOutcome outcome = new SyncOrchestrator(remote, new DeckStore()).retryImport(deckFile);
            System.out.println(outcome.summaryLine());
            return outcome.isSuccess() ? 0 : 1;
        }
    }

    /**
     * The only place the bearer token is read from configuration.
     */
    private static RemoteDecks connect(Path envFile) throws ConfigException {
        SyncSettings settings = SyncSettings.load(envFile);
        return new MoxfieldClient(settings.client(), settings.requireToken());
    }
}
