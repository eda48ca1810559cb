package com.mtg.decksync.sync;

import com.mtg.decksync.deck.DeckDocumentParser;
import com.mtg.decksync.deck.DeckMetadata;
import com.mtg.decksync.deck.DeckRecord;
import com.mtg.decksync.deck.MalformedDeckException;
import com.mtg.decksync.deck.Visibility;
import com.mtg.decksync.diff.CardChange;
import com.mtg.decksync.diff.DeckDiff;
import com.mtg.decksync.remote.NotFoundException;
import com.mtg.decksync.remote.RemoteDeckRef;
import com.mtg.decksync.remote.RemoteDeckSnapshot;
import com.mtg.decksync.remote.RemoteDeckSummary;
import com.mtg.decksync.remote.RemoteDecks;
import com.mtg.decksync.remote.RemoteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reconciles local deck files with Moxfield, one deck at a time.
 * <p>
 * Moxfield can create decks and append cards but cannot remove or resize a
 * card line, so a changed deck is never patched in place. Instead a new remote
 * deck is created, filled with the full local list and linked; the old deck is
 * left untouched and reported as orphaned.
 * <p>
 * Per deck the order is always create, import, then metadata write. Nothing is
 * written locally before the remote create has succeeded.
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    public static final String DEFAULT_FORMAT = "commander";

    private static final String FIX_FILE = "fix the deck file and sync again";
    private static final String REAUTHENTICATE = "extract a fresh bearer token from moxfield.com and update MOXFIELD_BEARER_TOKEN";
    private static final String RETRY_LATER = "sync again later";

    private final RemoteDecks remote;
    private final DeckStore store;
    private final String format;
    private final Clock clock;

    public SyncOrchestrator(RemoteDecks remote, DeckStore store) {
        this(remote, store, DEFAULT_FORMAT, Clock.systemDefaultZone());
    }

    public SyncOrchestrator(RemoteDecks remote, DeckStore store, String format, Clock clock) {
        this.remote = remote;
        this.store = store;
        this.format = format;
        this.clock = clock;
    }

    // ========== SYNC ==========

    /**
     * Sync every deck in order. An authentication failure stops the run; the
     * remaining decks are listed as not processed.
     */
    public SyncReport syncAll(List<Path> files) {
        List<SyncOutcome> outcomes = new ArrayList<>();
        List<Path> notProcessed = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            SyncOutcome outcome = sync(files.get(i));
            outcomes.add(outcome);
            if (outcome.failure() == FailureKind.AUTH) {
                notProcessed.addAll(files.subList(i + 1, files.size()));
                log.error("Authentication failed, aborting with {} deck(s) not processed", notProcessed.size());
                break;
            }
        }
        return new SyncReport(outcomes, notProcessed);
    }

    public SyncOutcome sync(Path file) {
        String label = file.getFileName().toString();

        DeckRecord record;
        try {
            record = load(file);
        } catch (MalformedDeckException e) {
            return SyncOutcome.failed(label, FailureKind.MALFORMED_DECK, e.getMessage(), FIX_FILE);
        } catch (IOException e) {
            return SyncOutcome.failed(label, FailureKind.LOCAL_IO, "Could not read deck file: " + e.getMessage(),
                    "check the file path");
        }

        DeckMetadata metadata = record.metadata();
        if (!metadata.visibility().isDiscoverable()) {
            log.warn("{}: visibility '{}' overridden with '{}' so the deck stays listable",
                    label, metadata.visibility().getJsonValue(), Visibility.discoverable().getJsonValue());
        }

        if (!metadata.isLinked()) {
            log.info("{}: not linked yet, creating '{}'", label, record.displayName());
            return publish(file, label, record, null);
        }

        String linkedId = metadata.remoteId();
        RemoteDeckSnapshot snapshot;
        try {
            snapshot = remote.fetchDeck(linkedId);
        } catch (NotFoundException e) {
            return SyncOutcome.failed(label, FailureKind.NOT_FOUND, e.getMessage(),
                    "confirm the deck was deleted on Moxfield, then clear the '"
                            + DeckDocumentParser.REMOTE_ID_KEY + "' row to publish it again");
        } catch (RemoteException e) {
            return remoteFailure(label, e);
        }

        if (DeckDiff.equivalent(record, snapshot)) {
            log.info("{}: up to date with {}", label, linkedId);
            if (!metadata.visibility().isDiscoverable()) {
                String writeError = writeMetadata(file,
                        record.withMetadata(metadata.linkedTo(linkedId, Visibility.discoverable())));
                if (writeError != null) {
                    return new SyncOutcome(label, SyncState.FAILED, false, linkedId, null,
                            FailureKind.LOCAL_IO, writeError, "check the file is writable and sync again");
                }
            }
            return SyncOutcome.unchanged(label, linkedId);
        }

        List<CardChange> changes = DeckDiff.compare(record, snapshot);
        log.info("{}: {} change(s) against {}: {}", label, changes.size(), linkedId, changes);
        return publish(file, label, record, linkedId);
    }

    /**
     * Create a remote deck, import the full local list and link it.
     *
     * @param supersededId currently linked remote id, or null for a first publish
     */
    private SyncOutcome publish(Path file, String label, DeckRecord record, String supersededId) {
        RemoteDeckRef created;
        try {
            created = remote.createDeck(record.displayName(), format, Visibility.discoverable());
        } catch (RemoteException e) {
            return remoteFailure(label, e);
        }

        DeckRecord linked = record.withMetadata(
                record.metadata().linkedTo(created.publicId(), Visibility.discoverable()));

        try {
            remote.importCards(created, record.cards());
        } catch (RemoteException e) {
            log.error("{}: created {} but the import failed: {}", label, created.publicId(), e.getMessage());
            String writeError = writeMetadata(file, linked);
            String nextAction = writeError == null
                    ? "run 'retry-import " + file + "' to fill " + created.publicId()
                    : "add '| **" + DeckDocumentParser.REMOTE_ID_KEY + "** | " + created.publicId()
                      + " |' to the file by hand, then run 'retry-import " + file + "'";
            String error = writeError == null ? e.getMessage() : e.getMessage() + "; " + writeError;
            return SyncOutcome.partial(label, FailureKind.of(e), created.publicId(), supersededId, error, nextAction);
        }

        String writeError = writeMetadata(file, linked);
        if (writeError != null) {
            return new SyncOutcome(label, SyncState.FAILED, false, created.publicId(), supersededId,
                    FailureKind.LOCAL_IO, writeError,
                    "add '| **" + DeckDocumentParser.REMOTE_ID_KEY + "** | " + created.publicId()
                            + " |' to the file by hand");
        }

        if (supersededId == null) {
            log.info("{}: published as {}", label, created.publicId());
            return SyncOutcome.created(label, created.publicId());
        }
        log.info("{}: superseded {} with {}", label, supersededId, created.publicId());
        return SyncOutcome.superseded(label, created.publicId(), supersededId);
    }

    // ========== RETRY IMPORT ==========

    /**
     * Finish a deck left PARTIAL: import the local list into the linked remote
     * deck, but only while that deck is still empty. Importing into a deck that
     * already has cards would add to the quantities already there.
     */
    public SyncOutcome retryImport(Path file) {
        String label = file.getFileName().toString();
        DeckRecord record;
        try {
            record = load(file);
        } catch (MalformedDeckException e) {
            return SyncOutcome.failed(label, FailureKind.MALFORMED_DECK, e.getMessage(), FIX_FILE);
        } catch (IOException e) {
            return SyncOutcome.failed(label, FailureKind.LOCAL_IO, "Could not read deck file: " + e.getMessage(),
                    "check the file path");
        }
        if (!record.metadata().isLinked()) {
            return SyncOutcome.failed(label, FailureKind.MALFORMED_DECK, "Deck is not linked to a Moxfield deck",
                    "run 'sync " + file + "' instead");
        }

        String remoteId = record.metadata().remoteId();
        try {
            RemoteDeckSnapshot snapshot = remote.fetchDeck(remoteId);
            if (!snapshot.isEmpty()) {
                if (DeckDiff.equivalent(record, snapshot)) {
                    log.info("{}: import into {} had already gone through", label, remoteId);
                    return SyncOutcome.unchanged(label, remoteId);
                }
                return SyncOutcome.failed(label, FailureKind.CONFLICT,
                        "Remote deck " + remoteId + " already holds " + snapshot.totalCards()
                                + " card(s); importing again would add to them",
                        "run 'sync " + file + "' to supersede it");
            }
            remote.importCards(snapshot.ref(), record.cards());
            log.info("{}: imported {} card(s) into {}", label, record.totalCards(), remoteId);
            return SyncOutcome.created(label, remoteId);
        } catch (NotFoundException e) {
            return SyncOutcome.failed(label, FailureKind.NOT_FOUND, e.getMessage(),
                    "clear the '" + DeckDocumentParser.REMOTE_ID_KEY + "' row and sync again");
        } catch (RemoteException e) {
            return remoteFailure(label, e);
        }
    }

    // ========== DRY RUN ==========

    /**
     * Work out what {@link #sync} would do. Reads only.
     */
    public SyncPlan plan(Path file) {
        String label = file.getFileName().toString();
        DeckRecord record;
        try {
            record = load(file);
        } catch (MalformedDeckException | IOException e) {
            return new SyncPlan(label, SyncPlan.Action.FAILED, null, null, 0, List.of(), e.getMessage());
        }
        DeckMetadata metadata = record.metadata();
        if (!metadata.isLinked()) {
            return new SyncPlan(label, SyncPlan.Action.CREATE, metadata.displayName(), null,
                    record.totalCards(), List.of(), null);
        }
        try {
            RemoteDeckSnapshot snapshot = remote.fetchDeck(metadata.remoteId());
            List<CardChange> changes = DeckDiff.compare(record, snapshot);
            SyncPlan.Action action = changes.isEmpty() ? SyncPlan.Action.UNCHANGED : SyncPlan.Action.SUPERSEDE;
            return new SyncPlan(label, action, metadata.displayName(), metadata.remoteId(),
                    record.totalCards(), changes, null);
        } catch (RemoteException e) {
            return new SyncPlan(label, SyncPlan.Action.FAILED, metadata.displayName(), metadata.remoteId(),
                    record.totalCards(), List.of(), e.getMessage());
        }
    }

    // ========== PULL ==========

    /**
     * Write local deck files for remote decks no local file links yet.
     *
     * @param nameFilters case-insensitive substrings; empty pulls every unlinked deck
     */
    public PullResult pull(String owner, List<String> nameFilters, Path decksDir) throws RemoteException, IOException {
        Set<String> linkedIds = new HashSet<>();
        for (Path deckFile : store.listDecks(decksDir)) {
            String id = DeckDocumentParser.readRemoteId(store.read(deckFile));
            if (id != null) {
                linkedIds.add(id);
            }
        }

        List<Path> pulled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (RemoteDeckSummary summary : remote.listOwnedDecks(owner)) {
            if (!matches(summary.name(), nameFilters)) {
                continue;
            }
            if (linkedIds.contains(summary.publicId())) {
                skipped.add(summary.name());
                continue;
            }
            RemoteDeckSnapshot snapshot = remote.fetchDeck(summary.publicId());
            String document = DeckDocumentParser.render(summary.name(), summary.publicId(),
                    snapshot.toCardLines(), LocalDate.now(clock));
            Path target = freeFileName(decksDir, slugify(summary.name()));
            Files.createDirectories(decksDir);
            store.write(target, document);
            log.info("Pulled '{}' ({}) into {}", summary.name(), summary.publicId(), target);
            pulled.add(target);
        }
        return new PullResult(pulled, skipped);
    }

    static String slugify(String name) {
        String s = name.toLowerCase(Locale.ROOT).trim();
        s = s.replaceAll("['‘’]", "");
        s = s.replaceAll("[^a-z0-9]+", "-");
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "deck" : s;
    }

    private Path freeFileName(Path dir, String slug) {
        Path candidate = dir.resolve(slug + ".md");
        int i = 2;
        while (store.exists(candidate)) {
            candidate = dir.resolve(slug + "-" + i + ".md");
            i++;
        }
        return candidate;
    }

    private static boolean matches(String name, List<String> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return filters.stream().anyMatch(f -> lower.contains(f.toLowerCase(Locale.ROOT)));
    }

    // ========== HELPERS ==========

    private DeckRecord load(Path file) throws IOException, MalformedDeckException {
        return DeckDocumentParser.parse(store.read(file), DeckStore.stem(file));
    }

    /**
     * @return null on success, otherwise an error message
     */
    private String writeMetadata(Path file, DeckRecord linked) {
        try {
            store.write(file, DeckDocumentParser.serialize(linked));
            return null;
        } catch (IOException e) {
            log.error("Could not record {} in {}: {}", linked.metadata().remoteId(), file, e.getMessage());
            return "Could not write deck file: " + e.getMessage();
        }
    }

    private static SyncOutcome remoteFailure(String label, RemoteException e) {
        FailureKind kind = FailureKind.of(e);
        String next = switch (kind) {
            case AUTH -> REAUTHENTICATE;
            case TRANSIENT -> RETRY_LATER;
            case CONFLICT -> "sync again to re-read the remote version";
            default -> "check the Moxfield response and sync again";
        };
        log.error("{}: {}", label, e.getMessage());
        return SyncOutcome.failed(label, kind, e.getMessage(), next);
    }
}
