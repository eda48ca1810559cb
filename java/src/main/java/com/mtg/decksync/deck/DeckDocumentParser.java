package com.mtg.decksync.deck;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes Markdown deck documents.
 * <p>
 * A deck document has a {@code # Title} heading, a metadata table of
 * {@code | **Key** | Value |} rows and a fenced code block holding
 * {@code N Card Name} lines. Only the first fenced block is read.
 * <p>
 * The parser owns three metadata rows: {@value #REMOTE_ID_KEY},
 * {@value #REMOTE_NAME_KEY} and {@value #VISIBILITY_KEY}. {@link #serialize}
 * rewrites those rows and leaves every other byte of the document alone.
 */
public final class DeckDocumentParser {
    private DeckDocumentParser() {}

    public static final String REMOTE_ID_KEY = "Moxfield ID";
    public static final String REMOTE_NAME_KEY = "Moxfield Name";
    public static final String VISIBILITY_KEY = "Visibility";
    public static final String COMMANDER_KEY = "Commander";
    public static final String DATE_KEY = "Date";

    private static final Pattern TITLE = Pattern.compile("^#[ \\t]+(.+?)[ \\t]*(?=\\r?$)", Pattern.MULTILINE);
    private static final Pattern META_ROW = Pattern.compile(
            "^\\|[ \\t]*\\*\\*(.+?)\\*\\*[ \\t]*\\|[ \\t]*(.*?)[ \\t]*\\|[ \\t]*(?=\\r?$)", Pattern.MULTILINE);
    private static final Pattern FENCE = Pattern.compile("```[^\\n]*\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern CARD_LINE = Pattern.compile("^(\\d+)x?\\s+(.+)$");

    /**
     * Parse a deck document.
     *
     * @param document     full document text
     * @param fallbackName name used when the document has neither a remote name nor a title,
     *                     usually the file stem; may be null
     * @return parsed deck
     * @throws MalformedDeckException if the card block cannot be split into quantity/name pairs,
     *                                or a linked deck has no usable name
     */
    public static DeckRecord parse(String document, String fallbackName) throws MalformedDeckException {
        Map<String, String> meta = readMetadata(document);

        Matcher title = TITLE.matcher(document);
        String deckTitle = title.find() ? title.group(1).trim() : null;

        String remoteId = meta.get(key(REMOTE_ID_KEY));
        String displayName = firstNonBlank(meta.get(key(REMOTE_NAME_KEY)), deckTitle, fallbackName);
        if (displayName == null) {
            if (remoteId != null) {
                throw new MalformedDeckException("Deck is linked to " + remoteId
                        + " but has no '" + REMOTE_NAME_KEY + "' row or title to sync it under");
            }
            throw new MalformedDeckException("Deck has no title");
        }

        Visibility visibility = Visibility.discoverable();
        String visibilityValue = meta.get(key(VISIBILITY_KEY));
        if (visibilityValue != null) {
            try {
                visibility = Visibility.fromString(visibilityValue);
            } catch (IllegalArgumentException e) {
                throw new MalformedDeckException("Invalid '" + VISIBILITY_KEY + "' value: " + visibilityValue, e);
            }
        }

        List<String> commanders = commanderNames(meta.get(key(COMMANDER_KEY)));
        List<CardLine> cards = readCards(document, commanders);

        return new DeckRecord(deckTitle, cards, new DeckMetadata(remoteId, displayName, visibility), document);
    }

    /**
     * Write the record's metadata back into its source document.
     * Missing rows are inserted after the {@value #DATE_KEY} row, else after the
     * last metadata row, else after the title, else at the top of the document.
     */
    public static String serialize(DeckRecord record) {
        String text = record.document();
        String newline = text.contains("\r\n") ? "\r\n" : "\n";
        DeckMetadata metadata = record.metadata();

        Map<String, String> owned = new LinkedHashMap<>();
        if (metadata.remoteId() != null || hasRow(text, REMOTE_ID_KEY)) {
            owned.put(REMOTE_ID_KEY, metadata.remoteId() == null ? "" : metadata.remoteId());
        }
        owned.put(REMOTE_NAME_KEY, metadata.displayName());
        owned.put(VISIBILITY_KEY, metadata.visibility().getJsonValue());

        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, String> row : owned.entrySet()) {
            Pattern rowPattern = rowPattern(row.getKey());
            Matcher m = rowPattern.matcher(text);
            if (m.find()) {
                text = text.substring(0, m.start()) + row(row.getKey(), row.getValue()) + text.substring(m.end());
            } else {
                missing.add(row(row.getKey(), row.getValue()));
            }
        }
        if (missing.isEmpty()) {
            return text;
        }
        return insertRows(text, missing, newline);
    }

    /**
     * Build a fresh document for a deck pulled from Moxfield.
     */
    public static String render(String name, String remoteId, List<CardLine> cards, LocalDate date) {
        String commander = cards.stream()
                .filter(c -> c.board() == Board.COMMANDER)
                .map(CardLine::name)
                .findFirst()
                .orElse("");

        List<String> lines = new ArrayList<>();
        lines.add("# " + name);
        lines.add("");
        lines.add("| | |");
        lines.add("|---|---|");
        lines.add(row(COMMANDER_KEY, commander));
        lines.add(row(DATE_KEY, date.toString()));
        lines.add(row(REMOTE_ID_KEY, remoteId));
        lines.add(row(REMOTE_NAME_KEY, name));
        lines.add(row(VISIBILITY_KEY, Visibility.discoverable().getJsonValue()));
        lines.add("");
        lines.add("## Strategy");
        lines.add("");
        lines.add("_Imported from Moxfield. Add strategy notes here._");
        lines.add("");
        lines.add("## Decklist");
        lines.add("");
        lines.add("```");
        cards.stream().filter(c -> c.board() == Board.COMMANDER).forEach(c -> lines.add(c.toDeckLine()));
        cards.stream().filter(c -> c.board() == Board.MAIN).forEach(c -> lines.add(c.toDeckLine()));
        lines.add("```");
        lines.add("");
        return String.join("\n", lines);
    }

    /**
     * Read the metadata table. Keys are lower-cased; empty values and a bare
     * {@code |} are treated as absent.
     */
    public static Map<String, String> readMetadata(String document) {
        Map<String, String> meta = new HashMap<>();
        Matcher m = META_ROW.matcher(document);
        while (m.find()) {
            String value = m.group(2).trim();
            if (value.isEmpty() || value.equals("|")) {
                continue;
            }
            meta.putIfAbsent(key(m.group(1)), value);
        }
        return meta;
    }

    /**
     * The recorded remote id, without validating the rest of the document.
     */
    public static String readRemoteId(String document) {
        return readMetadata(document).get(key(REMOTE_ID_KEY));
    }

    private static List<CardLine> readCards(String document, List<String> commanders) throws MalformedDeckException {
        Matcher fence = FENCE.matcher(document);
        if (!fence.find()) {
            throw new MalformedDeckException("No fenced decklist block found");
        }
        int blockStartLine = lineNumberAt(document, fence.start(1));

        List<CardLine> cards = new ArrayList<>();
        Map<Board, Set<String>> seen = new HashMap<>();
        String[] lines = fence.group(1).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }
            int lineNum = blockStartLine + i;

            Matcher cm = CARD_LINE.matcher(line);
            if (!cm.matches()) {
                throw new MalformedDeckException("Invalid deck format at line " + lineNum
                        + ": Expected format 'COUNT CARD_NAME' but got '" + line + "'");
            }
            int count;
            try {
                count = Integer.parseInt(cm.group(1));
            } catch (NumberFormatException e) {
                throw new MalformedDeckException("Invalid deck format at line " + lineNum
                        + ": '" + cm.group(1) + "' is not a valid number", e);
            }
            if (count < 1) {
                throw new MalformedDeckException("Invalid deck format at line " + lineNum
                        + ": quantity must be at least 1");
            }

            String name = cm.group(2).trim();
            Board board = isCommander(name, commanders) ? Board.COMMANDER : Board.MAIN;
            String nameKey = name.toLowerCase(Locale.ROOT);
            if (!seen.computeIfAbsent(board, b -> new HashSet<>()).add(nameKey) && !BasicLands.isBasic(name)) {
                throw new MalformedDeckException("Duplicate card at line " + lineNum + ": '" + name
                        + "' is listed more than once");
            }
            cards.add(new CardLine(name, count, board));
        }

        if (cards.isEmpty()) {
            throw new MalformedDeckException("Decklist block contains no cards");
        }
        return cards;
    }

    private static List<String> commanderNames(String value) {
        if (value == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String part : value.split("\\s+\\+\\s+")) {
            if (!part.isBlank()) {
                names.add(part.trim());
            }
        }
        return names;
    }

    private static boolean isCommander(String cardName, List<String> commanders) {
        String frontFace = cardName.contains(" // ") ? cardName.substring(0, cardName.indexOf(" // ")) : cardName;
        for (String commander : commanders) {
            if (commander.equalsIgnoreCase(cardName) || commander.equalsIgnoreCase(frontFace)) {
                return true;
            }
        }
        return false;
    }

    private static String insertRows(String text, List<String> rows, String newline) {
        String block = String.join(newline, rows);

        Matcher date = rowPattern(DATE_KEY).matcher(text);
        if (date.find()) {
            return insertAfter(text, date.end(), block, newline);
        }
        Matcher anyRow = META_ROW.matcher(text);
        int lastRowEnd = -1;
        while (anyRow.find()) {
            lastRowEnd = anyRow.end();
        }
        if (lastRowEnd >= 0) {
            return insertAfter(text, lastRowEnd, block, newline);
        }

        String table = "| | |" + newline + "|---|---|" + newline + block;
        Matcher title = TITLE.matcher(text);
        if (title.find()) {
            return insertAfter(text, title.end(), newline + table, newline);
        }
        return table + newline + newline + text;
    }

    private static String insertAfter(String text, int offset, String block, String newline) {
        return text.substring(0, offset) + newline + block + text.substring(offset);
    }

    private static boolean hasRow(String text, String key) {
        return rowPattern(key).matcher(text).find();
    }

    private static Pattern rowPattern(String key) {
        String keyPattern = Pattern.quote(key).replace(" ", "\\E[ \\t]+\\Q");
        return Pattern.compile("^\\|[ \\t]*\\*\\*" + keyPattern + "\\*\\*[ \\t]*\\|[^\\n]*?\\|[ \\t]*(?=\\r?$)",
                Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
    }

    private static String row(String key, String value) {
        return "| **" + key + "** | " + value + " |";
    }

    private static String key(String raw) {
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static int lineNumberAt(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
