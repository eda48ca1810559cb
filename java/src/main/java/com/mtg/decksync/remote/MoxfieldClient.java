package com.mtg.decksync.remote;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moxfield REST client.
 * <p>
 * Requests carry the headers the Moxfield web app sends (browser user agent,
 * origin, referer, client version); the edge layer rejects bare clients with 403.
 * The bearer token is fixed at construction. An expired token surfaces as
 * {@link AuthException} and is never refreshed here.
 */
public class MoxfieldClient implements RemoteDecks {
    private static final Logger log = LoggerFactory.getLogger(MoxfieldClient.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";
    private static final String ACCEPT = "application/json, text/plain, */*";
    private static final int MAX_ERROR_BODY = 300;

    private final RemoteClientConfig config;
    private final String bearerToken;
    private final HttpClient httpClient;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper mapper = new ObjectMapper();

    public MoxfieldClient(RemoteClientConfig config, String bearerToken) {
        this(config, bearerToken, HttpClient.newBuilder()
                .version("https".equalsIgnoreCase(config.apiBase().getScheme())
                        ? HttpClient.Version.HTTP_2 : HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), RetryPolicy.defaults());
    }

    public MoxfieldClient(RemoteClientConfig config, String bearerToken, HttpClient httpClient, RetryPolicy retryPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IllegalArgumentException("Bearer token is required");
        }
        this.bearerToken = bearerToken.trim();
    }

    // ========== LIST ==========

    @Override
    public List<RemoteDeckSummary> listOwnedDecks(String owner) throws RemoteException {
        List<RemoteDeckSummary> decks = new ArrayList<>();
        int page = 1;
        while (true) {
            String path = "/v2/users/" + encodePath(owner) + "/decks?pageNumber=" + page
                    + "&pageSize=" + config.pageSize();
            JsonNode root = getJson("list decks of " + owner, path, false, null);

            JsonNode data = root.get("data");
            if (data == null || !data.isArray()) {
                throw new ProtocolException("Deck listing has no 'data' array");
            }
            for (JsonNode node : data) {
                decks.add(new RemoteDeckSummary(
                        requireText(node, "publicId", "deck listing"),
                        requireText(node, "name", "deck listing"),
                        optionalText(node, "format"),
                        optionalText(node, "visibility")));
            }

            JsonNode totalPages = root.get("totalPages");
            boolean lastPage = totalPages != null && totalPages.canConvertToInt()
                    ? page >= totalPages.asInt()
                    : data.size() < config.pageSize();
            if (lastPage || data.isEmpty()) {
                break;
            }
            page++;
        }
        log.debug("Listed {} deck(s) for {}", decks.size(), owner);
        return decks;
    }

    // ========== FETCH ==========

    @Override
    public RemoteDeckSnapshot fetchDeck(String remoteId) throws RemoteException {
        JsonNode root = getJson("fetch deck " + remoteId, "/v3/decks/all/" + encodePath(remoteId), true, remoteId);
        return parseSnapshot(root);
    }

    // ========== CREATE ==========

    @Override
    public RemoteDeckRef createDeck(String name, String format, Visibility visibility) throws RemoteException {
        if (!visibility.isDiscoverable()) {
            throw new IllegalArgumentException("Decks must be created with discoverable visibility, got "
                    + visibility.getJsonValue());
        }
        CreateDeckRequest body = new CreateDeckRequest(name, format, visibility);
        JsonNode root = postJson("create deck '" + name + "'", "/v3/decks", body, config.requestTimeout());

        String publicId = requireText(root, "publicId", "create deck response");
        String internalId = optionalText(root, "id");
        if (internalId == null) {
            log.debug("Create response for {} has no internal id, resolving it on import", publicId);
        }
        log.info("Created Moxfield deck '{}' ({})", name, publicId);
        return new RemoteDeckRef(publicId, internalId);
    }

    // ========== IMPORT ==========

    @Override
    public RemoteDeckSnapshot importCards(RemoteDeckRef deck, List<CardLine> lines) throws RemoteException {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Nothing to import");
        }
        String internalId = deck.internalId() != null
                ? deck.internalId()
                : fetchDeck(deck.publicId()).internalId();
        String importText = importText(lines);
        postJson("import cards into " + deck.publicId(),
                "/v2/decks/" + encodePath(internalId) + "/import",
                new ImportRequest(importText), config.importTimeout());
        log.info("Imported {} line(s) into {}", lines.size(), deck.publicId());
        return fetchDeck(deck.publicId());
    }

    /**
     * Render card lines as import text. Commander lines go under a
     * {@code Commander} header so they land in the command zone.
     */
    static String importText(List<CardLine> lines) {
        List<String> commanders = new ArrayList<>();
        List<String> main = new ArrayList<>();
        for (CardLine line : lines) {
            (line.board() == Board.COMMANDER ? commanders : main).add(line.toDeckLine());
        }
        if (commanders.isEmpty()) {
            return String.join("\n", main);
        }
        StringBuilder sb = new StringBuilder("Commander\n");
        sb.append(String.join("\n", commanders));
        if (!main.isEmpty()) {
            sb.append("\n\nDeck\n").append(String.join("\n", main));
        }
        return sb.toString();
    }

    // ========== PAYLOADS ==========

    record CreateDeckRequest(@JsonProperty("name") String name,
                             @JsonProperty("format") String format,
                             @JsonProperty("visibility") Visibility visibility) {}

    record ImportRequest(@JsonProperty("importText") String importText) {}

    RemoteDeckSnapshot parseSnapshot(JsonNode root) throws ProtocolException {
        String what = "deck response";
        String publicId = requireText(root, "publicId", what);
        String internalId = requireText(root, "id", what);
        String name = requireText(root, "name", what);
        JsonNode version = root.get("version");
        if (version == null || version.isNull() || version.isContainerNode()) {
            throw new ProtocolException("Deck " + publicId + " has no version");
        }
        JsonNode boardsNode = root.get("boards");
        if (boardsNode == null || !boardsNode.isObject()) {
            throw new ProtocolException("Deck " + publicId + " has no 'boards' object");
        }

        Map<Board, List<RemoteCardEntry>> boards = new EnumMap<>(Board.class);
        for (Board board : Board.values()) {
            JsonNode boardNode = boardsNode.get(board.getJsonValue());
            List<RemoteCardEntry> entries = new ArrayList<>();
            if (boardNode != null && !boardNode.isNull()) {
                JsonNode cards = boardNode.get("cards");
                if (cards == null || !cards.isObject()) {
                    throw new ProtocolException("Board '" + board.getJsonValue() + "' of " + publicId
                            + " has no 'cards' object");
                }
                Iterator<Map.Entry<String, JsonNode>> it = cards.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    JsonNode entry = field.getValue();
                    JsonNode quantity = entry.get("quantity");
                    if (quantity == null || !quantity.canConvertToInt() || quantity.asInt() < 1) {
                        throw new ProtocolException("Card entry " + field.getKey() + " of " + publicId
                                + " has no valid quantity");
                    }
                    String cardName = requireText(entry.path("card"), "name", "card entry " + field.getKey());
                    entries.add(new RemoteCardEntry(field.getKey(), cardName, quantity.asInt()));
                }
            }
            boards.put(board, entries);
        }
        return new RemoteDeckSnapshot(publicId, internalId, name, version.asText(), boards);
    }

    // ========== TRANSPORT ==========

    private JsonNode getJson(String operation, String path, boolean notFoundIsMissing, String remoteId)
            throws RemoteException {
        HttpRequest request = baseRequest(path, config.requestTimeout()).GET().build();
        return retryPolicy.execute(operation, true, () -> {
            HttpResponse<String> response = send(operation, request);
            if (notFoundIsMissing && response.statusCode() == 404) {
                throw new NotFoundException(remoteId);
            }
            checkStatus(operation, response);
            return readJson(operation, response.body());
        });
    }

    private JsonNode postJson(String operation, String path, Object body, Duration timeout) throws RemoteException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Could not encode request for " + operation, e);
        }
        HttpRequest request = baseRequest(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return retryPolicy.execute(operation, false, () -> {
            HttpResponse<String> response = send(operation, request);
            checkStatus(operation, response);
            return readJson(operation, response.body());
        });
    }

    private HttpRequest.Builder baseRequest(String path, Duration timeout) {
        String origin = config.webBase().toString().replaceAll("/+$", "");
        return HttpRequest.newBuilder(resolve(path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + bearerToken)
                .header("Accept", ACCEPT)
                .header("User-Agent", USER_AGENT)
                .header("x-moxfield-version", config.clientVersion())
                .header("Origin", origin)
                .header("Referer", origin + "/");
    }

    private URI resolve(String path) {
        String base = config.apiBase().toString().replaceAll("/+$", "");
        return URI.create(base + path);
    }

    private HttpResponse<String> send(String operation, HttpRequest request) throws RemoteException {
        log.debug("{} {}", request.method(), request.uri());
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientException(operation + " timed out", e);
        } catch (IOException e) {
            throw new TransientException(operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException(operation + " interrupted", e);
        }
    }

    static void checkStatus(String operation, HttpResponse<String> response) throws RemoteException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String detail = abbreviate(response.body());
        if (status == 401 || status == 403) {
            throw new AuthException(status + " on " + operation
                    + " - bearer token may be expired or invalid", status);
        }
        if (status == 409 || status == 412) {
            throw new ConflictException(operation + " rejected with " + status + ": " + detail, status);
        }
        if (status == 429 || status >= 500) {
            throw new TransientException(operation + " returned " + status + ": " + detail, status);
        }
        throw new ProtocolException(operation + " returned unexpected status " + status + ": " + detail, status);
    }

    private JsonNode readJson(String operation, String body) throws ProtocolException {
        if (body == null || body.isBlank()) {
            throw new ProtocolException("Empty response body for " + operation);
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new ProtocolException("Expected a JSON object for " + operation);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON for " + operation + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String requireText(JsonNode node, String field, String what) throws ProtocolException {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            throw new ProtocolException("Missing '" + field + "' in " + what);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static String encodePath(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String abbreviate(String body) {
        if (body == null || body.isEmpty()) {
            return "(no body)";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_ERROR_BODY ? flat.substring(0, MAX_ERROR_BODY) + "..." : flat;
    }
}
