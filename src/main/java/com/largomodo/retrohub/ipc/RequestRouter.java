package com.largomodo.retrohub.ipc;

import com.google.gson.JsonParseException;
import com.largomodo.retrohub.core.GameNotFoundException;
import com.largomodo.retrohub.core.LibraryStore;
import com.largomodo.retrohub.core.domain.GameRecord;
import com.largomodo.retrohub.ipc.payload.GameListPayload;
import com.largomodo.retrohub.ipc.payload.RecentPayload;
import com.largomodo.retrohub.ipc.payload.ScanPathPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps protocol requests onto {@link LibraryStore} operations.
 * <p>
 * Every outcome is a {@link Response}: domain failures become {@code success=false}
 * responses carrying a message, never exceptions. Payloads are decoded only in the shape
 * the message type expects; any other shape is rejected with "Invalid payload for &lt;type&gt;".
 * <p>
 * Stateless apart from its collaborators; thread safety comes from the store.
 */
public class RequestRouter implements RequestHandler {

    public static final String VERSION = "1.0.0";

    static final String GAME_NOT_FOUND = "Game not found";
    static final String UNKNOWN_TYPE = "Unknown message type";

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final LibraryStore store;
    private final MessageCodec codec;

    public RequestRouter(LibraryStore store) {
        this(store, new MessageCodec());
    }

    public RequestRouter(LibraryStore store, MessageCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Response handle(Request request) {
        Optional<MessageType> type = MessageType.fromToken(request.type());
        if (type.isEmpty()) {
            log.debug("Unknown message type: {}", request.type());
            return Response.error(request.id(), UNKNOWN_TYPE);
        }

        try {
            return dispatch(type.get(), request);
        } catch (JsonParseException e) {
            log.debug("Invalid payload for {}: {}", type.get().token(), e.getMessage());
            return Response.error(request.id(), "Invalid payload for " + type.get().token());
        } catch (GameNotFoundException e) {
            log.debug(e.getMessage());
            return Response.error(request.id(), GAME_NOT_FOUND);
        } catch (NoSuchFileException e) {
            return Response.error(request.id(), "Path does not exist: " + e.getFile());
        } catch (NotDirectoryException e) {
            return Response.error(request.id(), "Not a directory: " + e.getFile());
        } catch (IOException e) {
            // Persistence failure; in-memory changes made by the request are kept
            log.error("{} failed: {}", type.get().token(), e.getMessage());
            return Response.error(request.id(), e.getMessage());
        }
    }

    private Response dispatch(MessageType type, Request request) throws GameNotFoundException, IOException {
        String id = request.id();
        return switch (type) {
            case LIST_GAMES -> {
                GameListPayload filter = payloadOr(request, GameListPayload.class, GameListPayload.ALL);
                List<GameRecord> games = store.getGames(filter.platform(), filter.category());
                yield Response.success(id, truncate(games, filter.effectiveLimit()));
            }
            case GET_GAME -> {
                Optional<GameRecord> game = store.getGameById(gameId(request));
                yield game.map(found -> Response.success(id, found))
                        .orElseGet(() -> Response.error(id, GAME_NOT_FOUND));
            }
            case LAUNCH_GAME -> Response.success(id, store.recordPlay(gameId(request)));
            case GET_CATEGORIES -> Response.success(id, store.getCategoryCounts());
            case GET_PLATFORMS -> Response.success(id, store.getPlatformCounts());
            case GET_FAVORITES -> Response.success(id, store.getFavorites());
            case TOGGLE_FAVORITE -> {
                store.toggleFavorite(gameId(request));
                yield Response.success(id, null);
            }
            case GET_RECENT -> {
                RecentPayload recent = payloadOr(request, RecentPayload.class, RecentPayload.ALL);
                yield Response.success(id, store.getRecentlyPlayed(recent.effectiveLimit()));
            }
            case SCAN -> Response.success(id, "Found " + store.scan() + " games");
            case ADD_SCAN_PATH -> {
                ScanPathPayload scanPath = codec.decodePayload(request.payload(), ScanPathPayload.class);
                if (scanPath == null || scanPath.path() == null || scanPath.path().isEmpty()) {
                    throw new JsonParseException("path is required");
                }
                store.addScanPath(scanPath.path());
                yield Response.success(id, null);
            }
            case STATUS -> {
                Map<String, String> status = new LinkedHashMap<>();
                status.put("status", "ready");
                status.put("version", VERSION);
                yield Response.status(id, status);
            }
        };
    }

    /**
     * Game-ID payloads are a bare JSON string. An absent payload is treated as an empty ID,
     * which matches no game.
     */
    private String gameId(Request request) {
        String gameId = codec.decodePayload(request.payload(), String.class);
        return gameId == null ? "" : gameId;
    }

    private <T> T payloadOr(Request request, Class<T> type, T fallback) {
        T decoded = codec.decodePayload(request.payload(), type);
        return decoded == null ? fallback : decoded;
    }

    private static List<GameRecord> truncate(List<GameRecord> games, int limit) {
        return limit > 0 && limit < games.size() ? games.subList(0, limit) : games;
    }
}
