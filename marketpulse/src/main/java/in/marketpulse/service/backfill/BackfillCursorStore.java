package in.marketpulse.service.backfill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.marketpulse.domain.backfill.BackfillCursor;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.infrastructure.persistence.StateStore;
import in.marketpulse.infrastructure.persistence.StorageWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Loads and saves backfill cursors as JSON in the state store under
 * {@code backfill:<venue>:<symbol>:<market>}.
 */
public class BackfillCursorStore {
    private static final Logger log = LoggerFactory.getLogger(BackfillCursorStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final StateStore store;

    public BackfillCursorStore(StateStore store) {
        this.store = store;
    }

    /**
     * Load a cursor. An unreadable value is logged and treated as absent.
     */
    public Optional<BackfillCursor> load(String venue, String symbol, MarketType market) {
        String key = BackfillCursor.key(venue, symbol, market);
        Optional<String> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(raw.get(), BackfillCursor.class));
        } catch (JsonProcessingException e) {
            log.warn("[Backfill] Ignoring unreadable cursor {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws StorageWriteException if the store rejects the write
     */
    public void save(BackfillCursor cursor) {
        String json;
        try {
            json = MAPPER.writeValueAsString(cursor);
        } catch (JsonProcessingException e) {
            throw new StorageWriteException(cursor.key(), "Cannot serialize cursor", e);
        }
        store.set(cursor.key(), json);
    }

    public void delete(String venue, String symbol, MarketType market) {
        store.delete(BackfillCursor.key(venue, symbol, market));
    }
}
