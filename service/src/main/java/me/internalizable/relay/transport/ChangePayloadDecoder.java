package me.internalizable.relay.transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.ChangeEventType;
import me.internalizable.relay.api.event.DeleteEvent;
import me.internalizable.relay.api.event.InsertEvent;
import me.internalizable.relay.api.event.UpdateEvent;
import me.internalizable.relay.api.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes raw change payloads into {@link ChangeEvent}s.
 *
 * <p>Expected payload shape:</p>
 * <pre>{@code
 * {
 *   "table": "bookings",
 *   "eventType": "UPDATE",
 *   "old": { "id": "b-1", "status": "pending" },
 *   "new": { "id": "b-1", "status": "confirmed" },
 *   "commit_timestamp": "2024-05-01T18:00:00Z"
 * }
 * }</pre>
 *
 * <p>Inserts require {@code new}, deletes require {@code old}, updates require
 * {@code new} and default a missing {@code old} to an empty row. Payloads that do
 * not fit are logged and dropped rather than passed on half-formed.</p>
 */
public final class ChangePayloadDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangePayloadDecoder.class);

    /**
     * A decoded change together with the table it happened on.
     *
     * @param table the table
     * @param event the change
     */
    public record DecodedChange(@Nonnull Table table, @Nonnull ChangeEvent<JsonObject> event) {
    }

    /**
     * Decode a JSON payload.
     *
     * @param json the payload text
     * @return the decoded change, or empty if the payload is invalid
     */
    @Nonnull
    public Optional<DecodedChange> decode(@Nonnull String json) {
        Objects.requireNonNull(json, "json");

        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            LOGGER.warn("Dropping unparseable change payload: {}", e.getMessage());
            return Optional.empty();
        }

        if (!element.isJsonObject()) {
            LOGGER.warn("Dropping change payload that is not a JSON object");
            return Optional.empty();
        }
        return decode(element.getAsJsonObject());
    }

    /**
     * Decode a parsed payload.
     *
     * @param payload the payload object
     * @return the decoded change, or empty if the payload is invalid
     */
    @Nonnull
    public Optional<DecodedChange> decode(@Nonnull JsonObject payload) {
        Objects.requireNonNull(payload, "payload");

        String tableName = getString(payload, "table");
        if (tableName == null) {
            LOGGER.warn("Dropping change payload without table");
            return Optional.empty();
        }
        Optional<Table> table = Table.fromName(tableName);
        if (table.isEmpty()) {
            LOGGER.warn("Dropping change payload for unknown table: {}", tableName);
            return Optional.empty();
        }

        String typeName = getString(payload, "eventType");
        Optional<ChangeEventType> type = typeName != null ? ChangeEventType.fromName(typeName) : Optional.empty();
        if (type.isEmpty()) {
            LOGGER.warn("Dropping change payload for {} with unknown event type: {}", tableName, typeName);
            return Optional.empty();
        }

        JsonObject newRow = getObject(payload, "new");
        JsonObject oldRow = getObject(payload, "old");

        ChangeEvent<JsonObject> event;
        switch (type.get()) {
            case INSERT -> {
                if (newRow == null) {
                    LOGGER.warn("Dropping INSERT on {} without new row", tableName);
                    return Optional.empty();
                }
                event = new InsertEvent<>(newRow);
            }
            case UPDATE -> {
                if (newRow == null) {
                    LOGGER.warn("Dropping UPDATE on {} without new row", tableName);
                    return Optional.empty();
                }
                event = new UpdateEvent<>(oldRow != null ? oldRow : new JsonObject(), newRow);
            }
            case DELETE -> {
                if (oldRow == null) {
                    LOGGER.warn("Dropping DELETE on {} without old row", tableName);
                    return Optional.empty();
                }
                event = new DeleteEvent<>(oldRow);
            }
            default -> throw new IllegalStateException("Unhandled event type: " + type.get());
        }

        return Optional.of(new DecodedChange(table.get(), event));
    }

    @Nullable
    private static String getString(JsonObject payload, String member) {
        JsonElement element = payload.get(member);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    @Nullable
    private static JsonObject getObject(JsonObject payload, String member) {
        JsonElement element = payload.get(member);
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        return element.getAsJsonObject();
    }
}
