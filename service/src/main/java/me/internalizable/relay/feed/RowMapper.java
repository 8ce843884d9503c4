package me.internalizable.relay.feed;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Converts decoded rows into a handler's row type.
 *
 * <p>Column names are snake_case; the default mapper binds them to camelCase
 * fields and record components. Handlers asking for {@link JsonObject} get their
 * own copy of the row.</p>
 */
public final class RowMapper {

    private final Gson gson;

    public RowMapper() {
        this(new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .create());
    }

    public RowMapper(@Nonnull Gson gson) {
        this.gson = Objects.requireNonNull(gson, "gson");
    }

    /**
     * Convert the rows of an event.
     *
     * @param event the decoded event
     * @param rowType the target row type
     * @param <T> the row type
     * @return an event of the same kind carrying converted rows
     * @throws com.google.gson.JsonParseException if a row does not fit the type
     */
    @Nonnull
    public <T> ChangeEvent<T> convert(@Nonnull ChangeEvent<JsonObject> event, @Nonnull Class<T> rowType) {
        if (rowType == JsonObject.class) {
            return event.map(row -> rowType.cast(row.deepCopy()));
        }
        return event.map(row -> {
            T converted = gson.fromJson(row, rowType);
            if (converted == null) {
                throw new IllegalStateException("Row converted to null for " + rowType.getName());
            }
            return converted;
        });
    }
}
