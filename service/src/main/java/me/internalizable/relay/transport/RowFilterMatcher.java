package me.internalizable.relay.transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import me.internalizable.relay.api.event.ChangeEvent;
import me.internalizable.relay.api.event.ChangeEventType;
import me.internalizable.relay.api.event.SubscribedEvent;
import me.internalizable.relay.api.table.RowFilter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Evaluates channel selectors against decoded changes.
 *
 * <p>Deletes are matched against the old row, everything else against the new row.
 * A missing or null column never matches. Values are compared numerically when both
 * sides are numbers and as strings otherwise.</p>
 */
public final class RowFilterMatcher {

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?$");

    private RowFilterMatcher() {
    }

    /**
     * Check whether a change should be delivered on a channel.
     *
     * @param selector the channel's event selector
     * @param filter the channel's filter, or null
     * @param event the change
     * @return true if the change is selected
     */
    public static boolean accepts(@Nonnull SubscribedEvent selector,
                                  @Nullable RowFilter filter,
                                  @Nonnull ChangeEvent<JsonObject> event) {
        if (!selector.matches(event.eventType())) {
            return false;
        }
        if (filter == null) {
            return true;
        }
        JsonObject row = event.eventType() == ChangeEventType.DELETE ? event.oldRow() : event.newRow();
        return row != null && matches(filter, row);
    }

    /**
     * Evaluate a filter against a row.
     *
     * @param filter the filter
     * @param row the row
     * @return true if the row satisfies the filter
     */
    public static boolean matches(@Nonnull RowFilter filter, @Nonnull JsonObject row) {
        JsonElement element = row.get(filter.column());
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return false;
        }
        String actual = element.getAsString();

        return switch (filter.operator()) {
            case EQ -> compare(actual, filter.value()) == 0;
            case NEQ -> compare(actual, filter.value()) != 0;
            case LT -> compare(actual, filter.value()) < 0;
            case LTE -> compare(actual, filter.value()) <= 0;
            case GT -> compare(actual, filter.value()) > 0;
            case GTE -> compare(actual, filter.value()) >= 0;
            case IN -> filter.values().stream().anyMatch(candidate -> compare(actual, candidate) == 0);
        };
    }

    private static int compare(String actual, String expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        return actual.compareTo(expected);
    }

    @Nullable
    private static BigDecimal toNumber(String value) {
        return NUMBER.matcher(value).matches() ? new BigDecimal(value) : null;
    }
}
