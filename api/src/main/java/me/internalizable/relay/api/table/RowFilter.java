package me.internalizable.relay.api.table;

import me.internalizable.relay.api.feed.InvalidSubscriptionException;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-column filter applied to change events, in the form
 * {@code column=operator.value}.
 *
 * <h2>Examples</h2>
 * <pre>{@code
 * RowFilter.parse("user_id=eq.42");
 * RowFilter.parse("party_size=gte.4");
 * RowFilter.parse("status=in.(pending,confirmed)");
 * RowFilter.eq("restaurant_id", restaurantId);
 * }</pre>
 *
 * <p>Two filters are equal exactly when their {@link #expression()} is equal, which
 * is what makes them usable as part of a channel identity.</p>
 *
 * @param column the row column the filter applies to
 * @param operator the comparison operator
 * @param value the operand, a parenthesized list for {@link FilterOperator#IN}
 */
public record RowFilter(
        @Nonnull String column,
        @Nonnull FilterOperator operator,
        @Nonnull String value
) {

    private static final Pattern EXPRESSION = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=([a-z]+)\\.(.+)$");
    private static final Pattern COLUMN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public RowFilter {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (!COLUMN.matcher(column).matches()) {
            throw new InvalidSubscriptionException("Invalid filter column: '" + column + "'");
        }
        if (value.isEmpty()) {
            throw new InvalidSubscriptionException("Filter value must not be empty for column " + column);
        }
        if (operator == FilterOperator.IN && parseList(value).isEmpty()) {
            throw new InvalidSubscriptionException(
                    "Filter 'in' expects a non-empty list like (a,b), got: " + value);
        }
    }

    /**
     * Parse a filter expression.
     *
     * @param expression the expression, e.g. {@code user_id=eq.42}
     * @return the parsed filter
     * @throws InvalidSubscriptionException if the expression is malformed
     */
    @Nonnull
    public static RowFilter parse(@Nonnull String expression) {
        Objects.requireNonNull(expression, "expression");
        Matcher matcher = EXPRESSION.matcher(expression.trim());
        if (!matcher.matches()) {
            throw new InvalidSubscriptionException("Malformed filter expression: '" + expression + "'");
        }

        FilterOperator operator = FilterOperator.fromToken(matcher.group(2))
                .orElseThrow(() -> new InvalidSubscriptionException(
                        "Unknown filter operator '" + matcher.group(2) + "' in: " + expression));

        return new RowFilter(matcher.group(1), operator, matcher.group(3));
    }

    /**
     * Create an equality filter.
     *
     * @param column the column name
     * @param value the value to match
     * @return the filter {@code column=eq.value}
     */
    @Nonnull
    public static RowFilter eq(@Nonnull String column, @Nonnull Object value) {
        Objects.requireNonNull(value, "value");
        return new RowFilter(column, FilterOperator.EQ, String.valueOf(value));
    }

    /**
     * Get the canonical textual form of this filter.
     *
     * @return the expression, e.g. {@code user_id=eq.42}
     */
    @Nonnull
    public String expression() {
        return column + "=" + operator.token() + "." + value;
    }

    /**
     * Get the operands of this filter.
     *
     * @return the list members for {@link FilterOperator#IN}, otherwise the single value
     */
    @Nonnull
    public List<String> values() {
        if (operator == FilterOperator.IN) {
            return parseList(value);
        }
        return List.of(value);
    }

    private static List<String> parseList(String raw) {
        if (raw.length() < 3 || raw.charAt(0) != '(' || raw.charAt(raw.length() - 1) != ')') {
            return List.of();
        }
        List<String> members = new ArrayList<>();
        for (String member : raw.substring(1, raw.length() - 1).split(",")) {
            String trimmed = member.trim();
            if (trimmed.isEmpty()) {
                return List.of();
            }
            members.add(trimmed);
        }
        return List.copyOf(members);
    }

    @Override
    public String toString() {
        return expression();
    }
}
