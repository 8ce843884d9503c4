package me.internalizable.relay.api.table;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Comparison operators accepted in a {@link RowFilter}.
 */
public enum FilterOperator {

    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),

    /**
     * Membership in a parenthesized list, e.g. {@code status=in.(pending,confirmed)}.
     */
    IN("in");

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    @Nonnull
    public String token() {
        return token;
    }

    @Nonnull
    public static Optional<FilterOperator> fromToken(@Nonnull String token) {
        for (FilterOperator operator : values()) {
            if (operator.token.equals(token)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
