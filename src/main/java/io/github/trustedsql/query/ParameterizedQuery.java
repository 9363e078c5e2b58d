package io.github.trustedsql.query;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.github.trustedsql.common.ValidatedString;
import io.github.trustedsql.common.ValidatedStringBuilder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finished SQL text together with the values bound to its {@code ?} placeholders.
 *
 * <p>{@link #prepare(Connection)} is where the trusted text leaves the type system: it is handed
 * to the driver as is, and every value goes through parameter binding.
 */
public record ParameterizedQuery(ValidatedString sql, List<Object> parameters) {

    private static final ValidatedString PLACEHOLDER = ValidatedString.wrap("?");

    public ParameterizedQuery {
        Objects.requireNonNull(sql, "sql");
        // null values bind as SQL NULL
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static ParameterizedQuery of(ValidatedString sql, Object... parameters) {
        return new ParameterizedQuery(sql, Arrays.asList(parameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int parameterCount() {
        return parameters.size();
    }

    /**
     * Prepares the query on {@code connection} and binds the parameters in order.
     * The caller owns the returned statement.
     */
    public PreparedStatement prepare(Connection connection) throws SQLException {
        var statement = connection.prepareStatement(sql.toString());
        try {
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
        } catch (SQLException e) {
            try {
                statement.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        return statement;
    }

    /**
     * Not thread-safe.
     */
    public static final class Builder {
        private final ValidatedStringBuilder sql = new ValidatedStringBuilder();
        private final List<Object> parameters = new ArrayList<>();

        private Builder() {
        }

        @CanIgnoreReturnValue
        public Builder append(ValidatedString fragment) {
            sql.append(fragment);
            return this;
        }

        /**
         * Appends a {@code ?} placeholder and records {@code value} as its parameter.
         */
        @CanIgnoreReturnValue
        public Builder bind(Object value) {
            sql.append(PLACEHOLDER);
            parameters.add(value);
            return this;
        }

        public ParameterizedQuery build() {
            return new ParameterizedQuery(sql.toValidatedString(), parameters);
        }
    }
}
