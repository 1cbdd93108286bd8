package io.github.cyfko.restql.core.parsing;

import io.github.cyfko.restql.core.exception.InvalidDirectiveException;
import io.github.cyfko.restql.core.model.SortBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parser for the {@code order} directive.
 *
 * <p><strong>Grammar:</strong></p>
 * <pre>
 * order     := item ( ',' item )*
 * item      := [ '+' | '-' ] field
 *            | field [ 'asc' | 'desc' ]
 * field     := [A-Za-z_][A-Za-z0-9_]*
 * </pre>
 *
 * <p>
 * Directions are case-insensitive and default to ascending. A sign and a direction token cannot
 * be combined. A blank directive yields no ordering.
 * </p>
 *
 * <pre>{@code
 * OrderDirectiveParser.parse("order", "name,-createdAt");
 * // → [SortBy(name, asc), SortBy(createdAt, desc)]
 *
 * OrderDirectiveParser.parse("order", "title DESC, id");
 * // → [SortBy(title, desc), SortBy(id, asc)]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OrderDirectiveParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private OrderDirectiveParser() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Parses an ordering directive. Whitelisting is left to the caller.
     *
     * @param key   directive key, used in error messages
     * @param value raw directive value
     * @return sort items in directive order
     * @throws InvalidDirectiveException if an item does not follow the grammar
     */
    public static List<SortBy> parse(String key, String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }

        List<SortBy> items = new ArrayList<>();
        for (String rawItem : value.split(",", -1)) {
            items.add(parseItem(key, value, rawItem.trim()));
        }
        return items;
    }

    private static SortBy parseItem(String key, String value, String item) {
        if (item.isEmpty()) {
            throw new InvalidDirectiveException(key, value, "empty ordering item");
        }

        char first = item.charAt(0);
        if (first == '+' || first == '-') {
            String field = item.substring(1);
            requireIdentifier(key, value, field);
            return first == '-' ? SortBy.desc(field) : SortBy.asc(field);
        }

        String[] tokens = WHITESPACE.split(item);
        requireIdentifier(key, value, tokens[0]);
        if (tokens.length == 1) {
            return SortBy.asc(tokens[0]);
        }
        if (tokens.length == 2) {
            String direction = tokens[1].toLowerCase(Locale.ROOT);
            if (direction.equals("asc") || direction.equals("desc")) {
                return new SortBy(tokens[0], direction);
            }
            throw new InvalidDirectiveException(key, value, "unknown direction '" + tokens[1] + "'");
        }
        throw new InvalidDirectiveException(key, value, "unexpected ordering item '" + item + "'");
    }

    private static void requireIdentifier(String key, String value, String field) {
        if (!IDENTIFIER.matcher(field).matches()) {
            throw new InvalidDirectiveException(key, value, "invalid field name '" + field + "'");
        }
    }
}
