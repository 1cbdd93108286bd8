package io.github.cyfko.restql.core.parsing;

import io.github.cyfko.restql.core.exception.InvalidDirectiveException;
import io.github.cyfko.restql.core.model.SortBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderDirectiveParser Tests")
class OrderDirectiveParserTest {

    @Test
    @DisplayName("Should parse signed items in order")
    void shouldParseSignedItems() {
        List<SortBy> order = OrderDirectiveParser.parse("order", "name,-created_at");

        assertEquals(List.of(SortBy.asc("name"), SortBy.desc("created_at")), order);
    }

    @Test
    @DisplayName("Should parse direction tokens case-insensitively")
    void shouldParseDirectionTokens() {
        List<SortBy> order = OrderDirectiveParser.parse("order", "title DESC, id asc,+rank");

        assertEquals(List.of(SortBy.desc("title"), SortBy.asc("id"), SortBy.asc("rank")), order);
    }

    @Test
    @DisplayName("Blank directive yields no ordering")
    void blankDirectiveYieldsNoOrdering() {
        assertTrue(OrderDirectiveParser.parse("order", "  ").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"name,", ",name", "-name desc", "name sideways", "na-me", "1name", "name asc extra", "--name"})
    @DisplayName("Should reject unparsable ordering")
    void shouldRejectUnparsableOrdering(String value) {
        InvalidDirectiveException ex = assertThrows(InvalidDirectiveException.class,
                () -> OrderDirectiveParser.parse("comments.order", value));

        assertEquals("comments.order", ex.getKey());
        assertTrue(ex.getMessage().contains("comments.order"));
    }
}
