package io.github.cyfko.restql.core.registry;

import io.github.cyfko.restql.core.spi.RemoteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WhitelistRegistry Tests")
class WhitelistRegistryTest {

    private WhitelistRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new WhitelistRegistry();
    }

    @Test
    @DisplayName("Should classify declared names by kind")
    void shouldClassifyDeclaredNames() {
        // Given
        registry.register("posts",
                Set.of("title"),
                List.of(AssociationDefinition.hasMany("comments", "comments", "post")),
                List.of(new RemoteDefinition("related", "posts", (p, r) -> RemoteResult.records(List.of()))));

        // Then
        assertEquals(NameKind.FIELD, registry.isAllowed("posts", "title"));
        assertEquals(NameKind.ASSOCIATION, registry.isAllowed("posts", "comments"));
        assertEquals(NameKind.REMOTE, registry.isAllowed("posts", "related"));
        assertEquals(NameKind.NONE, registry.isAllowed("posts", "secret"));
        assertEquals(NameKind.NONE, registry.isAllowed("posts", null));
    }

    @Test
    @DisplayName("Undeclared type answers NONE for every name")
    void undeclaredTypeFailsClosed() {
        registry.register("posts", Set.of("title"), List.of(), List.of());

        assertEquals(NameKind.NONE, registry.isAllowed("users", "title"));
        assertTrue(registry.definitionOf("users").isEmpty());
    }

    @Test
    @DisplayName("Re-registering a type merges declarations")
    void reRegistrationMerges() {
        // Given
        registry.register("posts", Set.of("title"),
                List.of(AssociationDefinition.belongsTo("author", "authors")), List.of());

        // When
        registry.register("posts", Set.of("body"),
                List.of(AssociationDefinition.hasOne("author", "people", "post")), List.of());

        // Then
        assertEquals(NameKind.FIELD, registry.isAllowed("posts", "title"));
        assertEquals(NameKind.FIELD, registry.isAllowed("posts", "body"));
        AssociationDefinition author = registry.association("posts", "author").orElseThrow();
        assertEquals("people", author.targetType(), "later declaration wins");
        assertEquals("post", author.ownershipKey());
    }

    @Test
    @DisplayName("Registering the same declaration twice is idempotent")
    void registrationIsIdempotent() {
        registry.register("posts", Set.of("title"), List.of(), List.of());
        registry.register("posts", Set.of("title"), List.of(), List.of());

        assertEquals(Set.of("title"), registry.definitionOf("posts").orElseThrow().fields());
        assertEquals(Set.of("posts"), registry.registeredTypes());
    }

    @Test
    @DisplayName("Field wins over an association of the same name")
    void fieldWinsOnConflict() {
        registry.register("posts", Set.of("author"),
                List.of(AssociationDefinition.belongsTo("author", "authors")), List.of());

        assertEquals(NameKind.FIELD, registry.isAllowed("posts", "author"));
        assertTrue(registry.association("posts", "author").isEmpty());
    }

    @Test
    @DisplayName("Plural association requires an ownership key")
    void pluralAssociationRequiresOwnershipKey() {
        assertThrows(IllegalArgumentException.class,
                () -> new AssociationDefinition("comments", Cardinality.MANY, "comments", null));
        assertThrows(IllegalArgumentException.class,
                () -> AssociationDefinition.hasMany("comments.all", "comments", "post"));
    }
}
