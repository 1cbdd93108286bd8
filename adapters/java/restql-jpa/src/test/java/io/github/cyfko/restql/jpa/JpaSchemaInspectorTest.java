package io.github.cyfko.restql.jpa;

import io.github.cyfko.restql.jpa.entities.Post;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JPA Schema Inspector Test")
class JpaSchemaInspectorTest {

    private static EntityManagerFactory emf;
    private static JpaSchemaInspector schema;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        schema = new JpaSchemaInspector(emf, BlogModel.entityTypes());
    }

    @AfterAll
    static void teardown() {
        if (emf != null) {
            emf.close();
        }
    }

    @Test
    @DisplayName("Should report mapped attributes only")
    void shouldReportMappedAttributes() {
        assertTrue(schema.hasAttribute("posts", "title"));
        assertTrue(schema.hasAttribute("posts", "author"));
        assertTrue(schema.hasAttribute("posts", "comments"));
        assertFalse(schema.hasAttribute("posts", "legacyScore"));
        assertFalse(schema.hasAttribute("unknown", "title"));
    }

    @Test
    @DisplayName("Should name the identifier attribute")
    void shouldNameIdentifier() {
        assertEquals("id", schema.identifierOf("posts"));
        assertThrows(IllegalArgumentException.class, () -> schema.identifierOf("unknown"));
    }

    @Test
    @DisplayName("Should tell associations from scalar attributes")
    void shouldDetectAssociations() {
        assertTrue(schema.isAssociation("posts", "author"));
        assertTrue(schema.isAssociation("posts", "comments"));
        assertFalse(schema.isAssociation("posts", "title"));
        assertEquals(Post.class, schema.entityClassOf("posts"));
    }

    @Test
    @DisplayName("Should refuse classes that are not entities")
    void shouldRefuseNonEntities() {
        assertThrows(IllegalArgumentException.class,
                () -> new JpaSchemaInspector(emf, Map.of("strings", String.class)));
    }
}
