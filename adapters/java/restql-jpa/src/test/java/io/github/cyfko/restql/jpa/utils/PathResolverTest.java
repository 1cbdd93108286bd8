package io.github.cyfko.restql.jpa.utils;

import io.github.cyfko.restql.jpa.entities.Author;
import io.github.cyfko.restql.jpa.entities.Post;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathResolver Test")
class PathResolverTest {

    private static EntityManagerFactory emf;
    private EntityManager em;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
    }

    @AfterAll
    static void teardown() {
        if (emf != null) {
            emf.close();
        }
    }

    @BeforeEach
    void open() {
        em = emf.createEntityManager();
    }

    @AfterEach
    void close() {
        em.close();
    }

    @Test
    @DisplayName("Should join each attribute once")
    void shouldReuseJoins() {
        CriteriaQuery<Tuple> query = em.getCriteriaBuilder().createTupleQuery();
        Root<Post> root = query.from(Post.class);
        PathResolver paths = new PathResolver(root);

        paths.resolve("author.name");
        paths.resolve("author.id");
        paths.resolve("title");

        assertEquals(1, root.getJoins().size());
        assertFalse(paths.hasCollectionJoin());
    }

    @Test
    @DisplayName("Should flag paths going through a collection")
    void shouldFlagCollectionJoins() {
        CriteriaQuery<Tuple> query = em.getCriteriaBuilder().createTupleQuery();
        Root<Author> root = query.from(Author.class);
        PathResolver paths = new PathResolver(root);

        assertEquals(Long.class, paths.resolve("comments.post.id").getJavaType());
        assertTrue(paths.hasCollectionJoin());
    }

    @Test
    @DisplayName("Should reject blank paths and unknown segments")
    void shouldRejectInvalidPaths() {
        CriteriaQuery<Tuple> query = em.getCriteriaBuilder().createTupleQuery();
        PathResolver paths = new PathResolver(query.from(Post.class));

        assertThrows(IllegalArgumentException.class, () -> paths.resolve(" "));
        assertThrows(IllegalArgumentException.class, () -> paths.resolve("publisher.name"));
    }
}
