package io.github.cyfko.restql.core.dispatch;

import io.github.cyfko.restql.core.BlogFixtures;
import io.github.cyfko.restql.core.exception.RecordValidationException;
import io.github.cyfko.restql.core.exception.ResourceNotFoundException;
import io.github.cyfko.restql.core.exception.StatementRejectedException;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.OwnershipAnchor;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.refine.QueryRefiner;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.QueryExecutor;
import io.github.cyfko.restql.core.spi.RecordStore;
import io.github.cyfko.restql.core.spi.RemoteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.cyfko.restql.core.BlogFixtures.params;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ResourceActionDispatcher Tests")
class ResourceActionDispatcherTest {

    static class Post {}
    static class Comment {}
    static class Author {}

    private QueryExecutor executor;
    private RecordStore store;
    private ResourceActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = mock(QueryExecutor.class);
        store = mock(RecordStore.class);

        ResourceConfig posts = ResourceConfig.builder("posts", Post.class)
                .handles(ApiAction.INDEX, ApiAction.SHOW, ApiAction.CREATE, ApiAction.UPDATE,
                        ApiAction.ASSOCIATED, ApiAction.REMOTED)
                .fields("title", "body", "createdAt", "published", "legacyScore")
                .belongsTo("author", "authors")
                .hasMany("comments", "comments", "post")
                .remote("commenters", "authors",
                        (post, request) -> RemoteResult.scope(BaseScope.all("authors").where("comments.post.id", post.get("id"))))
                .build();
        ResourceConfig comments = ResourceConfig.builder("comments", Comment.class)
                .fields("body", "approved", "createdAt")
                .belongsTo("post", "posts")
                .build();
        ResourceConfig authors = ResourceConfig.builder("authors", Author.class)
                .handles("index", "create", "destroy", "publish")
                .primaryKey("email")
                .fields("name", "email")
                .build();

        WhitelistRegistry registry = new WhitelistRegistry();
        QueryRefiner refiner = new QueryRefiner(registry, BlogFixtures.schema(), BlogFixtures.policy());
        dispatcher = new ResourceActionDispatcher(List.of(posts, comments, authors), registry, refiner,
                executor, store, BlogFixtures.schema());
    }

    private QueryPlan lastPlan() {
        ArgumentCaptor<QueryPlan> captor = ArgumentCaptor.forClass(QueryPlan.class);
        verify(executor, atLeastOnce()).execute(captor.capture());
        return captor.getValue();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("index nests rows under the resource type")
        void indexNestsRowsUnderType() {
            // Given
            List<Map<String, Object>> rows = List.of(row("id", 1L, "title", "Hello"));
            when(executor.execute(any())).thenReturn(rows);

            // When
            ActionResponse response = dispatcher.index("posts", params("title", "Hello", "junk", "1"));

            // Then
            assertEquals(200, response.status());
            assertEquals(Map.of("posts", rows), response.body());
            assertEquals(List.of(FilterPredicate.eq("title", "Hello")), lastPlan().predicates());
        }

        @Test
        @DisplayName("show locates the record by identifier and nests it under the record name")
        void showUsesIdentifier() {
            when(executor.execute(any())).thenReturn(List.of(row("id", 7L, "title", "T")));

            ActionResponse response = dispatcher.show("posts", "7", params("include", "comments"));

            assertEquals(200, response.status());
            assertEquals(Map.of("post", row("id", 7L, "title", "T")), response.body());
            QueryPlan plan = lastPlan();
            assertEquals(List.of(FilterPredicate.eq("id", "7")), plan.predicates());
            assertEquals(new Pagination(1, 0), plan.pagination());
            assertEquals("comments", plan.eagerLoads().get(0).name());
        }

        @Test
        @DisplayName("show answers 404 when nothing matches")
        void showNotFound() {
            when(executor.execute(any())).thenReturn(List.of());

            ActionResponse response = dispatcher.show("posts", "404", Map.of());

            assertEquals(404, response.status());
            assertTrue(((Map<?, ?>) response.body()).containsKey("errors"));
        }

        @Test
        @DisplayName("Malformed directive answers 400 without querying")
        void malformedDirectiveIs400() {
            ActionResponse response = dispatcher.index("posts", params("limit", "lots"));

            assertEquals(400, response.status());
            assertTrue(((Map<?, ?>) response.body()).get("errors").toString().contains("limit"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Schema mismatch answers 400")
        void schemaMismatchIs400() {
            ActionResponse response = dispatcher.index("posts", params("legacyScore", "1"));

            assertEquals(400, response.status());
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Unexpected failure answers 500 with a generic message")
        void unexpectedFailureIs500() {
            when(executor.execute(any())).thenThrow(new IllegalStateException("connection refused to db-7"));

            ActionResponse response = dispatcher.index("posts", Map.of());

            assertEquals(500, response.status());
            assertEquals(Map.of("errors", "Internal server error"), response.body());
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("create keeps writable attributes and answers 201 with the new key")
        void createKeepsWritableAttributes() {
            // Given
            when(store.create(eq("posts"), eq("id"), anyMap())).thenReturn(10L);
            when(executor.execute(any())).thenReturn(List.of(row("id", 10L, "title", "T", "authorId", 3L)));
            Map<String, Object> body = Map.of("post", Map.of("title", "T", "secret", "x", "authorId", 3L));

            // When
            ActionResponse response = dispatcher.create("posts", body);

            // Then
            verify(store).create("posts", "id", Map.of("title", "T", "author", 3L));
            assertEquals(201, response.status());
            assertEquals("10", response.locationKey());
            assertEquals(Map.of("post", row("id", 10L, "title", "T", "authorId", 3L)), response.body());
            assertEquals(List.of(FilterPredicate.eq("id", 10L)), lastPlan().predicates());
        }

        @Test
        @DisplayName("create accepts a bare body")
        void createAcceptsBareBody() {
            when(store.create(eq("posts"), eq("id"), anyMap())).thenReturn(11L);
            when(executor.execute(any())).thenReturn(List.of(row("id", 11L)));

            dispatcher.create("posts", Map.of("title", "Bare"));

            verify(store).create("posts", "id", Map.of("title", "Bare"));
        }

        @Test
        @DisplayName("Validation failure answers 422 with field errors")
        void validationFailureIs422() {
            when(store.create(eq("posts"), eq("id"), anyMap()))
                    .thenThrow(RecordValidationException.of("title", "must not be blank"));

            ActionResponse response = dispatcher.create("posts", Map.of("post", Map.of("title", "")));

            assertEquals(422, response.status());
            assertEquals(Map.of("errors", Map.of("title", List.of("must not be blank"))), response.body());
        }

        @Test
        @DisplayName("create reads back and locates the record by the configured primary key")
        void createUsesConfiguredKey() {
            // Given
            when(store.create(eq("authors"), eq("email"), anyMap())).thenReturn("ada@example.com");
            when(executor.execute(any())).thenReturn(List.of(row("id", 4L, "name", "Ada", "email", "ada@example.com")));

            // When
            ActionResponse response = dispatcher.create("authors", Map.of("author", Map.of("name", "Ada", "email", "ada@example.com")));

            // Then
            assertEquals(201, response.status());
            assertEquals("ada@example.com", response.locationKey());
            assertEquals(List.of(FilterPredicate.eq("email", "ada@example.com")), lastPlan().predicates());
        }

        @Test
        @DisplayName("Statement refused by the storage answers 400 without its details")
        void rejectedStatementIs400() {
            // Given
            StatementRejectedException rejected = new StatementRejectedException("delete", "authors",
                    new IllegalStateException("Referential integrity constraint violation: FK_POSTS_AUTHOR"));
            doThrow(rejected).when(store).delete("authors", "email", "ada@example.com");

            // When
            ActionResponse response = dispatcher.destroy("authors", "ada@example.com");

            // Then
            assertEquals(400, response.status());
            assertEquals(Map.of("errors", rejected.getMessage()), response.body());
            assertFalse(rejected.getMessage().contains("FK_POSTS_AUTHOR"));
        }

        @Test
        @DisplayName("Missing body answers 400")
        void missingBodyIs400() {
            assertEquals(400, dispatcher.create("posts", null).status());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("update answers 204")
        void updateAnswers204() {
            ActionResponse response = dispatcher.update("posts", "7", Map.of("post", Map.of("title", "New")));

            assertEquals(204, response.status());
            assertNull(response.body());
            verify(store).update("posts", "id", "7", Map.of("title", "New"));
        }

        @Test
        @DisplayName("destroy uses the configured primary key")
        void destroyUsesConfiguredKey() {
            doThrow(new ResourceNotFoundException("authors", "email", "x@y.z"))
                    .when(store).delete("authors", "email", "x@y.z");

            assertEquals(404, dispatcher.destroy("authors", "x@y.z").status());
            assertEquals(204, dispatcher.destroy("authors", "a@b.c").status());
        }
    }

    @Nested
    @DisplayName("Enabled actions")
    class EnabledActions {

        @Test
        @DisplayName("Action that was not enabled answers 404 without touching storage")
        void disabledActionIsNotFound() {
            assertEquals(404, dispatcher.destroy("posts", "1").status());
            assertEquals(404, dispatcher.index("comments", Map.of()).status());
            assertEquals(404, dispatcher.index("users", Map.of()).status());
            verifyNoInteractions(store, executor);
        }

        @Test
        @DisplayName("Unknown action names are ignored")
        void unknownActionNamesAreIgnored() {
            ResourceConfig authors = dispatcher.resources().stream()
                    .filter(c -> c.getType().equals("authors"))
                    .findFirst()
                    .orElseThrow();

            assertEquals(EnumSet.of(ApiAction.INDEX, ApiAction.CREATE, ApiAction.DESTROY), authors.getActions());
        }
    }

    @Nested
    @DisplayName("Associations")
    class Associations {

        @Test
        @DisplayName("associated anchors the collection to the parent found by key")
        void associatedAnchorsToParent() {
            // Given
            List<Map<String, Object>> comments = List.of(row("id", 3L, "body", "Nice"));
            when(executor.execute(any())).thenReturn(List.of(row("id", 1L)), comments);

            // When
            ActionResponse response = dispatcher.associated("posts", "1", "comments", params("post", "2", "approved", "true"));

            // Then
            assertEquals(200, response.status());
            assertEquals(Map.of("comments", comments), response.body());
            QueryPlan plan = lastPlan();
            assertEquals(new OwnershipAnchor("posts", 1L, "post"), plan.anchor());
            assertEquals(List.of(FilterPredicate.eq("approved", "true")), plan.predicates());
        }

        @Test
        @DisplayName("Singular association answers an object or null")
        void singularAssociationAnswersObjectOrNull() {
            Map<String, Object> withAuthor = row("id", 1L, "author", row("id", 3L, "name", "Alice"));
            Map<String, Object> withoutAuthor = new HashMap<>(Map.of("id", 2L));
            withoutAuthor.put("author", null);
            when(executor.execute(any())).thenReturn(List.of(withAuthor), List.of(withoutAuthor));

            ActionResponse first = dispatcher.associated("posts", "1", "author", Map.of());
            ActionResponse second = dispatcher.associated("posts", "2", "author", Map.of());

            assertEquals(Map.of("author", row("id", 3L, "name", "Alice")), first.body());
            assertEquals(Collections.singletonMap("author", null), second.body());
        }

        @Test
        @DisplayName("Undeclared association answers 404")
        void undeclaredAssociationIs404() {
            assertEquals(404, dispatcher.associated("posts", "1", "likes", Map.of()).status());
        }

        @Test
        @DisplayName("remoted refines the provider scope")
        void remotedRefinesProviderScope() {
            List<Map<String, Object>> authors = List.of(row("id", 9L, "name", "Bob"));
            when(executor.execute(any())).thenReturn(List.of(row("id", 5L)), authors);

            ActionResponse response = dispatcher.remoted("posts", "5", "commenters", params("name", "Bob"));

            assertEquals(Map.of("commenters", authors), response.body());
            assertEquals(List.of(FilterPredicate.eq("comments.post.id", 5L), FilterPredicate.eq("name", "Bob")),
                    lastPlan().predicates());
        }
    }
}
