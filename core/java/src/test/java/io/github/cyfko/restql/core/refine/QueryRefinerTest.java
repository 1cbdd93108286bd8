package io.github.cyfko.restql.core.refine;

import io.github.cyfko.restql.core.BlogFixtures;
import io.github.cyfko.restql.core.exception.InvalidDirectiveException;
import io.github.cyfko.restql.core.exception.SchemaMismatchException;
import io.github.cyfko.restql.core.model.BaseScope;
import io.github.cyfko.restql.core.model.EagerLoad;
import io.github.cyfko.restql.core.model.FilterPredicate;
import io.github.cyfko.restql.core.model.FilterPredicate.Operator;
import io.github.cyfko.restql.core.model.OwnershipAnchor;
import io.github.cyfko.restql.core.model.Pagination;
import io.github.cyfko.restql.core.model.QueryPlan;
import io.github.cyfko.restql.core.model.RefinementRequest;
import io.github.cyfko.restql.core.model.SortBy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.cyfko.restql.core.BlogFixtures.params;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryRefiner Tests")
class QueryRefinerTest {

    private QueryRefiner refiner;

    @BeforeEach
    void setUp() {
        refiner = new QueryRefiner(BlogFixtures.registry(), BlogFixtures.schema(), BlogFixtures.policy());
    }

    private QueryPlan refine(String type, String... keyValues) {
        RefinementRequest request = refiner.classifier().classify(type, params(keyValues));
        return refiner.refine(BaseScope.all(type), request);
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Filters become conjunctive EQ and IN predicates")
        void filtersBecomePredicates() {
            QueryPlan plan = refine("posts", "title", "Hello", "published", "true", "published", "false");

            assertEquals(2, plan.predicates().size());
            assertTrue(plan.predicates().contains(new FilterPredicate("title", Operator.EQ, List.of("Hello"))));
            assertTrue(plan.predicates().contains(new FilterPredicate("published", Operator.IN, List.of("true", "false"))));
        }

        @Test
        @DisplayName("Non-whitelisted filters leave no predicate")
        void nonWhitelistedFiltersLeaveNoPredicate() {
            QueryPlan plan = refine("posts", "password", "x", "author.password", "y");

            assertTrue(plan.predicates().isEmpty());
        }

        @Test
        @DisplayName("Scope constraints and anchor are kept")
        void scopeConstraintsAreKept() {
            OwnershipAnchor anchor = new OwnershipAnchor("authors", 7L, "author");
            BaseScope scope = BaseScope.anchored("posts", anchor).where("published", true);

            QueryPlan plan = refiner.refine(scope, refiner.classifier().classify("posts", params("title", "A")));

            assertSame(anchor, plan.anchor());
            assertEquals(List.of(FilterPredicate.eq("published", true), FilterPredicate.eq("title", "A")),
                    plan.predicates());
        }

        @Test
        @DisplayName("Whitelisted name missing from storage is a schema mismatch")
        void missingAttributeIsSchemaMismatch() {
            SchemaMismatchException ex = assertThrows(SchemaMismatchException.class,
                    () -> refine("posts", "legacyScore", "3"));

            assertEquals("posts", ex.getResourceType());
            assertEquals("legacyScore", ex.getAttribute());
            assertThrows(SchemaMismatchException.class, () -> refine("posts", "order", "-legacyScore"));
        }

        @Test
        @DisplayName("Request classified for another type is rejected")
        void requestForAnotherTypeIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> refiner.refine(BaseScope.all("posts"), RefinementRequest.empty("comments")));
        }
    }

    @Nested
    @DisplayName("Singular associations")
    class SingularAssociations {

        @Test
        @DisplayName("Nested conditions are promoted as related-object predicates")
        void nestedConditionsArePromoted() {
            QueryPlan plan = refine("posts", "author.name", "Alice", "author.order", "name", "author.limit", "1");

            assertEquals(List.of(FilterPredicate.eq("author.name", "Alice")), plan.predicates());
            assertEquals(1, plan.eagerLoads().size());
            EagerLoad author = plan.eagerLoads().get(0);
            assertEquals("author", author.name());
            assertTrue(author.plan().predicates().isEmpty());
            assertTrue(author.plan().order().isEmpty());
            assertFalse(author.plan().pagination().hasLimit());
        }

        @Test
        @DisplayName("Promotion follows chains of singular associations")
        void promotionFollowsSingularChains() {
            QueryPlan plan = refine("comments", "post.author.email", "a@b.c");

            assertEquals(List.of(FilterPredicate.eq("post.author.email", "a@b.c")), plan.predicates());
        }

        @Test
        @DisplayName("Bare association filter targets the referenced identity")
        void bareAssociationFilter() {
            QueryPlan plan = refine("posts", "author", "3", "author", "4");

            assertEquals(List.of(new FilterPredicate("author.id", Operator.IN, List.of("3", "4"))), plan.predicates());
        }
    }

    @Nested
    @DisplayName("Plural associations")
    class PluralAssociations {

        @Test
        @DisplayName("Nested conditions stay inside the eager-loaded collection")
        void nestedConditionsStayNested() {
            QueryPlan plan = refine("posts", "comments.approved", "true", "comments.order", "-createdAt", "comments.limit", "2");

            assertTrue(plan.predicates().isEmpty());
            QueryPlan comments = plan.eagerLoads().get(0).plan();
            assertEquals("comments", comments.resourceType());
            assertNull(comments.anchor(), "eager loads are bound to the parent batch by the executor");
            assertEquals(List.of(FilterPredicate.eq("approved", "true")), comments.predicates());
            assertEquals(List.of(SortBy.desc("createdAt")), comments.order());
            assertEquals(new Pagination(2, 0), comments.pagination());
        }

        @Test
        @DisplayName("Conditions on the ownership key are discarded")
        void ownershipKeyConditionsAreDiscarded() {
            QueryPlan plan = refine("posts", "comments.post", "99", "comments.post.title", "x", "comments.body", "hi");

            QueryPlan comments = plan.eagerLoads().get(0).plan();
            assertEquals(List.of(FilterPredicate.eq("body", "hi")), comments.predicates());
            assertTrue(comments.predicates().stream().noneMatch(p -> p.head().equals("post")));
        }
    }

    @Nested
    @DisplayName("Ordering and window")
    class OrderingAndWindow {

        @Test
        @DisplayName("Ordering is kept as requested")
        void orderingIsKept() {
            QueryPlan plan = refine("posts", "order", "title,-createdAt");

            assertEquals(List.of(SortBy.asc("title"), SortBy.desc("createdAt")), plan.order());
        }

        @Test
        @DisplayName("Without ordering, plans sort by identifier")
        void defaultOrderIsIdentifier() {
            assertEquals(List.of(SortBy.asc("id")), refine("posts").order());
        }

        @Test
        @DisplayName("page/per_page wins over limit/offset")
        void pageWins() {
            QueryPlan plan = refine("posts", "page", "2", "per_page", "10", "limit", "5", "offset", "0");

            assertEquals(new Pagination(10, 10), plan.pagination());
        }

        @Test
        @DisplayName("page alone uses the default page size")
        void pageAloneUsesDefaultSize() {
            assertEquals(new Pagination(20, 40), refine("posts", "page", "3").pagination());
        }

        @Test
        @DisplayName("Limits are clamped and default to the maximum")
        void limitsAreClamped() {
            assertEquals(new Pagination(100, 5), refine("posts", "limit", "500", "offset", "5").pagination());
            assertEquals(new Pagination(100, 100), refine("posts", "page", "2", "per_page", "1000").pagination());
            assertEquals(new Pagination(100, 0), refine("posts").pagination());
            assertEquals(new Pagination(100, 30), refine("posts", "offset", "30").pagination());
        }

        @Test
        @DisplayName("Unaddressable page is rejected")
        void unaddressablePageIsRejected() {
            assertThrows(InvalidDirectiveException.class,
                    () -> refine("posts", "page", String.valueOf(Integer.MAX_VALUE), "per_page", "100"));
        }
    }
}
