package io.github.cyfko.restql.spring.autoconfigure;

import io.github.cyfko.restql.core.config.EnumMatchMode;
import io.github.cyfko.restql.core.config.RefinementPolicy;
import io.github.cyfko.restql.core.dispatch.ApiAction;
import io.github.cyfko.restql.core.dispatch.ResourceActionDispatcher;
import io.github.cyfko.restql.core.dispatch.ResourceConfig;
import io.github.cyfko.restql.core.registry.NameKind;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.QueryExecutor;
import io.github.cyfko.restql.core.spi.RemoteResult;
import io.github.cyfko.restql.jpa.JpaQueryExecutor;
import io.github.cyfko.restql.jpa.JpaRecordStore;
import io.github.cyfko.restql.spring.web.ResourceRouteRegistrar;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.metamodel.Metamodel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RestQlAutoConfiguration")
class RestQlAutoConfigurationTest {

    static class Post {
    }

    static class Comment {
    }

    private final WebApplicationContextRunner contextRunner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RestQlAutoConfiguration.class))
            .withBean("requestMappingHandlerMapping", RequestMappingHandlerMapping.class, RequestMappingHandlerMapping::new)
            .withBean(EntityManagerFactory.class, RestQlAutoConfigurationTest::entityManagerFactory)
            .withBean("postsResource", ResourceConfig.class, () -> ResourceConfig.builder("posts", Post.class)
                    .handles(ApiAction.INDEX, ApiAction.SHOW, ApiAction.CREATE, ApiAction.ASSOCIATED, ApiAction.REMOTED)
                    .fields("title", "status")
                    .writable("title")
                    .hasMany("comments", "comments", "post")
                    .remote("commenters", "comments", (parent, request) -> RemoteResult.records(List.of()))
                    .build())
            .withBean("commentsResource", ResourceConfig.class, () -> ResourceConfig.builder("comments", Comment.class)
                    .handlesAll()
                    .fields("body")
                    .build());

    private static EntityManagerFactory entityManagerFactory() {
        EntityManagerFactory emf = mock(EntityManagerFactory.class);
        Metamodel metamodel = mock(Metamodel.class);
        when(emf.getMetamodel()).thenReturn(metamodel);
        return emf;
    }

    @Nested
    @DisplayName("Beans")
    class Beans {

        @Test
        @DisplayName("Wires the JPA collaborators and the dispatcher")
        void wiresDefaults() {
            contextRunner.run(context -> {
                assertNotNull(context.getBean(ResourceActionDispatcher.class));
                assertInstanceOf(JpaQueryExecutor.class, context.getBean(QueryExecutor.class));
                assertNotNull(context.getBean(JpaRecordStore.class));
                assertNotNull(context.getBean(ResourceRouteRegistrar.class));
                assertEquals(2, context.getBean(ResourceActionDispatcher.class).resources().size());
            });
        }

        @Test
        @DisplayName("Registers the whitelist of every declared resource")
        void registersWhitelist() {
            contextRunner.run(context -> {
                WhitelistRegistry registry = context.getBean(WhitelistRegistry.class);
                assertEquals(NameKind.FIELD, registry.isAllowed("posts", "title"));
                assertEquals(NameKind.ASSOCIATION, registry.isAllowed("posts", "comments"));
                assertEquals(NameKind.REMOTE, registry.isAllowed("posts", "commenters"));
                assertEquals(NameKind.NONE, registry.isAllowed("posts", "passwordDigest"));
            });
        }

        @Test
        @DisplayName("Binds the restql properties into the refinement policy")
        void bindsProperties() {
            contextRunner
                    .withPropertyValues("restql.max-limit=50", "restql.default-per-page=10",
                            "restql.max-depth=2", "restql.enum-match-mode=CASE_SENSITIVE")
                    .run(context -> {
                        RefinementPolicy policy = context.getBean(RefinementPolicy.class);
                        assertEquals(50, policy.getMaxLimit());
                        assertEquals(10, policy.getDefaultPerPage());
                        assertEquals(2, policy.getMaxDepth());
                        assertEquals(EnumMatchMode.CASE_SENSITIVE, policy.getEnumMatchMode());
                    });
        }

        @Test
        @DisplayName("Fails to start on an inconsistent policy")
        void rejectsInconsistentPolicy() {
            contextRunner
                    .withPropertyValues("restql.max-limit=5", "restql.default-per-page=10")
                    .run(context -> assertNotNull(context.getStartupFailure()));
        }

        @Test
        @DisplayName("Backs off when the application declares its own executor")
        void backsOffForCustomExecutor() {
            QueryExecutor custom = plan -> List.of();
            contextRunner
                    .withBean("customExecutor", QueryExecutor.class, () -> custom)
                    .run(context -> assertSame(custom, context.getBean(QueryExecutor.class)));
        }

        @Test
        @DisplayName("Stays off outside a servlet web application")
        void requiresServletApplication() {
            new ApplicationContextRunner()
                    .withConfiguration(AutoConfigurations.of(RestQlAutoConfiguration.class))
                    .withBean(EntityManagerFactory.class, RestQlAutoConfigurationTest::entityManagerFactory)
                    .run(context -> assertTrue(context.getBeansOfType(ResourceActionDispatcher.class).isEmpty()));
        }
    }

    @Nested
    @DisplayName("Routes")
    class Routes {

        @Test
        @DisplayName("Maps only the enabled actions")
        void mapsEnabledActions() {
            contextRunner.run(context -> {
                Set<String> routes = routes(context.getBean(RequestMappingHandlerMapping.class));

                assertTrue(routes.contains("GET /posts"));
                assertTrue(routes.contains("POST /posts"));
                assertTrue(routes.contains("GET /posts/{key}"));
                assertTrue(routes.contains("GET /posts/{key}/{association:comments}"));
                assertTrue(routes.contains("GET /posts/{key}/{remote:commenters}"));
                assertFalse(routes.contains("DELETE /posts/{key}"));
                assertFalse(routes.contains("PUT /posts/{key}"));

                assertTrue(routes.contains("DELETE /comments/{key}"));
                assertTrue(routes.contains("PATCH /comments/{key}"));
            });
        }

        @Test
        @DisplayName("Prefixes every route with the base path")
        void prefixesBasePath() {
            contextRunner
                    .withPropertyValues("restql.base-path=api/")
                    .run(context -> {
                        Set<String> routes = routes(context.getBean(RequestMappingHandlerMapping.class));
                        assertTrue(routes.contains("GET /api/posts"));
                        assertTrue(routes.contains("GET /api/comments/{key}"));
                        assertFalse(routes.contains("GET /posts"));
                    });
        }
    }

    private static Set<String> routes(RequestMappingHandlerMapping mapping) {
        return mapping.getHandlerMethods().keySet().stream()
                .flatMap(RestQlAutoConfigurationTest::describe)
                .collect(Collectors.toSet());
    }

    private static java.util.stream.Stream<String> describe(RequestMappingInfo info) {
        Set<RequestMethod> methods = info.getMethodsCondition().getMethods();
        return info.getPatternValues().stream()
                .flatMap(pattern -> methods.stream().map(method -> method + " " + pattern));
    }
}
