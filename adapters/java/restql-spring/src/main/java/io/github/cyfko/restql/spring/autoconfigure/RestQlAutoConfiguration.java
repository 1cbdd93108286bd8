package io.github.cyfko.restql.spring.autoconfigure;

import io.github.cyfko.restql.core.config.RefinementPolicy;
import io.github.cyfko.restql.core.dispatch.ResourceActionDispatcher;
import io.github.cyfko.restql.core.dispatch.ResourceConfig;
import io.github.cyfko.restql.core.refine.QueryRefiner;
import io.github.cyfko.restql.core.registry.WhitelistRegistry;
import io.github.cyfko.restql.core.spi.QueryExecutor;
import io.github.cyfko.restql.core.spi.RecordStore;
import io.github.cyfko.restql.jpa.JpaQueryExecutor;
import io.github.cyfko.restql.jpa.JpaRecordStore;
import io.github.cyfko.restql.jpa.JpaSchemaInspector;
import io.github.cyfko.restql.spring.web.ResourceRouteRegistrar;
import io.github.cyfko.restql.spring.web.RestQlExceptionHandler;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wires RestQL on top of the application's JPA persistence unit.
 * <p>
 * Every {@link ResourceConfig} bean declares one resource. The configuration builds the
 * whitelist registry, the refiner, the JPA storage collaborators and the dispatcher, then maps
 * the enabled actions of each resource on the Spring MVC handler mapping. Any of the core
 * beans can be replaced by declaring a bean of the same type.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration",
        "org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration"
})
@ConditionalOnClass({ResourceActionDispatcher.class, JpaQueryExecutor.class, EntityManagerFactory.class,
        RequestMappingHandlerMapping.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(RestQlProperties.class)
public class RestQlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RefinementPolicy restQlRefinementPolicy(RestQlProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public WhitelistRegistry whitelistRegistry() {
        return new WhitelistRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public JpaSchemaInspector restQlSchemaInspector(EntityManagerFactory emf, ObjectProvider<ResourceConfig> resources) {
        Map<String, Class<?>> entityTypes = new LinkedHashMap<>();
        resources.orderedStream().forEach(config -> entityTypes.put(config.getType(), config.getModelClass()));
        return new JpaSchemaInspector(emf, entityTypes);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryRefiner queryRefiner(WhitelistRegistry registry, JpaSchemaInspector schema, RefinementPolicy policy) {
        return new QueryRefiner(registry, schema, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryExecutor restQlQueryExecutor(EntityManagerFactory emf,
                                             JpaSchemaInspector schema,
                                             WhitelistRegistry registry,
                                             RefinementPolicy policy) {
        return new JpaQueryExecutor(emf, schema, registry, policy.getEnumMatchMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordStore restQlRecordStore(EntityManagerFactory emf, JpaSchemaInspector schema, RefinementPolicy policy) {
        return new JpaRecordStore(emf, schema, policy.getEnumMatchMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceActionDispatcher resourceActionDispatcher(ObjectProvider<ResourceConfig> resources,
                                                             WhitelistRegistry registry,
                                                             QueryRefiner refiner,
                                                             QueryExecutor executor,
                                                             RecordStore store,
                                                             JpaSchemaInspector schema) {
        List<ResourceConfig> configs = resources.orderedStream().collect(Collectors.toList());
        return new ResourceActionDispatcher(configs, registry, refiner, executor, store, schema);
    }

    @Bean
    public ResourceRouteRegistrar resourceRouteRegistrar(
            ResourceActionDispatcher dispatcher,
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            RestQlProperties properties) {
        return new ResourceRouteRegistrar(dispatcher, handlerMapping, properties.getBasePath());
    }

    @Bean
    public RestQlExceptionHandler restQlExceptionHandler() {
        return new RestQlExceptionHandler();
    }
}
