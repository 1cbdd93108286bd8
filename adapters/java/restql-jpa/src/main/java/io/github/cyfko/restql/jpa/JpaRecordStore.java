package io.github.cyfko.restql.jpa;

import io.github.cyfko.restql.core.config.EnumMatchMode;
import io.github.cyfko.restql.core.exception.FilterValueException;
import io.github.cyfko.restql.core.exception.RecordValidationException;
import io.github.cyfko.restql.core.exception.ResourceNotFoundException;
import io.github.cyfko.restql.core.exception.SchemaMismatchException;
import io.github.cyfko.restql.core.exception.StatementRejectedException;
import io.github.cyfko.restql.core.spi.RecordStore;
import io.github.cyfko.restql.core.utils.TypeConversionUtils;
import io.github.cyfko.restql.jpa.utils.EntityAttributes;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link RecordStore} writing entities through a resource-local transaction per call.
 *
 * <h2>Attribute values</h2>
 * <ul>
 *   <li>Scalar attributes are converted to the mapped Java type; a value that does not convert
 *       is reported as {@code "is invalid"}.</li>
 *   <li>Singular associations take the identity of the referenced record, bare or as an object
 *       holding the identifier; a reference to a missing record is reported as
 *       {@code "does not exist"}.</li>
 *   <li>Bean Validation constraints checked by the provider on flush are reported per property.</li>
 * </ul>
 * <p>
 * All three end in a {@link RecordValidationException}, and the transaction is rolled back.
 * A statement the database refuses (foreign key, unique or not-null constraint) ends in a
 * {@link StatementRejectedException} instead.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaRecordStore implements RecordStore {

    private static final Logger logger = Logger.getLogger(JpaRecordStore.class.getName());

    private final EntityManagerFactory emf;
    private final JpaSchemaInspector schema;
    private final EnumMatchMode enumMatchMode;

    public JpaRecordStore(EntityManagerFactory emf, JpaSchemaInspector schema, EnumMatchMode enumMatchMode) {
        this.emf = Objects.requireNonNull(emf, "EntityManagerFactory is required");
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.enumMatchMode = Objects.requireNonNull(enumMatchMode, "enumMatchMode is required");
    }

    @Override
    public Object create(String resourceType, String keyField, Map<String, Object> attributes) {
        Class<?> entityClass = schema.entityClassOf(resourceType);
        Attribute<?, ?> keyAttribute = schema.attributeOf(resourceType, keyField)
                .orElseThrow(() -> new SchemaMismatchException(resourceType, keyField));
        Object key = inTransaction(resourceType, "create", em -> {
            Object entity = EntityAttributes.instantiate(entityClass);
            apply(em, resourceType, entity, attributes);
            em.persist(entity);
            em.flush();
            return keyField.equals(schema.identifierOf(resourceType))
                    ? emf.getPersistenceUnitUtil().getIdentifier(entity)
                    : EntityAttributes.read(keyAttribute, entity);
        });
        logger.fine(() -> String.format("Created %s with %s %s", resourceType, keyField, key));
        return key;
    }

    @Override
    public void update(String resourceType, String keyField, Object key, Map<String, Object> attributes) {
        inTransaction(resourceType, "update", em -> {
            Object entity = locate(em, resourceType, keyField, key);
            apply(em, resourceType, entity, attributes);
            em.flush();
            return entity;
        });
    }

    @Override
    public void delete(String resourceType, String keyField, Object key) {
        inTransaction(resourceType, "delete", em -> {
            Object entity = locate(em, resourceType, keyField, key);
            em.remove(entity);
            em.flush();
            return entity;
        });
    }

    private <T> T inTransaction(String resourceType, String operation, Function<EntityManager, T> work) {
        long startTime = System.nanoTime();
        EntityManager em = emf.createEntityManager();
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            T result = work.apply(em);
            tx.commit();

            long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.info(() -> String.format("Record %s on '%s' completed in %dms", operation, resourceType, durationMs));
            return result;
        } catch (RuntimeException e) {
            if (tx.isActive()) {
                tx.rollback();
            }
            ConstraintViolationException violation = findViolation(e);
            if (violation != null) {
                throw toValidationException(violation);
            }
            if (e instanceof PersistenceException) {
                logger.fine(() -> String.format("Record %s on '%s' rejected: %s", operation, resourceType, e.getMessage()));
                throw new StatementRejectedException(operation, resourceType, e);
            }
            throw e;
        } finally {
            em.close();
        }
    }

    private Object locate(EntityManager em, String resourceType, String keyField, Object key) {
        if (!schema.hasAttribute(resourceType, keyField)) {
            throw new SchemaMismatchException(resourceType, keyField);
        }
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Object> query = cb.createQuery(Object.class);
        Root<?> root = query.from(schema.entityClassOf(resourceType));
        Path<?> keyPath = root.get(keyField);

        Object converted;
        try {
            converted = TypeConversionUtils.convertValue(keyPath.getJavaType(), key, enumMatchMode);
        } catch (IllegalArgumentException e) {
            throw new FilterValueException(String.format("Invalid value for '%s': %s", keyField, e.getMessage()), e);
        }

        query.select(root).where(cb.equal(keyPath, converted));
        List<Object> found = em.createQuery(query).setMaxResults(1).getResultList();
        if (found.isEmpty()) {
            throw new ResourceNotFoundException(resourceType, keyField, key);
        }
        return found.get(0);
    }

    private void apply(EntityManager em, String resourceType, Object entity, Map<String, Object> attributes) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        attributes.forEach((name, value) -> {
            Attribute<?, ?> attribute = schema.attributeOf(resourceType, name)
                    .orElseThrow(() -> new SchemaMismatchException(resourceType, name));

            if (attribute.isCollection()) {
                errors.computeIfAbsent(name, k -> new ArrayList<>()).add("is not writable");
                return;
            }
            try {
                Object resolved = attribute.isAssociation()
                        ? reference(em, attribute, value)
                        : TypeConversionUtils.convertValue(attribute.getJavaType(), value, enumMatchMode);
                EntityAttributes.write(attribute, entity, resolved);
            } catch (IllegalArgumentException e) {
                logger.fine(() -> String.format("Rejected value of '%s' on '%s': %s", name, resourceType, e.getMessage()));
                errors.computeIfAbsent(name, k -> new ArrayList<>()).add("is invalid");
            } catch (ResourceNotFoundException e) {
                errors.computeIfAbsent(name, k -> new ArrayList<>()).add("does not exist");
            }
        });
        if (!errors.isEmpty()) {
            throw new RecordValidationException(errors);
        }
    }

    private Object reference(EntityManager em, Attribute<?, ?> attribute, Object value) {
        Object raw = value instanceof Map<?, ?> map ? identifierIn(em, attribute, map) : value;
        if (raw == null) {
            return null;
        }
        EntityType<?> target = em.getMetamodel().entity(attribute.getJavaType());
        Object id = TypeConversionUtils.convertValue(target.getIdType().getJavaType(), raw, enumMatchMode);
        Object referenced = em.find(attribute.getJavaType(), id);
        if (referenced == null) {
            throw new ResourceNotFoundException(target.getName(), identifierName(target), id);
        }
        return referenced;
    }

    private Object identifierIn(EntityManager em, Attribute<?, ?> attribute, Map<?, ?> value) {
        return value.get(identifierName(em.getMetamodel().entity(attribute.getJavaType())));
    }

    private static String identifierName(EntityType<?> entityType) {
        return entityType.getSingularAttributes().stream()
                .filter(SingularAttribute::isId)
                .map(Attribute::getName)
                .findFirst()
                .orElse("id");
    }

    private static ConstraintViolationException findViolation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ConstraintViolationException violation) {
                return violation;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private static RecordValidationException toValidationException(ConstraintViolationException violation) {
        Map<String, List<String>> errors = new TreeMap<>();
        for (ConstraintViolation<?> v : violation.getConstraintViolations()) {
            errors.computeIfAbsent(v.getPropertyPath().toString(), k -> new ArrayList<>()).add(v.getMessage());
        }
        errors.values().forEach(messages -> messages.sort(null));
        return new RecordValidationException(errors, violation);
    }
}
