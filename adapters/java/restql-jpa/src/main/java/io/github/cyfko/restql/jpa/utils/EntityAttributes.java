package io.github.cyfko.restql.jpa.utils;

import jakarta.persistence.metamodel.Attribute;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;

/**
 * Reflective access to entity instances through their metamodel attributes.
 * <p>
 * Field-access entities are read and written through the mapped field; property-access entities
 * through the mapped getter and its matching setter.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EntityAttributes {

    private EntityAttributes() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Creates an entity through its no-argument constructor, which JPA requires.
     *
     * @throws IllegalStateException if the entity cannot be instantiated
     */
    public static <T> T instantiate(Class<T> entityClass) {
        try {
            Constructor<T> constructor = entityClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate entity " + entityClass.getName(), e);
        }
    }

    /**
     * Writes one attribute value.
     *
     * @param attribute mapped attribute
     * @param entity    entity instance
     * @param value     already converted value
     * @throws IllegalStateException if the attribute cannot be written
     */
    public static void write(Attribute<?, ?> attribute, Object entity, Object value) {
        Member member = attribute.getJavaMember();
        try {
            if (member instanceof Field field) {
                field.setAccessible(true);
                field.set(entity, value);
            } else if (member instanceof Method getter) {
                Method setter = setterFor(getter, attribute);
                setter.setAccessible(true);
                setter.invoke(entity, value);
            } else {
                throw new IllegalStateException("Unsupported member for attribute '" + attribute.getName() + "'");
            }
        } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
            throw new IllegalStateException(String.format("Cannot write attribute '%s' of %s",
                    attribute.getName(), entity.getClass().getSimpleName()), e);
        }
    }

    /**
     * Reads one attribute value.
     *
     * @param attribute mapped attribute
     * @param entity    entity instance
     * @return the current value
     * @throws IllegalStateException if the attribute cannot be read
     */
    public static Object read(Attribute<?, ?> attribute, Object entity) {
        Member member = attribute.getJavaMember();
        try {
            if (member instanceof Field field) {
                field.setAccessible(true);
                return field.get(entity);
            }
            if (member instanceof Method getter) {
                getter.setAccessible(true);
                return getter.invoke(entity);
            }
            throw new IllegalStateException("Unsupported member for attribute '" + attribute.getName() + "'");
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException(String.format("Cannot read attribute '%s' of %s",
                    attribute.getName(), entity.getClass().getSimpleName()), e);
        }
    }

    private static Method setterFor(Method getter, Attribute<?, ?> attribute) throws NoSuchMethodException {
        String name = attribute.getName();
        String setterName = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
        return getter.getDeclaringClass().getDeclaredMethod(setterName, getter.getReturnType());
    }
}
