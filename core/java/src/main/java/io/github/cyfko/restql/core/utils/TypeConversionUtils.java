package io.github.cyfko.restql.core.utils;

import io.github.cyfko.restql.core.config.EnumMatchMode;

import java.lang.reflect.Constructor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Conversion of raw parameter and body values to the Java type of a storage attribute.
 * <p>
 * Query strings only carry text, and JSON bodies carry strings, numbers and booleans; storage
 * adapters use this class to turn both into the attribute type before binding them.
 * </p>
 *
 * <h2>Supported Types</h2>
 * <dl>
 *   <dt><strong>Numeric</strong></dt>
 *   <dd>Primitives, wrappers, {@link BigDecimal}, {@link BigInteger}.</dd>
 *   <dt><strong>Date/Time</strong></dt>
 *   <dd>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link Instant},
 *       {@link ZonedDateTime}, {@link OffsetDateTime}, {@link Date}: ISO-8601 strings or epoch millis.</dd>
 *   <dt><strong>Enum</strong></dt>
 *   <dd>By constant name, according to {@link EnumMatchMode}.</dd>
 *   <dt><strong>Boolean</strong></dt>
 *   <dd>{@code true/false}, {@code 1/0}, {@code yes/no}, {@code y/n}, {@code t/f} (case-insensitive).</dd>
 *   <dt><strong>Other</strong></dt>
 *   <dd>{@link UUID}, {@link String} and any type with a public {@code String} constructor.</dd>
 * </dl>
 *
 * <pre>{@code
 * Long id = (Long) TypeConversionUtils.convertValue(Long.class, "42", EnumMatchMode.CASE_INSENSITIVE);
 * Status s = (Status) TypeConversionUtils.convertValue(Status.class, "published", EnumMatchMode.CASE_INSENSITIVE);
 * }</pre>
 *
 * <p>
 * Failures raise {@link IllegalArgumentException} with a descriptive message; callers translate
 * them to the error of their layer.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeConversionUtils {

    private static final Set<String> TRUE_TOKENS = Set.of("true", "1", "yes", "y", "t");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "n", "f");

    private TypeConversionUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts a value to the target type.
     *
     * @param targetType    the attribute type
     * @param value         the raw value, {@code null} passes through
     * @param enumMatchMode enum matching strategy
     * @return the converted value
     * @throws IllegalArgumentException if conversion is not possible
     */
    public static Object convertValue(Class<?> targetType, Object value, EnumMatchMode enumMatchMode) {
        if (value == null) {
            return null;
        }
        if (wrap(targetType).isInstance(value)) {
            return value;
        }

        try {
            if (targetType == BigDecimal.class) return new BigDecimal(value.toString().trim());
            if (targetType == BigInteger.class) return convertToBigInteger(value);
            if (Number.class.isAssignableFrom(targetType) || isNumericPrimitive(targetType)) {
                return convertToNumeric(targetType, value);
            }
            if (targetType.isEnum()) return convertToEnum(targetType, value, enumMatchMode);
            if (targetType == Boolean.class || targetType == boolean.class) return convertToBoolean(value);

            if (targetType == LocalDate.class) return convertToLocalDate(value);
            if (targetType == LocalDateTime.class) return convertToLocalDateTime(value);
            if (targetType == LocalTime.class) return LocalTime.parse(value.toString());
            if (targetType == Instant.class) return convertToInstant(value);
            if (targetType == ZonedDateTime.class) return convertToInstantBased(value).atZone(ZoneId.systemDefault());
            if (targetType == OffsetDateTime.class) return convertToOffsetDateTime(value);
            if (targetType == Date.class) return Date.from(convertToInstantBased(value));

            if (targetType == UUID.class) return UUID.fromString(value.toString());
            if (targetType == String.class) return value.toString();

            Constructor<?> constructor = targetType.getConstructor(String.class);
            return constructor.newInstance(value.toString());
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    String.format("Cannot convert value '%s' (type: %s) to target type %s",
                            value, value.getClass().getName(), targetType.getName()), e);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value '%s' to type %s: %s",
                            value, targetType.getName(), e.getMessage()), e);
        }
    }

    /**
     * Converts every value of a list.
     *
     * @param targetType    the attribute type
     * @param values        raw values
     * @param enumMatchMode enum matching strategy
     * @return converted values, in the same order
     */
    public static List<Object> convertAll(Class<?> targetType, List<?> values, EnumMatchMode enumMatchMode) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(convertValue(targetType, value, enumMatchMode));
        }
        return converted;
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return type;
    }

    private static boolean isNumericPrimitive(Class<?> type) {
        return type == int.class || type == long.class || type == double.class
                || type == float.class || type == short.class || type == byte.class;
    }

    private static Object convertToNumeric(Class<?> targetType, Object value) {
        if (value instanceof Number num) {
            if (targetType == Integer.class || targetType == int.class) return num.intValue();
            if (targetType == Long.class || targetType == long.class) return num.longValue();
            if (targetType == Double.class || targetType == double.class) return num.doubleValue();
            if (targetType == Float.class || targetType == float.class) return num.floatValue();
            if (targetType == Short.class || targetType == short.class) return num.shortValue();
            if (targetType == Byte.class || targetType == byte.class) return num.byteValue();
        }

        String str = value.toString().trim();
        if (targetType == Integer.class || targetType == int.class) return Integer.valueOf(str);
        if (targetType == Long.class || targetType == long.class) return Long.valueOf(str);
        if (targetType == Double.class || targetType == double.class) return Double.valueOf(str);
        if (targetType == Float.class || targetType == float.class) return Float.valueOf(str);
        if (targetType == Short.class || targetType == short.class) return Short.valueOf(str);
        if (targetType == Byte.class || targetType == byte.class) return Byte.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + targetType);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Enum<E>> E convertToEnum(Class<?> targetType, Object value, EnumMatchMode enumMatchMode) {
        Class<E> enumClass = (Class<E>) targetType;
        String stringValue = value.toString();

        for (E constant : enumClass.getEnumConstants()) {
            boolean matches = enumMatchMode == EnumMatchMode.CASE_SENSITIVE
                    ? constant.name().equals(stringValue)
                    : constant.name().equalsIgnoreCase(stringValue);
            if (matches) {
                return constant;
            }
        }

        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s (mode: %s)",
                        stringValue, enumClass.getSimpleName(), enumMatchMode));
    }

    private static Boolean convertToBoolean(Object value) {
        if (value instanceof Number num) return num.intValue() != 0;

        String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(normalized)) return true;
        if (FALSE_TOKENS.contains(normalized)) return false;
        throw new IllegalArgumentException("Invalid boolean value '" + value + "'");
    }

    private static LocalDate convertToLocalDate(Object value) {
        if (value instanceof LocalDateTime ldt) return ldt.toLocalDate();
        if (value instanceof Long l) return Instant.ofEpochMilli(l).atZone(ZoneId.systemDefault()).toLocalDate();
        return LocalDate.parse(value.toString());
    }

    private static LocalDateTime convertToLocalDateTime(Object value) {
        if (value instanceof Long l) return Instant.ofEpochMilli(l).atZone(ZoneId.systemDefault()).toLocalDateTime();
        String str = value.toString();
        if (str.length() == 10) {
            return LocalDate.parse(str).atStartOfDay();
        }
        return LocalDateTime.parse(str);
    }

    private static Instant convertToInstant(Object value) {
        if (value instanceof Long l) return Instant.ofEpochMilli(l);
        if (value instanceof LocalDateTime ldt) return ldt.atZone(ZoneId.systemDefault()).toInstant();
        return Instant.parse(value.toString());
    }

    private static OffsetDateTime convertToOffsetDateTime(Object value) {
        if (value instanceof Long l) return Instant.ofEpochMilli(l).atZone(ZoneId.systemDefault()).toOffsetDateTime();
        return OffsetDateTime.parse(value.toString());
    }

    private static Instant convertToInstantBased(Object value) {
        if (value instanceof Long l) return Instant.ofEpochMilli(l);
        if (value instanceof Date d) return d.toInstant();
        if (value instanceof LocalDateTime ldt) return ldt.atZone(ZoneId.systemDefault()).toInstant();
        if (value instanceof LocalDate ld) return ld.atStartOfDay(ZoneId.systemDefault()).toInstant();
        String str = value.toString();
        try {
            return Instant.parse(str);
        } catch (RuntimeException e) {
            return Instant.ofEpochMilli(Long.parseLong(str));
        }
    }

    private static BigInteger convertToBigInteger(Object value) {
        if (value instanceof Number n) return BigInteger.valueOf(n.longValue());
        return new BigInteger(value.toString().trim());
    }
}
