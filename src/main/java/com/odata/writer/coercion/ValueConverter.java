package com.odata.writer.coercion;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;

/**
 * Best-effort conversion of a value into one native representation.
 *
 * Numeric conversions are exact: a value that would lose digits or overflow the target
 * type is rejected rather than rounded.
 */
public final class ValueConverter {
    private static final Logger log = LoggerFactory.getLogger(ValueConverter.class);

    private ValueConverter() {
    }

    public static Optional<Object> tryConvert(Object value, Class<?> targetType) {
        if (value == null) {
            return Optional.empty();
        }
        if (targetType.isInstance(value)) {
            return Optional.of(value);
        }
        try {
            return Optional.ofNullable(convert(value, targetType));
        } catch (ArithmeticException | IllegalArgumentException | DateTimeException e) {
            log.trace("Cannot convert {} to {}: {}", value.getClass().getName(), targetType.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Object convert(Object value, Class<?> targetType) {
        if (targetType == String.class) {
            return toText(value);
        }
        if (targetType == Boolean.class) {
            return toBoolean(value);
        }
        if (targetType == Character.class) {
            String text = toText(value);
            return text != null && text.length() == 1 ? text.charAt(0) : null;
        }
        if (targetType == char[].class) {
            String text = toText(value);
            return text != null ? text.toCharArray() : null;
        }
        if (Number.class.isAssignableFrom(targetType)) {
            return toNumber(value, targetType);
        }
        if (targetType == UUID.class) {
            return value instanceof CharSequence s ? UUID.fromString(s.toString().trim()) : null;
        }
        if (targetType == Duration.class) {
            return value instanceof CharSequence s ? Duration.parse(s.toString().trim()) : null;
        }
        if (targetType == LocalDate.class) {
            return toLocalDate(value);
        }
        if (targetType == LocalTime.class) {
            return value instanceof CharSequence s ? LocalTime.parse(s.toString().trim()) : null;
        }
        if (targetType == OffsetDateTime.class) {
            return toOffsetDateTime(value);
        }
        if (targetType == Instant.class) {
            OffsetDateTime odt = toOffsetDateTime(value);
            return odt != null ? odt.toInstant() : null;
        }
        if (targetType == ZonedDateTime.class) {
            OffsetDateTime odt = toOffsetDateTime(value);
            return odt != null ? odt.toZonedDateTime() : null;
        }
        if (targetType == LocalDateTime.class) {
            OffsetDateTime odt = toOffsetDateTime(value);
            return odt != null ? odt.toLocalDateTime() : null;
        }
        if (targetType == Date.class) {
            OffsetDateTime odt = toOffsetDateTime(value);
            return odt != null ? Date.from(odt.toInstant()) : null;
        }
        // byte[], streams, spatial values and DOM nodes convert by instance only
        return null;
    }

    private static String toText(Object value) {
        if (value instanceof CharSequence s) {
            return s.toString();
        }
        if (value instanceof char[] chars) {
            return new String(chars);
        }
        if (value instanceof Node node) {
            return serializeNode(node);
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof UUID || value instanceof Enum<?>
                || value instanceof TemporalAccessor || value instanceof Duration) {
            return value.toString();
        }
        return null;
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof CharSequence s) {
            String text = s.toString().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("1")) {
                return Boolean.TRUE;
            }
            if (text.equals("false") || text.equals("0")) {
                return Boolean.FALSE;
            }
            return null;
        }
        if (value instanceof Number n) {
            BigDecimal decimal = toBigDecimal(n);
            return decimal != null ? decimal.signum() != 0 : null;
        }
        return null;
    }

    private static Object toNumber(Object value, Class<?> targetType) {
        BigDecimal decimal;
        if (value instanceof Number n) {
            decimal = toBigDecimal(n);
        } else if (value instanceof CharSequence s) {
            decimal = new BigDecimal(s.toString().trim());
        } else if (value instanceof Boolean b) {
            decimal = b ? BigDecimal.ONE : BigDecimal.ZERO;
        } else if (value instanceof Character c && Character.isDigit(c)) {
            decimal = BigDecimal.valueOf(Character.digit(c, 10));
        } else {
            return null;
        }
        if (decimal == null) {
            return null;
        }

        if (targetType == BigDecimal.class) {
            return decimal;
        }
        // floating targets: reject values whose shortest decimal form differs
        if (targetType == Double.class) {
            double d = decimal.doubleValue();
            return !Double.isInfinite(d) && BigDecimal.valueOf(d).compareTo(decimal) == 0 ? d : null;
        }
        if (targetType == Float.class) {
            float f = decimal.floatValue();
            return !Float.isInfinite(f) && new BigDecimal(Float.toString(f)).compareTo(decimal) == 0 ? f : null;
        }
        // integral targets: reject fractions and overflow
        BigInteger integral = decimal.toBigIntegerExact();
        if (targetType == BigInteger.class) {
            return integral;
        }
        if (targetType == Long.class) {
            return integral.longValueExact();
        }
        if (targetType == Integer.class) {
            return integral.intValueExact();
        }
        if (targetType == Short.class) {
            return integral.shortValueExact();
        }
        if (targetType == Byte.class) {
            return integral.byteValueExact();
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            // Float.toString keeps the shortest decimal form of the float itself
            return n instanceof Float f ? new BigDecimal(Float.toString(f)) : BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof CharSequence s) {
            return LocalDate.parse(s.toString().trim());
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toLocalDate();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDate();
        }
        return null;
    }

    private static OffsetDateTime toOffsetDateTime(Object value) {
        if (value instanceof OffsetDateTime odt) {
            return odt;
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof CharSequence s) {
            String text = s.toString().trim();
            try {
                return OffsetDateTime.parse(text);
            } catch (DateTimeException e) {
                return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
            }
        }
        return null;
    }

    private static String serializeNode(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            log.debug("Cannot serialize XML node {}", node.getNodeName(), e);
            return null;
        }
    }
}
