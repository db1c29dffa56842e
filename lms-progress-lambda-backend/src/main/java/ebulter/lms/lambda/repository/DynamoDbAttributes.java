package ebulter.lms.lambda.repository;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Helpers for building and reading DynamoDB attribute maps
 */
public final class DynamoDbAttributes {

    private DynamoDbAttributes() {
    }

    public static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    public static AttributeValue n(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }

    public static AttributeValue bool(boolean value) {
        return AttributeValue.builder().bool(value).build();
    }

    public static AttributeValue m(Map<String, AttributeValue> value) {
        return AttributeValue.builder().m(value).build();
    }

    /**
     * Put a string attribute, skipping nulls (DynamoDB rejects empty attribute values)
     */
    public static void putIfPresent(Map<String, AttributeValue> item, String name, String value) {
        if (value != null) {
            item.put(name, s(value));
        }
    }

    public static void putIfPresent(Map<String, AttributeValue> item, String name, Instant value) {
        if (value != null) {
            item.put(name, s(value.toString()));
        }
    }

    public static void putIfPresent(Map<String, AttributeValue> item, String name, Long value) {
        if (value != null) {
            item.put(name, n(value));
        }
    }

    public static String getString(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null || Boolean.TRUE.equals(value.nul())) {
            return null;
        }
        return value.s();
    }

    public static Instant getInstant(Map<String, AttributeValue> item, String name) {
        String value = getString(item, name);
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }

    public static Long getLong(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null || value.n() == null) {
            return null;
        }
        return Math.round(Double.parseDouble(value.n()));
    }

    public static int getInt(Map<String, AttributeValue> item, String name, int defaultValue) {
        Long value = getLong(item, name);
        return value == null ? defaultValue : value.intValue();
    }

    public static boolean getBool(Map<String, AttributeValue> item, String name, boolean defaultValue) {
        AttributeValue value = item.get(name);
        if (value == null || value.bool() == null) {
            return defaultValue;
        }
        return value.bool();
    }

    public static Map<String, AttributeValue> getMap(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        if (value == null || !value.hasM()) {
            return Collections.emptyMap();
        }
        return value.m();
    }
}
