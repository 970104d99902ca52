package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.exception.MalformedSerializationException;

import java.util.Map;

final class Attributes {

    private Attributes() {
    }

    static String text(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new MalformedSerializationException("Attribute " + key + " must be a string but was " + value);
    }

    static Boolean flag(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new MalformedSerializationException("Attribute " + key + " must be a boolean but was " + value);
    }

    static Integer integer(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new MalformedSerializationException("Attribute " + key + " must be a number but was " + value);
    }

    static Double decimal(Map<String, ?> attributes, String key) {
        Object value = attributes.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new MalformedSerializationException("Attribute " + key + " must be a number but was " + value);
    }
}
