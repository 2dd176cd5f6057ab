package com.poultry.review.controller;

import com.poultry.review.exception.ValidationException;

import java.util.Map;

/**
 * Field extraction for the Map request bodies used by the decision endpoints.
 */
final class RequestBodies {

    private RequestBodies() {}

    static String requireString(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null || v.toString().isBlank()) {
            throw new ValidationException(key + " is required");
        }
        return v.toString();
    }

    static String optionalString(Map<String, Object> body, String key) {
        Object v = body.get(key);
        return v == null ? null : v.toString();
    }

    static int requireInt(Map<String, Object> body, String key) {
        Integer value = optionalInt(body, key);
        if (value == null) {
            throw new ValidationException(key + " is required");
        }
        return value;
    }

    static Integer optionalInt(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be an integer");
        }
    }
}
