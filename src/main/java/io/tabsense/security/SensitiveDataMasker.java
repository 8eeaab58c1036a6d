package io.tabsense.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credential-like entries in task parameters and results before they reach logs or CLI
 * output.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "cookie", "credential",
            "session", "cardnumber", "card_number", "cvv"
    );

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitiveKey(key) && value != null) {
                out.put(key, MASK);
            } else {
                out.put(key, maskedValue(value));
            }
        }
        return out;
    }

    static Object maskedValue(Object value) {
        if (value instanceof Map<?, ?>) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return masked(nested);
        }
        if (value instanceof Collection<?>) {
            List<Object> out = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                out.add(maskedValue(item));
            }
            return out;
        }
        if (value instanceof String && likelySecretValue((String) value)) {
            return MASK;
        }
        return value;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.contains("://")) {
            return false;
        }
        // Long opaque strings without spaces are treated as tokens.
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}
