package io.hivemesh.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Copies task context for logging with credentials blanked out, and hides broker
 * passwords in URIs and error messages.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{32,}$");
    private static final Pattern URI_PASSWORD = Pattern.compile("(amqps?://[^:/@]+:)[^@]+@");

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> mask(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            if (isSensitiveKey(entry.getKey())) {
                out.put(entry.getKey(), MASK);
            } else {
                out.put(entry.getKey(), maskValue(entry.getValue()));
            }
        }
        return out;
    }

    /**
     * Hides the password part of broker URIs embedded in free text.
     */
    public static String maskText(String text) {
        if (text == null) {
            return null;
        }
        return URI_PASSWORD.matcher(text).replaceAll("$1" + MASK + "@");
    }

    @SuppressWarnings("unchecked")
    private static Object maskValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return mask((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> out = new ArrayList<>(collection.size());
            for (Object item : collection) {
                out.add(maskValue(item));
            }
            return out;
        }
        if (value instanceof String text) {
            if (OPAQUE_TOKEN.matcher(text.trim()).matches()) {
                return MASK;
            }
            return maskText(text);
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
}
