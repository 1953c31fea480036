package com.voucherpay.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before request data leaves the process in logs or analytics events.
 * <p>
 * A value is masked when its key contains one of the sensitive fragments (case-insensitive
 * substring match, so {@code refresh_token} and {@code new_password} both match {@code token}
 * and {@code password}), or when the value itself looks like a signed token or a bearer
 * credential, whatever its key. Nested maps and lists are walked.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Key fragments masked by the no-argument constructor. */
    public static final Set<String> DEFAULT_KEY_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "code", "otp"
    );

    // Three base64url segments starting with a JSON header, or an Authorization scheme prefix.
    private static final Pattern CREDENTIAL_VALUE = Pattern.compile(
            "^(?:eyJ[\\w-]*\\.[\\w-]+\\.[\\w-]*|(?i:bearer|basic)\\s+\\S+)$");

    private final Set<String> keyFragments;
    private final Pattern keyPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_KEY_FRAGMENTS);
    }

    /**
     * @param keyFragments key fragments to treat as sensitive; must not be empty
     */
    public SensitiveDataRedactor(Set<String> keyFragments) {
        if (keyFragments == null || keyFragments.isEmpty()) {
            throw new IllegalArgumentException("keyFragments must not be empty");
        }
        this.keyFragments = Set.copyOf(keyFragments);
        this.keyPattern = Pattern.compile(
                String.join("|", this.keyFragments.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED},
     * in the same iteration order. Null input returns an empty map.
     */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : redactValue(value)));
        return result;
    }

    /**
     * Masks the values of sensitive query parameters in a URL, leaving
     * everything else (including the fragment) byte for byte as it was.
     *
     * <pre>{@code
     * redactUrl("https://api/reset?token=abc&page=2")  ->  "https://api/reset?token=[REDACTED]&page=2"
     * }</pre>
     */
    public String redactUrl(String url) {
        if (url == null) {
            return null;
        }
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return url;
        }
        int fragmentStart = url.indexOf('#', queryStart);
        int queryEnd = fragmentStart < 0 ? url.length() : fragmentStart;

        StringBuilder out = new StringBuilder(url.length()).append(url, 0, queryStart + 1);
        String[] pairs = url.substring(queryStart + 1, queryEnd).split("&", -1);
        for (int i = 0; i < pairs.length; i++) {
            if (i > 0) {
                out.append('&');
            }
            String pair = pairs[i];
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            if (eq >= 0 && (isSensitive(name) || looksLikeCredential(value))) {
                out.append(name).append('=').append(REDACTED);
            } else {
                out.append(pair);
            }
        }
        return out.append(url, queryEnd, url.length()).toString();
    }

    /** True if the key contains any sensitive fragment, ignoring case. */
    public boolean isSensitive(String key) {
        return key != null && keyPattern.matcher(key).find();
    }

    /** True for values shaped like a JWT or an {@code Authorization} header value. */
    public static boolean looksLikeCredential(Object value) {
        return value instanceof CharSequence text && CREDENTIAL_VALUE.matcher(text).matches();
    }

    public Set<String> keyFragments() {
        return keyFragments;
    }

    private Object redactValue(Object value) {
        if (looksLikeCredential(value)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            Map<String, Object> copy = new LinkedHashMap<>();
            nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return redact(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(redactValue(item)));
            return copy;
        }
        return value;
    }
}
