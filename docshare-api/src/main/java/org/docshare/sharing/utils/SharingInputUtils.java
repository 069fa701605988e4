package org.docshare.sharing.utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class SharingInputUtils {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final String AT = "@";
    private static final String DOT = ".";
    private static final String CSV_SEPARATOR = ",";

    private SharingInputUtils() {
    }

    /**
     * Trims, strips a leading '@' and lowercases a domain. Returns null for null input.
     */
    public static String normalizeDomain(String value) {
        if (value == null) {
            return null;
        }
        String domain = value.trim();
        if (domain.startsWith(AT)) {
            domain = domain.substring(1);
        }
        return domain.toLowerCase(Locale.ROOT);
    }

    public static boolean isValidDomain(String normalizedDomain) {
        return normalizedDomain != null && !normalizedDomain.isEmpty() && normalizedDomain.contains(DOT);
    }

    public static String normalizeEmail(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValidEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /**
     * Domain part of an email address, lowercase, or null when the value has no '@'.
     */
    public static String emailDomain(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf(AT);
        if (at < 0 || at == email.length() - 1) {
            return null;
        }
        return email.substring(at + 1).trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a comma separated header value, dropping blank tokens. Order is kept.
     */
    public static Set<String> parseCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(CSV_SEPARATOR))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
