package org.docshare.sharing.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum PermissionLevel {
    READ,
    COMMENT,
    EDIT,
    FULL; // Administrators and owners only, never stored in an allow-list

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isShareable() {
        return this != FULL;
    }

    @JsonCreator
    public static PermissionLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(l -> l.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission level : " + value));
    }
}
