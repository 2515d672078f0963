package tech.demoserver.platform.principal;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Privilege tier of an account. Serialized in lower case ({@code "admin"}).
 */
public enum Role {
    ADMIN,
    USER,
    MODERATOR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
