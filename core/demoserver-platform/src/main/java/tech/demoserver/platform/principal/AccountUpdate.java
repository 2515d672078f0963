package tech.demoserver.platform.principal;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial account update. Only present fields are applied; the username and
 * password can not be changed through an update.
 */
public record AccountUpdate(
    Optional<String> email,
    Optional<String> fullName,
    Optional<Role> role,
    Optional<Boolean> active
) {

    public AccountUpdate {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(fullName, "fullName");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(active, "active");
    }

    public static AccountUpdate empty() {
        return new AccountUpdate(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Build an update from nullable values, null meaning "leave untouched".
     */
    public static AccountUpdate ofNullable(String email, String fullName, Role role, Boolean active) {
        return new AccountUpdate(
            Optional.ofNullable(email),
            Optional.ofNullable(fullName),
            Optional.ofNullable(role),
            Optional.ofNullable(active)
        );
    }

    public AccountUpdate withEmail(String value) {
        return new AccountUpdate(Optional.of(value), fullName, role, active);
    }

    public AccountUpdate withFullName(String value) {
        return new AccountUpdate(email, Optional.of(value), role, active);
    }

    public AccountUpdate withRole(Role value) {
        return new AccountUpdate(email, fullName, Optional.of(value), active);
    }

    public AccountUpdate withActive(boolean value) {
        return new AccountUpdate(email, fullName, role, Optional.of(value));
    }
}
