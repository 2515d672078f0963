package tech.demoserver.platform.principal;

import java.time.Instant;

/**
 * Stored account including the password digest.
 *
 * <p>Only {@link AccountStore} and the login path ever hold this record.
 * Everything that crosses the API boundary uses {@link AccountView}.
 */
public record Account(
    long id,
    String username,
    String email,
    String fullName,
    Role role,
    boolean active,
    String passwordHash,
    Instant createdAt,
    Instant updatedAt
) {

    public AccountView toView() {
        return new AccountView(id, username, email, fullName, role, active, createdAt, updatedAt);
    }

    Account applying(AccountUpdate update, Instant now) {
        return new Account(
            id,
            username,
            update.email().orElse(email),
            update.fullName().orElse(fullName),
            update.role().orElse(role),
            update.active().orElse(active),
            passwordHash,
            createdAt,
            now.isBefore(createdAt) ? createdAt : now
        );
    }
}
