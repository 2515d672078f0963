package tech.demoserver.platform.principal;

import java.util.Objects;

/**
 * Input to {@link AccountStore#register(NewAccount)}.
 *
 * @param fullName optional, may be null
 */
public record NewAccount(
    String username,
    String email,
    String password,
    String fullName,
    Role role,
    boolean active
) {

    public NewAccount {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(password, "password");
        if (role == null) {
            role = Role.USER;
        }
    }

    /**
     * Active {@link Role#USER} account without a full name.
     */
    public static NewAccount of(String username, String email, String password) {
        return new NewAccount(username, email, password, null, Role.USER, true);
    }
}
