package tech.demoserver.platform.principal;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Password hashing and verification using Argon2id.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 */
@ApplicationScoped
public class PasswordService {

    private static final int MEMORY_COST = 65536;  // 64 MiB in KiB
    private static final int ITERATIONS = 3;       // Time cost
    private static final int PARALLELISM = 4;      // Parallel threads
    private static final int HASH_LENGTH = 32;     // Output length in bytes
    private static final int SALT_LENGTH = 16;     // Salt length in bytes

    public static final int MIN_PASSWORD_LENGTH = 6;

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(
            Argon2Factory.Argon2Types.ARGON2id,
            SALT_LENGTH,
            HASH_LENGTH
        );
    }

    /**
     * Hash a password using Argon2id with a fresh random salt.
     *
     * @param plainPassword The plain text password
     * @return The hashed password in PHC format (e.g., $argon2id$v=19$m=65536,t=3,p=4$...)
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Verify a password against a hash. The comparison is constant-time.
     *
     * @return true if password matches the hash; false for null input or a malformed hash
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (Exception e) {
            // Invalid hash format
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Check if a password hash should be regenerated with the current parameters.
     */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith("$argon2id$")) {
            return true;
        }

        // PHC format: $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        String params = parts[3];
        return !(params.contains("m=" + MEMORY_COST)
            && params.contains("t=" + ITERATIONS)
            && params.contains("p=" + PARALLELISM));
    }

    /**
     * Whether a candidate password satisfies the password policy.
     */
    public boolean meetsPolicy(String password) {
        return password != null && password.length() >= MIN_PASSWORD_LENGTH;
    }
}
