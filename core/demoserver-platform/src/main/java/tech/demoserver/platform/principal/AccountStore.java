package tech.demoserver.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * In-memory registry of accounts.
 *
 * <p>Usernames and emails are unique (case-sensitive). Ids are assigned from 1
 * in creation order and never reused, even after deletion.
 *
 * <p>One read/write lock guards the account list and the id counter. Every
 * mutation, including its uniqueness checks, runs under the write lock so two
 * concurrent registrations of the same username can not both succeed.
 */
@ApplicationScoped
public class AccountStore {

    private static final Logger LOG = Logger.getLogger(AccountStore.class);

    public static final String WEAK_PASSWORD = "WEAK_PASSWORD";
    public static final String DUPLICATE_USERNAME = "DUPLICATE_USERNAME";
    public static final String DUPLICATE_EMAIL = "DUPLICATE_EMAIL";
    public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String BAD_PASSWORD = "BAD_PASSWORD";

    @Inject
    PasswordService passwordService;

    @Inject
    Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Account> accounts = new ArrayList<>();
    private long nextId = 1;

    /**
     * Register a new account.
     *
     * <p>Checks run in a fixed order before anything is stored: password policy,
     * username, then email. When both username and email collide the failure is
     * always {@link #DUPLICATE_USERNAME}.
     *
     * @return the stored account without its password hash
     */
    public Result<AccountView> register(NewAccount request) {
        if (!passwordService.meetsPolicy(request.password())) {
            return Result.failure(new UseCaseError.ValidationError(
                WEAK_PASSWORD,
                "Password must be at least " + PasswordService.MIN_PASSWORD_LENGTH + " characters long",
                Map.of("minLength", PasswordService.MIN_PASSWORD_LENGTH)
            ));
        }

        // Hashed outside the write lock; Argon2 takes tens of milliseconds
        String hash = passwordService.hashPassword(request.password());

        lock.writeLock().lock();
        try {
            if (find(a -> a.username().equals(request.username())).isPresent()) {
                return Result.failure(new UseCaseError.BusinessRuleViolation(
                    DUPLICATE_USERNAME,
                    "Username already registered",
                    Map.of("username", request.username())
                ));
            }
            if (find(a -> a.email().equals(request.email())).isPresent()) {
                return Result.failure(new UseCaseError.BusinessRuleViolation(
                    DUPLICATE_EMAIL,
                    "Email already registered",
                    Map.of("email", request.email())
                ));
            }

            Account account = new Account(
                nextId++,
                request.username(),
                request.email(),
                request.fullName(),
                request.role(),
                request.active(),
                hash,
                clock.instant(),
                null
            );
            accounts.add(account);

            LOG.infof("Registered account '%s' (id=%d, role=%s)", account.username(), account.id(), account.role());
            return Result.success(account.toView());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Check a username and password.
     *
     * <p>This is the only operation returning the hash-bearing record. It is
     * meant for the login path and must not be serialized.
     */
    public Result<Account> authenticate(String username, String password) {
        Optional<Account> found = getByUsername(username);
        if (found.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError(
                ACCOUNT_NOT_FOUND,
                "Account not found",
                Map.of("username", String.valueOf(username))
            ));
        }

        Account account = found.get();
        if (!passwordService.verifyPassword(password, account.passwordHash())) {
            return Result.failure(new UseCaseError.AuthenticationError(
                BAD_PASSWORD,
                "Incorrect password",
                Map.of()
            ));
        }
        return Result.success(account);
    }

    public Optional<AccountView> getById(long id) {
        lock.readLock().lock();
        try {
            return find(a -> a.id() == id).map(Account::toView);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Internal lookup, returns the hash-bearing record.
     */
    public Optional<Account> getByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return find(a -> a.username().equals(username));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Internal lookup, returns the hash-bearing record.
     */
    public Optional<Account> getByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return find(a -> a.email().equals(email));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Page through accounts in creation order. Out-of-range values clamp to
     * the available range, so a skip past the end yields an empty list.
     */
    public List<AccountView> list(int skip, int limit) {
        lock.readLock().lock();
        try {
            int size = accounts.size();
            int from = (int) Math.min(Math.max(skip, 0), size);
            int to = (int) Math.min((long) from + Math.max(limit, 0), size);
            return accounts.subList(from, to).stream()
                .map(Account::toView)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return accounts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Apply the present fields of {@code update} and stamp {@code updatedAt}.
     */
    public Result<AccountView> update(long id, AccountUpdate update) {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return Result.failure(new UseCaseError.NotFoundError(
                    ACCOUNT_NOT_FOUND,
                    "User not found",
                    Map.of("id", id)
                ));
            }
            Account updated = accounts.get(index).applying(update, clock.instant());
            accounts.set(index, updated);

            LOG.debugf("Updated account id=%d", id);
            return Result.success(updated.toView());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true if an account existed and was removed
     */
    public boolean delete(long id) {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return false;
            }
            Account removed = accounts.remove(index);
            LOG.infof("Deleted account '%s' (id=%d)", removed.username(), id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Callers hold the lock.
    private Optional<Account> find(Predicate<Account> predicate) {
        for (Account account : accounts) {
            if (predicate.test(account)) {
                return Optional.of(account);
            }
        }
        return Optional.empty();
    }

    private int indexOf(long id) {
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }
}
