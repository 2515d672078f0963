package tech.demoserver.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.demoserver.platform.authentication.TokenService;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;
import tech.demoserver.platform.principal.Account;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.Role;

import java.time.Clock;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Two-stage gate in front of protected operations.
 *
 * <ol>
 *   <li>{@link #authenticateRequest(String)} turns a bearer token into a principal</li>
 *   <li>{@link #authorize(AccountView, AccessRequirement...)} checks the principal
 *       against the declared requirements</li>
 * </ol>
 *
 * <p>Every token problem (missing, malformed, expired, subject deleted) is
 * reported to the caller as {@link #UNAUTHORIZED}. The precise reason is only
 * logged.
 */
@ApplicationScoped
public class AccessGuard {

    private static final Logger LOG = Logger.getLogger(AccessGuard.class);

    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String INACTIVE_ACCOUNT = "INACTIVE_ACCOUNT";
    public static final String INSUFFICIENT_ROLE = "INSUFFICIENT_ROLE";

    @Inject
    TokenService tokenService;

    @Inject
    AccountStore accountStore;

    @Inject
    Clock clock;

    public Result<AccountView> authenticateRequest(String token) {
        if (token == null || token.isBlank()) {
            LOG.debug("Rejected request: no bearer token");
            return unauthorized();
        }

        Result<String> verified = tokenService.verify(token, clock.instant());
        if (verified instanceof Result.Failure<String> f) {
            LOG.debugf("Rejected token: %s (%s)", f.error().code(), f.error().message());
            return unauthorized();
        }

        String subject = verified.orElseThrow();
        Optional<Account> account = accountStore.getByUsername(subject);
        if (account.isEmpty()) {
            LOG.debugf("Rejected token: subject '%s' no longer exists", subject);
            return unauthorized();
        }
        return Result.success(account.get().toView());
    }

    public Result<AccountView> authorize(AccountView principal, AccessRequirement... requirements) {
        AccessRequirement[] ordered = requirements.clone();
        Arrays.sort(ordered, Comparator.comparingInt(AccessRequirement::precedence));

        for (AccessRequirement requirement : ordered) {
            UseCaseError denial = check(principal, requirement);
            if (denial != null) {
                LOG.debugf("Denied '%s': %s", principal.username(), denial.code());
                return Result.failure(denial);
            }
        }
        return Result.success(principal);
    }

    /**
     * Authenticate and authorize in one call.
     */
    public Result<AccountView> require(String token, AccessRequirement... requirements) {
        return authenticateRequest(token).flatMap(principal -> authorize(principal, requirements));
    }

    private UseCaseError check(AccountView principal, AccessRequirement requirement) {
        if (requirement instanceof AccessRequirement.Active) {
            if (!principal.active()) {
                return new UseCaseError.AuthorizationError(INACTIVE_ACCOUNT, "Inactive user", Map.of());
            }
            return null;
        }
        if (requirement instanceof AccessRequirement.HasRole hasRole) {
            if (principal.role() != hasRole.role()) {
                return insufficientRole(hasRole.role());
            }
            return null;
        }
        AccessRequirement.OwnerOrRole ownerOrRole = (AccessRequirement.OwnerOrRole) requirement;
        if (principal.id() != ownerOrRole.ownerId() && principal.role() != ownerOrRole.role()) {
            return insufficientRole(ownerOrRole.role());
        }
        return null;
    }

    private static UseCaseError insufficientRole(Role role) {
        return new UseCaseError.AuthorizationError(
            INSUFFICIENT_ROLE,
            "Not enough permissions",
            Map.of("requiredRole", role.value())
        );
    }

    private static <T> Result<T> unauthorized() {
        return Result.failure(new UseCaseError.AuthenticationError(
            UNAUTHORIZED,
            "Could not validate credentials",
            Map.of()
        ));
    }
}
