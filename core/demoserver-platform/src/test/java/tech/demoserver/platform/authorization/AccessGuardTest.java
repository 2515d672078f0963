package tech.demoserver.platform.authorization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.demoserver.platform.authentication.TokenService;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;
import tech.demoserver.platform.principal.Account;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.Role;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccessGuard.
 * Token verification and account lookup are mocked.
 */
@ExtendWith(MockitoExtension.class)
class AccessGuardTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TokenService tokenService;

    @Mock
    private AccountStore accountStore;

    @InjectMocks
    private AccessGuard guard;

    @BeforeEach
    void setUp() {
        guard.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    // ========================================
    // authenticateRequest TESTS
    // ========================================

    @Test
    @DisplayName("authenticateRequest should resolve a valid token to the account view")
    void authenticateRequest_shouldReturnPrincipal_whenTokenValid() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.success("alice"));
        when(accountStore.getByUsername("alice")).thenReturn(Optional.of(account(7, "alice", Role.USER, true)));

        AccountView principal = guard.authenticateRequest("tok").orElseThrow();

        assertThat(principal.id()).isEqualTo(7);
        assertThat(principal.username()).isEqualTo("alice");
    }

    @Test
    @DisplayName("authenticateRequest should fail UNAUTHORIZED when the token is expired")
    void authenticateRequest_shouldFailUnauthorized_whenTokenExpired() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.failure(
            new UseCaseError.AuthenticationError(TokenService.TOKEN_EXPIRED, "Token has expired", Map.of())));

        Result<AccountView> result = guard.authenticateRequest("tok");

        assertThat(result.errorOrNull())
            .isInstanceOf(UseCaseError.AuthenticationError.class)
            .extracting(UseCaseError::code).isEqualTo(AccessGuard.UNAUTHORIZED);
        verifyNoInteractions(accountStore);
    }

    @Test
    @DisplayName("authenticateRequest should fail UNAUTHORIZED when the token is malformed")
    void authenticateRequest_shouldFailUnauthorized_whenTokenMalformed() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.failure(
            new UseCaseError.AuthenticationError(TokenService.TOKEN_MALFORMED, "bad", Map.of())));

        assertThat(guard.authenticateRequest("tok").errorOrNull().code()).isEqualTo(AccessGuard.UNAUTHORIZED);
    }

    @Test
    @DisplayName("authenticateRequest should fail UNAUTHORIZED when the subject was deleted")
    void authenticateRequest_shouldFailUnauthorized_whenSubjectOrphaned() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.success("ghost"));
        when(accountStore.getByUsername("ghost")).thenReturn(Optional.empty());

        Result<AccountView> result = guard.authenticateRequest("tok");

        assertThat(result.errorOrNull().code()).isEqualTo(AccessGuard.UNAUTHORIZED);
        assertThat(result.errorOrNull().message()).isEqualTo("Could not validate credentials");
    }

    @Test
    @DisplayName("authenticateRequest should fail UNAUTHORIZED without verifying when no token is given")
    void authenticateRequest_shouldFailUnauthorized_whenTokenMissing() {
        assertThat(guard.authenticateRequest(null).errorOrNull().code()).isEqualTo(AccessGuard.UNAUTHORIZED);
        assertThat(guard.authenticateRequest("  ").errorOrNull().code()).isEqualTo(AccessGuard.UNAUTHORIZED);
        verify(tokenService, never()).verify(anyString(), any());
    }

    // ========================================
    // authorize TESTS
    // ========================================

    @Test
    @DisplayName("authorize should reject a user when the admin role is required")
    void authorize_shouldFailInsufficientRole_whenRoleDiffers() {
        AccountView user = account(2, "john", Role.USER, true).toView();

        Result<AccountView> result = guard.authorize(user, AccessRequirement.role(Role.ADMIN));

        assertThat(result.errorOrNull())
            .isInstanceOf(UseCaseError.AuthorizationError.class)
            .extracting(UseCaseError::code).isEqualTo(AccessGuard.INSUFFICIENT_ROLE);
    }

    @Test
    @DisplayName("authorize should report inactivity before role, regardless of declaration order")
    void authorize_shouldCheckActiveBeforeRole() {
        AccountView inactiveUser = account(2, "john", Role.USER, false).toView();

        Result<AccountView> result = guard.authorize(inactiveUser,
            AccessRequirement.role(Role.ADMIN), AccessRequirement.active());

        assertThat(result.errorOrNull().code()).isEqualTo(AccessGuard.INACTIVE_ACCOUNT);
    }

    @Test
    @DisplayName("authorize should reject an inactive admin for inactivity")
    void authorize_shouldRejectInactiveAdmin() {
        AccountView inactiveAdmin = account(1, "root", Role.ADMIN, false).toView();

        Result<AccountView> result = guard.authorize(inactiveAdmin,
            AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        assertThat(result.errorOrNull().code()).isEqualTo(AccessGuard.INACTIVE_ACCOUNT);
    }

    @Test
    @DisplayName("authorize should pass an active admin through unchanged")
    void authorize_shouldSucceed_whenAllRequirementsMet() {
        AccountView admin = account(1, "root", Role.ADMIN, true).toView();

        Result<AccountView> result = guard.authorize(admin,
            AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        assertThat(result.orElseThrow()).isEqualTo(admin);
    }

    @Test
    @DisplayName("authorize with no requirements should always succeed")
    void authorize_shouldSucceed_whenNoRequirements() {
        AccountView inactive = account(3, "idle", Role.USER, false).toView();

        assertThat(guard.authorize(inactive).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("ownerOrRole should allow the owner and the role holder but nobody else")
    void authorize_ownerOrRole_shouldAllowOwnerOrRoleHolder() {
        AccountView owner = account(5, "owner", Role.USER, true).toView();
        AccountView other = account(6, "other", Role.USER, true).toView();
        AccountView admin = account(1, "root", Role.ADMIN, true).toView();

        AccessRequirement requirement = AccessRequirement.ownerOrRole(5, Role.ADMIN);

        assertThat(guard.authorize(owner, requirement).isSuccess()).isTrue();
        assertThat(guard.authorize(admin, requirement).isSuccess()).isTrue();
        assertThat(guard.authorize(other, requirement).errorOrNull().code()).isEqualTo(AccessGuard.INSUFFICIENT_ROLE);
    }

    // ========================================
    // require TESTS
    // ========================================

    @Test
    @DisplayName("require should not authorize when authentication fails")
    void require_shouldStopAtAuthentication_whenTokenInvalid() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.failure(
            new UseCaseError.AuthenticationError(TokenService.TOKEN_EXPIRED, "expired", Map.of())));

        Result<AccountView> result = guard.require("tok", AccessRequirement.role(Role.ADMIN));

        assertThat(result.errorOrNull().code()).isEqualTo(AccessGuard.UNAUTHORIZED);
    }

    @Test
    @DisplayName("require should authenticate then authorize")
    void require_shouldReturnForbidden_whenAuthenticatedButNotAdmin() {
        when(tokenService.verify("tok", NOW)).thenReturn(Result.success("john"));
        when(accountStore.getByUsername("john")).thenReturn(Optional.of(account(2, "john", Role.USER, true)));

        Result<AccountView> result = guard.require("tok", AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        assertThat(result.errorOrNull().code()).isEqualTo(AccessGuard.INSUFFICIENT_ROLE);
    }

    private static Account account(long id, String username, Role role, boolean active) {
        return new Account(id, username, username + "@x.com", null, role, active, "hash", NOW, null);
    }
}
