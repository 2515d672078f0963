package tech.demoserver.platform.authentication;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.demoserver.platform.authorization.AccessContext;
import tech.demoserver.platform.authorization.AccessRequirement;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;
import tech.demoserver.platform.common.api.ErrorResponses;
import tech.demoserver.platform.principal.Account;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.NewAccount;
import tech.demoserver.platform.principal.Role;

/**
 * Login, self-registration and "who am I".
 */
@Path("/api/v1/auth")
@Tag(name = "Authentication", description = "Token login and registration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    static final String BAD_CREDENTIALS = "Incorrect username or password";

    @Inject
    AccountStore accountStore;

    @Inject
    TokenService tokenService;

    @Inject
    AccessContext accessContext;

    /**
     * OAuth2 password-grant style login. Both unknown usernames and wrong
     * passwords get the same 401.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Login with username and password to get an access token")
    @APIResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = IssuedToken.class)))
    @APIResponse(responseCode = "401", description = "Invalid credentials")
    public Response login(@FormParam("username") String username, @FormParam("password") String password) {
        Result<Account> result = accountStore.authenticate(username, password);
        if (result instanceof Result.Failure<Account> f) {
            LOG.infof("Login failed for '%s': %s", username, f.error().code());
            return Response.status(Response.Status.UNAUTHORIZED)
                    .header(HttpHeaders.WWW_AUTHENTICATE, ErrorResponses.BEARER_CHALLENGE)
                    .entity(new ErrorResponse("INVALID_CREDENTIALS", BAD_CREDENTIALS))
                    .build();
        }

        Account account = result.orElseThrow();
        IssuedToken token = tokenService.issueAccessToken(account.username());
        LOG.infof("Login successful for user: %s", account.username());
        return Response.ok(token).build();
    }

    /**
     * Public self-registration. New accounts always get the {@code user} role.
     */
    @POST
    @Path("/register")
    @Operation(summary = "Register a new user account")
    @APIResponse(responseCode = "200", description = "Account created",
            content = @Content(schema = @Schema(implementation = AccountView.class)))
    @APIResponse(responseCode = "400", description = "Invalid input or weak password")
    @APIResponse(responseCode = "409", description = "Username or email already registered")
    public Response register(@Valid @NotNull RegisterRequest request) {
        NewAccount newAccount = new NewAccount(
                request.username(),
                request.email(),
                request.password(),
                request.fullName(),
                Role.USER,
                true
        );

        Result<AccountView> result = accountStore.register(newAccount);
        if (result instanceof Result.Failure<AccountView> f) {
            LOG.infof("Registration rejected for '%s': %s", request.username(), f.error().code());
            return ErrorResponses.toResponse(f.error());
        }
        return Response.ok(result.orElseThrow()).build();
    }

    @GET
    @Path("/me")
    @Operation(summary = "Get the current user's profile")
    @APIResponse(responseCode = "200", description = "Current user",
            content = @Content(schema = @Schema(implementation = AccountView.class)))
    @APIResponse(responseCode = "401", description = "Missing or invalid token")
    @APIResponse(responseCode = "403", description = "Inactive user")
    public AccountView me() {
        return accessContext.require(AccessRequirement.active());
    }

    // ==================== DTOs ====================

    public record RegisterRequest(
            @NotBlank String username,
            @NotBlank String email,
            @NotNull String password,
            @JsonProperty("full_name") String fullName
    ) {}
}
