package tech.demoserver.platform.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.demoserver.platform.authorization.AccessContext;
import tech.demoserver.platform.authorization.AccessRequirement;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;
import tech.demoserver.platform.common.api.ApiResponses.MessageResponse;
import tech.demoserver.platform.common.api.ErrorResponses;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountUpdate;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.NewAccount;
import tech.demoserver.platform.principal.Role;

import java.util.List;

/**
 * User management.
 *
 * <ul>
 *   <li>Reads need an active account</li>
 *   <li>Users may update themselves; admins may update anyone</li>
 *   <li>Create and delete are admin only</li>
 * </ul>
 */
@Path("/api/v1/users")
@Tag(name = "Users", description = "User management")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

    private static final Logger LOG = Logger.getLogger(UserResource.class);

    @Inject
    AccountStore accountStore;

    @Inject
    AccessContext accessContext;

    // ==================== List / Get ====================

    @GET
    @Operation(summary = "List users", description = "Users in creation order, paginated")
    @APIResponse(responseCode = "200", description = "Users")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    public List<AccountView> listUsers(
            @Parameter(description = "Number of users to skip")
            @QueryParam("skip") @DefaultValue("0") @Min(0) int skip,
            @Parameter(description = "Maximum number of users to return")
            @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(100) int limit) {
        accessContext.require(AccessRequirement.active());
        return accountStore.list(skip, limit);
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get user by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User found",
            content = @Content(schema = @Schema(implementation = AccountView.class))),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public Response getUser(@PathParam("id") long id) {
        accessContext.require(AccessRequirement.active());
        return accountStore.getById(id)
                .map(user -> Response.ok(user).build())
                .orElseGet(UserResource::userNotFound);
    }

    // ==================== Create ====================

    @POST
    @Operation(summary = "Create a user (admin only)")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User created",
            content = @Content(schema = @Schema(implementation = AccountView.class))),
        @APIResponse(responseCode = "400", description = "Invalid request or weak password"),
        @APIResponse(responseCode = "403", description = "Not an admin"),
        @APIResponse(responseCode = "409", description = "Username or email already registered")
    })
    public Response createUser(@Valid @NotNull CreateUserRequest request) {
        AccountView admin = accessContext.require(AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        Result<AccountView> result = accountStore.register(new NewAccount(
                request.username(),
                request.email(),
                request.password(),
                request.fullName(),
                request.role(),
                request.active() == null || request.active()
        ));
        if (result instanceof Result.Failure<AccountView> f) {
            return ErrorResponses.toResponse(f.error());
        }

        AccountView created = result.orElseThrow();
        LOG.infof("User '%s' created by admin '%s'", created.username(), admin.username());
        return Response.ok(created).build();
    }

    // ==================== Update ====================

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update a user", description = "Only the supplied fields change")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User updated",
            content = @Content(schema = @Schema(implementation = AccountView.class))),
        @APIResponse(responseCode = "403", description = "Not the same user and not an admin"),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public Response updateUser(@PathParam("id") long id, @NotNull UpdateUserRequest request) {
        accessContext.require(AccessRequirement.active(), AccessRequirement.ownerOrRole(id, Role.ADMIN));

        Result<AccountView> result = accountStore.update(id, request.toUpdate());
        if (result instanceof Result.Failure<AccountView> f) {
            return ErrorResponses.toResponse(f.error());
        }
        LOG.infof("User id=%d updated by '%s'", id,
                accessContext.currentPrincipal().map(AccountView::username).orElse("unknown"));
        return Response.ok(result.orElseThrow()).build();
    }

    // ==================== Delete ====================

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a user (admin only)")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User deleted",
            content = @Content(schema = @Schema(implementation = MessageResponse.class))),
        @APIResponse(responseCode = "403", description = "Not an admin"),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public Response deleteUser(@PathParam("id") long id) {
        AccountView admin = accessContext.require(AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        if (!accountStore.delete(id)) {
            return userNotFound();
        }
        LOG.infof("User id=%d deleted by admin '%s'", id, admin.username());
        return Response.ok(new MessageResponse("User deleted successfully")).build();
    }

    private static Response userNotFound() {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(AccountStore.ACCOUNT_NOT_FOUND, "User not found"))
                .build();
    }

    // ==================== DTOs ====================

    public record CreateUserRequest(
            @NotBlank String username,
            @NotBlank String email,
            @NotNull String password,
            @JsonProperty("full_name") String fullName,
            Role role,
            @JsonProperty("is_active") Boolean active
    ) {}

    /**
     * Every field is optional; absent fields are left untouched.
     */
    public record UpdateUserRequest(
            String email,
            @JsonProperty("full_name") String fullName,
            Role role,
            @JsonProperty("is_active") Boolean active
    ) {
        AccountUpdate toUpdate() {
            return AccountUpdate.ofNullable(email, fullName, role, active);
        }
    }
}
