package tech.demoserver.platform.user;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.demoserver.platform.authentication.TokenService;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.NewAccount;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for UserResource.
 * Tests list/get/create/update/delete and the per-endpoint access rules.
 */
@Tag("integration")
@QuarkusTest
class UserResourceTest {

    @Inject
    AccountStore accountStore;

    @Inject
    TokenService tokenService;

    private String adminToken;
    private String userToken;
    private AccountView user;

    @BeforeEach
    void setUp() {
        adminToken = tokenService.issueAccessToken("admin").accessToken();

        String username = "member-" + System.nanoTime();
        user = accountStore.register(NewAccount.of(username, username + "@example.com", "secret1")).orElseThrow();
        userToken = tokenService.issueAccessToken(username).accessToken();
    }

    private static String uniqueName(String prefix) {
        return prefix + "-" + System.nanoTime();
    }

    // ==================== Authentication ====================

    @Test
    @DisplayName("Listing users without a token should return 401")
    void listUsers_shouldReturn401_whenNoToken() {
        given()
        .when()
            .get("/api/v1/users")
        .then()
            .statusCode(401)
            .header("WWW-Authenticate", "Bearer");
    }

    // ==================== List / Get ====================

    @Test
    @DisplayName("Any active user can list users")
    void listUsers_shouldReturnUsers_whenAuthenticated() {
        given()
            .header("Authorization", "Bearer " + userToken)
        .when()
            .get("/api/v1/users")
        .then()
            .statusCode(200)
            .body("size()", greaterThanOrEqualTo(2))
            .body("[0].username", equalTo("admin"))
            .body("[0]", not(hasKey("password_hash")));
    }

    @Test
    @DisplayName("Pagination should honour skip and limit")
    void listUsers_shouldPaginate() {
        given()
            .header("Authorization", "Bearer " + userToken)
            .queryParam("skip", 1)
            .queryParam("limit", 1)
        .when()
            .get("/api/v1/users")
        .then()
            .statusCode(200)
            .body("size()", equalTo(1))
            .body("[0].username", equalTo("john_doe"));
    }

    @Test
    @DisplayName("A limit of zero should be rejected with 400")
    void listUsers_shouldReturn400_whenLimitZero() {
        given()
            .header("Authorization", "Bearer " + userToken)
            .queryParam("limit", 0)
        .when()
            .get("/api/v1/users")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("A limit above 100 should be rejected with 400")
    void listUsers_shouldReturn400_whenLimitTooLarge() {
        given()
            .header("Authorization", "Bearer " + userToken)
            .queryParam("limit", 101)
        .when()
            .get("/api/v1/users")
        .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("Get should return the requested user")
    void getUser_shouldReturnUser_whenExists() {
        given()
            .header("Authorization", "Bearer " + userToken)
        .when()
            .get("/api/v1/users/" + user.id())
        .then()
            .statusCode(200)
            .body("id", equalTo((int) user.id()))
            .body("username", equalTo(user.username()));
    }

    @Test
    @DisplayName("Get should return 404 for an unknown id")
    void getUser_shouldReturn404_whenMissing() {
        given()
            .header("Authorization", "Bearer " + userToken)
        .when()
            .get("/api/v1/users/999999")
        .then()
            .statusCode(404)
            .body("code", equalTo("ACCOUNT_NOT_FOUND"))
            .body("message", equalTo("User not found"));
    }

    // ==================== Create ====================

    @Test
    @DisplayName("A plain user should not be able to create users")
    void createUser_shouldReturn403_whenNotAdmin() {
        String username = uniqueName("blocked");

        given()
            .header("Authorization", "Bearer " + userToken)
            .contentType(ContentType.JSON)
            .body(Map.of("username", username, "email", username + "@example.com", "password", "secret1"))
        .when()
            .post("/api/v1/users")
        .then()
            .statusCode(403)
            .body("code", equalTo("INSUFFICIENT_ROLE"))
            .body("message", equalTo("Not enough permissions"));
    }

    @Test
    @DisplayName("An admin can create a user with any role")
    void createUser_shouldCreateModerator_whenAdmin() {
        String username = uniqueName("mod");

        given()
            .header("Authorization", "Bearer " + adminToken)
            .contentType(ContentType.JSON)
            .body(Map.of(
                "username", username,
                "email", username + "@example.com",
                "password", "secret1",
                "role", "moderator"))
        .when()
            .post("/api/v1/users")
        .then()
            .statusCode(200)
            .body("username", equalTo(username))
            .body("role", equalTo("moderator"))
            .body("is_active", equalTo(true));
    }

    @Test
    @DisplayName("Creating a user with a taken username should return 409")
    void createUser_shouldReturn409_whenDuplicateUsername() {
        given()
            .header("Authorization", "Bearer " + adminToken)
            .contentType(ContentType.JSON)
            .body(Map.of("username", "john_doe", "email", uniqueName("dup") + "@example.com", "password", "secret1"))
        .when()
            .post("/api/v1/users")
        .then()
            .statusCode(409)
            .body("code", equalTo("DUPLICATE_USERNAME"));
    }

    // ==================== Update ====================

    @Test
    @DisplayName("Users can update their own profile")
    void updateUser_shouldUpdate_whenSelf() {
        given()
            .header("Authorization", "Bearer " + userToken)
            .contentType(ContentType.JSON)
            .body(Map.of("full_name", "Renamed Member"))
        .when()
            .put("/api/v1/users/" + user.id())
        .then()
            .statusCode(200)
            .body("full_name", equalTo("Renamed Member"))
            .body("email", equalTo(user.email()))
            .body("updated_at", notNullValue());
    }

    @Test
    @DisplayName("Users can not update someone else")
    void updateUser_shouldReturn403_whenOtherUser() {
        given()
            .header("Authorization", "Bearer " + userToken)
            .contentType(ContentType.JSON)
            .body(Map.of("full_name", "Hijacked"))
        .when()
            .put("/api/v1/users/1")
        .then()
            .statusCode(403)
            .body("code", equalTo("INSUFFICIENT_ROLE"));
    }

    @Test
    @DisplayName("Admins can update any user")
    void updateUser_shouldUpdate_whenAdmin() {
        given()
            .header("Authorization", "Bearer " + adminToken)
            .contentType(ContentType.JSON)
            .body(Map.of("role", "moderator"))
        .when()
            .put("/api/v1/users/" + user.id())
        .then()
            .statusCode(200)
            .body("role", equalTo("moderator"));
    }

    @Test
    @DisplayName("Updating an unknown user as admin should return 404")
    void updateUser_shouldReturn404_whenMissing() {
        given()
            .header("Authorization", "Bearer " + adminToken)
            .contentType(ContentType.JSON)
            .body(Map.of("full_name", "Nobody"))
        .when()
            .put("/api/v1/users/999999")
        .then()
            .statusCode(404)
            .body("code", equalTo("ACCOUNT_NOT_FOUND"));
    }

    // ==================== Delete ====================

    @Test
    @DisplayName("A plain user can not delete users")
    void deleteUser_shouldReturn403_whenNotAdmin() {
        given()
            .header("Authorization", "Bearer " + userToken)
        .when()
            .delete("/api/v1/users/" + user.id())
        .then()
            .statusCode(403);
    }

    @Test
    @DisplayName("An admin can delete a user, after which it is gone")
    void deleteUser_shouldDelete_whenAdmin() {
        given()
            .header("Authorization", "Bearer " + adminToken)
        .when()
            .delete("/api/v1/users/" + user.id())
        .then()
            .statusCode(200)
            .body("message", equalTo("User deleted successfully"))
            .body("success", equalTo(true));

        given()
            .header("Authorization", "Bearer " + adminToken)
        .when()
            .get("/api/v1/users/" + user.id())
        .then()
            .statusCode(404);
    }

    @Test
    @DisplayName("Deleting an unknown user should return 404")
    void deleteUser_shouldReturn404_whenMissing() {
        given()
            .header("Authorization", "Bearer " + adminToken)
        .when()
            .delete("/api/v1/users/999999")
        .then()
            .statusCode(404)
            .body("message", equalTo("User not found"));
    }
}
