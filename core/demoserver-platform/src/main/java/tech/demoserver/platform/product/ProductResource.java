package tech.demoserver.platform.product;

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
import tech.demoserver.platform.authorization.AccessContext;
import tech.demoserver.platform.authorization.AccessRequirement;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;
import tech.demoserver.platform.common.api.ApiResponses.MessageResponse;
import tech.demoserver.platform.common.api.ErrorResponses;
import tech.demoserver.platform.principal.Role;

import java.util.List;
import java.util.Optional;

/**
 * Product catalog. Reads are public, writes need an active admin.
 */
@Path("/api/v1/products")
@Tag(name = "Products", description = "Product catalog")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ProductResource {

    @Inject
    ProductCatalog catalog;

    @Inject
    AccessContext accessContext;

    @GET
    @Operation(summary = "List products", description = "Optionally filtered by category and stock status")
    @APIResponse(responseCode = "200", description = "Products")
    @APIResponse(responseCode = "400", description = "Unknown category")
    public Response listProducts(
            @QueryParam("skip") @DefaultValue("0") @Min(0) int skip,
            @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(100) int limit,
            @Parameter(description = "electronics, clothing, books, home or sports")
            @QueryParam("category") String category,
            @QueryParam("in_stock") Boolean inStock) {
        Optional<ProductCategory> categoryFilter = Optional.empty();
        if (category != null && !category.isBlank()) {
            categoryFilter = ProductCategory.parse(category);
            if (categoryFilter.isEmpty()) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponse("INVALID_CATEGORY", "Unknown category: " + category))
                        .build();
            }
        }
        return Response.ok(catalog.list(skip, limit, categoryFilter, Optional.ofNullable(inStock))).build();
    }

    @GET
    @Path("/search")
    @Operation(summary = "Search products by name or description")
    public List<Product> searchProducts(@QueryParam("q") @NotBlank String q) {
        return catalog.search(q);
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get product by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Product found",
            content = @Content(schema = @Schema(implementation = Product.class))),
        @APIResponse(responseCode = "404", description = "Product not found")
    })
    public Response getProduct(@PathParam("id") long id) {
        return catalog.getById(id)
                .map(product -> Response.ok(product).build())
                .orElseGet(ProductResource::productNotFound);
    }

    @POST
    @Operation(summary = "Create a product (admin only)")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Product created",
            content = @Content(schema = @Schema(implementation = Product.class))),
        @APIResponse(responseCode = "400", description = "Invalid product"),
        @APIResponse(responseCode = "403", description = "Not an admin")
    })
    public Response createProduct(@Valid @NotNull CreateProductRequest request) {
        accessContext.require(AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        Result<Product> result = catalog.create(request.toNewProduct());
        if (result instanceof Result.Failure<Product> f) {
            return ErrorResponses.toResponse(f.error());
        }
        return Response.ok(result.orElseThrow()).build();
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update a product (admin only)", description = "Only the supplied fields change")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Product updated",
            content = @Content(schema = @Schema(implementation = Product.class))),
        @APIResponse(responseCode = "403", description = "Not an admin"),
        @APIResponse(responseCode = "404", description = "Product not found")
    })
    public Response updateProduct(@PathParam("id") long id, @NotNull UpdateProductRequest request) {
        accessContext.require(AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        Result<Product> result = catalog.update(id, request.toUpdate());
        if (result instanceof Result.Failure<Product> f) {
            return ErrorResponses.toResponse(f.error());
        }
        return Response.ok(result.orElseThrow()).build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a product (admin only)")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Product deleted",
            content = @Content(schema = @Schema(implementation = MessageResponse.class))),
        @APIResponse(responseCode = "404", description = "Product not found")
    })
    public Response deleteProduct(@PathParam("id") long id) {
        accessContext.require(AccessRequirement.active(), AccessRequirement.role(Role.ADMIN));

        if (!catalog.delete(id)) {
            return productNotFound();
        }
        return Response.ok(new MessageResponse("Product deleted successfully")).build();
    }

    private static Response productNotFound() {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(ProductCatalog.PRODUCT_NOT_FOUND, "Product not found"))
                .build();
    }

    // ==================== DTOs ====================

    public record CreateProductRequest(
            @NotBlank String name,
            String description,
            @NotNull Double price,
            @NotNull ProductCategory category,
            @JsonProperty("in_stock") Boolean inStock,
            @JsonProperty("stock_quantity") Integer stockQuantity
    ) {
        NewProduct toNewProduct() {
            return new NewProduct(
                    name,
                    description,
                    price,
                    category,
                    inStock == null || inStock,
                    stockQuantity == null ? 0 : stockQuantity
            );
        }
    }

    public record UpdateProductRequest(
            String name,
            String description,
            Double price,
            ProductCategory category,
            @JsonProperty("in_stock") Boolean inStock,
            @JsonProperty("stock_quantity") Integer stockQuantity
    ) {
        ProductUpdate toUpdate() {
            return ProductUpdate.ofNullable(name, description, price, category, inStock, stockQuantity);
        }
    }
}
