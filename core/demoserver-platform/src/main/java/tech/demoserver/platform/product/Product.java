package tech.demoserver.platform.product;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Catalog product")
public record Product(
    long id,
    @Schema(example = "MacBook Pro")
    String name,
    String description,
    @Schema(example = "2499.99")
    double price,
    ProductCategory category,
    @JsonProperty("in_stock")
    boolean inStock,
    @JsonProperty("stock_quantity")
    int stockQuantity,
    @JsonProperty("created_at")
    Instant createdAt,
    @JsonProperty("updated_at")
    Instant updatedAt
) {

    Product applying(ProductUpdate update, Instant now) {
        return new Product(
            id,
            update.name().orElse(name),
            update.description().orElse(description),
            update.price().orElse(price),
            update.category().orElse(category),
            update.inStock().orElse(inStock),
            update.stockQuantity().orElse(stockQuantity),
            createdAt,
            now.isBefore(createdAt) ? createdAt : now
        );
    }

    boolean matches(String lowerCaseQuery) {
        return name.toLowerCase().contains(lowerCaseQuery)
            || (description != null && description.toLowerCase().contains(lowerCaseQuery));
    }
}
