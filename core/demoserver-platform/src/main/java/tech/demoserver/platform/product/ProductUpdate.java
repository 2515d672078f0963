package tech.demoserver.platform.product;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial product update; only present fields are applied.
 */
public record ProductUpdate(
    Optional<String> name,
    Optional<String> description,
    Optional<Double> price,
    Optional<ProductCategory> category,
    Optional<Boolean> inStock,
    Optional<Integer> stockQuantity
) {

    public ProductUpdate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(inStock, "inStock");
        Objects.requireNonNull(stockQuantity, "stockQuantity");
    }

    public static ProductUpdate ofNullable(String name, String description, Double price,
                                           ProductCategory category, Boolean inStock, Integer stockQuantity) {
        return new ProductUpdate(
            Optional.ofNullable(name),
            Optional.ofNullable(description),
            Optional.ofNullable(price),
            Optional.ofNullable(category),
            Optional.ofNullable(inStock),
            Optional.ofNullable(stockQuantity)
        );
    }
}
