package tech.demoserver.platform.product;

import java.util.Objects;

/**
 * Input to {@link ProductCatalog#create(NewProduct)}.
 */
public record NewProduct(
    String name,
    String description,
    double price,
    ProductCategory category,
    boolean inStock,
    int stockQuantity
) {

    public NewProduct {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
    }
}
