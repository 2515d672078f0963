package tech.demoserver.platform.product;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ProductCategory {
    ELECTRONICS,
    CLOTHING,
    BOOKS,
    HOME,
    SPORTS;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * Case-insensitive lookup by value.
     */
    public static Optional<ProductCategory> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ProductCategory category : values()) {
            if (category.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
