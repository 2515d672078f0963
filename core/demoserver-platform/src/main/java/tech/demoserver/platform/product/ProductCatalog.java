package tech.demoserver.platform.product;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory product catalog. Same locking and id policy as the account store:
 * one read/write lock, ids from 1, never reused.
 */
@ApplicationScoped
public class ProductCatalog {

    private static final Logger LOG = Logger.getLogger(ProductCatalog.class);

    public static final String PRODUCT_NOT_FOUND = "PRODUCT_NOT_FOUND";
    public static final String INVALID_PRICE = "INVALID_PRICE";
    public static final String INVALID_STOCK_QUANTITY = "INVALID_STOCK_QUANTITY";

    @Inject
    Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Product> products = new ArrayList<>();
    private long nextId = 1;

    public Result<Product> create(NewProduct request) {
        UseCaseError invalid = validate(request.price(), request.stockQuantity());
        if (invalid != null) {
            return Result.failure(invalid);
        }

        lock.writeLock().lock();
        try {
            Product product = new Product(
                nextId++,
                request.name(),
                request.description(),
                request.price(),
                request.category(),
                request.inStock(),
                request.stockQuantity(),
                clock.instant(),
                null
            );
            products.add(product);
            LOG.debugf("Created product id=%d '%s'", product.id(), product.name());
            return Result.success(product);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Product> getById(long id) {
        lock.readLock().lock();
        try {
            return products.stream().filter(p -> p.id() == id).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Filter, then paginate. Empty filters match everything.
     */
    public List<Product> list(int skip, int limit, Optional<ProductCategory> category, Optional<Boolean> inStock) {
        lock.readLock().lock();
        try {
            return products.stream()
                .filter(p -> category.isEmpty() || p.category() == category.get())
                .filter(p -> inStock.isEmpty() || p.inStock() == inStock.get())
                .skip(Math.max(skip, 0))
                .limit(Math.max(limit, 0))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Case-insensitive substring match over name and description.
     */
    public List<Product> search(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        lock.readLock().lock();
        try {
            return products.stream()
                .filter(p -> p.matches(needle))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Result<Product> update(long id, ProductUpdate update) {
        UseCaseError invalid = validate(update.price().orElse(0.0), update.stockQuantity().orElse(0));
        if (invalid != null) {
            return Result.failure(invalid);
        }

        lock.writeLock().lock();
        try {
            for (int i = 0; i < products.size(); i++) {
                if (products.get(i).id() == id) {
                    Product updated = products.get(i).applying(update, clock.instant());
                    products.set(i, updated);
                    return Result.success(updated);
                }
            }
            return Result.failure(new UseCaseError.NotFoundError(
                PRODUCT_NOT_FOUND, "Product not found", Map.of("id", id)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean delete(long id) {
        lock.writeLock().lock();
        try {
            boolean removed = products.removeIf(p -> p.id() == id);
            if (removed) {
                LOG.infof("Deleted product id=%d", id);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return products.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static UseCaseError validate(double price, int stockQuantity) {
        if (price < 0 || Double.isNaN(price)) {
            return new UseCaseError.ValidationError(INVALID_PRICE, "Price must be positive", Map.of("price", price));
        }
        if (stockQuantity < 0) {
            return new UseCaseError.ValidationError(
                INVALID_STOCK_QUANTITY, "Stock quantity can not be negative", Map.of("stockQuantity", stockQuantity));
        }
        return null;
    }
}
