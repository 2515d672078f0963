package tech.demoserver.platform.bootstrap;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.principal.AccountStore;
import tech.demoserver.platform.principal.AccountView;
import tech.demoserver.platform.principal.NewAccount;
import tech.demoserver.platform.principal.Role;
import tech.demoserver.platform.product.NewProduct;
import tech.demoserver.platform.product.ProductCatalog;
import tech.demoserver.platform.product.ProductCategory;

import java.util.List;

/**
 * Seeds demo data on startup.
 *
 * Creates:
 * - admin / admin123 with the admin role
 * - john_doe / user123 with the user role
 * - three sample products, when the catalog is empty
 *
 * Disable with {@code demoserver.bootstrap.enabled=false}. Accounts that
 * already exist are left alone, so running twice is harmless.
 */
@ApplicationScoped
public class BootstrapService {

    private static final Logger LOG = Logger.getLogger(BootstrapService.class);

    static final List<NewAccount> DEMO_ACCOUNTS = List.of(
        new NewAccount("admin", "admin@example.com", "admin123", "Administrator", Role.ADMIN, true),
        new NewAccount("john_doe", "john@example.com", "user123", "John Doe", Role.USER, true)
    );

    static final List<NewProduct> SAMPLE_PRODUCTS = List.of(
        new NewProduct("MacBook Pro", "Apple MacBook Pro 16-inch with M2 chip", 2499.99,
            ProductCategory.ELECTRONICS, true, 10),
        new NewProduct("Nike Air Max", "Comfortable running shoes", 120.00,
            ProductCategory.SPORTS, true, 25),
        new NewProduct("Python Programming Book", "Learn Python programming from scratch", 29.99,
            ProductCategory.BOOKS, true, 50)
    );

    @ConfigProperty(name = "demoserver.bootstrap.enabled", defaultValue = "true")
    boolean enabled;

    @Inject
    AccountStore accountStore;

    @Inject
    ProductCatalog productCatalog;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.debug("Bootstrap disabled - skipping demo data");
            return;
        }

        LOG.info("=== BOOTSTRAP SERVICE ===");
        try {
            seedAccounts();
            seedProducts();
            LOG.infof("Bootstrap completed: %d accounts, %d products",
                accountStore.count(), productCatalog.count());
        } catch (Exception e) {
            LOG.error("Bootstrap failed: " + e.getMessage(), e);
        }
        LOG.info("=========================");
    }

    void seedAccounts() {
        for (NewAccount account : DEMO_ACCOUNTS) {
            Result<AccountView> result = accountStore.register(account);
            if (result instanceof Result.Failure<AccountView> f) {
                LOG.infof("Demo account '%s' not created: %s", account.username(), f.error().code());
            } else {
                LOG.infof("Created demo account: %s (%s)", account.username(), account.role().value());
            }
        }
    }

    void seedProducts() {
        if (productCatalog.count() > 0) {
            LOG.debug("Catalog already has products - skipping samples");
            return;
        }
        for (NewProduct product : SAMPLE_PRODUCTS) {
            productCatalog.create(product).orElseThrow();
        }
        LOG.infof("Created %d sample products", SAMPLE_PRODUCTS.size());
    }
}
