package tech.demoserver.app;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Demo Server startup handler.
 *
 * <p>This deployment includes demoserver-platform: accounts, token login,
 * access control, products, uploads and the misc endpoints. Demo data is
 * seeded by the platform's bootstrap service.</p>
 */
@ApplicationScoped
public class AppStartup {

    private static final Logger LOG = Logger.getLogger(AppStartup.class);

    @ConfigProperty(name = "demoserver.app-name", defaultValue = "Demo Server")
    String appName;

    @ConfigProperty(name = "demoserver.version", defaultValue = "1.0.0")
    String version;

    @ConfigProperty(name = "demoserver.api-prefix", defaultValue = "/api/v1")
    String apiPrefix;

    void onStart(@Observes StartupEvent event) {
        LOG.infof("%s %s started - API at %s, docs at /docs", appName, version, apiPrefix);
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.infof("%s shutdown", appName);
    }
}
