package tech.demoserver.app;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;

/**
 * Origins allowed to call the API from a browser.
 *
 * <pre>
 * demoserver.cors.allowed-origins=http://localhost:3000,http://localhost:8080
 * </pre>
 */
@ConfigMapping(prefix = "demoserver.cors")
public interface CorsConfig {

    @WithName("allowed-origins")
    @WithDefault("http://localhost:3000,http://localhost:8080")
    List<String> allowedOrigins();
}
