package tech.demoserver.platform.upload;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;

/**
 * File upload limits and storage location.
 *
 * <pre>
 * demoserver.upload.directory=uploads
 * demoserver.upload.max-file-size=10485760
 * demoserver.upload.max-files-per-request=5
 * </pre>
 */
@ConfigMapping(prefix = "demoserver.upload")
public interface UploadConfig {

    /**
     * Directory uploaded files are written to. Created on startup if missing.
     */
    @WithDefault("uploads")
    String directory();

    /**
     * Maximum size of a single file in bytes. Default: 10 MiB
     */
    @WithName("max-file-size")
    @WithDefault("10485760")
    long maxFileSize();

    @WithName("max-files-per-request")
    @WithDefault("5")
    int maxFilesPerRequest();

    /**
     * Lower-case extensions including the leading dot.
     */
    @WithName("allowed-extensions")
    @WithDefault(".jpg,.jpeg,.png,.gif,.pdf,.txt,.docx,.xlsx")
    List<String> allowedExtensions();
}
