package tech.demoserver.platform.upload;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates and stores uploaded files under the configured directory.
 *
 * <p>Stored files get a random UUID name that keeps the original extension,
 * so client-supplied names never reach the filesystem.
 */
@ApplicationScoped
public class FileStorage {

    private static final Logger LOG = Logger.getLogger(FileStorage.class);

    public static final String MISSING_FILENAME = "MISSING_FILENAME";
    public static final String FILE_TYPE_NOT_ALLOWED = "FILE_TYPE_NOT_ALLOWED";
    public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";

    public static final String FILES_URL_PREFIX = "/files/";

    @Inject
    UploadConfig config;

    void onStart(@Observes StartupEvent event) {
        Path directory = directory();
        try {
            Files.createDirectories(directory);
            LOG.infof("Upload directory: %s", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create upload directory " + directory, e);
        }
    }

    /**
     * Check name, extension and size.
     *
     * @return the lower-case extension including the dot
     */
    public Result<String> validate(String filename, long size) {
        if (filename == null || filename.isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                MISSING_FILENAME, "No file name provided", Map.of()));
        }

        String extension = extensionOf(filename);
        if (!config.allowedExtensions().contains(extension)) {
            return Result.failure(new UseCaseError.ValidationError(
                FILE_TYPE_NOT_ALLOWED,
                "File type not allowed. Allowed types: " + String.join(", ", config.allowedExtensions()),
                Map.of("extension", extension)
            ));
        }

        if (size > config.maxFileSize()) {
            return Result.failure(new UseCaseError.ValidationError(
                FILE_TOO_LARGE,
                "File too large. Maximum size: " + maxFileSizeMb() + "MB",
                Map.of("size", size)
            ));
        }
        return Result.success(extension);
    }

    /**
     * Copy an already received temporary file into the upload directory.
     *
     * @return the generated stored name
     */
    public String store(Path source, String extension) throws IOException {
        String storedName = UUID.randomUUID() + extension;
        Files.copy(source, directory().resolve(storedName), StandardCopyOption.REPLACE_EXISTING);
        LOG.debugf("Stored upload as %s", storedName);
        return storedName;
    }

    /**
     * Locate a stored file. Names that would escape the upload directory
     * resolve to nothing.
     */
    public Optional<Path> resolve(String storedName) {
        if (storedName == null || storedName.isBlank()) {
            return Optional.empty();
        }
        Path directory = directory();
        Path candidate = directory.resolve(storedName).normalize();
        if (!directory.equals(candidate.getParent()) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    public long maxFileSizeMb() {
        return config.maxFileSize() / 1024 / 1024;
    }

    private Path directory() {
        return Path.of(config.directory()).toAbsolutePath().normalize();
    }

    static String extensionOf(String filename) {
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
