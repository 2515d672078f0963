package tech.demoserver.platform.upload;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FileStorage.
 */
@ExtendWith(MockitoExtension.class)
class FileStorageTest {

    @TempDir
    Path uploadDir;

    @Mock
    private UploadConfig config;

    @InjectMocks
    private FileStorage storage;

    @BeforeEach
    void setUp() {
        lenient().when(config.directory()).thenReturn(uploadDir.toString());
        lenient().when(config.maxFileSize()).thenReturn(1024L * 1024L);
        lenient().when(config.allowedExtensions()).thenReturn(List.of(".txt", ".png", ".pdf"));
    }

    // ========================================
    // validate TESTS
    // ========================================

    @Test
    @DisplayName("validate should return the lower-case extension for an allowed file")
    void validate_shouldReturnExtension_whenAllowed() {
        Result<String> result = storage.validate("Report.PDF", 100);

        assertThat(result).isInstanceOf(Result.Success.class);
        assertThat(result.orElseThrow()).isEqualTo(".pdf");
    }

    @Test
    @DisplayName("validate should reject a missing file name")
    void validate_shouldFail_whenNameMissing() {
        assertThat(storage.validate(null, 1).errorOrNull().code()).isEqualTo(FileStorage.MISSING_FILENAME);
        assertThat(storage.validate("  ", 1).errorOrNull().code()).isEqualTo(FileStorage.MISSING_FILENAME);
    }

    @Test
    @DisplayName("validate should reject extensions outside the allow list")
    void validate_shouldFail_whenExtensionNotAllowed() {
        // Act
        UseCaseError error = storage.validate("virus.exe", 10).errorOrNull();

        // Assert
        assertThat(error).isInstanceOf(UseCaseError.ValidationError.class);
        assertThat(error.code()).isEqualTo(FileStorage.FILE_TYPE_NOT_ALLOWED);
        assertThat(error.message()).contains(".txt, .png, .pdf");
    }

    @Test
    @DisplayName("validate should reject files without an extension")
    void validate_shouldFail_whenNoExtension() {
        assertThat(storage.validate("Makefile", 10).errorOrNull().code())
            .isEqualTo(FileStorage.FILE_TYPE_NOT_ALLOWED);
    }

    @Test
    @DisplayName("validate should reject files above the size limit")
    void validate_shouldFail_whenTooLarge() {
        // Act
        UseCaseError error = storage.validate("big.png", 1024L * 1024L + 1).errorOrNull();

        // Assert
        assertThat(error.code()).isEqualTo(FileStorage.FILE_TOO_LARGE);
        assertThat(error.message()).isEqualTo("File too large. Maximum size: 1MB");
    }

    @Test
    @DisplayName("validate should accept a file exactly at the size limit")
    void validate_shouldAccept_whenExactlyAtLimit() {
        assertThat(storage.validate("ok.png", 1024L * 1024L)).isInstanceOf(Result.Success.class);
    }

    // ========================================
    // store / resolve TESTS
    // ========================================

    @Test
    @DisplayName("store should copy the file under a generated name that resolve can find")
    void store_shouldCopyUnderGeneratedName() throws Exception {
        // Arrange
        Path source = Files.createTempFile("upload", ".tmp");
        Files.writeString(source, "hello", StandardCharsets.UTF_8);

        // Act
        String storedName = storage.store(source, ".txt");
        Optional<Path> resolved = storage.resolve(storedName);

        // Assert
        assertThat(storedName).endsWith(".txt").hasSize(36 + 4);
        assertThat(resolved).isPresent();
        assertThat(Files.readString(resolved.get(), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    @DisplayName("resolve should not escape the upload directory")
    void resolve_shouldRejectTraversal() throws Exception {
        // Arrange
        Path outside = uploadDir.getParent().resolve("secret-" + System.nanoTime() + ".txt");
        Files.writeString(outside, "secret");

        try {
            // Act & Assert
            assertThat(storage.resolve("../" + outside.getFileName())).isEmpty();
            assertThat(storage.resolve("missing.txt")).isEmpty();
            assertThat(storage.resolve("")).isEmpty();
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    @DisplayName("maxFileSizeMb should report whole megabytes")
    void maxFileSizeMb_shouldConvertBytes() {
        assertThat(storage.maxFileSizeMb()).isEqualTo(1);
    }

    @Test
    @DisplayName("extensionOf should ignore directories and dotfiles")
    void extensionOf_shouldHandleEdgeCases() {
        assertThat(FileStorage.extensionOf("photo.JPG")).isEqualTo(".jpg");
        assertThat(FileStorage.extensionOf("archive.tar.gz")).isEqualTo(".gz");
        assertThat(FileStorage.extensionOf("dir.d/readme")).isEmpty();
        assertThat(FileStorage.extensionOf(".bashrc")).isEmpty();
        assertThat(FileStorage.extensionOf("C:\\docs\\cv.pdf")).isEqualTo(".pdf");
    }
}
