package com.project.tumor.detection.service;

import com.project.tumor.detection.config.StorageProperties;
import com.project.tumor.detection.exceptions.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {

    @TempDir
    Path tmp;

    private StorageService newStorage() {
        return new StorageService(new StorageProperties(
                tmp.resolve("uploads").toString(), tmp.resolve("results").toString()));
    }

    @Test
    void constructor_createsBothDirectories() {
        StorageService storage = newStorage();
        assertThat(Files.isDirectory(tmp.resolve("uploads"))).isTrue();
        assertThat(Files.isDirectory(storage.resultsDir())).isTrue();
    }

    @Test
    void store_writesFileWithUniqueName() throws Exception {
        StorageService storage = newStorage();
        MockMultipartFile file = new MockMultipartFile("file", "brain scan.png", "image/png", new byte[]{1, 2, 3, 4});

        var stored = storage.store(file);

        assertThat(Files.readAllBytes(stored.path())).containsExactly(1, 2, 3, 4);
        assertThat(stored.filename()).matches("\\d{8}_\\d{6}_\\d{3}_brain_scan\\.png");
        assertThat(stored.relativeWebPath()).isEqualTo("uploads/" + stored.filename());
        assertThat(stored.baseName()).endsWith("_brain_scan");
    }

    @Test
    void store_rejectsDisallowedExtension() {
        StorageService storage = newStorage();
        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());
        assertThatThrownBy(() -> storage.store(notImage)).isInstanceOf(StorageException.class);
    }

    @Test
    void store_rejectsEmptyUpload() {
        StorageService storage = newStorage();
        MockMultipartFile empty = new MockMultipartFile("file", "scan.dcm", "application/dicom", new byte[0]);
        assertThatThrownBy(() -> storage.store(empty)).isInstanceOf(StorageException.class);
    }

    @Test
    void sanitize_dropsDirectoriesAndOddCharacters() {
        assertThat(StorageService.sanitize("../../etc/pa ss.png")).isEqualTo("pa_ss.png");
        assertThat(StorageService.sanitize("..hidden.jpg")).isEqualTo("hidden.jpg");
    }

    @Test
    void resultWebPath_pointsIntoResults() {
        StorageService storage = newStorage();
        assertThat(storage.resultWebPath(storage.resultsDir().resolve("a_mask.png"))).isEqualTo("results/a_mask.png");
    }
}
