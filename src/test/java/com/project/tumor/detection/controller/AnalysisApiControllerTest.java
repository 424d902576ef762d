package com.project.tumor.detection.controller;

import com.project.tumor.detection.TestImages;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AnalysisApiControllerTest {

    @Autowired MockMvc mvc;

    private static MockMultipartFile diskPng() throws Exception {
        return new MockMultipartFile("file", "scan.png", "image/png",
                TestImages.pngBytes(TestImages.centeredDisk(), 256, 256));
    }

    @Test
    void analyze_returnsVerdictAndMarkedImageUrl() throws Exception {
        mvc.perform(multipart("/api/analyze").file(diskPng()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.resultado").value("procesado"))
                .andExpect(jsonPath("$.hay_tumor").value(true))
                .andExpect(jsonPath("$.imagen_marcada", allOf(containsString("/results/"), endsWith("_original.png"))));
    }

    @Test
    void analyze_withoutFile_isRejected() throws Exception {
        mvc.perform(multipart("/api/analyze"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No se encontró archivo"));
    }

    @Test
    void analyze_withDisallowedExtension_isRejected() throws Exception {
        MockMultipartFile txt = new MockMultipartFile("file", "notes.txt", "text/plain", "hi".getBytes());

        mvc.perform(multipart("/api/analyze").file(txt))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Archivo no válido"))
                .andExpect(jsonPath("$.hay_tumor").doesNotExist());
    }

    @Test
    void analyze_withCorruptImage_reportsDecodeFailure() throws Exception {
        MockMultipartFile broken = new MockMultipartFile("file", "broken.png", "image/png", new byte[]{1, 2, 3, 4});

        mvc.perform(multipart("/api/analyze").file(broken))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.resultado").value("error"))
                .andExpect(jsonPath("$.tipo").value("DECODE"))
                .andExpect(jsonPath("$.hay_tumor").doesNotExist());
    }

    @Test
    void pdfReport_isDownloadedAsAttachment() throws Exception {
        mvc.perform(multipart("/api/pdf-report").file(diskPng()))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", containsString("reporte_tumor.pdf")));
    }
}
