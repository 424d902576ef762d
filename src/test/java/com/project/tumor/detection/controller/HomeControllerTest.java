package com.project.tumor.detection.controller;

import com.project.tumor.detection.DTOs.ResultView;
import com.project.tumor.detection.TestImages;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HomeControllerTest {

    @Autowired MockMvc mvc;

    @Test
    void index_showsUploadForm() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attributeExists("allowedExtensions"));
    }

    @Test
    void upload_flow_works() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "scan.png", "image/png",
                TestImages.pngBytes(TestImages.centeredDisk(), 256, 256));

        MvcResult res = mvc.perform(multipart("/").file(img))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attribute("result", instanceOf(ResultView.class)))
                .andReturn();

        ResultView view = (ResultView) res.getModelAndView().getModel().get("result");
        assertThat(view.hasTumor()).isTrue();
        assertThat(view.imageShape()).containsExactly(256, 256);
        assertThat(view.originalImage()).startsWith("/uploads/");
        assertThat(view.resultImages()).hasSize(4).allSatisfy(p -> assertThat(p).startsWith("/results/"));
    }

    @Test
    void upload_withoutFile_showsError() throws Exception {
        mvc.perform(multipart("/"))
                .andExpect(status().isOk())
                .andExpect(model().attribute("error", "Seleccione un archivo para analizar."))
                .andExpect(model().attributeDoesNotExist("result"));
    }

    @Test
    void upload_corruptImage_showsDecodeError() throws Exception {
        MockMultipartFile broken = new MockMultipartFile("file", "broken.png", "image/png", new byte[]{1, 2, 3, 4});

        mvc.perform(multipart("/").file(broken))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attribute("errorKind", "DECODE"))
                .andExpect(model().attribute("error", containsString("broken")))
                .andExpect(model().attributeExists("allowedExtensions"))
                .andExpect(model().attributeDoesNotExist("result"));
    }

    @Test
    void upload_disallowedExtension_showsError() throws Exception {
        MockMultipartFile txt = new MockMultipartFile("file", "notes.txt", "text/plain", "hi".getBytes());

        mvc.perform(multipart("/").file(txt))
                .andExpect(status().isOk())
                .andExpect(view().name("index"))
                .andExpect(model().attributeExists("error"));
    }
}
