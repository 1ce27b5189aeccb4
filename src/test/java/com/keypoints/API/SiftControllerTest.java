package com.keypoints.API;

import com.keypoints.SIFT.PipelineState;
import com.keypoints.SIFT.SiftParameters;
import com.keypoints.SIFT.SiftPipeline;
import com.keypoints.SIFT.TileExecutor;
import com.keypoints.imageOperation.FloatImage;
import com.keypoints.matrix.CofactorMatrixKernel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SiftController.class)
class SiftControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SiftService siftService;

    private final MockMultipartFile png = new MockMultipartFile("image", "blob.png", "image/png", new byte[]{1, 2, 3});

    private static PipelineState smallRun() {
        FloatImage image = FloatImage.blank(8, 8);
        image.set(4, 4, 1f);
        SiftParameters parameters = SiftParameters.builder().numberOfOctaves(1).chunkSize(8).build();
        return new SiftPipeline(parameters, TileExecutor.inline(), new CofactorMatrixKernel(), null).run(image);
    }

    @Test
    void missingImageIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/sift"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Please choose an image."));
    }

    @Test
    void nonImageIsBadRequest() throws Exception {
        when(siftService.isValidImageFile(any())).thenReturn(false);

        mockMvc.perform(multipart("/api/sift").file(png))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid file: blob.png"));
    }

    @Test
    void invalidParametersAreBadRequest() throws Exception {
        when(siftService.isValidImageFile(any())).thenReturn(true);
        when(siftService.resolveParameters(eq(0), isNull(), isNull()))
                .thenThrow(new IllegalArgumentException("numberOfOctaves must be >= 1, got 0"));

        mockMvc.perform(multipart("/api/sift").file(png).param("octaves", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("numberOfOctaves must be >= 1, got 0"));
    }

    @Test
    void keypointsAreReturnedAsJson() throws Exception {
        SiftParameters parameters = SiftParameters.defaults();
        when(siftService.isValidImageFile(any())).thenReturn(true);
        when(siftService.resolveParameters(isNull(), eq(3), isNull())).thenReturn(parameters);
        when(siftService.detect(any(MultipartFile.class), eq(parameters))).thenReturn(smallRun());

        mockMvc.perform(multipart("/api/sift").file(png).param("scales", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.width").value(8))
                .andExpect(jsonPath("$.height").value(8))
                .andExpect(jsonPath("$.keypoints").isArray())
                .andExpect(jsonPath("$.rejections.DISCARDED_EDGE").isNumber())
                .andExpect(jsonPath("$.rejections.CONVERGED").doesNotExist())
                .andExpect(jsonPath("$.candidatesPerScale", hasSize(3)));
    }

    @Test
    void pipelineFailureIsServerError() throws Exception {
        when(siftService.isValidImageFile(any())).thenReturn(true);
        when(siftService.resolveParameters(any(), any(), any())).thenReturn(SiftParameters.defaults());
        when(siftService.detect(any(MultipartFile.class), any(SiftParameters.class))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(multipart("/api/sift").file(png))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Error: boom"));
    }

    @Test
    void defaultParametersAreExposed() throws Exception {
        when(siftService.getDefaultParameters()).thenReturn(SiftParameters.defaults());

        mockMvc.perform(get("/api/sift/parameters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.numberOfOctaves").value(5))
                .andExpect(jsonPath("$.scalesPerOctave").value(3))
                .andExpect(jsonPath("$.minBlurLevel").value(0.8))
                .andExpect(jsonPath("$.maxIterations").value(5));
    }
}
