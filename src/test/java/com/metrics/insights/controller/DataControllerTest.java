package com.metrics.insights.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metrics.insights.model.*;
import com.metrics.insights.service.DataPreparationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DataController.class)
class DataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DataPreparationService dataPreparationService;

    // ── Preprocess ──

    @Test
    void preprocess_nullEntriesAreMissingValues() throws Exception {
        ProcessedData result = ProcessedData.builder()
                .original(Arrays.asList(10.0, null, 12.0))
                .processed(List.of(10.0, 11.0, 12.0))
                .metadata(ProcessedData.Metadata.builder().mean(11).min(10).max(12).missingCount(1).build())
                .build();
        when(dataPreparationService.preprocess(anyList(), isNull())).thenReturn(result);

        mockMvc.perform(post("/api/v1/data/preprocess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\": [10.0, null, 12.0]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed[1]").value(11.0))
                .andExpect(jsonPath("$.metadata.missingCount").value(1));

        verify(dataPreparationService).preprocess(eq(Arrays.asList(10.0, null, 12.0)), isNull());
    }

    @Test
    void preprocess_explicitConfig_isPassedThrough() throws Exception {
        when(dataPreparationService.preprocess(anyList(), any(PreprocessingConfig.class)))
                .thenReturn(ProcessedData.builder().processed(List.of(0.0, 1.0)).build());

        mockMvc.perform(post("/api/v1/data/preprocess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "values", List.of(1.0, 2.0),
                                "config", Map.of("normalize", true, "fillMissing", "MEAN")))))
                .andExpect(status().isOk());

        verify(dataPreparationService).preprocess(eq(List.of(1.0, 2.0)),
                argThat(c -> c.isNormalize() && c.getFillMissing() == FillMethod.MEAN && c.getSmoothingWindow() == 3));
    }

    @Test
    void preprocess_missingValues_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/data/preprocess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("values"));

        verifyNoInteractions(dataPreparationService);
    }

    // ── Outliers ──

    @Test
    void outliers_passesMethodAndThreshold() throws Exception {
        OutlierResult result = OutlierResult.builder()
                .method(OutlierMethod.LOF)
                .threshold(1.5)
                .outliers(List.of(OutlierResult.Outlier.builder().index(4).value(100).score(1).statistic(8.2).build()))
                .cleanData(List.of(1.0, 2.0, 3.0, 4.0))
                .build();
        when(dataPreparationService.detectOutliers(anyList(), eq(OutlierMethod.LOF), eq(1.5))).thenReturn(result);

        mockMvc.perform(post("/api/v1/data/outliers")
                        .param("method", "LOF")
                        .param("threshold", "1.5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1, 2, 3, 4, 100]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("LOF"))
                .andExpect(jsonPath("$.outliers[0].index").value(4))
                .andExpect(jsonPath("$.cleanData.length()").value(4));
    }

    @Test
    void outliers_nonPositiveThreshold_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/data/outliers")
                        .param("threshold", "0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1, 2, 3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("threshold"));

        verifyNoInteractions(dataPreparationService);
    }

    @Test
    void outliers_unknownMethod_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/data/outliers")
                        .param("method", "DBSCAN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1, 2, 3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("method"));
    }
}
