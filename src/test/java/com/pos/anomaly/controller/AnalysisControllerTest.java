package com.pos.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.anomaly.model.AnalysisReport;
import com.pos.anomaly.model.AnalysisRequest;
import com.pos.anomaly.model.ShiftRecord;
import com.pos.anomaly.service.ScheduledAnalysisService;
import com.pos.anomaly.service.ShiftAnalysisService;
import com.pos.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    private static final Instant NOW = Instant.parse("2025-06-10T04:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ShiftAnalysisService analysisService;

    @MockBean
    private ScheduledAnalysisService scheduledAnalysisService;

    @Test
    void analyze_success() throws Exception {
        AnalysisRequest request = AnalysisRequest.builder()
                .now(NOW)
                .shifts(List.of(TestDataFactory.createShift("S-1", "STORE-001", NOW.minusSeconds(3600), 100)))
                .build();
        AnalysisReport report = TestDataFactory.createReport(NOW);
        report.setRejectedRows(2);
        when(analysisService.analyze(anyList(), eq(NOW))).thenReturn(report);

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generatedAt").value("2025-06-10T04:00:00Z"))
                .andExpect(jsonPath("$.rejectedRows").value(2))
                .andExpect(jsonPath("$.shifts").isArray());
    }

    @Test
    void analyze_withoutNow_usesCurrentTime() throws Exception {
        when(analysisService.analyze(anyList(), any(Instant.class))).thenReturn(TestDataFactory.createReport(NOW));

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shifts\": []}"))
                .andExpect(status().isOk());

        verify(analysisService).analyze(anyList(), any(Instant.class));
    }

    @Test
    void analyze_missingShifts_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("shifts is required"));

        verifyNoInteractions(analysisService);
    }

    @Test
    void analyze_invalidRows_returns400() throws Exception {
        when(analysisService.analyze(anyList(), any(Instant.class)))
                .thenThrow(new IllegalArgumentException("Duplicate shift S-1 in store STORE-001"));

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shifts\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Duplicate shift S-1 in store STORE-001"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyze_unparseableOpeningTime_rejectsRowNotBatch() throws Exception {
        AnalysisReport report = TestDataFactory.createReport(NOW);
        report.setRejectedRows(1);
        when(analysisService.analyze(anyList(), eq(NOW))).thenReturn(report);

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"now\": \"2025-06-10T04:00:00Z\", \"shifts\": ["
                                + "{\"shiftId\": \"S-1\", \"storeId\": \"STORE-001\", "
                                + "\"openedAt\": \"2025-06-09T00:00:00Z\", \"totalSales\": 100},"
                                + "{\"shiftId\": \"S-2\", \"storeId\": \"STORE-001\", "
                                + "\"openedAt\": \"not-a-timestamp\", \"totalSales\": 50}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rejectedRows").value(1));

        ArgumentCaptor<List<ShiftRecord>> rows = ArgumentCaptor.forClass(List.class);
        verify(analysisService).analyze(rows.capture(), eq(NOW));
        assertThat(rows.getValue()).hasSize(2);
        assertThat(rows.getValue().get(0).getOpenedAt()).isEqualTo(Instant.parse("2025-06-09T00:00:00Z"));
        assertThat(rows.getValue().get(1).getShiftId()).isEqualTo("S-2");
        assertThat(rows.getValue().get(1).getOpenedAt()).isNull();
    }

    @Test
    void analyze_malformedBody_returns400WithError() throws Exception {
        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shifts\": [ {\"shiftId\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));

        verifyNoInteractions(analysisService);
    }

    @Test
    void getLatest_found() throws Exception {
        when(scheduledAnalysisService.getLatestReport()).thenReturn(Optional.of(TestDataFactory.createReport(NOW)));

        mockMvc.perform(get("/api/v1/analysis/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generatedAt").value("2025-06-10T04:00:00Z"));
    }

    @Test
    void getLatest_notFound() throws Exception {
        when(scheduledAnalysisService.getLatestReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analysis/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void runNow_success() throws Exception {
        when(scheduledAnalysisService.runAnalysis()).thenReturn(TestDataFactory.createReport(NOW));

        mockMvc.perform(post("/api/v1/analysis/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysisStart").value("2025-06-03T04:00:00Z"));

        verify(scheduledAnalysisService).runAnalysis();
    }
}
