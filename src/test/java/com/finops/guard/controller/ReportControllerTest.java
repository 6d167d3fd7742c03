package com.finops.guard.controller;

import com.finops.guard.exception.DataParseException;
import com.finops.guard.exception.DeliveryException;
import com.finops.guard.exception.ReportDeliveryException;
import com.finops.guard.model.ReportPayload;
import com.finops.guard.service.WeeklyReviewService;
import com.finops.guard.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.format.DateTimeParseException;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WeeklyReviewService reviewService;

    // ── Run ──

    @Test
    void run_success_returnsReport() throws Exception {
        when(reviewService.runWeekly()).thenReturn(TestDataFactory.createReport());

        mockMvc.perform(post("/api/v1/reports/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("FinOps Guard Weekly Report"))
                .andExpect(jsonPath("$.metrics.anomaly_count").value(1.0))
                .andExpect(jsonPath("$.metrics.estimated_monthly_savings_usd").value(210.0))
                .andExpect(jsonPath("$.anomalies[0].dimension").value("prod:AmazonEC2"))
                .andExpect(jsonPath("$.anomalies[0].severity").value("high"))
                .andExpect(jsonPath("$.anomalies[0].day").value("2026-01-11"))
                .andExpect(jsonPath("$.recommendations[0].target").value("prod:AmazonEC2"))
                .andExpect(jsonPath("$.recommendations[0].effort").value("medium"));
    }

    @Test
    void run_malformedInput_returns422() throws Exception {
        when(reviewService.runWeekly()).thenThrow(new DataParseException("prod:AmazonS3", "01/15/2026",
                new DateTimeParseException("bad", "01/15/2026", 0)));

        mockMvc.perform(post("/api/v1/reports/run"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DATA_PARSE_ERROR"))
                .andExpect(jsonPath("$.details.dimension").value("prod:AmazonS3"))
                .andExpect(jsonPath("$.details.day").value("01/15/2026"));
    }

    @Test
    void run_deliveryFailed_returns502WithReport() throws Exception {
        ReportPayload report = TestDataFactory.createReport();
        when(reviewService.runWeekly()).thenThrow(new ReportDeliveryException(report,
                new DeliveryException("Teams webhook returned 500", 500, null)));

        mockMvc.perform(post("/api/v1/reports/run"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("DELIVERY_FAILED"))
                .andExpect(jsonPath("$.details.report.anomalies[0].dimension").value("prod:AmazonEC2"));
    }

    @Test
    void run_unexpectedError_returns500() throws Exception {
        when(reviewService.runWeekly()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/reports/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    // ── Latest ──

    @Test
    void latest_afterRun_returnsReport() throws Exception {
        when(reviewService.getLatestReport()).thenReturn(Optional.of(TestDataFactory.createReport()));

        mockMvc.perform(get("/api/v1/reports/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generatedAt").value(1768118400000L));
    }

    @Test
    void latest_noRunYet_returns404() throws Exception {
        when(reviewService.getLatestReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/reports/latest"))
                .andExpect(status().isNotFound());
    }
}
