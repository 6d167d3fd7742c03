package com.finops.guard.controller;

import com.finops.guard.model.ReportPayload;
import com.finops.guard.service.WeeklyReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Run the weekly cost review and read its report")
public class ReportController {

    private final WeeklyReviewService reviewService;

    public ReportController(WeeklyReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping("/run")
    @Operation(summary = "Run the weekly review now",
               description = "Ingests, detects anomalies, builds the report and delivers it to the configured webhook")
    public ResponseEntity<ReportPayload> run() {
        return ResponseEntity.ok(reviewService.runWeekly());
    }

    @GetMapping("/latest")
    @Operation(summary = "Get the most recent report",
               description = "Returns 404 until a review has completed in this process")
    public ResponseEntity<ReportPayload> latest() {
        return reviewService.getLatestReport()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
