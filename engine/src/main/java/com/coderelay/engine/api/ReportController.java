package com.coderelay.engine.api;

import com.coderelay.engine.service.ProgressReport;
import com.coderelay.engine.service.ReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /report — task and proposal counts by status, trunk head, escalations
 * and which workspaces are behind.
 */
@RestController
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/report")
    public ProgressReport report() {
        return reportService.report();
    }
}
