package com.automate.FindingSync.Controller;

import com.automate.FindingSync.Config.SyncProperties;
import com.automate.FindingSync.Service.ReportService;
import com.automate.FindingSync.Service.TrendService;
import com.automate.FindingSync.dto.PortfolioReport;
import com.automate.FindingSync.dto.SecurityReport;
import com.automate.FindingSync.dto.TrendAnalysis;
import com.automate.FindingSync.dto.request.PortfolioReportRequest;
import com.automate.FindingSync.dto.request.ReportRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportService reportService;
    private final TrendService trendService;
    private final SyncProperties syncProperties;

    public ReportController(ReportService reportService, TrendService trendService, SyncProperties syncProperties) {
        this.reportService = reportService;
        this.trendService = trendService;
        this.syncProperties = syncProperties;
    }

    @PostMapping
    public SecurityReport generate(@Valid @RequestBody ReportRequest req) {
        return reportService.generateReport(req.toConnection(), req.toOptions());
    }

    @PostMapping("/portfolio")
    public PortfolioReport generatePortfolio(@Valid @RequestBody PortfolioReportRequest req) {
        return reportService.generatePortfolioReport(req.toConnection(), req.getName(), req.getComponents(),
                req.toOptions(req.getComponents().get(0)));
    }

    @GetMapping("/trends")
    public TrendAnalysis trends(@RequestParam String component,
                                @RequestParam(required = false) Integer periodDays) {
        int days = periodDays != null ? periodDays : syncProperties.getTrendPeriodDays();
        if (days < 1) {
            throw new IllegalArgumentException("periodDays must be at least 1");
        }
        return trendService.computeTrend(trendService.loadHistory(component, days));
    }
}
