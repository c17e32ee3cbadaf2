package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.PortfolioReport;
import com.automate.FindingSync.dto.SecurityReport;
import com.automate.FindingSync.dto.SeveritySummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Console summary of each report.
 */
@Slf4j
@Component
public class LoggingReportPublisher implements ReportPublisher {

    @Override
    public void publish(SecurityReport report) {
        SeveritySummary s = report.getSummary() != null ? report.getSummary() : SeveritySummary.EMPTY;
        log.info("Report {} ({}): {} finding(s) [high={}, medium={}, low={}], quality gate={}, coverage={}",
                report.getProjectName(), report.getSonarComponent(), s.total(), s.high(), s.medium(), s.low(),
                report.getQualityGate() != null ? report.getQualityGate().status() : "N/A",
                report.getCoverage() != null ? report.getCoverage() : "N/A");
    }

    @Override
    public void publishPortfolio(PortfolioReport report) {
        SeveritySummary s = report.getTotals() != null ? report.getTotals() : SeveritySummary.EMPTY;
        log.info("Portfolio {}: {} project(s), {} failed, {} finding(s) [high={}, medium={}, low={}], gates passed={} failed={}",
                report.getName(), report.getProjects() != null ? report.getProjects().size() : 0,
                report.getProjectsFailed(), s.total(), s.high(), s.medium(), s.low(),
                report.getGatesPassed(), report.getGatesFailed());
    }
}
