package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.PortfolioReport;
import com.automate.FindingSync.dto.SecurityReport;

/**
 * Receives every finished report (renderers, notifiers). A publisher that
 * throws is logged and skipped.
 */
public interface ReportPublisher {

    void publish(SecurityReport report);

    default void publishPortfolio(PortfolioReport report) {
        if (report.getProjects() == null) return;
        report.getProjects().stream()
                .filter(PortfolioReport.Entry::isSuccess)
                .forEach(entry -> publish(entry.getReport()));
    }
}
