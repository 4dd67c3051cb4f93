package io.hearthwarrio.elementscout.webdriver;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout reporter for scans.
 * <p>
 * Prints one {@code [ElementScout]} summary line followed by the table and/or JSON
 * selected by the configured {@link ScanReportDetail}.
 */
public final class StdOutScanReporter implements ScanReporter {

    private final ScanReportDetail detail;
    private final PrintStream out;

    public StdOutScanReporter(ScanReportDetail detail) {
        this(detail, System.out);
    }

    StdOutScanReporter(ScanReportDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public ScanReportDetail detail() {
        return detail;
    }

    @Override
    public void reportScan(ScanReport report) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("[ElementScout] ").append(report.summary());

        if (detail.includesTable() && report.getTable() != null) {
            sb.append('\n').append(report.getTable());
        }
        if (detail.includesJson() && report.getJson() != null) {
            sb.append('\n').append(report.getJson());
        }

        out.println(sb);
    }
}
