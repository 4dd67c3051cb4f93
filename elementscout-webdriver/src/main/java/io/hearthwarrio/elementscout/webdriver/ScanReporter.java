package io.hearthwarrio.elementscout.webdriver;

/**
 * Receives the outcome of every scan made through {@link ElementScoutWebDriver}.
 * <p>
 * Implementations may print to stdout, attach to Allure, write files, etc.
 * <p>
 * Note: {@link #detail()} is used by the facade to decide whether the table and JSON
 * should be rendered at all.
 */
@FunctionalInterface
public interface ScanReporter {

    /**
     * Called after a scan completes, before the optional XPath consistency check.
     *
     * @param report page URL, scan result and the renderings requested by {@link #detail()}
     */
    void reportScan(ScanReport report);

    /**
     * Declares how much of the scan this reporter needs.
     * <p>
     * Default is {@link ScanReportDetail#TABLE_AND_JSON} so lambda reporters see everything.
     */
    default ScanReportDetail detail() {
        return ScanReportDetail.TABLE_AND_JSON;
    }
}
