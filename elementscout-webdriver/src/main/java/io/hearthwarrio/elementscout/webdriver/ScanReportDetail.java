package io.hearthwarrio.elementscout.webdriver;

/**
 * Controls which renderings of a scan a {@link ScanReporter} receives.
 */
public enum ScanReportDetail {

    /**
     * Only the page URL, element count and elapsed time.
     */
    SUMMARY,

    /**
     * Summary plus the fixed-width table.
     */
    TABLE,

    /**
     * Summary plus the JSON array.
     */
    JSON,

    /**
     * Summary plus both the table and the JSON array.
     */
    TABLE_AND_JSON;

    public boolean includesTable() {
        return this == TABLE || this == TABLE_AND_JSON;
    }

    public boolean includesJson() {
        return this == JSON || this == TABLE_AND_JSON;
    }
}
