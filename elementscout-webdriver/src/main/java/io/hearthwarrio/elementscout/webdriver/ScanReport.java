package io.hearthwarrio.elementscout.webdriver;

import io.hearthwarrio.elementscout.core.ScanResult;

import java.util.Objects;

/**
 * What a {@link ScanReporter} receives after a scan.
 * <p>
 * {@link #getTable()} and {@link #getJson()} are only rendered when the reporter's
 * {@link ScanReporter#detail()} asks for them, otherwise they are null.
 */
public final class ScanReport {

    private final String pageUrl;
    private final ScanResult result;
    private final String table;
    private final String json;

    public ScanReport(String pageUrl, ScanResult result, String table, String json) {
        this.pageUrl = pageUrl;
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.table = table;
        this.json = json;
    }

    /**
     * @return URL of the scanned page (may be null if the driver does not report one)
     */
    public String getPageUrl() {
        return pageUrl;
    }

    public ScanResult getResult() {
        return result;
    }

    public String getTable() {
        return table;
    }

    public String getJson() {
        return json;
    }

    /**
     * @return one-line summary: URL, element count and elapsed milliseconds
     */
    public String summary() {
        return "url=" + (pageUrl == null ? "" : pageUrl) +
                ", elements=" + result.size() +
                ", elapsed=" + result.getElapsed().toMillis() + "ms";
    }

    @Override
    public String toString() {
        return "ScanReport{" + summary() + '}';
    }
}
