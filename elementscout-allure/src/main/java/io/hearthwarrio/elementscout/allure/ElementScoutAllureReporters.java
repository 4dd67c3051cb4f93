package io.hearthwarrio.elementscout.allure;

import io.hearthwarrio.elementscout.webdriver.ScanReportDetail;
import io.hearthwarrio.elementscout.webdriver.ScanReporter;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related ElementScout reporters.
 * <p>
 * This class lives in the elementscout-allure module to avoid leaking Allure
 * dependencies into elementscout-core or elementscout-webdriver.
 */
public final class ElementScoutAllureReporters {

    private ElementScoutAllureReporters() {
        // utility class
    }

    /**
     * Creates an Allure reporter that attaches the table and JSON without screenshots.
     */
    public static ScanReporter scans(WebDriver driver) {
        return new AllureScanReporter(driver, ScanReportDetail.TABLE_AND_JSON, false);
    }

    /**
     * Creates an Allure reporter with explicit detail and screenshot flag.
     */
    public static ScanReporter scans(WebDriver driver, ScanReportDetail detail, boolean screenshots) {
        return new AllureScanReporter(driver, detail, screenshots);
    }
}
