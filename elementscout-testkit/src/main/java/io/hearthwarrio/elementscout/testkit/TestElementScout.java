package io.hearthwarrio.elementscout.testkit;

import io.hearthwarrio.elementscout.webdriver.ElementScoutWebDriver;
import io.hearthwarrio.elementscout.webdriver.ScanReportDetail;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for creating ElementScout instances in tests.
 * <p>
 * Does not depend on Allure.
 */
public final class TestElementScout {

    private TestElementScout() {
        // utility class
    }

    /**
     * Creates a plain ElementScoutWebDriver without reporting and without checks.
     */
    public static ElementScoutWebDriver plain(WebDriver driver) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new ElementScoutWebDriver(driver);
    }

    /**
     * Creates an ElementScoutWebDriver with stdout reporting enabled.
     */
    public static ElementScoutWebDriver stdout(WebDriver driver, ScanReportDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new ElementScoutWebDriver(driver)
                .withReportingToStdOut(detail);
    }

    /**
     * Creates an ElementScoutWebDriver with stdout reporting and XPath consistency checks enabled.
     */
    public static ElementScoutWebDriver stdoutWithChecks(WebDriver driver, ScanReportDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new ElementScoutWebDriver(driver)
                .withReportingToStdOut(detail)
                .checkXPaths();
    }
}
