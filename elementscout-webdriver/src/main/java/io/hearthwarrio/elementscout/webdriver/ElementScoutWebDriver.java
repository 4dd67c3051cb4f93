package io.hearthwarrio.elementscout.webdriver;

import io.hearthwarrio.elementscout.core.ElementRecord;
import io.hearthwarrio.elementscout.core.ElementRecordJson;
import io.hearthwarrio.elementscout.core.ElementScanException;
import io.hearthwarrio.elementscout.core.ElementScanner;
import io.hearthwarrio.elementscout.core.ElementTableRenderer;
import io.hearthwarrio.elementscout.core.ScanResult;
import io.hearthwarrio.elementscout.core.ScannedElement;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Objects;

/**
 * High-level ElementScout entry point for Selenium WebDriver.
 * <p>
 * Each call to {@link #scan()} inventories the page currently loaded in the driver. Nothing is
 * cached between calls: navigate or mutate the page, then scan again.
 * <p>
 * Optional extras, both off by default:
 * <ul>
 *   <li>a {@link ScanReporter} that receives every scan (stdout, Allure, custom lambda)</li>
 *   <li>the XPath consistency check, which re-evaluates every synthesized XPath in the browser and
 *       fails the scan unless it resolves to exactly the scanned element</li>
 * </ul>
 */
public class ElementScoutWebDriver {

    private final WebDriver driver;
    private final WebDriverDomDocument document;
    private final ElementScanner scanner;
    private final ElementTableRenderer tableRenderer;

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private ScanReporter reporter;

    private boolean xPathCheckEnabled = false;

    public ElementScoutWebDriver(WebDriver driver) {
        this(driver, new ElementScanner(), null);
    }

    public ElementScoutWebDriver(WebDriver driver, ScanReporter reporter) {
        this(driver, new ElementScanner(), reporter);
    }

    public ElementScoutWebDriver(WebDriver driver, ElementScanner scanner, ScanReporter reporter) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.document = new WebDriverDomDocument(driver);
        this.tableRenderer = new ElementTableRenderer();
        this.reporter = reporter;
    }

    // ----------- configuration (low-level) -----------

    public ElementScoutWebDriver withReporter(ScanReporter reporter) {
        this.reporter = reporter;
        return this;
    }

    public ElementScoutWebDriver withReportingToStdOut(ScanReportDetail detail) {
        this.reporter = new StdOutScanReporter(detail);
        return this;
    }

    public ElementScoutWebDriver withXPathCheck(boolean enabled) {
        this.xPathCheckEnabled = enabled;
        return this;
    }

    // ----------- configuration (sugar, minimal set) -----------

    public ElementScoutWebDriver reportScans() {
        return withReportingToStdOut(ScanReportDetail.TABLE_AND_JSON);
    }

    public ElementScoutWebDriver disableReporting() {
        this.reporter = null;
        return this;
    }

    public ElementScoutWebDriver checkXPaths() {
        this.xPathCheckEnabled = true;
        return this;
    }

    public ElementScoutWebDriver disableXPathChecks() {
        this.xPathCheckEnabled = false;
        return this;
    }

    public boolean isXPathCheckEnabled() {
        return xPathCheckEnabled;
    }

    public ScanReporter getReporter() {
        return reporter;
    }

    public WebDriver getDriver() {
        return driver;
    }

    // ----------- scanning -----------

    /**
     * Scans the current page.
     *
     * @return scanned elements in document order, each paired with its live {@link WebDriverDomElement}
     * @throws ElementScanException when the XPath consistency check is enabled and a path does not
     *                              resolve to exactly its element
     */
    public ScanResult scan() {
        ScanResult result = scanner.scan(document);

        if (reporter != null) {
            reporter.reportScan(buildReport(result, reporter.detail()));
        }
        if (xPathCheckEnabled) {
            runXPathCheck(result);
        }
        return result;
    }

    /**
     * Scans the current page and returns only the records.
     */
    public List<ElementRecord> scanRecords() {
        return scan().getRecords();
    }

    /**
     * Scans the current page and returns the pretty-printed JSON array.
     */
    public String scanAsJson() {
        return ElementRecordJson.write(scan());
    }

    /**
     * Scans the current page and returns the fixed-width table.
     */
    public String scanAsTable() {
        return tableRenderer.render(scan());
    }

    private ScanReport buildReport(ScanResult result, ScanReportDetail detail) {
        ScanReportDetail d = detail == null ? ScanReportDetail.SUMMARY : detail;
        String table = d.includesTable() ? tableRenderer.render(result) : null;
        String json = d.includesJson() ? ElementRecordJson.write(result) : null;
        return new ScanReport(driver.getCurrentUrl(), result, table, json);
    }

    // ----------- consistency check -----------

    private void runXPathCheck(ScanResult result) {
        for (ScannedElement scanned : result.getElements()) {
            String xPath = scanned.getRecord().getXpath();
            if (xPath == null) {
                continue;
            }

            WebElement original = unwrap(scanned.getElement());
            List<WebElement> byXPath = driver.findElements(By.xpath(xPath));

            if (byXPath.size() != 1) {
                throw new ElementScanException(
                        "XPath consistency check failed for <" + scanned.getRecord().getTagName() + ">" +
                                ": expected exactly one match, found " + byXPath.size() +
                                ", xpath='" + xPath + '\''
                );
            }
            if (!original.equals(byXPath.get(0))) {
                throw new ElementScanException(
                        "XPath consistency check failed for <" + scanned.getRecord().getTagName() + ">" +
                                ": xpath resolves to a different element, xpath='" + xPath + '\''
                );
            }
        }
    }

    private WebElement unwrap(DomElement element) {
        if (element instanceof WebDriverDomElement) {
            return ((WebDriverDomElement) element).getWebElement();
        }
        throw new ElementScanException(
                "XPath consistency check needs Selenium-backed elements, got: " +
                        (element == null ? "null" : element.getClass().getName())
        );
    }
}
