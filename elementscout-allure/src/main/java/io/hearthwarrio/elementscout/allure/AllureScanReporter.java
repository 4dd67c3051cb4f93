package io.hearthwarrio.elementscout.allure;

import io.hearthwarrio.elementscout.webdriver.ScanReport;
import io.hearthwarrio.elementscout.webdriver.ScanReportDetail;
import io.hearthwarrio.elementscout.webdriver.ScanReporter;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure reporter for scans.
 * <p>
 * Lives in elementscout-allure to avoid leaking Allure dependency into core/webdriver.
 */
public final class AllureScanReporter implements ScanReporter {

    private final WebDriver driver;
    private final ScanReportDetail detail;
    private final boolean attachScreenshot;

    public AllureScanReporter(WebDriver driver, ScanReportDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? ScanReportDetail.SUMMARY : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public ScanReportDetail detail() {
        return detail;
    }

    @Override
    public void reportScan(ScanReport report) {
        String title = "ElementScout: " + report.getResult().size() + " elements on " + safe(report.getPageUrl());

        Allure.step(title, () -> {
            attach("Scan summary", "text/plain", report.summary(), ".txt");

            if (detail.includesTable() && report.getTable() != null) {
                attach("Element table", "text/plain", report.getTable(), ".txt");
            }
            if (detail.includesJson() && report.getJson() != null) {
                attach("Element records", "application/json", report.getJson(), ".json");
            }

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    private static void attach(String name, String type, String content, String extension) {
        Allure.addAttachment(
                name,
                type,
                new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)),
                extension
        );
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
