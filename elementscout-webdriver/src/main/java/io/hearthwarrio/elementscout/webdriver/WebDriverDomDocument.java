package io.hearthwarrio.elementscout.webdriver;

import io.hearthwarrio.elementscout.core.dom.DomDocument;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exposes the page currently loaded in a Selenium {@link WebDriver} as a {@link DomDocument}.
 * <p>
 * Every call goes to the live browser; nothing is cached between scans. Driver failures
 * (stale elements, closed windows, script errors) propagate to the caller.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class WebDriverDomDocument implements DomDocument {

    private final WebDriver driver;
    private final JavascriptExecutor js;

    /**
     * @param driver Selenium WebDriver; must also implement {@link JavascriptExecutor}
     */
    public WebDriverDomDocument(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        if (!(driver instanceof JavascriptExecutor)) {
            throw new IllegalArgumentException(
                    "driver must implement JavascriptExecutor: " + driver.getClass().getName()
            );
        }
        this.js = (JavascriptExecutor) driver;
    }

    @Override
    public List<DomElement> querySelectorAll(String cssSelectorList) {
        List<WebElement> found = driver.findElements(By.cssSelector(cssSelectorList));
        List<DomElement> out = new ArrayList<>(found.size());
        for (WebElement element : found) {
            out.add(wrap(element));
        }
        return out;
    }

    /**
     * Wraps a Selenium element found elsewhere so it can be scanned or compared with scan results.
     */
    public WebDriverDomElement wrap(WebElement element) {
        return new WebDriverDomElement(element, js);
    }

    public WebDriver getDriver() {
        return driver;
    }
}
