package io.hearthwarrio.elementscout.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.util.Objects;

/**
 * Minimal WebDriver factory for tests.
 * <p>
 * Local Chrome by default, headless Chrome for CI, or a RemoteWebDriver against a Selenium Grid.
 * The window gets a fixed size so bounding boxes in scan results are reproducible between runs.
 */
public final class TestDrivers {

    /**
     * Window size applied to every driver created here.
     */
    public static final String WINDOW_SIZE = "1280,900";

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a local ChromeDriver with default settings.
     */
    public static WebDriver chrome() {
        return chrome(new ChromeOptions());
    }

    /**
     * Creates a local headless ChromeDriver.
     */
    public static WebDriver headlessChrome() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--headless=new", "--disable-gpu", "--no-sandbox");
        return chrome(options);
    }

    /**
     * Creates a local ChromeDriver with provided options.
     */
    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        options.addArguments("--window-size=" + WINDOW_SIZE);
        return new ChromeDriver(options);
    }

    /**
     * Creates a RemoteWebDriver with provided Selenium Grid URL and capabilities.
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        return new RemoteWebDriver(remoteUrl, capabilities);
    }
}
