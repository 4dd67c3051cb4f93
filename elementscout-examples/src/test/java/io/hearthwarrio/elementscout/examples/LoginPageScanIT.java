package io.hearthwarrio.elementscout.examples;

import io.hearthwarrio.elementscout.core.ElementRecord;
import io.hearthwarrio.elementscout.core.ElementRecordJson;
import io.hearthwarrio.elementscout.core.ScanResult;
import io.hearthwarrio.elementscout.testkit.TestDrivers;
import io.hearthwarrio.elementscout.testkit.TestElementScout;
import io.hearthwarrio.elementscout.webdriver.ElementScoutWebDriver;
import io.hearthwarrio.elementscout.webdriver.ScanReportDetail;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LoginPageScanIT {

    private WebDriver driver;
    private ElementScoutWebDriver scout;

    @BeforeEach
    void openPage() {
        driver = TestDrivers.headlessChrome();
        Path page = Paths.get("src", "test", "resources", "pages", "login.html");
        driver.get(page.toUri().toString());

        scout = TestElementScout.stdoutWithChecks(driver, ScanReportDetail.TABLE);
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void idShortcutForSubmitButton() {
        ElementRecord submit = byId(scout.scanRecords(), "submit-btn");

        assertEquals("//*[@id='submit-btn']", submit.getXpath());
        assertEquals("Sign in", submit.getText().getComputedText());
        assertEquals("submit", submit.getAttributes().getType());
        assertEquals("login-form", submit.getContext().getForm().getId());
    }

    @Test
    void checkboxRecord() {
        ElementRecord agree = byId(scout.scanRecords(), "agree");

        assertEquals("checkbox", agree.getAttributes().getType());
        assertTrue(agree.getState().isChecked());
        assertEquals("I agree", agree.getText().getComputedText());
    }

    @Test
    void ariaLabelWinsOverVisibleText() {
        ElementRecord button = byComputedText(scout.scanRecords(), "Submit Now");

        assertEquals("Go", button.getText().getVisibleText());
        assertEquals("div", button.getContext().getTagName());
        assertEquals("group", button.getContext().getRole());
        assertEquals("Actions", button.getContext().getAriaLabel());
    }

    @Test
    void labelsNameTheirInputs() {
        List<ElementRecord> records = scout.scanRecords();

        ElementRecord user = byId(records, "user");
        assertEquals("User name", user.getText().getLabelText());
        assertEquals("User name", user.getText().getComputedText());

        ElementRecord password = byComputedText(records, "Password", "input");
        assertEquals("Password", password.getText().getLabelText());
        assertEquals("password", password.getAttributes().getType());
        assertTrue(password.getXpath().startsWith("/html/body/form/"));
    }

    @Test
    void hiddenAndEmptyElementsAreOmitted() {
        List<ElementRecord> records = scout.scanRecords();

        for (ElementRecord record : records) {
            String text = record.getText().getComputedText();
            assertNotEquals("Hidden action", text);
            assertNotEquals("Ghost link", text);
            assertNotEquals("Collapsed widget", text);
            assertNotEquals("csrf", record.getAttributes().getName());
            assertTrue(!text.isEmpty() || record.getAttributes().getId() != null, "irrelevant record: " + record);
        }
    }

    @Test
    void positionalPathsAreUniqueAndResolve() {
        // stdoutWithChecks re-evaluates every XPath in the browser
        ScanResult result = scout.scan();

        Set<String> xpaths = new HashSet<>();
        for (ElementRecord record : result.getRecords()) {
            assertNotNull(record.getXpath());
            assertTrue(xpaths.add(record.getXpath()), "duplicate xpath: " + record.getXpath());
        }
        assertEquals("/html/body/nav/p[1]/a", byComputedText(result.getRecords(), "Help").getXpath());
        assertEquals("/html/body/nav/p[2]/a[2]", byComputedText(result.getRecords(), "Privacy").getXpath());
    }

    @Test
    void jsonReadsBackToSameRecords() {
        List<ElementRecord> records = scout.scanRecords();

        String json = ElementRecordJson.write(records);

        assertEquals(records, ElementRecordJson.read(json));
        assertTrue(json.contains("\"computedText\" : \"I agree\""));
    }

    @Test
    void headingIsListed() {
        ElementRecord heading = byComputedText(scout.scanRecords(), "Sign in", "h1");

        assertEquals("/html/body/h1", heading.getXpath());
        assertTrue(heading.getLocation().getWidth() > 0);
    }

    private static ElementRecord byId(List<ElementRecord> records, String id) {
        for (ElementRecord record : records) {
            if (id.equals(record.getAttributes().getId())) {
                return record;
            }
        }
        throw new AssertionError("No record with id '" + id + "' in " + records);
    }

    private static ElementRecord byComputedText(List<ElementRecord> records, String text) {
        return byComputedText(records, text, null);
    }

    private static ElementRecord byComputedText(List<ElementRecord> records, String text, String tagName) {
        for (ElementRecord record : records) {
            boolean tagMatches = tagName == null || tagName.equals(record.getTagName());
            if (tagMatches && text.equals(record.getText().getComputedText())) {
                return record;
            }
        }
        throw new AssertionError("No record with computed text '" + text + "' in " + records);
    }
}
