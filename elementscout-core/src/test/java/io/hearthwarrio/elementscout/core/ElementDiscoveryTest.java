package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomDocument;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import io.hearthwarrio.elementscout.core.fake.FakeDocument;
import io.hearthwarrio.elementscout.core.fake.FakeElement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.hearthwarrio.elementscout.core.fake.FakeElement.el;
import static org.junit.jupiter.api.Assertions.*;

public class ElementDiscoveryTest {

    private final ElementDiscovery discovery = new ElementDiscovery();

    @Test
    void returnsCandidatesInDocumentOrder() {
        FakeElement title = el("h1").text("Shop");
        FakeElement home = el("a").attr("href", "/").text("Home");
        FakeElement search = el("input").attr("type", "search");
        FakeElement go = el("button").text("Go");

        FakeDocument doc = FakeDocument.page(
                title,
                el("nav").child(home, el("span").text("|")),
                el("form").child(search, go)
        );

        assertEquals(Arrays.asList(title, home, search, go), discovery.discover(doc));
    }

    @Test
    void matchesRolesClickHandlersLabelsAndHeadingsUpToH4() {
        FakeElement tab = el("div").attr("role", "tab").text("Settings");
        FakeElement roleLink = el("span").attr("role", "link").text("More");
        FakeElement roleButton = el("div").attr("role", "button").text("Open");
        FakeElement clickable = el("li").attr("onclick", "pick()").text("Item");
        FakeElement label = el("label").text("Name");
        FakeElement h4 = el("h4").text("Small heading");
        FakeElement select = el("select");
        FakeElement textarea = el("textarea");

        FakeDocument doc = FakeDocument.page(
                tab,
                roleLink,
                roleButton,
                el("div").attr("role", "presentation").text("Decor"),
                clickable,
                label,
                el("h5").text("Too small"),
                h4,
                el("p").text("Paragraph"),
                select,
                textarea
        );

        assertEquals(
                Arrays.asList(tab, roleLink, roleButton, clickable, label, h4, select, textarea),
                discovery.discover(doc)
        );
    }

    @Test
    void elementMatchedByManyPatternsAppearsOnce() {
        FakeElement button = el("button").attr("role", "button").attr("onclick", "go()").text("Go");
        FakeDocument doc = FakeDocument.page(button);

        List<DomElement> found = discovery.discover(doc);

        assertEquals(1, found.size());
        assertSame(button, found.get(0));
    }

    @Test
    void dropsDuplicatesReportedByTheHost() {
        FakeElement a = el("a").text("A");
        FakeElement b = el("a").text("B");
        DomDocument repeating = selector -> Arrays.<DomElement>asList(a, b, a, null, b);

        assertEquals(Arrays.asList(a, b), discovery.discover(repeating));
    }

    @Test
    void issuesTheFixedSelectorListAsOneQuery() {
        StringBuilder issued = new StringBuilder();
        DomDocument recording = selector -> {
            issued.append(selector);
            return Collections.emptyList();
        };

        assertTrue(discovery.discover(recording).isEmpty());
        assertEquals(
                "a, button, input, select, textarea, label, h1, h2, h3, h4, " +
                        "[role=\"button\"], [role=\"link\"], [role=\"tab\"], [onclick]",
                issued.toString()
        );
    }
}
