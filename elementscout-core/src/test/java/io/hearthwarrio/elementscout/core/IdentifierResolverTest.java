package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.fake.FakeDocument;
import io.hearthwarrio.elementscout.core.fake.FakeElement;
import org.junit.jupiter.api.Test;

import static io.hearthwarrio.elementscout.core.fake.FakeElement.el;
import static org.junit.jupiter.api.Assertions.*;

public class IdentifierResolverTest {

    private final IdentifierResolver resolver = new IdentifierResolver();

    @Test
    void ariaLabelWinsOverVisibleText() {
        FakeElement button = el("button").attr("aria-label", "Submit Now").text("Go");
        FakeDocument doc = FakeDocument.page(button);

        ElementText text = resolver.resolve(doc, button);

        assertEquals("Submit Now", text.getComputedText());
        assertEquals("Go", text.getVisibleText());
        assertNull(text.getLabelText());
    }

    @Test
    void labelForWinsOverEnclosingLabel() {
        FakeElement input = el("input").id("email");
        FakeDocument doc = FakeDocument.page(
                el("label").attr("for", "email").text("E-mail address"),
                el("label").text("Wrapper ").child(input)
        );

        ElementText text = resolver.resolve(doc, input);

        assertEquals("E-mail address", text.getLabelText());
        assertEquals("E-mail address", text.getComputedText());
    }

    @Test
    void emptyLabelForFallsBackToEnclosingLabel() {
        FakeElement input = el("input").id("remember").attr("type", "checkbox");
        FakeDocument doc = FakeDocument.page(
                el("label").attr("for", "remember").text("   "),
                el("label").text("Remember me").child(input)
        );

        assertEquals("Remember me", resolver.resolve(doc, input).getComputedText());
    }

    @Test
    void labelResolvesToItsOwnText() {
        FakeElement label = el("label").text("Newsletter");
        FakeDocument doc = FakeDocument.page(label);

        ElementText text = resolver.resolve(doc, label);

        assertEquals("Newsletter", text.getLabelText());
        assertEquals("Newsletter", text.getVisibleText());
        assertEquals("Newsletter", text.getComputedText());
    }

    @Test
    void labelForIdWithQuotesIsMatched() {
        FakeElement input = el("input").id("say\"hi\"");
        FakeDocument doc = FakeDocument.page(
                el("label").attr("for", "say\"hi\"").text("Greeting"),
                input
        );

        assertEquals("Greeting", resolver.resolve(doc, input).getComputedText());
    }

    @Test
    void fallsBackToValueWhenThereIsNoText() {
        FakeElement submit = el("input").attr("type", "submit").value("Send form");
        FakeDocument doc = FakeDocument.page(submit);

        ElementText text = resolver.resolve(doc, submit);

        assertEquals("Send form", text.getVisibleText());
        assertEquals("Send form", text.getComputedText());
    }

    @Test
    void fallsBackToPlaceholderThenName() {
        FakeElement withPlaceholder = el("input").attr("placeholder", "Search products").attr("name", "q");
        FakeElement withName = el("textarea").attr("name", "comment");
        FakeDocument doc = FakeDocument.page(withPlaceholder, withName);

        assertEquals("Search products", resolver.resolve(doc, withPlaceholder).getComputedText());
        assertEquals("comment", resolver.resolve(doc, withName).getComputedText());
    }

    @Test
    void valueIsIgnoredOutsideFormControls() {
        FakeElement link = el("a").value("stale").attr("name", "top");
        FakeDocument doc = FakeDocument.page(link);

        ElementText text = resolver.resolve(doc, link);

        assertNull(text.getVisibleText());
        assertEquals("top", text.getComputedText());
    }

    @Test
    void normalizesWhitespaceOfEverySource() {
        FakeElement button = el("button").attr("aria-label", "   ").text("  Sign \n\t  in  ");
        FakeDocument doc = FakeDocument.page(button);

        ElementText text = resolver.resolve(doc, button);

        assertEquals("Sign in", text.getComputedText());
        assertEquals("Sign in", text.getVisibleText());
    }

    @Test
    void collapsesNonBreakingAndUnicodeSpaces() {
        FakeElement button = el("button").text("\u00A0Save\u00A0 \u2003changes\u00A0");
        FakeDocument doc = FakeDocument.page(button);

        ElementText text = resolver.resolve(doc, button);

        assertEquals("Save changes", text.getComputedText());
        assertEquals("Save changes", text.getVisibleText());
    }

    @Test
    void nonBreakingSpaceOnlyElementIsNotMeaningful() {
        FakeElement button = el("button").text("\u00A0\u00A0");
        FakeDocument doc = FakeDocument.page(button);

        ElementText text = resolver.resolve(doc, button);

        assertEquals("", text.getComputedText());
        assertNull(text.getVisibleText());
        assertFalse(resolver.isMeaningful(button, text));
    }

    @Test
    void labelForIdWithNewlineIsMatched() {
        FakeElement input = el("input").id("first\nname");
        FakeDocument doc = FakeDocument.page(
                el("label").attr("for", "first\nname").text("First name"),
                input
        );

        assertEquals("First name", resolver.resolve(doc, input).getLabelText());
    }

    @Test
    void cssLiteralEscapesControlCharacters() {
        assertEquals("\"a\\A b\"", IdentifierResolver.cssAttrLiteral("a\nb"));
        assertEquals("\"tab\\9 x\"", IdentifierResolver.cssAttrLiteral("tab\tx"));
        assertEquals("\"q\\\"\\\\\"", IdentifierResolver.cssAttrLiteral("q\"\\"));
    }

    @Test
    void elementWithIdOrNameIsMeaningful() {
        FakeElement idOnly = el("button").id("close");
        FakeElement named = el("input").attr("name", "city");
        FakeDocument doc = FakeDocument.page(idOnly, named);

        ElementText idOnlyText = resolver.resolve(doc, idOnly);

        assertEquals("", idOnlyText.getComputedText());
        assertTrue(resolver.isMeaningful(idOnly, idOnlyText));
        assertTrue(resolver.isMeaningful(named, resolver.resolve(doc, named)));
    }

    @Test
    void anonymousEmptyElementIsNotMeaningful() {
        FakeElement icon = el("a").attr("class", "icon icon-close");
        FakeDocument doc = FakeDocument.page(icon);

        assertFalse(resolver.isMeaningful(icon, resolver.resolve(doc, icon)));
    }
}
