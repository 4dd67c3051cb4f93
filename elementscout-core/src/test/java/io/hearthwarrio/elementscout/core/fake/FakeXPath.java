package io.hearthwarrio.elementscout.core.fake;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the two XPath shapes the synthesizer emits against a {@link FakeDocument}:
 * {@code //*[@id='x']} and absolute paths like {@code /html/body/div[2]/a}.
 */
public final class FakeXPath {

    private static final Pattern ID_SHORTCUT = Pattern.compile("^//\\*\\[@id=(?:'([^']*)'|\"([^\"]*)\")\\]$");
    private static final Pattern SEGMENT = Pattern.compile("^([a-z0-9]+)(?:\\[(\\d+)\\])?$");

    private FakeXPath() {
        // utility class
    }

    public static List<FakeElement> evaluate(FakeDocument document, String xpath) {
        Matcher idMatcher = ID_SHORTCUT.matcher(xpath);
        if (idMatcher.matches()) {
            String id = idMatcher.group(1) != null ? idMatcher.group(1) : idMatcher.group(2);
            List<FakeElement> out = new ArrayList<>();
            for (FakeElement e : document.allElements()) {
                if (id.equals(e.attribute("id"))) {
                    out.add(e);
                }
            }
            return out;
        }

        if (!xpath.startsWith("/") || xpath.startsWith("//")) {
            throw new IllegalArgumentException("Unsupported XPath in fake DOM: " + xpath);
        }

        List<FakeElement> context = null;
        for (String raw : xpath.substring(1).split("/")) {
            Matcher m = SEGMENT.matcher(raw);
            if (!m.matches()) {
                throw new IllegalArgumentException("Unsupported XPath segment: " + raw);
            }
            String tag = m.group(1);
            Integer position = m.group(2) == null ? null : Integer.valueOf(m.group(2));

            List<FakeElement> next = new ArrayList<>();
            List<List<FakeElement>> childSets = new ArrayList<>();
            if (context == null) {
                childSets.add(Collections.singletonList(document.root()));
            } else {
                for (FakeElement c : context) {
                    childSets.add(c.fakeChildren());
                }
            }
            for (List<FakeElement> children : childSets) {
                int seen = 0;
                for (FakeElement child : children) {
                    if (!tag.equals(child.tagName())) {
                        continue;
                    }
                    seen++;
                    if (position == null || position == seen) {
                        next.add(child);
                    }
                }
            }
            context = next;
        }
        return context == null ? Collections.emptyList() : context;
    }
}
