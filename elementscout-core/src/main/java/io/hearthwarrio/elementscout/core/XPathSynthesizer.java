package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomElement;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Builds an XPath that points back at an element.
 * <p>
 * Elements with an id get the shortcut {@code //*[@id='...']} (document-wide id uniqueness is assumed, not
 * checked). Everything else gets an absolute positional path such as {@code /html/body/div[2]/button}:
 * a segment is indexed only when the element has same-tag siblings, and positions are counted among the
 * siblings of each level separately.
 */
public class XPathSynthesizer {

    /**
     * @param element element to describe (may be null)
     * @return XPath, or {@code null} when no element chain is reachable
     */
    public String synthesize(DomElement element) {
        if (element == null) {
            return null;
        }

        String id = element.attribute("id");
        if (id != null && !id.isEmpty()) {
            return "//*[@id=" + xpathLiteral(id) + "]";
        }

        Deque<String> segments = new ArrayDeque<>();
        DomElement current = element;
        while (current != null) {
            String tag = DomTraversal.lowerTag(current);
            if (tag.isEmpty()) {
                break;
            }
            DomElement parent = current.parent();
            segments.addFirst(segment(current, tag, parent));
            current = parent;
        }

        if (segments.isEmpty()) {
            return null;
        }
        return "/" + String.join("/", segments);
    }

    private String segment(DomElement element, String tag, DomElement parent) {
        List<DomElement> siblings = parent == null ? Collections.singletonList(element) : parent.children();

        int preceding = 0;
        boolean following = false;
        boolean passed = false;
        for (DomElement sibling : siblings) {
            if (sibling.equals(element)) {
                passed = true;
                continue;
            }
            if (!tag.equals(DomTraversal.lowerTag(sibling))) {
                continue;
            }
            if (passed) {
                following = true;
                break;
            }
            preceding++;
        }

        if (preceding > 0 || following) {
            return tag + "[" + (preceding + 1) + "]";
        }
        return tag;
    }

    static String xpathLiteral(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }
}
