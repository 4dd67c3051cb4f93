package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomElement;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Small DOM walking helpers shared by the resolvers.
 */
final class DomTraversal {

    private static final Pattern UNICODE_WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private DomTraversal() {
        // utility class
    }

    /**
     * Same as {@code Element.closest(tag)}: checks the element itself, then its ancestors.
     *
     * @param element  start element (may be null)
     * @param tagName  lower-cased tag to look for
     * @param maxDepth maximum number of ancestors to visit above the element; negative means unbounded
     * @return nearest matching element or {@code null}
     */
    static DomElement closest(DomElement element, String tagName, int maxDepth) {
        DomElement current = element;
        int depth = 0;
        while (current != null) {
            if (tagName.equals(lowerTag(current))) {
                return current;
            }
            if (maxDepth >= 0 && depth >= maxDepth) {
                return null;
            }
            current = current.parent();
            depth++;
        }
        return null;
    }

    static String lowerTag(DomElement element) {
        String tag = element.tagName();
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
    }

    static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    /**
     * Collapses whitespace runs to a single space and trims.
     * <p>
     * Unicode whitespace counts too, so {@code &nbsp;} and the other typographic spaces are collapsed.
     *
     * @return normalized text, never null
     */
    static String normalizeText(String s) {
        if (s == null) {
            return "";
        }
        return UNICODE_WHITESPACE.matcher(s).replaceAll(" ").trim();
    }
}
