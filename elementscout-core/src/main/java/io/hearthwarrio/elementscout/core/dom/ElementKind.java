package io.hearthwarrio.elementscout.core.dom;

import java.util.Locale;

/**
 * Coarse element kinds. Only {@link #FORM_CONTROL} elements expose a value and form state.
 */
public enum ElementKind {
    FORM_CONTROL,
    ANCHOR,
    HEADING,
    GENERIC;

    /**
     * Classifies a tag name.
     *
     * @param tagName tag name in any case (may be null)
     * @return element kind; {@link #GENERIC} for unknown or missing tags
     */
    public static ElementKind of(String tagName) {
        if (tagName == null) {
            return GENERIC;
        }
        switch (tagName.trim().toLowerCase(Locale.ROOT)) {
            case "input":
            case "button":
            case "select":
            case "textarea":
                return FORM_CONTROL;
            case "a":
                return ANCHOR;
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
                return HEADING;
            default:
                return GENERIC;
        }
    }
}
