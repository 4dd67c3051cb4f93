package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomElement;

import static io.hearthwarrio.elementscout.core.DomTraversal.emptyToNull;

/**
 * Captures the immediate parent and the nearest enclosing form of an element.
 */
public class AncestorContextExtractor {

    /**
     * Upper bound on the number of ancestors visited while looking for an enclosing form.
     */
    public static final int MAX_FORM_SEARCH_DEPTH = 50;

    /**
     * @param element scanned element
     * @return context, or {@code null} when the element has no parent
     */
    public AncestorContext extract(DomElement element) {
        DomElement parent = element.parent();
        if (parent == null) {
            return null;
        }

        return new AncestorContext(
                DomTraversal.lowerTag(parent),
                emptyToNull(parent.attribute("id")),
                emptyToNull(parent.attribute("role")),
                emptyToNull(parent.attribute("aria-label")),
                resolveForm(element)
        );
    }

    private FormReference resolveForm(DomElement element) {
        DomElement form = DomTraversal.closest(element, "form", MAX_FORM_SEARCH_DEPTH);
        if (form == null) {
            return null;
        }
        return new FormReference(
                emptyToNull(form.attribute("id")),
                emptyToNull(form.attribute("name"))
        );
    }
}
