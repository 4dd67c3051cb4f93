package io.hearthwarrio.elementscout.core.dom;

import java.util.List;

/**
 * Element node as seen by the scanner.
 * <p>
 * Implementations must implement {@link #equals(Object)} and {@link #hashCode()} as node identity:
 * two handles are equal iff they point at the same DOM node. Scan-local deduplication relies on it.
 */
public interface DomElement {

    /**
     * @return lower-cased tag name, e.g. {@code input}
     */
    String tagName();

    /**
     * @param name attribute name, e.g. {@code aria-label}
     * @return raw attribute value, or {@code null} when the attribute is absent
     */
    String attribute(String name);

    /**
     * @return raw text content of the element subtree (may be null or empty)
     */
    String textContent();

    /**
     * @return parent element, or {@code null} for the root element or a detached node
     */
    DomElement parent();

    /**
     * @return element children in document order; never null
     */
    List<DomElement> children();

    /**
     * @return viewport-relative bounding box at the time of the call
     */
    BoundingRect boundingRect();

    /**
     * @return {@code false} when the host reports no offset parent (the element or an ancestor is not rendered)
     */
    boolean hasOffsetParent();

    ComputedStyle computedStyle();

    /**
     * @return kind of the element, derived from the tag name by default
     */
    default ElementKind kind() {
        return ElementKind.of(tagName());
    }

    /**
     * Form control capability.
     *
     * @return form control view for {@link ElementKind#FORM_CONTROL} elements, {@code null} for every other kind
     */
    FormControl formControl();
}
