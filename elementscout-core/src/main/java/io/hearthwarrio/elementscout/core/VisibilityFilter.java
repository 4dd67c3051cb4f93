package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.BoundingRect;
import io.hearthwarrio.elementscout.core.dom.ComputedStyle;
import io.hearthwarrio.elementscout.core.dom.DomElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects candidates that are not rendered.
 * <p>
 * An element is invisible when its bounding box has zero width or height, it has no offset parent,
 * its computed {@code visibility} is {@code hidden} or its computed {@code display} is {@code none}.
 * <p>
 * Elements with {@code opacity: 0} that still take up space are kept. Elements without an offset parent for
 * other reasons (for example {@code position: fixed}) are dropped, as the host reports them that way.
 */
public class VisibilityFilter {

    public boolean isVisible(DomElement element) {
        return isVisible(element, element.boundingRect());
    }

    /**
     * Same as {@link #isVisible(DomElement)} but reuses an already fetched bounding box.
     * <p>
     * Checks run cheapest first and stop at the first failing one.
     */
    public boolean isVisible(DomElement element, BoundingRect rect) {
        if (rect == null || rect.isEmpty()) {
            return false;
        }
        if (!element.hasOffsetParent()) {
            return false;
        }
        ComputedStyle style = element.computedStyle();
        if (style == null) {
            return true;
        }
        return !style.isVisibilityHidden() && !style.isDisplayNone();
    }

    public List<DomElement> filter(List<DomElement> candidates) {
        List<DomElement> out = new ArrayList<>(candidates.size());
        for (DomElement candidate : candidates) {
            if (isVisible(candidate)) {
                out.add(candidate);
            }
        }
        return out;
    }
}
