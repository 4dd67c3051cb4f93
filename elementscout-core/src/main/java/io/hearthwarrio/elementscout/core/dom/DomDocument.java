package io.hearthwarrio.elementscout.core.dom;

import java.util.List;

/**
 * Read-only view of an already rendered document.
 * <p>
 * The scanner never touches a browser global directly: Selenium, test doubles and any other DOM-like host
 * plug in through this interface.
 */
public interface DomDocument {

    /**
     * Runs a CSS selector list against the whole document.
     *
     * @param cssSelectorList comma separated selector list
     * @return matching elements in document order, each element at most once; never null
     */
    List<DomElement> querySelectorAll(String cssSelectorList);
}
