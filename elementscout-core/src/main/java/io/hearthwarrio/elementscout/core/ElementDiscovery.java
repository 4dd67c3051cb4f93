package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomDocument;
import io.hearthwarrio.elementscout.core.dom.DomElement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates candidate elements a user is likely to interact with.
 * <p>
 * The selector set is fixed. All patterns go to the host as one selector list so that results come back
 * in document order.
 */
public class ElementDiscovery {

    /**
     * Fixed candidate selectors: links, form controls, labels, headings h1-h4, ARIA button/link/tab roles
     * and anything with an inline click handler.
     */
    public static final List<String> INTERACTIVE_SELECTORS = Collections.unmodifiableList(Arrays.asList(
            "a",
            "button",
            "input",
            "select",
            "textarea",
            "label",
            "h1",
            "h2",
            "h3",
            "h4",
            "[role=\"button\"]",
            "[role=\"link\"]",
            "[role=\"tab\"]",
            "[onclick]"
    ));

    static final String INTERACTIVE_SELECTOR_LIST = String.join(", ", INTERACTIVE_SELECTORS);

    /**
     * Collects candidates in document order.
     * <p>
     * A node matched by more than one pattern (for example a {@code <button onclick>}) is returned once.
     * The dedup set lives only for this call.
     *
     * @param document document to scan
     * @return candidates; may be empty
     */
    public List<DomElement> discover(DomDocument document) {
        Objects.requireNonNull(document, "document must not be null");

        List<DomElement> matched = document.querySelectorAll(INTERACTIVE_SELECTOR_LIST);
        if (matched == null || matched.isEmpty()) {
            return Collections.emptyList();
        }

        Set<DomElement> seen = new HashSet<>();
        List<DomElement> out = new ArrayList<>(matched.size());
        for (DomElement element : matched) {
            if (element == null) {
                continue;
            }
            if (seen.add(element)) {
                out.add(element);
            }
        }
        return out;
    }
}
