package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomDocument;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import io.hearthwarrio.elementscout.core.dom.FormControl;

import java.util.List;
import java.util.Locale;

import static io.hearthwarrio.elementscout.core.DomTraversal.emptyToNull;
import static io.hearthwarrio.elementscout.core.DomTraversal.normalizeText;

/**
 * Computes the human-readable name of an element and decides whether it is worth reporting.
 * <p>
 * Priority for {@code computedText}, first non-empty wins:
 * <ol>
 *   <li>{@code aria-label}</li>
 *   <li>text of the first {@code label[for=<id>]}</li>
 *   <li>text of the closest enclosing {@code label} (the element itself counts)</li>
 *   <li>own text content</li>
 *   <li>own value (form controls only)</li>
 *   <li>{@code placeholder}</li>
 *   <li>{@code name}</li>
 * </ol>
 * Every source is whitespace-normalized before it is compared.
 */
public class IdentifierResolver {

    public ElementText resolve(DomDocument document, DomElement element) {
        String ownText = normalizeText(element.textContent());
        FormControl control = element.formControl();
        String value = control == null ? "" : normalizeText(control.value());
        String visibleText = ownText.isEmpty() ? value : ownText;

        String labelText = resolveLabelText(document, element);

        String computedText = firstNonEmpty(
                normalizeText(element.attribute("aria-label")),
                labelText,
                ownText,
                value,
                normalizeText(element.attribute("placeholder")),
                normalizeText(element.attribute("name"))
        );

        return new ElementText(emptyToNull(visibleText), emptyToNull(labelText), computedText);
    }

    /**
     * Relevance gate: only elements with an id or a computed name are kept.
     */
    public boolean isMeaningful(DomElement element, ElementText text) {
        String id = element.attribute("id");
        if (id != null && !id.isEmpty()) {
            return true;
        }
        return text != null && !text.getComputedText().isEmpty();
    }

    private String resolveLabelText(DomDocument document, DomElement element) {
        String id = element.attribute("id");
        if (id != null && !id.isEmpty()) {
            List<DomElement> labels = document.querySelectorAll("label[for=" + cssAttrLiteral(id) + "]");
            if (labels != null && !labels.isEmpty()) {
                String t = normalizeText(labels.get(0).textContent());
                if (!t.isEmpty()) {
                    return t;
                }
            }
        }

        DomElement enclosing = DomTraversal.closest(element, "label", -1);
        if (enclosing != null) {
            return normalizeText(enclosing.textContent());
        }
        return "";
    }

    private static String firstNonEmpty(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isEmpty()) {
                return c;
            }
        }
        return "";
    }

    /**
     * Quotes a value for use inside a CSS attribute selector. Control characters become hex escapes
     * ({@code \A } for a newline), which a raw CSS string may not contain.
     */
    static String cssAttrLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' || ch == '"') {
                sb.append('\\').append(ch);
            } else if (ch < 0x20 || ch == 0x7F) {
                sb.append('\\').append(Integer.toHexString(ch).toUpperCase(Locale.ROOT)).append(' ');
            } else {
                sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }
}
