package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.BoundingRect;
import io.hearthwarrio.elementscout.core.dom.DomElement;
import io.hearthwarrio.elementscout.core.dom.FormControl;

import static io.hearthwarrio.elementscout.core.DomTraversal.emptyToNull;

/**
 * Merges resolved text, ancestor context, XPath, raw attributes, state and geometry into one record.
 */
public class ElementRecordAssembler {

    public ElementRecord assemble(
            DomElement element,
            BoundingRect rect,
            ElementText text,
            AncestorContext context,
            String xpath
    ) {
        FormControl control = element.formControl();

        ElementAttributes attributes = new ElementAttributes(
                emptyToNull(element.attribute("id")),
                emptyToNull(element.attribute("class")),
                emptyToNull(element.attribute("name")),
                control == null ? null : emptyToNull(control.type()),
                emptyToNull(element.attribute("role")),
                emptyToNull(element.attribute("aria-label")),
                emptyToNull(element.attribute("placeholder")),
                emptyToNull(element.attribute("href"))
        );

        ElementState state = control == null
                ? new ElementState(false, false, false, false, isHiddenByAria(element))
                : new ElementState(
                control.isDisabled(),
                control.isReadOnly(),
                control.isChecked(),
                control.isSelected(),
                isHiddenByAria(element)
        );

        return new ElementRecord(
                DomTraversal.lowerTag(element),
                attributes,
                state,
                text,
                context,
                xpath,
                ElementLocation.of(rect)
        );
    }

    private boolean isHiddenByAria(DomElement element) {
        return "true".equals(element.attribute("aria-hidden"));
    }
}
