package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.DomElement;

/**
 * Record paired with the live element it was built from.
 * <p>
 * The element handle is only meaningful while the page that was scanned is still loaded.
 */
public final class ScannedElement {

    private final DomElement element;
    private final ElementRecord record;

    public ScannedElement(DomElement element, ElementRecord record) {
        this.element = element;
        this.record = record;
    }

    public DomElement getElement() {
        return element;
    }

    public ElementRecord getRecord() {
        return record;
    }

    @Override
    public String toString() {
        return "ScannedElement{record=" + record + '}';
    }
}
