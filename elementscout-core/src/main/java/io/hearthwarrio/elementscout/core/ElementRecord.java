package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structured description of one meaningful interactive element found by a scan.
 * <p>
 * Records are plain values: they hold no reference to the DOM node and do not outlive the caller's use
 * of the scan result.
 */
@JsonPropertyOrder({"tagName", "attributes", "state", "text", "context", "xpath", "location"})
public final class ElementRecord {

    private final String tagName;
    private final ElementAttributes attributes;
    private final ElementState state;
    private final ElementText text;
    private final AncestorContext context;
    private final String xpath;
    private final ElementLocation location;

    @JsonCreator
    public ElementRecord(
            @JsonProperty("tagName") String tagName,
            @JsonProperty("attributes") ElementAttributes attributes,
            @JsonProperty("state") ElementState state,
            @JsonProperty("text") ElementText text,
            @JsonProperty("context") AncestorContext context,
            @JsonProperty("xpath") String xpath,
            @JsonProperty("location") ElementLocation location
    ) {
        this.tagName = Objects.requireNonNull(tagName, "tagName must not be null");
        this.attributes = Objects.requireNonNull(attributes, "attributes must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.context = context;
        this.xpath = xpath;
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    @JsonProperty("tagName")
    public String getTagName() {
        return tagName;
    }

    @JsonProperty("attributes")
    public ElementAttributes getAttributes() {
        return attributes;
    }

    @JsonProperty("state")
    public ElementState getState() {
        return state;
    }

    @JsonProperty("text")
    public ElementText getText() {
        return text;
    }

    /**
     * @return parent/form context, or {@code null} for an element without a parent
     */
    @JsonProperty("context")
    public AncestorContext getContext() {
        return context;
    }

    /**
     * @return id shortcut or positional path; {@code null} only when no element chain was reachable
     */
    @JsonProperty("xpath")
    public String getXpath() {
        return xpath;
    }

    @JsonProperty("location")
    public ElementLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "ElementRecord{" +
                "tagName='" + tagName + '\'' +
                ", attributes=" + attributes +
                ", state=" + state +
                ", text=" + text +
                ", context=" + context +
                ", xpath='" + xpath + '\'' +
                ", location=" + location +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementRecord)) return false;
        ElementRecord that = (ElementRecord) o;
        return Objects.equals(tagName, that.tagName) &&
                Objects.equals(attributes, that.attributes) &&
                Objects.equals(state, that.state) &&
                Objects.equals(text, that.text) &&
                Objects.equals(context, that.context) &&
                Objects.equals(xpath, that.xpath) &&
                Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, attributes, state, text, context, xpath, location);
    }
}
