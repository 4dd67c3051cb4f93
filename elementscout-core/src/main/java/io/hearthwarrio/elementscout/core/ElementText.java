package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Three text views of an element, all whitespace-normalized.
 */
@JsonPropertyOrder({"visibleText", "labelText", "computedText"})
public final class ElementText {

    private final String visibleText;
    private final String labelText;
    private final String computedText;

    @JsonCreator
    public ElementText(
            @JsonProperty("visibleText") String visibleText,
            @JsonProperty("labelText") String labelText,
            @JsonProperty("computedText") String computedText
    ) {
        this.visibleText = visibleText;
        this.labelText = labelText;
        this.computedText = computedText == null ? "" : computedText;
    }

    /**
     * @return own text content, falling back to the control value; {@code null} when both are empty
     */
    @JsonProperty("visibleText")
    public String getVisibleText() {
        return visibleText;
    }

    /**
     * @return text of the associated or enclosing label; {@code null} when there is none
     */
    @JsonProperty("labelText")
    public String getLabelText() {
        return labelText;
    }

    /**
     * @return best-guess human-readable name; empty only for records kept because they carry an id
     */
    @JsonProperty("computedText")
    public String getComputedText() {
        return computedText;
    }

    @Override
    public String toString() {
        return "ElementText{" +
                "visibleText='" + visibleText + '\'' +
                ", labelText='" + labelText + '\'' +
                ", computedText='" + computedText + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementText)) return false;
        ElementText that = (ElementText) o;
        return Objects.equals(visibleText, that.visibleText) &&
                Objects.equals(labelText, that.labelText) &&
                Objects.equals(computedText, that.computedText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visibleText, labelText, computedText);
    }
}
