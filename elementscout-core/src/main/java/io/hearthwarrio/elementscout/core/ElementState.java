package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Interaction state of a scanned element.
 * <p>
 * Flags that do not apply to the element kind (for example {@code isChecked} on a link) are {@code false}.
 */
@JsonPropertyOrder({"isDisabled", "isReadOnly", "isChecked", "isSelected", "isHiddenByAria"})
public final class ElementState {

    private final boolean disabled;
    private final boolean readOnly;
    private final boolean checked;
    private final boolean selected;
    private final boolean hiddenByAria;

    @JsonCreator
    public ElementState(
            @JsonProperty("isDisabled") boolean disabled,
            @JsonProperty("isReadOnly") boolean readOnly,
            @JsonProperty("isChecked") boolean checked,
            @JsonProperty("isSelected") boolean selected,
            @JsonProperty("isHiddenByAria") boolean hiddenByAria
    ) {
        this.disabled = disabled;
        this.readOnly = readOnly;
        this.checked = checked;
        this.selected = selected;
        this.hiddenByAria = hiddenByAria;
    }

    @JsonProperty("isDisabled")
    public boolean isDisabled() {
        return disabled;
    }

    @JsonProperty("isReadOnly")
    public boolean isReadOnly() {
        return readOnly;
    }

    @JsonProperty("isChecked")
    public boolean isChecked() {
        return checked;
    }

    @JsonProperty("isSelected")
    public boolean isSelected() {
        return selected;
    }

    /**
     * @return {@code true} when the element carries {@code aria-hidden="true"}
     */
    @JsonProperty("isHiddenByAria")
    public boolean isHiddenByAria() {
        return hiddenByAria;
    }

    @Override
    public String toString() {
        return "ElementState{" +
                "disabled=" + disabled +
                ", readOnly=" + readOnly +
                ", checked=" + checked +
                ", selected=" + selected +
                ", hiddenByAria=" + hiddenByAria +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementState)) return false;
        ElementState that = (ElementState) o;
        return disabled == that.disabled &&
                readOnly == that.readOnly &&
                checked == that.checked &&
                selected == that.selected &&
                hiddenByAria == that.hiddenByAria;
    }

    @Override
    public int hashCode() {
        return Objects.hash(disabled, readOnly, checked, selected, hiddenByAria);
    }
}
