package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Metadata of the immediate parent element plus the nearest enclosing form.
 */
@JsonPropertyOrder({"tagName", "id", "role", "ariaLabel", "form"})
public final class AncestorContext {

    private final String tagName;
    private final String id;
    private final String role;
    private final String ariaLabel;
    private final FormReference form;

    @JsonCreator
    public AncestorContext(
            @JsonProperty("tagName") String tagName,
            @JsonProperty("id") String id,
            @JsonProperty("role") String role,
            @JsonProperty("ariaLabel") String ariaLabel,
            @JsonProperty("form") FormReference form
    ) {
        this.tagName = tagName;
        this.id = id;
        this.role = role;
        this.ariaLabel = ariaLabel;
        this.form = form;
    }

    /**
     * @return lower-cased tag name of the parent
     */
    @JsonProperty("tagName")
    public String getTagName() {
        return tagName;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("role")
    public String getRole() {
        return role;
    }

    @JsonProperty("ariaLabel")
    public String getAriaLabel() {
        return ariaLabel;
    }

    /**
     * @return nearest enclosing form, or {@code null} (omitted from JSON) when there is none
     */
    @JsonProperty("form")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public FormReference getForm() {
        return form;
    }

    @Override
    public String toString() {
        return "AncestorContext{" +
                "tagName='" + tagName + '\'' +
                ", id='" + id + '\'' +
                ", role='" + role + '\'' +
                ", ariaLabel='" + ariaLabel + '\'' +
                ", form=" + form +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AncestorContext)) return false;
        AncestorContext that = (AncestorContext) o;
        return Objects.equals(tagName, that.tagName) &&
                Objects.equals(id, that.id) &&
                Objects.equals(role, that.role) &&
                Objects.equals(ariaLabel, that.ariaLabel) &&
                Objects.equals(form, that.form);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, id, role, ariaLabel, form);
    }
}
