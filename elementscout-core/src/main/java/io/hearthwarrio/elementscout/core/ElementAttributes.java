package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Identifying attributes of a scanned element. Absent or empty attributes are {@code null}.
 * <p>
 * {@code type} is only populated for form controls.
 */
@JsonPropertyOrder({"id", "class", "name", "type", "role", "ariaLabel", "placeholder", "href"})
public final class ElementAttributes {

    private final String id;
    private final String cssClass;
    private final String name;
    private final String type;
    private final String role;
    private final String ariaLabel;
    private final String placeholder;
    private final String href;

    @JsonCreator
    public ElementAttributes(
            @JsonProperty("id") String id,
            @JsonProperty("class") String cssClass,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("role") String role,
            @JsonProperty("ariaLabel") String ariaLabel,
            @JsonProperty("placeholder") String placeholder,
            @JsonProperty("href") String href
    ) {
        this.id = id;
        this.cssClass = cssClass;
        this.name = name;
        this.type = type;
        this.role = role;
        this.ariaLabel = ariaLabel;
        this.placeholder = placeholder;
        this.href = href;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    /**
     * Raw {@code class} attribute (all class tokens, space separated).
     */
    @JsonProperty("class")
    public String getCssClass() {
        return cssClass;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("role")
    public String getRole() {
        return role;
    }

    @JsonProperty("ariaLabel")
    public String getAriaLabel() {
        return ariaLabel;
    }

    @JsonProperty("placeholder")
    public String getPlaceholder() {
        return placeholder;
    }

    @JsonProperty("href")
    public String getHref() {
        return href;
    }

    @Override
    public String toString() {
        return "ElementAttributes{" +
                "id='" + id + '\'' +
                ", class='" + cssClass + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", role='" + role + '\'' +
                ", ariaLabel='" + ariaLabel + '\'' +
                ", placeholder='" + placeholder + '\'' +
                ", href='" + href + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementAttributes)) return false;
        ElementAttributes that = (ElementAttributes) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(cssClass, that.cssClass) &&
                Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(role, that.role) &&
                Objects.equals(ariaLabel, that.ariaLabel) &&
                Objects.equals(placeholder, that.placeholder) &&
                Objects.equals(href, that.href);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, cssClass, name, type, role, ariaLabel, placeholder, href);
    }
}
