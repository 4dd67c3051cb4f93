package io.hearthwarrio.elementscout.core.dom;

import java.util.Locale;
import java.util.Objects;

/**
 * The two computed style properties the visibility filter looks at.
 */
public final class ComputedStyle {

    public static final ComputedStyle DEFAULT = new ComputedStyle("block", "visible");

    private final String display;
    private final String visibility;

    public ComputedStyle(String display, String visibility) {
        this.display = normalize(display);
        this.visibility = normalize(visibility);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    public String getDisplay() {
        return display;
    }

    public String getVisibility() {
        return visibility;
    }

    public boolean isDisplayNone() {
        return "none".equals(display);
    }

    public boolean isVisibilityHidden() {
        return "hidden".equals(visibility);
    }

    @Override
    public String toString() {
        return "ComputedStyle{display='" + display + "', visibility='" + visibility + "'}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComputedStyle)) return false;
        ComputedStyle that = (ComputedStyle) o;
        return Objects.equals(display, that.display) &&
                Objects.equals(visibility, that.visibility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(display, visibility);
    }
}
