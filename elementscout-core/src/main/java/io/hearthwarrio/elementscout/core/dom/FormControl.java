package io.hearthwarrio.elementscout.core.dom;

/**
 * Live properties of a form control (input, button, select, textarea).
 * <p>
 * Values are DOM properties, not attributes: {@link #value()} reflects what the user typed and
 * {@link #type()} is the normalized control type (an input without a type attribute reports {@code text}).
 */
public interface FormControl {

    String value();

    String type();

    boolean isDisabled();

    boolean isReadOnly();

    boolean isChecked();

    boolean isSelected();
}
