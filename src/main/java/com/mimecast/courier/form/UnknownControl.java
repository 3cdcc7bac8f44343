package com.mimecast.courier.form;

/**
 * Control of an unrecognized or malformed type.
 *
 * <p>Kept for completeness of the walk; never matched by extraction rules.
 *
 * @param name         Control label.
 * @param declaredType Type key as found in the form, empty if absent.
 * @param value        Value rendered as text, empty if absent.
 */
public record UnknownControl(String name, String declaredType, String value) implements FormControl {

    @Override
    public ControlType type() {
        return ControlType.OTHER;
    }
}
