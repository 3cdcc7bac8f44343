package com.mimecast.courier.form;

/**
 * Single or multiple choice control.
 *
 * @param name  Control label.
 * @param value Selected option text, empty if absent.
 */
public record SelectControl(String name, String value) implements FormControl {

    @Override
    public ControlType type() {
        return ControlType.SELECT;
    }
}
