package com.mimecast.courier.form;

/**
 * Plain text input control.
 *
 * @param name  Control label.
 * @param value Entered text, empty if absent.
 */
public record InputControl(String name, String value) implements FormControl {

    @Override
    public ControlType type() {
        return ControlType.INPUT;
    }
}
