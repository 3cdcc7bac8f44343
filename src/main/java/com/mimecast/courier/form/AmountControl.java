package com.mimecast.courier.form;

/**
 * Monetary amount control.
 *
 * @param name     Control label.
 * @param value    Amount as entered, empty if absent.
 * @param currency Currency code from the control side-data, null if absent.
 */
public record AmountControl(String name, String value, String currency) implements FormControl {

    @Override
    public ControlType type() {
        return ControlType.AMOUNT;
    }
}
