package com.mimecast.courier.form;

/**
 * A single named control of a submitted approval form.
 *
 * <p>Each declared type has its own implementation carrying only the data valid for it.
 * <br>Anything unrecognized is parsed into an {@link UnknownControl}.
 *
 * @see FormParser
 */
public interface FormControl {

    /**
     * Gets control label.
     *
     * @return Name string, empty if absent.
     */
    String name();

    /**
     * Gets declared control type.
     *
     * @return ControlType.
     */
    ControlType type();
}
