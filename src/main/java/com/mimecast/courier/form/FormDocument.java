package com.mimecast.courier.form;

import java.util.List;

/**
 * Parsed approval form, an ordered sequence of top level controls.
 *
 * @param controls Controls in document order.
 */
public record FormDocument(List<FormControl> controls) {

    /**
     * Constructs a new FormDocument with an immutable copy of the controls.
     */
    public FormDocument {
        controls = List.copyOf(controls);
    }

    /**
     * Gets an empty document.
     *
     * @return FormDocument instance.
     */
    public static FormDocument empty() {
        return new FormDocument(List.of());
    }

    /**
     * Is the document empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return controls.isEmpty();
    }
}
