package com.mimecast.courier.form;

import java.util.List;

/**
 * Grouping control holding rows of nested controls, like an itemized expense list.
 *
 * @param name      Control label.
 * @param rows      Ordered rows, each an ordered list of controls.
 * @param summaries Summary entries from the control side-data.
 */
public record FieldListControl(String name, List<List<FormControl>> rows, List<SummaryItem> summaries)
        implements FormControl {

    /**
     * Constructs a new FieldListControl with immutable copies of its contents.
     */
    public FieldListControl {
        rows = rows.stream().map(List::copyOf).toList();
        summaries = List.copyOf(summaries);
    }

    @Override
    public ControlType type() {
        return ControlType.FIELD_LIST;
    }
}
