package com.mimecast.courier.form;

/**
 * Summary entry from the side-data of a grouping control.
 *
 * <p>Amount summaries carry their per-currency totals as JSON text in {@code sumItems}.
 *
 * @param type     Summarized control type key.
 * @param value    Raw summary value, empty if absent.
 * @param sumItems JSON encoded list of value and currency pairs, empty if absent.
 */
public record SummaryItem(String type, String value, String sumItems) {

    /**
     * Is this a monetary summary.
     *
     * @return Boolean.
     */
    public boolean isAmount() {
        return ControlType.AMOUNT.getKey().equals(type);
    }
}
