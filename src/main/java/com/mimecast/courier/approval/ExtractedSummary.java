package com.mimecast.courier.approval;

/**
 * Title and amount derived from a walked form.
 *
 * @param title  Title, empty if the form has none.
 * @param amount Human readable amount annotated with currency, empty if the form has none.
 */
public record ExtractedSummary(String title, String amount) {
}
