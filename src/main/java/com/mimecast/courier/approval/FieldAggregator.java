package com.mimecast.courier.approval;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.mimecast.courier.config.server.FormConfig;
import com.mimecast.courier.form.AmountControl;
import com.mimecast.courier.form.FieldListControl;
import com.mimecast.courier.form.FormControl;
import com.mimecast.courier.form.InputControl;
import com.mimecast.courier.form.JsonValues;
import com.mimecast.courier.form.SummaryItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Field aggregator.
 *
 * <p>Derives title and amount from walked form fields using first match rules in document order.
 * <p>The amount comes from a labelled amount control if present.
 * <br>Otherwise the first grouping control with a monetary summary provides per currency totals.
 */
public class FieldAggregator {

    private final String titleField;
    private final String amountField;
    private final String defaultCurrency;

    /**
     * Constructs a new FieldAggregator instance.
     *
     * @param titleField      Title control label.
     * @param amountField     Amount control label.
     * @param defaultCurrency Currency used when an amount control has none.
     */
    public FieldAggregator(String titleField, String amountField, String defaultCurrency) {
        this.titleField = titleField;
        this.amountField = amountField;
        this.defaultCurrency = defaultCurrency;
    }

    /**
     * Constructs a new FieldAggregator instance from form configuration.
     *
     * @param config FormConfig instance.
     */
    public FieldAggregator(FormConfig config) {
        this(config.getTitleField(), config.getAmountField(), config.getDefaultCurrency());
    }

    /**
     * Aggregates fields into a summary.
     *
     * @param fields Walked fields in document order.
     * @return ExtractedSummary instance.
     */
    public ExtractedSummary aggregate(List<FormControl> fields) {
        return new ExtractedSummary(title(fields), labelledAmount(fields).or(() -> summaryAmount(fields)).orElse(""));
    }

    private String title(List<FormControl> fields) {
        for (FormControl field : fields) {
            if (field instanceof InputControl input && titleField.equals(input.name())) {
                return input.value();
            }
        }
        return "";
    }

    private Optional<String> labelledAmount(List<FormControl> fields) {
        for (FormControl field : fields) {
            if (field instanceof AmountControl amount && amountField.equals(amount.name())) {
                String currency = amount.currency() != null ? amount.currency() : defaultCurrency;
                return Optional.of(amount.value() + " " + currency);
            }
        }
        return Optional.empty();
    }

    private Optional<String> summaryAmount(List<FormControl> fields) {
        for (FormControl field : fields) {
            if (field instanceof FieldListControl group) {
                for (SummaryItem summary : group.summaries()) {
                    if (!summary.isAmount() || summary.sumItems().isEmpty()) {
                        continue;
                    }

                    String rendered = renderSumItems(summary);
                    if (!rendered.isEmpty()) {
                        return Optional.of(rendered);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Renders summed totals as "v1 c1, v2 c2".
     * <p>Falls back to the raw summary value if the totals are not a readable list.
     *
     * @param summary SummaryItem instance.
     * @return Rendered amount, possibly empty.
     */
    private String renderSumItems(SummaryItem summary) {
        Optional<JsonElement> parsed = JsonValues.parse(summary.sumItems());
        if (parsed.isEmpty() || !parsed.get().isJsonArray()) {
            return summary.value();
        }

        List<String> parts = new ArrayList<>();
        for (JsonElement item : parsed.get().getAsJsonArray()) {
            if (item.isJsonObject()) {
                JsonObject object = item.getAsJsonObject();
                parts.add(JsonValues.text(object.get("value")) + " " + JsonValues.text(object.get("currency")));
            }
        }
        return String.join(", ", parts);
    }
}
