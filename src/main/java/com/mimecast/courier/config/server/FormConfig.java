package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;

import java.util.Map;

/**
 * Approval form extraction configuration.
 *
 * <p>Names the form controls carrying the approval title and amount,
 * <br>the currency assumed when an amount control carries none,
 * <br>and the deepest row nesting the form walker will descend into.
 */
public class FormConfig extends BasicConfig {

    /**
     * Constructs a new FormConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public FormConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets title control label.
     *
     * @return Label string.
     */
    public String getTitleField() {
        return getStringProperty("titleField", "名称");
    }

    /**
     * Gets amount control label.
     *
     * @return Label string.
     */
    public String getAmountField() {
        return getStringProperty("amountField", "金额");
    }

    /**
     * Gets default currency code.
     *
     * @return Currency code string.
     */
    public String getDefaultCurrency() {
        return getStringProperty("defaultCurrency", "SEK");
    }

    /**
     * Gets maximum grouping control nesting depth.
     *
     * @return Depth limit.
     */
    public int getMaxDepth() {
        return Math.toIntExact(getLongProperty("maxDepth", 64L));
    }
}
