package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approval category to destination mailbox configuration.
 *
 * <p>Keys are approval names exactly as reported by the approval API.
 * <br>An empty address disables forwarding for that category.
 *
 * <p>Example configuration:
 * <pre>{@code
 * {
 *   categories: {
 *     "费用报销": "expenses@example.com",
 *     "付款-瑞典对公-SHIC": "payments@example.com",
 *     "付款test": ""
 *   }
 * }
 * }</pre>
 */
public class CategoryConfig extends BasicConfig {

    /**
     * Constructs a new CategoryConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public CategoryConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the category mapping as an immutable copy.
     * <p>Non-string values are ignored.
     *
     * @return Map of category name to address.
     */
    public Map<String, String> getMappings() {
        Map<String, String> mappings = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            if (entry.getValue() instanceof String) {
                mappings.put(entry.getKey(), ((String) entry.getValue()).trim());
            }
        }
        return Collections.unmodifiableMap(mappings);
    }
}
