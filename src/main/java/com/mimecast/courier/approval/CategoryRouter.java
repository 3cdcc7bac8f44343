package com.mimecast.courier.approval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Routes approval categories to destination mailboxes.
 *
 * <p>Lookup is exact. A category mapped to an empty address is treated as unmapped.
 */
public class CategoryRouter {

    private final Map<String, String> mappings;

    /**
     * Constructs a new CategoryRouter instance.
     *
     * @param mappings Map of approval name to address.
     */
    public CategoryRouter(Map<String, String> mappings) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    /**
     * Gets the destination for a category.
     *
     * @param categoryName Approval name.
     * @return Optional of address, empty if unmapped.
     */
    public Optional<String> route(String categoryName) {
        if (categoryName == null) {
            return Optional.empty();
        }
        String address = mappings.get(categoryName);
        return address == null || address.isBlank() ? Optional.empty() : Optional.of(address);
    }
}
