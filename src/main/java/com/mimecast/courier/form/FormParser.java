package com.mimecast.courier.form;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Approval form JSON parser.
 *
 * <p>Turns the form text returned by the approval API into a {@link FormDocument}.
 * <p>Parsing is best effort:
 * <ul>
 *   <li>Text that is not a JSON array yields an empty document.</li>
 *   <li>Entries that are not JSON objects are skipped.</li>
 *   <li>Grouping control rows that are not arrays are skipped.</li>
 *   <li>Unrecognized types become {@link UnknownControl}.</li>
 *   <li>Rows nested deeper than the configured limit are skipped with a warning.</li>
 * </ul>
 */
public class FormParser {
    private static final Logger log = LogManager.getLogger(FormParser.class);

    private final int maxDepth;

    /**
     * Constructs a new FormParser instance.
     *
     * @param maxDepth Deepest grouping row level to parse, top level being 0.
     */
    public FormParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Parses form JSON text.
     *
     * @param formJson Form JSON text.
     * @return FormDocument, empty if text is malformed.
     */
    public FormDocument parse(String formJson) {
        Optional<JsonElement> root = JsonValues.parse(formJson);
        if (root.isEmpty() || !root.get().isJsonArray()) {
            log.debug("Form text is not a JSON array, treating as empty form");
            return FormDocument.empty();
        }

        return new FormDocument(parseControls(root.get().getAsJsonArray(), 0));
    }

    /**
     * Parses a sequence of controls.
     *
     * @param array JSON array of controls.
     * @param depth Current nesting depth.
     * @return List of FormControl.
     */
    private List<FormControl> parseControls(JsonArray array, int depth) {
        List<FormControl> controls = new ArrayList<>();
        for (JsonElement element : array) {
            if (element.isJsonObject()) {
                controls.add(parseControl(element.getAsJsonObject(), depth));
            }
        }
        return controls;
    }

    /**
     * Parses a single control into its typed representation.
     *
     * @param object JSON object of the control.
     * @param depth  Current nesting depth.
     * @return FormControl.
     */
    private FormControl parseControl(JsonObject object, int depth) {
        String name = JsonValues.text(object.get("name"));
        JsonElement typeElement = object.get("type");
        String typeKey = typeElement != null && typeElement.isJsonPrimitive() ? typeElement.getAsString() : "";
        JsonElement value = object.get("value");
        JsonElement ext = object.get("ext");

        ControlType type = ControlType.fromKey(typeKey);
        return switch (type) {
            case INPUT -> new InputControl(name, JsonValues.text(value));
            case AMOUNT -> new AmountControl(name, JsonValues.text(value), currency(ext));
            case FIELD_LIST -> new FieldListControl(name, rows(name, value, depth), summaries(ext));
            case ATTACHMENT, ATTACHMENT_V2 -> new AttachmentControl(name, type, value, ext);
            case SELECT -> new SelectControl(name, JsonValues.text(value));
            case OTHER -> new UnknownControl(name, typeKey, JsonValues.text(value));
        };
    }

    /**
     * Reads currency code from amount side-data.
     *
     * @param ext Side-data.
     * @return Currency code or null if absent.
     */
    private String currency(JsonElement ext) {
        if (ext != null && ext.isJsonObject()) {
            String currency = JsonValues.text(ext.getAsJsonObject().get("currency")).trim();
            return currency.isEmpty() ? null : currency;
        }
        return null;
    }

    /**
     * Parses the rows of a grouping control.
     *
     * @param name  Control label, for logging.
     * @param value Raw value.
     * @param depth Depth of the grouping control.
     * @return List of rows.
     */
    private List<List<FormControl>> rows(String name, JsonElement value, int depth) {
        List<List<FormControl>> rows = new ArrayList<>();
        if (value == null || !value.isJsonArray()) {
            return rows;
        }

        if (depth + 1 > maxDepth) {
            log.warn("Skipping rows of grouping control '{}' nested beyond depth {}", name, maxDepth);
            return rows;
        }

        for (JsonElement row : value.getAsJsonArray()) {
            if (row.isJsonArray()) {
                rows.add(parseControls(row.getAsJsonArray(), depth + 1));
            }
        }
        return rows;
    }

    /**
     * Parses grouping control summary side-data.
     *
     * @param ext Side-data.
     * @return List of SummaryItem.
     */
    private List<SummaryItem> summaries(JsonElement ext) {
        List<SummaryItem> summaries = new ArrayList<>();
        if (ext == null || !ext.isJsonArray()) {
            return summaries;
        }

        for (JsonElement item : ext.getAsJsonArray()) {
            if (item.isJsonObject()) {
                JsonObject object = item.getAsJsonObject();
                summaries.add(new SummaryItem(
                        JsonValues.text(object.get("type")),
                        JsonValues.text(object.get("value")),
                        JsonValues.text(object.get("sumItems"))
                ));
            }
        }
        return summaries;
    }
}
