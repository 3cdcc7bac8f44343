package com.mimecast.courier.attachment;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.mimecast.courier.form.AttachmentControl;
import com.mimecast.courier.form.JsonValues;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Attachment resolver.
 *
 * <p>Normalizes the many shapes an attachment control value comes in into descriptors.
 * <p>The rules, in order:
 * <ol>
 *   <li>An empty value yields nothing.</li>
 *   <li>A text value is parsed as nested JSON, else kept as a single URL if it starts with http, else dropped.</li>
 *   <li>Filename candidates come from the side-data.</li>
 *   <li>A lone entry is treated as a single element list.</li>
 *   <li>Each entry becomes a descriptor if it is a URL string or an object holding a token or URL.</li>
 * </ol>
 * <p>Never throws on malformed entries, those are skipped.
 */
public class AttachmentResolver {
    private static final Logger log = LogManager.getLogger(AttachmentResolver.class);

    static final String URL_PREFIX = "http";
    static final String FALLBACK_NAME = "attachment_";

    /**
     * Resolves an attachment control into descriptors.
     *
     * @param control AttachmentControl instance.
     * @return Ordered list of AttachmentDescriptor, possibly empty.
     */
    public List<AttachmentDescriptor> resolveAttachmentControl(AttachmentControl control) {
        List<AttachmentDescriptor> descriptors = new ArrayList<>();

        DecodedValue decoded = decodeValue(control.value());
        if (decoded.kind() == DecodedValue.Kind.EMPTY) {
            return descriptors;
        }
        if (decoded.kind() == DecodedValue.Kind.DISCARDED) {
            log.debug("Discarding unreadable value of attachment control '{}'", control.name());
            return descriptors;
        }

        List<String> names = filenameCandidates(control.ext());
        List<JsonElement> entries = entries(decoded.element());
        for (int i = 0; i < entries.size(); i++) {
            toDescriptor(entries.get(i), i, names).ifPresent(descriptors::add);
        }

        return descriptors;
    }

    /**
     * Decodes a raw attachment value.
     *
     * @param value Raw value, may be null.
     * @return DecodedValue instance.
     */
    public DecodedValue decodeValue(JsonElement value) {
        if (JsonValues.isEmpty(value)) {
            return DecodedValue.empty();
        }

        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            String text = value.getAsString();
            Optional<JsonElement> nested = JsonValues.parse(text);
            if (nested.isPresent()) {
                return JsonValues.isEmpty(nested.get())
                        ? DecodedValue.empty()
                        : new DecodedValue(DecodedValue.Kind.STRUCTURED, nested.get());
            }
            return text.startsWith(URL_PREFIX)
                    ? new DecodedValue(DecodedValue.Kind.DIRECT_URL, new JsonPrimitive(text))
                    : DecodedValue.discarded();
        }

        return new DecodedValue(DecodedValue.Kind.STRUCTURED, value);
    }

    /**
     * Gets filename candidates from attachment side-data.
     * <p>Text is split on commas, an object gives its name and a list is used as is.
     *
     * @param ext Side-data, may be null.
     * @return List of names, possibly empty.
     */
    public List<String> filenameCandidates(JsonElement ext) {
        List<String> names = new ArrayList<>();
        if (JsonValues.isEmpty(ext)) {
            return names;
        }

        if (ext.isJsonPrimitive()) {
            Arrays.stream(ext.getAsString().split(",", -1))
                    .map(String::trim)
                    .forEach(names::add);
        } else if (ext.isJsonObject()) {
            JsonValues.firstText(ext.getAsJsonObject(), "name", "file_name").ifPresent(names::add);
        } else if (ext.isJsonArray()) {
            for (JsonElement element : ext.getAsJsonArray()) {
                names.add(JsonValues.text(element));
            }
        }

        return names;
    }

    /**
     * Keeps the first descriptor per file token and per download URL.
     *
     * @param descriptors Descriptors in document order.
     * @return Deduplicated list in the same order.
     */
    public static List<AttachmentDescriptor> deduplicate(List<AttachmentDescriptor> descriptors) {
        Set<String> tokens = new HashSet<>();
        Set<String> urls = new HashSet<>();
        List<AttachmentDescriptor> unique = new ArrayList<>();

        for (AttachmentDescriptor descriptor : descriptors) {
            boolean seen = (descriptor.hasFileToken() && tokens.contains(descriptor.getFileToken())) ||
                    (descriptor.hasDownloadUrl() && urls.contains(descriptor.getDownloadUrl()));
            if (seen) {
                log.debug("Dropping duplicate attachment: {}", descriptor.getName());
                continue;
            }

            if (descriptor.hasFileToken()) {
                tokens.add(descriptor.getFileToken());
            }
            if (descriptor.hasDownloadUrl()) {
                urls.add(descriptor.getDownloadUrl());
            }
            unique.add(descriptor);
        }

        return unique;
    }

    /**
     * Normalizes a structured value into entries.
     *
     * @param element Decoded value.
     * @return List of entries.
     */
    private List<JsonElement> entries(JsonElement element) {
        List<JsonElement> entries = new ArrayList<>();
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            array.forEach(entries::add);
        } else {
            entries.add(element);
        }
        return entries;
    }

    /**
     * Converts a single entry.
     *
     * @param entry Entry.
     * @param index Zero based entry index.
     * @param names Filename candidates.
     * @return Optional of AttachmentDescriptor, empty if entry is unusable.
     */
    private Optional<AttachmentDescriptor> toDescriptor(JsonElement entry, int index, List<String> names) {
        String fallback = FALLBACK_NAME + (index + 1);

        if (entry.isJsonPrimitive() && entry.getAsJsonPrimitive().isString()) {
            String url = entry.getAsString();
            if (!url.startsWith(URL_PREFIX)) {
                return Optional.empty();
            }
            String name = index < names.size() && !names.get(index).isEmpty() ? names.get(index) : fallback;
            return Optional.of(new AttachmentDescriptor("", name, "", url));
        }

        if (!entry.isJsonObject()) {
            return Optional.empty();
        }

        JsonObject object = entry.getAsJsonObject();
        String fileToken = JsonValues.firstText(object, "file_token", "token").orElse("");
        String downloadUrl = JsonValues.firstText(object, "url", "download_url").orElse("");
        if (fileToken.isEmpty() && downloadUrl.isEmpty()) {
            log.debug("Skipping attachment entry {} without token or URL", index);
            return Optional.empty();
        }

        return Optional.of(new AttachmentDescriptor(
                fileToken,
                JsonValues.firstText(object, "name", "file_name").orElse(fallback),
                JsonValues.text(object.get("mime_type")),
                downloadUrl
        ));
    }
}
