package com.mimecast.courier.form;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import com.mimecast.courier.attachment.AttachmentResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Form walker.
 *
 * <p>Depth first traversal of a form producing a flat field list and the raw attachment list.
 * <p>Grouping controls are emitted before their rows so summaries stay readable.
 * <br>Attachment controls are handed to the {@link AttachmentResolver} instead of the field list.
 */
public class FormWalker {

    private final FormParser parser;
    private final AttachmentResolver resolver;

    /**
     * Constructs a new FormWalker instance.
     *
     * @param parser   FormParser instance.
     * @param resolver AttachmentResolver instance.
     */
    public FormWalker(FormParser parser, AttachmentResolver resolver) {
        this.parser = parser;
        this.resolver = resolver;
    }

    /**
     * Parses and walks form JSON text.
     *
     * @param formJson Form JSON text.
     * @return WalkResult, empty if text is malformed.
     */
    public WalkResult walk(String formJson) {
        return walk(parser.parse(formJson));
    }

    /**
     * Walks a parsed form.
     *
     * @param document FormDocument instance.
     * @return WalkResult instance.
     */
    public WalkResult walk(FormDocument document) {
        List<FormControl> fields = new ArrayList<>();
        List<AttachmentDescriptor> attachments = new ArrayList<>();
        walk(document.controls(), fields, attachments);
        return new WalkResult(fields, attachments);
    }

    private void walk(List<FormControl> controls, List<FormControl> fields, List<AttachmentDescriptor> attachments) {
        for (FormControl control : controls) {
            if (control instanceof AttachmentControl attachment) {
                attachments.addAll(resolver.resolveAttachmentControl(attachment));
            } else if (control instanceof FieldListControl group) {
                fields.add(group);
                for (List<FormControl> row : group.rows()) {
                    walk(row, fields, attachments);
                }
            } else {
                fields.add(control);
            }
        }
    }

    /**
     * Walk output.
     *
     * @param fields      Non-attachment controls in document order.
     * @param attachments Attachment descriptors in document order, not deduplicated.
     */
    public record WalkResult(List<FormControl> fields, List<AttachmentDescriptor> attachments) {

        /**
         * Constructs a new WalkResult with immutable lists.
         */
        public WalkResult {
            fields = List.copyOf(fields);
            attachments = List.copyOf(attachments);
        }
    }
}
