package com.mimecast.courier.form;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import com.mimecast.courier.attachment.AttachmentResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FormWalker.
 */
class FormWalkerTest {

    private final FormWalker walker = new FormWalker(new FormParser(64), new AttachmentResolver());

    @Test
    void testMalformedFormYieldsEmptyResult() {
        FormWalker.WalkResult result = walker.walk("{not json");
        assertTrue(result.fields().isEmpty());
        assertTrue(result.attachments().isEmpty());
    }

    @Test
    void testEmptyDocument() {
        FormWalker.WalkResult result = walker.walk(FormDocument.empty());
        assertTrue(result.fields().isEmpty());
        assertTrue(result.attachments().isEmpty());
    }

    @Test
    void testFlatForm() {
        FormWalker.WalkResult result = walker.walk("[" +
                "{\"name\":\"名称\",\"type\":\"input\",\"value\":\"Taxi\"}," +
                "{\"name\":\"Receipt\",\"type\":\"attachmentV2\",\"value\":\"http://x/y.pdf\"}," +
                "{\"name\":\"Kind\",\"type\":\"select\",\"value\":\"Travel\"}" +
                "]");

        assertEquals(List.of("名称", "Kind"), names(result.fields()));
        assertEquals(1, result.attachments().size());
        assertEquals("http://x/y.pdf", result.attachments().get(0).getDownloadUrl());
    }

    @Test
    void testNestedRowsFlattenedInDocumentOrder() {
        String json = "[" +
                "{\"name\":\"Top\",\"type\":\"input\",\"value\":\"t\"}," +
                "{\"name\":\"Items\",\"type\":\"fieldList\",\"value\":[" +
                "  [{\"name\":\"Row1\",\"type\":\"input\",\"value\":\"1\"}," +
                "   {\"name\":\"File1\",\"type\":\"attachment\",\"value\":[{\"file_token\":\"tok1\",\"name\":\"a.pdf\"}]}]," +
                "  [{\"name\":\"Sub\",\"type\":\"fieldList\",\"value\":[" +
                "     [{\"name\":\"Row2\",\"type\":\"amount\",\"value\":\"5\"}," +
                "      {\"name\":\"File2\",\"type\":\"attachmentV2\",\"value\":\"[{\\\"token\\\":\\\"tok2\\\"}]\"}]" +
                "  ]}]" +
                "]}," +
                "{\"name\":\"Last\",\"type\":\"date\",\"value\":\"x\"}," +
                "{\"name\":\"File3\",\"type\":\"attachment\",\"value\":[{\"url\":\"http://z/3\"}]}" +
                "]";

        FormWalker.WalkResult result = walker.walk(json);

        assertEquals(List.of("Top", "Items", "Row1", "Sub", "Row2", "Last"), names(result.fields()));
        assertEquals(List.of("a.pdf", "attachment_1", "attachment_1"),
                result.attachments().stream().map(AttachmentDescriptor::getName).collect(Collectors.toList()));
        assertEquals("tok1", result.attachments().get(0).getFileToken());
        assertEquals("tok2", result.attachments().get(1).getFileToken());
        assertEquals("http://z/3", result.attachments().get(2).getDownloadUrl());
    }

    @Test
    void testAttachmentControlsNeverInFields() {
        FormWalker.WalkResult result = walker.walk("[" +
                "{\"name\":\"Empty\",\"type\":\"attachment\",\"value\":\"\"}," +
                "{\"name\":\"Junk\",\"type\":\"attachmentV2\",\"value\":\"not a url\"}" +
                "]");

        assertTrue(result.fields().isEmpty());
        assertTrue(result.attachments().isEmpty());
    }

    @Test
    void testDuplicatesKeptByWalk() {
        FormWalker.WalkResult result = walker.walk("[" +
                "{\"name\":\"A\",\"type\":\"attachment\",\"value\":[{\"file_token\":\"same\"}]}," +
                "{\"name\":\"B\",\"type\":\"attachment\",\"value\":[{\"file_token\":\"same\"}]}" +
                "]");

        assertEquals(2, result.attachments().size());
        assertEquals(1, AttachmentResolver.deduplicate(result.attachments()).size());
    }

    @Test
    void testResultIsImmutable() {
        FormWalker.WalkResult result = walker.walk("[{\"name\":\"A\",\"type\":\"input\",\"value\":\"a\"}]");
        assertThrows(UnsupportedOperationException.class, () -> result.fields().add(new InputControl("B", "b")));
    }

    private static List<String> names(List<FormControl> controls) {
        return controls.stream().map(FormControl::name).collect(Collectors.toList());
    }
}
