package com.mimecast.courier.approval;

import com.mimecast.courier.attachment.AttachmentDescriptor;

import java.util.List;

/**
 * Formats approval notifications.
 */
public class NotificationComposer {

    /**
     * Composes a notification.
     *
     * @param to           Destination address.
     * @param approvalName Approval category name.
     * @param summary      Extracted summary with resolved title.
     * @param attachments  Downloaded attachments.
     * @return Notification instance.
     */
    public Notification compose(String to, String approvalName, ExtractedSummary summary, List<AttachmentDescriptor> attachments) {
        String subject = "[" + approvalName + "]-" + summary.title();
        String body = "审批已通过\n\n" +
                "审批类型: " + approvalName + "\n" +
                "审批标题: " + summary.title() + "\n" +
                "审批金额: " + summary.amount() + "\n" +
                "附件数量: " + attachments.size() + "\n";

        return new Notification(to, subject, body, attachments);
    }
}
