package com.mimecast.courier.approval;

/**
 * Outcome of handling an approval event.
 *
 * @param status          Outcome status.
 * @param reason          Skip reason, null when sent.
 * @param attachmentCount Number of attachments sent.
 */
public record ProcessingResult(Status status, SkipReason reason, int attachmentCount) {

    /**
     * Outcome status.
     */
    public enum Status {
        SENT,
        SKIPPED
    }

    /**
     * Reasons for not forwarding an approval.
     */
    public enum SkipReason {
        NOT_INSTANCE_EVENT,
        NOT_APPROVED,
        NO_INSTANCE_CODE,
        NO_DESTINATION,
        NO_ATTACHMENTS,
        NO_DOWNLOADS;

        /**
         * Gets the metric tag value.
         *
         * @return Lower case reason.
         */
        public String tag() {
            return name().toLowerCase();
        }
    }

    /**
     * Gets a sent outcome.
     *
     * @param attachmentCount Number of attachments sent.
     * @return ProcessingResult instance.
     */
    public static ProcessingResult sent(int attachmentCount) {
        return new ProcessingResult(Status.SENT, null, attachmentCount);
    }

    /**
     * Gets a skipped outcome.
     *
     * @param reason Skip reason.
     * @return ProcessingResult instance.
     */
    public static ProcessingResult skipped(SkipReason reason) {
        return new ProcessingResult(Status.SKIPPED, reason, 0);
    }

    /**
     * Was the approval forwarded.
     *
     * @return Boolean.
     */
    public boolean isSent() {
        return status == Status.SENT;
    }
}
