/**
 * Approval event handling.
 *
 * <p>Webhook envelopes are filtered by {@link com.mimecast.courier.approval.ApprovalEventHandler}
 * <br>and approved instances forwarded by {@link com.mimecast.courier.approval.ApprovalProcessor}.
 *
 * <p>The subject of a forwarded approval reads {@code [approval name]-title}.
 * <br>The title is the first input control with the configured title label,
 * <br>falling back to the serial number and then the instance code.
 *
 * <p>Approvals are skipped, not failed, when:
 * <ul>
 *     <li>The category has no destination mailbox.</li>
 *     <li>The form has no attachments.</li>
 *     <li>None of the attachments could be downloaded.</li>
 * </ul>
 *
 * @see com.mimecast.courier.approval.ProcessingResult.SkipReason
 */
package com.mimecast.courier.approval;
