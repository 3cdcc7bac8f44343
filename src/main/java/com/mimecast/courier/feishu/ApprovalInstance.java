package com.mimecast.courier.feishu;

/**
 * Approval instance as returned by the approval API.
 *
 * @param instanceCode Instance code.
 * @param approvalName Approval definition name, the category.
 * @param form         Form JSON text.
 * @param serialNumber Serial number, empty if absent.
 * @param status       Instance status, empty if absent.
 */
public record ApprovalInstance(String instanceCode, String approvalName, String form, String serialNumber, String status) {
}
