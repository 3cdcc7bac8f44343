/**
 * Feishu open platform client.
 *
 * <p>Covers the tenant access token, approval instance lookup, batch temporary download URLs and file downloads.
 */
package com.mimecast.courier.feishu;
