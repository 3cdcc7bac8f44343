/**
 * Attachment resolution and download.
 *
 * @see com.mimecast.courier.attachment.AttachmentResolver
 * @see com.mimecast.courier.attachment.AttachmentDownloader
 */
package com.mimecast.courier.attachment;
