package com.mimecast.courier.attachment;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Attachment descriptor.
 *
 * <p>Created from form data with at least one of file token or download URL set.
 * <br>The download URL may be filled in later from the token and content once downloaded.
 */
public class AttachmentDescriptor {

    private final String fileToken;
    private final String name;
    private final String mimeType;
    private String downloadUrl;
    private byte[] content;

    /**
     * Constructs a new AttachmentDescriptor instance.
     *
     * @param fileToken   File token, may be empty.
     * @param name        File name.
     * @param mimeType    MIME type, may be empty.
     * @param downloadUrl Download URL, may be empty.
     * @throws IllegalArgumentException If both file token and download URL are empty.
     */
    public AttachmentDescriptor(String fileToken, String name, String mimeType, String downloadUrl) {
        this.fileToken = StringUtils.defaultString(fileToken);
        this.name = StringUtils.defaultString(name);
        this.mimeType = StringUtils.defaultString(mimeType);
        this.downloadUrl = StringUtils.defaultString(downloadUrl);

        if (this.fileToken.isEmpty() && this.downloadUrl.isEmpty()) {
            throw new IllegalArgumentException("Attachment needs a file token or a download URL");
        }
    }

    /**
     * Gets file token.
     *
     * @return String, empty if none.
     */
    public String getFileToken() {
        return fileToken;
    }

    /**
     * Gets file name.
     *
     * @return String.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets MIME type.
     *
     * @return String, empty if none.
     */
    public String getMimeType() {
        return mimeType;
    }

    /**
     * Gets download URL.
     *
     * @return String, empty if none.
     */
    public String getDownloadUrl() {
        return downloadUrl;
    }

    /**
     * Sets download URL.
     *
     * @param downloadUrl Download URL.
     * @return Self.
     */
    public AttachmentDescriptor setDownloadUrl(String downloadUrl) {
        this.downloadUrl = StringUtils.defaultString(downloadUrl);
        return this;
    }

    /**
     * Has download URL.
     *
     * @return Boolean.
     */
    public boolean hasDownloadUrl() {
        return !downloadUrl.isEmpty();
    }

    /**
     * Has file token.
     *
     * @return Boolean.
     */
    public boolean hasFileToken() {
        return !fileToken.isEmpty();
    }

    /**
     * Gets downloaded content.
     *
     * @return Optional of byte array, empty until downloaded.
     */
    public Optional<byte[]> getContent() {
        return Optional.ofNullable(content);
    }

    /**
     * Sets downloaded content.
     *
     * @param content Byte array.
     * @return Self.
     */
    public AttachmentDescriptor setContent(byte[] content) {
        this.content = content;
        return this;
    }

    @Override
    public String toString() {
        return "AttachmentDescriptor{" +
                "name='" + name + '\'' +
                ", fileToken='" + fileToken + '\'' +
                ", downloadUrl='" + downloadUrl + '\'' +
                ", size=" + (content == null ? "n/a" : content.length) +
                '}';
    }
}
