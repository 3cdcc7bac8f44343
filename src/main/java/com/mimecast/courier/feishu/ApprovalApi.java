package com.mimecast.courier.feishu;

import java.util.Map;
import java.util.Set;

/**
 * Approval platform API.
 */
public interface ApprovalApi {

    /**
     * Gets approval instance details.
     *
     * @param instanceCode Instance code.
     * @return ApprovalInstance instance.
     * @throws RemoteApiException On transport failure, non-2xx status or non-zero response code.
     */
    ApprovalInstance getApprovalInstance(String instanceCode) throws RemoteApiException;

    /**
     * Gets temporary download URLs for file tokens.
     * <p>An empty set returns an empty map without a remote call.
     *
     * @param fileTokens File tokens.
     * @return Map of file token to download URL, tokens unknown to the platform are absent.
     * @throws RemoteApiException On transport failure, non-2xx status or non-zero response code.
     */
    Map<String, String> getFileDownloadUrls(Set<String> fileTokens) throws RemoteApiException;

    /**
     * Downloads a file following redirects.
     *
     * @param url Download URL.
     * @return Byte array.
     * @throws RemoteApiException On transport failure or non-2xx status.
     */
    byte[] downloadFile(String url) throws RemoteApiException;
}
