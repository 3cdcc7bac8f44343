package com.mimecast.courier.approval;

import com.mimecast.courier.feishu.ApprovalApi;
import com.mimecast.courier.feishu.ApprovalInstance;
import com.mimecast.courier.feishu.RemoteApiException;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory ApprovalApi recording every call.
 */
class FakeApprovalApi implements ApprovalApi {

    final Map<String, ApprovalInstance> instances = new HashMap<>();
    final Map<String, String> tokenUrls = new HashMap<>();
    final Set<String> failingUrls = new HashSet<>();

    final List<String> instanceCalls = new CopyOnWriteArrayList<>();
    final List<Set<String>> urlCalls = new CopyOnWriteArrayList<>();
    final List<String> downloadCalls = new CopyOnWriteArrayList<>();

    RemoteApiException instanceFailure;
    RemoteApiException urlFailure;

    FakeApprovalApi withInstance(String code, String name, String form, String serial) {
        instances.put(code, new ApprovalInstance(code, name, form, serial, "APPROVED"));
        return this;
    }

    @Override
    public ApprovalInstance getApprovalInstance(String instanceCode) throws RemoteApiException {
        instanceCalls.add(instanceCode);
        if (instanceFailure != null) {
            throw instanceFailure;
        }
        ApprovalInstance instance = instances.get(instanceCode);
        if (instance == null) {
            throw new RemoteApiException("Unknown instance: " + instanceCode);
        }
        return instance;
    }

    @Override
    public Map<String, String> getFileDownloadUrls(Set<String> fileTokens) throws RemoteApiException {
        urlCalls.add(new LinkedHashSet<>(fileTokens));
        if (urlFailure != null) {
            throw urlFailure;
        }
        Map<String, String> urls = new HashMap<>();
        for (String token : fileTokens) {
            if (tokenUrls.containsKey(token)) {
                urls.put(token, tokenUrls.get(token));
            }
        }
        return urls;
    }

    @Override
    public byte[] downloadFile(String url) throws RemoteApiException {
        downloadCalls.add(url);
        if (failingUrls.contains(url)) {
            throw new RemoteApiException("Download failed with status: 404");
        }
        return ("content of " + url).getBytes(StandardCharsets.UTF_8);
    }
}
