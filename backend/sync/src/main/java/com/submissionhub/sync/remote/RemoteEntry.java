package com.submissionhub.sync.remote;

public record RemoteEntry(Long id, Long formId, String status, String response, String createdAt) {
}
