package com.submissionhub.sync.remote;

public record RemoteUser(long id, String name) {
}
