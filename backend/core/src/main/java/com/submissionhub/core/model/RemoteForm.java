package com.submissionhub.core.model;

public record RemoteForm(long id, String title, String status) {
}
