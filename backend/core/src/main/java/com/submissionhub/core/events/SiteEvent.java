package com.submissionhub.core.events;

public interface SiteEvent extends Event {
    long siteId();
}
