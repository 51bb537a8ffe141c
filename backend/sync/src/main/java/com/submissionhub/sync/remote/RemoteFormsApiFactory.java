package com.submissionhub.sync.remote;

import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.Credentials;

@FunctionalInterface
public interface RemoteFormsApiFactory {
    RemoteFormsApi open(Site site, Credentials credentials);
}
