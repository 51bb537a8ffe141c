package com.submissionhub.sync.api;

import com.submissionhub.core.model.Site;
import com.submissionhub.sync.error.AuthenticationException;

public interface CredentialStore {
    /**
     * @throws AuthenticationException when no usable credentials exist for the site
     */
    Credentials credentialsFor(Site site);
}
