package com.submissionhub.service.credentials;

import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.CredentialStore;
import com.submissionhub.sync.api.Credentials;
import com.submissionhub.sync.error.AuthenticationException;

import java.util.Locale;
import java.util.Map;

// SITE_CREDENTIALS_<REF>=username:secret, REF upper-cased with anything outside [A-Z0-9] as _
public final class EnvironmentCredentialStore implements CredentialStore {
    static final String PREFIX = "SITE_CREDENTIALS_";

    private final Map<String, String> environment;

    public EnvironmentCredentialStore(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    @Override
    public Credentials credentialsFor(Site site) {
        if (site.credentialRef() == null || site.credentialRef().isBlank()) {
            throw new AuthenticationException("No credentials configured for site " + site.id());
        }
        String variable = variableName(site.credentialRef());
        String value = environment.get(variable);
        if (value == null || value.isBlank()) {
            throw new AuthenticationException("No credentials configured for site " + site.id() + " (" + variable + ")");
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new AuthenticationException(variable + " must be formatted as username:secret");
        }
        return new Credentials(value.substring(0, separator), value.substring(separator + 1));
    }

    static String variableName(String credentialRef) {
        return PREFIX + credentialRef.strip().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }
}
