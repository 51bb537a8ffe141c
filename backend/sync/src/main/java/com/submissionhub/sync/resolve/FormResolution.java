package com.submissionhub.sync.resolve;

import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.core.model.ResolvedForm;

import java.util.List;
import java.util.Optional;

// discoveredForms holds the searched listing when nothing matched; empty when discovery was skipped.
public record FormResolution(ResolvedForm contactForm, List<RemoteForm> discoveredForms) {
    public FormResolution {
        discoveredForms = List.copyOf(discoveredForms);
    }

    public static FormResolution found(ResolvedForm form, List<RemoteForm> discovered) {
        return new FormResolution(form, discovered);
    }

    public static FormResolution notFound(List<RemoteForm> discovered) {
        return new FormResolution(null, discovered);
    }

    public Optional<ResolvedForm> form() {
        return Optional.ofNullable(contactForm);
    }
}
