package com.submissionhub.sync.resolve;

import com.submissionhub.core.model.RemoteForm;
import com.submissionhub.core.model.ResolvedForm;
import com.submissionhub.core.model.Site;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.remote.RemoteFormsApi;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

public final class ContactFormResolver {
    private static final Logger LOGGER = Logger.getLogger(ContactFormResolver.class.getName());

    private final ResolvedFormCache cache;
    private final List<String> allowedTitles;

    public ContactFormResolver(ResolvedFormCache cache, List<String> allowedTitles) {
        this.cache = cache;
        List<String> normalized = new ArrayList<>();
        for (String title : allowedTitles) {
            normalized.add(normalize(title));
        }
        this.allowedTitles = List.copyOf(normalized);
    }

    /**
     * @throws NotFoundException when the site lists no form with a contact title
     */
    public ResolvedForm resolveContactForm(Site site, RemoteFormsApi api) {
        return resolve(site, api).form()
                .orElseThrow(() -> new NotFoundException("No contact form found"));
    }

    public FormResolution resolve(Site site, RemoteFormsApi api) {
        if (site.contactFormId() != null) {
            return FormResolution.found(new ResolvedForm(site.contactFormId(), null, ResolvedForm.Source.PINNED), List.of());
        }

        AtomicReference<List<RemoteForm>> listed = new AtomicReference<>(List.of());
        Optional<ResolvedForm> resolved = cache.getOrLoad(site.id(), () -> {
            List<RemoteForm> forms = api.listForms();
            listed.set(forms);
            return match(forms).map(form -> new ResolvedForm(form.id(), form.title(), ResolvedForm.Source.DISCOVERED));
        });

        if (resolved.isEmpty()) {
            LOGGER.info("No contact form among " + listed.get().size() + " forms on site " + site.id());
            return FormResolution.notFound(listed.get());
        }
        ResolvedForm form = resolved.get();
        if (listed.get().isEmpty()) {
            form = form.withSource(ResolvedForm.Source.CACHED);
        }
        return FormResolution.found(form, listed.get());
    }

    public void forget(Site site) {
        cache.invalidate(site.id());
    }

    Optional<RemoteForm> match(List<RemoteForm> forms) {
        for (RemoteForm form : forms) {
            String title = normalize(form.title());
            if (allowedTitles.contains(title) || title.contains("contact form")) {
                return Optional.of(form);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String title) {
        return title == null ? "" : title.strip().toLowerCase(Locale.ROOT);
    }
}
