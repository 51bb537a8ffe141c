package com.submissionhub.sync.read;

import com.submissionhub.core.model.ParsedFields;
import com.submissionhub.core.model.ResolvedForm;
import com.submissionhub.core.model.Site;
import com.submissionhub.sync.api.CredentialStore;
import com.submissionhub.sync.api.SiteRepository;
import com.submissionhub.sync.error.NotFoundException;
import com.submissionhub.sync.parse.EntryParser;
import com.submissionhub.sync.remote.EntryPage;
import com.submissionhub.sync.remote.RemoteEntry;
import com.submissionhub.sync.remote.RemoteFormsApi;
import com.submissionhub.sync.remote.RemoteFormsApiFactory;
import com.submissionhub.sync.resolve.ContactFormResolver;

import java.util.ArrayList;
import java.util.List;

// Takes no site lock and writes nothing, so it may run alongside a sync.
public final class ContactFormReader {
    private final SiteRepository siteRepository;
    private final CredentialStore credentialStore;
    private final RemoteFormsApiFactory apiFactory;
    private final ContactFormResolver resolver;
    private final EntryParser parser;

    public ContactFormReader(
            SiteRepository siteRepository,
            CredentialStore credentialStore,
            RemoteFormsApiFactory apiFactory,
            ContactFormResolver resolver,
            EntryParser parser
    ) {
        this.siteRepository = siteRepository;
        this.credentialStore = credentialStore;
        this.apiFactory = apiFactory;
        this.resolver = resolver;
        this.parser = parser;
    }

    /**
     * @throws IllegalArgumentException when {@code page} or {@code pageSize} is not positive
     * @throws NotFoundException when the site is unknown or has no contact form
     */
    public ContactFormEntries listContactFormEntries(long siteId, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and per_page must be positive");
        }
        Site site = siteRepository.find(siteId)
                .orElseThrow(() -> new NotFoundException("Site not found"));
        RemoteFormsApi api = apiFactory.open(site, credentialStore.credentialsFor(site));
        ResolvedForm form = resolver.resolveContactForm(site, api);
        EntryPage entryPage = api.fetchEntries(form.formId(), page, pageSize);

        List<ContactFormEntries.EntryView> views = new ArrayList<>();
        for (RemoteEntry entry : entryPage.entries()) {
            ParsedFields parsed = parser.parse(entry);
            views.add(new ContactFormEntries.EntryView(
                    entry.id(),
                    entry.status(),
                    entry.createdAt(),
                    parser.cleanedData(entry.response()),
                    parsed.submitterName().orElse(null),
                    parsed.submitterEmail().orElse(null),
                    parsed.subject().orElse(null),
                    parsed.message().orElse(null),
                    parsed.submittedAt()
            ));
        }

        ContactFormEntries.Pagination pagination = new ContactFormEntries.Pagination(
                entryPage.totalCount(),
                entryPage.perPage() == null ? pageSize : entryPage.perPage(),
                entryPage.currentPage(),
                entryPage.lastPage()
        );
        return new ContactFormEntries(form, pagination, views);
    }
}
