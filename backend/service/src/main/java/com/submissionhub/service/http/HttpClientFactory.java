package com.submissionhub.service.http;

import com.submissionhub.sync.config.SyncSettings;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

public final class HttpClientFactory {
    private static final Logger LOGGER = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
    }

    public static HttpClient create(SyncSettings settings) {
        return create(settings.requestTimeout(), System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                // shared hosting proxies often mishandle the h2c upgrade on plain http sites
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                // WordPress commonly redirects http to https and bare to www hosts
                .followRedirects(HttpClient.Redirect.NORMAL);
        TrustStoreSettings.fromEnvironment(environment).ifPresent(trustStore -> {
            builder.sslContext(trustStore.sslContext());
            LOGGER.info("Trusting site certificates from " + trustStore.type() + " store " + trustStore.path());
        });
        return builder.build();
    }
}
