package com.submissionhub.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

// Replaces the JDK trust anchors for sites served with self-signed or private-CA certificates.
record TrustStoreSettings(Path path, char[] password, String type) {
    static final String PATH_VARIABLE = "TRUSTSTORE_PATH";
    static final String PASSWORD_VARIABLE = "TRUSTSTORE_PASSWORD";
    static final String TYPE_VARIABLE = "TRUSTSTORE_TYPE";

    static Optional<TrustStoreSettings> fromEnvironment(Map<String, String> environment) {
        String rawPath = environment.get(PATH_VARIABLE);
        if (rawPath == null || rawPath.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(PASSWORD_VARIABLE);
        if (password == null) {
            throw new IllegalStateException(PASSWORD_VARIABLE + " is required when " + PATH_VARIABLE + " is set");
        }
        Path path = Path.of(rawPath.strip());
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Trust store not found: " + path);
        }
        String type = environment.get(TYPE_VARIABLE);
        if (type == null || type.isBlank()) {
            type = typeFromExtension(path);
        }
        return Optional.of(new TrustStoreSettings(path, password.toCharArray(), type.strip().toUpperCase(Locale.ROOT)));
    }

    SSLContext sslContext() {
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type);
            trustStore.load(in, password);
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), null);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Could not load " + type + " trust store " + path, e);
        }
    }

    private static String typeFromExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
