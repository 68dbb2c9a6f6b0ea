package io.mindmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.mindmesh.util.Jsons;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * TLS material for mesh endpoints. Servers load a PKCS12 keystore; clients either trust a
 * truststore or, for local testing only, trust everything. Both sides can reject certificates
 * listed in a revocation file.
 */
public final class MeshTls {
    private MeshTls() {
    }

    public static SSLContext serverContext(TlsSettings settings) throws IOException, GeneralSecurityException {
        if (settings.keystorePath() == null || settings.keystorePath().isBlank()) {
            throw new IllegalArgumentException("tls keystore path is required for a tls listener");
        }
        String password = settings.keystorePassword() == null ? "" : settings.keystorePassword();
        KeyStore keyStore = loadKeyStore(Path.of(settings.keystorePath()), password, settings.storeType());
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, password.toCharArray());

        TrustManager[] trustManagers = null;
        if (settings.truststorePath() != null && !settings.truststorePath().isBlank()) {
            trustManagers = revocationAware(settings);
        }
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(kmf.getKeyManagers(), trustManagers, null);
        return context;
    }

    public static SSLContext clientContext(TlsSettings settings) throws IOException, GeneralSecurityException {
        if (settings.insecureTrustAll()) {
            return trustAllContext();
        }
        SSLContext context = SSLContext.getInstance("TLS");
        if (settings.truststorePath() == null || settings.truststorePath().isBlank()) {
            context.init(null, null, null);
        } else {
            context.init(null, revocationAware(settings), null);
        }
        return context;
    }

    /**
     * Accepts any server certificate. Connections stay encrypted but are not authenticated.
     */
    public static SSLContext trustAllContext() throws GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new TrustAllManager()}, null);
        return context;
    }

    /**
     * Reads a revocation file. JSON files carry {@code serialNumbers} and
     * {@code sha256Fingerprints} arrays; any other file is read line by line as
     * {@code serial:HEX} or {@code sha256:HEX} entries, {@code #} starting a comment.
     */
    public static RevocationList loadRevocationList(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return RevocationList.EMPTY;
        }
        String raw = stripBom(Files.readString(path, StandardCharsets.UTF_8)).trim();
        if (raw.isEmpty()) {
            return RevocationList.EMPTY;
        }
        Set<String> serials = new LinkedHashSet<>();
        Set<String> fingerprints = new LinkedHashSet<>();
        if (raw.startsWith("{")) {
            JsonNode root = Jsons.mapper().readTree(raw);
            for (JsonNode node : root.path("serialNumbers")) {
                if (!node.asText("").isBlank()) {
                    serials.add(normalizeSerial(node.asText()));
                }
            }
            for (JsonNode node : root.path("sha256Fingerprints")) {
                if (!node.asText("").isBlank()) {
                    fingerprints.add(normalizeFingerprint(node.asText()));
                }
            }
        } else {
            for (String line : raw.split("\r?\n")) {
                String entry = line.trim();
                if (entry.isEmpty() || entry.startsWith("#")) {
                    continue;
                }
                int sep = entry.indexOf(':');
                if (sep <= 0) {
                    throw new IllegalArgumentException("revocation entry needs a serial: or sha256: prefix: " + entry);
                }
                String kind = entry.substring(0, sep).trim().toLowerCase(Locale.ROOT);
                String value = entry.substring(sep + 1).trim();
                switch (kind) {
                    case "serial" -> serials.add(normalizeSerial(value));
                    case "sha256", "fingerprint" -> fingerprints.add(normalizeFingerprint(value));
                    default -> throw new IllegalArgumentException("unsupported revocation entry type: " + kind);
                }
            }
        }
        return new RevocationList(Collections.unmodifiableSet(serials), Collections.unmodifiableSet(fingerprints));
    }

    public static String normalizeSerial(String raw) {
        String hex = compactHex(raw);
        if (hex.isEmpty()) {
            throw new IllegalArgumentException("revocation serial is empty");
        }
        requireHex(hex, "serial");
        while (hex.length() > 1 && hex.charAt(0) == '0') {
            hex = hex.substring(1);
        }
        return hex;
    }

    public static String normalizeFingerprint(String raw) {
        String hex = compactHex(raw);
        if (hex.length() != 64) {
            throw new IllegalArgumentException("sha256 fingerprint must be 64 hex chars: " + raw);
        }
        requireHex(hex, "fingerprint");
        return hex;
    }

    public static String fingerprintSha256(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (NoSuchAlgorithmException | CertificateEncodingException e) {
            throw new IllegalStateException("cannot fingerprint certificate " + certificate.getSubjectX500Principal(), e);
        }
    }

    private static TrustManager[] revocationAware(TlsSettings settings) throws IOException, GeneralSecurityException {
        String password = settings.truststorePassword() == null ? "" : settings.truststorePassword();
        KeyStore trustStore = loadKeyStore(Path.of(settings.truststorePath()), password, settings.storeType());
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        RevocationList revocations = settings.revocationPath() == null || settings.revocationPath().isBlank()
                ? RevocationList.EMPTY
                : loadRevocationList(Path.of(settings.revocationPath()));
        TrustManager[] base = tmf.getTrustManagers();
        TrustManager[] wrapped = new TrustManager[base.length];
        for (int i = 0; i < base.length; i++) {
            wrapped[i] = base[i] instanceof X509ExtendedTrustManager x509
                    ? new RevocationTrustManager(x509, revocations)
                    : base[i];
        }
        return wrapped;
    }

    private static KeyStore loadKeyStore(Path path, String password, String type) throws IOException, GeneralSecurityException {
        KeyStore keyStore = KeyStore.getInstance(type == null || type.isBlank() ? "PKCS12" : type);
        try (InputStream in = Files.newInputStream(path)) {
            keyStore.load(in, password.toCharArray());
        }
        return keyStore;
    }

    private static String compactHex(String raw) {
        if (raw == null) {
            return "";
        }
        String token = stripBom(raw).trim();
        if (token.toLowerCase(Locale.ROOT).startsWith("0x")) {
            token = token.substring(2);
        }
        return token.replace(":", "").replace("-", "").replace(" ", "").toUpperCase(Locale.ROOT);
    }

    private static void requireHex(String value, String field) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'A' && c <= 'F'))) {
                throw new IllegalArgumentException(field + " must be hex: " + value);
            }
        }
    }

    private static String stripBom(String raw) {
        return !raw.isEmpty() && raw.charAt(0) == '\uFEFF' ? raw.substring(1) : raw;
    }

    public record TlsSettings(
            String keystorePath,
            String keystorePassword,
            String truststorePath,
            String truststorePassword,
            String storeType,
            String revocationPath,
            boolean insecureTrustAll
    ) {
        public static TlsSettings server(String keystorePath, String keystorePassword) {
            return new TlsSettings(keystorePath, keystorePassword, null, null, "PKCS12", null, false);
        }

        public static TlsSettings client(String truststorePath, String truststorePassword) {
            return new TlsSettings(null, null, truststorePath, truststorePassword, "PKCS12", null, false);
        }

        public static TlsSettings insecureClient() {
            return new TlsSettings(null, null, null, null, "PKCS12", null, true);
        }

        public TlsSettings withRevocationPath(String path) {
            return new TlsSettings(keystorePath, keystorePassword, truststorePath, truststorePassword, storeType, path, insecureTrustAll);
        }
    }

    public record RevocationList(Set<String> serials, Set<String> sha256Fingerprints) {
        public static final RevocationList EMPTY = new RevocationList(Set.of(), Set.of());

        public boolean isRevoked(X509Certificate certificate) {
            if (certificate == null) {
                return false;
            }
            if (serials.contains(normalizeSerial(certificate.getSerialNumber().toString(16)))) {
                return true;
            }
            return sha256Fingerprints.contains(fingerprintSha256(certificate));
        }

        public int size() {
            return serials.size() + sha256Fingerprints.size();
        }
    }

    private static final class RevocationTrustManager extends X509ExtendedTrustManager {
        private final X509ExtendedTrustManager delegate;
        private final RevocationList revocations;

        private RevocationTrustManager(X509ExtendedTrustManager delegate, RevocationList revocations) {
            this.delegate = Objects.requireNonNull(delegate);
            this.revocations = revocations;
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkClientTrusted(chain, authType);
            reject(chain);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkServerTrusted(chain, authType);
            reject(chain);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkClientTrusted(chain, authType, socket);
            reject(chain);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkServerTrusted(chain, authType, socket);
            reject(chain);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkClientTrusted(chain, authType, engine);
            reject(chain);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkServerTrusted(chain, authType, engine);
            reject(chain);
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return delegate.getAcceptedIssuers();
        }

        private void reject(X509Certificate[] chain) throws CertificateException {
            if (chain != null && chain.length > 0 && revocations.isRevoked(chain[0])) {
                throw new CertificateException("certificate revoked: " + chain[0].getSubjectX500Principal().getName()
                        + " sha256=" + fingerprintSha256(chain[0]));
            }
        }
    }

    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
