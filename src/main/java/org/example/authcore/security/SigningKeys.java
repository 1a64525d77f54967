package org.example.authcore.security;

import org.example.authcore.exception.KeyLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * RSA key pair used to sign (private) and verify (public) credentials.
 * Loaded once at startup and never mutated.
 */
public final class SigningKeys {

    private static final String RSA = "RSA";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    public SigningKeys(PrivateKey privateKey, PublicKey publicKey) {
        if (privateKey == null || publicKey == null) {
            throw new IllegalArgumentException("Both signing keys are required");
        }
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    public PrivateKey privateKey() {
        return privateKey;
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    public static SigningKeys load(String privateKeyLocation, String publicKeyLocation) {
        return fromPem(read(privateKeyLocation), read(publicKeyLocation));
    }

    public static SigningKeys fromPem(String privatePem, String publicPem) {
        try {
            KeyFactory keyFactory = KeyFactory.getInstance(RSA);
            PrivateKey privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(decode(privatePem, "PRIVATE KEY")));
            PublicKey publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(decode(publicPem, "PUBLIC KEY")));
            return new SigningKeys(privateKey, publicKey);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new KeyLoadException("Failed to parse RSA signing keys", e);
        }
    }

    private static byte[] decode(String pem, String type) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException(type + " PEM is empty");
        }
        String begin = "-----BEGIN " + type + "-----";
        String end = "-----END " + type + "-----";
        if (!pem.contains(begin) || !pem.contains(end)) {
            throw new IllegalArgumentException("Expected a " + type + " PEM block");
        }
        String body = pem.replace(begin, "").replace(end, "").replaceAll("\\s+", "");
        return Base64.getDecoder().decode(body);
    }

    private static String read(String location) {
        if (location == null || location.isBlank()) {
            throw new KeyLoadException("Key location is not configured", null);
        }
        try {
            if (location.startsWith(CLASSPATH_PREFIX)) {
                String resource = location.substring(CLASSPATH_PREFIX.length());
                while (resource.startsWith("/")) {
                    resource = resource.substring(1);
                }
                ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
                if (classLoader == null) {
                    classLoader = SigningKeys.class.getClassLoader();
                }
                try (InputStream in = classLoader.getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new IOException("Classpath resource not found: " + resource);
                    }
                    return new String(in.readAllBytes(), StandardCharsets.US_ASCII);
                }
            }
            return Files.readString(Path.of(location), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new KeyLoadException("Failed to read key from " + location, e);
        }
    }
}
