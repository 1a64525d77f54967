package org.example.authcore.support;

import org.example.authcore.security.SigningKeys;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Base64;

public final class TestKeys {

    public static final SigningKeys EMBEDDED = SigningKeys.load("classpath:keys/private.pem", "classpath:keys/public.pem");

    private TestKeys() {
    }

    public static SigningKeys generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            KeyPair pair = generator.generateKeyPair();
            return new SigningKeys(pair.getPrivate(), pair.getPublic());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String toPem(PublicKey key) {
        return encode(key.getEncoded(), "PUBLIC KEY");
    }

    public static String toPem(PrivateKey key) {
        return encode(key.getEncoded(), "PRIVATE KEY");
    }

    private static String encode(byte[] der, String type) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }
}
