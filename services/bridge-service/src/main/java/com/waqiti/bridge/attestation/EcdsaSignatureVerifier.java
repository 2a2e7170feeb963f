package com.waqiti.bridge.attestation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * ECDSA verification with X.509 encoded public keys.
 */
@Slf4j
@Component
public class EcdsaSignatureVerifier implements SignatureVerifier {

    public static final String KEY_ALGORITHM = "EC";
    public static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    @Override
    public boolean verify(String publicKey, byte[] message, String signature) {
        if (publicKey == null || message == null || signature == null) {
            return false;
        }
        try {
            PublicKey key = KeyFactory.getInstance(KEY_ALGORITHM)
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(publicKey)));

            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(Base64.getDecoder().decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature rejected: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isValidPublicKey(String publicKey) {
        if (publicKey == null) {
            return false;
        }
        try {
            KeyFactory.getInstance(KEY_ALGORITHM)
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(publicKey)));
            return true;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Public key rejected: {}", e.getMessage());
            return false;
        }
    }
}
