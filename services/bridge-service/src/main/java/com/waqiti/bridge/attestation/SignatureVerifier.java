package com.waqiti.bridge.attestation;

/**
 * Verifies validator signatures over attestation payloads.
 */
public interface SignatureVerifier {

    /**
     * @param publicKey base64 encoded public key
     * @param message   signed bytes
     * @param signature base64 encoded signature
     * @return true only for a well-formed signature that verifies under the key
     */
    boolean verify(String publicKey, byte[] message, String signature);

    /**
     * @return true if the key can be used for verification
     */
    boolean isValidPublicKey(String publicKey);
}
