package com.eon.credit.identity;

import com.eon.credit.config.CreditProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;

/**
 * Recovers the signer of an identity proof (Ethereum personal-message signature over
 * {@link ProofMessages#digest}) and compares it with the trusted issuer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityProofVerifier {

    private static final int SIGNATURE_LENGTH = 65;

    private final CreditProperties properties;

    public boolean isIssuedByTrustedIssuer(String subject, String commitmentHash, long expiresAt, String signatureHex) {
        Optional<String> signer = recoverSigner(subject, commitmentHash, expiresAt, signatureHex);
        return signer.isPresent() && signer.get().equalsIgnoreCase(properties.getIdentity().getTrustedIssuer());
    }

    /** Empty when the inputs are malformed or no key can be recovered. */
    public Optional<String> recoverSigner(String subject, String commitmentHash, long expiresAt, String signatureHex) {
        byte[] digest;
        Sign.SignatureData signature;
        try {
            digest = ProofMessages.digest(subject, commitmentHash, expiresAt);
            signature = parseSignature(signatureHex);
        } catch (IllegalArgumentException ex) {
            log.warn("Malformed identity proof for {}: {}", subject, ex.getMessage());
            return Optional.empty();
        }
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, signature);
            return Optional.of("0x" + Keys.getAddress(publicKey));
        } catch (SignatureException | IllegalArgumentException ex) {
            log.warn("Signer recovery failed for {}: {}", subject, ex.getMessage());
            return Optional.empty();
        }
    }

    static Sign.SignatureData parseSignature(String signatureHex) {
        if (signatureHex == null) {
            throw new IllegalArgumentException("signature is required");
        }
        byte[] raw = Numeric.hexStringToByteArray(signatureHex);
        if (raw.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        return new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
    }
}
