package com.eon.credit.identity;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/** Byte layout of the identity-proof message the verification provider signs. */
public final class ProofMessages {

    static final int ADDRESS_LENGTH = 20;
    static final int WORD_LENGTH = 32;

    private ProofMessages() {}

    /** keccak256(subject[20] ‖ commitmentHash[32] ‖ uint256 expiresAt). */
    public static byte[] digest(String subject, String commitmentHash, long expiresAtEpochSeconds) {
        byte[] address = fixedBytes(subject, ADDRESS_LENGTH, "subject");
        byte[] commitment = fixedBytes(commitmentHash, WORD_LENGTH, "commitment hash");
        byte[] expiry = Numeric.toBytesPadded(BigInteger.valueOf(expiresAtEpochSeconds), WORD_LENGTH);

        byte[] packed = new byte[ADDRESS_LENGTH + WORD_LENGTH + WORD_LENGTH];
        System.arraycopy(address, 0, packed, 0, ADDRESS_LENGTH);
        System.arraycopy(commitment, 0, packed, ADDRESS_LENGTH, WORD_LENGTH);
        System.arraycopy(expiry, 0, packed, ADDRESS_LENGTH + WORD_LENGTH, WORD_LENGTH);
        return Hash.sha3(packed);
    }

    public static String digestHex(String subject, String commitmentHash, long expiresAtEpochSeconds) {
        return Numeric.toHexString(digest(subject, commitmentHash, expiresAtEpochSeconds));
    }

    static byte[] fixedBytes(String hex, int length, String field) {
        if (hex == null || !Numeric.containsHexPrefix(hex)) {
            throw new IllegalArgumentException(field + " must be 0x-prefixed hex");
        }
        String clean = Numeric.cleanHexPrefix(hex);
        if (clean.length() != length * 2 || !clean.matches("[0-9a-fA-F]+")) {
            throw new IllegalArgumentException(field + " must be " + length + " bytes");
        }
        return Numeric.hexStringToByteArray(clean);
    }
}
