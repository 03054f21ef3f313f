package com.repledger.proof;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies identity proofs issued by a KYC provider that shares a secret with the ledger.
 *
 * <p>A proof is the lowercase hex SHA-256 of {@code secret + ":" + borrower}. Comparison is
 * constant-time.
 */
public class DigestProofVerifier implements ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(DigestProofVerifier.class);

    private final String secret;

    public DigestProofVerifier(String secret) {
        this.secret = secret;
    }

    @Override
    public boolean verify(String borrower, String proof) {
        if (borrower == null || proof == null) {
            return false;
        }
        byte[] expected = issue(borrower).getBytes(StandardCharsets.UTF_8);
        byte[] actual = proof.trim().toLowerCase().getBytes(StandardCharsets.UTF_8);
        boolean valid = MessageDigest.isEqual(expected, actual);
        if (!valid) {
            log.debug("Proof rejected for {}", borrower);
        }
        return valid;
    }

    /** Produces the proof a borrower would present. Used by the issuer side and tests. */
    public String issue(String borrower) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((secret + ":" + borrower).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
