package com.flagship.token_ledger.token;

import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Base64;

/**
 * Descriptive metadata of a token class. Stored as JSON next to the token.
 *
 * Hashes are base64 encoded SHA-256 digests of the linked content and only
 * make sense together with the link they describe.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenMetadata {
    String title;
    String description;
    String media;
    String mediaHash;
    Long issuedAt;
    Long expiresAt;
    Long startsAt;
    Long updatedAt;
    String extra;
    String reference;
    String referenceHash;

    private static final int HASH_BYTES = 32;

    /**
     * @throws LedgerException INVALID_METADATA if a link and its hash are not paired
     *         or a hash is not a base64 encoded 32-byte digest
     */
    public void validate() {
        requirePaired(media, mediaHash, "media");
        requirePaired(reference, referenceHash, "reference");
        if (mediaHash != null) {
            requireDigest(mediaHash, "mediaHash");
        }
        if (referenceHash != null) {
            requireDigest(referenceHash, "referenceHash");
        }
    }

    private static void requirePaired(String link, String hash, String name) {
        if ((link == null) != (hash == null)) {
            throw new LedgerException(LedgerErrorCode.INVALID_METADATA,
                name + " and " + name + "Hash must be supplied together");
        }
    }

    private static void requireDigest(String hash, String name) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(hash);
        } catch (IllegalArgumentException e) {
            throw new LedgerException(LedgerErrorCode.INVALID_METADATA, name + " is not valid base64");
        }
        if (decoded.length != HASH_BYTES) {
            throw new LedgerException(LedgerErrorCode.INVALID_METADATA,
                name + " must decode to " + HASH_BYTES + " bytes, got " + decoded.length);
        }
    }
}
