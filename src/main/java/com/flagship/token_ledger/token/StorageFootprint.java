package com.flagship.token_ledger.token;

import java.nio.charset.StandardCharsets;

/**
 * Measures the storage a call adds, in bytes, over the logical key/value
 * entries it writes.
 *
 * Keys are a one-byte prefix per entry kind followed by the UTF-8 token id
 * and, for per-account entries, a zero separator and the UTF-8 account id.
 * Every entry also pays a fixed record overhead.
 */
public final class StorageFootprint {

    static final int ENTRY_OVERHEAD = 40;
    static final int AMOUNT_BYTES = 16;
    static final int COUNTER_BYTES = 8;

    static final byte OWNER_PREFIX = 'o';
    static final byte SUPPLY_PREFIX = 's';
    static final byte METADATA_PREFIX = 'm';
    static final byte APPROVAL_COUNTER_PREFIX = 'a';
    static final byte BALANCE_PREFIX = 'b';

    private long bytes;

    public StorageFootprint add(byte[] key, int valueBytes) {
        bytes += key.length + valueBytes + ENTRY_OVERHEAD;
        return this;
    }

    public long getBytes() {
        return bytes;
    }

    public static byte[] tokenKey(byte prefix, String tokenId) {
        byte[] id = tokenId.getBytes(StandardCharsets.UTF_8);
        byte[] key = new byte[id.length + 1];
        key[0] = prefix;
        System.arraycopy(id, 0, key, 1, id.length);
        return key;
    }

    public static byte[] accountKey(byte prefix, String tokenId, String accountId) {
        byte[] token = tokenKey(prefix, tokenId);
        byte[] account = accountId.getBytes(StandardCharsets.UTF_8);
        byte[] key = new byte[token.length + 1 + account.length];
        System.arraycopy(token, 0, key, 0, token.length);
        key[token.length] = 0;
        System.arraycopy(account, 0, key, token.length + 1, account.length);
        return key;
    }

    /**
     * Entries written when a token is minted.
     *
     * @param metadataJson serialized metadata, or null when none is stored
     */
    public static StorageFootprint ofMint(String tokenId, String ownerId, byte[] metadataJson) {
        StorageFootprint footprint = new StorageFootprint()
            .add(tokenKey(OWNER_PREFIX, tokenId), ownerId.getBytes(StandardCharsets.UTF_8).length)
            .add(tokenKey(SUPPLY_PREFIX, tokenId), AMOUNT_BYTES)
            .add(tokenKey(APPROVAL_COUNTER_PREFIX, tokenId), COUNTER_BYTES)
            .add(accountKey(BALANCE_PREFIX, tokenId, ownerId), AMOUNT_BYTES);
        if (metadataJson != null) {
            footprint.add(tokenKey(METADATA_PREFIX, tokenId), metadataJson.length);
        }
        return footprint;
    }
}
