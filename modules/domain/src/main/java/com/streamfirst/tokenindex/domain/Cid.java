package com.streamfirst.tokenindex.domain;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Content identifier on the storage network. The value is opaque to the index: the network's own
 * encoding rules decide it, so two CIDs are equal only if their strings are.
 *
 * @param value the CID string (e.g. {@code QmfYNyAyGD8xHE9XgctX8WnfJ627edkM2EkAcijEutoJmH})
 */
public record Cid(String value) {

    /** Multihash prefix for a 32-byte SHA2-256 digest. */
    private static final byte[] SHA2_256_PREFIX = {0x12, 0x20};

    public Cid {
        Objects.requireNonNull(value, "CID cannot be null");
        value = value.strip();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("CID cannot be empty");
        }
    }

    public static Cid of(String value) {
        return new Cid(value);
    }

    /**
     * Builds the CIDv0 that wraps a raw SHA-256 digest: {@code base58btc(0x12 0x20 || digest)}.
     *
     * <p>Accepts the 64-character hex digest, or 67-character token content whose last 64
     * characters are the digest. Whitespace anywhere in the input is ignored.
     *
     * <p>This is a multihash of the digest itself, not of the DAG node the network builds when the
     * content is added, so it does not equal the CID returned by {@code add}.
     *
     * @throws IllegalArgumentException if the input is not hex or has the wrong length
     */
    public static Cid v0FromSha256(String hexDigest) {
        Objects.requireNonNull(hexDigest, "digest cannot be null");
        String hex = hexDigest.replaceAll("\\s", "");
        if (hex.length() == TokenContent.LENGTH) {
            hex = hex.substring(TokenContent.LEVEL_WIDTH);
        }
        if (!TokenHash.isHex64(hex)) {
            throw new IllegalArgumentException(
                    "Input must be 64 or 67 hex characters after removing whitespace (got "
                            + hex.length()
                            + ")");
        }
        byte[] digest = HexFormat.of().parseHex(hex.toLowerCase());
        byte[] multihash = new byte[SHA2_256_PREFIX.length + digest.length];
        System.arraycopy(SHA2_256_PREFIX, 0, multihash, 0, SHA2_256_PREFIX.length);
        System.arraycopy(digest, 0, multihash, SHA2_256_PREFIX.length, digest.length);
        return new Cid(Base58.encode(multihash));
    }

    /** True if the value is a CIDv0: base58btc of a SHA2-256 multihash ({@code Qm...}). */
    public boolean isV0() {
        if (value.length() != 46 || !value.startsWith("Qm")) {
            return false;
        }
        byte[] multihash;
        try {
            multihash = Base58.decode(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return multihash.length == SHA2_256_PREFIX.length + 32
                && multihash[0] == SHA2_256_PREFIX[0]
                && multihash[1] == SHA2_256_PREFIX[1];
    }

    @Override
    public String toString() {
        return value;
    }
}
