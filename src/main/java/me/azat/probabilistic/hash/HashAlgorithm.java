package me.azat.probabilistic.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Hashers backed by Guava hash functions.
 * <p>
 * Digest variants append the seed to the key as decimal text and read the first eight bytes of
 * the digest little-endian. {@link #MURMUR3_128} feeds all 64 bits of the seed ahead of the key.
 */
public enum HashAlgorithm implements Hasher {

    MURMUR3_128("murmur3_128") {
        @Override
        public long hash(byte[] key, long seed) {
            return Hashing.murmur3_128().newHasher()
                    .putLong(seed)
                    .putBytes(key)
                    .hash()
                    .asLong();
        }
    },
    MD5("md5") {
        @Override
        @SuppressWarnings("deprecation")
        public long hash(byte[] key, long seed) {
            return digest(Hashing.md5(), key, seed);
        }
    },
    SHA1("sha1") {
        @Override
        @SuppressWarnings("deprecation")
        public long hash(byte[] key, long seed) {
            return digest(Hashing.sha1(), key, seed);
        }
    },
    SHA256("sha256") {
        @Override
        public long hash(byte[] key, long seed) {
            return digest(Hashing.sha256(), key, seed);
        }
    };

    private final String id;

    HashAlgorithm(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Looks an algorithm up by its id ({@code murmur3_128}, {@code md5}, {@code sha1}, {@code sha256}),
     * ignoring case.
     */
    public static HashAlgorithm fromId(String id) {
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.id.equalsIgnoreCase(id) || algorithm.name().equalsIgnoreCase(id)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown hash algorithm: " + id);
    }

    /**
     * Human readable form used in diagnostics, e.g. {@code md5(seed=0)}.
     */
    public static String describe(Hasher hasher, long seed) {
        String name = hasher instanceof HashAlgorithm ? ((HashAlgorithm) hasher).id : hasher.toString();
        return name + "(seed=" + seed + ")";
    }

    private static long digest(HashFunction function, byte[] key, long seed) {
        return function.newHasher()
                .putBytes(key)
                .putString(Long.toString(seed), StandardCharsets.UTF_8)
                .hash()
                .asLong();
    }
}
