package com.di.starnova.keys;

import com.di.starnova.exception.KeyDerivationException;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.ReadableInstant;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Pure functions mapping natural attributes to surrogate keys.
 *
 * <p>Hash keys are the first 8 bytes of SHA-256 over the namespace and the natural-key parts,
 * each part type-tagged and length-prefixed so that {@code ("ab", "c")} and {@code ("a", "bc")}
 * never encode alike. The same natural key therefore gets the same key in every run and on every
 * worker. Keys are always positive.
 *
 * <p>Date keys reuse the natural key verbatim as {@code yyyyMMdd} (UTC).
 */
public final class KeyDeriver {

    private KeyDeriver() {}

    public static final String GEOLOCATION = "geolocation";
    public static final String CUSTOMER = "customer";
    public static final String PRODUCT = "product";
    public static final String SELLER = "seller";

    private static final ThreadLocal<MessageDigest> SHA_256 = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    });

    /**
     * Derives a surrogate key for the given natural-key parts within a namespace (one per dimension).
     *
     * @throws KeyDerivationException if any part is null or a blank string
     */
    public static long surrogateKey(String namespace, Object... parts) {
        if (namespace == null || namespace.isBlank()) {
            throw new KeyDerivationException("Key namespace is required");
        }
        if (parts == null || parts.length == 0) {
            throw new KeyDerivationException("No natural-key attributes given for namespace '" + namespace + "'");
        }
        MessageDigest digest = SHA_256.get();
        digest.reset();
        update(digest, 'N', namespace);
        for (int i = 0; i < parts.length; i++) {
            Object part = parts[i];
            if (part == null) {
                throw new KeyDerivationException(String.format(
                        "Natural-key attribute %d of '%s' is null", i, namespace));
            }
            if (part instanceof CharSequence && part.toString().isBlank()) {
                throw new KeyDerivationException(String.format(
                        "Natural-key attribute %d of '%s' is blank", i, namespace));
            }
            update(digest, typeTag(part), String.valueOf(part));
        }
        long key = ByteBuffer.wrap(digest.digest()).getLong() & Long.MAX_VALUE;
        return key == 0L ? 1L : key;
    }

    /**
     * Returns the {@code yyyyMMdd} key of the UTC calendar date containing {@code instant}.
     *
     * @throws KeyDerivationException if the instant is null
     */
    public static long dateKey(ReadableInstant instant) {
        DateTime day = utcDate(instant);
        return day.getYear() * 10_000L + day.getMonthOfYear() * 100L + day.getDayOfMonth();
    }

    /** Start of the UTC day containing {@code instant}. */
    public static DateTime utcDate(ReadableInstant instant) {
        if (instant == null) {
            throw new KeyDerivationException("Date natural key is null");
        }
        return new DateTime(instant.getMillis(), DateTimeZone.UTC).withTimeAtStartOfDay();
    }

    private static char typeTag(Object part) {
        if (part instanceof CharSequence) return 'S';
        if (part instanceof Integer || part instanceof Long || part instanceof Short) return 'I';
        if (part instanceof Number) return 'F';
        return 'O';
    }

    private static void update(MessageDigest digest, char tag, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        digest.update((byte) tag);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }
}
