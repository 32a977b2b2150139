package in.hostsnap.snapshot.change;

import java.util.Collection;

/**
 * Order-independent content digest comparison for large record sets.
 *
 * Each record's {@code hashCode()} is mixed to 64 bits and folded into a sum and an xor,
 * together with the collection size. Two collections with equal digests are reported as
 * unchanged. Distinct multisets can collide; the probability is negligible for inventory-sized
 * collections, but callers needing exactness should use {@link MultisetChangeDetector}.
 */
public final class ContentHashChangeDetector implements ChangeDetector {

    public static final ContentHashChangeDetector INSTANCE = new ContentHashChangeDetector();

    private ContentHashChangeDetector() {}

    @Override
    public boolean hasChanged(Collection<?> previous, Collection<?> current) {
        if (previous.size() != current.size()) {
            return true;
        }
        return !digest(previous).equals(digest(current));
    }

    /**
     * Digest of a collection; equal multisets always produce equal digests.
     */
    public static Digest digest(Collection<?> records) {
        long sum = 0L;
        long xor = 0L;
        for (Object record : records) {
            long h = mix(record == null ? 0 : record.hashCode());
            sum += h;
            xor ^= Long.rotateLeft(h, 17) * 0x9E3779B97F4A7C15L;
        }
        return new Digest(records.size(), sum, xor);
    }

    // MurmurHash3 fmix64
    private static long mix(int hash) {
        long k = hash & 0xFFFFFFFFL;
        k ^= k >>> 33;
        k *= 0xFF51AFD7ED558CCDL;
        k ^= k >>> 33;
        k *= 0xC4CEB9FE1A85EC53L;
        k ^= k >>> 33;
        return k;
    }

    public record Digest(int size, long sum, long xor) {}

    @Override
    public String toString() {
        return "CONTENT_HASH";
    }
}
