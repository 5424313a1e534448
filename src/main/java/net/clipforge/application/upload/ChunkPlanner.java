package net.clipforge.application.upload;

/**
 * Splits an object of known length into fixed-size parts. The last part carries the remainder.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /**
     * Returns {@code ceil(length / partSize)}; zero for an empty object.
     */
    public static int totalChunks(long length, long partSize) {
        validate(length, partSize);
        long chunks = (length + partSize - 1) / partSize;
        if (chunks > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Object of " + length + " bytes needs too many parts of " + partSize + " bytes");
        }
        return (int) chunks;
    }

    public static boolean requiresChunking(long length, long partSize) {
        return totalChunks(length, partSize) > 1;
    }

    /**
     * Returns the half-open byte range {@code [start, end)} of part {@code index}.
     */
    public static ByteRange rangeOf(int index, long length, long partSize) {
        int total = totalChunks(length, partSize);
        if (index < 0 || index >= total) {
            throw new IllegalArgumentException("Part index " + index + " is outside [0, " + total + ")");
        }
        long start = index * partSize;
        long end = Math.min(start + partSize, length);
        return new ByteRange(start, end);
    }

    private static void validate(long length, long partSize) {
        if (partSize <= 0) {
            throw new IllegalArgumentException("partSize must be positive but was " + partSize);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative but was " + length);
        }
    }

    public record ByteRange(long start, long end) {

        public int length() {
            return (int) (end - start);
        }
    }
}
