package com.pgoutbox.domain.model;

/**
 * Value Object for a write-ahead log position (PostgreSQL LSN).
 * Ordered by the unsigned 64-bit value; printed in the server's {@code X/Y} hex form.
 */
public record WalPosition(long value) implements Comparable<WalPosition> {

    public static final WalPosition INVALID = new WalPosition(0L);

    public static WalPosition of(long value) {
        return value == 0L ? INVALID : new WalPosition(value);
    }

    /**
     * Parses the textual form returned by the server, e.g. {@code 16/B374D848}.
     *
     * @throws IllegalArgumentException if the text is not a valid LSN
     */
    public static WalPosition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("WAL position cannot be empty");
        }
        int slash = text.indexOf('/');
        if (slash <= 0 || slash == text.length() - 1) {
            throw new IllegalArgumentException("WAL position must have the form X/Y: " + text);
        }
        try {
            long high = Long.parseLong(text.substring(0, slash), 16);
            long low = Long.parseLong(text.substring(slash + 1), 16);
            if (high > 0xFFFFFFFFL || low > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("WAL position out of range: " + text);
            }
            return of((high << 32) | low);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("WAL position must be hexadecimal: " + text, e);
        }
    }

    public boolean isValid() {
        return value != 0L;
    }

    public boolean isAfter(WalPosition other) {
        return compareTo(other) > 0;
    }

    public static WalPosition max(WalPosition a, WalPosition b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(WalPosition other) {
        return Long.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return String.format("%X/%X", value >>> 32, value & 0xFFFFFFFFL);
    }
}
