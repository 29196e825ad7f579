package automihomo.control.util;

/**
 * Keeps only the last {@code limit} characters written to it.
 *
 * Memory stays bounded by roughly twice the limit however much is appended.
 * Cuts never leave half of a surrogate pair at the start, so the tail can be
 * one char shorter than the limit.
 */
public final class TailBuffer {

    private final int limit;
    private final StringBuilder buffer = new StringBuilder();

    public TailBuffer(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        this.limit = limit;
    }

    public synchronized void append(char[] chars, int offset, int length) {
        if (limit == 0 || length <= 0) {
            return;
        }
        if (length >= limit) {
            buffer.setLength(0);
            buffer.append(chars, offset + length - limit, limit);
        } else {
            buffer.append(chars, offset, length);
        }
        if (buffer.length() > limit * 2) {
            buffer.delete(0, buffer.length() - limit);
        }
        if (buffer.length() > 0 && Character.isLowSurrogate(buffer.charAt(0))) {
            buffer.deleteCharAt(0);
        }
    }

    public void append(String text) {
        append(text.toCharArray(), 0, text.length());
    }

    /** The retained suffix, at most {@code limit} chars */
    public synchronized String tail() {
        return tail(buffer, limit);
    }

    /**
     * Suffix of {@code text} of at most {@code limit} chars, cut on a character boundary.
     */
    public static String tail(CharSequence text, int limit) {
        if (text == null || limit <= 0) {
            return "";
        }
        int length = text.length();
        if (length <= limit) {
            return text.toString();
        }
        int start = length - limit;
        if (Character.isLowSurrogate(text.charAt(start)) && Character.isHighSurrogate(text.charAt(start - 1))) {
            start++;
        }
        return text.subSequence(start, length).toString();
    }
}
