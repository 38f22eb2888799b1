package org.redfx.quantumlab;

/**
 * Conversions between basis-state indexes and measurement bitstrings.
 * <p>
 * Bitstrings are big-endian: qubit (or classical bit) {@code n-1} is the leftmost
 * character, index 0 the rightmost.
 */
public final class BitStrings {

    private BitStrings() {
    }

    public static String requireBinary(String bits, String name) {
        if (bits == null || bits.isEmpty()) {
            throw new IllegalArgumentException(name + " must be a non-empty bitstring of 0s and 1s");
        }
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException(name + " must be a bitstring of 0s and 1s, got '" + bits + "'");
            }
        }
        return bits;
    }

    public static String requireBinary(String bits, int length, String name) {
        requireBinary(bits, name);
        if (bits.length() != length) {
            throw new IllegalArgumentException(name + " must be a " + length + "-bit string, got '" + bits + "'");
        }
        return bits;
    }

    /**
     * Returns the value of qubit {@code index} as encoded in the big-endian bitstring.
     */
    public static boolean isSet(String bits, int index) {
        return bits.charAt(bits.length() - 1 - index) == '1';
    }

    public static String toBitString(int value, int width) {
        char[] answer = new char[width];
        for (int p = 0; p < width; p++) {
            int bit = width - 1 - p;
            answer[p] = ((value >> bit) & 1) == 1 ? '1' : '0';
        }
        return new String(answer);
    }

    public static int toIndex(String bits) {
        requireBinary(bits, "bits");
        if (bits.length() > 30) {
            throw new IllegalArgumentException("bitstring too long for a basis index: " + bits.length());
        }
        int answer = 0;
        for (int p = 0; p < bits.length(); p++) {
            answer = (answer << 1) | (bits.charAt(p) - '0');
        }
        return answer;
    }
}
