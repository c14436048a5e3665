package io.github.nicechester.logos.parser;

final class Digits {

    private Digits() {
    }

    /**
     * Strips leading zeros from a run of ASCII digits, keeping a single "0" when nothing else is left.
     */
    static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() && digits.charAt(start) == '0') {
            start++;
        }
        return start == digits.length() ? "0" : digits.substring(start);
    }
}
