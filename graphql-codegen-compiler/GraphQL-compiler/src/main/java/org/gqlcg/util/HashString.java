package org.gqlcg.util;

import org.apache.commons.codec.digest.DigestUtils;

/** A Hash value produced by SHA256 */
public record HashString(String value) {
    /** Number of digits that is safe to use in abbreviations */
    static final int SHORT_SIZE = 12;

    /** Hash the UTF-8 encoding of a string. */
    public static HashString sha256(String data) {
        return new HashString(DigestUtils.sha256Hex(data));
    }

    @Override
    public String toString() {
        return this.value;
    }

    public String shortString() {
        // Hopefully there are no collisions in the first 12 digits.
        return this.value.substring(0, SHORT_SIZE);
    }
}
