package org.severityoracle.domain.model;

/**
 * Ordered severity tiers handed to the downstream policy engine.
 * The wire form is a single ASCII byte.
 */
public enum Category {
    S('S'),
    M('M'),
    L('L');

    private final char code;

    Category(char code) {
        this.code = code;
    }

    public char code() { return code; }

    /** One-byte payload delivered to the response sink. */
    public byte[] payload() {
        return new byte[]{(byte) code};
    }

    public static Category fromCode(char code) {
        for (Category c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new IllegalArgumentException("unknown category code: " + code);
    }
}
