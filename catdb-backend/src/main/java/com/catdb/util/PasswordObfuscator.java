package com.catdb.util;

/**
 * Letter rotation (ROT13) applied to stored passwords.
 *
 * <p>This only keeps passwords from sitting in plain text on disk. It is not encryption and must
 * not be treated as a security control.
 */
public final class PasswordObfuscator {

    private PasswordObfuscator() {
    }

    /**
     * Obfuscate a password for storage.
     *
     * @param plain plain password (may be null)
     * @return obfuscated password
     */
    public static String obfuscate(String plain) {
        return rotate(plain);
    }

    /**
     * Reverse {@link #obfuscate(String)}.
     *
     * @param stored stored password (may be null)
     * @return plain password
     */
    public static String reveal(String stored) {
        return rotate(stored);
    }

    private static String rotate(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 'a' && c <= 'z') {
                sb.append((char) ('a' + (c - 'a' + 13) % 26));
            } else if (c >= 'A' && c <= 'Z') {
                sb.append((char) ('A' + (c - 'A' + 13) % 26));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
