package com.williamcallahan.corpussync.support;

/**
 * Maps arbitrary source and collection names onto file names that every filesystem accepts.
 */
public final class SafeFileNames {

    private static final int MAX_LENGTH = 150;

    private SafeFileNames() {}

    /**
     * Replaces unsafe characters and shortens long names with a digest so distinct inputs
     * keep distinct file names.
     *
     * @param name logical name
     * @return file-system safe base name
     */
    public static String safeName(String name) {
        String sanitized = name.replaceAll("[^a-zA-Z0-9._-]", "_");
        if (!sanitized.equals(name)) {
            // Sanitizing may merge distinct names ("a/b" and "a_b"), so suffix a digest.
            sanitized = sanitized + "_" + ContentHasher.shortSha256(name);
        }
        if (sanitized.length() <= MAX_LENGTH) {
            return sanitized;
        }
        String prefix = sanitized.substring(0, 80);
        String suffix = sanitized.substring(sanitized.length() - 40);
        return prefix + "_" + ContentHasher.shortSha256(name) + "_" + suffix;
    }
}
