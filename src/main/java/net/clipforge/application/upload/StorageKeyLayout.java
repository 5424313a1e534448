package net.clipforge.application.upload;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Storage key scheme for one logical object:
 * <pre>
 * owner/logicalName/chunks/name_chunk_000.ext
 * owner/logicalName/manifests/name_manifest.json
 * owner/logicalName/filename
 * </pre>
 */
public record StorageKeyLayout(String ownerId, String logicalName, String baseName, String extension) {

    static final String MANIFEST_SUFFIX = "_manifest.json";

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^a-zA-Z0-9\\-_.]");

    public static StorageKeyLayout of(String ownerId, String logicalName, String filename) {
        String safeFilename = sanitize(filename);
        int dot = safeFilename.lastIndexOf('.');
        String baseName = dot > 0 ? safeFilename.substring(0, dot) : safeFilename;
        String extension = dot > 0 && dot < safeFilename.length() - 1
            ? safeFilename.substring(dot + 1).toLowerCase(Locale.ROOT)
            : "";
        return new StorageKeyLayout(sanitize(ownerId), sanitize(logicalName), baseName, extension);
    }

    /**
     * Replaces every character outside {@code [a-zA-Z0-9-_.]} with an underscore.
     */
    public static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Storage identifiers must not be blank");
        }
        String sanitized = UNSAFE_CHARACTERS.matcher(value.trim()).replaceAll("_");
        if (sanitized.equals(".") || sanitized.equals("..")) {
            throw new IllegalArgumentException("Storage identifier '" + value + "' is not allowed");
        }
        return sanitized;
    }

    public static boolean isManifestKey(String key) {
        return key != null && key.endsWith(MANIFEST_SUFFIX);
    }

    /**
     * Prefix shared by every object of this logical name, ending in a slash.
     */
    public String logicalPrefix() {
        return ownerId + "/" + logicalName + "/";
    }

    public String chunkKey(int sequenceIndex) {
        String key = logicalPrefix() + "chunks/" + baseName + "_chunk_" + String.format(Locale.ROOT, "%03d", sequenceIndex);
        return extension.isEmpty() ? key : key + "." + extension;
    }

    public String manifestKey() {
        return logicalPrefix() + "manifests/" + baseName + MANIFEST_SUFFIX;
    }

    public String directKey() {
        return logicalPrefix() + fileName();
    }

    public String fileName() {
        return extension.isEmpty() ? baseName : baseName + "." + extension;
    }
}
