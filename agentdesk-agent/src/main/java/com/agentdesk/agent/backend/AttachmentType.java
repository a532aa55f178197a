package com.agentdesk.agent.backend;

import java.util.Locale;
import java.util.Set;

public enum AttachmentType {
    IMAGE,
    DOCUMENT,
    CODE,
    OTHER;

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "js", "jsx", "ts", "tsx", "py", "rb", "go", "rs", "c", "h",
            "cpp", "hpp", "cs", "swift", "php", "sh", "sql", "json", "yaml", "yml", "xml", "toml", "html",
            "css");
    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "txt", "md", "rtf", "odt", "csv");
    private static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "gif", "webp", "bmp", "svg");

    /**
     * Classify by MIME type first, then by file extension.
     */
    public static AttachmentType classify(String mimeType, String fileName) {
        if (mimeType != null && !mimeType.isBlank()) {
            String lower = mimeType.toLowerCase(Locale.ROOT);
            if (lower.startsWith("image/")) {
                return IMAGE;
            }
            if (lower.equals("application/pdf") || lower.startsWith("text/markdown")
                    || lower.equals("text/plain")) {
                return DOCUMENT;
            }
        }
        String ext = extension(fileName);
        if (IMAGE_EXTENSIONS.contains(ext)) {
            return IMAGE;
        }
        if (CODE_EXTENSIONS.contains(ext)) {
            return CODE;
        }
        if (DOCUMENT_EXTENSIONS.contains(ext)) {
            return DOCUMENT;
        }
        return OTHER;
    }

    private static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 || dot == fileName.length() - 1 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
