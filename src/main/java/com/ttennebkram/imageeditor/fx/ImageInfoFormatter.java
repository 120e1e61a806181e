package com.ttennebkram.imageeditor.fx;

import java.util.Locale;

/**
 * Status bar text for the current image.
 */
public final class ImageInfoFormatter {

    public static final String NO_IMAGE = "No image loaded";

    private static final long KB = 1024;
    private static final long MB = 1024 * 1024;

    private ImageInfoFormatter() {
    }

    /**
     * "W × H px | RGB", plus " | size" when the image has a file on disk.
     *
     * @param fileSize Size of the backing file in bytes, or null if there is none
     */
    public static String format(int width, int height, Long fileSize) {
        StringBuilder sb = new StringBuilder();
        sb.append(width).append(" × ").append(height).append(" px | RGB");
        if (fileSize != null) {
            sb.append(" | ").append(formatSize(fileSize));
        }
        return sb.toString();
    }

    public static String formatSize(long bytes) {
        if (bytes < KB) {
            return bytes + " bytes";
        } else if (bytes < MB) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        }
        return String.format(Locale.ROOT, "%.2f MB", bytes / (double) MB);
    }
}
