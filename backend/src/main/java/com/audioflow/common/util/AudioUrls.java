package com.audioflow.common.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class AudioUrls {

    private AudioUrls() {
    }

    public static boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return (normalized.equals("http") || normalized.equals("https"))
                    && uri.getHost() != null
                    && !uri.getHost().isBlank();
        } catch (URISyntaxException exception) {
            return false;
        }
    }

    public static String filenameFromUrl(String url) {
        if (url == null) {
            return "unknown";
        }
        try {
            String path = new URI(url.trim()).getPath();
            if (path == null || path.isEmpty()) {
                return "unknown";
            }
            String filename = path.substring(path.lastIndexOf('/') + 1);
            return filename.isEmpty() ? "unknown" : filename;
        } catch (URISyntaxException exception) {
            return "unknown";
        }
    }
}
