package com.classmonitor.handler;

import java.net.URI;

/**
 * Reads the trailing path variable of a WebSocket URL.
 */
final class PathKeys {

    private PathKeys() {
    }

    static String lastSegment(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return "";
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
