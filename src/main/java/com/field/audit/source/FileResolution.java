package com.field.audit.source;

import java.util.Objects;

/**
 * Outcome of resolving a file reference to an absolute URL.
 *
 * @param status whether the file resolved, no longer exists, or could not be looked up
 * @param url    the absolute URL when resolved, otherwise null
 * @param reason failure description when the lookup failed, otherwise null
 */
public record FileResolution(Status status, String url, String reason) {

    public enum Status { RESOLVED, MISSING, FAILED }

    public FileResolution {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.RESOLVED && url == null) {
            throw new IllegalArgumentException("url is required for a resolved file");
        }
    }

    public static FileResolution resolved(String url) {
        return new FileResolution(Status.RESOLVED, url, null);
    }

    public static FileResolution missing() {
        return new FileResolution(Status.MISSING, null, null);
    }

    public static FileResolution failed(String reason) {
        return new FileResolution(Status.FAILED, null, reason);
    }
}
