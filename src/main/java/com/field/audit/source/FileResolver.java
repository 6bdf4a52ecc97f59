package com.field.audit.source;

/**
 * Resolves a referenced file to its absolute URL.
 */
@FunctionalInterface
public interface FileResolver {

    FileResolution resolveUrl(String fileId);
}
