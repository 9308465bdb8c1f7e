package io.fsdebounce.spi;

/**
 * Whether a directory watch covers its sub-directories.
 */
public enum RecursiveMode {
    /** Watch the directory and everything below it, including directories created later. */
    RECURSIVE,
    /** Watch only the direct children of the directory. */
    NON_RECURSIVE
}
