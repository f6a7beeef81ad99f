package com.schemkit;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 1;
    static final int PATCH = 0;

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH;
    /** On-disk record format version emitted when a document carries no version record. */
    public static final String FILE_FORMAT_VERSION = "1.2";
    public static final String DEFAULT_VERSION_STRING =
            "xschem version=" + FULL + " file_version=" + FILE_FORMAT_VERSION;

    private Version() {}
}
