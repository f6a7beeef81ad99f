package com.schemkit.loader;

/** Loader switches read from system properties, falling back to environment variables. */
public final class LoaderFlags {
    private static final String LIBRARY_PATH_PROPERTY = "schemkit.libraryPath";
    private static final String EMBEDDED_PROPERTY = "schemkit.parseEmbeddedSymbols";
    /** Environment fallbacks kept for convenience; prefer using system properties. */
    private static final String LIBRARY_PATH_ENV = "XSCHEM_LIBRARY_PATH";
    private static final String EMBEDDED_ENV = "SCHEMKIT_PARSE_EMBEDDED_SYMBOLS";

    private LoaderFlags() {}

    /** Colon separated symbol search directories, or an empty string when none are configured. */
    public static String libraryPath() {
        String value = System.getProperty(LIBRARY_PATH_PROPERTY);
        if (value != null) {
            return value;
        }
        value = System.getenv(LIBRARY_PATH_ENV);
        return value == null ? "" : value;
    }

    /** Whether {@code [ ... ]} blocks are parsed into embedded symbols instead of being skipped. */
    public static boolean isEmbeddedSymbolParsingEnabled() {
        String value = System.getProperty(EMBEDDED_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(EMBEDDED_ENV));
    }
}
