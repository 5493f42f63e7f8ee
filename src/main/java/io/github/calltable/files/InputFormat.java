package io.github.calltable.files;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Input file layouts, selected by file extension (case-insensitive).
 */
public enum InputFormat {
    /** A whole-file JSON document: one object or an array of objects. */
    JSON(".json"),
    /** One JSON value per line. */
    JSON_LINES(".jsonl");

    private final String extension;

    InputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Returns the format for a path, or empty if its extension is not a known input extension.
     */
    public static Optional<InputFormat> forPath(Path path) {
        String suffix = extensionOf(path);
        for (InputFormat format : values()) {
            if (format.extension.equals(suffix)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the lower-cased final extension including the dot, or "" when there is none.
     * A leading dot (hidden file such as {@code .json}) does not start an extension.
     */
    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
