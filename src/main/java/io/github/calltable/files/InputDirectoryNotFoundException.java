package io.github.calltable.files;

import java.io.FileNotFoundException;
import java.nio.file.Path;

/**
 * Thrown when the input root does not exist or is not a directory.
 */
public class InputDirectoryNotFoundException extends FileNotFoundException {

    private final transient Path directory;

    public InputDirectoryNotFoundException(Path directory) {
        super("Input directory not found or not a directory: " + directory);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
