package com.webspec.report;

import java.io.IOException;
import java.nio.file.Path;

/** A saved execution report could not be read or is not a valid report. */
public class ReportParseException extends IOException {

    private final Path path;

    public ReportParseException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() { return path; }
}
