package com.umitunal.qrunner.serialization;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Turns a Throwable into the text detail stored in job records and the recovery file.
 */
public final class ErrorDetails {

    private ErrorDetails() {
    }

    /**
     * Full stack trace including causes, or null for a null throwable.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter writer = new StringWriter();
        try (PrintWriter printer = new PrintWriter(writer)) {
            error.printStackTrace(printer);
        }
        return writer.toString();
    }
}
