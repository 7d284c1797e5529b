package io.suite4j.core;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Discovery could not enumerate the suite (broken import, missing module, ...).
 *
 * @param detail optional stack trace or collaborator output
 */
public record DiscoveryFailure(String message, String detail) {

    public static DiscoveryFailure of(Throwable cause) {
        StringWriter sw = new StringWriter();
        cause.printStackTrace(new PrintWriter(sw));
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return new DiscoveryFailure(message, sw.toString());
    }
}
