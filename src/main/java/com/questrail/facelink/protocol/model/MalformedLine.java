package com.questrail.facelink.protocol.model;

import java.util.Objects;

/**
 * A line that is not protocol traffic. Kept only long enough to be reported and dropped.
 */
public record MalformedLine(String text, String reason) implements LinkMessage
{
    public MalformedLine {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(reason, "reason");
    }
}
