package com.migration.planning.waveforge.exception;

import lombok.Getter;

/**
 * A prioritization pattern could not be compiled.
 */
@Getter
public class MalformedPatternException extends WavePlanningException {

    private final String pattern;

    public MalformedPatternException(String pattern, String reason) {
        super("Invalid prioritization pattern '" + pattern + "': " + reason);
        this.pattern = pattern;
    }

    public MalformedPatternException(String pattern, String reason, Throwable cause) {
        super("Invalid prioritization pattern '" + pattern + "': " + reason, cause);
        this.pattern = pattern;
    }
}
