package com.jay.dcfengine.model;

/**
 * Start and end rate of a margin or intensity driver over the forecast horizon.
 */
public record DriverPath(double start, double end) {

    public static DriverPath flat(double value) {
        return new DriverPath(value, value);
    }

    public DriverPath shift(double delta) {
        return new DriverPath(start + delta, end + delta);
    }
}
