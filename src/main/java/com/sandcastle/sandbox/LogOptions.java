package com.sandcastle.sandbox;

import java.time.Instant;

/**
 * @param tail       number of trailing lines, {@code null} for all
 * @param since      only lines after this instant, {@code null} for no lower bound
 * @param timestamps prefix each line with its timestamp
 */
public record LogOptions(Integer tail, Instant since, boolean timestamps) {

    public static LogOptions defaults() {
        return new LogOptions(null, null, false);
    }

    public static LogOptions tail(int lines) {
        return new LogOptions(lines, null, false);
    }
}
