package com.jay.dcfengine.model.enums;

import com.jay.dcfengine.exception.UnknownProvenanceException;

import java.util.Locale;

/**
 * Where an assumption value came from. Closed set: anything else is rejected at parse time.
 */
public enum Provenance {
    FILED,              // structured filing, taken as reported
    HISTORICAL_AVERAGE, // averaged over several filed periods
    INTERPOLATED,       // interpolated or extrapolated from filed periods
    HEURISTIC_DEFAULT,  // fallback constant or scenario shift
    INDUSTRY_NORM;      // sector rule of thumb

    /**
     * Parses an external provenance tag such as {@code "filed"} or {@code "historical-average"}.
     *
     * @throws UnknownProvenanceException if the tag is blank or not one of the known sources
     */
    public static Provenance fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new UnknownProvenanceException(tag);
        }
        String normalised = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Provenance p : values()) {
            if (p.name().equals(normalised)) return p;
        }
        throw new UnknownProvenanceException(tag);
    }
}
