package com.jay.dcfengine.model;

import com.jay.dcfengine.model.enums.ScenarioCase;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base, Bull and Bear valuations of one run. Always complete: a partial set is never built.
 */
@Value
@Builder
public class ScenarioSet {

    @NonNull ValuationResult base;
    @NonNull ValuationResult bull;
    @NonNull ValuationResult bear;

    public ValuationResult get(ScenarioCase scenario) {
        return switch (scenario) {
            case BASE -> base;
            case BULL -> bull;
            case BEAR -> bear;
        };
    }

    /** Results keyed "base", "bull", "bear" in that order. */
    public Map<String, ValuationResult> asMap() {
        Map<String, ValuationResult> map = new LinkedHashMap<>();
        for (ScenarioCase c : ScenarioCase.values()) {
            map.put(c.key(), get(c));
        }
        return Collections.unmodifiableMap(map);
    }
}
