package com.jay.dcfengine.layer2_assumptions;

import com.jay.dcfengine.exception.UnknownProvenanceException;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.ConfidenceTier;
import com.jay.dcfengine.model.enums.Provenance;
import com.jay.dcfengine.model.enums.TerminalMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps the provenance of each assumption to a confidence tier for display.
 * Annotates only; values are never touched.
 */
@Slf4j
@Component
public class ConfidenceLabeler {

    public ConfidenceTier label(Provenance provenance) {
        if (provenance == null) {
            throw new UnknownProvenanceException(null);
        }
        return switch (provenance) {
            case FILED -> ConfidenceTier.HIGH;
            case HISTORICAL_AVERAGE, INTERPOLATED -> ConfidenceTier.MED;
            case HEURISTIC_DEFAULT, INDUSTRY_NORM -> ConfidenceTier.LOW;
        };
    }

    public ConfidenceTier label(String tag) {
        return label(Provenance.fromTag(tag));
    }

    /**
     * One tier per numeric field the assumptions use. The exit multiple only counts under
     * the exit-multiple method.
     *
     * @throws UnknownProvenanceException if a field in use carries no provenance tag
     */
    public Map<AssumptionField, ConfidenceTier> annotate(Assumptions assumptions) {
        Map<AssumptionField, ConfidenceTier> tiers = new EnumMap<>(AssumptionField.class);
        for (AssumptionField field : AssumptionField.values()) {
            if (field == AssumptionField.EXIT_MULTIPLE
                    && assumptions.getTerminalMethod() != TerminalMethod.EXIT_MULTIPLE) {
                continue;
            }
            Provenance provenance = assumptions.provenanceOf(field);
            if (provenance == null) {
                throw new UnknownProvenanceException(null,
                    "No provenance tag for assumption field " + field);
            }
            tiers.put(field, label(provenance));
        }
        log.debug("Confidence tiers: {}", tiers);
        return Collections.unmodifiableMap(tiers);
    }

    /** The less trustworthy of two sources; used when a value combines both. */
    public Provenance weaker(Provenance a, Provenance b) {
        return label(a).ordinal() >= label(b).ordinal() ? a : b;
    }
}
