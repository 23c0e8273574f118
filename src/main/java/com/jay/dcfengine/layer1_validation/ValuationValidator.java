package com.jay.dcfengine.layer1_validation;

import com.jay.dcfengine.exception.ValidationException;
import com.jay.dcfengine.exception.ValidationException.Violation;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.FinancialSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Layer 1: Valuation Validator.
 * Hard gate run before any forecasting. If ANY precondition fails the run is rejected;
 * nothing downstream ever sees partially valid input.
 */
@Slf4j
@Service
public class ValuationValidator {

    public static final String FIELD_GROWTH_PATH = "growthPath";
    public static final String FIELD_REVENUE = "revenue";
    public static final String FIELD_SHARES = "sharesOutstanding";

    /**
     * Validates a snapshot against the growth path the assumptions will produce
     * (one rate per horizon year).
     */
    public void validate(FinancialSnapshot snapshot, Assumptions assumptions) {
        List<Violation> violations = new ArrayList<>();
        if (assumptions == null || assumptions.getHorizonYears() < 1) {
            violations.add(new Violation(FIELD_GROWTH_PATH, String.format(Locale.ROOT,
                "growth path is empty (horizon %d years, need at least 1)",
                assumptions == null ? 0 : assumptions.getHorizonYears())));
        }
        checkSnapshot(snapshot, violations);
        finish(snapshot, violations);
    }

    /** Validates a snapshot against an already materialised growth path. */
    public void validate(FinancialSnapshot snapshot, List<Double> growthPath) {
        List<Violation> violations = new ArrayList<>();
        if (growthPath == null || growthPath.isEmpty()) {
            violations.add(new Violation(FIELD_GROWTH_PATH, "growth path is empty"));
        }
        checkSnapshot(snapshot, violations);
        finish(snapshot, violations);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void checkSnapshot(FinancialSnapshot snapshot, List<Violation> violations) {
        if (snapshot == null) {
            violations.add(new Violation("snapshot", "financial snapshot is missing"));
            return;
        }
        if (!(snapshot.getRevenue() > 0)) {
            violations.add(new Violation(FIELD_REVENUE,
                String.format(Locale.ROOT, "base revenue must be > 0, was %.2f", snapshot.getRevenue())));
        }
        if (!(snapshot.getSharesOutstanding() > 0)) {
            violations.add(new Violation(FIELD_SHARES,
                String.format(Locale.ROOT, "share count must be > 0, was %.2f", snapshot.getSharesOutstanding())));
        }
    }

    private void finish(FinancialSnapshot snapshot, List<Violation> violations) {
        String ticker = snapshot != null ? snapshot.getTicker() : null;
        if (!violations.isEmpty()) {
            log.info("Validation FAILED for {} — {} violations: {}", ticker, violations.size(), violations);
            throw new ValidationException(violations);
        }
        log.debug("Validation PASSED for {}", ticker);
    }
}
