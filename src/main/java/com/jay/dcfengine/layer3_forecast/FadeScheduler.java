package com.jay.dcfengine.layer3_forecast;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.model.enums.FadeMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Layer 3: Fade Scheduler.
 * Turns a starting rate and a terminal rate into one rate per forecast year.
 * The first year carries the starting rate (except for one-year horizons) and the last
 * year is always exactly the terminal rate.
 *
 * Shapes, with t = i / (years - 1):
 *   LINEAR       start + (end - start) * t
 *   EXPONENTIAL  start + (end - start) * (e^(k t) - 1) / (e^k - 1)
 *   PIECEWISE    linear to start + (end - start) * fastShare over the first breakpoint
 *                years, then linear to end over the rest; falls back to LINEAR when the
 *                horizon is too short for the second segment to be the slower one
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FadeScheduler {

    private final EngineConfig config;

    public List<Double> schedule(double start, double end, int years, FadeMethod method) {
        if (years < 1) {
            throw new InvalidAssumptionException("Fade horizon must be at least 1 year, was " + years);
        }
        if (method == null) {
            throw new InvalidAssumptionException("Fade method is required");
        }
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "Fade rates must be finite, got start=%s end=%s", start, end));
        }
        if (years == 1) return List.of(end);
        if (start == end) return Collections.nCopies(years, end);

        double[] rates = switch (method) {
            case LINEAR -> linear(start, end, years);
            case EXPONENTIAL -> exponential(start, end, years);
            case PIECEWISE -> piecewise(start, end, years);
        };
        rates[years - 1] = end;

        List<Double> out = new ArrayList<>(years);
        for (double r : rates) out.add(r);
        log.debug("{} fade {} -> {} over {}y: {}", method, start, end, years, out);
        return Collections.unmodifiableList(out);
    }

    // ── Shapes ────────────────────────────────────────────────────────────────

    private double[] linear(double start, double end, int years) {
        double[] rates = new double[years];
        int steps = years - 1;
        for (int i = 0; i < years; i++) {
            rates[i] = start + (end - start) * i / steps;
        }
        return rates;
    }

    private double[] exponential(double start, double end, int years) {
        double k = config.fade().getExponentialK();
        if (!(k > 0)) {
            throw new InvalidAssumptionException("Exponential fade constant k must be > 0, was " + k);
        }
        double[] rates = new double[years];
        int steps = years - 1;
        double denominator = Math.expm1(k);
        for (int i = 0; i < years; i++) {
            double t = (double) i / steps;
            rates[i] = start + (end - start) * Math.expm1(k * t) / denominator;
        }
        return rates;
    }

    private double[] piecewise(double start, double end, int years) {
        int breakpoint = config.fade().getPiecewiseBreakpointYears();
        double fastShare = config.fade().getPiecewiseFastShare();
        if (breakpoint < 1) {
            throw new InvalidAssumptionException("Piecewise breakpoint must be at least 1 year, was " + breakpoint);
        }
        if (fastShare < 0 || fastShare > 1) {
            throw new InvalidAssumptionException("Piecewise fast share must be within [0, 1], was " + fastShare);
        }
        int steps = years - 1;
        int slowSteps = steps - breakpoint;
        if (slowSteps < 1 || (1 - fastShare) / slowSteps > fastShare / breakpoint) {
            return linear(start, end, years);
        }
        double mid = start + (end - start) * fastShare;
        double[] rates = new double[years];
        for (int i = 0; i <= breakpoint; i++) {
            rates[i] = start + (mid - start) * i / breakpoint;
        }
        for (int i = breakpoint + 1; i < years; i++) {
            rates[i] = mid + (end - mid) * (i - breakpoint) / slowSteps;
        }
        return rates;
    }
}
