package com.jay.dcfengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads and exposes the engine settings from engine.yaml.
 * Values are read once at startup; every section has in-code defaults so a missing file
 * still yields a working engine. A file that is present but malformed stops startup.
 */
@Slf4j
@Component
public class EngineConfig {

    @Value("${engine.config-file:engine.yaml}")
    private String configFile = "engine.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Fade fade = new Fade();
    private Scenarios scenarios = new Scenarios();
    private Sensitivity sensitivity = new Sensitivity();
    private Defaults defaults = new Defaults();
    private Wacc wacc = new Wacc();
    private Execution execution = new Execution();

    @PostConstruct
    public void load() {
        loadFrom(configFile);
    }

    /** Replaces every section with the content of the given classpath resource. */
    public void loadFrom(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", resource);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root == null) {
                log.warn("Config file '{}' is empty — using defaults", resource);
                return;
            }
            this.fade        = root.getFade();
            this.scenarios   = root.getScenarios();
            this.sensitivity = root.getSensitivity();
            this.defaults    = root.getDefaults();
            this.wacc        = root.getWacc();
            this.execution   = root.getExecution();
            this.configFile  = resource;
            log.info("EngineConfig loaded from '{}'. Parallelism: {}", resource, execution.getParallelism());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load engine config '" + resource + "'", e);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Fade fade()               { return fade; }
    public Scenarios scenarios()     { return scenarios; }
    public Sensitivity sensitivity() { return sensitivity; }
    public Defaults defaults()       { return defaults; }
    public Wacc wacc()               { return wacc; }
    public Execution execution()     { return execution; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Fade fade = new Fade();
        private Scenarios scenarios = new Scenarios();
        private Sensitivity sensitivity = new Sensitivity();
        private Defaults defaults = new Defaults();
        private Wacc wacc = new Wacc();
        private Execution execution = new Execution();
    }

    @Data public static class Fade {
        private double exponentialK = 2.0;           // curvature of the exponential fade
        private int piecewiseBreakpointYears = 2;    // length of the fast segment
        private double piecewiseFastShare = 0.6;     // share of the total fade done in the fast segment
    }

    @Data public static class Scenarios {
        private Delta bull = new Delta(0.02, 0.05, -0.01, 0.005);
        private Delta bear = new Delta(-0.02, -0.05, 0.01, -0.005);
    }

    /** Additive shifts applied to Base assumptions to derive a scenario. */
    @Data public static class Delta {
        private double growthShift;
        private double marginShift;
        private double costOfCapitalShift;
        private double terminalGrowthShift;

        public Delta() {}

        public Delta(double growthShift, double marginShift, double costOfCapitalShift, double terminalGrowthShift) {
            this.growthShift = growthShift;
            this.marginShift = marginShift;
            this.costOfCapitalShift = costOfCapitalShift;
            this.terminalGrowthShift = terminalGrowthShift;
        }
    }

    @Data public static class Sensitivity {
        private int points = 5;                      // per axis, odd
        private double costOfCapitalStep = 0.01;
        private double terminalGrowthStep = 0.005;
    }

    @Data public static class Defaults {
        private int horizonYears = 5;
        private double startGrowth = 0.05;           // when no revenue history is available
        private double terminalGrowth = 0.025;
        private double maxStartGrowth = 0.50;        // cap on historical CAGR used as a seed
        private double cogsPct = 0.60;               // excluding D&A
        private double sgaPct = 0.21;
        private double daPct = 0.04;
        private double capexPct = 0.05;
        private double nwcPct = 0.10;
        private double sbcPct = 0.0;
        private double exitMultiple = 10.0;
    }

    @Data public static class Wacc {
        private double riskFreeRate = 0.04;
        private double equityRiskPremium = 0.06;
        private double beta = 1.0;
        private double costOfDebt = 0.05;
        private double debtToEquity = 0.3;
        private double taxRate = 0.21;
    }

    @Data public static class Execution {
        private int parallelism = 4;                 // worker threads for scenarios and grid rows
    }
}
