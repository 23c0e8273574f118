package com.jay.dcfengine.model.enums;

public enum ConfidenceTier {
    HIGH, // taken directly from filed data
    MED,  // computed from historical filings
    LOW   // heuristic default or industry norm
}
