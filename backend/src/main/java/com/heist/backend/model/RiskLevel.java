package com.heist.backend.model;

public enum RiskLevel {
    SAFE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 90) return SAFE;
        if (score >= 70) return LOW;
        if (score >= 50) return MEDIUM;
        if (score >= 30) return HIGH;
        return CRITICAL;
    }

    /**
     * Maps a collaborator-reported level name; unknown names read as MEDIUM.
     */
    public static RiskLevel fromLabel(String label) {
        if (label == null) {
            return MEDIUM;
        }
        return switch (label.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "low", "info" -> LOW;
            case "high", "warn" -> HIGH;
            case "critical", "danger" -> CRITICAL;
            default -> MEDIUM;
        };
    }
}
