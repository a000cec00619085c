package com.heist.backend.model;

public record SecurityCheck(String name, boolean passed, double score, String detail, RiskLevel severity) {

    public static SecurityCheck passed(String name, double score, String detail, RiskLevel severity) {
        return new SecurityCheck(name, true, score, detail, severity);
    }

    public static SecurityCheck failed(String name, double score, String detail, RiskLevel severity) {
        return new SecurityCheck(name, false, score, detail, severity);
    }

    public boolean isCriticalFailure() {
        return !passed && severity == RiskLevel.CRITICAL;
    }
}
