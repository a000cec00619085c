package com.heist.backend.model;

public enum SizingStrategy {
    CONSERVATIVE,
    BALANCED,
    AGGRESSIVE,
    ADAPTIVE
}
