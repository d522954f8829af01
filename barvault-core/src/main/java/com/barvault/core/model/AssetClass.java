package com.barvault.core.model;

public enum AssetClass {
    EQUITY,
    FX,
    CRYPTO,
    FUTURE,
    OPTION,
    INDEX,
    COMMODITY
}
