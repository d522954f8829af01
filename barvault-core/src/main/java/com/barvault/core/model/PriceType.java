package com.barvault.core.model;

/**
 * Which price a bar was built from.
 */
public enum PriceType {
    BID,
    ASK,
    MID,
    LAST
}
