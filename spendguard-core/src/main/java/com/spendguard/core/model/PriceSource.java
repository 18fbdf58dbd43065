package com.spendguard.core.model;

/**
 * Which fallback tier answered a pricing lookup.
 */
public enum PriceSource {

    /** A current-dated row from the persistent price store. */
    DATABASE,

    /** The static table shipped with the provider integration. */
    DRIVER_DEFAULT,

    /** The hard-coded conservative rate used when nothing else matched. */
    UNIVERSAL_FALLBACK
}
