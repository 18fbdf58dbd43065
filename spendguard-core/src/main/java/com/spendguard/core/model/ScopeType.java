package com.spendguard.core.model;

/**
 * The kind of subject a budget applies to.
 */
public enum ScopeType {
    USER,
    PROJECT,
    ORGANIZATION
}
