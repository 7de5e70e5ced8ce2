package com.planforge.core.model;

public enum ImplementationVerdict {
    APPROVED,
    NEEDS_CHANGES
}
