package org.dxworks.apislice.model;

public enum DetectionTier {
    DECORATOR,
    CALL_PATTERN,
    TEXT_PATTERN
}
