package org.dxworks.apislice.model;

public enum CallKind {
    /** {@code name(...)} */
    FUNCTION_CALL,
    /** {@code object.name(...)} */
    METHOD_CALL
}
