package org.vain.astnode;

/**
 * Type tags attached by type inference. Only literals get a concrete tag;
 * everything else stays {@link #UNKNOWN}.
 */
public enum VainType {
    UNKNOWN,
    INT,
    FLOAT,
    STRING,
    BOOL,
    NONE,
    LIST,
    DICT,
    FUNC
}
