package com.vibecoding.k8scapacity.model;

/**
 * How a memory quantity without unit suffix is interpreted.
 * The two conventions are not interchangeable; every call site picks one.
 */
public enum BareNumberConvention {
    /** "512" means 512 MiB */
    MEBIBYTES,
    /** "536870912" means 536870912 bytes (raw API byte quantities) */
    BYTES
}
