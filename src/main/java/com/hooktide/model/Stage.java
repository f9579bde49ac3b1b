package com.hooktide.model;

/** The stages of the chain, in execution order. */
public enum Stage {
    VALIDATE,
    DEDUPLICATE,
    CLASSIFY,
    ENRICH,
    BIND,
    RESOLVE,
    DISPATCH
}
