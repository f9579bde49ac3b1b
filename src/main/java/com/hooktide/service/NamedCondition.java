package com.hooktide.service;

/** A filter rule: its configured name plus the compiled expression. */
public record NamedCondition(String name, Condition condition) {
}
