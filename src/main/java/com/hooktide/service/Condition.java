package com.hooktide.service;

import java.util.Map;

/**
 * A compiled filter expression. Immutable and safe to share between threads;
 * evaluation never does I/O, so the same input always gives the same answer.
 */
public final class Condition {

    private final String expression;
    private final ConditionEvaluator.Node root;

    Condition(String expression, ConditionEvaluator.Node root) {
        this.expression = expression;
        this.root = root;
    }

    /**
     * @param body    parsed webhook body
     * @param headers request headers, ideally a case-insensitive map
     */
    public boolean matches(Map<String, Object> body, Map<String, String> headers) {
        return root.test(body, headers);
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
