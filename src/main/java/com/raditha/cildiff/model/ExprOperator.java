package com.raditha.cildiff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Operators of boolean, constraint and permission expressions.
 */
public enum ExprOperator {
    AND("and", true),
    OR("or", true),
    XOR("xor", true),
    NOT("not", false),
    ALL("all", false),
    EQ("eq", true),
    NEQ("neq", true),
    DOM("dom", false),
    DOMBY("domby", false),
    INCOMP("incomp", true),
    RANGE("range", false);

    private static final Map<String, ExprOperator> BY_KEYWORD = new HashMap<>();

    static {
        for (ExprOperator operator : values()) {
            BY_KEYWORD.put(operator.keyword, operator);
        }
    }

    private final String keyword;
    private final boolean commutative;

    ExprOperator(String keyword, boolean commutative) {
        this.keyword = keyword;
        this.commutative = commutative;
    }

    public static ExprOperator fromKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    public boolean isCommutative() {
        return commutative;
    }
}
