package com.raditha.cildiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * An expression: an optional leading operator followed by operands, each of which is a
 * name or a nested expression. Without an operator the expression is a plain list.
 *
 * @param operator leading operator, or null
 * @param operands operands in source order
 */
public record CilExpr(ExprOperator operator, List<Operand> operands) {

    public CilExpr {
        operands = List.copyOf(operands);
    }

    public static CilExpr names(List<String> names) {
        return new CilExpr(null, names.stream().map(Operand::name).toList());
    }

    public static CilExpr of(ExprOperator operator, Operand... operands) {
        return new CilExpr(operator, List.of(operands));
    }

    /**
     * Whether operand order carries meaning.
     */
    @JsonIgnore
    public boolean isOrdered() {
        return operator != null && !operator.isCommutative();
    }

    /**
     * A single expression operand.
     *
     * @param name the operand name, or null if nested
     * @param expr the nested expression, or null if a name
     */
    public record Operand(String name, CilExpr expr) {

        public Operand {
            if ((name == null) == (expr == null)) {
                throw new IllegalArgumentException("Operand must be either a name or an expression");
            }
        }

        public static Operand name(String name) {
            return new Operand(name, null);
        }

        public static Operand expr(CilExpr expr) {
            return new Operand(null, expr);
        }

        @JsonValue
        public Object value() {
            return name != null ? name : expr;
        }
    }
}
