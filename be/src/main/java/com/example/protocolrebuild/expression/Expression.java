package com.example.protocolrebuild.expression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed form of a visibility/applicability rule. Only the constructs below exist; anything
 * else is rejected while parsing.
 */
public interface Expression {

    /**
     * Every bare identifier referenced anywhere in this expression, in first-seen order.
     */
    default Set<String> identifiers() {
        Set<String> found = new LinkedHashSet<>();
        collectIdentifiers(this, found);
        return found;
    }

    private static void collectIdentifiers(Expression e, Set<String> found) {
        if (e instanceof Identifier id) {
            found.add(id.name());
        } else if (e instanceof Or or) {
            or.operands().forEach(o -> collectIdentifiers(o, found));
        } else if (e instanceof And and) {
            and.operands().forEach(o -> collectIdentifiers(o, found));
        } else if (e instanceof Not not) {
            collectIdentifiers(not.operand(), found);
        } else if (e instanceof Comparison c) {
            collectIdentifiers(c.left(), found);
            collectIdentifiers(c.right(), found);
        } else if (e instanceof ListLiteral list) {
            list.elements().forEach(o -> collectIdentifiers(o, found));
        }
    }

    enum Operator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="), IN("in"), NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isMembership() {
            return this == IN || this == NOT_IN;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }
    }

    record Or(List<Expression> operands) implements Expression {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record And(List<Expression> operands) implements Expression {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Not(Expression operand) implements Expression {
    }

    record Comparison(Expression left, Operator operator, Expression right) implements Expression {
    }

    record Identifier(String name) implements Expression {
    }

    record StringLiteral(String value) implements Expression {
    }

    record NumberLiteral(String text) implements Expression {
    }

    record BooleanLiteral(boolean value) implements Expression {
    }

    record ListLiteral(List<Expression> elements) implements Expression {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }
}
