package com.underwriting.engine.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of a condition tree: either a {@link LeafCondition} comparing one
 * field of the case context, or a {@link CompoundCondition} combining
 * sub-conditions with AND/OR.
 * <p>
 * Trees come from static rule configuration and are immutable once built.
 */
@JsonDeserialize(using = ConditionDeserializer.class)
public abstract class Condition {

    Condition() {
    }

    public abstract boolean isCompound();

    /**
     * Leaf comparison operators, keyed by their configuration symbol.
     */
    public enum Operator {
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LTE("<="),
        GTE(">="),
        CONTAINS("contains"),
        IN("in"),
        MATCHES("matches"),
        EXISTS("exists"),
        NOT_EXISTS("notExists");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Resolves a configuration symbol.
         *
         * @param symbol operator symbol, e.g. {@code ">="} or {@code "notExists"}
         * @return the operator, or {@code null} when the symbol is unknown
         */
        public static Operator fromSymbol(String symbol) {
            if (symbol == null) {
                return null;
            }
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }

        /**
         * Whether the operator only tests definedness and ignores the compare value.
         */
        public boolean isPresenceCheck() {
            return this == EXISTS || this == NOT_EXISTS;
        }

        public static List<String> symbols() {
            return Arrays.stream(values()).map(Operator::symbol).collect(Collectors.toList());
        }
    }
}
