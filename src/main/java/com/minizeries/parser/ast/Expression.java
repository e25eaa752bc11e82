package com.minizeries.parser.ast;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 表达式抽象基类
 *
 * 用于表示 WHERE 条件
 *
 * @author Mini-Zeries
 */
public abstract class Expression {

    /**
     * 字面量的 SQL 文本形式
     */
    public static String formatLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        return String.valueOf(value);
    }

    /**
     * 二元运算表达式
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class BinaryExpression extends Expression {
        /**
         * 运算符
         */
        private String operator;

        /**
         * 左操作数
         */
        private Expression left;

        /**
         * 右操作数
         */
        private Expression right;

        public BinaryExpression() {
        }

        public BinaryExpression(String operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        /**
         * 是否为逻辑运算（AND / OR）
         */
        public boolean isLogical() {
            return "AND".equalsIgnoreCase(operator) || "OR".equalsIgnoreCase(operator);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * 一元运算表达式
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class UnaryExpression extends Expression {
        /**
         * 运算符 (NOT)
         */
        private String operator;

        /**
         * 操作数
         */
        private Expression operand;

        @Override
        public String toString() {
            return operator + " " + operand;
        }
    }

    /**
     * 字面量表达式 (常量)
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class LiteralExpression extends Expression {
        /**
         * 字面量值
         */
        private Object value;

        /**
         * 数据类型 (INTEGER, REAL, STRING, NULL, BOOLEAN)
         */
        private String dataType;

        public LiteralExpression() {
        }

        public LiteralExpression(Object value, String dataType) {
            this.value = value;
            this.dataType = dataType;
        }

        @Override
        public String toString() {
            return formatLiteral(value);
        }
    }

    /**
     * 列引用表达式
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class ColumnReference extends Expression {
        /**
         * 列名
         */
        private String columnName;

        public ColumnReference() {
        }

        public ColumnReference(String columnName) {
            this.columnName = columnName;
        }

        @Override
        public String toString() {
            return columnName;
        }
    }

    /**
     * IN 表达式
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class InExpression extends Expression {
        /**
         * 列名
         */
        private String columnName;

        /**
         * 值列表
         */
        private List<Object> values = new ArrayList<>();

        /**
         * NOT IN
         */
        private boolean negated;

        @Override
        public String toString() {
            return columnName + (negated ? " NOT IN (" : " IN (")
                    + values.stream().map(Expression::formatLiteral).collect(Collectors.joining(", "))
                    + ")";
        }
    }

    /**
     * BETWEEN 表达式
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class BetweenExpression extends Expression {
        /**
         * 列名
         */
        private String columnName;

        /**
         * 范围起始值
         */
        private Object start;

        /**
         * 范围结束值
         */
        private Object end;

        /**
         * NOT BETWEEN
         */
        private boolean negated;

        @Override
        public String toString() {
            return columnName + (negated ? " NOT BETWEEN " : " BETWEEN ")
                    + formatLiteral(start) + " AND " + formatLiteral(end);
        }
    }
}
