package com.minizeries.parser.ast;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * SELECT 语句的 AST 节点
 *
 * 语法: SELECT columns FROM fn(args) [WHERE condition] [ORDER BY ...] [LIMIT n [OFFSET k]]
 *
 * @author Mini-Zeries
 */
@Data
@EqualsAndHashCode(callSuper = false)
public class SelectStatement extends SqlStatement {

    /**
     * 选择的列
     */
    private List<SelectElement> selectElements = new ArrayList<>();

    /**
     * 表函数名
     */
    private String tableName;

    /**
     * 表函数参数（字面量，可能为空列表）
     */
    private List<Object> tableArguments = new ArrayList<>();

    /**
     * WHERE 条件表达式
     */
    private Expression whereCondition;

    /**
     * ORDER BY 子句
     */
    private List<OrderByElement> orderByElements = new ArrayList<>();

    /**
     * LIMIT 值（字面量，未指定时为 null）
     */
    private Object limit;

    /**
     * OFFSET 值（字面量，未指定时为 null）
     */
    private Object offset;

    /**
     * 是否是 SELECT *
     */
    private boolean selectAll;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (selectAll) {
            sb.append("*");
        } else {
            for (int i = 0; i < selectElements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(selectElements.get(i));
            }
        }
        sb.append(" FROM ").append(tableName).append("(");
        for (int i = 0; i < tableArguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(Expression.formatLiteral(tableArguments.get(i)));
        }
        sb.append(")");

        if (whereCondition != null) {
            sb.append(" WHERE ").append(whereCondition);
        }

        if (!orderByElements.isEmpty()) {
            sb.append(" ORDER BY ");
            for (int i = 0; i < orderByElements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(orderByElements.get(i));
            }
        }

        if (limit != null) {
            sb.append(" LIMIT ").append(Expression.formatLiteral(limit));
        }
        if (offset != null) {
            sb.append(" OFFSET ").append(Expression.formatLiteral(offset));
        }

        return sb.toString();
    }

    /**
     * SELECT 列元素
     */
    @Data
    public static class SelectElement {
        /**
         * 列名
         */
        private String columnName;

        /**
         * 别名
         */
        private String alias;

        @Override
        public String toString() {
            if (alias != null) {
                return columnName + " AS " + alias;
            }
            return columnName;
        }
    }

    /**
     * ORDER BY 元素
     */
    @Data
    public static class OrderByElement {
        /**
         * 列名
         */
        private String columnName;

        /**
         * 是否降序(true=DESC, false=ASC)
         */
        private boolean descending;

        @Override
        public String toString() {
            return columnName + (descending ? " DESC" : " ASC");
        }
    }
}
