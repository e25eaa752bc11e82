package com.minizeries.executor;

import com.minizeries.common.Constants;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.parser.ast.Expression;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * WHERE 条件求值器
 *
 * 对表函数没有消费的残余条件逐行求值，采用 SQL 的三值逻辑:
 * TRUE / FALSE / UNKNOWN（用 null 表示）。只有结果为 TRUE 的行被保留。
 *
 * 比较规则:
 * - 与 NULL 比较结果为 UNKNOWN（IS / IS NOT 除外）
 * - 整数与浮点数按精确数值比较
 * - 形如数字的文本按数值比较（列具有 INTEGER 亲和性）
 * - 数值总是小于非数字文本
 *
 * @author Mini-Zeries
 */
@Slf4j
public class ExpressionEvaluator {

    /**
     * 把多个条件按 AND 组合成一个行谓词
     */
    public Predicate<Map<String, Object>> toPredicate(List<Expression> conjuncts) {
        return row -> {
            for (Expression conjunct : conjuncts) {
                if (!Boolean.TRUE.equals(evaluate(conjunct, row))) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * 对一行数据求值
     *
     * @return TRUE / FALSE，UNKNOWN 时返回 null
     */
    public Boolean evaluate(Expression expr, Map<String, Object> row) {
        if (expr instanceof Expression.BinaryExpression) {
            Expression.BinaryExpression binary = (Expression.BinaryExpression) expr;
            if (binary.isLogical()) {
                return evaluateLogical(binary, row);
            }
            Object left = columnValue(((Expression.ColumnReference) binary.getLeft()).getColumnName(), row);
            Object right = ((Expression.LiteralExpression) binary.getRight()).getValue();
            return evaluateComparison(left, binary.getOperator(), right);
        }

        if (expr instanceof Expression.UnaryExpression) {
            Boolean operand = evaluate(((Expression.UnaryExpression) expr).getOperand(), row);
            return operand == null ? null : !operand;
        }

        if (expr instanceof Expression.BetweenExpression) {
            Expression.BetweenExpression between = (Expression.BetweenExpression) expr;
            Object value = columnValue(between.getColumnName(), row);
            Boolean result = and(evaluateComparison(value, ">=", between.getStart()),
                    evaluateComparison(value, "<=", between.getEnd()));
            if (result == null) {
                return null;
            }
            return between.isNegated() != result;
        }

        if (expr instanceof Expression.InExpression) {
            Expression.InExpression in = (Expression.InExpression) expr;
            Object value = columnValue(in.getColumnName(), row);
            Boolean result = Boolean.FALSE;
            for (Object candidate : in.getValues()) {
                Boolean eq = evaluateComparison(value, "=", candidate);
                if (Boolean.TRUE.equals(eq)) {
                    result = Boolean.TRUE;
                    break;
                }
                if (eq == null) {
                    result = null;
                }
            }
            if (result == null) {
                return null;
            }
            return in.isNegated() != result;
        }

        throw new UnsupportedOperationException("Unsupported expression: " + expr);
    }

    private Boolean evaluateLogical(Expression.BinaryExpression binary, Map<String, Object> row) {
        Boolean left = evaluate(binary.getLeft(), row);
        Boolean right = evaluate(binary.getRight(), row);
        if ("AND".equalsIgnoreCase(binary.getOperator())) {
            return and(left, right);
        }
        if (Boolean.TRUE.equals(left) || Boolean.TRUE.equals(right)) {
            return true;
        }
        if (left == null || right == null) {
            return null;
        }
        return false;
    }

    private static Boolean and(Boolean left, Boolean right) {
        if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
            return false;
        }
        if (left == null || right == null) {
            return null;
        }
        return true;
    }

    /**
     * 读取行中的列值，rowid 映射为 value
     */
    private Object columnValue(String columnName, Map<String, Object> row) {
        Column column = Column.fromName(columnName);
        if (column == null) {
            throw new IllegalArgumentException("No such column: " + columnName);
        }
        return row.get(column.isValue() ? Constants.COLUMN_VALUE : column.getColumnName());
    }

    /**
     * 执行比较操作
     */
    Boolean evaluateComparison(Object left, String operator, Object right) {
        String op = operator.toUpperCase();
        if ("IS".equals(op) || "IS NOT".equals(op)) {
            boolean same;
            if (left == null || right == null) {
                same = left == null && right == null;
            } else {
                same = compare(left, right) == 0;
            }
            return "IS".equals(op) == same;
        }

        if (left == null || right == null) {
            return null;
        }

        int cmp = compare(left, right);
        switch (op) {
            case "=":
            case "==":
                return cmp == 0;
            case "!=":
            case "<>":
                return cmp != 0;
            case "<":
                return cmp < 0;
            case "<=":
                return cmp <= 0;
            case ">":
                return cmp > 0;
            case ">=":
                return cmp >= 0;
            default:
                log.warn("Unsupported operator: {}", operator);
                return null;
        }
    }

    /**
     * 比较两个非空值
     */
    private int compare(Object left, Object right) {
        SqlValue l = SqlValue.of(left);
        SqlValue r = SqlValue.of(right);
        boolean leftNumeric = l.numericType() != SqlValue.NumericType.OTHER;
        boolean rightNumeric = r.numericType() != SqlValue.NumericType.OTHER;

        if (leftNumeric && rightNumeric) {
            return toDecimal(l).compareTo(toDecimal(r));
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return left.toString().compareTo(right.toString());
    }

    private static BigDecimal toDecimal(SqlValue value) {
        if (value.numericType() == SqlValue.NumericType.INTEGER) {
            return BigDecimal.valueOf(value.longValue());
        }
        double d = value.doubleValue();
        if (Double.isInfinite(d)) {
            // 比任何 long 都大 / 小
            return d > 0 ? BigDecimal.valueOf(Double.MAX_VALUE) : BigDecimal.valueOf(-Double.MAX_VALUE);
        }
        return new BigDecimal(d);
    }
}
