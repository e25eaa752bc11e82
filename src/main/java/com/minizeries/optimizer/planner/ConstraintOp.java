package com.minizeries.optimizer.planner;

import lombok.Getter;

/**
 * 宿主查询引擎提供给表函数的约束运算符
 *
 * LIMIT / OFFSET 也以约束的形式下推，它们不关联具体的列。
 *
 * @author Mini-Zeries
 */
@Getter
public enum ConstraintOp {

    EQ("="),
    GT(">"),
    LE("<="),
    LT("<"),
    GE(">="),
    IS("IS"),
    NE("!="),
    IS_NOT("IS NOT"),
    IS_NOT_NULL("IS NOT NULL"),
    IS_NULL("IS NULL"),
    LIMIT("LIMIT"),
    OFFSET("OFFSET");

    private final String symbol;

    ConstraintOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * 把 SQL 比较运算符映射为约束运算符
     *
     * @param operator SQL 运算符文本
     * @return 约束运算符，不支持时返回 null
     */
    public static ConstraintOp fromComparison(String operator) {
        switch (operator.toUpperCase()) {
            case "=":
            case "==":
                return EQ;
            case "<":
                return LT;
            case "<=":
                return LE;
            case ">":
                return GT;
            case ">=":
                return GE;
            case "!=":
            case "<>":
                return NE;
            case "IS":
                return IS;
            case "IS NOT":
                return IS_NOT;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
