package com.minizeries.optimizer.planner;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 宿主优化器向表函数描述的查询形态
 *
 * 包含:
 * 1. 所有可下推的约束（列 + 运算符 + 是否可用）
 * 2. ORDER BY 子句
 *
 * 只描述"形态"，不包含任何参数值。
 *
 * @author Mini-Zeries
 */
@Data
public class IndexInfo {

    private final List<IndexConstraint> constraints = new ArrayList<>();

    private final List<OrderByTerm> orderBy = new ArrayList<>();

    /**
     * 添加一个可用约束
     *
     * @return 约束在列表中的位置
     */
    public int addConstraint(Column column, ConstraintOp op) {
        return addConstraint(column, op, true);
    }

    public int addConstraint(Column column, ConstraintOp op, boolean usable) {
        constraints.add(new IndexConstraint(column, op, usable));
        return constraints.size() - 1;
    }

    public IndexInfo addOrderBy(Column column, boolean descending) {
        orderBy.add(new OrderByTerm(column, descending));
        return this;
    }

    /**
     * 单个约束
     */
    @Data
    public static class IndexConstraint {
        /**
         * 被约束的列（LIMIT / OFFSET 时为 null）
         */
        private final Column column;

        private final ConstraintOp op;

        /**
         * 宿主是否允许在本次计划中使用该约束
         */
        private final boolean usable;

        @Override
        public String toString() {
            if (column == null) {
                return op.getSymbol();
            }
            return column.getColumnName() + " " + op.getSymbol() + " ?";
        }
    }

    /**
     * ORDER BY 项
     */
    @Data
    public static class OrderByTerm {
        private final Column column;

        private final boolean descending;

        @Override
        public String toString() {
            return column.getColumnName() + (descending ? " DESC" : " ASC");
        }
    }
}
