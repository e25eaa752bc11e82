package com.minizeries.optimizer.planner;

import com.minizeries.common.Constants;
import com.minizeries.optimizer.cost.SeriesCostModel;
import com.minizeries.optimizer.planner.IndexInfo.IndexConstraint;
import com.minizeries.optimizer.planner.IndexInfo.OrderByTerm;
import com.minizeries.optimizer.planner.SeriesPlan.ConstraintUsage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 表函数的谓词规划器
 *
 * 宿主优化器在查询准备阶段调用，决定哪些约束由表函数自己处理:
 * 1. 精确槽位 (step, base, value 等值) 只接受 = / IS
 * 2. value 列还接受 &lt; &lt;= &gt;= &gt;
 * 3. LIMIT / OFFSET 总是被消费
 * 4. 被消费的约束按出现顺序分配参数序号，并标记 omit（宿主无需复查）
 * 5. ORDER BY 中第一个 value 项决定扫描方向，排序被消费后宿主无需再排序
 *
 * 规划是纯函数: 相同的输入总是得到相同的计划，没有副作用。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SeriesPlanner {

    private final SeriesCostModel costModel;

    public SeriesPlanner() {
        this(new SeriesCostModel());
    }

    public SeriesPlanner(SeriesCostModel costModel) {
        this.costModel = costModel;
    }

    /**
     * 为给定的查询形态生成执行计划
     *
     * @param info 查询形态
     * @return 执行计划
     */
    public SeriesPlan bestIndex(IndexInfo info) {
        StringBuilder indexString = new StringBuilder();
        List<ConstraintUsage> usages = new ArrayList<>(info.getConstraints().size());
        Set<ConstraintSlot> consumed = EnumSet.noneOf(ConstraintSlot.class);
        int argIndex = 0;

        for (IndexConstraint constraint : info.getConstraints()) {
            ConstraintSlot slot = constraint.isUsable() ? slotFor(constraint) : null;
            if (slot == null) {
                log.debug("Constraint not consumed: {}", constraint);
                usages.add(ConstraintUsage.UNUSED);
                continue;
            }

            usages.add(new ConstraintUsage(++argIndex, true));
            indexString.append(slot.code());
            consumed.add(slot);
            log.debug("Constraint {} -> slot {} (arg {})", constraint, slot, argIndex);
        }

        int indexNumber = 0;
        boolean orderByConsumed = false;
        for (OrderByTerm term : info.getOrderBy()) {
            if (term.getColumn().isValue()) {
                orderByConsumed = true;
                if (term.isDescending()) {
                    indexNumber |= Constants.FLAG_DESC;
                }
                break;
            }
        }

        double cost = costModel.estimateScanCost(consumed);

        SeriesPlan plan = new SeriesPlan(indexNumber, indexString.toString(), cost,
                orderByConsumed, usages);
        log.debug("Plan chosen: indexNumber={}, indexString='{}', cost={}, orderByConsumed={}",
                plan.getIndexNumber(), plan.getIndexString(), cost, orderByConsumed);
        return plan;
    }

    /**
     * 约束对应的槽位
     *
     * @return 槽位，不能消费时返回 null
     */
    private ConstraintSlot slotFor(IndexConstraint constraint) {
        Column column = constraint.getColumn();

        switch (constraint.getOp()) {
            case LIMIT:
                return ConstraintSlot.LIMIT;
            case OFFSET:
                return ConstraintSlot.OFFSET;
            case EQ:
            case IS:
                if (column == null) {
                    return null;
                }
                switch (column) {
                    case ROWID:
                    case VALUE:
                        return ConstraintSlot.EQ;
                    case STEP:
                        return ConstraintSlot.STEP;
                    case BASE:
                        return ConstraintSlot.BASE;
                    default:
                        return null;
                }
            case LT:
                return column != null && column.isValue() ? ConstraintSlot.LT : null;
            case LE:
                return column != null && column.isValue() ? ConstraintSlot.LE : null;
            case GE:
                return column != null && column.isValue() ? ConstraintSlot.GE : null;
            case GT:
                return column != null && column.isValue() ? ConstraintSlot.GT : null;
            default:
                return null;
        }
    }
}
