package com.minizeries.optimizer.cost;

import com.minizeries.common.Constants;
import com.minizeries.optimizer.planner.ConstraintSlot;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * 表函数扫描的成本模型
 *
 * 序列是无限的，成本只需单调地反映选择性，供宿主优化器比较不同计划:
 * 1. 没有任何边界: 2^64
 * 2. 存在上界: 成本减半
 * 3. 存在下界: 成本再减半
 * 4. 存在等值条件: 成本为 1
 *
 * 成本只是建议值，不影响结果的正确性。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SeriesCostModel {

    /**
     * 根据被消费的槽位估算扫描成本
     *
     * @param consumed 已消费的槽位集合
     * @return 估算成本
     */
    public double estimateScanCost(Set<ConstraintSlot> consumed) {
        double cost = Constants.UNBOUNDED_COST;

        boolean hasUpper = consumed.contains(ConstraintSlot.LT) || consumed.contains(ConstraintSlot.LE);
        boolean hasLower = consumed.contains(ConstraintSlot.GE) || consumed.contains(ConstraintSlot.GT);

        if (hasUpper) {
            cost *= 0.5;
        }
        if (hasLower) {
            cost *= 0.5;
        }
        if (consumed.contains(ConstraintSlot.EQ)) {
            cost = Constants.EQUALITY_COST;
        }

        log.debug("Series scan cost: upper={}, lower={}, eq={}, cost={}",
                hasUpper, hasLower, consumed.contains(ConstraintSlot.EQ), cost);

        return cost;
    }
}
