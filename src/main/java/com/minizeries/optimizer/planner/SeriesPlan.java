package com.minizeries.optimizer.planner;

import com.minizeries.common.Constants;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表函数的执行计划
 *
 * 由 {@link SeriesPlanner} 在查询准备阶段生成，执行阶段交给
 * {@link com.minizeries.executor.resolver.RangeResolver}。
 *
 * 组成:
 * - indexNumber: 标志位（目前只有 {@link Constants#FLAG_DESC}）
 * - indexString: 每个被消费的参数一个字母，字母表示参数对应的槽位
 * - usages: 与 IndexInfo 中约束一一对应的使用方式
 *
 * 计划不可变，只记录"第 N 个参数进入哪个槽位"，不包含任何参数值。
 *
 * @author Mini-Zeries
 */
@Value
public class SeriesPlan {

    int indexNumber;

    String indexString;

    double estimatedCost;

    boolean orderByConsumed;

    List<ConstraintUsage> usages;

    public SeriesPlan(int indexNumber, String indexString, double estimatedCost,
                      boolean orderByConsumed, List<ConstraintUsage> usages) {
        this.indexNumber = indexNumber;
        this.indexString = indexString;
        this.estimatedCost = estimatedCost;
        this.orderByConsumed = orderByConsumed;
        this.usages = Collections.unmodifiableList(new ArrayList<>(usages));
    }

    public boolean isDescending() {
        return (indexNumber & Constants.FLAG_DESC) != 0;
    }

    /**
     * 执行时需要提供的参数个数
     */
    public int getArgumentCount() {
        return indexString.length();
    }

    /**
     * 按参数顺序解码出槽位列表
     */
    public List<ConstraintSlot> getSlots() {
        List<ConstraintSlot> slots = new ArrayList<>(indexString.length());
        for (int i = 0; i < indexString.length(); i++) {
            slots.add(ConstraintSlot.fromCode(indexString.charAt(i)));
        }
        return slots;
    }

    /**
     * 某个约束在执行计划中的使用方式
     */
    @Value
    public static class ConstraintUsage {

        /**
         * 未使用的约束
         */
        public static final ConstraintUsage UNUSED = new ConstraintUsage(0, false);

        /**
         * 参数序号（从 1 开始，0 表示未消费）
         */
        int argvIndex;

        /**
         * 宿主是否可以省略对该约束的复查
         */
        boolean omit;

        public boolean isConsumed() {
            return argvIndex > 0;
        }
    }
}
