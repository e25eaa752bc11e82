package com.minizeries.optimizer.explain;

import com.minizeries.executor.PreparedQuery;
import com.minizeries.optimizer.planner.ConstraintSlot;
import com.minizeries.optimizer.planner.IndexInfo;
import com.minizeries.optimizer.planner.SeriesPlan;
import com.minizeries.parser.ast.Expression;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * EXPLAIN 生成器
 *
 * 根据准备好的查询生成执行计划说明
 *
 * @author Mini-Zeries
 */
@Slf4j
public class ExplainGenerator {

    /**
     * 为准备好的查询生成 EXPLAIN 计划
     *
     * @param query 准备好的查询
     * @return EXPLAIN 计划
     */
    public ExplainPlan generateExplain(PreparedQuery query) {
        SeriesPlan seriesPlan = query.getPlan();
        log.info("Generating EXPLAIN for table function: {}", query.getStatement().getTableName());

        ExplainPlan plan = new ExplainPlan();
        plan.setTable(query.getStatement().getTableName());
        plan.setIndexNumber(seriesPlan.getIndexNumber());
        plan.setIndexString(seriesPlan.getIndexString());
        plan.setCost(seriesPlan.getEstimatedCost());

        // 被消费的约束
        List<IndexInfo.IndexConstraint> constraints = query.getIndexInfo().getConstraints();
        List<SeriesPlan.ConstraintUsage> usages = seriesPlan.getUsages();
        for (int i = 0; i < constraints.size(); i++) {
            if (usages.get(i).isConsumed()) {
                plan.addConsumed(constraints.get(i).toString());
            }
        }

        // 访问类型
        List<ConstraintSlot> slots = seriesPlan.getSlots();
        if (slots.contains(ConstraintSlot.EQ)) {
            plan.setType("const");
        } else if (slots.stream().anyMatch(s -> s.isUpperBound() || s.isLowerBound())) {
            plan.setType("range");
        } else {
            plan.setType("ALL");
        }

        if (!query.getResiduals().isEmpty()) {
            plan.setFilter(query.getResiduals().stream()
                    .map(Expression::toString)
                    .collect(Collectors.joining(" AND ")));
            plan.addExtra("Using where");
        }

        if (query.isSortRequired()) {
            plan.addExtra("Using filesort");
        }

        if (seriesPlan.isDescending()) {
            plan.addExtra("Backward scan");
        }

        if (query.isPaginationPushed()) {
            plan.addExtra("Using limit pushdown");
        }

        log.info("EXPLAIN plan generated: type={}, index={}:{}, cost={}",
                plan.getType(), plan.getIndexNumber(), plan.getIndexString(), plan.getCost());

        return plan;
    }

    /**
     * 格式化并打印 EXPLAIN 结果
     *
     * @param plan EXPLAIN 计划
     */
    public void printExplain(ExplainPlan plan) {
        System.out.println("EXPLAIN Result:");
        System.out.println(ExplainPlan.tableSeparator());
        System.out.println(ExplainPlan.tableHeader());
        System.out.println(ExplainPlan.tableSeparator());
        System.out.println(plan.formatTable());
        System.out.println(ExplainPlan.tableSeparator());
        System.out.println();
        System.out.println("Detailed Info:");
        System.out.println(plan.format());
    }
}
