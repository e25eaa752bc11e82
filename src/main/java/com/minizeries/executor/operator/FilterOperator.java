package com.minizeries.executor.operator;

import com.minizeries.executor.Operator;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Predicate;

/**
 * 过滤算子
 *
 * 对表函数没有消费的约束（残余条件）做复查:
 * 1. 从子算子获取数据
 * 2. 对每行数据应用过滤条件
 * 3. 只返回满足条件的行
 *
 * @author Mini-Zeries
 */
@Slf4j
public class FilterOperator implements Operator {

    /**
     * 子算子（数据源）
     */
    private final Operator child;

    /**
     * 过滤条件
     */
    private final Predicate<Map<String, Object>> predicate;

    /**
     * 过滤描述（用于日志和 EXPLAIN）
     */
    private final String filterDescription;

    /**
     * 统计信息
     */
    private long inputRows = 0;
    private long outputRows = 0;

    public FilterOperator(Operator child, Predicate<Map<String, Object>> predicate,
                          String filterDescription) {
        this.child = child;
        this.predicate = predicate;
        this.filterDescription = filterDescription;
    }

    @Override
    public void open() throws Exception {
        log.debug("Opening Filter: {}", filterDescription);
        child.open();
        inputRows = 0;
        outputRows = 0;
    }

    @Override
    public Map<String, Object> next() throws Exception {
        // 循环从子算子获取数据，直到找到满足条件的行
        while (true) {
            Map<String, Object> row = child.next();

            if (row == null) {
                log.debug("Filter finished: input={}, output={}", inputRows, outputRows);
                return null;
            }

            inputRows++;
            if (predicate.test(row)) {
                outputRows++;
                return row;
            }
            log.trace("Filter rejected row: {}", row);
        }
    }

    @Override
    public void close() throws Exception {
        log.debug("Closing Filter");
        child.close();
    }

    @Override
    public String getOperatorType() {
        return "Filter(" + filterDescription + ")";
    }

    public long getInputRows() {
        return inputRows;
    }

    public long getOutputRows() {
        return outputRows;
    }
}
