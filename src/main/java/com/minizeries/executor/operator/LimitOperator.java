package com.minizeries.executor.operator;

import com.minizeries.executor.Operator;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 分页算子
 *
 * 在表函数无法消费 LIMIT / OFFSET 时由宿主执行:
 * 1. 跳过前 offset 行
 * 2. 返回之后的 limit 行（limit 为负数表示不限制）
 * 3. 达到限制后不再拉取子算子
 *
 * @author Mini-Zeries
 */
@Slf4j
public class LimitOperator implements Operator {

    /**
     * 子算子（数据源）
     */
    private final Operator child;

    /**
     * 限制的行数，负数表示不限制
     */
    private final long limit;

    /**
     * 跳过的行数
     */
    private final long offset;

    /**
     * 已返回的行数
     */
    private long returnedRows = 0;

    private boolean skipped = false;

    public LimitOperator(Operator child, long limit) {
        this(child, limit, 0L);
    }

    public LimitOperator(Operator child, long limit, long offset) {
        this.child = child;
        this.limit = limit;
        this.offset = Math.max(offset, 0L);
    }

    @Override
    public void open() throws Exception {
        log.debug("Opening Limit: limit={}, offset={}", limit, offset);
        child.open();
        returnedRows = 0;
        skipped = false;
    }

    @Override
    public Map<String, Object> next() throws Exception {
        // 已达到限制，停止返回数据
        if (limit >= 0 && returnedRows >= limit) {
            log.debug("Limit reached: {} rows", returnedRows);
            return null;
        }

        if (!skipped) {
            skipped = true;
            for (long i = 0; i < offset; i++) {
                if (child.next() == null) {
                    return null;
                }
            }
        }

        Map<String, Object> row = child.next();

        if (row != null) {
            returnedRows++;
            log.trace("Limit returned row {}/{}", returnedRows, limit);
        }

        return row;
    }

    @Override
    public void close() throws Exception {
        log.debug("Closing Limit, returned {} rows", returnedRows);
        child.close();
    }

    @Override
    public String getOperatorType() {
        if (offset > 0) {
            return "Limit(" + limit + " OFFSET " + offset + ")";
        }
        return "Limit(" + limit + ")";
    }

    public long getReturnedRows() {
        return returnedRows;
    }
}
