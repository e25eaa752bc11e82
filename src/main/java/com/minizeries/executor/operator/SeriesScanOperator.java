package com.minizeries.executor.operator;

import com.minizeries.common.Constants;
import com.minizeries.executor.Operator;
import com.minizeries.executor.cursor.SeriesCursor;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.optimizer.planner.SeriesPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 序列扫描算子
 *
 * 火山模型中的叶子节点，数据来自 generate_zeries 表函数:
 * 1. open(): 用执行计划和参数初始化游标（解析范围）
 * 2. next(): 输出当前行 (value, step, base)，然后推进游标
 * 3. close(): 游标回到结束状态
 *
 * 每行同时输出本次生效的 step 和 base，宿主可以把它们当作普通列查询。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SeriesScanOperator implements Operator {

    private final SeriesCursor cursor;

    private final SeriesPlan plan;

    /**
     * 参数值，顺序与 plan 的索引字符串一致
     */
    private final List<SqlValue> args;

    /**
     * 已输出的行数
     */
    private long scannedRows = 0;

    private boolean opened = false;

    public SeriesScanOperator(SeriesCursor cursor, SeriesPlan plan, List<SqlValue> args) {
        this.cursor = cursor;
        this.plan = plan;
        this.args = new ArrayList<>(args);
    }

    @Override
    public void open() throws Exception {
        log.debug("Opening SeriesScan: indexNumber={}, indexString='{}', args={}",
                plan.getIndexNumber(), plan.getIndexString(), args);
        cursor.filter(plan, args);
        scannedRows = 0;
        opened = true;
    }

    @Override
    public Map<String, Object> next() throws Exception {
        if (!opened) {
            throw new IllegalStateException("Operator not opened");
        }
        if (cursor.isEof()) {
            return null;
        }

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(Constants.COLUMN_VALUE, cursor.column(Column.VALUE));
        row.put(Constants.COLUMN_STEP, cursor.column(Column.STEP));
        row.put(Constants.COLUMN_BASE, cursor.column(Column.BASE));
        cursor.next();

        scannedRows++;
        log.trace("SeriesScan returned row {}: {}", scannedRows, row);
        return row;
    }

    @Override
    public void close() throws Exception {
        log.debug("Closing SeriesScan, total scanned: {} rows", scannedRows);
        opened = false;
    }

    @Override
    public String getOperatorType() {
        String type = "SeriesScan(" + plan.getIndexNumber() + ":" + plan.getIndexString() + ")";
        return plan.isDescending() ? type + " DESC" : type;
    }

    public long getScannedRows() {
        return scannedRows;
    }
}
