package com.minizeries.executor.operator;

import com.minizeries.executor.Operator;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 投影算子
 *
 * 选择需要的列（SELECT 子句），支持 AS 别名。
 * 输出列的顺序与 SELECT 列表一致。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class ProjectOperator implements Operator {

    /**
     * 子算子（数据源）
     */
    private final Operator child;

    /**
     * 要读取的源列名
     */
    private final List<String> sourceColumns;

    /**
     * 输出列名，与 sourceColumns 一一对应（别名或原列名）
     */
    private final List<String> outputColumns;

    private long processedRows = 0;

    public ProjectOperator(Operator child, List<String> sourceColumns) {
        this(child, sourceColumns, sourceColumns);
    }

    public ProjectOperator(Operator child, List<String> sourceColumns,
                           List<String> outputColumns) {
        if (sourceColumns.size() != outputColumns.size()) {
            throw new IllegalArgumentException("Column count mismatch: "
                    + sourceColumns + " vs " + outputColumns);
        }
        this.child = child;
        this.sourceColumns = sourceColumns;
        this.outputColumns = outputColumns;
    }

    @Override
    public void open() throws Exception {
        log.debug("Opening Project: columns={}", outputColumns);
        child.open();
        processedRows = 0;
    }

    @Override
    public Map<String, Object> next() throws Exception {
        Map<String, Object> row = child.next();

        if (row == null) {
            log.debug("Project finished, processed {} rows", processedRows);
            return null;
        }

        processedRows++;

        Map<String, Object> projectedRow = new LinkedHashMap<>();
        for (int i = 0; i < sourceColumns.size(); i++) {
            String column = sourceColumns.get(i);
            if (row.containsKey(column)) {
                projectedRow.put(outputColumns.get(i), row.get(column));
            } else {
                log.warn("Column '{}' not found in row: {}", column, row.keySet());
            }
        }

        log.trace("Project row {}: {} -> {}", processedRows, row, projectedRow);
        return projectedRow;
    }

    @Override
    public void close() throws Exception {
        log.debug("Closing Project");
        child.close();
    }

    @Override
    public String getOperatorType() {
        return "Project(" + outputColumns + ")";
    }
}
