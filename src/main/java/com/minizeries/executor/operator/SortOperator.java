package com.minizeries.executor.operator;

import com.minizeries.executor.Operator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 宿主排序算子
 *
 * 执行计划没有消费 ORDER BY 时使用。open() 物化子算子的全部行，
 * 按排序键稳定排序后逐行返回。
 *
 * 行中的 value / step / base 都是 Long 或 NULL。升序时 NULL 在前，
 * 降序时整体反转，NULL 在后。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SortOperator implements Operator {

    private static final Comparator<Long> NULLS_FIRST = Comparator.nullsFirst(Long::compare);

    private final Operator child;

    private final List<String> orderByColumns;

    private final Comparator<Map<String, Object>> comparator;

    private Iterator<Map<String, Object>> iterator;

    /**
     * @param orderByColumns 排序键（行中的列名）
     * @param descending     与 orderByColumns 一一对应
     */
    public SortOperator(Operator child, List<String> orderByColumns, List<Boolean> descending) {
        if (orderByColumns.isEmpty() || orderByColumns.size() != descending.size()) {
            throw new IllegalArgumentException("Sort keys and directions do not match: "
                    + orderByColumns + " / " + descending);
        }
        this.child = child;
        this.orderByColumns = orderByColumns;

        Comparator<Map<String, Object>> chain = null;
        for (int i = 0; i < orderByColumns.size(); i++) {
            Comparator<Map<String, Object>> key = byColumn(orderByColumns.get(i));
            if (descending.get(i)) {
                key = key.reversed();
            }
            chain = chain == null ? key : chain.thenComparing(key);
        }
        this.comparator = chain;
    }

    private static Comparator<Map<String, Object>> byColumn(String column) {
        return Comparator.comparing(row -> (Long) row.get(column), NULLS_FIRST);
    }

    @Override
    public void open() throws Exception {
        child.open();

        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> row;
        while ((row = child.next()) != null) {
            rows.add(row);
        }
        rows.sort(comparator);

        log.debug("Sorted {} rows by {}", rows.size(), orderByColumns);
        iterator = rows.iterator();
    }

    @Override
    public Map<String, Object> next() throws Exception {
        if (iterator == null) {
            throw new IllegalStateException("Operator not opened");
        }
        return iterator.hasNext() ? iterator.next() : null;
    }

    @Override
    public void close() throws Exception {
        child.close();
        iterator = null;
    }

    @Override
    public String getOperatorType() {
        return "Sort(" + orderByColumns + ")";
    }
}
