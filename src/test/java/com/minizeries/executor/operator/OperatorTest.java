package com.minizeries.executor.operator;

import com.minizeries.executor.Operator;
import com.minizeries.executor.cursor.SeriesCursor;
import com.minizeries.executor.resolver.SeriesException;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.optimizer.planner.SeriesPlan;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 火山模型算子测试
 *
 * @author Mini-Zeries
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class OperatorTest {

    /**
     * 序列扫描输出 value / step / base
     */
    @Test
    @Order(1)
    void testSeriesScan() throws Exception {
        SeriesScanOperator scan = scan(0, "cdhg", 2L, 1L, 0L, 6L);

        List<Map<String, Object>> rows = drain(scan);

        assertEquals(3, rows.size());
        assertEquals(1L, rows.get(0).get("value"));
        assertEquals(2L, rows.get(0).get("step"));
        assertEquals(1L, rows.get(0).get("base"));
        assertEquals(5L, rows.get(2).get("value"));
        assertEquals(3, scan.getScannedRows());
        assertEquals("SeriesScan(0:cdhg)", scan.getOperatorType());
    }

    /**
     * 未 open 的扫描算子不能读取
     */
    @Test
    @Order(2)
    void testScanNotOpened() {
        SeriesScanOperator scan = scan(0, "");
        assertThrows(IllegalStateException.class, scan::next);
    }

    /**
     * 参数错误在 open() 时抛出
     */
    @Test
    @Order(3)
    void testScanOpenFailsOnBadStep() {
        SeriesScanOperator scan = scan(0, "c", 0L);
        SeriesException e = assertThrows(SeriesException.class, scan::open);
        assertEquals(SeriesException.ErrorKind.STEP_OUT_OF_RANGE, e.getKind());
    }

    /**
     * 过滤、排序、分页、投影的组合
     */
    @Test
    @Order(4)
    void testPipeline() throws Exception {
        Operator plan = scan(0, "hg", 1L, 10L);
        plan = new FilterOperator(plan, row -> (Long) row.get("value") % 3 != 0, "value % 3 != 0");
        plan = new SortOperator(plan, Collections.singletonList("value"), Collections.singletonList(true));
        plan = new LimitOperator(plan, 3, 1);
        plan = new ProjectOperator(plan, Collections.singletonList("value"), Collections.singletonList("v"));

        List<Map<String, Object>> rows = drain(plan);

        // 10 8 7 5 4 2 1 → 跳过 10，取 3 行
        assertEquals(3, rows.size());
        assertEquals(8L, rows.get(0).get("v"));
        assertEquals(7L, rows.get(1).get("v"));
        assertEquals(5L, rows.get(2).get("v"));
        assertEquals(Collections.singleton("v"), rows.get(0).keySet());
    }

    /**
     * 负数 LIMIT 不限制行数
     */
    @Test
    @Order(5)
    void testNegativeLimit() throws Exception {
        LimitOperator limit = new LimitOperator(scan(0, "hg", 1L, 5L), -1, 2);

        List<Map<String, Object>> rows = drain(limit);

        assertEquals(3, rows.size());
        assertEquals(3L, rows.get(0).get("value"));
        assertEquals(3, limit.getReturnedRows());
    }

    /**
     * 过滤算子的计数
     */
    @Test
    @Order(6)
    void testFilterCounters() throws Exception {
        FilterOperator filter = new FilterOperator(scan(0, "hg", 1L, 10L),
                row -> (Long) row.get("value") > 7, "value > 7");

        assertEquals(3, drain(filter).size());
        assertEquals(10, filter.getInputRows());
        assertEquals(3, filter.getOutputRows());
    }

    /**
     * 宿主排序: 多个排序键，NULL 在升序中排在最前
     */
    @Test
    @Order(7)
    void testSortNullsAndKeys() throws Exception {
        List<Map<String, Object>> input = Arrays.asList(
                row(3L, 2L), row(null, 1L), row(1L, 2L), row(3L, null), row(1L, 1L));

        List<Map<String, Object>> asc = drain(new SortOperator(new RowsOperator(input),
                Arrays.asList("value", "step"), Arrays.asList(false, false)));
        assertEquals(Arrays.asList(row(null, 1L), row(1L, 1L), row(1L, 2L), row(3L, null), row(3L, 2L)), asc);

        List<Map<String, Object>> mixed = drain(new SortOperator(new RowsOperator(input),
                Arrays.asList("value", "step"), Arrays.asList(true, false)));
        assertEquals(Arrays.asList(row(3L, null), row(3L, 2L), row(1L, 1L), row(1L, 2L), row(null, 1L)), mixed);
    }

    /**
     * 相等的排序键保持输入顺序
     */
    @Test
    @Order(8)
    void testSortIsStable() throws Exception {
        List<Map<String, Object>> input = Arrays.asList(
                row(2L, 10L), row(1L, 20L), row(2L, 30L), row(1L, 40L));

        List<Map<String, Object>> rows = drain(new SortOperator(new RowsOperator(input),
                Collections.singletonList("value"), Collections.singletonList(false)));

        assertEquals(Arrays.asList(20L, 40L, 10L, 30L),
                Arrays.asList(rows.get(0).get("step"), rows.get(1).get("step"),
                        rows.get(2).get("step"), rows.get(3).get("step")));
        assertThrows(IllegalArgumentException.class, () -> new SortOperator(new RowsOperator(input),
                Collections.singletonList("value"), Collections.emptyList()));
    }

    private static Map<String, Object> row(Long value, Long step) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("value", value);
        row.put("step", step);
        return row;
    }

    /**
     * 从固定的行列表读取数据
     */
    private static class RowsOperator implements Operator {

        private final List<Map<String, Object>> rows;

        private Iterator<Map<String, Object>> iterator;

        RowsOperator(List<Map<String, Object>> rows) {
            this.rows = rows;
        }

        @Override
        public void open() {
            iterator = rows.iterator();
        }

        @Override
        public Map<String, Object> next() {
            return iterator.hasNext() ? iterator.next() : null;
        }

        @Override
        public void close() {
            iterator = null;
        }
    }

    private SeriesScanOperator scan(int indexNumber, String indexString, Object... args) {
        List<SeriesPlan.ConstraintUsage> usages = new ArrayList<>();
        List<SqlValue> values = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            usages.add(new SeriesPlan.ConstraintUsage(i + 1, true));
            values.add(SqlValue.of(args[i]));
        }
        SeriesPlan plan = new SeriesPlan(indexNumber, indexString, 1.0, false, usages);
        return new SeriesScanOperator(new SeriesCursor(), plan, values);
    }

    private List<Map<String, Object>> drain(Operator operator) throws Exception {
        List<Map<String, Object>> rows = new ArrayList<>();
        operator.open();
        try {
            Map<String, Object> row;
            while ((row = operator.next()) != null) {
                rows.add(row);
            }
        } finally {
            operator.close();
        }
        return rows;
    }
}
