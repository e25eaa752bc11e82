package com.minizeries.executor;

import com.minizeries.executor.resolver.SeriesException;
import com.minizeries.parser.SQLParser;
import com.minizeries.parser.ast.SelectStatement;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询执行器端到端测试
 *
 * SQL → 解析 → 与表函数协商计划 → 算子树 → 结果
 *
 * @author Mini-Zeries
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class QueryExecutorTest {

    private QueryExecutor executor;
    private SQLParser parser;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor();
        parser = new SQLParser();
    }

    /**
     * 负步长和基准值作为表函数参数
     */
    @Test
    @Order(1)
    void testArgumentsAndBetween() throws Exception {
        List<Long> values = values("SELECT value FROM generate_zeries(-3, 10) WHERE value BETWEEN -9 AND 9");

        assertEquals(Arrays.asList(-8L, -5L, -2L, 1L, 4L, 7L), values);
    }

    /**
     * SELECT * 只输出 value 列
     */
    @Test
    @Order(2)
    void testSelectAllEquality() throws Exception {
        List<Map<String, Object>> rows = executor.execute("SELECT * FROM generate_zeries WHERE value = 5");

        assertEquals(1, rows.size());
        assertEquals(Collections.singletonMap("value", 5L), rows.get(0));
    }

    /**
     * 隐藏列 step / base 可以出现在结果中
     */
    @Test
    @Order(3)
    void testHiddenColumns() throws Exception {
        List<Map<String, Object>> rows = executor.execute(
                "SELECT value, step, base AS b FROM generate_zeries(3, 1) WHERE value BETWEEN 0 AND 10");

        assertEquals(4, rows.size());
        assertEquals(Arrays.asList("value", "step", "b"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals(1L, rows.get(0).get("value"));
        assertEquals(3L, rows.get(0).get("step"));
        assertEquals(1L, rows.get(0).get("b"));
        assertEquals(10L, rows.get(3).get("value"));

        printResults(rows);
    }

    /**
     * 在 WHERE 中直接约束隐藏列
     */
    @Test
    @Order(4)
    void testHiddenColumnsInWhere() throws Exception {
        assertEquals(Arrays.asList(1L, 4L, 7L),
                values("SELECT value FROM generate_zeries WHERE step = 3 AND base = 1 AND value >= 0 AND value < 10"));
    }

    /**
     * 矛盾的条件
     */
    @Test
    @Order(5)
    void testContradiction() throws Exception {
        assertTrue(executor.execute("SELECT value FROM generate_zeries(2) WHERE value > 10 AND value < 10").isEmpty());
    }

    /**
     * LIMIT / OFFSET 下推
     */
    @Test
    @Order(6)
    void testPaginationPushdown() throws Exception {
        String sql = "SELECT value FROM generate_zeries WHERE value BETWEEN 0 AND 10 LIMIT 2 OFFSET 2";

        PreparedQuery query = executor.prepare(parse(sql));
        assertTrue(query.isPaginationPushed());
        assertFalse(query.isLimitRequired());
        assertEquals("hgba", query.getPlan().getIndexString());

        assertEquals(Arrays.asList(2L, 3L), values(sql));
        assertEquals(Arrays.asList(2L, 3L), values("SELECT value FROM generate_zeries WHERE value BETWEEN 0 AND 10 LIMIT 2, 2"));
    }

    /**
     * ORDER BY value 由表函数消费
     */
    @Test
    @Order(7)
    void testOrderByConsumed() throws Exception {
        String sql = "SELECT value FROM generate_zeries(5) WHERE value BETWEEN 0 AND 30 ORDER BY value DESC LIMIT 3";

        PreparedQuery query = executor.prepare(parse(sql));
        assertFalse(query.isSortRequired());
        assertTrue(query.getPlan().isDescending());
        assertTrue(query.isPaginationPushed());

        assertEquals(Arrays.asList(30L, 25L, 20L), values(sql));
        assertEquals(Arrays.asList(3L, 2L, 1L),
                values("SELECT value FROM generate_zeries WHERE rowid BETWEEN 1 AND 3 ORDER BY rowid DESC"));
    }

    /**
     * 无界序列在两端取值
     */
    @Test
    @Order(8)
    void testUnboundedWithLimit() throws Exception {
        assertEquals(Arrays.asList(Long.MIN_VALUE, Long.MIN_VALUE + 1, Long.MIN_VALUE + 2),
                values("SELECT value FROM generate_zeries LIMIT 3"));
        assertEquals(Arrays.asList(Long.MAX_VALUE, Long.MAX_VALUE - 1),
                values("SELECT value FROM generate_zeries ORDER BY value DESC LIMIT 2"));
    }

    /**
     * 残余条件由宿主过滤，分页不下推
     */
    @Test
    @Order(9)
    void testResidualFilter() throws Exception {
        String sql = "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 10 AND value != 2 LIMIT 3";

        PreparedQuery query = executor.prepare(parse(sql));
        assertEquals(1, query.getResiduals().size());
        assertFalse(query.isPaginationPushed());
        assertTrue(query.isLimitRequired());

        assertEquals(Arrays.asList(1L, 3L, 4L), values(sql));
        assertEquals(Arrays.asList(2L, 9L),
                values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 10 AND (value = 2 OR value = 9)"));
        assertEquals(Arrays.asList(1L, 4L),
                values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 5 AND value NOT IN (2, 3, 5)"));
        assertEquals(Arrays.asList(1L, 5L),
                values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 5 AND value NOT BETWEEN 2 AND 4"));
    }

    /**
     * 无界扫描加残余条件时按需拉取
     */
    @Test
    @Order(10)
    void testLazyResidualScan() throws Exception {
        assertEquals(Arrays.asList(0L, 2L, 3L),
                values("SELECT value FROM generate_zeries WHERE value >= 0 AND value <> 1 LIMIT 3"));
    }

    /**
     * IS NULL / IS NOT NULL 由宿主判断
     */
    @Test
    @Order(11)
    void testNullPredicates() throws Exception {
        assertTrue(values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 3 AND value IS NULL").isEmpty());
        assertEquals(Arrays.asList(1L, 2L, 3L),
                values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 3 AND value IS NOT NULL"));
        assertEquals(Collections.singletonList(2L),
                values("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 3 AND value IS 2"));
    }

    /**
     * 浮点数边界
     */
    @Test
    @Order(12)
    void testFloatBounds() throws Exception {
        assertEquals(Arrays.asList(2L, 3L, 4L),
                values("SELECT value FROM generate_zeries WHERE value > 1.5 AND value <= 4.5"));
        assertTrue(values("SELECT value FROM generate_zeries WHERE value = 2.5").isEmpty());
    }

    /**
     * 宿主排序（ORDER BY 隐藏列）
     */
    @Test
    @Order(13)
    void testHostSort() throws Exception {
        String sql = "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 4 ORDER BY step";

        PreparedQuery query = executor.prepare(parse(sql));
        assertTrue(query.isSortRequired());
        assertEquals(Arrays.asList(1L, 2L, 3L, 4L), values(sql));

        // 后面的 value 排序项仍然决定扫描方向
        sql = "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 4 ORDER BY step, value DESC";
        query = executor.prepare(parse(sql));
        assertFalse(query.isSortRequired());
        assertEquals(Arrays.asList(4L, 3L, 2L, 1L), values(sql));
    }

    /**
     * rowid 与 value 相同
     */
    @Test
    @Order(14)
    void testRowid() throws Exception {
        List<Map<String, Object>> rows = executor.execute(
                "SELECT rowid, value AS v FROM generate_zeries WHERE rowid BETWEEN 1 AND 2");

        assertEquals(2, rows.size());
        assertEquals(1L, rows.get(0).get("rowid"));
        assertEquals(1L, rows.get(0).get("v"));
        assertEquals(2L, rows.get(1).get("rowid"));
    }

    /**
     * 致命参数错误
     */
    @Test
    @Order(15)
    void testConfigurationErrors() {
        SeriesException e = assertThrows(SeriesException.class,
                () -> executor.execute("SELECT value FROM generate_zeries(0) WHERE value BETWEEN 1 AND 5"));
        assertEquals(SeriesException.ErrorKind.STEP_OUT_OF_RANGE, e.getKind());

        e = assertThrows(SeriesException.class,
                () -> executor.execute("SELECT value FROM generate_zeries('abc') WHERE value BETWEEN 1 AND 5"));
        assertEquals(SeriesException.ErrorKind.TYPE_MISMATCH, e.getKind());
        assertEquals("step parameter has wrong type", e.getMessage());

        e = assertThrows(SeriesException.class,
                () -> executor.execute("SELECT value FROM generate_zeries LIMIT 'abc'"));
        assertEquals("limit", e.getSlot());
    }

    /**
     * 查询本身的错误
     */
    @Test
    @Order(16)
    void testQueryErrors() {
        assertThrows(IllegalArgumentException.class,
                () -> executor.execute("SELECT value FROM generate_zeries(1, 2, 3)"));
        assertThrows(IllegalArgumentException.class,
                () -> executor.execute("SELECT value FROM generate_series(1, 2)"));
        assertThrows(IllegalArgumentException.class,
                () -> executor.execute("SELECT price FROM generate_zeries LIMIT 1"));
        assertThrows(IllegalArgumentException.class,
                () -> executor.execute("SELECT value FROM generate_zeries WHERE price = 1 LIMIT 1"));
        assertThrows(SQLParser.SQLParseException.class,
                () -> executor.execute("SELECT value FROM"));
    }

    /**
     * 算子树的形状
     */
    @Test
    @Order(17)
    void testExecutionPlanShape() throws Exception {
        PreparedQuery query = executor.prepare(parse(
                "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 9 AND value != 3 ORDER BY step LIMIT 2"));

        Operator plan = executor.buildExecutionPlan(query);

        assertTrue(plan.getOperatorType().startsWith("Project"));
        assertEquals(Arrays.asList(1L, 2L), values(
                "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 9 AND value != 3 ORDER BY step LIMIT 2"));
    }

    /**
     * 宿主 LIMIT / OFFSET 接受 long 范围内的整数浮点数
     */
    @Test
    @Order(18)
    void testHostLimitFloatLiterals() throws Exception {
        String residual = "SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 5 AND value != 2 ";
        assertTrue(executor.prepare(parse(residual + "LIMIT 1")).isLimitRequired());

        // -2^63 是最小的 long，按负数 LIMIT 处理为不限制
        assertEquals(Arrays.asList(1L, 3L, 4L, 5L), values(residual + "LIMIT -9223372036854775808.0"));
        assertEquals(Arrays.asList(3L, 4L), values(residual + "LIMIT 2.0 OFFSET 1.0"));

        assertThrows(IllegalArgumentException.class,
                () -> executor.execute(residual + "LIMIT 9223372036854775808.0"));
        assertThrows(IllegalArgumentException.class,
                () -> executor.execute(residual + "LIMIT 1.5"));
    }

    private SelectStatement parse(String sql) throws SQLParser.SQLParseException {
        return (SelectStatement) parser.parse(sql);
    }

    private List<Long> values(String sql) throws Exception {
        return executor.execute(sql).stream()
                .map(row -> (Long) row.get("value"))
                .collect(Collectors.toList());
    }

    private void printResults(List<Map<String, Object>> results) {
        for (Map<String, Object> row : results) {
            System.out.println(row);
        }
    }
}
