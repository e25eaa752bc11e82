package com.minizeries.optimizer.explain;

import com.minizeries.common.Constants;
import com.minizeries.executor.PreparedQuery;
import com.minizeries.executor.QueryExecutor;
import com.minizeries.parser.SQLParser;
import com.minizeries.parser.ast.SelectStatement;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EXPLAIN 测试
 *
 * @author Mini-Zeries
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ExplainGeneratorTest {

    private QueryExecutor executor;
    private SQLParser parser;
    private ExplainGenerator generator;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor();
        parser = new SQLParser();
        generator = new ExplainGenerator();
    }

    /**
     * 范围扫描 + 残余条件 + 降序
     */
    @Test
    @Order(1)
    void testRangeScan() throws Exception {
        ExplainPlan plan = explain("SELECT value FROM generate_zeries(2) "
                + "WHERE value BETWEEN 0 AND 10 AND value != 3 ORDER BY value DESC");

        assertEquals("generate_zeries", plan.getTable());
        assertEquals("range", plan.getType());
        assertEquals(Constants.FLAG_DESC, plan.getIndexNumber());
        assertEquals("chg", plan.getIndexString());
        assertEquals(Arrays.asList("step = ?", "value >= ?", "value <= ?"), plan.getConsumed());
        assertEquals("(value != 3)", plan.getFilter());
        assertEquals(Arrays.asList("Using where", "Backward scan"), plan.getExtra());
        assertEquals(Constants.UNBOUNDED_COST / 4, plan.getCost());

        generator.printExplain(plan);
    }

    /**
     * 等值查询
     */
    @Test
    @Order(2)
    void testConstScan() throws Exception {
        ExplainPlan plan = explain("SELECT value FROM generate_zeries WHERE value = 7");

        assertEquals("const", plan.getType());
        assertEquals("e", plan.getIndexString());
        assertEquals(1.0, plan.getCost());
        assertTrue(plan.getExtra().isEmpty());
        assertTrue(plan.format().contains("index: 0:e"));
    }

    /**
     * 全序列扫描 + 宿主排序 + 分页下推
     */
    @Test
    @Order(3)
    void testFullScan() throws Exception {
        ExplainPlan sorted = explain("SELECT value FROM generate_zeries WHERE value BETWEEN 1 AND 3 ORDER BY base");
        assertEquals(Collections.singletonList("Using filesort"), sorted.getExtra());

        ExplainPlan paged = explain("SELECT value FROM generate_zeries LIMIT 10 OFFSET 5");
        assertEquals("ALL", paged.getType());
        assertEquals("ba", paged.getIndexString());
        assertEquals(Arrays.asList("LIMIT", "OFFSET"), paged.getConsumed());
        assertEquals(Collections.singletonList("Using limit pushdown"), paged.getExtra());
        assertNull(paged.getFilter());
    }

    /**
     * EXPLAIN 语句返回一行执行计划，不执行查询
     */
    @Test
    @Order(4)
    void testExplainStatement() throws Exception {
        List<Map<String, Object>> rows = executor.execute(
                "EXPLAIN SELECT value FROM generate_zeries WHERE value = 7");

        assertEquals(1, rows.size());
        Map<String, Object> row = rows.get(0);
        assertEquals(Arrays.asList("table", "type", "index", "consumed", "filter", "cost", "Extra"),
                new ArrayList<>(row.keySet()));
        assertEquals("generate_zeries", row.get("table"));
        assertEquals("const", row.get("type"));
        assertEquals("0:e", row.get("index"));
        assertEquals("value = ?", row.get("consumed"));
        assertNull(row.get("filter"));
        assertEquals(1.0, row.get("cost"));
        assertNull(row.get("Extra"));
    }

    /**
     * explain() 与 EXPLAIN 语句给出相同的计划
     */
    @Test
    @Order(5)
    void testExplainStatementMatchesPlan() throws Exception {
        String select = "select value from generate_zeries(5) where value > 10 and value != 20 "
                + "order by value desc limit 3";
        ExplainPlan plan = executor.explain((SelectStatement) parser.parse(select));
        Map<String, Object> row = executor.execute("explain " + select).get(0);

        assertEquals(plan.toRow(), row);
        assertEquals("range", row.get("type"));
        assertEquals("Using where; Backward scan", row.get("Extra"));
    }

    private ExplainPlan explain(String sql) throws Exception {
        PreparedQuery query = executor.prepare((SelectStatement) parser.parse(sql));
        return generator.generateExplain(query);
    }
}
