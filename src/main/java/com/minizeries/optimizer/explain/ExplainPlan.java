package com.minizeries.optimizer.explain;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EXPLAIN 执行计划
 *
 * 展示表函数与宿主之间的分工: 哪些条件由表函数处理，哪些留给宿主。
 *
 * @author Mini-Zeries
 */
@Data
public class ExplainPlan {

    /**
     * 表函数名
     */
    private String table;

    /**
     * 访问类型
     * - const: value 等值，最多一行
     * - range: value 有上界或下界
     * - ALL: 没有 value 约束，按 step / base 全序列扫描
     */
    private String type;

    /**
     * 标志位（bit 0 表示降序）
     */
    private int indexNumber;

    /**
     * 槽位编码
     */
    private String indexString;

    /**
     * 表函数消费的约束
     */
    private List<String> consumed;

    /**
     * 宿主复查的残余条件
     */
    private String filter;

    /**
     * 额外信息
     * - Using where: 宿主逐行过滤
     * - Using filesort: 宿主排序
     * - Backward scan: 表函数降序输出
     * - Using limit pushdown: LIMIT / OFFSET 由表函数处理
     */
    private List<String> extra;

    /**
     * 估算的查询成本
     */
    private Double cost;

    public ExplainPlan() {
        this.consumed = new ArrayList<>();
        this.extra = new ArrayList<>();
    }

    public void addExtra(String info) {
        if (!extra.contains(info)) {
            extra.add(info);
        }
    }

    public void addConsumed(String constraint) {
        consumed.add(constraint);
    }

    /**
     * 格式化输出
     */
    public String format() {
        StringBuilder sb = new StringBuilder();

        sb.append(String.format("table: %s\n", table));
        sb.append(String.format("type: %s\n", type));
        sb.append(String.format("index: %d:%s\n", indexNumber, indexString));

        if (!consumed.isEmpty()) {
            sb.append(String.format("consumed: %s\n", String.join(", ", consumed)));
        }

        if (filter != null) {
            sb.append(String.format("filter: %s\n", filter));
        }

        if (!extra.isEmpty()) {
            sb.append(String.format("Extra: %s\n", String.join("; ", extra)));
        }

        if (cost != null) {
            sb.append(String.format("cost: %.1f\n", cost));
        }

        return sb.toString();
    }

    /**
     * 作为 EXPLAIN 语句的结果行
     *
     * 列顺序与 {@link #tableHeader()} 一致，另加 filter 列。
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("table", table);
        row.put("type", type);
        row.put("index", indexNumber + ":" + indexString);
        row.put("consumed", consumed.isEmpty() ? null : String.join(", ", consumed));
        row.put("filter", filter);
        row.put("cost", cost);
        row.put("Extra", extra.isEmpty() ? null : String.join("; ", extra));
        return row;
    }

    /**
     * 表格格式输出
     */
    public String formatTable() {
        return String.format("| %-15s | %-5s | %-12s | %-30s | %22.1f | %-40s |",
                table,
                type,
                indexNumber + ":" + indexString,
                consumed.isEmpty() ? "NULL" : String.join(", ", consumed),
                cost != null ? cost : 0.0,
                extra.isEmpty() ? "" : String.join("; ", extra));
    }

    /**
     * 表格表头
     */
    public static String tableHeader() {
        return String.format("| %-15s | %-5s | %-12s | %-30s | %22s | %-40s |",
                "table", "type", "index", "consumed", "cost", "Extra");
    }

    /**
     * 表格分隔线
     */
    public static String tableSeparator() {
        return "+-----------------+-------+--------------+--------------------------------+------------------------+------------------------------------------+";
    }

    @Override
    public String toString() {
        return format();
    }
}
