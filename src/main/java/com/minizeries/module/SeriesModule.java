package com.minizeries.module;

import com.minizeries.common.Constants;
import com.minizeries.executor.cursor.SeriesCursor;
import com.minizeries.executor.resolver.RangeResolver;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.optimizer.planner.IndexInfo;
import com.minizeries.optimizer.planner.SeriesPlan;
import com.minizeries.optimizer.planner.SeriesPlanner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * generate_zeries 表函数模块
 *
 * 一个结果列 value 和两个可选参数 step、base（隐藏列）。
 * 输出序列是下面这个无限序列的一个子区间:
 * <pre>
 *     ..., base - step*2, base - step, base, base + step, base + step*2, ...
 * </pre>
 * 步长的符号被忽略，绝对值必须在 [1, 2^63 - 1]。
 * 没有 start / stop 参数，用 value 上的约束代替，
 * 需要倒序时使用 ORDER BY value DESC。
 *
 * 示例:
 * <pre>
 * SELECT value FROM generate_zeries(-3, 10) WHERE value BETWEEN -9 AND 9;
 * -- -8, -5, -2, 1, 4, 7
 * </pre>
 *
 * 模块本身无状态，可以被多个查询共享；每次扫描使用独立的游标。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SeriesModule {

    /**
     * 表结构声明
     */
    public static final String SCHEMA =
            "create table generate_zeries(\n"
            + "    value integer,\n"
            + "    step integer hidden,\n"
            + "    base integer hidden\n"
            + ");\n";

    private final SeriesPlanner planner;

    private final RangeResolver resolver;

    public SeriesModule() {
        this(new SeriesPlanner(), new RangeResolver());
    }

    public SeriesModule(SeriesPlanner planner, RangeResolver resolver) {
        this.planner = planner;
        this.resolver = resolver;
    }

    public String getName() {
        return Constants.MODULE_NAME;
    }

    /**
     * 按声明顺序排列的列（不含 rowid）
     */
    public List<Column> getColumns() {
        List<Column> columns = new ArrayList<>();
        for (Column column : Column.values()) {
            if (column.getIndex() >= 0) {
                columns.add(column);
            }
        }
        return columns;
    }

    /**
     * 表函数参数依次对应的隐藏列
     */
    public List<Column> getParameterColumns() {
        List<Column> parameters = new ArrayList<>();
        for (Column column : getColumns()) {
            if (column.isHidden()) {
                parameters.add(column);
            }
        }
        return parameters;
    }

    /**
     * 查询准备阶段: 选择执行计划
     */
    public SeriesPlan bestIndex(IndexInfo info) {
        log.debug("bestIndex on {}: constraints={}, orderBy={}",
                getName(), info.getConstraints(), info.getOrderBy());
        return planner.bestIndex(info);
    }

    /**
     * 打开一个新的游标
     */
    public SeriesCursor openCursor() {
        return new SeriesCursor(resolver);
    }
}
