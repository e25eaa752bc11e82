package com.minizeries.executor;

import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.module.SeriesModule;
import com.minizeries.optimizer.planner.IndexInfo;
import com.minizeries.optimizer.planner.SeriesPlan;
import com.minizeries.parser.ast.Expression;
import com.minizeries.parser.ast.SelectStatement;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 准备好的查询
 *
 * 查询准备阶段的产物: 表函数的执行计划、按参数顺序排列的参数值，
 * 以及需要宿主自己处理的部分（残余条件、排序、分页）。
 *
 * @author Mini-Zeries
 */
@Getter
public class PreparedQuery {

    private final SelectStatement statement;

    private final SeriesModule module;

    private final IndexInfo indexInfo;

    private final SeriesPlan plan;

    /**
     * 表函数参数，顺序与 plan 的索引字符串一致
     */
    private final List<SqlValue> arguments;

    /**
     * 表函数没有消费、需要宿主复查的条件
     */
    private final List<Expression> residuals;

    /**
     * LIMIT / OFFSET 是否已下推给表函数
     */
    private final boolean paginationPushed;

    public PreparedQuery(SelectStatement statement, SeriesModule module, IndexInfo indexInfo,
                         SeriesPlan plan, List<SqlValue> arguments, List<Expression> residuals,
                         boolean paginationPushed) {
        this.statement = statement;
        this.module = module;
        this.indexInfo = indexInfo;
        this.plan = plan;
        this.arguments = Collections.unmodifiableList(arguments);
        this.residuals = Collections.unmodifiableList(residuals);
        this.paginationPushed = paginationPushed;
    }

    /**
     * 宿主是否需要排序
     */
    public boolean isSortRequired() {
        return !statement.getOrderByElements().isEmpty() && !plan.isOrderByConsumed();
    }

    /**
     * 宿主是否需要自己做分页
     */
    public boolean isLimitRequired() {
        return statement.getLimit() != null && !paginationPushed;
    }
}
