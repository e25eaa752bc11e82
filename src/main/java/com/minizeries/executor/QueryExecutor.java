package com.minizeries.executor;

import com.minizeries.common.Constants;
import com.minizeries.executor.operator.*;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.module.ModuleRegistry;
import com.minizeries.module.SeriesModule;
import com.minizeries.optimizer.explain.ExplainGenerator;
import com.minizeries.optimizer.explain.ExplainPlan;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.optimizer.planner.ConstraintOp;
import com.minizeries.optimizer.planner.IndexInfo;
import com.minizeries.optimizer.planner.SeriesPlan;
import com.minizeries.parser.SQLParser;
import com.minizeries.parser.ast.ExplainStatement;
import com.minizeries.parser.ast.Expression;
import com.minizeries.parser.ast.SelectStatement;
import com.minizeries.parser.ast.SqlStatement;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 查询执行器
 *
 * 根据 SQL AST 与表函数协商执行计划并执行:
 * 1. 准备: 把表函数参数和 WHERE 中的 AND 项转换为约束，交给表函数规划
 * 2. 只有所有条件都被表函数消费、且排序已满足时，才把 LIMIT / OFFSET 下推
 * 3. 构建算子树: SeriesScan → Filter → Sort → Limit → Project
 * 4. open() / next() / close() 拉取结果
 *
 * EXPLAIN 只执行第 1 步，由 {@link ExplainGenerator} 描述协商结果。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class QueryExecutor {

    private final ModuleRegistry registry;

    private final SQLParser parser = new SQLParser();

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private final ExplainGenerator explainGenerator = new ExplainGenerator();

    public QueryExecutor() {
        this(ModuleRegistry.withDefaults());
    }

    public QueryExecutor(ModuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * 解析并执行一条 SQL
     *
     * EXPLAIN SELECT 不执行查询，返回一行执行计划。
     *
     * @param sql SELECT 或 EXPLAIN SELECT 语句
     * @return 查询结果集
     */
    public List<Map<String, Object>> execute(String sql) throws Exception {
        SqlStatement stmt = parser.parse(sql);
        if (stmt instanceof ExplainStatement) {
            ExplainPlan plan = explain(((ExplainStatement) stmt).getSelect());
            return Collections.singletonList(plan.toRow());
        }
        if (!(stmt instanceof SelectStatement)) {
            throw new IllegalArgumentException("Only SELECT is supported: " + sql);
        }
        return execute((SelectStatement) stmt);
    }

    /**
     * 生成 SELECT 的执行计划，不执行查询
     *
     * @param selectStmt SELECT 语句 AST
     * @return 执行计划
     */
    public ExplainPlan explain(SelectStatement selectStmt) {
        ExplainPlan plan = explainGenerator.generateExplain(prepare(selectStmt));
        log.info("Explain plan:\n{}", plan.format());
        return plan;
    }

    /**
     * 执行 SELECT 查询
     *
     * @param selectStmt SELECT 语句 AST
     * @return 查询结果集
     */
    public List<Map<String, Object>> execute(SelectStatement selectStmt) throws Exception {
        log.info("Executing query on table function: {}", selectStmt.getTableName());

        Operator plan = buildExecutionPlan(prepare(selectStmt));

        List<Map<String, Object>> results = new ArrayList<>();

        try {
            plan.open();

            Map<String, Object> row;
            while ((row = plan.next()) != null) {
                results.add(row);
            }

            log.info("Query finished, returned {} rows", results.size());

        } finally {
            plan.close();
        }

        return results;
    }

    /**
     * 查询准备: 与表函数协商执行计划
     *
     * @param selectStmt SELECT 语句
     * @return 准备好的查询
     */
    public PreparedQuery prepare(SelectStatement selectStmt) {
        String name = selectStmt.getTableName();
        SeriesModule module = registry.find(name);
        if (module == null) {
            throw new IllegalArgumentException("No such table function: " + name);
        }

        // 1. 表函数参数依次对应隐藏列
        List<Column> parameters = module.getParameterColumns();
        List<Object> tableArgs = selectStmt.getTableArguments();
        if (tableArgs.size() > parameters.size()) {
            throw new IllegalArgumentException("too many arguments on " + name
                    + "() - max " + parameters.size());
        }

        List<Conjunct> conjuncts = new ArrayList<>();
        for (int i = 0; i < tableArgs.size(); i++) {
            Expression.BinaryExpression eq = new Expression.BinaryExpression("=",
                    new Expression.ColumnReference(parameters.get(i).getColumnName()),
                    new Expression.LiteralExpression(tableArgs.get(i), null));
            conjuncts.add(toConjunct(eq));
        }

        // 2. WHERE 中的 AND 项
        for (Expression expr : splitConjuncts(selectStmt.getWhereCondition())) {
            conjuncts.add(toConjunct(expr));
        }

        // 3. ORDER BY 必须引用已知列
        for (SelectStatement.OrderByElement element : selectStmt.getOrderByElements()) {
            requireColumn(element.getColumnName());
        }

        IndexInfo info = buildIndexInfo(conjuncts, selectStmt, false);
        SeriesPlan plan = module.bestIndex(info);

        // 4. 所有条件都被消费且排序已满足时，下推 LIMIT / OFFSET 再规划一次
        boolean paginationPushed = false;
        if (selectStmt.getLimit() != null
                && allConsumed(conjuncts, plan)
                && (selectStmt.getOrderByElements().isEmpty() || plan.isOrderByConsumed())) {
            info = buildIndexInfo(conjuncts, selectStmt, true);
            plan = module.bestIndex(info);
            paginationPushed = true;
        }

        // 5. 按参数序号排列参数值
        List<Object> constraintValues = constraintValues(conjuncts, selectStmt, paginationPushed);
        SqlValue[] arguments = new SqlValue[plan.getArgumentCount()];
        List<SeriesPlan.ConstraintUsage> usages = plan.getUsages();
        for (int i = 0; i < usages.size(); i++) {
            if (usages.get(i).isConsumed()) {
                arguments[usages.get(i).getArgvIndex() - 1] = SqlValue.of(constraintValues.get(i));
            }
        }

        List<Expression> residuals = new ArrayList<>();
        int index = 0;
        for (Conjunct conjunct : conjuncts) {
            if (!conjunct.isConsumed(usages, index)) {
                residuals.add(conjunct.source);
            }
            index += conjunct.pushdowns.size();
        }

        log.info("Prepared {}: plan={}:{} cost={}, residuals={}, paginationPushed={}",
                name, plan.getIndexNumber(), plan.getIndexString(), plan.getEstimatedCost(),
                residuals, paginationPushed);

        return new PreparedQuery(selectStmt, module, info, plan,
                Arrays.asList(arguments), residuals, paginationPushed);
    }

    /**
     * 构建执行计划
     *
     * 执行计划是一棵算子树:
     * - 叶子节点: SeriesScan（表函数）
     * - 中间节点: Filter（残余条件）、Sort（未被消费的 ORDER BY）、Limit（未下推的分页）
     * - 根节点: Project（SELECT 列）
     */
    public Operator buildExecutionPlan(PreparedQuery query) {
        SelectStatement selectStmt = query.getStatement();

        // 1. SeriesScan - 表函数扫描
        Operator plan = new SeriesScanOperator(query.getModule().openCursor(),
                query.getPlan(), query.getArguments());
        log.debug("Added SeriesScan operator");

        // 2. Filter - 残余条件
        if (!query.getResiduals().isEmpty()) {
            String filterDesc = query.getResiduals().stream()
                    .map(Expression::toString)
                    .collect(Collectors.joining(" AND "));
            plan = new FilterOperator(plan, evaluator.toPredicate(query.getResiduals()), filterDesc);
            log.debug("Added Filter operator: {}", filterDesc);
        }

        // 3. Sort - ORDER BY
        if (query.isSortRequired()) {
            List<String> orderColumns = new ArrayList<>();
            List<Boolean> descending = new ArrayList<>();

            for (SelectStatement.OrderByElement element : selectStmt.getOrderByElements()) {
                orderColumns.add(rowKey(requireColumn(element.getColumnName())));
                descending.add(element.isDescending());
            }

            plan = new SortOperator(plan, orderColumns, descending);
            log.debug("Added Sort operator: {}", orderColumns);
        }

        // 4. Limit - LIMIT / OFFSET
        if (query.isLimitRequired()) {
            long limit = toLong(selectStmt.getLimit(), "LIMIT");
            long offset = selectStmt.getOffset() != null ? toLong(selectStmt.getOffset(), "OFFSET") : 0L;
            plan = new LimitOperator(plan, limit, offset);
            log.debug("Added Limit operator: limit={}, offset={}", limit, offset);
        }

        // 5. Project - SELECT 列
        List<String> sources = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        if (selectStmt.isSelectAll()) {
            for (Column column : query.getModule().getColumns()) {
                if (!column.isHidden()) {
                    sources.add(column.getColumnName());
                    outputs.add(column.getColumnName());
                }
            }
        } else {
            for (SelectStatement.SelectElement element : selectStmt.getSelectElements()) {
                Column column = requireColumn(element.getColumnName());
                sources.add(rowKey(column));
                outputs.add(element.getAlias() != null ? element.getAlias() : element.getColumnName());
            }
        }
        plan = new ProjectOperator(plan, sources, outputs);
        log.debug("Added Project operator: {}", outputs);

        return plan;
    }

    /**
     * 把 WHERE 条件按顶层 AND 拆开
     */
    private List<Expression> splitConjuncts(Expression expr) {
        List<Expression> result = new ArrayList<>();
        if (expr == null) {
            return result;
        }
        if (expr instanceof Expression.BinaryExpression
                && "AND".equalsIgnoreCase(((Expression.BinaryExpression) expr).getOperator())) {
            Expression.BinaryExpression and = (Expression.BinaryExpression) expr;
            result.addAll(splitConjuncts(and.getLeft()));
            result.addAll(splitConjuncts(and.getRight()));
        } else {
            result.add(expr);
        }
        return result;
    }

    /**
     * 把一个 AND 项转换为可下推的约束
     *
     * 只有 "列 运算符 常量" 和 BETWEEN 可以下推，其他条件全部留给宿主。
     */
    private Conjunct toConjunct(Expression expr) {
        List<Pushdown> pushdowns = new ArrayList<>();

        if (expr instanceof Expression.BinaryExpression
                && !((Expression.BinaryExpression) expr).isLogical()) {
            Expression.BinaryExpression binary = (Expression.BinaryExpression) expr;
            Column column = requireColumn(((Expression.ColumnReference) binary.getLeft()).getColumnName());
            ConstraintOp op = ConstraintOp.fromComparison(binary.getOperator());
            Object value = ((Expression.LiteralExpression) binary.getRight()).getValue();
            if (value == null && op == ConstraintOp.IS) {
                op = ConstraintOp.IS_NULL;
            } else if (value == null && op == ConstraintOp.IS_NOT) {
                op = ConstraintOp.IS_NOT_NULL;
            }
            if (op != null) {
                pushdowns.add(new Pushdown(column, op, value));
            }
        } else if (expr instanceof Expression.BetweenExpression
                && !((Expression.BetweenExpression) expr).isNegated()) {
            Expression.BetweenExpression between = (Expression.BetweenExpression) expr;
            Column column = requireColumn(between.getColumnName());
            pushdowns.add(new Pushdown(column, ConstraintOp.GE, between.getStart()));
            pushdowns.add(new Pushdown(column, ConstraintOp.LE, between.getEnd()));
        }

        return new Conjunct(expr, pushdowns);
    }

    private IndexInfo buildIndexInfo(List<Conjunct> conjuncts, SelectStatement selectStmt,
                                     boolean withPagination) {
        IndexInfo info = new IndexInfo();
        for (Conjunct conjunct : conjuncts) {
            for (Pushdown pushdown : conjunct.pushdowns) {
                info.addConstraint(pushdown.column, pushdown.op);
            }
        }
        if (withPagination) {
            info.addConstraint(null, ConstraintOp.LIMIT);
            if (selectStmt.getOffset() != null) {
                info.addConstraint(null, ConstraintOp.OFFSET);
            }
        }
        for (SelectStatement.OrderByElement element : selectStmt.getOrderByElements()) {
            info.addOrderBy(requireColumn(element.getColumnName()), element.isDescending());
        }
        return info;
    }

    /**
     * 与 IndexInfo 中约束顺序一致的参数值
     */
    private List<Object> constraintValues(List<Conjunct> conjuncts, SelectStatement selectStmt,
                                          boolean withPagination) {
        List<Object> values = new ArrayList<>();
        for (Conjunct conjunct : conjuncts) {
            for (Pushdown pushdown : conjunct.pushdowns) {
                values.add(pushdown.value);
            }
        }
        if (withPagination) {
            values.add(selectStmt.getLimit());
            if (selectStmt.getOffset() != null) {
                values.add(selectStmt.getOffset());
            }
        }
        return values;
    }

    private boolean allConsumed(List<Conjunct> conjuncts, SeriesPlan plan) {
        int index = 0;
        for (Conjunct conjunct : conjuncts) {
            if (!conjunct.isConsumed(plan.getUsages(), index)) {
                return false;
            }
            index += conjunct.pushdowns.size();
        }
        return true;
    }

    private Column requireColumn(String columnName) {
        Column column = Column.fromName(columnName);
        if (column == null) {
            throw new IllegalArgumentException("No such column: " + columnName);
        }
        return column;
    }

    /**
     * 列在行数据中的键，rowid 读取 value
     */
    private String rowKey(Column column) {
        return column.isValue() ? Constants.COLUMN_VALUE : column.getColumnName();
    }

    private long toLong(Object literal, String clause) {
        Long value = SqlValue.of(literal).exactLongValue();
        if (value == null) {
            throw new IllegalArgumentException(clause + " must be an integer: " + literal);
        }
        return value;
    }

    /**
     * 单个可下推的约束
     */
    private static final class Pushdown {
        final Column column;
        final ConstraintOp op;
        final Object value;

        Pushdown(Column column, ConstraintOp op, Object value) {
            this.column = column;
            this.op = op;
            this.value = value;
        }
    }

    /**
     * WHERE 中的一个 AND 项及其对应的约束
     */
    private static final class Conjunct {
        final Expression source;
        final List<Pushdown> pushdowns;

        Conjunct(Expression source, List<Pushdown> pushdowns) {
            this.source = source;
            this.pushdowns = pushdowns;
        }

        /**
         * 所有约束都被消费并且可以省略复查
         *
         * @param firstIndex 第一个约束在 IndexInfo 中的位置
         */
        boolean isConsumed(List<SeriesPlan.ConstraintUsage> usages, int firstIndex) {
            if (pushdowns.isEmpty()) {
                return false;
            }
            for (int i = 0; i < pushdowns.size(); i++) {
                SeriesPlan.ConstraintUsage usage = usages.get(firstIndex + i);
                if (!usage.isConsumed() || !usage.isOmit()) {
                    return false;
                }
            }
            return true;
        }
    }
}
