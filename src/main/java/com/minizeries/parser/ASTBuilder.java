package com.minizeries.parser;

import com.minizeries.parser.ast.ExplainStatement;
import com.minizeries.parser.ast.Expression;
import com.minizeries.parser.ast.SelectStatement;
import com.minizeries.parser.ast.SqlStatement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST 构建器
 *
 * 使用 Visitor 模式将 ANTLR 生成的解析树转换为自定义的 AST
 *
 * @author Mini-Zeries
 */
@Slf4j
public class ASTBuilder extends ZeriesSQLBaseVisitor<Object> {

    /**
     * 访问 SQL 语句根节点
     */
    @Override
    public SqlStatement visitSqlStatement(ZeriesSQLParser.SqlStatementContext ctx) {
        log.debug("Visiting SQL statement");

        if (ctx.selectStatement() != null) {
            SelectStatement select = visitSelectStatement(ctx.selectStatement());
            return ctx.EXPLAIN() != null ? new ExplainStatement(select) : select;
        }

        throw new IllegalArgumentException("Unknown statement type");
    }

    /**
     * 访问 SELECT 语句
     */
    @Override
    public SelectStatement visitSelectStatement(ZeriesSQLParser.SelectStatementContext ctx) {
        log.debug("Visiting SELECT statement");

        SelectStatement stmt = new SelectStatement();

        // SELECT 列
        if (ctx.selectElements().STAR() != null) {
            stmt.setSelectAll(true);
        } else {
            List<SelectStatement.SelectElement> elements = new ArrayList<>();
            for (ZeriesSQLParser.SelectElementContext elemCtx : ctx.selectElements().selectElement()) {
                SelectStatement.SelectElement element = new SelectStatement.SelectElement();
                element.setColumnName(elemCtx.columnName().getText());

                if (elemCtx.alias() != null) {
                    element.setAlias(elemCtx.alias().getText());
                }

                elements.add(element);
            }
            stmt.setSelectElements(elements);
        }

        // 表函数及其参数
        ZeriesSQLParser.TableSourceContext source = ctx.tableSource();
        stmt.setTableName(source.functionName().getText());
        stmt.setTableArguments(source.constant().stream()
                .map(this::parseConstant)
                .collect(Collectors.toList()));

        // WHERE 子句
        if (ctx.whereClause() != null) {
            stmt.setWhereCondition(visitExpression(ctx.whereClause().expression()));
        }

        // ORDER BY 子句
        if (ctx.orderByClause() != null) {
            List<SelectStatement.OrderByElement> orderByElements = new ArrayList<>();
            for (ZeriesSQLParser.OrderByElementContext orderByCtx : ctx.orderByClause().orderByElement()) {
                SelectStatement.OrderByElement element = new SelectStatement.OrderByElement();
                element.setColumnName(orderByCtx.columnName().getText());
                element.setDescending(orderByCtx.DESC() != null);
                orderByElements.add(element);
            }
            stmt.setOrderByElements(orderByElements);
        }

        // LIMIT 子句: LIMIT n [OFFSET k] 或 LIMIT k, n
        if (ctx.limitClause() != null) {
            ZeriesSQLParser.LimitClauseContext limitCtx = ctx.limitClause();
            if (limitCtx.COMMA() != null) {
                stmt.setOffset(parseConstant(limitCtx.constant(0)));
                stmt.setLimit(parseConstant(limitCtx.constant(1)));
            } else {
                stmt.setLimit(parseConstant(limitCtx.constant(0)));
                if (limitCtx.OFFSET() != null) {
                    stmt.setOffset(parseConstant(limitCtx.constant(1)));
                }
            }
        }

        return stmt;
    }

    /**
     * 访问表达式
     */
    @Override
    public Expression visitExpression(ZeriesSQLParser.ExpressionContext ctx) {
        // 处理 AND/OR 逻辑运算
        if (ctx.AND() != null || ctx.OR() != null) {
            return new Expression.BinaryExpression(
                    ctx.AND() != null ? "AND" : "OR",
                    visitExpression(ctx.expression(0)),
                    visitExpression(ctx.expression(1)));
        }

        // 处理 NOT
        if (ctx.NOT() != null) {
            Expression.UnaryExpression expr = new Expression.UnaryExpression();
            expr.setOperator("NOT");
            expr.setOperand(visitExpression(ctx.expression(0)));
            return expr;
        }

        if (ctx.predicate() != null) {
            return visitPredicate(ctx.predicate());
        }

        throw new IllegalArgumentException("Unknown expression type");
    }

    /**
     * 访问谓词 (比较表达式)
     */
    @Override
    public Expression visitPredicate(ZeriesSQLParser.PredicateContext ctx) {
        // 处理括号表达式
        if (ctx.expression() != null) {
            return visitExpression(ctx.expression());
        }

        String columnName = ctx.columnName().getText();

        // 处理 BETWEEN
        if (ctx.BETWEEN() != null) {
            Expression.BetweenExpression expr = new Expression.BetweenExpression();
            expr.setColumnName(columnName);
            expr.setStart(parseConstant(ctx.constant(0)));
            expr.setEnd(parseConstant(ctx.constant(1)));
            expr.setNegated(ctx.NOT() != null);
            return expr;
        }

        // 处理 IN
        if (ctx.IN() != null) {
            Expression.InExpression expr = new Expression.InExpression();
            expr.setColumnName(columnName);
            expr.setValues(ctx.constant().stream()
                    .map(this::parseConstant)
                    .collect(Collectors.toList()));
            expr.setNegated(ctx.NOT() != null);
            return expr;
        }

        // 处理 IS / IS NOT
        if (ctx.IS() != null) {
            return new Expression.BinaryExpression(
                    ctx.NOT() != null ? "IS NOT" : "IS",
                    new Expression.ColumnReference(columnName),
                    literal(parseConstant(ctx.constant(0))));
        }

        // 处理比较运算 (=, <, >, etc.)
        if (ctx.comparisonOperator() != null) {
            return new Expression.BinaryExpression(
                    ctx.comparisonOperator().getText(),
                    new Expression.ColumnReference(columnName),
                    literal(parseConstant(ctx.constant(0))));
        }

        throw new IllegalArgumentException("Unknown predicate type");
    }

    private Expression.LiteralExpression literal(Object value) {
        return new Expression.LiteralExpression(value, getDataType(value));
    }

    /**
     * 解析常量值
     *
     * 超出 long 范围的整数按浮点数处理
     */
    private Object parseConstant(ZeriesSQLParser.ConstantContext ctx) {
        String sign = ctx.MINUS() != null ? "-" : "";
        if (ctx.INTEGER_LITERAL() != null) {
            String text = sign + ctx.INTEGER_LITERAL().getText();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                log.debug("Integer literal {} out of range, using REAL", text);
                return Double.parseDouble(text);
            }
        } else if (ctx.REAL_LITERAL() != null) {
            return Double.parseDouble(sign + ctx.REAL_LITERAL().getText());
        } else if (ctx.STRING_LITERAL() != null) {
            String text = ctx.STRING_LITERAL().getText();
            // 移除引号，还原转义的单引号
            return text.substring(1, text.length() - 1).replace("''", "'");
        } else if (ctx.NULL_LITERAL() != null) {
            return null;
        } else if (ctx.TRUE() != null) {
            return true;
        } else if (ctx.FALSE() != null) {
            return false;
        }
        throw new IllegalArgumentException("Unknown constant type: " + ctx.getText());
    }

    /**
     * 获取值的数据类型
     */
    private String getDataType(Object value) {
        if (value == null) {
            return "NULL";
        } else if (value instanceof Long) {
            return "INTEGER";
        } else if (value instanceof Double) {
            return "REAL";
        } else if (value instanceof Boolean) {
            return "BOOLEAN";
        }
        return "STRING";
    }
}
