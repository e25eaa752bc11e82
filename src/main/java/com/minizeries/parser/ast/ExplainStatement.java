package com.minizeries.parser.ast;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * EXPLAIN 语句
 *
 * 只生成执行计划说明，不执行查询。
 *
 * @author Mini-Zeries
 */
@Data
@EqualsAndHashCode(callSuper = false)
public class ExplainStatement extends SqlStatement {

    /**
     * 被说明的查询
     */
    private SelectStatement select;

    public ExplainStatement() {
    }

    public ExplainStatement(SelectStatement select) {
        this.select = select;
    }

    @Override
    public String toString() {
        return "EXPLAIN " + select;
    }
}
