package com.minizeries.parser.ast;

/**
 * SQL 语句抽象基类
 *
 * @author Mini-Zeries
 */
public abstract class SqlStatement {

    /**
     * 获取语句类型名称
     *
     * @return 语句类型
     */
    public String getStatementType() {
        return this.getClass().getSimpleName();
    }
}
