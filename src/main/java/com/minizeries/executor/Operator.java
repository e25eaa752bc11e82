package com.minizeries.executor;

import java.util.Map;

/**
 * 执行器算子接口 - 火山模型（Volcano Model）
 *
 * 每个算子都是一个迭代器，通过 next() 逐行返回数据，
 * 算子可以嵌套组合形成执行计划树。
 *
 * 执行流程:
 * 1. open(): 初始化算子，打开子算子
 * 2. next(): 返回下一行数据，如果没有更多数据返回 null
 * 3. close(): 关闭算子，释放资源
 *
 * @author Mini-Zeries
 */
public interface Operator {

    /**
     * 初始化算子
     *
     * 必须先调用 open() 才能调用 next()
     *
     * @throws Exception 初始化失败时抛出
     */
    void open() throws Exception;

    /**
     * 获取下一行数据
     *
     * 返回一行数据（Map 格式，列名 -> 值），没有更多数据时返回 null。
     * 采用拉取模式（Pull-based）。
     *
     * @return 下一行数据，如果没有返回 null
     * @throws Exception 执行失败时抛出
     */
    Map<String, Object> next() throws Exception;

    /**
     * 关闭算子
     *
     * @throws Exception 关闭失败时抛出
     */
    void close() throws Exception;

    /**
     * 获取算子类型（用于 EXPLAIN）
     *
     * @return 算子类型名称
     */
    default String getOperatorType() {
        return this.getClass().getSimpleName();
    }
}
