package com.minizeries.common;

/**
 * 系统常量定义
 *
 * @author Mini-Zeries
 */
public class Constants {

    // ==================== 64 位整数边界 ====================

    /**
     * 有符号 64 位最大值
     */
    public static final long MAX64 = Long.MAX_VALUE;

    /**
     * 有符号 64 位最小值
     */
    public static final long MIN64 = Long.MIN_VALUE;

    /**
     * 2^63 的浮点表示
     * 任何 >= TWO_POW_63 的 double 都超出 long 的范围
     */
    public static final double TWO_POW_63 = 9223372036854775808.0;

    // ==================== 表函数定义 ====================

    /**
     * 表函数名称
     */
    public static final String MODULE_NAME = "generate_zeries";

    /**
     * 结果列: 序列值
     */
    public static final String COLUMN_VALUE = "value";

    /**
     * 隐藏列: 步长
     */
    public static final String COLUMN_STEP = "step";

    /**
     * 隐藏列: 基准值
     */
    public static final String COLUMN_BASE = "base";

    /**
     * 行号列（与 value 相同）
     */
    public static final String COLUMN_ROWID = "rowid";

    // ==================== 参数默认值 ====================

    /**
     * 默认步长
     */
    public static final long DEFAULT_STEP = 1L;

    /**
     * 默认基准值
     */
    public static final long DEFAULT_BASE = 0L;

    /**
     * 默认偏移量
     */
    public static final long DEFAULT_OFFSET = 0L;

    /**
     * 无限制（LIMIT 缺省时的哨兵值）
     * 任何负数的 LIMIT 都表示无限制
     */
    public static final long NO_LIMIT = -1L;

    // ==================== 执行计划相关常量 ====================

    /**
     * 索引编号中的降序标志位
     */
    public static final int FLAG_DESC = 0x01;

    /**
     * 无任何边界时的估算成本: 2^64
     */
    public static final double UNBOUNDED_COST = 18446744073709551616.0;

    /**
     * 存在等值条件时的估算成本
     */
    public static final double EQUALITY_COST = 1.0;

    // ==================== 私有构造函数 ====================

    private Constants() {
        // 工具类，禁止实例化
    }
}
