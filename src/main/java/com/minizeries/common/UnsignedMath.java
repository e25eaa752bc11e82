package com.minizeries.common;

/**
 * 无溢出的 64 位整数运算
 *
 * 在接近 Long.MIN_VALUE / Long.MAX_VALUE 的宽范围上做加减法时，
 * 有符号结果很容易溢出。这里把"差值"当作无符号 64 位数处理:
 * - unsignedDifference: 两个有符号数之差，返回无符号数
 * - addMagnitude / subMagnitude: 有符号数加减一个无符号数
 *
 * 调用方负责保证真实结果落在有符号 64 位范围内。
 * 返回值为"无符号"的 long 必须用 Long.compareUnsigned / Long.divideUnsigned 处理。
 *
 * @author Mini-Zeries
 */
public final class UnsignedMath {

    private UnsignedMath() {
    }

    /**
     * 计算 high - low，结果按无符号数解释
     *
     * 前置条件: high >= low
     *
     * @param high 较大值
     * @param low 较小值
     * @return 无符号差值
     */
    public static long unsignedDifference(long high, long low) {
        if (low >= 0 || high < 0) {
            // 同号，差值一定在有符号范围内
            return high - low;
        }
        // high >= 0 > low: 两部分各自不超过 2^63
        return high + (-low);
    }

    /**
     * 计算 base + delta，delta 为无符号数
     *
     * delta 超过 Long.MAX_VALUE 时分块相加，每一步都不会越界。
     *
     * @param base 有符号基数
     * @param delta 无符号增量
     * @return base + delta
     */
    public static long addMagnitude(long base, long delta) {
        while (Long.compareUnsigned(delta, Constants.MAX64) > 0) {
            base += Constants.MAX64;
            delta -= Constants.MAX64;
        }
        return base + delta;
    }

    /**
     * 计算 base - delta，delta 为无符号数
     *
     * @param base 有符号基数
     * @param delta 无符号减量
     * @return base - delta
     */
    public static long subMagnitude(long base, long delta) {
        while (Long.compareUnsigned(delta, Constants.MAX64) > 0) {
            base -= Constants.MAX64;
            delta -= Constants.MAX64;
        }
        return base - delta;
    }

    /**
     * 向下对齐到步长的整数倍: ⌊value / step⌋ * step（均为无符号数）
     */
    public static long floorToMultiple(long value, long step) {
        return Long.divideUnsigned(value, step) * step;
    }
}
