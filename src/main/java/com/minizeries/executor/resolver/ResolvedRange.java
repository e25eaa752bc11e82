package com.minizeries.executor.resolver;

import lombok.Value;

/**
 * 解析后的扫描范围
 *
 * (start, stop, signedStep) 完全确定一次枚举:
 * start 是第一个输出值，stop 是最后一个输出值（包含），
 * signedStep 的符号表示方向。
 *
 * step / base 是本次执行实际生效的参数（按用户给出的原值，包括符号），
 * 作为隐藏列随每一行输出。
 *
 * @author Mini-Zeries
 */
@Value
public class ResolvedRange {

    /**
     * 空结果
     */
    public static final ResolvedRange EMPTY = new ResolvedRange(0L, 0L, 0L, 0L, 0L, true);

    long start;

    long stop;

    long signedStep;

    long step;

    long base;

    boolean empty;

    public static ResolvedRange of(long start, long stop, long signedStep, long step, long base) {
        return new ResolvedRange(start, stop, signedStep, step, base, false);
    }

    @Override
    public String toString() {
        if (empty) {
            return "ResolvedRange(EMPTY)";
        }
        return "ResolvedRange(start=" + start + ", stop=" + stop + ", signedStep=" + signedStep
                + ", step=" + step + ", base=" + base + ")";
    }
}
