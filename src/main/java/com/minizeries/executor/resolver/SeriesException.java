package com.minizeries.executor.resolver;

import lombok.Getter;

/**
 * 表函数的致命配置错误
 *
 * 与"空结果"不同，这类错误会中止整个执行，不产生任何行:
 * - TYPE_MISMATCH: 精确槽位（offset / limit / step / base）收到非整数参数
 * - STEP_OUT_OF_RANGE: 步长为 0 或绝对值 &gt;= 2^63
 * - INTERNAL: 执行计划与参数不一致
 *
 * @author Mini-Zeries
 */
@Getter
public class SeriesException extends Exception {

    /**
     * 错误类型
     */
    public enum ErrorKind {
        TYPE_MISMATCH,
        STEP_OUT_OF_RANGE,
        INTERNAL
    }

    private final ErrorKind kind;

    /**
     * 引发错误的参数名（可能为 null）
     */
    private final String slot;

    public SeriesException(ErrorKind kind, String slot, String message) {
        super(message);
        this.kind = kind;
        this.slot = slot;
    }

    public static SeriesException typeMismatch(String slot) {
        return new SeriesException(ErrorKind.TYPE_MISMATCH, slot,
                slot + " parameter has wrong type");
    }

    public static SeriesException stepOutOfRange() {
        return new SeriesException(ErrorKind.STEP_OUT_OF_RANGE, "step",
                "step parameter out of range");
    }

    public static SeriesException internal(String message) {
        return new SeriesException(ErrorKind.INTERNAL, null, message);
    }
}
