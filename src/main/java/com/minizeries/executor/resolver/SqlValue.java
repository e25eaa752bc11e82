package com.minizeries.executor.resolver;

import com.minizeries.common.Constants;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * 宿主传入的参数值
 *
 * 参数保留原始表示（整数、浮点、文本、NULL），解析器按数值亲和性判断类型:
 * - Long / Integer / Short / Byte / Boolean: INTEGER
 * - Double / Float / BigDecimal: FLOAT
 * - 形如数字的文本: 转换为对应的 INTEGER 或 FLOAT
 * - 其他（NULL、非数字文本等）: OTHER
 *
 * @author Mini-Zeries
 */
@EqualsAndHashCode
public final class SqlValue {

    /**
     * 数值类型
     */
    public enum NumericType {
        INTEGER,
        FLOAT,
        OTHER
    }

    public static final SqlValue NULL = new SqlValue(null);

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");

    private static final Pattern REAL_TEXT =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Object value;

    private SqlValue(Object value) {
        this.value = value;
    }

    public static SqlValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof SqlValue) {
            return (SqlValue) value;
        }
        return new SqlValue(value);
    }

    public static SqlValue ofLong(long value) {
        return new SqlValue(value);
    }

    /**
     * 按数值亲和性得到的类型
     */
    public NumericType numericType() {
        Object numeric = toNumeric();
        if (numeric instanceof Long) {
            return NumericType.INTEGER;
        }
        if (numeric instanceof Double) {
            return NumericType.FLOAT;
        }
        return NumericType.OTHER;
    }

    /**
     * 整数值，仅在 numericType() 为 INTEGER 时有意义
     */
    public long longValue() {
        Object numeric = toNumeric();
        if (numeric instanceof Long) {
            return (Long) numeric;
        }
        if (numeric instanceof Double) {
            return (long) (double) (Double) numeric;
        }
        throw new IllegalStateException("Not a numeric value: " + value);
    }

    /**
     * 浮点值，仅在 numericType() 不为 OTHER 时有意义
     */
    public double doubleValue() {
        Object numeric = toNumeric();
        if (numeric instanceof Long) {
            return (double) (Long) numeric;
        }
        if (numeric instanceof Double) {
            return (Double) numeric;
        }
        throw new IllegalStateException("Not a numeric value: " + value);
    }

    /**
     * 无损转换为 long
     *
     * 浮点数必须等于自身的截断值，并且落在 [-2^63, 2^63) 内。
     *
     * @return 整数值，不是整数、超出 long 范围或不是数值时返回 null
     */
    public Long exactLongValue() {
        Object numeric = toNumeric();
        if (numeric instanceof Long) {
            return (Long) numeric;
        }
        if (numeric instanceof Double) {
            double d = (Double) numeric;
            if (d == Math.floor(d) && d >= -Constants.TWO_POW_63 && d < Constants.TWO_POW_63) {
                return (long) d;
            }
        }
        return null;
    }

    /**
     * 转换为 Long 或 Double，无法转换时返回 null
     */
    private Object toNumeric() {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof String) {
            return parseNumericText(((String) value).trim());
        }
        return null;
    }

    private static Object parseNumericText(String text) {
        if (INTEGER_TEXT.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                // 超出 long 范围的整数文本按浮点数处理
                return Double.parseDouble(text);
            }
        }
        if (REAL_TEXT.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        return null;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
