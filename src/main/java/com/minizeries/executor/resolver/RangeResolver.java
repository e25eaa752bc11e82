package com.minizeries.executor.resolver;

import com.minizeries.common.Constants;
import com.minizeries.common.UnsignedMath;
import com.minizeries.executor.resolver.SqlValue.NumericType;
import com.minizeries.optimizer.planner.ConstraintSlot;
import com.minizeries.optimizer.planner.SeriesPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.minizeries.common.Constants.MAX64;
import static com.minizeries.common.Constants.MIN64;
import static com.minizeries.common.Constants.TWO_POW_63;

/**
 * 范围解析器
 *
 * 每次执行调用一次，把执行计划和具体参数转换为 (start, stop, signedStep):
 * 1. 精确槽位（offset / limit / step / base）: 必须是无损整数，重复且不一致时结果为空
 * 2. value 边界: 浮点边界向可行区域取整，维护 [lower, upper] 的交集
 * 3. 校验步长: 绝对值必须在 [1, 2^63 - 1]
 * 4. 同余对齐: 把 [lower, upper] 收缩到与 base 模 |step| 同余的值上
 * 5. 计算可行步数，应用 OFFSET
 * 6. 根据方向确定 start / stop，应用 LIMIT
 *
 * 所有 64 位区间运算都通过 {@link UnsignedMath} 完成，不会溢出。
 * 解析是全有或全无的: 要么得到完整的范围，要么为空，要么抛出异常。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class RangeResolver {

    /**
     * 按执行计划解析
     *
     * @param plan 执行计划
     * @param args 按计划参数顺序排列的参数值
     * @return 解析结果，可能为 {@link ResolvedRange#EMPTY}
     * @throws SeriesException 参数类型错误或步长越界
     */
    public ResolvedRange resolve(SeriesPlan plan, List<SqlValue> args) throws SeriesException {
        return resolve(plan.getIndexNumber(), plan.getIndexString(), args);
    }

    /**
     * 按索引编号和索引字符串解析
     *
     * @param indexNumber 标志位
     * @param indexString 槽位编码（可以为 null，表示没有参数）
     * @param args 参数值
     * @return 解析结果
     * @throws SeriesException 参数类型错误、步长越界或计划与参数不一致
     */
    public ResolvedRange resolve(int indexNumber, String indexString, List<SqlValue> args)
            throws SeriesException {
        String slots = indexString != null ? indexString : "";
        if (args.size() != slots.length()) {
            throw SeriesException.internal("expected " + slots.length()
                    + " arguments but got " + args.size());
        }

        Map<ConstraintSlot, Long> exact = new EnumMap<>(ConstraintSlot.class);
        long lower = MIN64;
        long upper = MAX64;

        for (int i = 0; i < args.size(); i++) {
            ConstraintSlot slot = ConstraintSlot.fromCode(slots.charAt(i));
            if (slot == null) {
                throw SeriesException.internal("unknown constraint code '" + slots.charAt(i) + "'");
            }
            SqlValue arg = args.get(i);

            if (slot.isExact()) {
                long value = exactValue(slot, arg);
                Long previous = exact.putIfAbsent(slot, value);
                if (previous != null && previous != value) {
                    log.debug("Conflicting {} values: {} vs {}", slot.getSlotName(), previous, value);
                    return ResolvedRange.EMPTY;
                }
                continue;
            }

            NumericType type = arg.numericType();
            if (type == NumericType.OTHER
                    || (type == NumericType.FLOAT && Double.isNaN(arg.doubleValue()))) {
                log.debug("Non-numeric bound {} {}, empty result", slot, arg);
                return ResolvedRange.EMPTY;
            }

            if (slot == ConstraintSlot.EQ) {
                Long point = arg.exactLongValue();
                if (point == null || point < lower || point > upper) {
                    log.debug("Equality {} outside [{}, {}], empty result", arg, lower, upper);
                    return ResolvedRange.EMPTY;
                }
                lower = point;
                upper = point;
            } else if (slot.isUpperBound()) {
                Bound bound = upperBound(slot, arg);
                if (bound.infeasible) {
                    return ResolvedRange.EMPTY;
                }
                if (!bound.unbounded && bound.value < upper) {
                    if (bound.value < lower) {
                        log.debug("Upper bound {} below lower bound {}, empty result", bound.value, lower);
                        return ResolvedRange.EMPTY;
                    }
                    upper = bound.value;
                }
            } else {
                Bound bound = lowerBound(slot, arg);
                if (bound.infeasible) {
                    return ResolvedRange.EMPTY;
                }
                if (!bound.unbounded && bound.value > lower) {
                    if (bound.value > upper) {
                        log.debug("Lower bound {} above upper bound {}, empty result", bound.value, upper);
                        return ResolvedRange.EMPTY;
                    }
                    lower = bound.value;
                }
            }
        }

        long step = exact.getOrDefault(ConstraintSlot.STEP, Constants.DEFAULT_STEP);
        long base = exact.getOrDefault(ConstraintSlot.BASE, Constants.DEFAULT_BASE);
        long offset = exact.getOrDefault(ConstraintSlot.OFFSET, Constants.DEFAULT_OFFSET);
        long limit = exact.getOrDefault(ConstraintSlot.LIMIT, Constants.NO_LIMIT);

        if (step == 0 || step == MIN64) {
            throw SeriesException.stepOutOfRange();
        }
        long ustep = Math.abs(step);

        if (ustep > 1) {
            long lowest = UnsignedMath.subMagnitude(base,
                    UnsignedMath.floorToMultiple(UnsignedMath.unsignedDifference(base, MIN64), ustep));
            if (upper < lowest) {
                return ResolvedRange.EMPTY;
            }
            upper = UnsignedMath.addMagnitude(lowest,
                    UnsignedMath.floorToMultiple(UnsignedMath.unsignedDifference(upper, lowest), ustep));

            long highest = UnsignedMath.addMagnitude(base,
                    UnsignedMath.floorToMultiple(UnsignedMath.unsignedDifference(MAX64, base), ustep));
            if (lower > highest) {
                return ResolvedRange.EMPTY;
            }
            lower = UnsignedMath.subMagnitude(highest,
                    UnsignedMath.floorToMultiple(UnsignedMath.unsignedDifference(highest, lower), ustep));

            if (lower > upper) {
                log.debug("No value congruent to {} (mod {}) in range, empty result", base, ustep);
                return ResolvedRange.EMPTY;
            }
        }

        // 可行步数（从 0 开始计数，无符号）
        long length = Long.divideUnsigned(UnsignedMath.unsignedDifference(upper, lower), ustep);
        if (offset > 0 && Long.compareUnsigned(offset, length) > 0) {
            log.debug("Offset {} beyond {} steps, empty result", offset, Long.toUnsignedString(length));
            return ResolvedRange.EMPTY;
        }
        if (limit == 0) {
            return ResolvedRange.EMPTY;
        }

        boolean descending = (indexNumber & Constants.FLAG_DESC) != 0;
        long start;
        long stop;
        long signedStep;
        if (!descending) {
            start = lower;
            stop = upper;
            signedStep = ustep;
            if (offset > 0) {
                start = UnsignedMath.addMagnitude(start, offset * ustep);
                length -= offset;
            }
            if (limit > 0 && Long.compareUnsigned(limit, length) <= 0) {
                stop = UnsignedMath.addMagnitude(start, (limit - 1) * ustep);
            }
        } else {
            start = upper;
            stop = lower;
            signedStep = -ustep;
            if (offset > 0) {
                start = UnsignedMath.subMagnitude(start, offset * ustep);
                length -= offset;
            }
            if (limit > 0 && Long.compareUnsigned(limit, length) <= 0) {
                stop = UnsignedMath.subMagnitude(start, (limit - 1) * ustep);
            }
        }

        ResolvedRange range = ResolvedRange.of(start, stop, signedStep, step, base);
        log.debug("Resolved {} from indexNumber={}, indexString='{}'", range, indexNumber, slots);
        return range;
    }

    /**
     * 精确槽位的整数值
     *
     * 浮点数必须等于自身的截断值并且在 long 范围内。
     */
    private long exactValue(ConstraintSlot slot, SqlValue arg) throws SeriesException {
        switch (arg.numericType()) {
            case INTEGER:
                return arg.longValue();
            case FLOAT:
                Long value = arg.exactLongValue();
                if (value != null) {
                    return value;
                }
                throw SeriesException.typeMismatch(slot.getSlotName());
            default:
                throw SeriesException.typeMismatch(slot.getSlotName());
        }
    }

    /**
     * 由 &lt; / &lt;= 约束得到的上界
     *
     * LE x: floor(x)
     * LT x: x 为整数时 x - 1，否则 floor(x)
     */
    private static Bound upperBound(ConstraintSlot slot, SqlValue arg) {
        if (arg.numericType() == NumericType.INTEGER) {
            long value = arg.longValue();
            if (slot == ConstraintSlot.LE) {
                return Bound.of(value);
            }
            return value > MIN64 ? Bound.of(value - 1) : Bound.INFEASIBLE;
        }

        double d = arg.doubleValue();
        double floor = Math.floor(d);
        if (floor >= TWO_POW_63) {
            // 比所有 long 都大（包括 +Infinity）
            return Bound.UNBOUNDED;
        }
        if (floor < -TWO_POW_63) {
            return Bound.INFEASIBLE;
        }
        long value = (long) floor;
        if (slot == ConstraintSlot.LT && floor == d) {
            return value > MIN64 ? Bound.of(value - 1) : Bound.INFEASIBLE;
        }
        return Bound.of(value);
    }

    /**
     * 由 &gt; / &gt;= 约束得到的下界
     *
     * GE x: ceil(x)
     * GT x: x 为整数时 x + 1，否则 ceil(x)
     */
    private static Bound lowerBound(ConstraintSlot slot, SqlValue arg) {
        if (arg.numericType() == NumericType.INTEGER) {
            long value = arg.longValue();
            if (slot == ConstraintSlot.GE) {
                return Bound.of(value);
            }
            return value < MAX64 ? Bound.of(value + 1) : Bound.INFEASIBLE;
        }

        double d = arg.doubleValue();
        double ceil = Math.ceil(d);
        if (ceil >= TWO_POW_63) {
            return Bound.INFEASIBLE;
        }
        if (ceil < -TWO_POW_63) {
            // 比所有 long 都小（包括 -Infinity）
            return Bound.UNBOUNDED;
        }
        long value = (long) ceil;
        if (slot == ConstraintSlot.GT && ceil == d) {
            return value < MAX64 ? Bound.of(value + 1) : Bound.INFEASIBLE;
        }
        return Bound.of(value);
    }

    /**
     * 单个约束换算出的边界
     */
    private static final class Bound {

        static final Bound UNBOUNDED = new Bound(0L, true, false);

        static final Bound INFEASIBLE = new Bound(0L, false, true);

        final long value;

        /**
         * 约束不收窄区间
         */
        final boolean unbounded;

        /**
         * 没有任何 long 满足约束
         */
        final boolean infeasible;

        private Bound(long value, boolean unbounded, boolean infeasible) {
            this.value = value;
            this.unbounded = unbounded;
            this.infeasible = infeasible;
        }

        static Bound of(long value) {
            return new Bound(value, false, false);
        }
    }
}
