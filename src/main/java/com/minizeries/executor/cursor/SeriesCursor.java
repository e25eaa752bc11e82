package com.minizeries.executor.cursor;

import com.minizeries.executor.resolver.RangeResolver;
import com.minizeries.executor.resolver.ResolvedRange;
import com.minizeries.executor.resolver.SeriesException;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.optimizer.planner.SeriesPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 序列游标（惰性枚举器）
 *
 * 状态: 当前值、终止值、带符号步长、是否结束，以及本次执行生效的 step / base。
 *
 * 生命周期:
 * 1. 新建时处于结束状态
 * 2. filter(): 解析范围并重新初始化，范围为空时保持结束状态
 * 3. next(): 当前值等于终止值时结束，否则前进一个步长
 *
 * 解析出的范围保证 start 与 stop 之间的每一步都不会越界，因此前进不会溢出。
 * 一个游标只能被一个线程使用。
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SeriesCursor {

    private final RangeResolver resolver;

    private long value;

    private long stop;

    private long signedStep;

    private long step;

    private long base;

    private boolean eof = true;

    public SeriesCursor() {
        this(new RangeResolver());
    }

    public SeriesCursor(RangeResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * 开始一次新的执行
     *
     * 解析失败时游标保持结束状态并抛出异常。
     *
     * @param plan 执行计划
     * @param args 按计划顺序排列的参数
     * @throws SeriesException 参数类型错误或步长越界
     */
    public void filter(SeriesPlan plan, List<SqlValue> args) throws SeriesException {
        eof = true;
        seed(resolver.resolve(plan, args));
    }

    /**
     * 从已经解析好的范围开始枚举
     */
    public void seed(ResolvedRange range) {
        if (range.isEmpty()) {
            eof = true;
            log.debug("Cursor seeded with empty range");
            return;
        }
        value = range.getStart();
        stop = range.getStop();
        signedStep = range.getSignedStep();
        step = range.getStep();
        base = range.getBase();
        eof = false;
    }

    public boolean isEof() {
        return eof;
    }

    /**
     * 前进到下一个值
     */
    public void next() {
        if (eof) {
            return;
        }
        if (value == stop) {
            eof = true;
        } else {
            value += signedStep;
        }
    }

    /**
     * 读取当前行的某一列
     *
     * @return 列值，游标已结束时返回 null
     */
    public Long column(Column column) {
        if (eof) {
            return null;
        }
        switch (column) {
            case ROWID:
            case VALUE:
                return value;
            case STEP:
                return step;
            case BASE:
                return base;
            default:
                throw new IllegalArgumentException("Unknown column: " + column);
        }
    }

    /**
     * 行号，与 value 相同
     */
    public long rowid() {
        return value;
    }
}
