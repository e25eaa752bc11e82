package com.minizeries.executor.cursor;

import com.minizeries.executor.resolver.ResolvedRange;
import com.minizeries.executor.resolver.SeriesException;
import com.minizeries.executor.resolver.SqlValue;
import com.minizeries.optimizer.planner.Column;
import com.minizeries.optimizer.planner.SeriesPlan;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 序列游标测试
 *
 * @author Mini-Zeries
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class SeriesCursorTest {

    private SeriesCursor cursor;

    @BeforeEach
    void setUp() {
        cursor = new SeriesCursor();
    }

    /**
     * 新游标处于结束状态
     */
    @Test
    @Order(1)
    void testNewCursorIsEof() {
        assertTrue(cursor.isEof());
        assertNull(cursor.column(Column.VALUE));
        cursor.next();
        assertTrue(cursor.isEof());
    }

    /**
     * 每一行都带有生效的 step / base
     */
    @Test
    @Order(2)
    void testColumns() {
        cursor.seed(ResolvedRange.of(4, 10, 3, -3, 1));

        assertEquals(4L, cursor.column(Column.VALUE));
        assertEquals(4L, cursor.column(Column.ROWID));
        assertEquals(-3L, cursor.column(Column.STEP));
        assertEquals(1L, cursor.column(Column.BASE));

        cursor.next();
        assertEquals(7L, cursor.column(Column.VALUE));
        cursor.next();
        assertEquals(10L, cursor.column(Column.VALUE));
        cursor.next();
        assertTrue(cursor.isEof());
        assertNull(cursor.column(Column.STEP));
    }

    /**
     * 在 Long.MAX_VALUE 上停止而不溢出
     */
    @Test
    @Order(3)
    void testStopsAtMaxWithoutOverflow() {
        cursor.seed(ResolvedRange.of(Long.MAX_VALUE - 2, Long.MAX_VALUE, 1, 1, 0));

        List<Long> values = new ArrayList<>();
        while (!cursor.isEof()) {
            values.add(cursor.rowid());
            cursor.next();
        }

        assertEquals(Arrays.asList(Long.MAX_VALUE - 2, Long.MAX_VALUE - 1, Long.MAX_VALUE), values);
    }

    /**
     * filter() 重新开始一次执行
     */
    @Test
    @Order(4)
    void testFilterRestarts() throws SeriesException {
        SeriesPlan plan = new SeriesPlan(1, "hg", 1.0, true,
                Arrays.asList(new SeriesPlan.ConstraintUsage(1, true), new SeriesPlan.ConstraintUsage(2, true)));
        List<SqlValue> args = Arrays.asList(SqlValue.ofLong(1), SqlValue.ofLong(3));

        cursor.filter(plan, args);
        assertEquals(3L, cursor.column(Column.VALUE));
        cursor.next();
        cursor.next();
        cursor.next();
        assertTrue(cursor.isEof());

        cursor.filter(plan, args);
        assertFalse(cursor.isEof());
        assertEquals(3L, cursor.column(Column.VALUE));
    }

    /**
     * 解析失败时游标保持结束状态
     */
    @Test
    @Order(5)
    void testFilterErrorLeavesCursorAtEof() {
        cursor.seed(ResolvedRange.of(1, 5, 1, 1, 0));
        SeriesPlan plan = new SeriesPlan(0, "c", 1.0, false,
                Collections.singletonList(new SeriesPlan.ConstraintUsage(1, true)));

        assertThrows(SeriesException.class,
                () -> cursor.filter(plan, Collections.singletonList(SqlValue.ofLong(0))));
        assertTrue(cursor.isEof());
    }

    /**
     * 空范围
     */
    @Test
    @Order(6)
    void testEmptyRange() {
        cursor.seed(ResolvedRange.EMPTY);
        assertTrue(cursor.isEof());
    }
}
