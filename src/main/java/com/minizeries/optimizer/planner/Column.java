package com.minizeries.optimizer.planner;

import com.minizeries.common.Constants;
import lombok.Getter;

/**
 * generate_zeries 的列
 *
 * 对应的表结构:
 * <pre>
 * create table generate_zeries(
 *     value integer,
 *     step integer hidden,
 *     base integer hidden
 * );
 * </pre>
 *
 * ROWID 是 value 的别名。
 *
 * @author Mini-Zeries
 */
@Getter
public enum Column {

    ROWID(-1, Constants.COLUMN_ROWID, true),
    VALUE(0, Constants.COLUMN_VALUE, false),
    STEP(1, Constants.COLUMN_STEP, true),
    BASE(2, Constants.COLUMN_BASE, true);

    /**
     * 列序号（ROWID 为 -1）
     */
    private final int index;

    private final String columnName;

    /**
     * 隐藏列不出现在 SELECT * 中
     */
    private final boolean hidden;

    Column(int index, String columnName, boolean hidden) {
        this.index = index;
        this.columnName = columnName;
        this.hidden = hidden;
    }

    /**
     * 是否为序列值列（value 或 rowid）
     */
    public boolean isValue() {
        return this == VALUE || this == ROWID;
    }

    /**
     * 根据列名查找（不区分大小写）
     *
     * @return 对应的列，找不到返回 null
     */
    public static Column fromName(String name) {
        if (name == null) {
            return null;
        }
        for (Column column : values()) {
            if (column.columnName.equalsIgnoreCase(name)) {
                return column;
            }
        }
        return null;
    }
}
