package com.minizeries.optimizer.planner;

import lombok.Getter;

/**
 * 约束槽位
 *
 * 执行计划中每个被消费的约束对应一个槽位，槽位以单个字母编码进索引字符串:
 * 字母 = 'a' + ordinal()。
 *
 * 前四个是"精确槽位"，只接受整数参数。
 *
 * @author Mini-Zeries
 */
@Getter
public enum ConstraintSlot {

    OFFSET("offset", true),
    LIMIT("limit", true),
    STEP("step", true),
    BASE("base", true),
    EQ("value", false),
    LT("value", false),
    LE("value", false),
    GE("value", false),
    GT("value", false);

    /**
     * 槽位名称（用于错误信息）
     */
    private final String slotName;

    private final boolean exact;

    ConstraintSlot(String slotName, boolean exact) {
        this.slotName = slotName;
        this.exact = exact;
    }

    public char code() {
        return (char) ('a' + ordinal());
    }

    public boolean isUpperBound() {
        return this == LT || this == LE;
    }

    public boolean isLowerBound() {
        return this == GE || this == GT;
    }

    /**
     * 解码索引字符串中的字母
     *
     * @return 对应槽位，无法识别返回 null
     */
    public static ConstraintSlot fromCode(char code) {
        int ordinal = code - 'a';
        ConstraintSlot[] slots = values();
        if (ordinal < 0 || ordinal >= slots.length) {
            return null;
        }
        return slots[ordinal];
    }
}
