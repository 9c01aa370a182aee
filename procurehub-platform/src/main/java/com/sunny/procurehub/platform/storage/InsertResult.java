package com.sunny.procurehub.platform.storage;

/**
 * 唯一约束插入结果
 * conflict 时携带冲突的约束名，由调用方决定回放或报错
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record InsertResult(boolean wasInserted, String conflictConstraint) {

    private static final InsertResult INSERTED = new InsertResult(true, null);

    public static InsertResult inserted() {
        return INSERTED;
    }

    public static InsertResult conflict(String constraintName) {
        return new InsertResult(false, constraintName);
    }

    public boolean conflicted() {
        return !wasInserted;
    }
}
