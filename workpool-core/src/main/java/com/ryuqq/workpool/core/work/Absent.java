package com.ryuqq.workpool.core.work;

/**
 * 값 없음.
 *
 * <p>모든 view가 zero value를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Absent implements WorkValue {

    static final Absent INSTANCE = new Absent();

    private Absent() {
    }

    @Override
    public Object raw() {
        return null;
    }

    @Override
    public String asString() {
        return "";
    }

    @Override
    public boolean asBool() {
        return false;
    }

    @Override
    public long asLong() {
        return 0L;
    }

    @Override
    public String toString() {
        return "Absent";
    }
}
