package com.ryuqq.workpool.core.work;

/**
 * 정수 값.
 *
 * @param value 정수 (long으로 넓혀서 보관)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Whole(long value) implements WorkValue {

    @Override
    public Object raw() {
        return value;
    }

    @Override
    public String asString() {
        return Long.toString(value);
    }

    @Override
    public boolean asBool() {
        return value != 0;
    }

    @Override
    public long asLong() {
        return value;
    }
}
