package com.ryuqq.workpool.core.work;

/**
 * 불리언 값.
 *
 * @param value 불리언
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Flag(boolean value) implements WorkValue {

    @Override
    public Object raw() {
        return value;
    }

    @Override
    public String asString() {
        return Boolean.toString(value);
    }

    @Override
    public boolean asBool() {
        return value;
    }

    @Override
    public long asLong() {
        return value ? 1L : 0L;
    }
}
