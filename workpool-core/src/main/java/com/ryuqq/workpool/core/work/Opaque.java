package com.ryuqq.workpool.core.work;

/**
 * 해석하지 않는 임의 객체.
 *
 * <p>asString만 의미 있는 값을 돌려줍니다. Throwable은 메시지를, 그 외에는 toString()을 사용합니다.</p>
 *
 * @param value 원본 객체 (null 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Opaque(Object value) implements WorkValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Opaque {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public Object raw() {
        return value;
    }

    @Override
    public String asString() {
        if (value instanceof Throwable throwable) {
            return String.valueOf(throwable.getMessage());
        }
        return String.valueOf(value);
    }

    @Override
    public boolean asBool() {
        return false;
    }

    @Override
    public long asLong() {
        return 0L;
    }
}
