package com.ryuqq.workpool.core.work;

import java.math.BigDecimal;

/**
 * 실수 값.
 *
 * <p>asString은 불필요한 소수점 0을 제거합니다 (42.0 → "42", 3.50 → "3.5").
 * asLong은 소수점 이하를 버리고, long 범위를 벗어나거나 NaN이면 0입니다.</p>
 *
 * @param value 실수 (double로 보관)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Decimal(double value) implements WorkValue {

    @Override
    public Object raw() {
        return value;
    }

    @Override
    public String asString() {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean asBool() {
        return value != 0;
    }

    @Override
    public long asLong() {
        if (Double.isNaN(value) || value < (double) Long.MIN_VALUE || value >= -(double) Long.MIN_VALUE) {
            return 0L;
        }
        return (long) value;
    }
}
