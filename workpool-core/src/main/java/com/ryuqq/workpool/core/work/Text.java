package com.ryuqq.workpool.core.work;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.math.BigDecimal;

/**
 * 문자열 값.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>asBool: 숫자로 해석되면 0이 아닌지, 아니면 true/false/yes/no/on/off/t/f/y/n 해석</li>
 *   <li>asLong: 10진수, 0x 16진수, 0 접두 8진수, 소수점 이하는 버림. long 범위를 벗어나면 0</li>
 * </ul>
 *
 * @param value 문자열 (null 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Text(String value) implements WorkValue {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Text {
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
        return value;
    }

    @Override
    public boolean asBool() {
        String trimmed = StringUtils.trim(value);
        Number number = parseNumber(trimmed);
        if (number != null) {
            return number.doubleValue() != 0;
        }
        return BooleanUtils.toBoolean(trimmed);
    }

    @Override
    public long asLong() {
        Number number = parseNumber(StringUtils.trim(value));
        return number == null ? 0L : toLongOrZero(number);
    }

    private static long toLongOrZero(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return number.longValue();
        }
        if ((number instanceof Float || number instanceof Double)
            && (Double.isNaN(number.doubleValue()) || Double.isInfinite(number.doubleValue()))) {
            return 0L;
        }
        BigDecimal decimal = new BigDecimal(number.toString());
        if (decimal.compareTo(LONG_MIN) < 0 || decimal.compareTo(LONG_MAX) > 0) {
            return 0L;
        }
        return decimal.longValue();
    }

    private static Number parseNumber(String candidate) {
        if (!NumberUtils.isCreatable(candidate)) {
            return null;
        }
        try {
            return NumberUtils.createNumber(candidate);
        } catch (NumberFormatException e) {
            // isCreatable과 createNumber의 허용 범위가 다른 경계값 (예: 범위 초과 지수)
            return null;
        }
    }
}
