package com.ryuqq.workpool.core.work;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Work 파라미터 하나의 값.
 *
 * <p>Work는 호출자가 넘긴 임의의 값을 담기 때문에, 값의 종류를 variant로 구분하고
 * 각 variant가 문자열/불리언/정수 view로의 best-effort 변환을 직접 구현합니다.</p>
 *
 * <ul>
 *   <li>{@link Absent}: 키가 없거나 값이 null</li>
 *   <li>{@link Text}: 문자열 (CharSequence, Character, long 범위를 벗어난 BigInteger)</li>
 *   <li>{@link Flag}: 불리언</li>
 *   <li>{@link Whole}: 정수형 숫자 (Byte, Short, Integer, Long, long 범위의 BigInteger, Atomic*)</li>
 *   <li>{@link Decimal}: 실수형 숫자 (Float, Double, BigDecimal)</li>
 *   <li>{@link Opaque}: 그 외 모든 객체</li>
 * </ul>
 *
 * <p><strong>변환 규칙:</strong> 어떤 변환도 예외를 던지지 않습니다.
 * 변환할 수 없으면 해당 타입의 zero value("", false, 0)를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface WorkValue permits Absent, Text, Flag, Whole, Decimal, Opaque {

    /**
     * 원본 값을 variant로 감쌉니다.
     *
     * @param raw 원본 값 (null 허용)
     * @return 원본 값에 대응하는 WorkValue
     */
    static WorkValue of(Object raw) {
        if (raw == null) {
            return Absent.INSTANCE;
        }
        if (raw instanceof WorkValue value) {
            return value;
        }
        if (raw instanceof Boolean flag) {
            return new Flag(flag);
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return new Text(raw.toString());
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long
            || raw instanceof AtomicInteger || raw instanceof AtomicLong) {
            return new Whole(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? new Whole(big.longValue()) : new Text(big.toString());
        }
        if (raw instanceof Float single) {
            return new Decimal(Double.parseDouble(Float.toString(single)));
        }
        if (raw instanceof Double || raw instanceof BigDecimal) {
            return new Decimal(((Number) raw).doubleValue());
        }
        return new Opaque(raw);
    }

    /**
     * 원본 값 조회.
     *
     * @return 원본 값 ({@link Absent}이면 null)
     */
    Object raw();

    /**
     * 문자열 view.
     *
     * @return 값의 텍스트 표현, 값이 없으면 빈 문자열
     */
    String asString();

    /**
     * 불리언 view.
     *
     * @return 변환된 불리언, 변환 불가 시 false
     */
    boolean asBool();

    /**
     * 정수 view (long).
     *
     * @return 변환된 정수, 변환 불가 시 0
     */
    long asLong();

    /**
     * 정수 view (int).
     *
     * @return {@link #asLong()}이 int 범위 안이면 그 값, 범위를 벗어나면 0
     */
    default int asInt() {
        long value = asLong();
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return 0;
        }
        return (int) value;
    }

    /**
     * 값이 존재하는지 확인.
     *
     * @return {@link Absent}가 아니면 true
     */
    default boolean isPresent() {
        return !(this instanceof Absent);
    }
}
