package com.ryuqq.workpool.core.progress;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Worker가 보내는 진행 상황 보고.
 *
 * <p>태그({@link ProgressType})와 payload의 쌍입니다. 알려진 태그는 payload 타입이 정해져 있고,
 * 생성 시점에 검증합니다. 알 수 없는 태그는 어떤 payload든 허용합니다.</p>
 *
 * <p><strong>생성 예시:</strong></p>
 * <pre>
 * Progress.errorf("failed to fetch %s", url);    // ERROR,    ProgressFailure
 * Progress.error(exception);                     // ERROR,    Throwable 그대로
 * Progress.messagef("fetched %d rows", rows);    // MESSAGE,  String
 * Progress.update(1);                            // UPDATE,   Long
 * Progress.estimate(250);                        // ESTIMATE, Long
 * Progress.other(customPayload);                 // OTHER,    Object
 * </pre>
 *
 * <p><strong>표현:</strong> {@link #render()}는 {@code "<displayName>: <payload>"} 형식이며,
 * 알 수 없는 태그는 이름 부분이 비어 {@code ": payload"}가 됩니다.</p>
 *
 * @param type 태그 (null 불가)
 * @param data payload (OTHER 및 알 수 없는 태그에서만 null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Progress(ProgressType type, Object data) {

    /**
     * Compact Constructor.
     *
     * <p>UPDATE/ESTIMATE의 Integer, Short, Byte payload는 Long으로 넓힙니다.</p>
     *
     * @throws IllegalArgumentException type이 null이거나 payload 타입이 태그와 맞지 않는 경우
     */
    public Progress {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type.equals(ProgressType.ERROR) && !(data instanceof Throwable)) {
            throw new IllegalArgumentException("ProgressError requires a Throwable payload (current: " + describe(data) + ")");
        }
        if (type.equals(ProgressType.UPDATE) || type.equals(ProgressType.ESTIMATE)) {
            if (data instanceof Integer || data instanceof Short || data instanceof Byte) {
                data = ((Number) data).longValue();
            }
            if (!(data instanceof Long)) {
                throw new IllegalArgumentException(type.displayName() + " requires a Long payload (current: " + describe(data) + ")");
            }
        }
        if (type.equals(ProgressType.MESSAGE) && !(data instanceof String)) {
            throw new IllegalArgumentException("ProgressMessage requires a String payload (current: " + describe(data) + ")");
        }
    }

    /**
     * 임의 태그로 생성.
     *
     * @param type 태그
     * @param data payload
     * @return Progress 인스턴스
     * @throws IllegalArgumentException payload 타입이 태그와 맞지 않는 경우
     */
    public static Progress of(ProgressType type, Object data) {
        return new Progress(type, data);
    }

    /**
     * 포맷된 메시지의 ERROR 생성.
     *
     * @param format {@link String#format} 형식
     * @param args 인자
     * @return ERROR Progress ({@link ProgressFailure} payload)
     */
    public static Progress errorf(String format, Object... args) {
        return new Progress(ProgressType.ERROR, new ProgressFailure(String.format(format, args)));
    }

    /**
     * 예외를 그대로 담은 ERROR 생성.
     *
     * @param error 오류
     * @return ERROR Progress
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static Progress error(Throwable error) {
        return new Progress(ProgressType.ERROR, error);
    }

    /**
     * 포맷된 MESSAGE 생성.
     *
     * @param format {@link String#format} 형식
     * @param args 인자
     * @return MESSAGE Progress
     */
    public static Progress messagef(String format, Object... args) {
        return new Progress(ProgressType.MESSAGE, String.format(format, args));
    }

    /**
     * UPDATE 생성 (완료 작업량 증감, 음수 가능).
     *
     * @param delta 증감량
     * @return UPDATE Progress
     */
    public static Progress update(long delta) {
        return new Progress(ProgressType.UPDATE, delta);
    }

    /**
     * ESTIMATE 생성 (전체 작업량 추정치 재평가).
     *
     * @param estimate 추정치
     * @return ESTIMATE Progress
     */
    public static Progress estimate(long estimate) {
        return new Progress(ProgressType.ESTIMATE, estimate);
    }

    /**
     * OTHER 생성 (호출자 고유 consumer 전용 payload).
     *
     * @param payload payload
     * @return OTHER Progress
     */
    public static Progress other(Object payload) {
        return new Progress(ProgressType.OTHER, payload);
    }

    /**
     * ERROR일 때만 오류를 반환.
     *
     * @return ERROR면 payload, 아니면 Optional.empty()
     */
    public Optional<Throwable> asError() {
        if (type.equals(ProgressType.ERROR)) {
            return Optional.of((Throwable) data);
        }
        return Optional.empty();
    }

    /**
     * UPDATE/ESTIMATE일 때만 수치를 반환.
     *
     * @return 수치 payload, 그 외 태그는 OptionalLong.empty()
     */
    public OptionalLong asCount() {
        if (type.equals(ProgressType.UPDATE) || type.equals(ProgressType.ESTIMATE)) {
            return OptionalLong.of((Long) data);
        }
        return OptionalLong.empty();
    }

    /**
     * MESSAGE일 때만 텍스트를 반환.
     *
     * @return 메시지 payload, 그 외 태그는 Optional.empty()
     */
    public Optional<String> asMessage() {
        if (type.equals(ProgressType.MESSAGE)) {
            return Optional.of((String) data);
        }
        return Optional.empty();
    }

    /**
     * {@code "<displayName>: <payload>"} 형식의 텍스트.
     *
     * @return 렌더링된 문자열
     */
    public String render() {
        return type.displayName() + ": " + payloadText();
    }

    @Override
    public String toString() {
        return render();
    }

    private String payloadText() {
        if (data instanceof Throwable throwable) {
            return String.valueOf(throwable.getMessage());
        }
        return String.valueOf(data);
    }

    private static String describe(Object data) {
        return data == null ? "null" : data.getClass().getSimpleName();
    }
}
