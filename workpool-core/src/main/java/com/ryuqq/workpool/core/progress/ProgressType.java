package com.ryuqq.workpool.core.progress;

/**
 * Progress의 태그.
 *
 * <p>알려진 태그는 다섯 개이지만, 태그 자체는 작은 정수입니다.
 * 알 수 없는 값도 {@link #of(int)}로 만들 수 있고, 그 경우 {@link #displayName()}은 빈 문자열입니다.
 * enum 대신 정수 기반 값 객체를 쓰는 이유는 호출자 고유의 태그를 거부하지 않기 위해서입니다.</p>
 *
 * <table>
 *   <caption>알려진 태그</caption>
 *   <tr><th>code</th><th>상수</th><th>displayName</th><th>payload</th></tr>
 *   <tr><td>0</td><td>ERROR</td><td>ProgressError</td><td>Throwable</td></tr>
 *   <tr><td>1</td><td>UPDATE</td><td>ProgressUpdate</td><td>Long (증감량)</td></tr>
 *   <tr><td>2</td><td>ESTIMATE</td><td>ProgressEstimate</td><td>Long (전체 작업량 추정치)</td></tr>
 *   <tr><td>3</td><td>MESSAGE</td><td>ProgressMessage</td><td>String</td></tr>
 *   <tr><td>4</td><td>OTHER</td><td>ProgressOther</td><td>임의 객체 (해석하지 않음)</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressType {

    public static final ProgressType ERROR = new ProgressType(0, "ProgressError");
    public static final ProgressType UPDATE = new ProgressType(1, "ProgressUpdate");
    public static final ProgressType ESTIMATE = new ProgressType(2, "ProgressEstimate");
    public static final ProgressType MESSAGE = new ProgressType(3, "ProgressMessage");
    public static final ProgressType OTHER = new ProgressType(4, "ProgressOther");

    private static final ProgressType[] KNOWN = {ERROR, UPDATE, ESTIMATE, MESSAGE, OTHER};

    private final int code;
    private final String displayName;

    private ProgressType(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * 코드로 태그 조회.
     *
     * <p>알려진 코드는 상수 인스턴스를, 그 외에는 이름 없는 태그를 반환합니다.</p>
     *
     * @param code 태그 코드
     * @return ProgressType 인스턴스
     */
    public static ProgressType of(int code) {
        if (code >= 0 && code < KNOWN.length) {
            return KNOWN[code];
        }
        return new ProgressType(code, "");
    }

    public int code() {
        return code;
    }

    /**
     * 태그 이름.
     *
     * @return 알려진 태그면 "ProgressError" 등의 이름, 아니면 ""
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 알려진 다섯 태그 중 하나인지 확인.
     *
     * @return 알려진 태그면 true
     */
    public boolean isKnown() {
        return !displayName.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return code == ((ProgressType) o).code;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(code);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
