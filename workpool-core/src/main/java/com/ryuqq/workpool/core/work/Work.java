package com.ryuqq.workpool.core.work;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Worker에게 전달되는 작업 단위.
 *
 * <p>Work는 이름 붙은 파라미터의 불변 묶음입니다. 호출자가 제출 전에 한 번 생성하고,
 * 배정된 Worker 하나만 읽으며, Worker 호출이 끝나면 버려집니다.</p>
 *
 * <p><strong>접근자 규칙:</strong></p>
 * <ul>
 *   <li>없는 키: zero value 반환 (Optional.empty / "" / false / 0)</li>
 *   <li>타입 불일치: {@link WorkValue}의 best-effort 변환 (예: true의 정수 view는 1)</li>
 *   <li>어떤 접근자도 예외를 던지지 않음</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Work work = Work.of(Map.of("Hello", "World", "Truth", true, "The Answer", 42));
 *
 * work.getString("Hello");      // "World"
 * work.getBool("Truth");        // true
 * work.getInt("The Answer");    // 42
 * work.getString("The Answer"); // "42"
 * work.getInt("Truth");         // 1
 * work.getBool("Hello");        // false
 * work.get("Missing");          // Optional.empty()
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 시 전달된 Map을 복사하므로 원본 Map 변경의 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Work {

    private static final Work EMPTY = new Work(Collections.emptyMap());

    private final Map<String, Object> params;

    private Work(Map<String, Object> params) {
        this.params = params;
    }

    /**
     * Work 생성.
     *
     * @param params 파라미터 (null 허용, null 값 허용)
     * @return Work 인스턴스
     */
    public static Work of(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return EMPTY;
        }
        return new Work(Collections.unmodifiableMap(new LinkedHashMap<>(params)));
    }

    /**
     * 파라미터 없는 Work.
     *
     * @return 빈 Work 인스턴스
     */
    public static Work empty() {
        return EMPTY;
    }

    /**
     * 원본 값 조회.
     *
     * @param key 파라미터 이름
     * @return 원본 값, 없거나 null이면 Optional.empty()
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(params.get(key));
    }

    /**
     * 값 조회 (variant).
     *
     * @param key 파라미터 이름
     * @return WorkValue, 없으면 {@link Absent}
     */
    public WorkValue value(String key) {
        return WorkValue.of(params.get(key));
    }

    /**
     * 문자열 view.
     *
     * @param key 파라미터 이름
     * @return 변환된 문자열, 없으면 ""
     */
    public String getString(String key) {
        return value(key).asString();
    }

    /**
     * 불리언 view.
     *
     * @param key 파라미터 이름
     * @return 변환된 불리언, 없으면 false
     */
    public boolean getBool(String key) {
        return value(key).asBool();
    }

    /**
     * 정수 view.
     *
     * @param key 파라미터 이름
     * @return 변환된 정수, 없으면 0
     */
    public int getInt(String key) {
        return value(key).asInt();
    }

    /**
     * long 정수 view.
     *
     * @param key 파라미터 이름
     * @return 변환된 정수, 없으면 0
     */
    public long getLong(String key) {
        return value(key).asLong();
    }

    public boolean containsKey(String key) {
        return params.containsKey(key);
    }

    public Set<String> keys() {
        return params.keySet();
    }

    public int size() {
        return params.size();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Work work = (Work) o;
        return params.equals(work.params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return "Work{keys=" + params.keySet() + '}';
    }
}
