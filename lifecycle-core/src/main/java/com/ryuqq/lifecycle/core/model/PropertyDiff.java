package com.ryuqq.lifecycle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * UPDATE 시 변경된 속성만 담은 차이(diff).
 *
 * <p>어떤 속성이 바뀌었는지 계산하는 일은 호출자(템플릿 비교 계층)의 책임이며,
 * 엔진은 전달받은 diff를 백엔드 update 호출에 넘기고
 * 교체(replacement)가 필요한 키가 포함되어 있는지만 검사합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 방어적 복사</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class PropertyDiff {

    private static final PropertyDiff EMPTY = new PropertyDiff(Map.of());

    private final Map<String, Object> changes;

    private PropertyDiff(Map<String, Object> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : changes.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("property name cannot be null or blank");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.changes = Collections.unmodifiableMap(copy);
    }

    /**
     * PropertyDiff 생성.
     *
     * @param changes 변경된 속성 이름과 새 값
     * @return PropertyDiff 인스턴스
     * @throws IllegalArgumentException changes가 null이거나 키가 유효하지 않은 경우
     */
    public static PropertyDiff of(Map<String, Object> changes) {
        return new PropertyDiff(changes);
    }

    /**
     * 변경 없음.
     *
     * @return 빈 PropertyDiff
     */
    public static PropertyDiff empty() {
        return EMPTY;
    }

    /**
     * 변경된 속성 이름 목록.
     *
     * @return 수정 불가 Set
     */
    public Set<String> changedNames() {
        return changes.keySet();
    }

    /**
     * 변경 내용 조회.
     *
     * @return 수정 불가 Map
     */
    public Map<String, Object> asMap() {
        return changes;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyDiff that = (PropertyDiff) o;
        return changes.equals(that.changes);
    }

    @Override
    public int hashCode() {
        return changes.hashCode();
    }

    @Override
    public String toString() {
        return "PropertyDiff{" + changes.keySet() + '}';
    }
}
