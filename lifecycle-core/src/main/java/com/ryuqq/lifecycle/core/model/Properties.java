package com.ryuqq.lifecycle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 리소스 속성 집합.
 *
 * <p>템플릿 조각에서 해석된 속성 값을 담으며, CREATE 시 백엔드에 그대로 전달됩니다.
 * 속성 스키마 검증과 타입 변환은 이 객체를 만들기 전에 끝나 있어야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 방어적 복사, 조회 시 수정 불가 뷰 반환</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>map은 null 불가</li>
 *   <li>키는 null 또는 빈 문자열 불가</li>
 *   <li>값은 null 허용 (명시적으로 비어 있는 속성)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Properties {

    private static final Properties EMPTY = new Properties(Map.of());

    private final Map<String, Object> values;

    private Properties(Map<String, Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("property name cannot be null or blank");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Properties 생성.
     *
     * @param values 속성 이름과 값
     * @return Properties 인스턴스
     * @throws IllegalArgumentException values가 null이거나 키가 유효하지 않은 경우
     */
    public static Properties of(Map<String, Object> values) {
        return new Properties(values);
    }

    /**
     * 빈 Properties.
     *
     * @return 빈 Properties 인스턴스
     */
    public static Properties empty() {
        return EMPTY;
    }

    /**
     * 속성 값 조회.
     *
     * @param name 속성 이름
     * @return 속성 값 (없거나 null이면 empty)
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * 속성 이름 목록.
     *
     * @return 수정 불가 Set
     */
    public Set<String> names() {
        return values.keySet();
    }

    /**
     * 전체 속성 조회.
     *
     * @return 수정 불가 Map
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * 비어 있는지 확인.
     *
     * @return 속성이 하나도 없으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Properties that = (Properties) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Properties{" + values.keySet() + '}';
    }
}
