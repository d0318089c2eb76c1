package com.ryuqq.lifecycle.core.model;

/**
 * 템플릿 상의 리소스 논리 이름.
 *
 * <p>ResourceName은 하나의 스택 안에서 리소스를 구분하며,
 * 실패 메시지와 로그에서 리소스를 가리키는 데 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ResourceName.of("remote_stack")</li>
 *   <li>ResourceName.of("web_firewall")</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 불가</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ResourceName {

    private final String value;

    private ResourceName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ResourceName length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("ResourceName cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * ResourceName 생성.
     *
     * @param value 리소스 이름
     * @return ResourceName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceName of(String value) {
        return new ResourceName(value);
    }

    /**
     * ResourceName 값 조회.
     *
     * @return 리소스 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceName that = (ResourceName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
