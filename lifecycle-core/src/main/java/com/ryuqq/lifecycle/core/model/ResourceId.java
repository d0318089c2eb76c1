package com.ryuqq.lifecycle.core.model;

/**
 * 백엔드가 발급한 리소스 식별자.
 *
 * <p>ResourceId는 원격 서비스가 create 호출의 응답으로 돌려준 값이며,
 * 엔진은 그 형식을 해석하지 않습니다 (opaque).
 * 이후 update, delete, suspend, resume, probe, show 호출은 모두 이 값으로 대상을 지정합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ResourceId {

    private final String value;

    private ResourceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ResourceId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * ResourceId 생성.
     *
     * @param value 백엔드 식별자
     * @return ResourceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceId of(String value) {
        return new ResourceId(value);
    }

    /**
     * ResourceId 값 조회.
     *
     * @return 백엔드 식별자
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceId that = (ResourceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceId{" + value + '}';
    }
}
