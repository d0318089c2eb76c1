package com.ryuqq.lifecycle.core.model;

import java.util.regex.Pattern;

/**
 * 리소스 유형 이름.
 *
 * <p>ResourceType은 {@link com.ryuqq.lifecycle.core.spi.ResourceHandlerRegistry}의 키로 사용되어,
 * 유형별 {@link com.ryuqq.lifecycle.core.spi.ResourceHandler} 구현체를 선택합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ResourceType.of("OS::Neutron::Firewall")</li>
 *   <li>ResourceType.of("OS::Neutron::FirewallPolicy")</li>
 *   <li>ResourceType.of("OS::Heat::Stack")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 콜론(:), 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ResourceType {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z0-9:._\\-]+$");

    private final String value;

    private ResourceType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ResourceType cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("ResourceType length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ResourceType contains invalid characters. Only alphanumeric, ':', '.', '-' and '_' are allowed");
        }
        this.value = value;
    }

    /**
     * ResourceType 생성.
     *
     * @param value 유형 이름 (예: OS::Neutron::Firewall)
     * @return ResourceType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ResourceType of(String value) {
        return new ResourceType(value);
    }

    /**
     * ResourceType 값 조회.
     *
     * @return 유형 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceType that = (ResourceType) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceType{" + value + '}';
    }
}
