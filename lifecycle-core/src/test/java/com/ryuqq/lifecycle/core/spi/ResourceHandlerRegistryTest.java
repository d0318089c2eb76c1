package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.model.ResourceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;

/**
 * ResourceHandlerRegistry 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceHandlerRegistryTest {

    private static final ResourceType STACK = ResourceType.of("OS::Heat::Stack");

    @Mock
    private ResourceHandler handler;

    @Test
    void resolve_등록된_핸들러를_돌려준다() {
        // given
        ResourceHandlerRegistry registry = new ResourceHandlerRegistry().register(STACK, handler);

        // when & then
        assertThat(registry.resolve(STACK)).isSameAs(handler);
        assertThat(registry.contains(STACK)).isTrue();
        assertThat(registry.types()).containsExactly(STACK);
    }

    @Test
    void register_중복_등록은_IllegalStateException() {
        ResourceHandlerRegistry registry = new ResourceHandlerRegistry().register(STACK, handler);

        assertThatThrownBy(() -> registry.register(STACK, handler)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolve_미등록_유형은_IllegalArgumentException() {
        ResourceHandlerRegistry registry = new ResourceHandlerRegistry();

        assertThatThrownBy(() -> registry.resolve(ResourceType.of("OS::Neutron::Firewall")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No handler registered");
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void replacementProperties_기본값은_빈_Set() {
        ResourceHandler plain = mock(ResourceHandler.class, CALLS_REAL_METHODS);

        assertThat(plain.replacementProperties()).isEmpty();
    }
}
