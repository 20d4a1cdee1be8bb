package com.faultline.core.fingerprint;

import com.faultline.core.model.ErrorSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FingerprintGenerator}.
 */
class FingerprintGeneratorTest {

    private static final List<String> MARKERS = List.of("/gems/", "/vendor/");

    private FingerprintGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new FingerprintGenerator(MARKERS);
    }

    @Test
    @DisplayName("Should produce a 16-character lowercase hex fingerprint")
    void shouldProduceHexFingerprint() {
        String fp = generator.generate(signal("NoMethodError", "undefined method 'x' for nil").build());

        assertThat(fp).hasSize(FingerprintGenerator.FINGERPRINT_LENGTH).matches("[0-9a-f]{16}");
    }

    @Test
    @DisplayName("Should ignore dynamic ids, addresses and line numbers")
    void shouldBeStableAcrossDynamicValues() {
        ErrorSignal first = signal("ActiveRecord::RecordNotFound", "Couldn't find User with 'id'=42")
                .stackFrames("/app/models/user.rb:10:in `find'")
                .build();
        ErrorSignal second = signal("ActiveRecord::RecordNotFound", "Couldn't find User with 'id'=9000")
                .stackFrames("/app/models/user.rb:27:in `find'")
                .build();

        assertThat(generator.generate(first)).isEqualTo(generator.generate(second));
    }

    @Test
    @DisplayName("Should separate tenants with the same error")
    void shouldSeparateTenants() {
        ErrorSignal a = signal("TypeError", "boom").tenantId("acme").build();
        ErrorSignal b = signal("TypeError", "boom").tenantId("globex").build();

        assertThat(generator.generate(a)).isNotEqualTo(generator.generate(b));
    }

    @Test
    @DisplayName("Should separate different controller actions")
    void shouldSeparateActions() {
        ErrorSignal a = signal("TypeError", "boom").controller("Orders").action("create").build();
        ErrorSignal b = signal("TypeError", "boom").controller("Orders").action("update").build();

        assertThat(generator.generate(a)).isNotEqualTo(generator.generate(b));
    }

    @Test
    @DisplayName("Should normalize hex, object inspections, digits and quoted literals")
    void shouldNormalizeMessage() {
        assertThat(FingerprintGenerator.normalizeMessage("at 0x7fff1234 for #<User id: 5>"))
                .isEqualTo("at HEX for #<OBJ>");
        assertThat(FingerprintGenerator.normalizeMessage("order 123 failed after 45ms"))
                .isEqualTo("order N failed after Nms");
        assertThat(FingerprintGenerator.normalizeMessage("key \"abc\" and 'def'"))
                .isEqualTo("key \"\" and ''");
        assertThat(FingerprintGenerator.normalizeMessage(null)).isNull();
    }

    @Test
    @DisplayName("Should pick the first non-library frame without its line number")
    void shouldExtractAppFrame() {
        String frame = generator.extractAppFrame(List.of(
                "/usr/lib/gems/rack/lib/rack.rb:12:in `call'",
                "/app/controllers/orders_controller.rb:88:in `create'",
                "/app/models/order.rb:3"));

        assertThat(frame).isEqualTo("/app/controllers/orders_controller.rb");
    }

    @Test
    @DisplayName("Should return null when every frame belongs to a library")
    void shouldReturnNullForLibraryOnlyTrace() {
        assertThat(generator.extractAppFrame(List.of("/vendor/bundle/x.rb:1"))).isNull();
        assertThat(generator.extractAppFrame(null)).isNull();
    }

    @Test
    @DisplayName("Should use a custom strategy when it returns a key")
    void shouldUseCustomStrategy() {
        FingerprintGenerator custom = new FingerprintGenerator(MARKERS, s -> "custom-" + s.getType());

        assertThat(custom.generate(signal("TypeError", "x").build())).isEqualTo("custom-TypeError");
    }

    @Test
    @DisplayName("Should fall back to the default when the custom strategy fails or is blank")
    void shouldFallBackWhenCustomStrategyFails() {
        ErrorSignal s = signal("TypeError", "x").build();
        String expected = generator.generate(s);

        FingerprintGenerator failing = new FingerprintGenerator(MARKERS, sig -> {
            throw new IllegalStateException("broken");
        });
        FingerprintGenerator blank = new FingerprintGenerator(MARKERS, sig -> " ");

        assertThat(failing.generate(s)).isEqualTo(expected);
        assertThat(blank.generate(s)).isEqualTo(expected);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ErrorSignal.Builder signal(String type, String message) {
        return ErrorSignal.builder().type(type).message(message);
    }
}
