package com.bluxguard.core.token;

import com.bluxguard.core.util.JsonSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StaticTokenAuthority 单元测试")
class StaticTokenAuthorityTest {

    @Test
    @DisplayName("登记的令牌有效并解析出 token_ref")
    void trustedTokenIsValid() {
        try (CapabilityTokenVerifier verifier = new CapabilityTokenVerifier(
                new StaticTokenAuthority(Map.of("tok-1", "cap-ref-1")), Duration.ofSeconds(1))) {
            TokenCheck check = verifier.check(List.of("tok-1"), List.of());

            assertTrue(check.isValid());
            assertEquals("cap-ref-1", check.getTokenRef());
        }
    }

    @Test
    @DisplayName("未登记的令牌无效")
    void unknownTokenIsInvalid() {
        try (CapabilityTokenVerifier verifier = new CapabilityTokenVerifier(
                new StaticTokenAuthority(), Duration.ofSeconds(1))) {
            TokenCheck check = verifier.check(List.of("nope"), List.of());

            assertFalse(check.isValid());
            assertEquals(List.of(TokenReasons.INVALID), check.getReasonCodes());
        }
    }

    @Test
    @DisplayName("可为令牌指定完整应答")
    void customResponse() {
        StaticTokenAuthority authority = new StaticTokenAuthority().respond("tok-2",
                JsonSupport.mapper().createObjectNode().put("state", "active").put("id", "cap-2")
                        .put("reason_codes", "token.scoped"));
        try (CapabilityTokenVerifier verifier = new CapabilityTokenVerifier(authority, Duration.ofSeconds(1))) {
            TokenCheck check = verifier.check(List.of("tok-2"), List.of());

            assertTrue(check.isValid());
            assertEquals("cap-2", check.getTokenRef());
            assertEquals(List.of("token.scoped"), check.getReasonCodes());
        }
    }
}
