package io.hivemesh.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() {
        Map<String, Object> context = Map.of(
                "repo", "core",
                "DB_PASSWORD", "hunter2",
                "nested", Map.of("apiKey", "x", "region", "eu"),
                "hooks", List.of(Map.of("authorization", "Bearer y"))
        );

        Map<String, Object> masked = SensitiveDataMasker.mask(context);

        Assertions.assertEquals("core", masked.get("repo"));
        Assertions.assertEquals("***", masked.get("DB_PASSWORD"));
        Assertions.assertEquals(Map.of("apiKey", "***", "region", "eu"), masked.get("nested"));
        Assertions.assertEquals(List.of(Map.of("authorization", "***")), masked.get("hooks"));
    }

    @Test
    void masksOpaqueTokensAndUriPasswords() {
        Map<String, Object> masked = SensitiveDataMasker.mask(Map.of(
                "blob", "ZXlKaGJHY2lPaUpJVXpJMU5pSjkuZXlKemRXSWlPaUl4TWpNME5UWTNPRGt3SW4w",
                "broker", "use amqp://svc:p4ss@mq:5672 please"
        ));

        Assertions.assertEquals("***", masked.get("blob"));
        Assertions.assertEquals("use amqp://svc:***@mq:5672 please", masked.get("broker"));
    }

    @Test
    void nullAndEmptyBecomeEmpty() {
        Assertions.assertTrue(SensitiveDataMasker.mask(null).isEmpty());
        Assertions.assertNull(SensitiveDataMasker.maskText(null));
    }
}
