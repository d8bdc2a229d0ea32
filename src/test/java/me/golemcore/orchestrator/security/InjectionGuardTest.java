package me.golemcore.orchestrator.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InjectionGuardTest {

    private InjectionGuard guard;

    @BeforeEach
    void setUp() {
        guard = new InjectionGuard();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Necesito renovar mi licencia de conducción",
            "¿Cuál es el estado del trámite 12345?",
            "Quiero saber más sobre el programa de adulto mayor",
            "Gracias por la ayuda, hasta luego"
    })
    void shouldAcceptOrdinaryCitizenMessages(String text) {
        assertTrue(guard.isSafe(text));
    }

    @Test
    void shouldTreatNullAndBlankAsSafe() {
        assertTrue(guard.isSafe(null));
        assertTrue(guard.isSafe("   "));
        assertTrue(guard.detectThreats(null).isEmpty());
    }

    @Test
    void shouldDetectScriptInjection() {
        assertEquals(List.of("script_injection"), guard.detectThreats("<script>alert('x')</script>"));
        assertEquals(List.of("script_injection"), guard.detectThreats("click JavaScript:void(0)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1 UNION SELECT password FROM users",
            "DROP TABLE sessions",
            "abc; truncate logs",
            "admin' OR 1=1"
    })
    void shouldDetectSqlInjection(String text) {
        assertTrue(guard.detectThreats(text).contains("sql_injection"));
        assertFalse(guard.isSafe(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "eval(payload)",
            "exec (cmd)",
            "ok; rm -rf /",
            "cat file | bash"
    })
    void shouldDetectCodeInjection(String text) {
        assertTrue(guard.detectThreats(text).contains("code_injection"));
    }

    @Test
    void shouldDetectPathTraversal() {
        assertEquals(List.of("path_traversal"), guard.detectThreats("../../secrets"));
        assertEquals(List.of("path_traversal"), guard.detectThreats("%2E%2E%2Fconfig"));
        assertEquals(List.of("path_traversal"), guard.detectThreats("show /etc/passwd"));
    }

    @Test
    void shouldReportEachCategoryOnceInStableOrder() {
        List<String> threats = guard.detectThreats("../x <script> eval( union all select");

        assertEquals(List.of("script_injection", "sql_injection", "code_injection", "path_traversal"), threats);
    }
}
