package me.golemcore.orchestrator.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Denylist check for inbound text and identifiers.
 *
 * <p>
 * Detects:
 * <ul>
 * <li>Script injection - {@code <script>} tags and {@code javascript:} URLs</li>
 * <li>SQL injection - {@code UNION ... SELECT}, {@code DROP TABLE} and
 * tautologies</li>
 * <li>Code and command injection - {@code exec(}, {@code eval(} and shell
 * pipelines</li>
 * <li>Path traversal - {@code ../} sequences and well-known system files</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InjectionGuard {

    private static final Map<String, List<Pattern>> THREAT_PATTERNS = Map.of(
            "script_injection", List.of(
                    Pattern.compile("<script.*?>", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE)),
            "sql_injection", List.of(
                    Pattern.compile("union.*select", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("drop\\s+table", Pattern.CASE_INSENSITIVE),
                    Pattern.compile(";\\s*(drop|truncate)\\b", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("'\\s*or\\s+1\\s*=\\s*1", Pattern.CASE_INSENSITIVE)),
            "code_injection", List.of(
                    Pattern.compile("exec\\s*\\(", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("eval\\s*\\(", Pattern.CASE_INSENSITIVE),
                    Pattern.compile(";\\s*(rm|mkfs)\\s", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("\\|\\s*(sh|bash|powershell)\\b", Pattern.CASE_INSENSITIVE)),
            "path_traversal", List.of(
                    Pattern.compile("\\.\\./"),
                    Pattern.compile("%2e%2e%2f", Pattern.CASE_INSENSITIVE),
                    Pattern.compile("/etc/passwd", Pattern.CASE_INSENSITIVE)));

    private static final List<String> THREAT_ORDER = List.of(
            "script_injection", "sql_injection", "code_injection", "path_traversal");

    /**
     * Check that the input matches none of the denylisted patterns. Null and
     * blank input is considered safe.
     */
    public boolean isSafe(String input) {
        return detectThreats(input).isEmpty();
    }

    /**
     * Detect every threat category present in the input.
     *
     * @return threat categories in a stable order, empty if none
     */
    public List<String> detectThreats(String input) {
        List<String> threats = new ArrayList<>();
        if (input == null || input.isBlank()) {
            return threats;
        }

        for (String threat : THREAT_ORDER) {
            for (Pattern pattern : THREAT_PATTERNS.get(threat)) {
                if (pattern.matcher(input).find()) {
                    log.warn("[Security] {} detected: pattern={}", threat, pattern.pattern());
                    threats.add(threat);
                    break;
                }
            }
        }
        return threats;
    }
}
