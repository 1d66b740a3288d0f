package com.bulwark.core.pattern;

import com.bulwark.core.check.CheckRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternMatcherTest {

    @Test
    @DisplayName("matches case-insensitively")
    void matchesIgnoringCase() {
        var rules = List.of(Rule.of("log.*password", "Password in logs", 2));
        assertEquals(List.of("Password in logs"),
                PatternMatcher.matchLabels("LOG::info!(\"PASSWORD was {}\")", rules));
    }

    @Test
    @DisplayName("safe marker anywhere in the content suppresses the rule")
    void safeMarkerSuppresses() {
        String content = """
                const token = "abcdefghijklmnopqrstuvwxyz";
                const other = process.env.OTHER;
                """;
        assertTrue(PatternMatcher.match(content, CheckRules.SECRET_RULES).isEmpty());
    }

    @Test
    @DisplayName("without the marker the secret rule fires")
    void secretRuleFires() {
        var matched = PatternMatcher.match("token = \"abcdefghijklmnopqrstuvwxyz\"", CheckRules.SECRET_RULES);
        assertEquals(1, matched.size());
        assertEquals("Hardcoded token", matched.get(0).description());
        assertEquals(3, matched.get(0).weight());
    }

    @Test
    @DisplayName("short literals stay below the length threshold")
    void shortLiteralIgnored() {
        assertTrue(PatternMatcher.match("password = \"short\"", CheckRules.SECRET_RULES).isEmpty());
    }

    @Test
    @DisplayName("each rule is reported at most once and in rule order")
    void ruleOrderAndOncePerRule() {
        String content = """
                println!("password: {}", p);
                log::debug!("token {}", t);
                log::debug!("password again {}", p);
                """;
        assertEquals(List.of("Password in logs", "Token in logs", "Password in Rust logs"),
                PatternMatcher.matchLabels(content, CheckRules.LOGGING_RULES));
    }

    @Test
    @DisplayName("null and empty content match nothing")
    void emptyContent() {
        assertTrue(PatternMatcher.match(null, CheckRules.LOGGING_RULES).isEmpty());
        assertTrue(PatternMatcher.match("", CheckRules.LOGGING_RULES).isEmpty());
    }
}
