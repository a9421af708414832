package com.codescout.core.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreRulesTest {

    @Test
    void unanchoredPatternsMatchByName() {
        IgnoreRules rules = IgnoreRules.of(List.of("*.pyc", "__pycache__/"));

        assertTrue(rules.matches("pkg/mod.pyc", false));
        assertTrue(rules.matches("pkg/__pycache__", true));
        assertFalse(rules.matches("pkg/mod.py", false));
    }

    @Test
    void directoryOnlyPatternsSkipFiles() {
        IgnoreRules rules = IgnoreRules.of(List.of("build/"));

        assertTrue(rules.matches("build", true));
        assertFalse(rules.matches("build", false));
    }

    @Test
    void anchoredPatternsMatchFullPath() {
        IgnoreRules rules = IgnoreRules.of(List.of("/docs/*.md"));

        assertTrue(rules.matches("docs/intro.md", false));
        assertFalse(rules.matches("src/docs/intro.md", false));
    }

    @Test
    void lastMatchingRuleWinsAndNegationReincludes() {
        IgnoreRules rules = IgnoreRules.of(List.of("*.log", "!keep.log"));

        assertTrue(rules.matches("debug.log", false));
        assertFalse(rules.matches("keep.log", false));
    }

    @Test
    void commentsBlankLinesAndMalformedGlobsAreSkipped() {
        IgnoreRules rules = IgnoreRules.of(List.of("# comment", "", "[unclosed", "*.tmp"));

        assertTrue(rules.matches("a.tmp", false));
        assertFalse(rules.matches("# comment", false));
    }

    @Test
    void isIgnoredChecksAncestors() {
        IgnoreRules rules = IgnoreRules.of(List.of("node_modules/"));

        assertTrue(rules.isIgnored("web/node_modules/react/index.js", false));
        assertFalse(rules.matches("web/node_modules/react/index.js", false));
        assertFalse(rules.isIgnored("web/src/index.js", false));
    }

    @Test
    void equalityFollowsPatterns() {
        assertEquals(IgnoreRules.of(List.of("a", "b")), IgnoreRules.of(List.of("a", "b")));
        assertNotEquals(IgnoreRules.of(List.of("a")), IgnoreRules.of(List.of("b")));
    }
}
