package com.codescout.core.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReviewRequestTest {

    @Test
    @DisplayName("null status groups and null paths are dropped")
    void normalizesChangedFiles() {
        Map<String, List<String>> changed = new LinkedHashMap<>();
        changed.put("modified", null);
        changed.put("added", Arrays.asList("a.py", null, " "));

        ReviewRequest request = ReviewRequest.of(Path.of("/work/app"), "feature", changed);

        assertEquals(List.of(), request.changedFiles().get("modified"));
        assertEquals(List.of("a.py"), request.changedFiles().get("added"));
        assertEquals(List.of("a.py"), request.allChangedPaths());
    }

    @Test
    @DisplayName("null diffs are dropped and null maps become empty")
    void normalizesDiffs() {
        Map<String, String> diffs = new HashMap<>();
        diffs.put("a.py", null);
        diffs.put("b.py", "@@ -1 +1 @@");

        ReviewRequest request = new ReviewRequest(Path.of("/work/app"), null, null, diffs,
                false, null, null, null, null);

        assertTrue(request.changedFiles().isEmpty());
        assertTrue(request.allChangedPaths().isEmpty());
        assertEquals(Map.of("b.py", "@@ -1 +1 @@"), request.diffs());
    }
}
