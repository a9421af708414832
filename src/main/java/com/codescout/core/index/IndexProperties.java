package com.codescout.core.index;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "codescout.index")
public class IndexProperties {

    private List<String> ignorePatterns = new ArrayList<>(List.of(
            ".git/", ".hg/", ".svn/", ".idea/", ".vscode/", ".vs/", ".gradle/", ".mvn/",
            "node_modules/", "__pycache__/", ".venv/", "venv/", ".tox/", ".pytest_cache/", ".mypy_cache/",
            "target/", "build/", "dist/", "out/", "bin/", "obj/", ".next/", "htmlcov/", "packages/",
            "TestResults/", "*.egg-info", "*.pyc", "*.class", "*.dll", "*.exe", "*.pdb", "*.nupkg",
            "*.log", "*.cache", ".coverage", ".DS_Store", "Thumbs.db"
    ));

    private boolean respectGitignore = true;

    /** Files larger than this are listed in the tree but not parsed. */
    private long maxFileBytes = 1024 * 1024;

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public void setIgnorePatterns(List<String> ignorePatterns) {
        this.ignorePatterns = ignorePatterns;
    }

    public boolean isRespectGitignore() {
        return respectGitignore;
    }

    public void setRespectGitignore(boolean respectGitignore) {
        this.respectGitignore = respectGitignore;
    }

    public long getMaxFileBytes() {
        return maxFileBytes;
    }

    public void setMaxFileBytes(long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }
}
