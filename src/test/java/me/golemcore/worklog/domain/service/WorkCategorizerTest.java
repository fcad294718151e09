package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.domain.model.ChangedFile;
import me.golemcore.worklog.domain.model.WorkCategory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkCategorizerTest {

    @ParameterizedTest
    @CsvSource({
            "src/components/Login.tsx, frontend",
            "server/handlers/auth.go, backend",
            "src/main/java/App.java, backend",
            "Dockerfile, infrastructure",
            ".github/workflows/ci.yml, infrastructure",
            "db/migrations/001_init.sql, database",
            "README.md, docs",
            "package.json, config",
            "LICENSE, other"
    })
    void shouldAssignFirstMatchingCategory(String file, String expected) {
        assertEquals(expected, WorkCategorizer.categoryOf(file));
    }

    @Test
    void shouldPreferEarlierCategoryOnOverlap() {
        // a .ts test file matches frontend before tests
        assertEquals("frontend", WorkCategorizer.categoryOf("src/auth.test.ts"));
        assertEquals("tests", WorkCategorizer.categoryOf("tests/fixtures/data.bin"));
    }

    @Test
    void shouldComputeRoundedPercentagesLargestFirst() {
        List<WorkCategory> categories = WorkCategorizer.categorize(
                List.of("a.tsx", "b.tsx", "c.go"));

        assertEquals(2, categories.size());
        assertEquals("frontend", categories.get(0).getName());
        assertEquals(67, categories.get(0).getPercentage());
        assertEquals("backend", categories.get(1).getName());
        assertEquals(33, categories.get(1).getPercentage());
    }

    @Test
    void shouldKeepPercentagesSummingToHundred() {
        List<WorkCategory> categories = WorkCategorizer.categorize(List.of(
                "a.go", "b.go", "c.go", "d.go", "e.go", "f.go", "README.md", "deploy/app.tf"));

        assertEquals(100, categories.stream().mapToInt(WorkCategory::getPercentage).sum());
        assertEquals(List.of("backend", "docs", "infrastructure"),
                categories.stream().map(WorkCategory::getName).toList());
        assertEquals(List.of(75, 13, 12), categories.stream().map(WorkCategory::getPercentage).toList());
    }

    @Test
    void shouldGiveLeftoverPointToFirstSeenCategoryOnEvenSplit() {
        List<WorkCategory> categories = WorkCategorizer.categorize(List.of("schema.sql", "a.go", "README.md"));

        assertEquals(List.of("database", "backend", "docs"),
                categories.stream().map(WorkCategory::getName).toList());
        assertEquals(List.of(34, 33, 33), categories.stream().map(WorkCategory::getPercentage).toList());
    }

    @Test
    void shouldReturnEmptyCategoriesForNoFiles() {
        assertTrue(WorkCategorizer.categorize(List.of()).isEmpty());
        assertTrue(WorkCategorizer.categorize(null).isEmpty());
    }

    @Test
    void shouldRankTopFilesByOccurrence() {
        List<ChangedFile> top = WorkCategorizer.topFiles(
                List.of("b.ts", "a.ts", "c.ts"),
                List.of("c.ts", "c.ts", "a.ts", "unrelated.ts"),
                2);

        assertEquals(List.of("c.ts", "a.ts"), top.stream().map(ChangedFile::getPath).toList());
        assertEquals(2, top.get(0).getFrequency());
    }

    @Test
    void shouldCountUnseenFilesOnceAndBreakTiesByPath() {
        List<ChangedFile> top = WorkCategorizer.topFiles(List.of("b.ts", "a.ts"), List.of(), 10);

        assertEquals(List.of("a.ts", "b.ts"), top.stream().map(ChangedFile::getPath).toList());
        assertEquals(1, top.get(1).getFrequency());
    }
}
