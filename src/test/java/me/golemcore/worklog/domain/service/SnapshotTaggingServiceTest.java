package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.domain.model.BranchStatus;
import me.golemcore.worklog.domain.model.DiffStats;
import me.golemcore.worklog.domain.model.JournalCommit;
import me.golemcore.worklog.domain.model.PullRequestSnapshot;
import me.golemcore.worklog.domain.model.PullRequestState;
import me.golemcore.worklog.domain.model.TicketSnapshot;
import me.golemcore.worklog.domain.model.WorkCategory;
import me.golemcore.worklog.domain.model.WorkSnapshot;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotTaggingServiceTest {

    private final SnapshotTaggingService taggingService = new SnapshotTaggingService();

    @Test
    void shouldTagEmptyDayAsNoCommits() {
        List<String> tags = taggingService.autoTag(snapshot().build());

        assertEquals(List.of(SnapshotTaggingService.NO_COMMITS), tags);
    }

    @Test
    void shouldDeriveTagsFromBranchAndCommits() {
        WorkSnapshot snapshot = snapshot()
                .currentBranch("feature/PROJ-12-login")
                .todayCommits(commits("feat(auth): add login PROJ-12", "fix: handle #42", "wip"))
                .build();

        List<String> tags = taggingService.autoTag(snapshot);

        assertTrue(tags.contains("feature"));
        assertTrue(tags.contains("feat"));
        assertTrue(tags.contains("fix"));
        assertTrue(tags.contains("proj-12"));
        assertTrue(tags.contains("#42"));
        assertFalse(tags.contains(SnapshotTaggingService.NO_COMMITS));
    }

    @Test
    void shouldIgnoreUnknownConventionalType() {
        List<String> tags = taggingService.autoTag(snapshot()
                .todayCommits(commits("update: bump deps"))
                .build());

        assertFalse(tags.contains("update"));
    }

    @Test
    void shouldDeriveActivityTags() {
        WorkSnapshot snapshot = snapshot()
                .activeBranches(new ArrayList<>(List.of(BranchStatus.builder()
                        .name("main").hasUncommittedChanges(true).build())))
                .pullRequests(new ArrayList<>(List.of(
                        pullRequest(1, PullRequestState.OPEN, "needs-review"),
                        pullRequest(2, PullRequestState.MERGED))))
                .tickets(new ArrayList<>(List.of(TicketSnapshot.builder().id("PROJ-1").build())))
                .diffStats(new DiffStats(3, 450, 60))
                .todayCommits(commits("a", "b", "c", "d", "e", "f", "g", "h", "i", "j"))
                .build();

        List<String> tags = taggingService.autoTag(snapshot);

        assertTrue(tags.containsAll(List.of(
                SnapshotTaggingService.HAS_WIP,
                SnapshotTaggingService.OPEN_PR,
                SnapshotTaggingService.MERGED_PR,
                SnapshotTaggingService.HAS_TICKETS,
                SnapshotTaggingService.LARGE_CHANGE,
                SnapshotTaggingService.BUSY_DAY,
                "needs-review")));
    }

    @Test
    void shouldTagLargeChangeByFileCount() {
        List<String> tags = taggingService.autoTag(snapshot()
                .diffStats(new DiffStats(SnapshotTaggingService.LARGE_CHANGE_FILES, 1, 1))
                .build());

        assertTrue(tags.contains(SnapshotTaggingService.LARGE_CHANGE));
    }

    @Test
    void shouldTagOnlySignificantCategories() {
        List<String> tags = taggingService.autoTag(snapshot()
                .categories(new ArrayList<>(List.of(
                        new WorkCategory("backend", 85),
                        new WorkCategory("docs", 15))))
                .build());

        assertTrue(tags.contains("backend"));
        assertFalse(tags.contains("docs"));
    }

    @Test
    void shouldNormalizeTags() {
        assertEquals(List.of("wip", "review"),
                SnapshotTaggingService.normalize(Arrays.asList(" WIP ", "wip", null, "", "Review")));
        assertTrue(SnapshotTaggingService.normalize(null).isEmpty());
    }

    @Test
    void shouldReplaceStaleActivityTagsAndKeepOthersOnRetag() {
        WorkSnapshot snapshot = snapshot()
                .tags(new ArrayList<>(List.of("Release", SnapshotTaggingService.HAS_WIP,
                        SnapshotTaggingService.NO_COMMITS)))
                .todayCommits(commits("fix: null check"))
                .tickets(new ArrayList<>(List.of(TicketSnapshot.builder().id("PROJ-3").build())))
                .build();

        List<String> tags = taggingService.retag(snapshot);

        assertEquals(List.of("release", "fix", SnapshotTaggingService.HAS_TICKETS), tags);
        assertEquals(tags, taggingService.retag(snapshot.toBuilder().tags(tags).build()));
    }

    private static WorkSnapshot.WorkSnapshotBuilder snapshot() {
        return WorkSnapshot.builder()
                .date(LocalDate.of(2026, 2, 10))
                .projectId("acme")
                .currentBranch("main");
    }

    private static List<JournalCommit> commits(String... messages) {
        List<JournalCommit> commits = new ArrayList<>();
        for (int i = 0; i < messages.length; i++) {
            commits.add(JournalCommit.builder().hash("h" + i).message(messages[i]).build());
        }
        return commits;
    }

    private static PullRequestSnapshot pullRequest(int number, PullRequestState state, String... labels) {
        return PullRequestSnapshot.builder()
                .number(number)
                .title("PR " + number)
                .state(state)
                .labels(new ArrayList<>(List.of(labels)))
                .build();
    }
}
