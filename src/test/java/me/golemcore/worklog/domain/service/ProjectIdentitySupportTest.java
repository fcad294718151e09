package me.golemcore.worklog.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProjectIdentitySupportTest {

    @ParameterizedTest
    @CsvSource({
            "git@github.com:acme/web-app.git, acme/web-app",
            "https://github.com/acme/web-app.git, acme/web-app",
            "https://github.com/acme/web-app, acme/web-app",
            "https://github.com/acme/web-app/, acme/web-app",
            "ssh://git@gitlab.example.com/team/service.git, team/service"
    })
    void shouldParseOwnerAndRepoFromRemote(String remote, String expected) {
        assertEquals(expected, ProjectIdentitySupport.parseRemote(remote));
    }

    @Test
    void shouldReturnNullForUnparseableRemote() {
        assertNull(ProjectIdentitySupport.parseRemote(null));
        assertNull(ProjectIdentitySupport.parseRemote("   "));
        assertNull(ProjectIdentitySupport.parseRemote("localrepo"));
    }

    @Test
    void shouldResolveInPriorityOrder() {
        Path root = Path.of("/work/My Project");

        assertEquals("custom-id", ProjectIdentitySupport.resolve("Custom ID", "git@github.com:acme/app.git", root));
        assertEquals("acme-app", ProjectIdentitySupport.resolve(null, "git@github.com:acme/app.git", root));
        assertEquals("my-project", ProjectIdentitySupport.resolve(" ", null, root));
        assertEquals(ProjectIdentitySupport.UNKNOWN_PROJECT, ProjectIdentitySupport.resolve(null, null, null));
    }

    @Test
    void shouldSanitizeToSlug() {
        assertEquals("acme-web-app", ProjectIdentitySupport.sanitize("  Acme//Web_App!! "));
        assertEquals("", ProjectIdentitySupport.sanitize("---"));
        assertEquals("", ProjectIdentitySupport.sanitize(null));
        assertEquals(ProjectIdentitySupport.MAX_LENGTH, ProjectIdentitySupport.sanitize("a".repeat(150)).length());
    }

    @Test
    void shouldRejectIdWithoutUsableCharacters() {
        assertEquals("acme", ProjectIdentitySupport.requireProjectId("ACME"));
        assertThrows(IllegalArgumentException.class, () -> ProjectIdentitySupport.requireProjectId("../"));
        assertThrows(IllegalArgumentException.class, () -> ProjectIdentitySupport.requireProjectId(null));
    }
}
