package me.golemcore.worklog.domain.service;

import me.golemcore.worklog.domain.model.TicketReference;
import me.golemcore.worklog.infrastructure.config.WorklogProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TicketExtractorTest {

    private WorklogProperties properties;
    private TicketExtractor ticketExtractor;

    @BeforeEach
    void setUp() {
        properties = new WorklogProperties();
        ticketExtractor = new TicketExtractor(properties);
    }

    @Test
    void shouldExtractJiraAndGithubIds() {
        List<TicketReference> tickets = ticketExtractor.extract("Fix PROJ-123 crash, closes #42");

        assertEquals(List.of(new TicketReference("PROJ-123", "jira"), new TicketReference("#42", "github")), tickets);
    }

    @Test
    void shouldUppercaseLowercaseIds() {
        List<TicketReference> tickets = ticketExtractor.extract("feature/eng-7");

        assertEquals("ENG-7", tickets.get(0).id());
    }

    @Test
    void shouldDeduplicateAcrossTexts() {
        List<TicketReference> tickets = ticketExtractor.extractAll(
                Arrays.asList("PROJ-1 start", null, "continue PROJ-1", "  "));

        assertEquals(1, tickets.size());
    }

    @Test
    void shouldPreferConfiguredPrefix() {
        properties.getTickets().setPrefix("ABC");
        properties.getTickets().setTool("linear");

        List<TicketReference> tickets = ticketExtractor.extract("abc-17 and XY-2");

        assertEquals(new TicketReference("ABC-17", "linear"), tickets.get(0));
        assertTrue(tickets.contains(new TicketReference("XY-2", "jira")));
    }

    @Test
    void shouldMarkPrefixTypeUnknownWithoutTool() {
        properties.getTickets().setPrefix("ABC");
        properties.getTickets().setTool("none");

        assertEquals("unknown", ticketExtractor.extract("ABC-1").get(0).type());
    }

    @Test
    void shouldReturnEmptyForTextWithoutIds() {
        assertTrue(ticketExtractor.extract("plain message").isEmpty());
        assertTrue(ticketExtractor.extract(null).isEmpty());
    }
}
