package com.delta.opportunities.pipeline.api;

import com.delta.opportunities.pipeline.ingest.OpportunityIngestionService;
import com.delta.opportunities.pipeline.model.ApplicationRecord;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import com.delta.opportunities.pipeline.persistence.ApplicationJdbcRepository;
import com.delta.opportunities.support.PipelineTestConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Import(PipelineTestConfiguration.class)
class PipelineApiTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ApplicationJdbcRepository applications;

    @Autowired
    private OpportunityIngestionService ingestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void profileCanBeStoredAndRead() throws Exception {
        String userId = "api-" + UUID.randomUUID();

        mockMvc.perform(put("/api/users/{userId}/profile", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"skills": ["java", "postgres"], "yearsExperience": 4, "automationLevel": "SEMI_AUTO"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.userId").value(userId));

        mockMvc.perform(get("/api/users/{userId}/profile", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.skills[0]").value("java"))
            .andExpect(jsonPath("$.yearsExperience").value(4))
            .andExpect(jsonPath("$.automationLevel").value("SEMI_AUTO"));
    }

    @Test
    void missingProfileIsNotFound() throws Exception {
        mockMvc.perform(get("/api/users/{userId}/profile", "nobody-" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void discoveryReportsCreatedAndRejectedItems() throws Exception {
        String userId = "api-" + UUID.randomUUID();
        String suffix = UUID.randomUUID().toString().substring(0, 8);

        mockMvc.perform(post("/api/users/{userId}/opportunities", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    [
                      {"source": "board-a", "title": "Kernel Hacker %1$s", "organization": "Penguin Co",
                       "url": "https://penguin.example/jobs/%1$s", "description": "C and schedulers"},
                      {"source": "board-a", "organization": "Penguin Co", "url": "https://penguin.example/jobs/none"}
                    ]
                    """.formatted(suffix)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.received").value(2))
            .andExpect(jsonPath("$.opportunitiesCreated").value(1))
            .andExpect(jsonPath("$.rejected").value(1))
            .andExpect(jsonPath("$.applicationsCreated").value(1));

        mockMvc.perform(get("/api/users/{userId}/applications", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/users/{userId}/funnel", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.discovered").value(1));
    }

    @Test
    void unknownApplicationIsNotFound() throws Exception {
        mockMvc.perform(get("/api/applications/{id}", Long.MAX_VALUE))
            .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/applications/{id}/approval", Long.MAX_VALUE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"APPROVED\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void approvalOutsidePendingApprovalIsConflict() throws Exception {
        ApplicationRecord application = parkedApplication();

        mockMvc.perform(post("/api/applications/{id}/approval", application.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"APPROVED\", \"reviewer\": \"kim\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("illegal_state_transition"))
            .andExpect(jsonPath("$.state").value("DISCOVERED"));

        mockMvc.perform(post("/api/applications/{id}/outcome", application.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\": \"ACCEPTED\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void malformedRequestsAreBadRequests() throws Exception {
        ApplicationRecord application = parkedApplication();

        mockMvc.perform(post("/api/applications/{id}/approval", application.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reviewer\": \"kim\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_failed"));

        mockMvc.perform(post("/api/applications/{id}/approval", application.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"MAYBE\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("malformed_request"));

        mockMvc.perform(put("/api/scoring/weights")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"weights\": {}}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void cancelAbandonsParkedApplication() throws Exception {
        ApplicationRecord application = parkedApplication();

        mockMvc.perform(post("/api/applications/{id}/cancel", application.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"operator\": \"ops\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("ABANDONED"));

        mockMvc.perform(get("/api/applications/{id}/timeline", application.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].kind").value(hasItem("CANCELLED")));
    }

    @Test
    void weightsAndQueuesAreReadable() throws Exception {
        mockMvc.perform(get("/api/scoring/weights"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value(greaterThanOrEqualTo(1)))
            .andExpect(jsonPath("$.tier2Threshold").value(0.5));

        mockMvc.perform(get("/api/submissions/queues"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].platform").value(hasItem("board")));
    }

    /**
     * An application stored without being dispatched, so it stays in DISCOVERED.
     */
    private ApplicationRecord parkedApplication() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        long opportunityId = ingestionService.ingest(RawOpportunity.of(
            "api-test",
            "Support Engineer " + suffix,
            "Helpdesk " + suffix,
            "https://helpdesk.example/jobs/" + suffix,
            "Customer support tooling"
        )).opportunity().id();
        return applications.createIfAbsent("api-" + UUID.randomUUID(), opportunityId, Instant.now()).application();
    }
}
