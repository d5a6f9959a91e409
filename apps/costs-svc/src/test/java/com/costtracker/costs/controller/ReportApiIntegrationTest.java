package com.costtracker.costs.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.report.CachedReportRepository;
import com.costtracker.costs.repository.CostRecordRepository;
import com.costtracker.costs.support.MutableClock;
import com.costtracker.costs.support.TestClockConfiguration;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Drives the HTTP surface end to end against H2 with a movable clock.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
class ReportApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    MutableClock clock;

    @Autowired
    CachedReportRepository cachedReportRepository;

    @Autowired
    CostRecordRepository costRecordRepository;

    @Test
    void closedMonthIsComputedOnceThenServedFromCache() throws Exception {
        clock.set("2025-03-05T10:00:00Z");
        addUser(123123L);
        addCost(123123L, "lunch", "food", "12.5", null);
        addCost(123123L, "rent", "housing", "1500", "2025-03-10T08:00:00Z");

        // March is still open: computed but not memoized
        mockMvc.perform(get("/api/report").param("id", "123123").param("year", "2025").param("month", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.costs.length()").value(5));
        assertThat(cachedReportRepository.findByUserIdAndYearAndMonth(123123L, 2025, 3)).isEmpty();

        clock.set("2025-04-02T00:00:00Z");
        mockMvc.perform(get("/api/report").param("id", "123123").param("year", "2025").param("month", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userid").value(123123))
                .andExpect(jsonPath("$.year").value(2025))
                .andExpect(jsonPath("$.month").value(3))
                .andExpect(jsonPath("$.costs[0].food[0].sum").value(12.5))
                .andExpect(jsonPath("$.costs[0].food[0].description").value("lunch"))
                .andExpect(jsonPath("$.costs[0].food[0].day").value(5))
                .andExpect(jsonPath("$.costs[1].education").isEmpty())
                .andExpect(jsonPath("$.costs[2].health").isEmpty())
                .andExpect(jsonPath("$.costs[3].housing[0].sum").value(1500.0))
                .andExpect(jsonPath("$.costs[3].housing[0].day").value(10))
                .andExpect(jsonPath("$.costs[4].sports").isEmpty());
        assertThat(cachedReportRepository.findByUserIdAndYearAndMonth(123123L, 2025, 3)).isPresent();

        // a late write to March is not reflected once the report is memoized
        costRecordRepository.save(new CostRecord(UUID.randomUUID(), "late", "food", 123123L,
                new BigDecimal("3.00"), Instant.parse("2025-03-20T12:00:00Z")));
        mockMvc.perform(get("/api/report").param("id", "123123").param("year", "2025").param("month", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.costs[0].food.length()").value(1));

        mockMvc.perform(get("/api/users/123123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.first_name").value("mosh"))
                .andExpect(jsonPath("$.total").value(1515.5));
    }

    @Test
    void amountsAreStoredAndEchoedInCents() throws Exception {
        clock.set("2025-06-03T10:00:00Z");
        addUser(246L);

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"coffee\",\"category\":\"food\",\"userid\":246,\"sum\":12.505}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sum").value(12.51));

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"yacht\",\"category\":\"sports\",\"userid\":246,\"sum\":123456789012}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/report").param("id", "246").param("year", "2025").param("month", "6"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.costs[0].food[0].sum").value(12.51))
                .andExpect(jsonPath("$.costs[4].sports").isEmpty());
    }

    @Test
    void reportForUnknownUserHasFiveEmptyBuckets() throws Exception {
        clock.set("2025-04-02T00:00:00Z");

        mockMvc.perform(get("/api/report").param("id", "777").param("year", "2024").param("month", "11"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.costs[0].food").isEmpty())
                .andExpect(jsonPath("$.costs[4].sports").isEmpty());
    }

    @Test
    void invalidReportParamsAreRejectedWithErrorId() throws Exception {
        mockMvc.perform(get("/api/report").param("id", "1").param("year", "2025").param("month", "13")
                        .header("X-Request-Trace", "trace-123"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(21))
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value("month must be between 1 and 12"))
                .andExpect(jsonPath("$.traceId").value("trace-123"));

        mockMvc.perform(get("/api/report").param("id", "abc").param("year", "2025").param("month", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(20));

        mockMvc.perform(get("/api/report").param("id", "1").param("year", "2025").param("month", ""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(21));
    }

    @Test
    void costIntakeAndUserErrorsCarryTheirIds() throws Exception {
        clock.set("2025-05-01T00:00:00Z");
        addUser(555L);

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\",\"category\":\"travel\",\"userid\":555,\"sum\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(3));

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\",\"category\":\"food\",\"userid\":555,\"sum\":\"lots\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(5));

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\",\"category\":\"food\",\"userid\":555,\"sum\":1,\"createdAt\":\"2025-04-01T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.message").value("Cannot add costs with dates in the past"));

        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\",\"category\":\"food\",\"userid\":556,\"sum\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(8));

        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":555,\"first_name\":\"a\",\"last_name\":\"b\",\"birthday\":\"1990-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(5));

        mockMvc.perform(get("/api/users/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(6));

        mockMvc.perform(get("/api/users/99999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.message").value("User not found"));
    }

    @Test
    void requestsAreLoggedAndPeerLogsAccepted() throws Exception {
        clock.set("2025-05-01T00:00:00Z");

        mockMvc.perform(post("/api/logs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"service\":\"users-service\",\"type\":\"error\",\"message\":\"boom\",\"meta\":{\"userId\":5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        mockMvc.perform(post("/api/logs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"error\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.id").value(30));

        mockMvc.perform(get("/api/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].service", hasItem("users-service")))
                .andExpect(jsonPath("$[*].path", hasItem("/api/logs")));
    }

    private void addUser(long id) throws Exception {
        mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":" + id + ",\"first_name\":\"mosh\",\"last_name\":\"israeli\",\"birthday\":\"1990-01-10\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
    }

    private void addCost(long userId, String description, String category, String sum, String createdAt) throws Exception {
        String created = createdAt == null ? "" : ",\"createdAt\":\"" + createdAt + "\"";
        mockMvc.perform(post("/api/add").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"" + description + "\",\"category\":\"" + category
                                + "\",\"userid\":" + userId + ",\"sum\":" + sum + created + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.category").value(category));
    }
}
