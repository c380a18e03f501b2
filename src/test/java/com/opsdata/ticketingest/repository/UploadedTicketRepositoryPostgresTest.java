package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.dto.MttrMttiTrendPoint;
import com.opsdata.ticketingest.dto.MttrMttiUserStats;
import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.UploadedTicket;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class UploadedTicketRepositoryPostgresTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("tickets")
            .withUsername("tickets")
            .withPassword("tickets");

    static JdbcTemplate jdbc;
    static UploadedTicketRepositoryImpl repository;

    @BeforeAll
    static void setup() {
        DataSource ds = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/ticket-schema.sql")).execute(ds);
        jdbc = new JdbcTemplate(ds);
        repository = new UploadedTicketRepositoryImpl(new NamedParameterJdbcTemplate(ds));
    }

    @BeforeEach
    void clean() {
        jdbc.update("TRUNCATE uploaded_tickets, upload_sessions");
    }

    @Test
    void secondWriteOfAKeyOverwritesEveryColumn() {
        UploadedTicket first = ticket("INC1");
        first.setPriority("INC");
        first.setSummary("VPN down");
        first.setVip(true);
        first.setGroupTransfers(2);
        first.setMttr("00:30:00");
        first.setMttrSeconds(1800);
        first.setMttrMinutes(new BigDecimal("30.00"));
        first.setReportedDate1(OffsetDateTime.of(2025, 8, 18, 19, 11, 50, 0, ZoneOffset.UTC));

        assertThat(repository.upsert(first)).isEqualTo(MergeOutcome.INSERTED);
        Map<String, Object> inserted = jdbc.queryForMap("SELECT * FROM uploaded_tickets WHERE incident_id = 'INC1'");
        assertThat(inserted.get("created_at")).isEqualTo(inserted.get("updated_at"));

        UploadedTicket second = ticket("INC1");
        second.setSummary("VPN restored");
        second.setVip(false);

        assertThat(repository.upsert(second)).isEqualTo(MergeOutcome.UPDATED);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM uploaded_tickets", Long.class)).isEqualTo(1L);
        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM uploaded_tickets WHERE incident_id = 'INC1'");
        assertThat(row.get("id")).isEqualTo(inserted.get("id"));
        assertThat(row.get("summary")).isEqualTo("VPN restored");
        assertThat(row.get("vip")).isEqualTo(false);
        assertThat(row.get("priority")).isNull();
        assertThat(row.get("group_transfers")).isNull();
        assertThat(row.get("mttr")).isNull();
        assertThat(row.get("mttr_seconds")).isNull();
        assertThat(row.get("mttr_minutes")).isNull();
        assertThat(row.get("reported_date1")).isNull();
        assertThat(row.get("created_at")).isEqualTo(inserted.get("created_at"));
        OffsetDateTime createdAt = jdbc.queryForObject(
                "SELECT created_at FROM uploaded_tickets WHERE incident_id = 'INC1'", OffsetDateTime.class);
        OffsetDateTime updatedAt = jdbc.queryForObject(
                "SELECT updated_at FROM uploaded_tickets WHERE incident_id = 'INC1'", OffsetDateTime.class);
        assertThat(updatedAt).isAfter(createdAt);
    }

    @Test
    void insertIfAbsentLeavesAnExistingRowAlone() {
        UploadedTicket original = ticket("INC1");
        original.setSummary("original");
        UploadedTicket again = ticket("INC1");
        again.setSummary("again");

        assertThat(repository.insertIfAbsent(original)).isTrue();
        assertThat(repository.insertIfAbsent(again)).isFalse();

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM uploaded_tickets", Long.class)).isEqualTo(1L);
        assertThat(jdbc.queryForObject("SELECT summary FROM uploaded_tickets WHERE incident_id = 'INC1'", String.class))
                .isEqualTo("original");
    }

    @Test
    void concurrentWritesOfOneKeyLeaveOneRow() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MergeOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                UploadedTicket ticket = ticket("INC-RACE");
                ticket.setSummary("writer " + i);
                futures.add(pool.submit(() -> {
                    start.await();
                    return repository.upsert(ticket);
                }));
            }
            start.countDown();

            List<MergeOutcome> outcomes = new ArrayList<>();
            for (Future<MergeOutcome> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(outcomes).filteredOn(outcome -> outcome == MergeOutcome.INSERTED).hasSize(1);
            assertThat(outcomes).filteredOn(outcome -> outcome == MergeOutcome.UPDATED).hasSize(writers - 1);
            assertThat(jdbc.queryForObject(
                    "SELECT COUNT(*) FROM uploaded_tickets WHERE incident_id = 'INC-RACE'", Long.class)).isEqualTo(1L);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void upsertStatisticsFollowTheSessionSource() {
        UUID sourceA = UUID.randomUUID();
        UUID sourceB = UUID.randomUUID();
        UUID session = UUID.randomUUID();
        jdbc.update("INSERT INTO upload_sessions (id, user_email, source_id, file_name, status) VALUES (?, ?, ?, ?, ?)",
                session, "ops@example.com", sourceA, "export.csv", "completed");

        repository.upsert(ticket("INC1", sourceA));
        repository.upsert(ticket("INC2", sourceA));
        repository.upsert(ticket("INC2", sourceA));
        repository.upsert(ticket("INC3", sourceB));

        UpsertStatistics scoped = repository.upsertStatistics(session, null, null);
        UpsertStatistics all = repository.upsertStatistics(null, null, null);

        assertThat(scoped.totalRecords()).isEqualTo(2L);
        assertThat(scoped.newRecords()).isEqualTo(1L);
        assertThat(scoped.updatedRecords()).isEqualTo(1L);
        assertThat(scoped.updatedIncidentIds()).containsExactly("INC2");
        assertThat(all.totalRecords()).isEqualTo(3L);
    }

    @Test
    void userStatisticsFallBackToTheAssignee() {
        UploadedTicket mapped1 = withMttr(ticket("INC1"), 30);
        mapped1.setAssignee("Jane Doe");
        mapped1.setMappedUserEmail("jane@example.com");
        UploadedTicket mapped2 = withMttr(ticket("INC2"), 90);
        mapped2.setAssignee("Jane Doe");
        mapped2.setMappedUserEmail("jane@example.com");
        UploadedTicket unmapped = withMttr(ticket("INC3"), 120);
        unmapped.setAssignee("Nobody Known");
        repository.upsert(mapped1);
        repository.upsert(mapped2);
        repository.upsert(unmapped);

        List<MttrMttiUserStats> stats = repository.aggregateMttrMttiByUser(null, null);

        assertThat(stats).extracting(MttrMttiUserStats::user)
                .containsExactlyInAnyOrder("Nobody Known", "jane@example.com");
        MttrMttiUserStats jane = stats.stream()
                .filter(s -> "jane@example.com".equals(s.user()))
                .findFirst()
                .orElseThrow();
        assertThat(jane.totalTickets()).isEqualTo(2L);
        assertThat(jane.avgMttrMinutes()).isEqualByComparingTo("60.00");
        assertThat(jane.totalMttrMinutes()).isEqualByComparingTo("120.00");
        assertThat(jane.efficiencyScore()).isEqualByComparingTo("99.00");
    }

    @Test
    void trendOnlyCoversTheRequestedDays() {
        UploadedTicket recent = withMttr(ticket("INC1"), 60);
        recent.setReportedDate1(OffsetDateTime.now(ZoneOffset.UTC).minusDays(2));
        UploadedTicket old = withMttr(ticket("INC2"), 60);
        old.setReportedDate1(OffsetDateTime.now(ZoneOffset.UTC).minusDays(60));
        repository.upsert(recent);
        repository.upsert(old);

        List<MttrMttiTrendPoint> trend = repository.dailyMttrMttiTrend(null, 7);

        assertThat(trend).singleElement().satisfies(point -> {
            assertThat(point.ticketCount()).isEqualTo(1L);
            assertThat(point.avgMttrMinutes()).isEqualByComparingTo("60.00");
        });
        assertThat(repository.dailyMttrMttiTrend(null, 90)).hasSize(2);
    }

    private static UploadedTicket ticket(String incidentId) {
        return ticket(incidentId, null);
    }

    private static UploadedTicket ticket(String incidentId, UUID sourceId) {
        UploadedTicket ticket = new UploadedTicket();
        ticket.setIncidentId(incidentId);
        ticket.setSourceId(sourceId);
        return ticket;
    }

    private static UploadedTicket withMttr(UploadedTicket ticket, int minutes) {
        ticket.setMttrSeconds(minutes * 60);
        ticket.setMttrMinutes(BigDecimal.valueOf(minutes).setScale(2));
        return ticket;
    }
}
