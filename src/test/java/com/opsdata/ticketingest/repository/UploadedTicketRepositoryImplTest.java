package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.UploadedTicket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.math.BigDecimal;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadedTicketRepositoryImplTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    private UploadedTicketRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new UploadedTicketRepositoryImpl(jdbcTemplate);
    }

    @Test
    void upsertIsOneKeyedStatement() {
        when(jdbcTemplate.queryForObject(anyString(), any(SqlParameterSource.class), eq(Boolean.class))).thenReturn(true);
        UploadedTicket ticket = new UploadedTicket();
        ticket.setIncidentId("INC1");
        ticket.setSummary("VPN down");
        ticket.setMttrMinutes(new BigDecimal("178.42"));
        ticket.setReportedDate1(OffsetDateTime.of(2025, 8, 18, 19, 11, 50, 0, ZoneOffset.UTC));

        MergeOutcome outcome = repository.upsert(ticket);

        assertThat(outcome).isEqualTo(MergeOutcome.INSERTED);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).queryForObject(sql.capture(), params.capture(), eq(Boolean.class));

        assertThat(sql.getValue())
                .startsWith("INSERT INTO uploaded_tickets")
                .contains("ON CONFLICT (incident_id) DO UPDATE SET")
                .contains("summary = EXCLUDED.summary")
                .contains("mttr_minutes = EXCLUDED.mttr_minutes")
                .contains("updated_at = now()")
                .doesNotContain("incident_id = EXCLUDED.incident_id")
                .doesNotContain("created_at = EXCLUDED")
                .endsWith("RETURNING (xmax = 0) AS inserted");
        SqlParameterSource bound = params.getValue();
        assertThat(bound.getValue("id")).isInstanceOf(UUID.class);
        assertThat(bound.getValue("incident_id")).isEqualTo("INC1");
        assertThat(bound.getValue("summary")).isEqualTo("VPN down");
        assertThat(bound.getValue("priority")).isNull();
        assertThat(bound.getSqlType("reported_date1")).isEqualTo(Types.TIMESTAMP_WITH_TIMEZONE);
        assertThat(bound.getSqlType("mttr_minutes")).isEqualTo(Types.NUMERIC);
    }

    @Test
    void upsertReportsUpdateForExistingKey() {
        when(jdbcTemplate.queryForObject(anyString(), any(SqlParameterSource.class), eq(Boolean.class))).thenReturn(false);
        UploadedTicket ticket = new UploadedTicket();
        ticket.setIncidentId("INC1");

        assertThat(repository.upsert(ticket)).isEqualTo(MergeOutcome.UPDATED);
    }

    @Test
    @SuppressWarnings("unchecked")
    void projectAndWindowFiltersAreOptional() {
        when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class))).thenReturn(List.of());
        UUID project = UUID.randomUUID();
        OffsetDateTime start = OffsetDateTime.of(2025, 8, 1, 0, 0, 0, 0, ZoneOffset.UTC);

        repository.aggregateMttrMttiByProject(null, null, null);
        repository.aggregateMttrMttiByProject(project, start, null);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate, times(2)).query(sql.capture(), params.capture(), any(RowMapper.class));

        assertThat(sql.getAllValues().get(0)).doesNotContain(":projectId").doesNotContain(":start").contains("GROUP BY ut.project_id");
        assertThat(sql.getAllValues().get(1)).contains("ut.project_id = :projectId").contains("ut.reported_date1 >= :start")
                .doesNotContain(":end");
        assertThat(((MapSqlParameterSource) params.getAllValues().get(1)).getValues())
                .containsEntry("projectId", project)
                .containsEntry("start", start);
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertStatisticsSplitsNewAndUpdated() {
        when(jdbcTemplate.queryForObject(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(new long[]{10L, 7L});
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class), eq(String.class)))
                .thenReturn(List.of("INC3", "INC9", "INC4"));

        UpsertStatistics statistics = repository.upsertStatistics(null, null, null);

        assertThat(statistics.totalRecords()).isEqualTo(10L);
        assertThat(statistics.newRecords()).isEqualTo(7L);
        assertThat(statistics.updatedRecords()).isEqualTo(3L);
        assertThat(statistics.updatedIncidentIds()).containsExactly("INC3", "INC9", "INC4");
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertStatisticsScopesToTheSessionSource() {
        when(jdbcTemplate.queryForObject(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(new long[]{2L, 2L});
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class), eq(String.class)))
                .thenReturn(List.of());
        UUID session = UUID.randomUUID();

        repository.upsertStatistics(session, null, null);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).queryForObject(sql.capture(), params.capture(), any(RowMapper.class));
        assertThat(sql.getValue()).contains("SELECT us.source_id FROM upload_sessions us WHERE us.id = :sessionId");
        assertThat(params.getValue().getValue("sessionId")).isEqualTo(session);
    }

    @Test
    void insertIfAbsentReportsWhetherARowWasWritten() {
        when(jdbcTemplate.queryForList(anyString(), any(SqlParameterSource.class), eq(UUID.class)))
                .thenReturn(List.of(UUID.randomUUID()))
                .thenReturn(List.of());
        UploadedTicket ticket = new UploadedTicket();
        ticket.setIncidentId("INC1");

        assertThat(repository.insertIfAbsent(ticket)).isTrue();
        assertThat(repository.insertIfAbsent(ticket)).isFalse();

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(2)).queryForList(sql.capture(), any(SqlParameterSource.class), eq(UUID.class));
        assertThat(sql.getValue())
                .contains("ON CONFLICT (incident_id) DO NOTHING")
                .doesNotContain("DO UPDATE")
                .endsWith("RETURNING id");
    }
}
