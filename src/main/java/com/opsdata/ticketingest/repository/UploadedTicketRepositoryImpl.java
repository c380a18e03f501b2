package com.opsdata.ticketingest.repository;

import com.opsdata.ticketingest.dto.AverageDurations;
import com.opsdata.ticketingest.dto.MttrMttiProjectStats;
import com.opsdata.ticketingest.dto.MttrMttiTrendPoint;
import com.opsdata.ticketingest.dto.MttrMttiUserStats;
import com.opsdata.ticketingest.dto.UpsertStatistics;
import com.opsdata.ticketingest.model.MergeOutcome;
import com.opsdata.ticketingest.model.UploadedTicket;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class UploadedTicketRepositoryImpl implements UploadedTicketRepositoryCustom {

    private record ColumnBinding(String column, int sqlType, Function<UploadedTicket, Object> getter) {
    }

    private static ColumnBinding bind(String column, int sqlType, Function<UploadedTicket, Object> getter) {
        return new ColumnBinding(column, sqlType, getter);
    }

    // Every column an ingestion writes; the newest row for a key overwrites all of them.
    private static final List<ColumnBinding> TICKET_COLUMNS = List.of(
            bind("source_id", Types.OTHER, UploadedTicket::getSourceId),
            bind("mapping_id", Types.OTHER, UploadedTicket::getMappingId),
            bind("project_id", Types.OTHER, UploadedTicket::getProjectId),
            bind("incident_id", Types.VARCHAR, UploadedTicket::getIncidentId),
            bind("priority", Types.VARCHAR, UploadedTicket::getPriority),
            bind("region", Types.VARCHAR, UploadedTicket::getRegion),
            bind("assigned_support_organization", Types.VARCHAR, UploadedTicket::getAssignedSupportOrganization),
            bind("assigned_group", Types.VARCHAR, UploadedTicket::getAssignedGroup),
            bind("vertical", Types.VARCHAR, UploadedTicket::getVertical),
            bind("sub_vertical", Types.VARCHAR, UploadedTicket::getSubVertical),
            bind("owner_support_organization", Types.VARCHAR, UploadedTicket::getOwnerSupportOrganization),
            bind("owner_group", Types.VARCHAR, UploadedTicket::getOwnerGroup),
            bind("owner", Types.VARCHAR, UploadedTicket::getOwner),
            bind("reported_source", Types.VARCHAR, UploadedTicket::getReportedSource),
            bind("user_name", Types.VARCHAR, UploadedTicket::getUserName),
            bind("site_group", Types.VARCHAR, UploadedTicket::getSiteGroup),
            bind("operational_category_tier_1", Types.VARCHAR, UploadedTicket::getOperationalCategoryTier1),
            bind("operational_category_tier_2", Types.VARCHAR, UploadedTicket::getOperationalCategoryTier2),
            bind("operational_category_tier_3", Types.VARCHAR, UploadedTicket::getOperationalCategoryTier3),
            bind("product_name", Types.VARCHAR, UploadedTicket::getProductName),
            bind("product_categorization_tier_1", Types.VARCHAR, UploadedTicket::getProductCategorizationTier1),
            bind("product_categorization_tier_2", Types.VARCHAR, UploadedTicket::getProductCategorizationTier2),
            bind("product_categorization_tier_3", Types.VARCHAR, UploadedTicket::getProductCategorizationTier3),
            bind("incident_type", Types.VARCHAR, UploadedTicket::getIncidentType),
            bind("summary", Types.VARCHAR, UploadedTicket::getSummary),
            bind("assignee", Types.VARCHAR, UploadedTicket::getAssignee),
            bind("mapped_user_email", Types.VARCHAR, UploadedTicket::getMappedUserEmail),
            bind("reported_date1", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getReportedDate1),
            bind("responded_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getRespondedDate),
            bind("last_resolved_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getLastResolvedDate),
            bind("closed_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getClosedDate),
            bind("status", Types.VARCHAR, UploadedTicket::getStatus),
            bind("status_reason_hidden", Types.VARCHAR, UploadedTicket::getStatusReasonHidden),
            bind("pending_reason", Types.VARCHAR, UploadedTicket::getPendingReason),
            bind("group_transfers", Types.INTEGER, UploadedTicket::getGroupTransfers),
            bind("total_transfers", Types.INTEGER, UploadedTicket::getTotalTransfers),
            bind("department", Types.VARCHAR, UploadedTicket::getDepartment),
            bind("vip", Types.BOOLEAN, UploadedTicket::getVip),
            bind("company", Types.VARCHAR, UploadedTicket::getCompany),
            bind("vendor_ticket_number", Types.VARCHAR, UploadedTicket::getVendorTicketNumber),
            bind("reported_to_vendor", Types.BOOLEAN, UploadedTicket::getReportedToVendor),
            bind("resolution", Types.VARCHAR, UploadedTicket::getResolution),
            bind("resolver_group", Types.VARCHAR, UploadedTicket::getResolverGroup),
            bind("reopen_count", Types.INTEGER, UploadedTicket::getReopenCount),
            bind("reopened_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getReopenedDate),
            bind("service_desk_1st_assigned_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getServiceDesk1stAssignedDate),
            bind("service_desk_1st_assigned_group", Types.VARCHAR, UploadedTicket::getServiceDesk1stAssignedGroup),
            bind("submitter", Types.VARCHAR, UploadedTicket::getSubmitter),
            bind("owner_login_id", Types.VARCHAR, UploadedTicket::getOwnerLoginId),
            bind("impact", Types.VARCHAR, UploadedTicket::getImpact),
            bind("submit_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getSubmitDate),
            bind("report_date", Types.TIMESTAMP_WITH_TIMEZONE, UploadedTicket::getReportDate),
            bind("vil_function", Types.VARCHAR, UploadedTicket::getVilFunction),
            bind("it_partner", Types.VARCHAR, UploadedTicket::getItPartner),
            bind("mttr", Types.VARCHAR, UploadedTicket::getMttr),
            bind("mtti", Types.VARCHAR, UploadedTicket::getMtti),
            bind("mttr_seconds", Types.INTEGER, UploadedTicket::getMttrSeconds),
            bind("mtti_seconds", Types.INTEGER, UploadedTicket::getMttiSeconds),
            bind("mttr_minutes", Types.NUMERIC, UploadedTicket::getMttrMinutes),
            bind("mtti_minutes", Types.NUMERIC, UploadedTicket::getMttiMinutes)
    );

    private static final String UPSERT_SQL = buildUpsertSql();

    private static final String INSERT_IF_ABSENT_SQL = buildInsertIfAbsentSql();

    private static final int UPDATED_ID_LIMIT = 500;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public UploadedTicketRepositoryImpl(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static String buildUpsertSql() {
        String columns = TICKET_COLUMNS.stream().map(ColumnBinding::column).collect(Collectors.joining(", "));
        String values = TICKET_COLUMNS.stream().map(c -> ":" + c.column()).collect(Collectors.joining(", "));
        String updates = TICKET_COLUMNS.stream()
                .map(ColumnBinding::column)
                .filter(c -> !c.equals("incident_id"))
                .map(c -> c + " = EXCLUDED." + c)
                .collect(Collectors.joining(",\n    "));
        // xmax is 0 only for a tuple this statement inserted
        return "INSERT INTO uploaded_tickets (id, created_at, updated_at, " + columns + ")\n" +
                "VALUES (:id, now(), now(), " + values + ")\n" +
                "ON CONFLICT (incident_id) DO UPDATE SET\n    " + updates + ",\n    updated_at = now()\n" +
                "RETURNING (xmax = 0) AS inserted";
    }

    private static String buildInsertIfAbsentSql() {
        String columns = TICKET_COLUMNS.stream().map(ColumnBinding::column).collect(Collectors.joining(", "));
        String values = TICKET_COLUMNS.stream().map(c -> ":" + c.column()).collect(Collectors.joining(", "));
        return "INSERT INTO uploaded_tickets (id, created_at, updated_at, " + columns + ")\n" +
                "VALUES (:id, now(), now(), " + values + ")\n" +
                "ON CONFLICT (incident_id) DO NOTHING\n" +
                "RETURNING id";
    }

    @Override
    public MergeOutcome upsert(UploadedTicket ticket) {
        Boolean inserted = jdbcTemplate.queryForObject(UPSERT_SQL, ticketParams(ticket), Boolean.class);
        return Boolean.TRUE.equals(inserted) ? MergeOutcome.INSERTED : MergeOutcome.UPDATED;
    }

    @Override
    public boolean insertIfAbsent(UploadedTicket ticket) {
        // DO NOTHING returns no row when the key is already taken
        List<UUID> ids = jdbcTemplate.queryForList(INSERT_IF_ABSENT_SQL, ticketParams(ticket), UUID.class);
        return !ids.isEmpty();
    }

    private static MapSqlParameterSource ticketParams(UploadedTicket ticket) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", ticket.getId() != null ? ticket.getId() : UUID.randomUUID(), Types.OTHER);
        for (ColumnBinding binding : TICKET_COLUMNS) {
            params.addValue(binding.column(), binding.getter().apply(ticket), binding.sqlType());
        }
        return params;
    }

    @Override
    public List<MttrMttiProjectStats> aggregateMttrMttiByProject(UUID projectId, OffsetDateTime start, OffsetDateTime end) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("""
                SELECT ut.project_id,
                       COUNT(*) AS total_tickets,
                       CAST(AVG(ut.mttr_seconds) AS INTEGER) AS avg_mttr_seconds,
                       ROUND(AVG(ut.mttr_minutes), 2) AS avg_mttr_minutes,
                       CAST(AVG(ut.mtti_seconds) AS INTEGER) AS avg_mtti_seconds,
                       ROUND(AVG(ut.mtti_minutes), 2) AS avg_mtti_minutes,
                       MIN(ut.mttr_minutes) AS min_mttr_minutes,
                       MAX(ut.mttr_minutes) AS max_mttr_minutes,
                       MIN(ut.mtti_minutes) AS min_mtti_minutes,
                       MAX(ut.mtti_minutes) AS max_mtti_minutes
                FROM uploaded_tickets ut
                WHERE ut.project_id IS NOT NULL
                  AND (ut.mttr_seconds IS NOT NULL OR ut.mtti_seconds IS NOT NULL)
                """);
        appendProjectAndWindow(sql, params, projectId, "ut.reported_date1", start, end);
        sql.append(" GROUP BY ut.project_id ORDER BY ut.project_id");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new MttrMttiProjectStats(
                rs.getObject("project_id", UUID.class),
                rs.getLong("total_tickets"),
                (Integer) rs.getObject("avg_mttr_seconds"),
                rs.getBigDecimal("avg_mttr_minutes"),
                (Integer) rs.getObject("avg_mtti_seconds"),
                rs.getBigDecimal("avg_mtti_minutes"),
                rs.getBigDecimal("min_mttr_minutes"),
                rs.getBigDecimal("max_mttr_minutes"),
                rs.getBigDecimal("min_mtti_minutes"),
                rs.getBigDecimal("max_mtti_minutes")));
    }

    @Override
    public List<MttrMttiUserStats> aggregateMttrMttiByUser(OffsetDateTime start, OffsetDateTime end) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("""
                SELECT COALESCE(ut.mapped_user_email, ut.assignee) AS user_key,
                       COUNT(*) AS total_tickets,
                       ROUND(AVG(ut.mttr_minutes), 2) AS avg_mttr_minutes,
                       ROUND(AVG(ut.mtti_minutes), 2) AS avg_mtti_minutes,
                       SUM(ut.mttr_minutes) AS total_mttr_minutes,
                       SUM(ut.mtti_minutes) AS total_mtti_minutes,
                       CASE WHEN AVG(ut.mttr_minutes) > 0
                            THEN ROUND(100 - AVG(ut.mttr_minutes) / 60, 2)
                            ELSE 100 END AS efficiency_score
                FROM uploaded_tickets ut
                WHERE (ut.mapped_user_email IS NOT NULL OR ut.assignee IS NOT NULL)
                  AND (ut.mttr_seconds IS NOT NULL OR ut.mtti_seconds IS NOT NULL)
                """);
        appendProjectAndWindow(sql, params, null, "ut.reported_date1", start, end);
        sql.append(" GROUP BY COALESCE(ut.mapped_user_email, ut.assignee) ORDER BY user_key");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new MttrMttiUserStats(
                rs.getString("user_key"),
                rs.getLong("total_tickets"),
                rs.getBigDecimal("avg_mttr_minutes"),
                rs.getBigDecimal("avg_mtti_minutes"),
                rs.getBigDecimal("total_mttr_minutes"),
                rs.getBigDecimal("total_mtti_minutes"),
                rs.getBigDecimal("efficiency_score")));
    }

    @Override
    public List<MttrMttiTrendPoint> dailyMttrMttiTrend(UUID projectId, int days) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("days", days, Types.INTEGER);
        StringBuilder sql = new StringBuilder("""
                SELECT CAST(ut.reported_date1 AS DATE) AS day,
                       ROUND(AVG(ut.mttr_minutes), 2) AS avg_mttr_minutes,
                       ROUND(AVG(ut.mtti_minutes), 2) AS avg_mtti_minutes,
                       COUNT(*) AS ticket_count
                FROM uploaded_tickets ut
                WHERE ut.reported_date1 >= CURRENT_DATE - :days
                  AND (ut.mttr_seconds IS NOT NULL OR ut.mtti_seconds IS NOT NULL)
                """);
        appendProjectAndWindow(sql, params, projectId, null, null, null);
        sql.append(" GROUP BY CAST(ut.reported_date1 AS DATE) ORDER BY day");

        return jdbcTemplate.query(sql.toString(), params, (rs, rowNum) -> new MttrMttiTrendPoint(
                rs.getObject("day", LocalDate.class),
                rs.getBigDecimal("avg_mttr_minutes"),
                rs.getBigDecimal("avg_mtti_minutes"),
                rs.getLong("ticket_count")));
    }

    @Override
    public AverageDurations averageMinutes(UUID projectId) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("""
                SELECT ROUND(AVG(ut.mttr_minutes), 2) AS avg_mttr,
                       ROUND(AVG(ut.mtti_minutes), 2) AS avg_mtti
                FROM uploaded_tickets ut
                WHERE (ut.mttr_seconds IS NOT NULL OR ut.mtti_seconds IS NOT NULL)
                """);
        appendProjectAndWindow(sql, params, projectId, null, null, null);
        return jdbcTemplate.queryForObject(sql.toString(), params, (rs, rowNum) ->
                new AverageDurations(rs.getBigDecimal("avg_mttr"), rs.getBigDecimal("avg_mtti")));
    }

    @Override
    public UpsertStatistics upsertStatistics(UUID sessionId, OffsetDateTime start, OffsetDateTime end) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder window = new StringBuilder(" WHERE 1 = 1");
        if (sessionId != null) {
            // a session is scoped through the source it uploaded into
            window.append(" AND ut.source_id IN (SELECT us.source_id FROM upload_sessions us WHERE us.id = :sessionId)");
            params.addValue("sessionId", sessionId, Types.OTHER);
        }
        appendProjectAndWindow(window, params, null, "ut.updated_at", start, end);

        String countSql = "SELECT COUNT(*) AS total_records, " +
                "COUNT(*) FILTER (WHERE ut.created_at = ut.updated_at) AS new_records " +
                "FROM uploaded_tickets ut" + window;
        long[] counts = jdbcTemplate.queryForObject(countSql, params, (rs, rowNum) ->
                new long[]{rs.getLong("total_records"), rs.getLong("new_records")});

        params.addValue("limit", UPDATED_ID_LIMIT);
        String idsSql = "SELECT ut.incident_id FROM uploaded_tickets ut" + window +
                " AND ut.created_at <> ut.updated_at ORDER BY ut.updated_at DESC LIMIT :limit";
        List<String> updatedIds = jdbcTemplate.queryForList(idsSql, params, String.class);

        long total = counts != null ? counts[0] : 0L;
        long fresh = counts != null ? counts[1] : 0L;
        return new UpsertStatistics(total, fresh, total - fresh, updatedIds);
    }

    private void appendProjectAndWindow(StringBuilder sql,
                                        MapSqlParameterSource params,
                                        UUID projectId,
                                        String dateColumn,
                                        OffsetDateTime start,
                                        OffsetDateTime end) {
        if (projectId != null) {
            sql.append(" AND ut.project_id = :projectId");
            params.addValue("projectId", projectId, Types.OTHER);
        }
        if (dateColumn != null && start != null) {
            sql.append(" AND ").append(dateColumn).append(" >= :start");
            params.addValue("start", start, Types.TIMESTAMP_WITH_TIMEZONE);
        }
        if (dateColumn != null && end != null) {
            sql.append(" AND ").append(dateColumn).append(" <= :end");
            params.addValue("end", end, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }
}
