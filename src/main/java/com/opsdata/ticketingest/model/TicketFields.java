package com.opsdata.ticketingest.model;

/**
 * Field names accepted in an incoming ticket record. They match the {@code uploaded_tickets}
 * column names; anything else in a record is ignored.
 */
public final class TicketFields {

    private TicketFields() {
    }

    public static final String INCIDENT_ID = "incident_id";
    public static final String PRIORITY = "priority";
    public static final String REGION = "region";
    public static final String ASSIGNED_SUPPORT_ORGANIZATION = "assigned_support_organization";
    public static final String ASSIGNED_GROUP = "assigned_group";
    public static final String VERTICAL = "vertical";
    public static final String SUB_VERTICAL = "sub_vertical";
    public static final String OWNER_SUPPORT_ORGANIZATION = "owner_support_organization";
    public static final String OWNER_GROUP = "owner_group";
    public static final String OWNER = "owner";
    public static final String REPORTED_SOURCE = "reported_source";
    public static final String USER_NAME = "user_name";
    public static final String SITE_GROUP = "site_group";
    public static final String OPERATIONAL_CATEGORY_TIER_1 = "operational_category_tier_1";
    public static final String OPERATIONAL_CATEGORY_TIER_2 = "operational_category_tier_2";
    public static final String OPERATIONAL_CATEGORY_TIER_3 = "operational_category_tier_3";
    public static final String PRODUCT_NAME = "product_name";
    public static final String PRODUCT_CATEGORIZATION_TIER_1 = "product_categorization_tier_1";
    public static final String PRODUCT_CATEGORIZATION_TIER_2 = "product_categorization_tier_2";
    public static final String PRODUCT_CATEGORIZATION_TIER_3 = "product_categorization_tier_3";
    public static final String INCIDENT_TYPE = "incident_type";
    public static final String SUMMARY = "summary";
    public static final String ASSIGNEE = "assignee";
    public static final String REPORTED_DATE1 = "reported_date1";
    public static final String RESPONDED_DATE = "responded_date";
    public static final String LAST_RESOLVED_DATE = "last_resolved_date";
    public static final String CLOSED_DATE = "closed_date";
    public static final String STATUS = "status";
    public static final String STATUS_REASON_HIDDEN = "status_reason_hidden";
    public static final String PENDING_REASON = "pending_reason";
    public static final String GROUP_TRANSFERS = "group_transfers";
    public static final String TOTAL_TRANSFERS = "total_transfers";
    public static final String DEPARTMENT = "department";
    public static final String VIP = "vip";
    public static final String COMPANY = "company";
    public static final String VENDOR_TICKET_NUMBER = "vendor_ticket_number";
    public static final String REPORTED_TO_VENDOR = "reported_to_vendor";
    public static final String RESOLUTION = "resolution";
    public static final String RESOLVER_GROUP = "resolver_group";
    public static final String REOPEN_COUNT = "reopen_count";
    public static final String REOPENED_DATE = "reopened_date";
    public static final String SERVICE_DESK_1ST_ASSIGNED_DATE = "service_desk_1st_assigned_date";
    public static final String SERVICE_DESK_1ST_ASSIGNED_GROUP = "service_desk_1st_assigned_group";
    public static final String SUBMITTER = "submitter";
    public static final String OWNER_LOGIN_ID = "owner_login_id";
    public static final String IMPACT = "impact";
    public static final String SUBMIT_DATE = "submit_date";
    public static final String REPORT_DATE = "report_date";
    public static final String VIL_FUNCTION = "vil_function";
    public static final String IT_PARTNER = "it_partner";
    // time to resolve
    public static final String MTTR = "mttr";
    // response time to assign
    public static final String MTTI = "mtti";
}
