package com.opsdata.ticketingest.dto;

public record CategoryMigrationResult(int scanned, int migrated, int skipped, int optionsCreated) {
}
