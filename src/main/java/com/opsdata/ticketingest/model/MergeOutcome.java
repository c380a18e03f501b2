package com.opsdata.ticketingest.model;

public enum MergeOutcome {
    INSERTED,
    UPDATED
}
