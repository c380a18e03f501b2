package com.opsdata.ticketingest.dto;

import java.math.BigDecimal;

public record AverageDurations(BigDecimal mttrMinutes, BigDecimal mttiMinutes) {
}
