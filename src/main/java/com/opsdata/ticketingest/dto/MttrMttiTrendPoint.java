package com.opsdata.ticketingest.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MttrMttiTrendPoint(LocalDate date,
                                 BigDecimal avgMttrMinutes,
                                 BigDecimal avgMttiMinutes,
                                 long ticketCount) {
}
