package com.opsdata.ticketingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TicketIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketIngestApplication.class, args);
    }
}
