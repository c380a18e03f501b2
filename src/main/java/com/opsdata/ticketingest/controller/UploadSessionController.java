package com.opsdata.ticketingest.controller;

import com.opsdata.ticketingest.dto.UploadSessionResponse;
import com.opsdata.ticketingest.service.UploadSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/upload-sessions")
@Tag(name = "Upload Sessions", description = "Progress of ticket uploads")
public class UploadSessionController {

    private final UploadSessionService uploadSessionService;

    public UploadSessionController(UploadSessionService uploadSessionService) {
        this.uploadSessionService = uploadSessionService;
    }

    @Operation(summary = "Get one upload session")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Session found"),
            @ApiResponse(responseCode = "404", description = "No such session")
    })
    @GetMapping("/{id}")
    public ResponseEntity<UploadSessionResponse> getSession(@PathVariable("id") UUID id) {
        return uploadSessionService.find(id)
                .map(UploadSessionResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "List a user's upload sessions, newest first")
    @GetMapping
    public ResponseEntity<List<UploadSessionResponse>> listSessions(
            @Parameter(description = "Email the sessions were requested by", required = true)
            @RequestParam("requestedBy") String requestedBy) {
        List<UploadSessionResponse> sessions = uploadSessionService.findByRequester(requestedBy).stream()
                .map(UploadSessionResponse::from)
                .toList();
        return ResponseEntity.ok(sessions);
    }
}
