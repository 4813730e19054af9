package com.ospicorp.outageanalytics.admin;

import com.ospicorp.outageanalytics.incident.service.IncidentPurgeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private final IncidentPurgeService purgeService;

  public AdminController(IncidentPurgeService purgeService) {
    this.purgeService = purgeService;
  }

  @PostMapping("/purge")
  @Operation(summary = "Purge incidents",
      description = "Deletes every stored incident and recreates the bucket in the background.")
  public ResponseEntity<Map<String, String>> purge() {
    purgeService.purgeAllAsync();
    return ResponseEntity.accepted().body(Map.of("status", "purge in progress"));
  }
}
