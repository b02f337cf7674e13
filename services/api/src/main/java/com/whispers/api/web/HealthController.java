package com.whispers.api.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api")
class HealthController {

  private static final Logger log = LoggerFactory.getLogger(HealthController.class);

  private final JdbcTemplate jdbc;
  private final Clock clock;

  HealthController(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
  }

  @GetMapping("/health")
  ResponseEntity<HealthResponse> health() {
    boolean database;
    try {
      jdbc.queryForObject("select 1", Integer.class);
      database = true;
    } catch (DataAccessException e) {
      log.warn("Health check could not reach the database: {}", e.getMessage());
      database = false;
    }
    var body = new HealthResponse(database, database, clock.instant().toString());
    return ResponseEntity.status(database ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  record HealthResponse(boolean ok, boolean database, String now) {}
}
