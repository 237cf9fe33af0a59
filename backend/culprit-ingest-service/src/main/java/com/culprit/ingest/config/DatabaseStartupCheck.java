package com.culprit.ingest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

@Component
public class DatabaseStartupCheck {

  private static final Logger log = LoggerFactory.getLogger(DatabaseStartupCheck.class);

  private final DataSource dataSource;

  public DatabaseStartupCheck(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    try (Connection conn = dataSource.getConnection()) {
      log.info("Database connection successful ({})", conn.getMetaData().getURL());
    } catch (Exception e) {
      log.error("Database connection failed: {}", e.getMessage());
    }
  }
}
