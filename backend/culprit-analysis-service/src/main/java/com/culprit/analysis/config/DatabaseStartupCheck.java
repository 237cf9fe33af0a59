package com.culprit.analysis.config;

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
    verifyConnection();
  }

  /** @return whether a connection could be opened; startup continues either way */
  public boolean verifyConnection() {
    try (Connection conn = dataSource.getConnection()) {
      log.info("Database connection successful ({})", conn.getMetaData().getDatabaseProductName());
      return true;
    } catch (Exception e) {
      log.error("Database connection failed: {}", e.getMessage());
      return false;
    }
  }
}
