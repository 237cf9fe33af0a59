package com.culprit.analysis.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "incidents")
public class DbIncident {
  @Id
  private String id;

  private String title;

  @Column(nullable = false)
  private Instant createdAt;

  public String getId() { return id; }
  public String getTitle() { return title; }
  public Instant getCreatedAt() { return createdAt; }
}
