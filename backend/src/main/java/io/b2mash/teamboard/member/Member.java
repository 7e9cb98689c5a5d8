package io.b2mash.teamboard.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "members")
public class Member {

  public static final String STATUS_ACTIVE = "active";
  public static final String STATUS_INACTIVE = "inactive";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "external_user_id", nullable = false, length = 255)
  private String externalUserId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "avatar_url", length = 1000)
  private String avatarUrl;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Column(name = "job_title", length = 100)
  private String jobTitle;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(String externalUserId, String email, String name, String avatarUrl, String role) {
    this.externalUserId = externalUserId;
    this.email = email;
    this.name = name;
    this.avatarUrl = avatarUrl;
    this.role = role;
    this.status = STATUS_ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateFrom(String email, String name, String avatarUrl, String role) {
    this.email = email;
    this.name = name;
    this.avatarUrl = avatarUrl;
    this.role = role;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.status = STATUS_INACTIVE;
    this.updatedAt = Instant.now();
  }

  public boolean isActive() {
    return STATUS_ACTIVE.equals(status);
  }

  public UUID getId() {
    return id;
  }

  public String getExternalUserId() {
    return externalUserId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public String getRole() {
    return role;
  }

  public String getJobTitle() {
    return jobTitle;
  }

  public void setJobTitle(String jobTitle) {
    this.jobTitle = jobTitle;
    this.updatedAt = Instant.now();
  }

  public String getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
