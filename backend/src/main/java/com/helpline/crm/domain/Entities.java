package com.helpline.crm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class Entities {
  public enum Role {
    ADMIN, SUPERVISOR, AGENT;

    @JsonValue public String value(){ return name().toLowerCase(Locale.ROOT); }
    @JsonCreator public static Role of(String value){ return valueOf(value.trim().toUpperCase(Locale.ROOT)); }
  }

  public enum UserStatus {
    ACTIVE, INACTIVE;

    @JsonValue public String value(){ return name().toLowerCase(Locale.ROOT); }
    @JsonCreator public static UserStatus of(String value){ return valueOf(value.trim().toUpperCase(Locale.ROOT)); }
  }

  public enum CallPriority {
    LOW, NORMAL, HIGH, URGENT;

    @JsonValue public String value(){ return name().toLowerCase(Locale.ROOT); }
    @JsonCreator public static CallPriority of(String value){ return valueOf(value.trim().toUpperCase(Locale.ROOT)); }
  }

  public enum CallStatus {
    IN_PROGRESS, COMPLETED, FOLLOW_UP;

    @JsonValue public String value(){ return name().toLowerCase(Locale.ROOT); }
    @JsonCreator public static CallStatus of(String value){ return valueOf(value.trim().toUpperCase(Locale.ROOT)); }
  }

  @Document(collection = "users")
  public static class UserEntity {
    @Id public String id;
    // Unique index backs the existsByEmail pre-check when two sign-ups race.
    @Indexed(unique = true) public String email;
    @JsonIgnore public String passwordHash;
    public String name;
    public Role role = Role.AGENT;
    public UserStatus status = UserStatus.ACTIVE;
    @Indexed(sparse = true) public String extension;
    public Instant createdAt;
    public Instant lastLogin;

    public boolean active(){ return status != UserStatus.INACTIVE; }
  }

  // No unique index on phoneNumber: concurrent auto-creation can still insert duplicates.
  @Document(collection = "contacts")
  public static class ContactEntity {
    @Id public String id;
    @Indexed public String phoneNumber;
    public String name;
    public String email;
    public String address;
    public String company;
    public List<String> tags = new ArrayList<>();
    public Instant createdAt;
    public Instant updatedAt;
  }

  @Document(collection = "calls")
  public static class CallEntity {
    @Id public String id;
    public String contactId;
    public String agentId;
    public String agentName;
    public String callerNumber;
    public String contactName;
    public int duration;
    public String notes;
    public String callType = "inquiry";
    public CallPriority priority = CallPriority.NORMAL;
    public CallStatus status = CallStatus.COMPLETED;
    public String resolutionNotes;
    @Indexed public Instant timestamp;
    public String freepbxCallId;
  }

  @Document(collection = "call_events")
  public static class CallEventEntity {
    @Id public String id;
    public String freepbxCallId;
    public String callerNumber;
    @Indexed(sparse = true) public String agentId;
    public String agentExtension;
    public String contactId;
    public boolean contactExists;
    public String eventType;
    public String direction = "inbound";
    public String redirectUrl;
    public Instant timestamp;
    public Instant createdAt;
    public boolean processed;
    public Instant processedAt;
    public String callId;
  }
}
