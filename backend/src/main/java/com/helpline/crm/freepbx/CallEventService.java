package com.helpline.crm.freepbx;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.config.AccessPolicy;
import com.helpline.crm.config.FreePbxProperties;
import com.helpline.crm.contact.ContactService;
import com.helpline.crm.domain.CallEventRepository;
import com.helpline.crm.domain.Entities.CallEventEntity;
import com.helpline.crm.domain.Entities.ContactEntity;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class CallEventService {
  private static final Logger log = LoggerFactory.getLogger(CallEventService.class);
  static final int DEFAULT_LIMIT = 50;
  static final int PENDING_LIMIT = 10;

  private final CallEventRepository events;
  private final ContactService contacts;
  private final UserRepository users;
  private final MongoOperations mongo;
  private final FreePbxProperties properties;
  private final Clock clock;

  public CallEventService(CallEventRepository events, ContactService contacts, UserRepository users,
                          MongoOperations mongo, FreePbxProperties properties, Clock clock) {
    this.events = events;
    this.contacts = contacts;
    this.users = users;
    this.mongo = mongo;
    this.properties = properties;
    this.clock = clock;
  }

  public record CallEventPayload(String eventType, String callerId, String extension, String agentUsername,
                                 String callId, String timestamp, String direction) {}

  public record CallEventResult(boolean success, String redirectUrl, boolean contactExists, String contactId,
                                String callEventId, String message) {}

  /**
   * With no secret configured every delivery is accepted; that mode exists for lab setups and
   * leaves the webhook open to anyone who can reach it.
   */
  public void verifySecret(String provided) {
    if (!properties.hasWebhookSecret()) return;
    byte[] expected = properties.getWebhookSecret().getBytes(StandardCharsets.UTF_8);
    byte[] actual = provided == null ? new byte[0] : provided.getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(expected, actual)) {
      log.warn("Rejected FreePBX call event: invalid webhook secret");
      throw ApiException.unauthorized("Invalid webhook secret");
    }
  }

  public CallEventResult receive(CallEventPayload payload, String secret) {
    verifySecret(secret);
    log.info("FreePBX call event received: {} from {}", payload.eventType(), payload.callerId());

    String callerNumber = PhoneNumbers.normalize(payload.callerId());
    Optional<ContactEntity> contact = contacts.findByPhone(callerNumber);
    if (contact.isEmpty() && !payload.callerId().equals(callerNumber)) {
      contact = contacts.findByPhone(payload.callerId());
    }
    Optional<UserEntity> agent = resolveAgent(payload.agentUsername(), payload.extension());

    Instant now = clock.instant();
    CallEventEntity e = new CallEventEntity();
    e.id = UUID.randomUUID().toString();
    e.freepbxCallId = payload.callId();
    e.callerNumber = callerNumber;
    e.agentId = agent.map(a -> a.id).orElse(null);
    e.agentExtension = payload.extension();
    e.contactId = contact.map(c -> c.id).orElse(null);
    e.contactExists = contact.isPresent();
    e.eventType = payload.eventType();
    e.direction = StringUtils.hasText(payload.direction()) ? payload.direction() : "inbound";
    e.redirectUrl = CallRedirect.url(e.contactId, callerNumber, e.id);
    e.timestamp = eventTime(payload.timestamp(), now);
    e.createdAt = now;
    e.processed = false;
    events.insert(e);

    log.info("Call event {} created. Redirect: {}", e.id, e.redirectUrl);
    String message = CallRedirect.message(contact.map(c -> c.name).orElse(null), callerNumber, e.contactExists);
    return new CallEventResult(true, e.redirectUrl, e.contactExists, e.contactId, e.id, message);
  }

  Optional<UserEntity> resolveAgent(String agentUsername, String extension) {
    Optional<UserEntity> agent = StringUtils.hasText(agentUsername) ? users.findByEmail(agentUsername) : Optional.empty();
    if (agent.isEmpty() && StringUtils.hasText(extension)) {
      agent = users.findFirstByExtension(extension);
    }
    return agent;
  }

  private Instant eventTime(String timestamp, Instant fallback) {
    if (!StringUtils.hasText(timestamp)) return fallback;
    try {
      return OffsetDateTime.parse(timestamp.trim()).toInstant();
    } catch (DateTimeParseException ex) {
      log.warn("Ignoring unparseable call event timestamp '{}', using receipt time", timestamp);
      return fallback;
    }
  }

  /** Agents only ever see events addressed to them; supervisors and admins see everything. */
  public List<CallEventEntity> list(UserEntity viewer, String agentId, Boolean processed, int limit) {
    Query query = new Query();
    if (StringUtils.hasText(agentId)) {
      query.addCriteria(Criteria.where("agentId").is(agentId));
    } else if (!AccessPolicy.SUPERVISOR_OR_ADMIN.allows(viewer.role)) {
      query.addCriteria(Criteria.where("agentId").is(viewer.id));
    }
    if (processed != null) {
      query.addCriteria(Criteria.where("processed").is(processed));
    }
    query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit > 0 ? limit : DEFAULT_LIMIT);
    return mongo.find(query, CallEventEntity.class);
  }

  public List<CallEventEntity> pending(UserEntity viewer) {
    return list(viewer, null, false, PENDING_LIMIT);
  }

  public CallEventEntity get(String id) {
    return events.findById(id).orElseThrow(() -> ApiException.notFound("Call event not found"));
  }

  /** Re-marking an already processed event just refreshes {@code processedAt}. */
  public void markProcessed(String id) {
    if (!events.existsById(id)) throw ApiException.notFound("Call event not found");
    mongo.updateFirst(Query.query(Criteria.where("id").is(id)),
        new Update().set("processed", true).set("processedAt", clock.instant()),
        CallEventEntity.class);
  }

  /**
   * Marks the event as consumed by call {@code callId}. Unknown or blank ids are not an error:
   * the call is simply logged without a PBX reference.
   */
  public Optional<CallEventEntity> linkToCall(String eventId, String callId, Instant at) {
    if (!StringUtils.hasText(eventId)) return Optional.empty();
    Optional<CallEventEntity> event = events.findById(eventId);
    event.ifPresent(e -> mongo.updateFirst(Query.query(Criteria.where("id").is(eventId)),
        new Update().set("processed", true).set("processedAt", at).set("callId", callId),
        CallEventEntity.class));
    return event;
  }
}
