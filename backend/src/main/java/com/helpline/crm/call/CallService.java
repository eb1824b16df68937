package com.helpline.crm.call;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.contact.ContactService;
import com.helpline.crm.domain.CallRepository;
import com.helpline.crm.domain.Entities.CallEntity;
import com.helpline.crm.domain.Entities.ContactEntity;
import com.helpline.crm.domain.Entities.UserEntity;
import com.helpline.crm.freepbx.CallEventService;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
public class CallService {
  static final int LIST_LIMIT = 1000;
  static final int EXPORT_LIMIT = 10000;

  private final CallRepository calls;
  private final ContactService contacts;
  private final CallEventService callEvents;
  private final MongoOperations mongo;
  private final Clock clock;

  public CallService(CallRepository calls, ContactService contacts, CallEventService callEvents, MongoOperations mongo, Clock clock) {
    this.calls = calls;
    this.contacts = contacts;
    this.callEvents = callEvents;
    this.mongo = mongo;
    this.clock = clock;
  }

  public List<CallEntity> list(CallFilter filter) {
    return mongo.find(filter.toQuery(clock.getZone(), LIST_LIMIT), CallEntity.class);
  }

  public CallEntity get(String id) {
    return calls.findById(id).orElseThrow(() -> ApiException.notFound("Call not found"));
  }

  /**
   * Logs a call for {@code agent}. The contact is the explicit one if it exists, else the first
   * contact holding the caller number, else a bare contact created here. The check-then-insert is
   * not atomic, so two concurrent calls from the same unknown number may each create a contact.
   */
  public CallEntity create(UserEntity agent, CallDraft draft, String callEventId) {
    ContactEntity contact = contacts.findById(draft.contactId())
        .or(() -> contacts.findByPhone(draft.callerNumber()))
        .orElseGet(() -> contacts.createBare(draft.callerNumber()));

    CallEntity call = new CallEntity();
    call.id = UUID.randomUUID().toString();
    call.contactId = contact.id;
    call.agentId = agent.id;
    call.agentName = agent.name;
    call.callerNumber = draft.callerNumber();
    call.contactName = contact.name;
    call.duration = draft.duration();
    call.notes = draft.notes();
    call.callType = draft.callType();
    call.priority = draft.priority();
    call.status = draft.status();
    call.resolutionNotes = draft.resolutionNotes();
    call.timestamp = clock.instant();

    callEvents.linkToCall(callEventId, call.id, call.timestamp)
        .ifPresent(event -> call.freepbxCallId = event.freepbxCallId);

    calls.insert(call);
    return call;
  }

  public CallEntity update(String id, CallPatch patch) {
    if (patch.isEmpty()) return get(id);
    CallEntity updated = mongo.findAndModify(
        Query.query(Criteria.where("id").is(id)),
        patch.toUpdate(),
        FindAndModifyOptions.options().returnNew(true),
        CallEntity.class);
    if (updated == null) throw ApiException.notFound("Call not found");
    return updated;
  }

  public CallStats stats() {
    LocalDate today = LocalDate.now(clock);
    Instant todayStart = today.atStartOfDay(clock.getZone()).toInstant();
    Instant weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay(clock.getZone()).toInstant();

    return new CallStats(
        calls.count(),
        calls.countByTimestampGreaterThanEqual(todayStart),
        calls.countByTimestampGreaterThanEqual(weekStart),
        countBy("callType", false),
        countBy("priority", true),
        countBy("status", true),
        averageDuration());
  }

  public String exportCsv(CallFilter filter) {
    return CallCsv.render(mongo.find(filter.toQuery(clock.getZone(), EXPORT_LIMIT), CallEntity.class));
  }

  // Enum-backed fields are stored by constant name and reported by wire value.
  private Map<String, Long> countBy(String field, boolean enumField) {
    var aggregation = Aggregation.newAggregation(Aggregation.group(field).count().as("count"));
    Map<String, Long> counts = new LinkedHashMap<>();
    mongo.aggregate(aggregation, CallEntity.class, GroupCount.class).getMappedResults()
        .forEach(g -> counts.merge(g.id == null ? "unknown" : enumField ? g.id.toLowerCase(Locale.ROOT) : g.id, g.count, Long::sum));
    return counts;
  }

  private double averageDuration() {
    var aggregation = Aggregation.newAggregation(Aggregation.group().avg("duration").as("avgDuration"));
    var result = mongo.aggregate(aggregation, CallEntity.class, AverageDuration.class).getUniqueMappedResult();
    return result == null || result.avgDuration == null ? 0 : result.avgDuration;
  }

  public static class GroupCount {
    public String id;
    public long count;
  }

  public static class AverageDuration {
    public Double avgDuration;
  }
}
