package com.helpline.crm.call;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.domain.Entities.CallPriority;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class CallFilterTest {

  @Test
  void bareDatesCoverWholeDaysOnBothEnds() {
    Query query = new CallFilter(null, null, null, null, "2025-03-01", "2025-03-31").toQuery(ZoneOffset.UTC, 100);

    List<Document> and = query.getQueryObject().getList("$and", Document.class);
    Document range = and.get(0).get("timestamp", Document.class);
    assertEquals(Instant.parse("2025-03-01T00:00:00Z"), range.get("$gte"));
    assertEquals(Instant.parse("2025-03-31T23:59:59.999999999Z"), range.get("$lte"));
    assertEquals(100, query.getLimit());
    assertEquals(-1, query.getSortObject().get("timestamp"));
  }

  @Test
  void searchMatchesCallerContactAndNotesCaseInsensitively() {
    Query query = new CallFilter("Smith (", null, null, null, null, null).toQuery(ZoneOffset.UTC, 10);

    List<Document> and = query.getQueryObject().getList("$and", Document.class);
    List<Document> or = and.get(0).getList("$or", Document.class);
    assertEquals(List.of("callerNumber", "contactName", "notes"), or.stream().map(d -> d.keySet().iterator().next()).toList());
    Pattern notes = (Pattern) or.get(2).get("notes");
    assertEquals(Pattern.quote("Smith ("), notes.pattern());
    assertTrue(notes.matcher("called back mr smith (billing)").find());
  }

  @Test
  void fullTimestampsAreUsedAsGiven() {
    assertEquals(Instant.parse("2025-03-01T10:15:00Z"), CallFilter.lowerBound("2025-03-01T12:15:00+02:00", ZoneOffset.UTC));
    assertEquals(Instant.parse("2025-03-01T10:15:00Z"), CallFilter.upperBound("2025-03-01T10:15:00Z", ZoneOffset.UTC));
  }

  @Test
  void enumFiltersMatchStoredConstants() {
    Query query = new CallFilter(null, "complaint", "high", null, null, null).toQuery(ZoneOffset.UTC, 10);

    List<Document> and = query.getQueryObject().getList("$and", Document.class);
    assertEquals("complaint", and.get(0).get("callType"));
    assertEquals(CallPriority.HIGH, and.get(1).get("priority"));
  }

  @Test
  void unknownPriorityIsBadRequest() {
    var filter = new CallFilter(null, null, "critical", null, null, null);

    var ex = assertThrows(ApiException.class, () -> filter.toQuery(ZoneOffset.UTC, 10));
    assertEquals("BAD_REQUEST", ex.code());
  }

  @Test
  void garbledDateIsBadRequest() {
    assertThrows(ApiException.class, () -> CallFilter.lowerBound("yesterday", ZoneOffset.UTC));
    assertThrows(ApiException.class, () -> CallFilter.upperBound("2025-13-45", ZoneOffset.UTC));
  }

  @Test
  void noFiltersMatchEverything() {
    assertTrue(CallFilter.none().toQuery(ZoneOffset.UTC, 10).getQueryObject().isEmpty());
  }
}
