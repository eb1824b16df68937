package com.helpline.crm.call;

import com.helpline.crm.common.ApiException;
import com.helpline.crm.contact.ContactService;
import com.helpline.crm.domain.Entities.CallPriority;
import com.helpline.crm.domain.Entities.CallStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Filters shared by the call list and the CSV export. Both date bounds are inclusive; a bare
 * {@code yyyy-MM-dd} covers the whole day in the given zone.
 */
public record CallFilter(String search, String callType, String priority, String status, String dateFrom, String dateTo) {

  public static CallFilter none() {
    return new CallFilter(null, null, null, null, null, null);
  }

  Query toQuery(ZoneId zone, int limit) {
    List<Criteria> filters = new ArrayList<>();
    if (StringUtils.hasText(search)) filters.add(ContactService.containsAny(search, "callerNumber", "contactName", "notes"));
    if (StringUtils.hasText(callType)) filters.add(Criteria.where("callType").is(callType));
    if (StringUtils.hasText(priority)) filters.add(Criteria.where("priority").is(parsePriority(priority)));
    if (StringUtils.hasText(status)) filters.add(Criteria.where("status").is(parseStatus(status)));

    Instant from = StringUtils.hasText(dateFrom) ? lowerBound(dateFrom, zone) : null;
    Instant to = StringUtils.hasText(dateTo) ? upperBound(dateTo, zone) : null;
    if (from != null || to != null) {
      Criteria range = Criteria.where("timestamp");
      if (from != null) range = range.gte(from);
      if (to != null) range = range.lte(to);
      filters.add(range);
    }

    Query query = filters.isEmpty() ? new Query() : new Query(new Criteria().andOperator(filters));
    return query.with(Sort.by(Sort.Direction.DESC, "timestamp")).limit(limit);
  }

  static Instant lowerBound(String value, ZoneId zone) {
    try {
      if (isDateOnly(value)) return LocalDate.parse(value.trim()).atStartOfDay(zone).toInstant();
      return OffsetDateTime.parse(value.trim()).toInstant();
    } catch (DateTimeParseException e) {
      throw ApiException.badRequest("Invalid date: " + value);
    }
  }

  static Instant upperBound(String value, ZoneId zone) {
    try {
      if (isDateOnly(value)) return LocalDate.parse(value.trim()).plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
      return OffsetDateTime.parse(value.trim()).toInstant();
    } catch (DateTimeParseException e) {
      throw ApiException.badRequest("Invalid date: " + value);
    }
  }

  private static boolean isDateOnly(String value) {
    return value.trim().length() == 10;
  }

  static CallPriority parsePriority(String value) {
    try {
      return CallPriority.of(value);
    } catch (IllegalArgumentException e) {
      throw ApiException.badRequest("Invalid priority: " + value);
    }
  }

  static CallStatus parseStatus(String value) {
    try {
      return CallStatus.of(value);
    } catch (IllegalArgumentException e) {
      throw ApiException.badRequest("Invalid status: " + value);
    }
  }
}
