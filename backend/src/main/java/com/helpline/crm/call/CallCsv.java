package com.helpline.crm.call;

import com.helpline.crm.domain.Entities.CallEntity;

import java.util.List;
import java.util.Objects;

final class CallCsv {
  static final String HEADER = "ID,Caller Number,Contact Name,Agent,Duration (s),Call Type,Priority,Status,Notes,Resolution Notes,Timestamp";

  private CallCsv() {}

  static String render(List<CallEntity> rows) {
    StringBuilder sb = new StringBuilder(HEADER).append("\r\n");
    rows.forEach(c -> sb
        .append(csv(c.id)).append(',')
        .append(csv(c.callerNumber)).append(',')
        .append(csv(c.contactName)).append(',')
        .append(csv(c.agentName)).append(',')
        .append(c.duration).append(',')
        .append(csv(c.callType)).append(',')
        .append(csv(c.priority == null ? null : c.priority.value())).append(',')
        .append(csv(c.status == null ? null : c.status.value())).append(',')
        .append(csv(c.notes)).append(',')
        .append(csv(c.resolutionNotes)).append(',')
        .append(csv(Objects.toString(c.timestamp, null)))
        .append("\r\n"));
    return sb.toString();
  }

  // Quote only when the value would otherwise break the row.
  static String csv(String v) {
    if (v == null) return "";
    if (v.indexOf(',') < 0 && v.indexOf('"') < 0 && v.indexOf('\n') < 0 && v.indexOf('\r') < 0) return v;
    return '"' + v.replace("\"", "\"\"") + '"';
  }
}
