package com.helpline.crm.call;

import com.helpline.crm.domain.Entities.CallPriority;
import com.helpline.crm.domain.Entities.CallStatus;
import org.springframework.data.mongodb.core.query.Update;

/** Partial call change; only non-null fields are written and nothing else is touched. */
public record CallPatch(Integer duration, String notes, String callType, CallPriority priority, CallStatus status, String resolutionNotes) {
  Update toUpdate() {
    Update update = new Update();
    if (duration != null) update.set("duration", duration);
    if (notes != null) update.set("notes", notes);
    if (callType != null) update.set("callType", callType);
    if (priority != null) update.set("priority", priority);
    if (status != null) update.set("status", status);
    if (resolutionNotes != null) update.set("resolutionNotes", resolutionNotes);
    return update;
  }

  boolean isEmpty() {
    return duration == null && notes == null && callType == null && priority == null && status == null && resolutionNotes == null;
  }
}
