package com.helpline.crm.call;

import com.helpline.crm.domain.Entities.CallPriority;
import com.helpline.crm.domain.Entities.CallStatus;

/** Fields an agent supplies when logging a call. */
public record CallDraft(String callerNumber, int duration, String notes, String callType, CallPriority priority,
                        CallStatus status, String resolutionNotes, String contactId) {
  public CallDraft {
    if (callType == null || callType.isBlank()) callType = "inquiry";
    if (priority == null) priority = CallPriority.NORMAL;
    if (status == null) status = CallStatus.COMPLETED;
  }
}
