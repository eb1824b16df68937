package com.helpline.crm.freepbx;

/** Where the answering agent's screen goes once a call event is resolved. */
public final class CallRedirect {
  private CallRedirect() {}

  public static String url(String contactId, String phone, String eventId) {
    if (contactId != null) {
      return "/calls/new?contact=" + contactId + "&phone=" + phone + "&callEventId=" + eventId;
    }
    return "/contacts/new?phone=" + phone + "&callEventId=" + eventId;
  }

  public static String message(String contactName, String phone, boolean contactExists) {
    if (contactExists) {
      return "Contact found: " + (contactName == null || contactName.isBlank() ? phone : contactName);
    }
    return "New caller: " + phone + " - Create contact first";
  }
}
