package com.helpline.crm.freepbx;

public final class PhoneNumbers {
  private PhoneNumbers() {}

  /**
   * Canonical lookup key for a caller id: digits only, plus a {@code +} when it is the first
   * character kept. {@code "+1 (555) 012-3456"} becomes {@code "+15550123456"}.
   */
  public static String normalize(String callerId) {
    if (callerId == null) return "";
    StringBuilder sb = new StringBuilder(callerId.length());
    for (int i = 0; i < callerId.length(); i++) {
      char ch = callerId.charAt(i);
      if (ch >= '0' && ch <= '9') {
        sb.append(ch);
      } else if (ch == '+' && sb.length() == 0) {
        sb.append(ch);
      }
    }
    return sb.toString();
  }
}
