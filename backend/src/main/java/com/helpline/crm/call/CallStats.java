package com.helpline.crm.call;

import java.util.Map;

public record CallStats(long totalCalls, long callsToday, long callsThisWeek,
                        Map<String, Long> callsByType, Map<String, Long> callsByPriority, Map<String, Long> callsByStatus,
                        double avgDuration) {
}
