package com.interviewpulse.aggregator.service.aggregation;

import com.interviewpulse.aggregator.domain.RawInsight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions a session's raw insights by {@link GroupKey}.
 *
 * <p>Records keep their arrival order inside a group; groups are returned in order of first
 * appearance, which is the tie-break order of the final sort.
 */
public class InsightGrouper {

    public Map<GroupKey, List<RawInsight>> group(List<RawInsight> records) {
        if (records == null || records.isEmpty()) {
            return Map.of();
        }
        Map<GroupKey, List<RawInsight>> grouped = new LinkedHashMap<>();
        for (RawInsight record : records) {
            GroupKey key = new GroupKey(record.category(), record.type());
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(grouped);
    }
}
