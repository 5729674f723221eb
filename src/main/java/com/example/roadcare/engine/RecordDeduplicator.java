package com.example.roadcare.engine;

import com.example.roadcare.domain.ImageRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * id 列没有唯一约束时，同一ID只保留信息最完整的一行：
 * 采集时间最新者优先，其次已知序号最小者，再相同则保留先读到的。
 */
@Component
public class RecordDeduplicator {

    static final Comparator<ImageRecord> PREFERENCE = Comparator
            .comparing(ImageRecord::getCaptureDate, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(r -> r.hasKnownIndex() ? r.getIndex() : Integer.MAX_VALUE);

    public List<ImageRecord> deduplicate(List<ImageRecord> records) {
        Map<String, ImageRecord> best = new LinkedHashMap<>();
        for (ImageRecord record : records) {
            best.merge(record.getId(), record, (kept, candidate) ->
                    PREFERENCE.compare(candidate, kept) < 0 ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }
}
