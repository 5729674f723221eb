package com.example.roadcare.engine;

import com.example.roadcare.domain.ImageRecord;
import org.junit.Test;

import java.util.List;

import static com.example.roadcare.support.Records.BASE_DATE;
import static com.example.roadcare.support.Records.image;
import static org.junit.Assert.*;

public class RecordDeduplicatorTest {

    private final RecordDeduplicator deduplicator = new RecordDeduplicator();

    @Test
    public void testKeepsMostRecentCapture() {
        ImageRecord old = image("D1", 1).id("dup").captureDate(BASE_DATE).index(1).build();
        ImageRecord recent = image("D1", 2).id("dup").captureDate(BASE_DATE.plusDays(1)).index(9).build();
        ImageRecord undated = image("D1", 3).id("dup").index(0).build();

        List<ImageRecord> result = deduplicator.deduplicate(List.of(old, undated, recent));

        assertEquals(1, result.size());
        assertSame(recent, result.get(0));
    }

    @Test
    public void testSameDateKeepsLowestKnownIndex() {
        ImageRecord unknown = image("D1", 1).id("dup").captureDate(BASE_DATE).build();
        ImageRecord high = image("D1", 2).id("dup").captureDate(BASE_DATE).index(8).build();
        ImageRecord low = image("D1", 3).id("dup").captureDate(BASE_DATE).index(2).build();

        List<ImageRecord> result = deduplicator.deduplicate(List.of(unknown, high, low));

        assertSame(low, result.get(0));
    }

    @Test
    public void testFullTieKeepsFirstRow() {
        ImageRecord first = image("D1", 1).id("dup").build();
        ImageRecord second = image("D1", 2).id("dup").build();

        assertSame(first, deduplicator.deduplicate(List.of(first, second)).get(0));
    }

    @Test
    public void testUniqueRecordsUntouched() {
        List<ImageRecord> records = List.of(image("D1", 1).build(), image("D1", 2).build());

        assertEquals(records, deduplicator.deduplicate(records));
    }
}
