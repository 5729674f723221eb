package com.example.roadcare.engine;

import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.support.RecordingRunReporter;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ObsolescenceAggregatorTest {

    private final ObsolescenceAggregator aggregator = new ObsolescenceAggregator();

    @Test
    public void testUnionOfDisjointPartitions() {
        RecordingRunReporter reporter = new RecordingRunReporter();

        Set<String> ids = aggregator.aggregate(List.of(
                new PartitionResult("D1", Set.of("a", "b"), 3),
                new PartitionResult("D2", Set.of("c"), 1),
                new PartitionResult("D3", Set.of(), 0)), reporter);

        assertEquals(Set.of("a", "b", "c"), ids);
        assertEquals(0, reporter.overlappingIds);
    }

    @Test
    public void testOverlapIsMergedAndReported() {
        RecordingRunReporter reporter = new RecordingRunReporter();

        Set<String> ids = aggregator.aggregate(List.of(
                new PartitionResult("D1", Set.of("a", "b"), 3),
                new PartitionResult("D2", Set.of("b", "c"), 2)), reporter);

        assertEquals(Set.of("a", "b", "c"), ids);
        assertEquals(1, reporter.overlappingIds);
    }

    @Test
    public void testEmptyInput() {
        assertTrue(aggregator.aggregate(List.of(), new RecordingRunReporter()).isEmpty());
    }
}
