package com.migration.planning.waveforge.exception;

import com.migration.planning.waveforge.dto.wave.WavePartition;
import lombok.Getter;

import java.util.List;

/**
 * No condensation unit is ready although some remain unassigned, i.e. the unit graph is not acyclic.
 * Carries the stuck unit ids and the partitions completed before partitioning stopped; those
 * partitions are valid and can still be reported.
 */
@Getter
public class GraphInconsistencyException extends WavePlanningException {

    private final List<Integer> stuckUnitIds;
    private final List<? extends WavePartition<?>> completedPartitions;

    public GraphInconsistencyException(List<Integer> stuckUnitIds,
                                       List<? extends WavePartition<?>> completedPartitions) {
        super("No ready units found but " + stuckUnitIds.size()
                + " unassigned units remain; stuck unit ids: " + preview(stuckUnitIds));
        this.stuckUnitIds = List.copyOf(stuckUnitIds);
        this.completedPartitions = List.copyOf(completedPartitions);
    }

    private static String preview(List<Integer> ids) {
        if (ids.size() <= 20) {
            return ids.toString();
        }
        return ids.subList(0, 20) + " ... and " + (ids.size() - 20) + " more";
    }
}
