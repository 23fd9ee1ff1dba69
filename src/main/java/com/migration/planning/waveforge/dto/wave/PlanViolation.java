package com.migration.planning.waveforge.dto.wave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A broken plan invariant found by the validator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanViolation {

    public enum Kind {
        FORWARD_DEPENDENCY,  // an object depends on an object in a later wave
        SPLIT_CYCLE,         // members of one SCC ended up in different waves
        MISSING_NODE,        // a graph node is in no wave
        DUPLICATE_NODE,      // a node is in more than one wave
        UNKNOWN_NODE         // a wave contains a node the graph does not know
    }

    private Kind kind;
    private String message;
    private List<String> nodes;
}
