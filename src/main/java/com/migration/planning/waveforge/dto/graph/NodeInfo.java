package com.migration.planning.waveforge.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * External metadata attached to a graph node.
 * Only used by partitioning heuristics (category leveling, ETL tier); never interpreted otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInfo {

    public static final String UNKNOWN_CATEGORY = "Unknown";

    private String category;          // e.g. TABLE, VIEW, FUNCTION, PROCEDURE, ETL
    private String technology;        // e.g. SSIS, Informatica (optional)
    private String conversionStatus;  // optional

    public static NodeInfo ofCategory(String category) {
        return NodeInfo.builder().category(category).build();
    }
}
