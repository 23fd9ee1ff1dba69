package com.migration.planning.waveforge.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reference record handed over by an upstream parser: the caller depends on the referenced object.
 * The relation type is carried for diagnostics only; rows that must not become edges are filtered upstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyEdge<T> {

    private T caller;
    private T referenced;
    private String relationType;

    public static <T> DependencyEdge<T> of(T caller, T referenced) {
        return new DependencyEdge<>(caller, referenced, null);
    }
}
