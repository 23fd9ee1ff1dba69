package com.migration.planning.waveforge.dto.wave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ask for an object to be placed in the given wave (1-based).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelocationRequest<T> {
    private T node;
    private int targetWave;
}
