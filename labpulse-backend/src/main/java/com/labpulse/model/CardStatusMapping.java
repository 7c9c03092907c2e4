package com.labpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A dashboard card that shows a status dot, with its optional monitor binding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CardStatusMapping {
    private long cardId;
    /**
     * Card-specific source integration. Null falls back to the global status source.
     */
    private Long statusSourceId;
    private String monitorName;
}
