package com.whereq.herald.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a single delivery attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchResult {

    private boolean success;

    private String deliveryId;

    private String error;

    public static DispatchResult delivered(String deliveryId) {
        return DispatchResult.builder().success(true).deliveryId(deliveryId).build();
    }

    public static DispatchResult failed(String error) {
        return DispatchResult.builder().success(false).error(error).build();
    }
}
