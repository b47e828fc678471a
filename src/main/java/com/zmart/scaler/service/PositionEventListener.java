package com.zmart.scaler.service;

import com.zmart.scaler.position.PositionEvent;

/**
 * Receives position transitions, e.g. an execution or notification adapter.
 * Called while the position is still locked; implementations should return quickly.
 */
public interface PositionEventListener {

    void onEvent(PositionEvent event);
}
