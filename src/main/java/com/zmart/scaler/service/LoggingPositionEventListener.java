package com.zmart.scaler.service;

import com.zmart.scaler.position.PositionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingPositionEventListener implements PositionEventListener {

    @Override
    public void onEvent(PositionEvent event) {
        log.info("[EVENT] {}", event.toSummary());
    }
}
