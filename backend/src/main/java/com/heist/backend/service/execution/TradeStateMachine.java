package com.heist.backend.service.execution;

import com.heist.backend.model.Position;
import com.heist.backend.model.TradeStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class TradeStateMachine {

    /**
     * @return false when the position already sits in the target state
     * @throws IllegalStateException on a transition the lifecycle does not allow
     */
    public boolean transition(Position position, TradeStatus target, String reason) {
        if (position == null || target == null) {
            return false;
        }
        TradeStatus current = position.getStatus();
        if (current == target) {
            return false;
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid position state transition: " + current + " -> " + target
                    + " for " + position.getId());
        }
        position.setStatus(target);
        log.debug("Position {} {} -> {} reason={} signalKey={}",
                position.getId(), current, target, reason, MDC.get("signalKey"));
        return true;
    }
}
