package com.heist.backend.service.notification;

import com.heist.backend.config.OrchestratorProperties;
import com.heist.backend.event.PositionClosedEvent;
import com.heist.backend.event.PositionOpenedEvent;
import com.heist.backend.model.PositionSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PositionEventNotifier {

    private final NotificationService notificationService;
    private final OrchestratorProperties properties;

    @EventListener
    public void onOpened(PositionOpenedEvent event) {
        if (!properties.isNotifyOnOpen()) {
            return;
        }
        PositionSnapshot position = event.position();
        notificationService.notify(String.format(
                "🎯 TRADE EXECUTED%nToken: %s%nChain: %s%nAddress: %s%nAmount: $%s%nSafety Score: %s/100%nTx: %s",
                position.getSymbol(), position.getChain(), position.getAddress(),
                position.getEntryAmountUsd(),
                event.safetyScore() == null ? "n/a" : String.format("%.1f", event.safetyScore()),
                position.getEntryTxRef()));
    }

    @EventListener
    public void onClosed(PositionClosedEvent event) {
        if (!properties.isNotifyOnClose()) {
            return;
        }
        PositionSnapshot position = event.position();
        String icon = position.getPnlUsd() != null && position.getPnlUsd().signum() > 0 ? "💰" : "🔻";
        notificationService.notify(String.format(
                "%s POSITION CLOSED%nToken: %s%nReason: %s%nP&L: $%s (%s%%)%nTx: %s",
                icon, position.getSymbol(), position.getExitReason(),
                position.getPnlUsd(), position.getPnlPct(), position.getExitTxRef()));
    }
}
