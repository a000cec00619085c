package com.heist.backend.service.notification;

import com.heist.backend.config.OrchestratorProperties;
import com.heist.backend.event.PositionClosedEvent;
import com.heist.backend.event.PositionOpenedEvent;
import com.heist.backend.model.ExitReason;
import com.heist.backend.model.PositionSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PositionEventNotifierTest {

    @Mock
    private NotificationService notificationService;

    @Test
    void announcesOpenedPosition() {
        PositionEventNotifier notifier = new PositionEventNotifier(notificationService, new OrchestratorProperties());
        PositionSnapshot position = PositionSnapshot.builder()
                .symbol("PEPE")
                .chain("ethereum")
                .address("0x6982508145454Ce325dDbE47a25d4ec3d2311933")
                .entryAmountUsd(new BigDecimal("150.0000"))
                .entryTxRef("0xDRYRUN_abc")
                .build();

        notifier.onOpened(new PositionOpenedEvent(position, 92.5, Instant.now()));

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(notificationService).notify(message.capture());
        assertThat(message.getValue()).contains("TRADE EXECUTED", "PEPE", "$150.0000", "92.5/100");
    }

    @Test
    void closeAnnouncementsCanBeTurnedOff() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setNotifyOnClose(false);
        PositionEventNotifier notifier = new PositionEventNotifier(notificationService, properties);
        PositionSnapshot position = PositionSnapshot.builder()
                .symbol("PEPE")
                .exitReason(ExitReason.STOP_LOSS)
                .pnlUsd(new BigDecimal("-50"))
                .build();

        notifier.onClosed(new PositionClosedEvent(position, Instant.now()));

        verify(notificationService, never()).notify(anyString());
    }
}
