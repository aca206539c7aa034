package com.caltrade.backend.service.trigger;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.exception.CalendarSourceException;
import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.DispatchMetrics;
import com.caltrade.backend.service.ScheduledTaskGuard;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CalendarTriggersTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final ReconciliationService reconciliationService = mock(ReconciliationService.class);
    private final ScheduledTaskGuard guard = new ScheduledTaskGuard(new DispatchMetrics(new SimpleMeterRegistry()));
    private final CalendarTradeProperties properties = new CalendarTradeProperties();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void pushScansWideWindow() {
        when(reconciliationService.reconcileAndDispatch(any()))
                .thenAnswer(invocation -> ReconcileReport.empty(invocation.getArgument(0)));

        new CalendarChangeTrigger(reconciliationService, guard, properties, clock).onCalendarChanged();

        ReconcileWindow window = capturedWindow();
        assertThat(window.source()).isEqualTo(TriggerSource.PUSH);
        assertThat(window.start()).isEqualTo(NOW.minus(Duration.ofHours(24)));
        assertThat(window.end()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(window.lookAhead()).isNull();
    }

    @Test
    void pollScansNarrowWindow() {
        when(reconciliationService.reconcileAndDispatch(any()))
                .thenAnswer(invocation -> ReconcileReport.empty(invocation.getArgument(0)));

        new CalendarPollScheduler(reconciliationService, guard, properties, clock).poll();

        ReconcileWindow window = capturedWindow();
        assertThat(window.source()).isEqualTo(TriggerSource.POLL);
        assertThat(window.start()).isEqualTo(NOW);
        assertThat(window.end()).isEqualTo(NOW.plus(Duration.ofMinutes(2)));
        assertThat(window.lookAhead()).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void disabledPollDoesNothing() {
        properties.getPoll().setEnabled(false);

        new CalendarPollScheduler(reconciliationService, guard, properties, clock).poll();

        verifyNoInteractions(reconciliationService);
    }

    @Test
    void faultDoesNotEscapeTrigger() {
        when(reconciliationService.reconcileAndDispatch(any())).thenThrow(new CalendarSourceException("unreachable"));

        assertThat(new CalendarChangeTrigger(reconciliationService, guard, properties, clock).onCalendarChanged())
                .isEmpty();
    }

    private ReconcileWindow capturedWindow() {
        ArgumentCaptor<ReconcileWindow> captor = ArgumentCaptor.forClass(ReconcileWindow.class);
        verify(reconciliationService).reconcileAndDispatch(captor.capture());
        return captor.getValue();
    }
}
