package com.caltrade.backend.service.dispatch;

import com.caltrade.backend.dto.ExecutionServiceResponse;
import com.caltrade.backend.model.TradeBatch;
import com.caltrade.backend.model.TradeInstruction;

/**
 * Downstream service that places orders. Failures to reach it surface as
 * {@link com.caltrade.backend.exception.ExecutionServiceException}.
 */
public interface ExecutionServicePort {

    ExecutionServiceResponse submitTrade(TradeInstruction instruction, String correlationEventId, String correlationEventTitle);

    ExecutionServiceResponse submitBatch(TradeBatch batch, String correlationEventId, String correlationEventTitle);

    boolean isConfigured();

    /**
     * Whether a submit made now would reach the service. False while a circuit breaker is rejecting calls,
     * in which case callers must not claim the event.
     */
    boolean isAcceptingCalls();
}
