package com.caltrade.backend.service.dispatch;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.dto.BatchTradeRequestPayload;
import com.caltrade.backend.dto.ExecutionServiceResponse;
import com.caltrade.backend.dto.TradeRequestPayload;
import com.caltrade.backend.exception.ExecutionServiceException;
import com.caltrade.backend.model.TradeBatch;
import com.caltrade.backend.model.TradeInstruction;
import com.caltrade.backend.service.DispatchMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

@Slf4j
@Service
public class HttpExecutionServiceClient implements ExecutionServicePort {

    static final String TRADE_PATH = "/trade";
    static final String BATCH_PATH = "/trades/batch";
    private static final String API_KEY_HEADER = "X-API-Key";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final DispatchMetrics dispatchMetrics;
    private final CalendarTradeProperties.Execution config;

    public HttpExecutionServiceClient(@Qualifier("executionRestTemplate") RestTemplate restTemplate,
                                      @Qualifier("executionCircuitBreaker") CircuitBreaker circuitBreaker,
                                      DispatchMetrics dispatchMetrics,
                                      CalendarTradeProperties properties) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.dispatchMetrics = dispatchMetrics;
        this.config = properties.getExecution();
    }

    @Override
    public boolean isConfigured() {
        return config.getBaseUrl() != null && !config.getBaseUrl().isBlank();
    }

    @Override
    public boolean isAcceptingCalls() {
        if (!isConfigured()) {
            return false;
        }
        // acquiring moves an expired OPEN breaker to HALF_OPEN; the permit is handed back untouched
        if (!circuitBreaker.tryAcquirePermission()) {
            log.warn("Execution service circuit breaker is {}, not accepting calls", circuitBreaker.getState());
            return false;
        }
        circuitBreaker.releasePermission();
        return true;
    }

    @Override
    public ExecutionServiceResponse submitTrade(TradeInstruction instruction, String correlationEventId, String correlationEventTitle) {
        TradeRequestPayload payload = new TradeRequestPayload(
                instruction.symbol(),
                instruction.action().name(),
                instruction.quantity(),
                correlationEventId,
                correlationEventTitle
        );
        log.info("Submitting trade {} for event {}", instruction.describe(), correlationEventId);
        return post(TRADE_PATH, payload);
    }

    @Override
    public ExecutionServiceResponse submitBatch(TradeBatch batch, String correlationEventId, String correlationEventTitle) {
        BatchTradeRequestPayload payload = new BatchTradeRequestPayload(batch.rawText(), correlationEventId, correlationEventTitle);
        log.info("Submitting batch of {} trades for event {}", batch.size(), correlationEventId);
        return post(BATCH_PATH, payload);
    }

    private ExecutionServiceResponse post(String path, Object payload) {
        if (!isConfigured()) {
            throw new ExecutionServiceException("Execution service base URL not configured");
        }
        Timer.Sample sample = dispatchMetrics.startExecutionCall();
        boolean success = false;
        Supplier<ExecutionServiceResponse> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> doPost(path, payload));
        try {
            ExecutionServiceResponse response = call.get();
            success = response != null && response.isSuccess();
            return response;
        } catch (CallNotPermittedException e) {
            throw new ExecutionServiceException("Execution service circuit breaker open", e);
        } finally {
            dispatchMetrics.stopExecutionCall(sample, path, success);
        }
    }

    private ExecutionServiceResponse doPost(String path, Object payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.set(API_KEY_HEADER, config.getApiKey());
        }
        String url = stripTrailingSlash(config.getBaseUrl()) + path;
        try {
            ResponseEntity<ExecutionServiceResponse> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(payload, headers), ExecutionServiceResponse.class);
            ExecutionServiceResponse body = response.getBody();
            if (body == null) {
                throw new ExecutionServiceException("Execution service returned an empty body", response.getStatusCode().value(), null);
            }
            return body;
        } catch (HttpStatusCodeException e) {
            throw new ExecutionServiceException("Execution service error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Execution service unreachable at {}: {}", url, e.getMessage());
            throw new ExecutionServiceException("Execution service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExecutionServiceException("Execution service call failed: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
