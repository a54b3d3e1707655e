package com.invoiceDesk.analyzer.provider.client;

import com.invoiceDesk.analyzer.provider.exception.ProviderRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * Base for RestClient-based providers: runs a call and turns every failure into a
 * {@link ProviderRequestException} that says whether retrying the same provider makes sense.
 */
@Slf4j
abstract class AbstractRestProviderClient implements TextGenerationProvider {
    
    /**
     * Runs the HTTP exchange and validates that it produced text.
     */
    protected String execute(Supplier<String> exchange) {
        String text;
        try {
            text = exchange.get();
        } catch (RestClientResponseException e) {
            boolean retryable = isRetryable(e.getStatusCode());
            log.warn("{} API returned {} (retryable: {})", getDisplayName(), e.getStatusCode().value(), retryable);
            throw new ProviderRequestException(
                    getDisplayName() + " API error: HTTP " + e.getStatusCode().value(), retryable, e);
        } catch (ProviderRequestException e) {
            throw e;
        } catch (Exception e) {
            log.warn("{} API call failed: {}", getDisplayName(), e.getMessage());
            throw new ProviderRequestException(getDisplayName() + " API error: " + e.getMessage(), true, e);
        }
        
        if (text == null || text.isBlank()) {
            throw new ProviderRequestException(getDisplayName() + " API returned an empty completion", false);
        }
        return text;
    }
    
    /**
     * Server errors, timeouts and rate limiting are worth another attempt; other client errors are not.
     */
    static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError()
                || status.value() == HttpStatus.REQUEST_TIMEOUT.value()
                || status.value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
