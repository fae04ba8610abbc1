package tw.gc.auto.control.services.promotion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.StrategyCandidate;
import tw.gc.auto.control.exceptions.ValidationFailedException;

import java.util.HashMap;
import java.util.Map;

/**
 * Asks the evolution engine to paper-trade a candidate for the validation window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RemoteValidationRunner implements ValidationRunner {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ControlPlaneProperties properties;

    @Override
    public ValidationRun run(StrategyCandidate candidate, int validationPeriodDays) {
        String url = properties.getEvolution().getBaseUrl() + "/api/evotester/validate";

        Map<String, Object> request = new HashMap<>();
        request.put("strategy_id", candidate.getId());
        request.put("name", candidate.getName());
        request.put("parameters", candidate.getParametersJson());
        request.put("validation_days", validationPeriodDays);

        log.info("📤 Validating {} for {} days", candidate.getId(), validationPeriodDays);
        String response;
        try {
            response = restTemplate.postForObject(url, request, String.class);
        } catch (HttpClientErrorException.UnprocessableEntity e) {
            throw new ValidationFailedException(
                    "Validation environment refused " + candidate.getId() + ": " + e.getResponseBodyAsString(), e);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException("Unreadable validation response for " + candidate.getId(), e);
        }
        return new ValidationRun(
                requiredNumber(body, "pnl", candidate),
                requiredNumber(body, "win_rate", candidate),
                requiredNumber(body, "drawdown", candidate));
    }

    private static double requiredNumber(JsonNode body, String field, StrategyCandidate candidate) {
        JsonNode value = body.get(field);
        if (value == null || !value.isNumber()) {
            throw new IllegalStateException(
                    "Validation response for " + candidate.getId() + " has no numeric '" + field + "'");
        }
        return value.asDouble();
    }
}
