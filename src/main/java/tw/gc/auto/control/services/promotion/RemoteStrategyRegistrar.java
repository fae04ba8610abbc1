package tw.gc.auto.control.services.promotion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.control.config.ControlPlaneProperties;
import tw.gc.auto.control.entities.CapitalAllocation;
import tw.gc.auto.control.entities.StrategyCandidate;
import tw.gc.auto.control.exceptions.DeploymentFailureException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class RemoteStrategyRegistrar implements StrategyRegistrar {

    private final RestTemplate restTemplate;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    @Override
    public void register(StrategyCandidate candidate, CapitalAllocation allocation) {
        String url = properties.getEvolution().getBaseUrl() + "/api/strategies";

        Map<String, Object> request = new HashMap<>();
        request.put("id", candidate.getId());
        request.put("name", candidate.getName());
        request.put("fitness", candidate.getFitness());
        request.put("parameters", candidate.getParametersJson());
        request.put("allocation_id", allocation.getId());
        request.put("capital", allocation.getAmount());
        request.put("deployed_at", LocalDateTime.now(clock).toString());

        try {
            String response = restTemplate.postForObject(url, request, String.class);
            log.debug("📥 Registration response for {}: {}", candidate.getId(), response);
        } catch (RestClientException e) {
            throw new DeploymentFailureException("Registration of " + candidate.getId() + " failed: " + e.getMessage(), e);
        }
    }
}
