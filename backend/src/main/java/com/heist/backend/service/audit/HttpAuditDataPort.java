package com.heist.backend.service.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heist.backend.config.AuditProperties;
import com.heist.backend.exception.CollaboratorException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Talks to a public Ethereum JSON-RPC node, honeypot.is, DEXTools and RugCheck.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "audit", name = "mode", havingValue = "LIVE")
public class HttpAuditDataPort implements AuditDataPort {

    private final RestTemplate collaboratorRestTemplate;
    private final Retry auditRetry;
    private final ObjectMapper objectMapper;
    private final AuditProperties properties;

    @Override
    public boolean hasContractCode(String address) {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "method", "eth_getCode",
                "params", List.of(address, "latest"),
                "id", 1);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode response = execute("ethereum-rpc", properties.getEndpoints().getEthereumRpcUrl(),
                HttpMethod.POST, new HttpEntity<>(request, headers));
        if (response.hasNonNull("error")) {
            throw new CollaboratorException("ethereum-rpc",
                    "eth_getCode error: " + response.path("error").path("message").asText());
        }
        String code = response.path("result").asText("");
        return !code.isEmpty() && !"0x".equalsIgnoreCase(code);
    }

    @Override
    public HoneypotReport honeypot(String address) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getHoneypotUrl())
                .queryParam("address", address)
                .queryParam("chainID", "1")
                .toUriString();
        JsonNode response = execute("honeypot", url, HttpMethod.GET, HttpEntity.EMPTY);
        // missing verdicts are read as the worst case
        boolean honeypot = response.path("honeypotResult").path("isHoneypot").asBoolean(true);
        JsonNode simulation = response.path("simulationResult");
        double buyTax = simulation.path("buyTax").asDouble(100);
        double sellTax = simulation.path("sellTax").asDouble(100);
        return new HoneypotReport(honeypot, buyTax, sellTax);
    }

    @Override
    public Optional<TokenInfo> tokenInfo(String address, String chain) {
        String apiKey = properties.getEndpoints().getDextoolsApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.empty();
        }
        String dextoolsChain = "solana".equals(chain) ? "solana" : "ether";
        String url = properties.getEndpoints().getDextoolsUrl() + "/" + dextoolsChain + "/" + address;
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-API-Key", apiKey);
        JsonNode response = execute("dextools", url, HttpMethod.GET, new HttpEntity<>(headers));
        JsonNode data = response.path("data");
        if (data.isMissingNode() || data.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new TokenInfo(
                textOrNull(data, "name"),
                textOrNull(data, "symbol"),
                textOrNull(data, "totalSupply"),
                data.path("liquidity").path("usd").asDouble(0),
                data.hasNonNull("topHolderPct") ? data.get("topHolderPct").asDouble() : null,
                data.hasNonNull("holders") ? data.get("holders").asInt() : null));
    }

    @Override
    public RugCheckReport rugCheck(String address) {
        String url = properties.getEndpoints().getRugcheckUrl() + "/" + address + "/report";
        JsonNode response = execute("rugcheck", url, HttpMethod.GET, HttpEntity.EMPTY);
        List<RugCheckReport.Risk> risks = new ArrayList<>();
        for (JsonNode risk : response.path("risks")) {
            risks.add(new RugCheckReport.Risk(
                    risk.path("name").asText("Unknown Risk"),
                    risk.path("level").asText("medium"),
                    risk.path("description").asText("")));
        }
        return new RugCheckReport(response.path("score").asDouble(0), risks);
    }

    private JsonNode execute(String collaborator, String url, HttpMethod method, HttpEntity<?> entity) {
        Supplier<String> request = () -> {
            try {
                ResponseEntity<String> response = collaboratorRestTemplate.exchange(url, method, entity, String.class);
                return response.getBody();
            } catch (HttpClientErrorException e) {
                throw new CollaboratorException(collaborator,
                        collaborator + " rejected request (" + e.getStatusCode().value() + ")", e);
            }
        };
        String body;
        try {
            body = Retry.decorateSupplier(auditRetry, request).get();
        } catch (RestClientException e) {
            throw new CollaboratorException(collaborator, collaborator + " request failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new CollaboratorException(collaborator, collaborator + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            log.warn("{} returned unparseable body: {}", collaborator, e.getMessage());
            throw new CollaboratorException(collaborator, collaborator + " returned malformed JSON", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
