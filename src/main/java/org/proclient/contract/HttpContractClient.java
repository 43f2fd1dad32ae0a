package org.proclient.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.proclient.operation.Message;
import org.proclient.spi.IContractClient;
import org.proclient.system.ReleaseInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link IContractClient} backed by the contract server's REST API.
 * <p>
 * Attach posts the contract token to {@code /v1/context/machines/token}; refresh reads
 * {@code /v1/contracts/<contract>/context/machines/<machine>} with the machine token.
 * Both answer with a machine token document whose {@code machineTokenInfo} carries the
 * account, the contract and its resource entitlements.
 */
public class HttpContractClient implements IContractClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpContractClient.class);

    private final URI baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpContractClient(final URI baseUrl, final Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    HttpContractClient(final URI baseUrl, final Duration timeout, final HttpClient httpClient) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.httpClient = httpClient;
    }

    @Override
    public ContractInfo attach(final String contractToken, final String machineId, final ReleaseInfo release)
            throws ContractException {
        final ObjectNode body = mapper.createObjectNode();
        body.put("machineId", machineId);
        final ObjectNode os = body.putObject("os");
        os.put("type", "Linux");
        os.put("release", release.version());
        os.put("series", release.series());

        final HttpRequest request = HttpRequest.newBuilder()
            .uri(baseUrl.resolve("/v1/context/machines/token"))
            .timeout(timeout)
            .header("Authorization", "Bearer " + contractToken)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();

        final HttpResponse<String> response = send(request);
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw new ContractException(Message.ATTACH_INVALID_TOKEN, null);
        }
        if (response.statusCode() / 100 != 2) {
            LOGGER.warn("Contract server rejected attach with status {}: {}", response.statusCode(), response.body());
            throw new ContractException(Message.ATTACH_FAILURE, null);
        }
        return parse(response.body(), Message.ATTACH_FAILURE);
    }

    @Override
    public ContractInfo refresh(final String machineToken, final String contractId, final String machineId)
            throws ContractException {
        final HttpRequest request = HttpRequest.newBuilder()
            .uri(baseUrl.resolve("/v1/contracts/" + contractId + "/context/machines/" + machineId))
            .timeout(timeout)
            .header("Authorization", "Bearer " + machineToken)
            .GET()
            .build();

        final HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            LOGGER.warn("Contract server rejected refresh with status {}: {}", response.statusCode(), response.body());
            throw new ContractException(Message.REFRESH_CONTRACT_FAILURE, null);
        }
        final ContractInfo info = parse(response.body(), Message.REFRESH_CONTRACT_FAILURE);
        // The refresh endpoint omits the machine token when it has not been rotated.
        if (info.machineToken() == null) {
            return new ContractInfo(machineToken, info.contractId(), info.contractName(), info.accountName(),
                info.entitlements());
        }
        return info;
    }

    private HttpResponse<String> send(final HttpRequest request) throws ContractException {
        LOGGER.debug("{} {}", request.method(), request.uri());
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (final IOException e) {
            throw new ContractException(Message.CONNECTIVITY_ERROR, e, baseUrl, e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContractException(Message.CONNECTIVITY_ERROR, e, baseUrl, "interrupted");
        }
    }

    ContractInfo parse(final String body, final Message failure) throws ContractException {
        final JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (final JsonProcessingException e) {
            LOGGER.warn("Contract server returned malformed JSON: {}", e.getOriginalMessage());
            throw new ContractException(failure, e);
        }

        final JsonNode info = root.has("machineTokenInfo") ? root.get("machineTokenInfo") : root;
        final JsonNode contract = info.path("contractInfo");
        if (contract.isMissingNode()) {
            throw new ContractException(failure, null);
        }

        final List<ContractEntitlement> entitlements = new ArrayList<>();
        for (final JsonNode entitlement : contract.path("resourceEntitlements")) {
            final String type = entitlement.path("type").asText(null);
            if (type == null) {
                continue;
            }
            entitlements.add(new ContractEntitlement(
                type,
                entitlement.path("entitled").asBoolean(false),
                entitlement.path("obligations").path("enableByDefault").asBoolean(false)));
        }

        return new ContractInfo(
            root.path("machineToken").asText(null),
            contract.path("id").asText(null),
            contract.path("name").asText(null),
            info.path("accountInfo").path("name").asText(null),
            entitlements);
    }
}
