package org.tanzu.vcenterperf.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Client for the vCenter VI/JSON API (vSphere 8.0 U1 and later).
 *
 * VI/JSON exposes the vim25 managed object model over HTTP:
 * - Properties are read with GET /sdk/vim25/{release}/{type}/{moId}/{property}
 * - Methods are invoked with POST /sdk/vim25/{release}/{type}/{moId}/{method}
 * - The session id travels in the vmware-api-session-id header
 * - Faults come back as HTTP errors whose body is the fault object
 *
 * Each instance is bound to one endpoint. All calls block, and every call is bound to
 * the {@link RunContext} so that cancelling the run aborts it.
 */
public class VimJsonClient implements VimApi {

    private static final Logger logger = LoggerFactory.getLogger(VimJsonClient.class);

    /** Header carrying the session id in both directions */
    static final String SESSION_HEADER = "vmware-api-session-id";

    private final URI endpoint;

    private final WebClient webClient;

    private final VimJsonCodec codec;

    private final RunContext runContext;

    /**
     * Constructs a client for one SDK endpoint.
     *
     * @param endpoint SDK endpoint, e.g. https://vc.example.com:443/sdk
     * @param apiRelease VI/JSON release path segment, e.g. "8.0.1.0"
     * @param webClientBuilder Pre-configured builder with SSL and timeout settings
     * @param runContext Cancellation scope of the run
     */
    public VimJsonClient(URI endpoint, String apiRelease, WebClient.Builder webClientBuilder, RunContext runContext) {
        this.endpoint = endpoint;
        this.runContext = runContext;
        this.codec = new VimJsonCodec(new ObjectMapper());

        String baseUrl = endpoint.toString().replaceAll("/+$", "") + "/vim25/" + apiRelease;
        logger.debug("Initializing VimJsonClient for {}", baseUrl);
        this.webClient = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .build();
    }

    @Override
    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public ServiceContent retrieveServiceContent() {
        JsonNode content = invoke(HttpMethod.GET, "/ServiceInstance/ServiceInstance/content", null, null).body;
        ServiceContent serviceContent = codec.readServiceContent(content);
        logger.debug("Service content: {}", serviceContent);
        return serviceContent;
    }

    @Override
    public String login(ManagedObjectReference sessionManager, String userName, String password) {
        logger.debug("Logging in to {} as {}", endpoint, userName);
        VimResponse response = invoke(HttpMethod.POST, methodPath(sessionManager, "Login"), null,
                codec.loginRequest(userName, password));
        String sessionId = response.sessionId;
        if (sessionId == null || sessionId.isEmpty()) {
            throw new VimFaultException("InvalidResponse", response.status, "Login response carried no " + SESSION_HEADER + " header");
        }
        return sessionId;
    }

    @Override
    public void logout(String sessionId, ManagedObjectReference sessionManager) {
        invoke(HttpMethod.POST, methodPath(sessionManager, "Logout"), sessionId, null);
    }

    @Override
    public ManagedObjectReference createContainerView(String sessionId, ManagedObjectReference viewManager,
                                                      ManagedObjectReference container, List<String> types, boolean recursive) {
        JsonNode view = invoke(HttpMethod.POST, methodPath(viewManager, "CreateContainerView"), sessionId,
                codec.createContainerViewRequest(container, types, recursive)).body;
        return codec.readMoRef(view);
    }

    @Override
    public RetrieveResult retrieveViewProperties(String sessionId, ManagedObjectReference propertyCollector,
                                                 ManagedObjectReference view, String type, List<String> pathSet) {
        JsonNode result = invoke(HttpMethod.POST, methodPath(propertyCollector, "RetrievePropertiesEx"), sessionId,
                codec.retrieveViewPropertiesRequest(view, type, pathSet)).body;
        return codec.readRetrieveResult(result);
    }

    @Override
    public RetrieveResult continueRetrieveProperties(String sessionId, ManagedObjectReference propertyCollector, String token) {
        JsonNode result = invoke(HttpMethod.POST, methodPath(propertyCollector, "ContinueRetrievePropertiesEx"), sessionId,
                codec.continueRetrievePropertiesRequest(token)).body;
        return codec.readRetrieveResult(result);
    }

    @Override
    public void destroyView(String sessionId, ManagedObjectReference view) {
        invoke(HttpMethod.POST, methodPath(view, "DestroyView"), sessionId, null);
    }

    @Override
    public List<PerfCounterInfo> retrievePerfCounters(String sessionId, ManagedObjectReference perfManager) {
        JsonNode counters = invoke(HttpMethod.GET, methodPath(perfManager, "perfCounter"), sessionId, null).body;
        return codec.readPerfCounters(counters);
    }

    @Override
    public List<PerfEntityMetricBase> queryPerf(String sessionId, ManagedObjectReference perfManager, PerfQuerySpec querySpec) {
        JsonNode metrics = invoke(HttpMethod.POST, methodPath(perfManager, "QueryPerf"), sessionId,
                codec.queryPerfRequest(querySpec)).body;
        return codec.readPerfEntityMetrics(metrics);
    }

    private static String methodPath(ManagedObjectReference ref, String member) {
        return "/" + ref.getType() + "/" + ref.getValue() + "/" + member;
    }

    /**
     * Sends one VI/JSON request and waits for the answer.
     *
     * @param method GET for property reads, POST for method invocations
     * @param path Path below the release base URL
     * @param sessionId Session id, or null for calls made before login
     * @param body Request body, or null for none
     * @return The parsed body (null when empty) and the session header of the response
     * @throws VimFaultException if the server answered with an error status
     * @throws VimTransportException if no response was received
     * @throws RunCancelledException if the run was cancelled before or during the call
     */
    private VimResponse invoke(HttpMethod method, String path, String sessionId, ObjectNode body) {
        runContext.throwIfCancelled();
        logger.debug("VI/JSON {} {}", method, path);

        WebClient.RequestBodySpec request = webClient.method(method).uri(path);
        if (sessionId != null) {
            request.header(SESSION_HEADER, sessionId);
        }
        WebClient.RequestHeadersSpec<?> exchange = body != null
                ? request.contentType(MediaType.APPLICATION_JSON).bodyValue(body.toString())
                : request;

        Mono<ResponseEntity<String>> call = exchange.retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(errorBody -> codec.readFault(response.statusCode().value(), errorBody)))
                .toEntity(String.class)
                .onErrorMap(WebClientRequestException.class,
                        e -> new VimTransportException("Could not reach " + endpoint + ": " + e.getMessage(), e));

        ResponseEntity<String> entity = runContext.bind(call).block();
        if (entity == null) {
            throw new VimTransportException("No response from " + endpoint + " for " + path, null);
        }

        String text = entity.getBody();
        JsonNode parsed = null;
        if (text != null && !text.trim().isEmpty()) {
            try {
                parsed = codec.parse(text);
            } catch (Exception e) {
                throw new VimFaultException("InvalidResponse", entity.getStatusCode().value(),
                        "Response to " + path + " is not JSON: " + e.getMessage());
            }
        }
        logger.debug("VI/JSON {} {} -> {}", method, path, entity.getStatusCode().value());
        return new VimResponse(entity.getStatusCode().value(), parsed, entity.getHeaders().getFirst(SESSION_HEADER));
    }

    private static final class VimResponse {
        private final int status;
        private final JsonNode body;
        private final String sessionId;

        private VimResponse(int status, JsonNode body, String sessionId) {
            this.status = status;
            this.body = body;
            this.sessionId = sessionId;
        }
    }
}
