package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.tanzu.pvemcp.config.Profile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Thin REST adapter for the Proxmox VE API, one instance per profile.
 *
 * This client only covers the calls the operation queue and the cluster
 * aggregator need: the version check, the cluster resource listing, guest and
 * node lifecycle actions and task status. It uses Spring WebClient in blocking
 * mode with a per-request timeout.
 *
 * Authentication follows the profile:
 * - Password profiles log in through {@code POST /access/ticket}; the ticket is
 *   sent as the {@code PVEAuthCookie} cookie and write requests carry the CSRF
 *   token header. An expired ticket (401) triggers one fresh login and retry.
 * - Token profiles send {@code Authorization: PVEAPIToken=user@realm!id=secret}.
 *
 * Every failure is reported as a {@link PveApiException} naming the profile.
 */
public class PveRestClient implements PveClient {

    private static final Logger logger = LoggerFactory.getLogger(PveRestClient.class);

    static final String API_PATH = "/api2/json";

    private final Profile profile;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    /** Ticket and CSRF token of the current login; null until logged in or for token profiles */
    private final AtomicReference<Session> session = new AtomicReference<>();

    /**
     * Constructs a client for one profile.
     *
     * @param profile The profile to talk to
     * @param webClientBuilder Builder with the profile's TLS policy already applied
     * @param objectMapper Mapper used to parse responses
     * @param requestTimeout Upper bound for each HTTP exchange
     */
    public PveRestClient(Profile profile, WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                         Duration requestTimeout) {
        this.profile = profile;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;

        String baseUrl = baseUrl(profile.getAddress());
        logger.info("Initializing PveRestClient for profile '{}': {} (insecure={})",
                profile.getName(), baseUrl, profile.isInsecure());

        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .build();
    }

    static String baseUrl(String address) {
        String trimmed = address.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(API_PATH)) {
            return trimmed;
        }
        return trimmed + API_PATH;
    }

    @Override
    public String getProfileName() {
        return profile.getName();
    }

    /**
     * Authenticates with the cluster. For token profiles this is a no-op; the
     * token is checked by the first request.
     */
    public void login() {
        if (profile.usesToken()) {
            return;
        }
        session.set(createSession());
    }

    private Session createSession() {
        logger.info("Requesting ticket for {} on profile '{}'", profile.getQualifiedUser(), profile.getName());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", profile.getQualifiedUser());
        form.add("password", profile.getPassword());

        String response;
        try {
            response = webClient.post()
                .uri("/access/ticket")
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .block(requestTimeout);
        } catch (WebClientResponseException e) {
            throw new PveApiException(profile.getName(),
                    "Authentication failed (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (WebClientException e) {
            throw new PveApiException(profile.getName(), "Cannot reach " + profile.getAddress() + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new PveApiException(profile.getName(), "Authentication timed out after " + requestTimeout.getSeconds() + "s", e);
        }

        JsonNode data = readData(response, "access/ticket");
        if (!data.hasNonNull("ticket")) {
            throw new PveApiException(profile.getName(), "Authentication response carried no ticket");
        }
        logger.info("Obtained ticket for profile '{}'", profile.getName());
        return new Session(data.get("ticket").asText(), data.path("CSRFPreventionToken").asText(null));
    }

    @Override
    public String getVersion() {
        JsonNode data = get("/version");
        return data.path("version").asText("unknown");
    }

    @Override
    public ClusterSnapshot getClusterResources() {
        JsonNode data = get("/cluster/resources");
        List<NodeInfo> nodes = new ArrayList<>();
        List<VmInfo> vms = new ArrayList<>();
        for (JsonNode resource : data) {
            String type = resource.path("type").asText();
            switch (type) {
                case "node":
                    nodes.add(parseNode(resource));
                    break;
                case VmInfo.TYPE_QEMU:
                case VmInfo.TYPE_LXC:
                    vms.add(parseVm(resource, type));
                    break;
                default:
                    // storage, pool, sdn entries are not managed here
                    break;
            }
        }
        logger.debug("Profile '{}' listed {} nodes and {} guests", profile.getName(), nodes.size(), vms.size());
        return new ClusterSnapshot(nodes, vms, Instant.now());
    }

    @Override
    public VmInfo getVmStatus(String node, String type, int vmid) {
        JsonNode data = get("/nodes/{node}/{type}/{vmid}/status/current", node, type, vmid);
        return new VmInfo(
            vmid,
            data.path("name").asText(null),
            node,
            type,
            data.path("status").asText("unknown"),
            data.path("uptime").asLong(0),
            data.path("cpu").asDouble(0),
            data.path("cpus").asInt(0),
            data.path("mem").asLong(0),
            data.path("maxmem").asLong(0),
            data.path("template").asInt(0) == 1,
            null,
            false
        );
    }

    @Override
    public String startVm(VmInfo vm) {
        return vmStatusAction(vm, "start");
    }

    @Override
    public String stopVm(VmInfo vm) {
        return vmStatusAction(vm, "stop");
    }

    @Override
    public String shutdownVm(VmInfo vm) {
        return vmStatusAction(vm, "shutdown");
    }

    @Override
    public String rebootVm(VmInfo vm) {
        return vmStatusAction(vm, "reboot");
    }

    @Override
    public String resetVm(VmInfo vm) {
        if (!vm.isQemu()) {
            throw new PveApiException(profile.getName(), "Reset is only supported for QEMU VMs, not " + vm.getType());
        }
        return vmStatusAction(vm, "reset");
    }

    @Override
    public String migrateVm(VmInfo vm, MigrationOptions options) {
        logger.info("=== PVE [{}] migrate {} {} -> {} ===", profile.getName(), vm.getId(), vm.getNode(), options.getTargetNode());
        if (options.getTargetNode().equals(vm.getNode())) {
            throw new PveApiException(profile.getName(), "VM " + vm.getId() + " is already on node " + vm.getNode());
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("target", options.getTargetNode());
        if (vm.isQemu()) {
            form.add("online", options.isOnlineFor(vm) ? "1" : "0");
        } else {
            form.add("restart", "1");
        }
        JsonNode data = post(form, "/nodes/{node}/{type}/{vmid}/migrate", vm.getNode(), vm.getType(), vm.getId());
        return data.asText("");
    }

    @Override
    public String deleteVm(VmInfo vm) {
        logger.info("=== PVE [{}] delete {} on {} ===", profile.getName(), vm.getId(), vm.getNode());
        JsonNode data = execute("DELETE /nodes/" + vm.getNode() + "/" + vm.getType() + "/" + vm.getId(), () ->
            webClient.delete()
                .uri("/nodes/{node}/{type}/{vmid}", vm.getNode(), vm.getType(), vm.getId())
                .headers(this::applyWriteAuth)
                .retrieve()
                .bodyToMono(String.class)
                .block(requestTimeout));
        return data.asText("");
    }

    @Override
    public String rebootNode(String node) {
        return nodeCommand(node, "reboot");
    }

    @Override
    public String shutdownNode(String node) {
        return nodeCommand(node, "shutdown");
    }

    @Override
    public RemoteTaskStatus getTaskStatus(String node, String upid) {
        JsonNode data = get("/nodes/{node}/tasks/{upid}/status", node, upid);
        return new RemoteTaskStatus(upid, data.path("status").asText(null), data.path("exitstatus").asText(null));
    }

    @Override
    public List<ClusterTask> getClusterTasks() {
        JsonNode data = get("/cluster/tasks");
        List<ClusterTask> tasks = new ArrayList<>();
        for (JsonNode entry : data) {
            tasks.add(new ClusterTask(
                entry.path("upid").asText(null),
                entry.path("node").asText(null),
                entry.path("type").asText(null),
                entry.path("id").asText(null),
                entry.path("user").asText(null),
                entry.path("status").asText(null),
                entry.path("starttime").asLong(0),
                entry.path("endtime").asLong(0),
                null
            ));
        }
        logger.debug("Profile '{}' listed {} cluster tasks", profile.getName(), tasks.size());
        return tasks;
    }

    @Override
    public void close() {
        session.set(null);
        logger.debug("Closed client for profile '{}'", profile.getName());
    }

    private String vmStatusAction(VmInfo vm, String action) {
        logger.info("=== PVE [{}] {} {} on {} ===", profile.getName(), action, vm.getId(), vm.getNode());
        JsonNode data = post(new LinkedMultiValueMap<>(), "/nodes/{node}/{type}/{vmid}/status/{action}",
                vm.getNode(), vm.getType(), vm.getId(), action);
        return data.asText("");
    }

    private String nodeCommand(String node, String command) {
        logger.info("=== PVE [{}] node {} {} ===", profile.getName(), node, command);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("command", command);
        JsonNode data = post(form, "/nodes/{node}/status", node);
        return data.isTextual() ? data.asText() : "";
    }

    private JsonNode get(String uriTemplate, Object... uriVariables) {
        return execute("GET " + uriTemplate, () ->
            webClient.get()
                .uri(uriTemplate, uriVariables)
                .headers(this::applyReadAuth)
                .retrieve()
                .bodyToMono(String.class)
                .block(requestTimeout));
    }

    private JsonNode post(MultiValueMap<String, String> form, String uriTemplate, Object... uriVariables) {
        return execute("POST " + uriTemplate, () ->
            webClient.post()
                .uri(uriTemplate, uriVariables)
                .headers(this::applyWriteAuth)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .block(requestTimeout));
    }

    /**
     * Runs one exchange, retrying once with a fresh ticket if the current one was
     * rejected, and returns the response's {@code data} member.
     */
    private JsonNode execute(String call, Supplier<String> exchange) {
        try {
            ensureSession();
            return readData(exchange.get(), call);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value() && !profile.usesToken()) {
                logger.warn("Ticket rejected on profile '{}' for {}, logging in again", profile.getName(), call);
                session.set(createSession());
                return retry(call, exchange);
            }
            throw new PveApiException(profile.getName(),
                    call + " failed with HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (WebClientException e) {
            throw new PveApiException(profile.getName(), call + " failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // Mono.block(timeout) signals a timeout this way
            throw new PveApiException(profile.getName(), call + " timed out after " + requestTimeout.getSeconds() + "s", e);
        }
    }

    private JsonNode retry(String call, Supplier<String> exchange) {
        try {
            return readData(exchange.get(), call);
        } catch (WebClientResponseException e) {
            throw new PveApiException(profile.getName(),
                    call + " failed after fresh login with HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientException | IllegalStateException e) {
            throw new PveApiException(profile.getName(), call + " failed after fresh login: " + e.getMessage(), e);
        }
    }

    private void ensureSession() {
        if (!profile.usesToken() && session.get() == null) {
            session.set(createSession());
        }
    }

    private JsonNode readData(String body, String call) {
        if (body == null || body.isBlank()) {
            throw new PveApiException(profile.getName(), call + " returned an empty response");
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.has("errors") && !root.get("errors").isNull()) {
                throw new PveApiException(profile.getName(), call + " rejected: " + root.get("errors"));
            }
            return root.path("data");
        } catch (PveApiException e) {
            throw e;
        } catch (Exception e) {
            throw new PveApiException(profile.getName(), call + " returned malformed JSON: " + e.getMessage(), e);
        }
    }

    private void applyReadAuth(HttpHeaders headers) {
        if (profile.usesToken()) {
            headers.set(HttpHeaders.AUTHORIZATION, "PVEAPIToken=" + profile.getQualifiedUser() + "!"
                    + profile.getTokenId() + "=" + profile.getTokenSecret());
            return;
        }
        Session current = session.get();
        if (current != null) {
            headers.add(HttpHeaders.COOKIE, "PVEAuthCookie=" + current.ticket);
        }
    }

    private void applyWriteAuth(HttpHeaders headers) {
        applyReadAuth(headers);
        Session current = session.get();
        if (!profile.usesToken() && current != null && current.csrfToken != null) {
            headers.set("CSRFPreventionToken", current.csrfToken);
        }
    }

    private static NodeInfo parseNode(JsonNode resource) {
        return new NodeInfo(
            resource.path("node").asText(),
            "online".equals(resource.path("status").asText()),
            resource.path("cpu").asDouble(0),
            resource.path("maxcpu").asInt(0),
            resource.path("mem").asLong(0),
            resource.path("maxmem").asLong(0),
            resource.path("uptime").asLong(0),
            null,
            false
        );
    }

    private static VmInfo parseVm(JsonNode resource, String type) {
        return new VmInfo(
            resource.path("vmid").asInt(),
            resource.path("name").asText(null),
            resource.path("node").asText(),
            type,
            resource.path("status").asText("unknown"),
            resource.path("uptime").asLong(0),
            resource.path("cpu").asDouble(0),
            resource.path("maxcpu").asInt(0),
            resource.path("mem").asLong(0),
            resource.path("maxmem").asLong(0),
            resource.path("template").asInt(0) == 1,
            null,
            false
        );
    }

    private static final class Session {
        private final String ticket;
        private final String csrfToken;

        private Session(String ticket, String csrfToken) {
            this.ticket = ticket;
            this.csrfToken = csrfToken;
        }
    }
}
