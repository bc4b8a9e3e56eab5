package io.authrelay.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.bridge.HyperlaneMailbox;
import io.authrelay.bridge.InterchainRelayer;
import io.authrelay.bridge.PolytoneNote;
import io.authrelay.bridge.PolytoneProxy;
import io.authrelay.bridge.PolytoneVoice;
import io.authrelay.bridge.RelayReport;
import io.authrelay.config.AuthRelayConfig;
import io.authrelay.config.NetworkSettings;
import io.authrelay.host.ContractException;
import io.authrelay.host.LocalChain;
import io.authrelay.host.TxResult;
import io.authrelay.library.Library;
import io.authrelay.library.LibraryRegistry;
import io.authrelay.model.Authorization;
import io.authrelay.model.AuthorizationInfo;
import io.authrelay.model.Domain;
import io.authrelay.model.Expiration;
import io.authrelay.model.ExternalDomain;
import io.authrelay.model.ExternalDomainInfo;
import io.authrelay.model.MessageBatch;
import io.authrelay.model.Mint;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorCallbackInfo;
import io.authrelay.model.ProcessorConfig;
import io.authrelay.model.ProcessorDomain;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.ProcessorQuery;
import io.authrelay.model.RegistryMsg;
import io.authrelay.model.RegistryQuery;
import io.authrelay.observability.AuditLogger;
import io.authrelay.processor.Processor;
import io.authrelay.registry.AuthorizationRegistry;
import io.authrelay.routing.DomainRouter;
import io.authrelay.routing.JsonMessageEncoder;
import io.authrelay.storage.Database;
import io.authrelay.storage.SqliteStateBackend;
import io.authrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public final class AuthRelayRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(AuthRelayRuntime.class);
    public static final String RELAYER = "relayer";
    public static final String KEEPER = "keeper";
    public static final int MAIN_HYPERLANE_DOMAIN_ID = 1;
    public static final int FIRST_EXTERNAL_HYPERLANE_DOMAIN_ID = 1000;

    private static final TypeReference<List<Authorization>> AUTHORIZATIONS = new TypeReference<>() {
    };
    private static final TypeReference<List<ExternalDomain>> EXTERNAL_DOMAINS = new TypeReference<>() {
    };
    private static final TypeReference<List<ProcessorCallbackInfo>> CALLBACKS = new TypeReference<>() {
    };
    private static final TypeReference<List<MessageBatch>> BATCHES = new TypeReference<>() {
    };
    private static final TypeReference<List<AuthorizationInfo>> AUTHORIZATION_INFOS = new TypeReference<>() {
    };
    private static final TypeReference<List<ProcessorMessage>> PROCESSOR_MESSAGES = new TypeReference<>() {
    };

    private final AuthRelayConfig config;
    private final Database database;
    private final AuditLogger auditLogger;
    private final DomainRouter router;
    private final LibraryRegistry libraries;
    private final Map<String, DomainDeployment> domains;
    private NetworkSettings settings;
    private DomainDeployment main;
    private String registry;
    private InterchainRelayer relayer;

    public AuthRelayRuntime(AuthRelayConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                config.namespace(),
                loadOrCreateAuditSigningSecret(config.auditSigningKeyFile())
        );
        this.router = new DomainRouter(new JsonMessageEncoder());
        this.libraries = LibraryRegistry.builtIns();
        this.domains = new LinkedHashMap<>();
    }

    public synchronized void init() {
        database.init();
        settings = NetworkSettings.load(config.settingsFile());
        if (!Files.exists(config.settingsFile())) {
            settings.save(config.settingsFile());
        }
        domains.clear();
        main = openChain(settings.mainChainId(), settings.addressPrefix(), "main");
        registry = main.chain().predictAddress(settings.owner(), "authorization");
        relayer = new InterchainRelayer(RELAYER);

        List<ExternalDomainInfo> newDomains = new ArrayList<>();
        int index = 0;
        for (NetworkSettings.ExternalDomainSettings external : settings.externalDomains()) {
            DomainDeployment deployment = deployExternal(external, index++, newDomains);
            domains.put(external.name(), deployment);
        }
        deployMain(newDomains);
        LOG.info("Runtime ready: namespace={} registry={} externalDomains={}",
                config.namespace(), registry, domains.keySet());
    }

    private DomainDeployment openChain(String chainId, String prefix, String role) {
        database.registerChain(chainId, prefix, role);
        LocalChain chain = new LocalChain(chainId, prefix, new SqliteStateBackend(database, chainId));
        // code ids must match on every start
        Map<String, Long> codeIds = new LinkedHashMap<>();
        codeIds.put("authorization", chain.storeCode(new AuthorizationRegistry(router)));
        codeIds.put("processor", chain.storeCode(new Processor(router)));
        codeIds.put("polytone-note", chain.storeCode(new PolytoneNote()));
        codeIds.put("polytone-voice", chain.storeCode(new PolytoneVoice()));
        codeIds.put("polytone-proxy", chain.storeCode(new PolytoneProxy()));
        codeIds.put("hyperlane-mailbox", chain.storeCode(new HyperlaneMailbox()));
        for (Library library : libraries.all()) {
            codeIds.put("library-" + library.id(), chain.storeCode(library));
        }
        String owner = settings.owner();
        Map<String, String> libraryAddresses = new LinkedHashMap<>();
        for (Library library : libraries.all()) {
            libraryAddresses.put(library.id(), chain.predictAddress(owner, "library-" + library.id()));
        }
        return new DomainDeployment(
                role.equals("main") ? "main" : chainId,
                chain,
                codeIds,
                chain.predictAddress(owner, "processor"),
                libraryAddresses,
                chain.predictAddress(owner, "polytone-voice"),
                chain.predictAddress(owner, "hyperlane-mailbox")
        );
    }

    private DomainDeployment deployExternal(NetworkSettings.ExternalDomainSettings external, int index,
                                            List<ExternalDomainInfo> newDomains) {
        DomainDeployment mainSide = main;
        DomainDeployment remote = openChain(external.chainId(), external.name(), "external");
        remote = remote.named(external.name());
        LocalChain chain = remote.chain();
        String owner = settings.owner();
        long timeout = external.timeoutSeconds() == null || external.timeoutSeconds() <= 0
                ? settings.polytoneTimeoutSeconds()
                : external.timeoutSeconds();
        boolean fresh = !chain.hasContract(remote.processor());
        try {
            ExternalDomainInfo info;
            if (external.polytone()) {
                String remoteNote = chain.predictAddress(owner, "polytone-note");
                String mainNote = mainSide.chain().predictAddress(owner, "polytone-note/" + external.name());
                String registryProxy = chain.predictAddress(remote.voice(),
                        PolytoneVoice.proxySalt(mainSide.chain().chainId(), registry));
                String processorProxy = mainSide.chain().predictAddress(mainSide.voice(),
                        PolytoneVoice.proxySalt(chain.chainId(), remote.processor()));
                if (fresh) {
                    instantiate(chain, remote.codeId("polytone-note"), new PolytoneNote.InstantiateMsg(RELAYER),
                            "polytone-note", "polytone-note");
                    instantiate(chain, remote.codeId("polytone-voice"),
                            new PolytoneVoice.InstantiateMsg(remote.codeId("polytone-proxy"), RELAYER),
                            "polytone-voice", "polytone-voice");
                    deployLibraries(remote);
                    instantiate(chain, remote.codeId("processor"), new Processor.InstantiateMsg(owner, registry,
                                    new ProcessorDomain.Polytone(remoteNote, registryProxy, timeout, null)),
                            "processor", "processor");
                }
                if (!mainSide.chain().hasContract(mainNote)) {
                    instantiate(mainSide.chain(), mainSide.codeId("polytone-note"), new PolytoneNote.InstantiateMsg(RELAYER),
                            "polytone-note " + external.name(), "polytone-note/" + external.name());
                }
                relayer.addLink(new InterchainRelayer.PolytoneLink(mainSide.chain(), mainNote, chain, remote.voice()));
                relayer.addLink(new InterchainRelayer.PolytoneLink(chain, remoteNote, mainSide.chain(), mainSide.voice()));
                info = ExternalDomainInfo.polytone(external.name(), mainNote, timeout, processorProxy, remote.processor());
            } else {
                int domainId = external.hyperlaneDomainId() == null
                        ? FIRST_EXTERNAL_HYPERLANE_DOMAIN_ID + index
                        : external.hyperlaneDomainId();
                if (fresh) {
                    instantiate(chain, remote.codeId("hyperlane-mailbox"), new HyperlaneMailbox.InstantiateMsg(domainId, RELAYER),
                            "hyperlane-mailbox", "hyperlane-mailbox");
                    deployLibraries(remote);
                    instantiate(chain, remote.codeId("processor"), new Processor.InstantiateMsg(owner, registry,
                                    new ProcessorDomain.Hyperlane(remote.mailbox(), MAIN_HYPERLANE_DOMAIN_ID)),
                            "processor", "processor");
                }
                relayer.addLink(new InterchainRelayer.HyperlaneLink(mainSide.chain(), mainSide.mailbox(), chain,
                        remote.mailbox(), domainId));
                relayer.addLink(new InterchainRelayer.HyperlaneLink(chain, remote.mailbox(), mainSide.chain(),
                        mainSide.mailbox(), MAIN_HYPERLANE_DOMAIN_ID));
                info = ExternalDomainInfo.hyperlane(external.name(), mainSide.mailbox(), domainId, remote.processor());
            }
            newDomains.add(info);
            if (fresh) {
                LOG.info("Deployed external domain {} on chain {} ({})", external.name(), chain.chainId(), external.bridge());
            }
            return remote;
        } catch (ContractException e) {
            throw new IllegalStateException("Failed to deploy external domain " + external.name(), e);
        }
    }

    private void deployMain(List<ExternalDomainInfo> externalDomains) {
        LocalChain chain = main.chain();
        String owner = settings.owner();
        try {
            if (!chain.hasContract(main.voice())) {
                instantiate(chain, main.codeId("polytone-voice"),
                        new PolytoneVoice.InstantiateMsg(main.codeId("polytone-proxy"), RELAYER),
                        "polytone-voice", "polytone-voice");
                instantiate(chain, main.codeId("hyperlane-mailbox"),
                        new HyperlaneMailbox.InstantiateMsg(MAIN_HYPERLANE_DOMAIN_ID, RELAYER),
                        "hyperlane-mailbox", "hyperlane-mailbox");
                deployLibraries(main);
                instantiate(chain, main.codeId("processor"),
                        new Processor.InstantiateMsg(owner, registry, new ProcessorDomain.Main()), "processor", "processor");
            }
            if (!chain.hasContract(registry)) {
                instantiate(chain, main.codeId("authorization"), new AuthorizationRegistry.InstantiateMsg(
                        owner, settings.subOwners(), main.processor(), externalDomains), "authorization", "authorization");
                LOG.info("Deployed authorization registry {} on {}", registry, chain.chainId());
                return;
            }
            List<String> known = new ArrayList<>();
            for (ExternalDomain domain : externalDomains()) {
                known.add(domain.name());
            }
            List<ExternalDomainInfo> missing = new ArrayList<>();
            for (ExternalDomainInfo info : externalDomains) {
                if (!known.contains(info.name())) {
                    missing.add(info);
                }
            }
            if (!missing.isEmpty()) {
                submit("registry.add_external_domains", main.chain(), owner, registry,
                        new RegistryMsg.AddExternalDomains(missing)).requireSuccess();
            }
        } catch (ContractException e) {
            throw new IllegalStateException("Failed to deploy main domain contracts", e);
        }
    }

    private void deployLibraries(DomainDeployment deployment) throws ContractException {
        for (Library library : libraries.all()) {
            String salt = "library-" + library.id();
            instantiate(deployment.chain(), deployment.codeId(salt), Map.of("processor", deployment.processor()),
                    library.id(), salt);
        }
    }

    private String instantiate(LocalChain chain, long codeId, Object msg, String label, String salt)
            throws ContractException {
        String address = chain.instantiate2(settings.owner(), codeId, msg, label, settings.owner(), salt);
        auditLogger.log(AuditLogger.AuditEvent.of("contract.instantiate", settings.owner(), chain.chainId(), address,
                "ok", chain.block().height(), Map.of("label", label, "code_id", codeId)));
        return address;
    }

    public synchronized TxOutcome createAuthorizations(String sender, String authorizationsJson) {
        List<AuthorizationInfo> infos;
        try {
            infos = Jsons.wire().readValue(authorizationsJson, AUTHORIZATION_INFOS);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid authorizations JSON: " + e.getMessage(), e);
        }
        return createAuthorizations(sender, infos);
    }

    public synchronized TxOutcome createAuthorizations(String sender, List<AuthorizationInfo> infos) {
        return submit("registry.create_authorizations", main.chain(), sender, registry,
                new RegistryMsg.CreateAuthorizations(infos));
    }

    public synchronized TxOutcome mint(String sender, String label, List<Mint> mints) {
        return submit("registry.mint_authorizations", main.chain(), sender, registry,
                new RegistryMsg.MintAuthorizations(label, mints));
    }

    public synchronized TxOutcome setAuthorizationEnabled(String sender, String label, boolean enabled) {
        RegistryMsg msg = enabled ? new RegistryMsg.EnableAuthorization(label) : new RegistryMsg.DisableAuthorization(label);
        return submit(enabled ? "registry.enable_authorization" : "registry.disable_authorization",
                main.chain(), sender, registry, msg);
    }

    public synchronized TxOutcome sendMsgs(String sender, String label, String messagesJson, Expiration ttl) {
        List<ProcessorMessage> messages;
        try {
            messages = Jsons.wire().readValue(messagesJson, PROCESSOR_MESSAGES);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid messages JSON: " + e.getMessage(), e);
        }
        return sendMsgs(sender, label, messages, ttl);
    }

    public synchronized TxOutcome sendMsgs(String sender, String label, List<ProcessorMessage> messages, Expiration ttl) {
        return submit("registry.send_msgs", main.chain(), sender, registry, new RegistryMsg.SendMsgs(label, messages, ttl));
    }

    public synchronized TxOutcome retryMsgs(String sender, long executionId) {
        return submit("registry.retry_msgs", main.chain(), sender, registry, new RegistryMsg.RetryMsgs(executionId));
    }

    public synchronized TxOutcome retryBridgeCreation(String sender, String domainName) {
        return submit("registry.retry_bridge_creation", main.chain(), sender, registry,
                new RegistryMsg.RetryBridgeCreation(domainName));
    }

    public synchronized TxOutcome evict(String sender, Domain domain, int queuePosition, Priority priority) {
        return submit("registry.evict_msgs", main.chain(), sender, registry,
                new RegistryMsg.EvictMsgs(domain, queuePosition, priority));
    }

    public synchronized TxOutcome pause(String sender, Domain domain) {
        return submit("registry.pause_processor", main.chain(), sender, registry, new RegistryMsg.PauseProcessor(domain));
    }

    public synchronized TxOutcome resume(String sender, Domain domain) {
        return submit("registry.resume_processor", main.chain(), sender, registry, new RegistryMsg.ResumeProcessor(domain));
    }

    public synchronized TxOutcome tick(Domain domain) {
        DomainDeployment deployment = deployment(domain);
        return submit("processor.tick", deployment.chain(), KEEPER, deployment.processor(), new ProcessorMsg.Tick());
    }

    public synchronized TxOutcome execute(Domain domain, String sender, String contract, Object msg) {
        return submit("contract.execute", deployment(domain).chain(), sender, contract, msg);
    }

    public synchronized RelayReport relay() {
        RelayReport report = relayer.relayAll();
        auditLogger.log(AuditLogger.AuditEvent.of("bridge.relay", RELAYER, null, null,
                report.failed() > 0 ? "partial" : "ok", null, Map.of(
                        "delivered", report.delivered(),
                        "timed_out", report.timedOut(),
                        "failed", report.failed()
                )));
        return report;
    }

    public synchronized void advanceTime(long seconds) {
        main.chain().advanceSeconds(seconds);
        for (DomainDeployment deployment : domains.values()) {
            deployment.chain().advanceSeconds(seconds);
        }
    }

    public synchronized List<Authorization> authorizations() {
        return paged(start -> new RegistryQuery.Authorizations(start, AuthRelayConfig.MAX_PAGE_LIMIT),
                AUTHORIZATIONS, Authorization::label);
    }

    public synchronized List<ExternalDomain> externalDomains() {
        return paged(start -> new RegistryQuery.ExternalDomains(start, AuthRelayConfig.MAX_PAGE_LIMIT),
                EXTERNAL_DOMAINS, ExternalDomain::name);
    }

    public synchronized List<ProcessorCallbackInfo> callbacks() {
        List<ProcessorCallbackInfo> out = new ArrayList<>();
        Long start = null;
        while (true) {
            List<ProcessorCallbackInfo> page = queryRegistry(
                    new RegistryQuery.ProcessorCallbacks(start, AuthRelayConfig.MAX_PAGE_LIMIT), CALLBACKS);
            out.addAll(page);
            if (page.size() < AuthRelayConfig.MAX_PAGE_LIMIT) {
                return out;
            }
            start = page.get(page.size() - 1).executionId();
        }
    }

    public synchronized ProcessorCallbackInfo callback(long executionId) {
        return queryRegistry(new RegistryQuery.ProcessorCallback(executionId), new TypeReference<ProcessorCallbackInfo>() {
        });
    }

    public synchronized long permissionTokens(String label, String address) {
        return queryRegistry(new RegistryQuery.PermissionTokens(label, address), new TypeReference<Long>() {
        });
    }

    public synchronized List<MessageBatch> queue(Domain domain, Priority priority) {
        DomainDeployment deployment = deployment(domain);
        try {
            return deployment.chain().query(deployment.processor(), new ProcessorQuery.GetQueue(null, null, priority), BATCHES);
        } catch (ContractException e) {
            throw new IllegalStateException("Queue query failed on " + deployment.name() + ": " + e.getMessage(), e);
        }
    }

    public synchronized ProcessorConfig processorConfig(Domain domain) {
        DomainDeployment deployment = deployment(domain);
        try {
            return deployment.chain().query(deployment.processor(), new ProcessorQuery.Config(), ProcessorConfig.class);
        } catch (ContractException e) {
            throw new IllegalStateException("Config query failed on " + deployment.name() + ": " + e.getMessage(), e);
        }
    }

    public synchronized <T> T queryContract(Domain domain, String contract, Object msg, TypeReference<T> type) {
        try {
            return deployment(domain).chain().query(contract, msg, type);
        } catch (ContractException e) {
            throw new IllegalStateException("Query failed on " + contract + ": " + e.getMessage(), e);
        }
    }

    public synchronized List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public synchronized AuditLogger.IntegrityReport verifyAudit() {
        return auditLogger.verify();
    }

    public synchronized List<Database.ChainRow> chains() {
        return database.listChains();
    }

    public String registryAddress() {
        return registry;
    }

    public synchronized String processorAddress(Domain domain) {
        return deployment(domain).processor();
    }

    public synchronized String libraryAddress(Domain domain, String libraryId) {
        String address = deployment(domain).libraries().get(libraryId);
        if (address == null) {
            throw new IllegalArgumentException("Unknown library: " + libraryId);
        }
        return address;
    }

    public synchronized LocalChain chain(Domain domain) {
        return deployment(domain).chain();
    }

    public synchronized NetworkSettings settings() {
        return settings;
    }

    private DomainDeployment deployment(Domain domain) {
        if (main == null) {
            throw new IllegalStateException("Runtime is not initialized");
        }
        if (domain == null || domain.main()) {
            return main;
        }
        DomainDeployment deployment = domains.get(domain.externalName());
        if (deployment == null) {
            throw new IllegalArgumentException("Unknown domain: " + domain.externalName());
        }
        return deployment;
    }

    private TxOutcome submit(String action, LocalChain chain, String sender, String contract, Object msg) {
        try {
            TxResult result = chain.execute(sender, contract, msg);
            Map<String, Object> details = new LinkedHashMap<>();
            List<String> executionIds = result.attributes("execution_id");
            if (!executionIds.isEmpty()) {
                details.put("execution_id", executionIds.get(0));
            }
            details.put("events", result.events().size());
            auditLogger.log(AuditLogger.AuditEvent.of(action, sender, chain.chainId(), contract, "ok",
                    result.height(), details));
            return TxOutcome.accepted(chain.chainId(), result);
        } catch (ContractException e) {
            LOG.debug("{} rejected on {}: {}", action, chain.chainId(), e.getMessage());
            auditLogger.log(AuditLogger.AuditEvent.of(action, sender, chain.chainId(), contract, "rejected",
                    chain.block().height(), Map.of("error", e.getMessage())));
            return TxOutcome.rejected(chain.chainId(), chain.block().height(), e.getMessage());
        }
    }

    private <T> T queryRegistry(Object query, TypeReference<T> type) {
        try {
            return main.chain().query(registry, query, type);
        } catch (ContractException e) {
            throw new IllegalStateException("Registry query failed: " + e.getMessage(), e);
        }
    }

    private <T> List<T> paged(Function<String, Object> page, TypeReference<List<T>> type, Function<T, String> key) {
        List<T> out = new ArrayList<>();
        String start = null;
        while (true) {
            List<T> chunk = queryRegistry(page.apply(start), type);
            out.addAll(chunk);
            if (chunk.size() < AuthRelayConfig.MAX_PAGE_LIMIT) {
                return out;
            }
            start = key.apply(chunk.get(chunk.size() - 1));
        }
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    record DomainDeployment(
            String name,
            LocalChain chain,
            Map<String, Long> codeIds,
            String processor,
            Map<String, String> libraries,
            String voice,
            String mailbox
    ) {
        long codeId(String key) {
            Long codeId = codeIds.get(key);
            if (codeId == null) {
                throw new IllegalStateException("No code registered for " + key);
            }
            return codeId;
        }

        DomainDeployment named(String next) {
            return new DomainDeployment(next, chain, codeIds, processor, libraries, voice, mailbox);
        }
    }

    public record TxOutcome(boolean success, String chainId, long height, Map<String, List<String>> attributes,
                            String error) {
        static TxOutcome accepted(String chainId, TxResult result) {
            Map<String, List<String>> attributes = new LinkedHashMap<>();
            result.events().forEach(event -> event.attributes().forEach((key, value) ->
                    attributes.computeIfAbsent(key, ignored -> new ArrayList<>()).add(value)));
            return new TxOutcome(true, chainId, result.height(), attributes, null);
        }

        static TxOutcome rejected(String chainId, long height, String error) {
            return new TxOutcome(false, chainId, height, Map.of(), error);
        }

        public List<String> attribute(String key) {
            return attributes.getOrDefault(key, List.of());
        }

        public TxOutcome requireSuccess() throws ContractException {
            if (!success) {
                throw new ContractException(error);
            }
            return this;
        }
    }
}
