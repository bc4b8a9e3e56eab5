package io.authrelay.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.authrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record NetworkSettings(
        @JsonProperty("owner") String owner,
        @JsonProperty("sub_owners") List<String> subOwners,
        @JsonProperty("main_chain_id") String mainChainId,
        @JsonProperty("address_prefix") String addressPrefix,
        @JsonProperty("polytone_timeout_seconds") Long polytoneTimeoutSeconds,
        @JsonProperty("external_domains") List<ExternalDomainSettings> externalDomains
) {
    public static final String DEFAULT_OWNER = "owner";
    public static final String DEFAULT_MAIN_CHAIN_ID = "neutron-1";
    public static final String DEFAULT_PREFIX = "neutron";

    public NetworkSettings {
        owner = owner == null || owner.isBlank() ? DEFAULT_OWNER : owner.trim();
        subOwners = subOwners == null ? List.of() : List.copyOf(subOwners);
        mainChainId = mainChainId == null || mainChainId.isBlank() ? DEFAULT_MAIN_CHAIN_ID : mainChainId.trim();
        addressPrefix = addressPrefix == null || addressPrefix.isBlank() ? DEFAULT_PREFIX : addressPrefix.trim();
        polytoneTimeoutSeconds = polytoneTimeoutSeconds == null || polytoneTimeoutSeconds <= 0
                ? AuthRelayConfig.DEFAULT_POLYTONE_TIMEOUT_SECONDS
                : polytoneTimeoutSeconds;
        externalDomains = externalDomains == null ? List.of() : List.copyOf(externalDomains);
    }

    public static NetworkSettings defaults() {
        return new NetworkSettings(null, null, null, null, null, null);
    }

    public static NetworkSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return defaults();
            }
            return Jsons.mapper().readValue(raw, NetworkSettings.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read network settings: " + file, e);
        }
    }

    public void save(Path file) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, Jsons.toJson(this), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write network settings: " + file, e);
        }
    }

    public NetworkSettings withExternalDomain(ExternalDomainSettings domain) {
        List<ExternalDomainSettings> next = new ArrayList<>(externalDomains);
        next.removeIf(d -> d.name().equals(domain.name()));
        next.add(domain);
        return new NetworkSettings(owner, subOwners, mainChainId, addressPrefix, polytoneTimeoutSeconds, next);
    }

    public record ExternalDomainSettings(
            @JsonProperty("name") String name,
            @JsonProperty("chain_id") String chainId,
            @JsonProperty("bridge") String bridge,
            @JsonProperty("timeout_seconds") Long timeoutSeconds,
            @JsonProperty("hyperlane_domain_id") Integer hyperlaneDomainId
    ) {
        public ExternalDomainSettings {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("external domain name must not be blank");
            }
            name = name.trim();
            chainId = chainId == null || chainId.isBlank() ? name : chainId.trim();
            bridge = bridge == null || bridge.isBlank() ? "polytone" : bridge.trim().toLowerCase(Locale.ROOT);
            if (!bridge.equals("polytone") && !bridge.equals("hyperlane")) {
                throw new IllegalArgumentException("Unknown bridge for domain " + name + ": " + bridge);
            }
        }

        public boolean polytone() {
            return "polytone".equals(bridge);
        }
    }
}
