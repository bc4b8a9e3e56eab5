package io.authrelay.host;

public record Env(BlockInfo block, String chainId, String contractAddress) {
}
