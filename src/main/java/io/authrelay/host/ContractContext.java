package io.authrelay.host;

public record ContractContext(Env env, String sender, Storage storage) {
    public String self() {
        return env.contractAddress();
    }

    public BlockInfo block() {
        return env.block();
    }
}
