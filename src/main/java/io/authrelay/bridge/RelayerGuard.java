package io.authrelay.bridge;

import io.authrelay.host.ContractException;

import java.util.Optional;

final class RelayerGuard {
    private RelayerGuard() {
    }

    // endpoints deployed without a relayer accept deliveries from anyone
    static void check(Optional<String> relayer, String sender) throws ContractException {
        if (relayer.isPresent() && !relayer.get().equals(sender)) {
            throw new ContractException("Unauthorized relayer: " + sender);
        }
    }
}
