package io.authrelay.model;

public record ProcessorConfig(String authorizationContract, ProcessorDomain processorDomain, ProcessorState state) {
    public ProcessorConfig withState(ProcessorState next) {
        return new ProcessorConfig(authorizationContract, processorDomain, next);
    }

    public ProcessorConfig withDomain(ProcessorDomain next) {
        return new ProcessorConfig(authorizationContract, next, state);
    }

    public ProcessorConfig withAuthorizationContract(String next) {
        return new ProcessorConfig(next, processorDomain, state);
    }
}
