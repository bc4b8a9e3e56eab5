package io.authrelay.host;

public interface Contract {
    Response instantiate(ContractContext ctx, byte[] msg) throws ContractException;

    Response execute(ContractContext ctx, byte[] msg) throws ContractException;

    byte[] query(ContractContext ctx, byte[] msg) throws ContractException;

    default Response reply(ContractContext ctx, Reply reply) throws ContractException {
        throw new ContractException("Contract does not handle replies (id " + reply.id() + ")");
    }

    default Response migrate(ContractContext ctx, byte[] msg) throws ContractException {
        throw new ContractException("Contract does not support migration");
    }
}
