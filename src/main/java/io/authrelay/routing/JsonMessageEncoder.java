package io.authrelay.routing;

import io.authrelay.host.ContractException;
import io.authrelay.host.Wire;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.RegistryMsg;

public final class JsonMessageEncoder implements MessageEncoder {
    @Override
    public byte[] encodeProcessorMsg(ProcessorMsg msg) {
        return Wire.encode(msg, ProcessorMsg.class);
    }

    @Override
    public ProcessorMsg decodeProcessorMsg(byte[] body) throws BridgeError {
        try {
            return Wire.decode(body, ProcessorMsg.class);
        } catch (ContractException e) {
            throw new BridgeError(BridgeError.Reason.INVALID_BODY, e.getMessage());
        }
    }

    @Override
    public byte[] encodeCallback(RegistryMsg.ProcessorCallback callback) {
        return Wire.encode(callback, RegistryMsg.class);
    }

    @Override
    public RegistryMsg.ProcessorCallback decodeCallback(byte[] body) throws BridgeError {
        RegistryMsg decoded;
        try {
            decoded = Wire.decode(body, RegistryMsg.class);
        } catch (ContractException e) {
            throw new BridgeError(BridgeError.Reason.INVALID_BODY, e.getMessage());
        }
        if (decoded instanceof RegistryMsg.ProcessorCallback callback) {
            return callback;
        }
        throw new BridgeError(BridgeError.Reason.INVALID_BODY, "expected processor_callback");
    }
}
