package io.authrelay.routing;

import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.RegistryMsg;

public interface MessageEncoder {
    byte[] encodeProcessorMsg(ProcessorMsg msg);

    ProcessorMsg decodeProcessorMsg(byte[] body) throws BridgeError;

    byte[] encodeCallback(RegistryMsg.ProcessorCallback callback);

    RegistryMsg.ProcessorCallback decodeCallback(byte[] body) throws BridgeError;
}
