package io.authrelay.routing;

import io.authrelay.host.CosmosMsg;
import io.authrelay.host.Wire;
import io.authrelay.model.CallbackRequest;
import io.authrelay.model.ExternalDomain;
import io.authrelay.model.HyperlaneMsg;
import io.authrelay.model.PolytoneCallbackTag;
import io.authrelay.model.PolytoneMsg;
import io.authrelay.model.PolytoneProxyState;
import io.authrelay.model.ProcessorDomain;
import io.authrelay.model.ProcessorMsg;
import io.authrelay.model.RegistryMsg;

import java.util.List;

public final class DomainRouter {
    private final MessageEncoder encoder;

    public DomainRouter(MessageEncoder encoder) {
        this.encoder = encoder;
    }

    public MessageEncoder encoder() {
        return encoder;
    }

    public CosmosMsg toMainProcessor(String processor, ProcessorMsg msg) {
        return new CosmosMsg.WasmExecute(processor, Wire.encode(msg, ProcessorMsg.class));
    }

    public CosmosMsg toExternalProcessor(ExternalDomain domain, String callbackReceiver, ProcessorMsg msg,
                                         PolytoneCallbackTag tag) throws BridgeError {
        if (domain.executionEnvironment() instanceof ExternalDomain.Cosmwasm cosmwasm) {
            ExternalDomain.PolytoneNote note = cosmwasm.polytone().polytoneNote();
            if (!(note.state() instanceof PolytoneProxyState.Created)) {
                throw new BridgeError(BridgeError.Reason.PROXY_NOT_CREATED, domain.name());
            }
            CosmosMsg inner = new CosmosMsg.WasmExecute(domain.processor(), Wire.encode(msg, ProcessorMsg.class));
            return polytoneExecute(note.address(), List.of(inner), callbackReceiver, tag, note.timeoutSeconds());
        }
        ExternalDomain.HyperlaneConnector hyperlane = ((ExternalDomain.Evm) domain.executionEnvironment()).hyperlane();
        return new CosmosMsg.WasmExecute(hyperlane.mailbox(), Wire.encode(new HyperlaneMsg.Dispatch(
                hyperlane.domainId(), domain.processor(), encoder.encodeProcessorMsg(msg)), HyperlaneMsg.class));
    }

    public CosmosMsg createProxy(String note, long timeoutSeconds, String callbackReceiver, String domainName) {
        return polytoneExecute(note, List.of(), callbackReceiver, new PolytoneCallbackTag.CreateProxy(domainName),
                timeoutSeconds);
    }

    public CosmosMsg callbackToRegistry(ProcessorDomain processorDomain, String registry, String self,
                                        RegistryMsg.ProcessorCallback callback) {
        if (processorDomain instanceof ProcessorDomain.Polytone polytone) {
            CosmosMsg inner = new CosmosMsg.WasmExecute(registry, Wire.encode(callback, RegistryMsg.class));
            return polytoneExecute(polytone.note(), List.of(inner), self,
                    new PolytoneCallbackTag.ExecutionId(callback.executionId()), polytone.timeoutSeconds());
        }
        if (processorDomain instanceof ProcessorDomain.Hyperlane hyperlane) {
            return new CosmosMsg.WasmExecute(hyperlane.mailbox(), Wire.encode(new HyperlaneMsg.Dispatch(
                    hyperlane.mainDomainId(), registry, encoder.encodeCallback(callback)), HyperlaneMsg.class));
        }
        return new CosmosMsg.WasmExecute(registry, Wire.encode(callback, RegistryMsg.class));
    }

    private CosmosMsg polytoneExecute(String note, List<CosmosMsg> msgs, String callbackReceiver,
                                      PolytoneCallbackTag tag, long timeoutSeconds) {
        CallbackRequest callback = tag == null
                ? null
                : new CallbackRequest(callbackReceiver, Wire.encode(tag, PolytoneCallbackTag.class));
        return new CosmosMsg.WasmExecute(note, Wire.encode(new PolytoneMsg.Execute(msgs, callback, timeoutSeconds),
                PolytoneMsg.class));
    }
}
