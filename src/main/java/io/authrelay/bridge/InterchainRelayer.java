package io.authrelay.bridge;

import com.fasterxml.jackson.core.type.TypeReference;
import io.authrelay.host.ContractException;
import io.authrelay.host.LocalChain;
import io.authrelay.host.TxResult;
import io.authrelay.host.Wire;
import io.authrelay.model.HyperlaneMsg;
import io.authrelay.model.PolytoneMsg;
import io.authrelay.model.PolytonePacket;
import io.authrelay.model.PolytoneResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public final class InterchainRelayer {
    private static final Logger LOG = LoggerFactory.getLogger(InterchainRelayer.class);
    private static final TypeReference<List<PolytonePacket>> PACKETS = new TypeReference<>() {
    };
    private static final TypeReference<List<HyperlaneMsg.OutboundMessage>> OUTBOX = new TypeReference<>() {
    };
    public static final int MAX_ROUNDS = 32;

    private final String relayerAddress;
    private final List<PolytoneLink> polytoneLinks = new ArrayList<>();
    private final List<HyperlaneLink> hyperlaneLinks = new ArrayList<>();

    public InterchainRelayer(String relayerAddress) {
        this.relayerAddress = relayerAddress;
    }

    public record PolytoneLink(LocalChain source, String note, LocalChain destination, String voice) {
    }

    public record HyperlaneLink(
            LocalChain source,
            String mailbox,
            LocalChain destination,
            String destinationMailbox,
            int destinationDomainId
    ) {
    }

    public InterchainRelayer addLink(PolytoneLink link) {
        polytoneLinks.add(link);
        return this;
    }

    public InterchainRelayer addLink(HyperlaneLink link) {
        hyperlaneLinks.add(link);
        return this;
    }

    public RelayReport relayAll() {
        RelayReport total = RelayReport.EMPTY;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            RelayReport pass = RelayReport.EMPTY;
            for (PolytoneLink link : polytoneLinks) {
                pass = pass.plus(relay(link));
            }
            for (HyperlaneLink link : hyperlaneLinks) {
                pass = pass.plus(relay(link));
            }
            total = total.plus(pass);
            if (!pass.progressed()) {
                break;
            }
        }
        if (total.progressed() || total.failed() > 0) {
            LOG.info("Relay pass finished: delivered={} timedOut={} failed={}",
                    total.delivered(), total.timedOut(), total.failed());
        }
        return total;
    }

    RelayReport relay(PolytoneLink link) {
        List<PolytonePacket> packets;
        try {
            packets = link.source().query(link.note(), new PolytoneMsg.PendingPackets(), PACKETS);
        } catch (ContractException e) {
            LOG.warn("Cannot list packets of note {} on {}: {}", link.note(), link.source().chainId(), e.getMessage());
            return new RelayReport(0, 0, 1);
        }
        int delivered = 0;
        int timedOut = 0;
        int failed = 0;
        for (PolytonePacket packet : packets) {
            try {
                if (link.destination().block().time() >= packet.timeoutAt()) {
                    link.source().execute(relayerAddress, link.note(), new PolytoneMsg.Timeout(packet.sequence()));
                    timedOut++;
                    continue;
                }
                PolytoneResult ack = deliver(link, packet);
                link.source().execute(relayerAddress, link.note(), new PolytoneMsg.Ack(packet.sequence(), ack));
                delivered++;
            } catch (ContractException e) {
                failed++;
                LOG.warn("Relaying packet {} from {} failed: {}", packet.sequence(), link.source().chainId(), e.getMessage());
            }
        }
        return new RelayReport(delivered, timedOut, failed);
    }

    private PolytoneResult deliver(PolytoneLink link, PolytonePacket packet) {
        PolytoneMsg.Rx rx = new PolytoneMsg.Rx(link.source().chainId(), packet.initiator(), packet.msgs());
        try {
            TxResult result = link.destination().execute(relayerAddress, link.voice(), rx);
            return Wire.decode(result.data(), PolytoneResult.class);
        } catch (ContractException e) {
            return new PolytoneResult.FatalError(e.getMessage());
        }
    }

    RelayReport relay(HyperlaneLink link) {
        List<HyperlaneMsg.OutboundMessage> outbox;
        try {
            outbox = link.source().query(link.mailbox(), new HyperlaneMsg.Outbox(), OUTBOX);
        } catch (ContractException e) {
            LOG.warn("Cannot list outbox of mailbox {} on {}: {}", link.mailbox(), link.source().chainId(), e.getMessage());
            return new RelayReport(0, 0, 1);
        }
        int delivered = 0;
        int failed = 0;
        for (HyperlaneMsg.OutboundMessage message : outbox) {
            if (message.destinationDomain() != link.destinationDomainId()) {
                continue;
            }
            try {
                link.destination().execute(relayerAddress, link.destinationMailbox(), new HyperlaneMsg.Process(
                        message.nonce(), message.origin(), message.sender(), message.recipient(), message.body()));
                link.source().execute(relayerAddress, link.mailbox(), new HyperlaneMsg.Delivered(message.nonce()));
                delivered++;
            } catch (ContractException e) {
                failed++;
                LOG.warn("Delivering mailbox message {} from domain {} failed: {}",
                        message.nonce(), message.origin(), e.getMessage());
            }
        }
        return new RelayReport(delivered, 0, failed);
    }
}
