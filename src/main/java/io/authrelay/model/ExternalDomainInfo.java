package io.authrelay.model;

public record ExternalDomainInfo(String name, ExternalDomain.ExecutionEnvironment executionEnvironment, String processor) {

    public static ExternalDomainInfo polytone(String name, String note, long timeoutSeconds, String proxy, String processor) {
        ExternalDomain.PolytoneNote polytoneNote = new ExternalDomain.PolytoneNote(note, timeoutSeconds, null);
        return new ExternalDomainInfo(name,
                new ExternalDomain.Cosmwasm(new ExternalDomain.PolytoneConnectors(polytoneNote, proxy)), processor);
    }

    public static ExternalDomainInfo hyperlane(String name, String mailbox, int domainId, String processor) {
        return new ExternalDomainInfo(name,
                new ExternalDomain.Evm(new ExternalDomain.HyperlaneConnector(mailbox, domainId)), processor);
    }

    public ExternalDomain toExternalDomain() {
        ExternalDomain domain = new ExternalDomain(name, executionEnvironment, processor);
        return domain.withProxyState(PolytoneProxyState.PENDING_RESPONSE);
    }
}
