package io.authrelay.cli;

import io.authrelay.bridge.RelayReport;
import io.authrelay.config.AuthRelayConfig;
import io.authrelay.model.Domain;
import io.authrelay.model.Expiration;
import io.authrelay.model.Mint;
import io.authrelay.model.Priority;
import io.authrelay.model.ProcessorMessage;
import io.authrelay.observability.AuditLogger;
import io.authrelay.runtime.AuthRelayRuntime;
import io.authrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "authrelay",
        mixinStandardHelpOptions = true,
        description = "Authorization registry, processors and bridges on local chains",
        subcommands = {
                AuthRelayCommand.InitCommand.class,
                AuthRelayCommand.DomainsCommand.class,
                AuthRelayCommand.ChainsCommand.class,
                AuthRelayCommand.CreateAuthorizationsCommand.class,
                AuthRelayCommand.AuthorizationsCommand.class,
                AuthRelayCommand.MintCommand.class,
                AuthRelayCommand.TokensCommand.class,
                AuthRelayCommand.EnableCommand.class,
                AuthRelayCommand.DisableCommand.class,
                AuthRelayCommand.SendCommand.class,
                AuthRelayCommand.RetryCommand.class,
                AuthRelayCommand.TickCommand.class,
                AuthRelayCommand.RelayCommand.class,
                AuthRelayCommand.QueueCommand.class,
                AuthRelayCommand.CallbacksCommand.class,
                AuthRelayCommand.PauseCommand.class,
                AuthRelayCommand.ResumeCommand.class,
                AuthRelayCommand.AdvanceTimeCommand.class,
                AuthRelayCommand.AuditTailCommand.class,
                AuthRelayCommand.AuditVerifyCommand.class
        }
)
public final class AuthRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | domains | chains | create-authorizations | authorizations | mint | tokens | enable | disable | send | retry | tick | relay | queue | callbacks | pause | resume | advance-time | audit-tail | audit-verify");
    }

    AuthRelayRuntime runtime() {
        AuthRelayRuntime runtime = new AuthRelayRuntime(AuthRelayConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    String owner(AuthRelayRuntime runtime, String sender) {
        return sender == null || sender.isBlank() ? runtime.settings().owner() : sender.trim();
    }

    static int print(AuthRelayRuntime.TxOutcome outcome) {
        System.out.println(Jsons.toJson(outcome));
        return outcome.success() ? 0 : 1;
    }

    @Command(name = "init", description = "Create the data root, settings file and deploy all contracts")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            System.out.println("Initialized AuthRelay at: " + AuthRelayConfig.fromRoot(parent.root, parent.namespace).rootDir());
            System.out.println("Registry: " + runtime.registryAddress());
            return 0;
        }
    }

    @Command(name = "domains", description = "List external domains registered in the registry")
    static final class DomainsCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().externalDomains()));
            return 0;
        }
    }

    @Command(name = "chains", description = "List local chains stored in this namespace")
    static final class ChainsCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().chains()));
            return 0;
        }
    }

    @Command(name = "create-authorizations", description = "Create authorizations from a JSON array file")
    static final class CreateAuthorizationsCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--file"}, required = true, description = "JSON file with an array of authorizations")
        Path file;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() throws IOException {
            AuthRelayRuntime runtime = parent.runtime();
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            return print(runtime.createAuthorizations(parent.owner(runtime, sender), raw));
        }
    }

    @Command(name = "authorizations", description = "List authorizations")
    static final class AuthorizationsCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().authorizations()));
            return 0;
        }
    }

    @Command(name = "mint", description = "Mint permission tokens of an authorization")
    static final class MintCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--label"}, required = true, description = "Authorization label")
        String label;

        @Option(names = {"--to"}, required = true, description = "Receiving address")
        String to;

        @Option(names = {"--amount"}, defaultValue = "1", description = "Number of tokens")
        long amount;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.mint(parent.owner(runtime, sender), label, List.of(new Mint(to, amount))));
        }
    }

    @Command(name = "tokens", description = "Show how many permission tokens an address holds")
    static final class TokensCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--label"}, required = true, description = "Authorization label")
        String label;

        @Option(names = {"--address"}, required = true, description = "Holder address")
        String address;

        @Override
        public Integer call() {
            System.out.println(parent.runtime().permissionTokens(label, address));
            return 0;
        }
    }

    @Command(name = "enable", description = "Enable an authorization")
    static final class EnableCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--label"}, required = true, description = "Authorization label")
        String label;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.setAuthorizationEnabled(parent.owner(runtime, sender), label, true));
        }
    }

    @Command(name = "disable", description = "Disable an authorization")
    static final class DisableCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--label"}, required = true, description = "Authorization label")
        String label;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.setAuthorizationEnabled(parent.owner(runtime, sender), label, false));
        }
    }

    @Command(name = "send", description = "Trigger an authorization with Cosmwasm execute messages")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--label"}, required = true, description = "Authorization label")
        String label;

        @Option(names = {"--sender"}, required = true, description = "Sender address")
        String sender;

        @Option(names = {"--msg"}, description = "Raw JSON execute message, one per function (repeatable)")
        List<String> msgs;

        @Option(names = {"--messages-file"}, description = "JSON array of processor messages")
        Path messagesFile;

        @Option(names = {"--ttl-seconds"}, description = "Seconds from now after which a timed out execution can't be retried")
        Long ttlSeconds;

        @Override
        public Integer call() throws IOException {
            AuthRelayRuntime runtime = parent.runtime();
            Expiration ttl = ttlSeconds == null
                    ? null
                    : Expiration.atTime(runtime.chain(Domain.MAIN).block().time() + ttlSeconds);
            if (messagesFile != null) {
                String raw = Files.readString(messagesFile, StandardCharsets.UTF_8);
                return print(runtime.sendMsgs(sender, label, raw, ttl));
            }
            List<ProcessorMessage> messages = new ArrayList<>();
            for (String msg : msgs == null ? List.<String>of() : msgs) {
                messages.add(new ProcessorMessage.CosmwasmExecuteMsg(msg.getBytes(StandardCharsets.UTF_8)));
            }
            return print(runtime.sendMsgs(sender, label, messages, ttl));
        }
    }

    @Command(name = "retry", description = "Re-send an execution that timed out on its bridge")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--execution-id"}, required = true, description = "Execution id")
        long executionId;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.retryMsgs(parent.owner(runtime, sender), executionId));
        }
    }

    @Command(name = "tick", description = "Advance the processor of a domain by one step")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--domain"}, defaultValue = "main", description = "main or an external domain name")
        String domain;

        @Option(names = {"--count"}, defaultValue = "1", description = "Number of ticks")
        int count;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            int code = 0;
            for (int i = 0; i < Math.max(1, count); i++) {
                code = Math.max(code, print(runtime.tick(Domain.parse(domain))));
            }
            return code;
        }
    }

    @Command(name = "relay", description = "Relay pending bridge packets until nothing moves")
    static final class RelayCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            RelayReport report = parent.runtime().relay();
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "queue", description = "Show a processor queue")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--domain"}, defaultValue = "main", description = "main or an external domain name")
        String domain;

        @Option(names = {"--priority"}, defaultValue = "medium", description = "Priority: high|medium")
        String priority;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.queue(Domain.parse(domain), Priority.fromString(priority))));
            return 0;
        }
    }

    @Command(name = "callbacks", description = "List execution results recorded by the registry")
    static final class CallbacksCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--execution-id"}, description = "Show one execution only")
        Long executionId;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            Object out = executionId == null ? runtime.callbacks() : runtime.callback(executionId);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "pause", description = "Pause the processor of a domain")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--domain"}, defaultValue = "main", description = "main or an external domain name")
        String domain;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.pause(parent.owner(runtime, sender), Domain.parse(domain)));
        }
    }

    @Command(name = "resume", description = "Resume the processor of a domain")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--domain"}, defaultValue = "main", description = "main or an external domain name")
        String domain;

        @Option(names = {"--sender"}, description = "Sender address (default: configured owner)")
        String sender;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            return print(runtime.resume(parent.owner(runtime, sender), Domain.parse(domain)));
        }
    }

    @Command(name = "advance-time", description = "Move block time forward on every chain")
    static final class AdvanceTimeCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--seconds"}, required = true, description = "Seconds to add")
        long seconds;

        @Override
        public Integer call() {
            AuthRelayRuntime runtime = parent.runtime();
            runtime.advanceTime(seconds);
            System.out.println(Jsons.toJson(runtime.chain(Domain.MAIN).block()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log lines")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (String row : parent.runtime().auditTail(lines)) {
                System.out.println(row);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AuthRelayCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityReport report = parent.runtime().verifyAudit();
            System.out.println(Jsons.toJson(report));
            return report.valid() ? 0 : 1;
        }
    }
}
