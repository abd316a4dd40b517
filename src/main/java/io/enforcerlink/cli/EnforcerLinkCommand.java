package io.enforcerlink.cli;

import io.enforcerlink.config.EnforcerLinkConfig;
import io.enforcerlink.config.LinkSettings;
import io.enforcerlink.monitor.ContextStore;
import io.enforcerlink.monitor.DirectoryContextStore;
import io.enforcerlink.monitor.EventInfo;
import io.enforcerlink.monitor.EventType;
import io.enforcerlink.monitor.LifecycleMonitor;
import io.enforcerlink.monitor.MonitorClient;
import io.enforcerlink.monitor.ProcessEventProcessor;
import io.enforcerlink.monitor.RemoteEventException;
import io.enforcerlink.monitor.UnitType;
import io.enforcerlink.observability.AuditLogger;
import io.enforcerlink.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "enforcerlink",
        mixinStandardHelpOptions = true,
        description = "Enforcer lifecycle monitor and RPC link CLI",
        subcommands = {
                EnforcerLinkCommand.MonitorCommand.class,
                EnforcerLinkCommand.SendEventCommand.class,
                EnforcerLinkCommand.AuditVerifyCommand.class
        }
)
public final class EnforcerLinkCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = EnforcerLinkConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: monitor | send-event | audit-verify");
    }

    EnforcerLinkConfig config() {
        return EnforcerLinkConfig.fromRoot(root);
    }

    LinkSettings settings() {
        return LinkSettings.fromSystem(config());
    }

    AuditLogger auditLogger() {
        return new AuditLogger(config().auditFile(), "enforcerlink", "");
    }

    @Command(name = "monitor", description = "Run the lifecycle monitor on a unix socket until interrupted")
    static final class MonitorCommand implements Callable<Integer> {
        @ParentCommand
        EnforcerLinkCommand parent;

        @Option(names = {"--socket"}, required = true, description = "Unix socket path to serve on")
        String socket;

        @Option(names = {"--store"}, description = "Context store directory to resync from")
        String store;

        @Option(names = {"--secret"}, description = "Shared secret callers must sign events with")
        String secret;

        @Override
        public Integer call() throws Exception {
            LinkSettings settings = parent.settings();
            if (secret != null && !secret.isBlank()) {
                settings = settings.withMonitorSharedSecret(secret);
            }
            AuditLogger audit = parent.auditLogger();
            ContextStore contextStore = store == null || store.isBlank()
                    ? ContextStore.empty()
                    : new DirectoryContextStore(Paths.get(store));
            AuditingUnitHandler handler = new AuditingUnitHandler(audit);
            LifecycleMonitor monitor = new LifecycleMonitor(socket, handler, contextStore, settings, audit);
            monitor.registerProcessor(UnitType.LINUX_PROCESS, new ProcessEventProcessor(handler));

            LifecycleMonitor.ResyncOutcome resync = monitor.start();
            Map<String, Object> started = new LinkedHashMap<>();
            started.put("socket", monitor.rpcAddress());
            started.put("settings", settings.toString());
            started.put("resync", resync);
            System.out.println(Jsons.toJson(started));

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    monitor.stop();
                } catch (Exception e) {
                    System.err.println("monitor stop failed: " + e.getMessage());
                } finally {
                    stopped.countDown();
                }
            }, "enforcerlink-shutdown-hook"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "send-event", description = "Send one lifecycle event to a running monitor")
    static final class SendEventCommand implements Callable<Integer> {
        @ParentCommand
        EnforcerLinkCommand parent;

        @Option(names = {"--socket"}, required = true, description = "Monitor unix socket path")
        String socket;

        @Option(names = {"--event"}, required = true, description = "Event type: create|start|stop|destroy|pause|unpause")
        String event;

        @Option(names = {"--unit-type"}, defaultValue = "LINUX_PROCESS", description = "Unit type: LINUX_PROCESS|CONTAINER")
        String unitType;

        @Option(names = {"--unit-id"}, required = true, description = "Unit id")
        String unitId;

        @Option(names = {"--name"}, defaultValue = "", description = "Unit name")
        String name;

        @Option(names = {"--pid"}, defaultValue = "", description = "Process id")
        String pid;

        @Option(names = {"--tag"}, description = "Tag as key=value, repeatable")
        Map<String, String> tags;

        @Option(names = {"--ip"}, description = "Address as network=ip, repeatable")
        Map<String, String> ips;

        @Option(names = {"--secret"}, description = "Shared secret to sign the event with")
        String secret;

        @Override
        public Integer call() throws Exception {
            Optional<EventType> type = EventType.fromWire(event);
            if (type.isEmpty()) {
                throw new IllegalArgumentException("Unknown event type: " + event);
            }
            EventInfo info = new EventInfo(
                    type.get().wire(),
                    UnitType.fromJson(unitType),
                    unitId,
                    name,
                    tags,
                    pid,
                    ips
            );
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("socket", socket);
            out.put("event", info.eventType());
            out.put("unit", info.unitId());
            try (MonitorClient client = MonitorClient.connect(socket, secret, parent.settings())) {
                client.sendEvent(info);
                out.put("result", "ok");
                System.out.println(Jsons.toJson(out));
                return 0;
            } catch (RemoteEventException e) {
                out.put("result", "rejected");
                out.put("error", e.remoteError());
                System.out.println(Jsons.toJson(out));
                return 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        EnforcerLinkCommand parent;

        @Override
        public Integer call() throws Exception {
            AuditLogger.ChainVerification out = parent.auditLogger().verifyChain();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }
}
