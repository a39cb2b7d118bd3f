package me.botfleet.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.domain.model.DesiredState;
import me.botfleet.domain.model.FleetConfigReloadedEvent;
import me.botfleet.domain.model.FleetDocument;
import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.InstanceCrashException;
import me.botfleet.domain.model.InstanceNotFoundException;
import me.botfleet.domain.model.InstanceStopRequestedEvent;
import me.botfleet.domain.model.InstanceStatus;
import me.botfleet.domain.model.InstanceTransition;
import me.botfleet.domain.model.InstanceUpdate;
import me.botfleet.domain.model.InvalidReferenceException;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.domain.model.Template;
import me.botfleet.domain.model.TemplateDefaults;
import me.botfleet.infrastructure.config.FleetExecutors;
import me.botfleet.infrastructure.config.FleetProperties;
import me.botfleet.infrastructure.event.SpringEventBus;
import me.botfleet.port.outbound.ChatGatewayPort;
import me.botfleet.port.outbound.ChatGatewayPort.GatewayConnection;
import me.botfleet.port.outbound.KnowledgeStorePort;
import me.botfleet.port.outbound.PersonalityPort;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Owns the live instance registry and drives every instance through its
 * lifecycle.
 *
 * <p>
 * Threading model:
 * <ul>
 * <li>all registry, fault and chain state is touched only on the single
 * {@code fleet-orchestrator} thread, so none of it is locked</li>
 * <li>operations on the same instance id run one after another: each waits
 * for the previous one's future</li>
 * <li>blocking knowledge-store calls run on the I/O pool; gateway I/O runs
 * inside the adapter</li>
 * </ul>
 *
 * <p>
 * Observed state is derived from the registry and the fault table only.
 * Persisted {@code desiredState}/{@code lastObservedState} are never trusted.
 */
@Service
@Slf4j
public class InstanceOrchestrator {

    static final String MDC_INSTANCE_ID = "instanceId";
    static final long STOP_GRACE_MILLIS = 1000;

    private final FleetConfigService configService;
    private final TemplateService templateService;
    private final CredentialVaultService vault;
    private final PersonalityPort personalityPort;
    private final ChatGatewayPort gateway;
    private final KnowledgeStorePort knowledgeStore;
    private final IsolationPathResolver isolationPathResolver;
    private final StatusBus statusBus;
    private final SpringEventBus eventBus;
    private final FleetProperties.OrchestratorProperties settings;
    private final ScheduledExecutorService loop;
    private final FleetExecutors executors;
    private final Clock clock;

    private final Map<String, LiveInstance> registry = new HashMap<>();
    private final Map<String, String> faults = new HashMap<>();
    private final Map<String, CompletableFuture<?>> chains = new HashMap<>();

    public InstanceOrchestrator(FleetConfigService configService, TemplateService templateService,
            CredentialVaultService vault, PersonalityPort personalityPort, ChatGatewayPort gateway,
            KnowledgeStorePort knowledgeStore, IsolationPathResolver isolationPathResolver, StatusBus statusBus,
            SpringEventBus eventBus, FleetProperties properties, FleetExecutors executors, Clock clock) {
        this.configService = configService;
        this.templateService = templateService;
        this.vault = vault;
        this.personalityPort = personalityPort;
        this.gateway = gateway;
        this.knowledgeStore = knowledgeStore;
        this.isolationPathResolver = isolationPathResolver;
        this.statusBus = statusBus;
        this.eventBus = eventBus;
        this.settings = properties.getOrchestrator();
        this.executors = executors;
        this.loop = executors.loop();
        this.clock = clock;
    }

    // ==================== lifecycle API ====================

    /**
     * Validates and stores a new instance config. Nothing is started.
     */
    public CompletableFuture<InstanceStatus> create(InstanceConfig draft) {
        String id = draft.getId() != null && !draft.getId().isBlank()
                ? draft.getId().trim()
                : "bot-" + UUID.randomUUID().toString().substring(0, 8);
        return enqueue(id, () -> {
            Template template = templateService.resolve(draft.getTemplateId());
            vault.resolve(draft.getCredentialRef());
            validatePersonality(draft.getPersonalityOverride());

            InstanceConfig config = InstanceConfig.builder()
                    .id(id)
                    .displayName(draft.getDisplayName() != null && !draft.getDisplayName().isBlank()
                            ? draft.getDisplayName()
                            : template.getName())
                    .templateId(template.getId())
                    .credentialRef(draft.getCredentialRef())
                    .personalityOverride(blankToNull(draft.getPersonalityOverride()))
                    .autoStart(draft.isAutoStart())
                    .desiredState(DesiredState.STOPPED)
                    .createdAt(Instant.now(clock))
                    .defaults(TemplateDefaults.from(template))
                    .build();

            configService.update(doc -> {
                if (doc.findInstance(id).isPresent()) {
                    throw new IllegalStateException("Instance '" + id + "' already exists");
                }
                doc.getInstances().add(config);
            });
            log.info("[Orchestrator] Created instance {} from template {}", id, template.getId());
            return CompletableFuture.completedFuture(snapshot(id, config));
        });
    }

    /**
     * Starts the instance unless it already has a live task. A config error
     * fails the returned future and leaves the desired state untouched; a
     * connect failure completes it with an {@link LifecycleState#ERROR}
     * status.
     */
    public CompletableFuture<InstanceStatus> start(String id) {
        return enqueue(id, () -> {
            InstanceConfig config = requireConfig(id);
            if (!registry.containsKey(id)) {
                vault.resolve(config.getCredentialRef());
                ensureCredentialFree(id, config.getCredentialRef());
            }
            setDesiredState(id, DesiredState.RUNNING);
            return doStart(id, false);
        });
    }

    public CompletableFuture<InstanceStatus> stop(String id) {
        return enqueue(id, () -> {
            setDesiredState(id, DesiredState.STOPPED);
            eventBus.publish(new InstanceStopRequestedEvent(id, false));
            return doStop(id);
        });
    }

    /**
     * Restart requested by crash supervision. Does nothing unless the
     * instance is still faulted without a live task and its desired state is
     * still {@link DesiredState#RUNNING}.
     */
    public CompletableFuture<InstanceStatus> restartAfterCrash(String id) {
        return enqueue(id, () -> {
            InstanceConfig config = configService.findInstance(id).orElse(null);
            if (config == null || registry.containsKey(id) || !faults.containsKey(id)
                    || config.getDesiredState() != DesiredState.RUNNING) {
                log.info("[Orchestrator] Skipping crash restart of {}: no longer wanted", id);
                return CompletableFuture.completedFuture(snapshot(id, config));
            }
            return doStart(id, true);
        });
    }

    /**
     * Stop followed by start as one operation. A failing start leaves the
     * instance in {@link LifecycleState#ERROR}.
     */
    public CompletableFuture<InstanceStatus> restart(String id) {
        return enqueue(id, () -> {
            setDesiredState(id, DesiredState.RUNNING);
            return doStop(id).thenComposeAsync(stopped -> doStart(id, true), loop);
        });
    }

    /**
     * Stops the instance, waits for the stop, then removes its config.
     */
    public CompletableFuture<InstanceStatus> delete(String id) {
        return enqueue(id, () -> {
            requireConfig(id);
            eventBus.publish(new InstanceStopRequestedEvent(id, true));
            return doStop(id).thenApplyAsync(stopped -> {
                configService.update(doc -> doc.getInstances().removeIf(instance -> id.equals(instance.getId())));
                faults.remove(id);
                log.info("[Orchestrator] Deleted instance {}", id);
                return InstanceStatus.builder()
                        .id(id)
                        .displayName(stopped.displayName())
                        .state(LifecycleState.STOPPED)
                        .desiredState(DesiredState.STOPPED)
                        .build();
            }, loop);
        });
    }

    /**
     * Changes an instance config. A live instance keeps running unless its
     * credential reference changed, in which case it is restarted.
     */
    public CompletableFuture<InstanceStatus> update(String id, InstanceUpdate change) {
        return enqueue(id, () -> {
            InstanceConfig previous = requireConfig(id);
            InstanceConfig updated = applyChange(previous, change);
            configService.update(doc -> {
                doc.getInstances().replaceAll(instance -> id.equals(instance.getId()) ? updated : instance);
            });
            log.info("[Orchestrator] Updated instance {}", id);
            return applyConfigChange(previous, updated);
        });
    }

    public CompletableFuture<InstanceStatus> status(String id) {
        return onLoop(() -> {
            LiveInstance live = registry.get(id);
            InstanceConfig config = live != null ? live.config : requireConfig(id);
            return snapshot(id, config);
        });
    }

    public CompletableFuture<List<InstanceStatus>> list() {
        return onLoop(() -> {
            List<InstanceStatus> statuses = new ArrayList<>();
            Set<String> seen = new LinkedHashSet<>();
            for (InstanceConfig config : configService.getInstances()) {
                seen.add(config.getId());
                LiveInstance live = registry.get(config.getId());
                statuses.add(snapshot(config.getId(), live != null ? live.config : config));
            }
            for (LiveInstance live : registry.values()) {
                if (!seen.contains(live.id)) {
                    statuses.add(snapshot(live.id, live.config));
                }
            }
            return statuses;
        });
    }

    /**
     * Ids with a live task right now.
     */
    public CompletableFuture<Set<String>> liveIds() {
        return onLoop(() -> Set.copyOf(registry.keySet()));
    }

    // ==================== reconciliation ====================

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!settings.isReconcileOnBoot()) {
            log.info("[Orchestrator] Boot reconciliation disabled");
            return;
        }
        reconcileOnBoot().whenComplete((statuses, error) -> {
            if (error != null) {
                log.error("[Orchestrator] Boot reconciliation failed", error);
            }
        });
    }

    /**
     * Starts every {@code autoStart} instance fresh, one after another.
     * Persisted state from a previous run is ignored.
     */
    public CompletableFuture<List<InstanceStatus>> reconcileOnBoot() {
        List<String> ids = configService.getInstances().stream()
                .filter(InstanceConfig::isAutoStart)
                .map(InstanceConfig::getId)
                .toList();
        log.info("[Orchestrator] Boot reconciliation: {} auto-start instance(s)", ids.size());

        List<InstanceStatus> results = new ArrayList<>();
        CompletableFuture<Void> sequence = CompletableFuture.completedFuture(null);
        for (String id : ids) {
            sequence = sequence.thenCompose(ignored -> enqueue(id, () -> doStart(id, true))
                    .handle((status, error) -> {
                        if (error != null) {
                            log.warn("[Orchestrator] Boot start of {} failed: {}", id, rootCause(error).getMessage());
                        } else {
                            results.add(status);
                        }
                        return null;
                    }));
        }
        return sequence.thenApply(ignored -> List.copyOf(results));
    }

    /**
     * Applies an externally replaced fleet document to the live set.
     */
    @EventListener
    public void onConfigReloaded(FleetConfigReloadedEvent event) {
        applyReload(event.previous(), event.current());
    }

    public CompletableFuture<Void> applyReload(FleetDocument previous, FleetDocument current) {
        Map<String, InstanceConfig> before = previous != null ? previous.instancesById() : Map.of();
        Map<String, InstanceConfig> after = current.instancesById();
        List<CompletableFuture<InstanceStatus>> actions = new ArrayList<>();

        for (Map.Entry<String, InstanceConfig> entry : before.entrySet()) {
            String id = entry.getKey();
            if (!after.containsKey(id)) {
                log.info("[Orchestrator] Reload: {} removed, stopping", id);
                eventBus.publish(new InstanceStopRequestedEvent(id, true));
                actions.add(enqueue(id, () -> doStop(id).thenApplyAsync(status -> {
                    faults.remove(id);
                    return status;
                }, loop)));
            }
        }

        for (Map.Entry<String, InstanceConfig> entry : after.entrySet()) {
            String id = entry.getKey();
            InstanceConfig updated = entry.getValue();
            InstanceConfig old = before.get(id);
            if (old == null) {
                if (updated.isAutoStart()) {
                    log.info("[Orchestrator] Reload: {} added with auto-start", id);
                    actions.add(enqueue(id, () -> doStart(id, true)));
                }
            } else if (!updated.sameIntentAs(old)) {
                actions.add(enqueue(id, () -> applyConfigChange(old, updated)));
            }
        }

        return CompletableFuture.allOf(actions.stream()
                .map(action -> action.handle((status, error) -> {
                    if (error != null) {
                        log.warn("[Orchestrator] Reload action failed: {}", rootCause(error).getMessage());
                    }
                    return null;
                }))
                .toArray(CompletableFuture[]::new));
    }

    /**
     * Stops every live instance and waits for all of them.
     */
    @PreDestroy
    public void stopAll() {
        List<String> ids;
        try {
            ids = onLoop(() -> List.copyOf(registry.keySet())).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("[Orchestrator] Could not list live instances on shutdown: {}", e.getMessage());
            return;
        }
        if (ids.isEmpty()) {
            return;
        }
        log.info("[Orchestrator] Stopping {} live instance(s)", ids.size());
        CompletableFuture<?>[] stops = ids.stream()
                .map(id -> enqueue(id, () -> doStop(id)))
                .toArray(CompletableFuture[]::new);
        long waitMillis = settings.getStopTimeout().toMillis() + 5000;
        try {
            CompletableFuture.allOf(stops).get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Orchestrator] Not every instance stopped cleanly: {}", e.getMessage());
        }
    }

    // ==================== state machine ====================

    private CompletableFuture<InstanceStatus> doStart(String id, boolean recordConfigErrors) {
        LiveInstance existing = registry.get(id);
        if (existing != null) {
            log.debug("[Orchestrator] {} already has a live task", id);
            return CompletableFuture.completedFuture(snapshot(id, existing.config));
        }

        InstanceConfig config = requireConfig(id);
        String secret;
        BehaviorDescriptor behavior;
        Path isolationPath;
        try {
            secret = vault.resolve(config.getCredentialRef());
            ensureCredentialFree(id, config.getCredentialRef());
            behavior = describe(config);
            isolationPath = isolationPathResolver.resolve(config.getCredentialRef());
        } catch (InvalidReferenceException | IllegalStateException e) {
            if (!recordConfigErrors) {
                throw e;
            }
            return CompletableFuture.completedFuture(failWithoutTask(config, e.getMessage()));
        }

        LiveInstance live = new LiveInstance(config, UUID.randomUUID().toString(), isolationPath);
        registry.put(id, live);
        transition(live, LifecycleState.STARTING, null, false);

        return CompletableFuture.supplyAsync(() -> openKnowledge(isolationPath), executors.io())
                .thenComposeAsync(handle -> {
                    live.knowledge = handle;
                    live.pendingConnect = gateway.connect(secret, behavior, handle);
                    return live.pendingConnect.copy()
                            .orTimeout(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
                }, loop)
                .handleAsync((connection, error) -> error == null
                        ? CompletableFuture.completedFuture(onConnected(live, connection))
                        : onStartFailed(live, error), loop)
                .thenCompose(future -> future);
    }

    private InstanceStatus onConnected(LiveInstance live, GatewayConnection connection) {
        live.connection = connection;
        live.pendingConnect = null;
        live.startedAt = Instant.now(clock);
        live.heartbeatAt = live.startedAt;
        faults.remove(live.id);
        transition(live, LifecycleState.RUNNING, null, false);

        long interval = settings.getHeartbeatInterval().toMillis();
        live.heartbeatTask = loop.scheduleAtFixedRate(() -> {
            if (live.connection != null && live.connection.isReady()) {
                live.heartbeatAt = Instant.now(clock);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);

        connection.closeFuture().whenCompleteAsync((ignored, error) -> onTaskEnded(live, error), loop);
        log.info("[Orchestrator] {} running (task {}, store {})", live.id, live.taskId, live.isolationPath);
        return snapshot(live.id, live.config);
    }

    private CompletableFuture<InstanceStatus> onStartFailed(LiveInstance live, Throwable error) {
        Throwable cause = rootCause(error);
        String reason = cause instanceof TimeoutException
                ? "Connect timed out after " + settings.getConnectTimeout().toMillis() + "ms"
                : cause.getMessage();
        withInstance(live.id, () -> log.warn("[Orchestrator] {} failed to start: {}", live.id, reason));

        CompletableFuture<GatewayConnection> pending = live.pendingConnect;
        live.pendingConnect = null;
        if (pending != null) {
            pending.thenAccept(late -> {
                log.warn("[Orchestrator] Discarding late connection for {}", live.id);
                late.abort();
            });
        }

        return releaseKnowledge(live).thenApplyAsync(ignored -> {
            registry.remove(live.id);
            faults.put(live.id, reason);
            transition(live, LifecycleState.ERROR, reason, false);
            return snapshot(live.id, live.config);
        }, loop);
    }

    private CompletableFuture<InstanceStatus> doStop(String id) {
        LiveInstance live = registry.get(id);
        if (live == null) {
            InstanceConfig config = configService.findInstance(id).orElse(null);
            return CompletableFuture.completedFuture(snapshot(id, config));
        }

        live.stopRequested = true;
        live.cancelHeartbeat();
        transition(live, LifecycleState.STOPPING, null, false);

        Duration stopTimeout = settings.getStopTimeout();
        GatewayConnection connection = live.connection;
        return disconnect(connection, stopTimeout)
                .handleAsync((ignored, error) -> {
                    if (error != null) {
                        withInstance(id, () -> log.warn("[Orchestrator] {} did not stop within {}, aborting: {}",
                                id, stopTimeout, rootCause(error).toString()));
                        abortQuietly(id, connection);
                    }
                    return null;
                }, loop)
                .thenCompose(ignored -> releaseKnowledge(live))
                .thenApplyAsync(ignored -> {
                    registry.remove(id);
                    faults.remove(id);
                    transition(live, LifecycleState.STOPPED, null, false);
                    log.info("[Orchestrator] {} stopped (task {})", id, live.taskId);
                    return snapshot(id, configService.findInstance(id).orElse(live.config));
                }, loop);
    }

    /**
     * Graceful disconnect bounded on this side too, so an adapter that never
     * completes or throws still ends in an abort.
     */
    private CompletableFuture<Void> disconnect(GatewayConnection connection, Duration stopTimeout) {
        if (connection == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return connection.disconnect(stopTimeout).copy()
                    .orTimeout(stopTimeout.toMillis() + STOP_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void abortQuietly(String id, GatewayConnection connection) {
        try {
            connection.abort();
        } catch (RuntimeException e) {
            withInstance(id, () -> log.error("[Orchestrator] Abort of {} failed", id, e));
        }
    }

    /**
     * Supervision callback for a connection that closed without a stop
     * request.
     */
    private void onTaskEnded(LiveInstance live, Throwable error) {
        if (live.stopRequested || registry.get(live.id) != live) {
            return;
        }
        live.stopRequested = true;
        live.cancelHeartbeat();

        Throwable cause = error != null ? rootCause(error) : null;
        String reason = cause != null ? cause.getMessage() : "Gateway session closed";
        InstanceCrashException crash = new InstanceCrashException(live.id,
                "Instance " + live.id + " crashed: " + reason, cause);
        withInstance(live.id, () -> log.error("[Orchestrator] {}", crash.getMessage(), crash.getCause()));

        registry.remove(live.id);
        faults.put(live.id, reason);
        transition(live, LifecycleState.ERROR, reason, true);
        appendToChain(live.id, releaseKnowledge(live));
    }

    private InstanceStatus failWithoutTask(InstanceConfig config, String reason) {
        String id = config.getId();
        withInstance(id, () -> log.warn("[Orchestrator] {} cannot start: {}", id, reason));
        LifecycleState before = observedWithoutTask(id);
        faults.put(id, reason);
        Instant now = Instant.now(clock);
        statusBus.publish(InstanceTransition.of(id, before, LifecycleState.STARTING, now));
        statusBus.publish(new InstanceTransition(id, LifecycleState.STARTING, LifecycleState.ERROR, now, reason,
                false));
        return snapshot(id, config);
    }

    private void transition(LiveInstance live, LifecycleState next, String reason, boolean crash) {
        LifecycleState current = live.state;
        if (current == next) {
            return;
        }
        LifecycleState from = current == LifecycleState.STOPPED ? observedWithoutTask(live.id) : current;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for " + live.id + ": " + from + " -> " + next);
        }
        live.state = next;
        withInstance(live.id, () -> statusBus.publish(
                new InstanceTransition(live.id, from, next, Instant.now(clock), reason, crash)));
    }

    private InstanceStatus applyConfigChangeNow(InstanceConfig previous, InstanceConfig updated) {
        LiveInstance live = registry.get(updated.getId());
        live.config = updated;
        boolean behaviorChanged = !Objects.equals(previous.effectivePersonality(), updated.effectivePersonality())
                || !Objects.equals(previous.getDefaults(), updated.getDefaults());
        if (behaviorChanged && live.connection != null) {
            BehaviorDescriptor behavior = describe(updated);
            live.connection.applyBehavior(behavior);
            log.info("[Orchestrator] {} switched personality to {}", updated.getId(), behavior.personalityId());
        }
        return snapshot(updated.getId(), updated);
    }

    private CompletableFuture<InstanceStatus> applyConfigChange(InstanceConfig previous, InstanceConfig updated) {
        String id = updated.getId();
        LiveInstance live = registry.get(id);
        if (live == null) {
            return CompletableFuture.completedFuture(snapshot(id, updated));
        }
        if (updated.changesIsolationFrom(previous)) {
            log.info("[Orchestrator] {} credential changed, restarting", id);
            return doStop(id).thenComposeAsync(stopped -> doStart(id, true), loop);
        }
        return CompletableFuture.completedFuture(applyConfigChangeNow(previous, updated));
    }

    // ==================== helpers ====================

    private InstanceConfig applyChange(InstanceConfig previous, InstanceUpdate change) {
        InstanceConfig.InstanceConfigBuilder builder = previous.toBuilder();
        if (change.displayName() != null && !change.displayName().isBlank()) {
            builder.displayName(change.displayName().trim());
        }
        if (change.templateId() != null && !change.templateId().equals(previous.getTemplateId())) {
            Template template = templateService.resolve(change.templateId());
            builder.templateId(template.getId()).defaults(TemplateDefaults.from(template));
        }
        if (change.credentialRef() != null && !change.credentialRef().equals(previous.getCredentialRef())) {
            vault.resolve(change.credentialRef());
            builder.credentialRef(change.credentialRef());
        }
        if (change.personalityOverride() != null) {
            validatePersonality(change.personalityOverride());
            builder.personalityOverride(blankToNull(change.personalityOverride()));
        }
        if (change.autoStart() != null) {
            builder.autoStart(change.autoStart());
        }
        return builder.build();
    }

    /**
     * Personality description plus the instance's template defaults.
     */
    private BehaviorDescriptor describe(InstanceConfig config) {
        return personalityPort.describe(config.getId(), config.effectivePersonality()).toBuilder()
                .loadEmbedder(config.getDefaults() == null || config.getDefaults().isLoadEmbedder())
                .features(config.effectiveFeatures())
                .settings(config.effectiveSettings())
                .build();
    }

    private void ensureCredentialFree(String id, String credentialRef) {
        for (LiveInstance other : registry.values()) {
            if (!other.id.equals(id) && Objects.equals(other.credentialRef(), credentialRef)) {
                throw new IllegalStateException(
                        "Credential '" + credentialRef + "' is in use by running instance '" + other.id + "'");
            }
        }
    }

    private void validatePersonality(String personality) {
        if (personality != null && !personality.isBlank() && !personalityPort.isKnown(personality)) {
            throw InvalidReferenceException.unknown("personality", personality);
        }
    }

    private void setDesiredState(String id, DesiredState desired) {
        InstanceConfig config = requireConfig(id);
        if (config.getDesiredState() == desired) {
            return;
        }
        configService.update(doc -> doc.findInstance(id).ifPresent(instance -> instance.setDesiredState(desired)));
    }

    private InstanceConfig requireConfig(String id) {
        return configService.findInstance(id).orElseThrow(() -> new InstanceNotFoundException(id));
    }

    private KnowledgeStorePort.KnowledgeHandle openKnowledge(Path isolationPath) {
        try {
            return knowledgeStore.open(isolationPath);
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private CompletableFuture<Void> releaseKnowledge(LiveInstance live) {
        KnowledgeStorePort.KnowledgeHandle handle = live.knowledge;
        live.knowledge = null;
        if (handle == null) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                handle.close();
            } catch (IOException e) {
                log.warn("[Orchestrator] Failed to close knowledge store for {}: {}", live.id, e.getMessage());
            }
        }, executors.io());
    }

    private LifecycleState observedWithoutTask(String id) {
        return faults.containsKey(id) ? LifecycleState.ERROR : LifecycleState.STOPPED;
    }

    private InstanceStatus snapshot(String id, InstanceConfig config) {
        LiveInstance live = registry.get(id);
        InstanceStatus.InstanceStatusBuilder builder = InstanceStatus.builder().id(id);
        if (config != null) {
            builder.displayName(config.getDisplayName())
                    .personality(config.effectivePersonality())
                    .desiredState(config.getDesiredState())
                    .autoStart(config.isAutoStart());
        }
        if (live == null) {
            return builder.state(observedWithoutTask(id))
                    .lastError(faults.get(id))
                    .build();
        }
        Instant now = Instant.now(clock);
        boolean stale = live.heartbeatAt != null
                && Duration.between(live.heartbeatAt, now).compareTo(settings.getHeartbeatStaleAfter()) > 0;
        return builder.state(live.state)
                .taskId(live.taskId)
                .startedAt(live.startedAt)
                .heartbeatAt(live.heartbeatAt)
                .heartbeatStale(stale)
                .isolationPath(live.isolationPath.toString())
                .build();
    }

    private CompletableFuture<InstanceStatus> enqueue(String id,
            Supplier<CompletableFuture<InstanceStatus>> operation) {
        return onLoop(() -> {
            CompletableFuture<?> previous = chains.getOrDefault(id, CompletableFuture.completedFuture(null));
            CompletableFuture<InstanceStatus> result = previous
                    .handle((ignored, error) -> (Void) null)
                    .thenComposeAsync(ignored -> runGuarded(id, operation), loop);
            chains.put(id, result);
            result.whenCompleteAsync((ignored, error) -> {
                if (chains.get(id) == result) {
                    chains.remove(id);
                }
            }, loop);
            return result;
        }).thenCompose(future -> future);
    }

    private void appendToChain(String id, CompletableFuture<Void> work) {
        CompletableFuture<?> previous = chains.getOrDefault(id, CompletableFuture.completedFuture(null));
        CompletableFuture<Void> combined = previous
                .handle((ignored, error) -> (Void) null)
                .thenCombine(work.handle((ignored, error) -> (Void) null), (a, b) -> (Void) null);
        chains.put(id, combined);
        combined.whenCompleteAsync((ignored, error) -> {
            if (chains.get(id) == combined) {
                chains.remove(id);
            }
        }, loop);
    }

    private CompletableFuture<InstanceStatus> runGuarded(String id,
            Supplier<CompletableFuture<InstanceStatus>> operation) {
        MDC.put(MDC_INSTANCE_ID, id);
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            MDC.remove(MDC_INSTANCE_ID);
        }
    }

    private <T> CompletableFuture<T> onLoop(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, loop);
    }

    private static void withInstance(String id, Runnable action) {
        String previous = MDC.get(MDC_INSTANCE_ID);
        MDC.put(MDC_INSTANCE_ID, id);
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(MDC_INSTANCE_ID, previous);
            } else {
                MDC.remove(MDC_INSTANCE_ID);
            }
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
