package dev.changeguard.collector;

import dev.changeguard.collector.source.ComponentFactSource;
import dev.changeguard.config.ValidationProperties;
import dev.changeguard.domain.valueobject.ChangeContext;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.Deadline;
import dev.changeguard.domain.valueobject.DocumentationFields;
import dev.changeguard.domain.valueobject.EnvironmentHealth;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.facts.ComponentFacts;
import dev.changeguard.domain.valueobject.facts.UnavailableComponentFacts;
import dev.changeguard.domain.valueobject.facts.UnrecognizedComponentFacts;
import dev.changeguard.exception.CollectionTimeoutException;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.infrastructure.servicenow.TicketRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Gathers environment health, change context and component facts in parallel.
 *
 * <p>Each fetch has its own timeout, capped by the attempt's deadline. A failed or late fetch
 * becomes an entry in {@code collectionErrors} and a placeholder value; it never stops the
 * other fetches. Component checks are always fully populated, and anything that could not be
 * confirmed is {@code false}.
 *
 * <p>Errors are reported in a fixed order (environment, change, component) regardless of
 * which fetch finished first.
 */
@Component
public class FactCollector {

    private static final Logger log = LoggerFactory.getLogger(FactCollector.class);

    static final String CLONE_CHECK = "clone_is_fresh";
    private static final String CHANGE_TABLE = "change_request";
    private static final List<String> CHANGE_FIELDS = List.of("number", "state", "short_description",
            "implementation_plan", "backout_plan", "test_plan", "justification", "risk", "start_date", "end_date");

    private final TicketClient ticketClient;
    private final ComponentFactRegistry registry;
    private final EnvironmentHealthProbe environmentProbe;
    private final ValidationProperties properties;
    private final ExecutorService executor;

    public FactCollector(TicketClient ticketClient, ComponentFactRegistry registry,
                         EnvironmentHealthProbe environmentProbe, ValidationProperties properties,
                         @Qualifier("collectorExecutor") ExecutorService executor) {
        this.ticketClient = ticketClient;
        this.registry = registry;
        this.environmentProbe = environmentProbe;
        this.properties = properties;
        this.executor = executor;
    }

    public FactBundle collect(ChangeSnapshot change, Deadline deadline) {
        String type = change.componentType();
        boolean probeEnvironment = environmentProbe.applies(change);
        Optional<ComponentFactSource<?>> source = registry.find(type);

        CompletableFuture<Outcome<EnvironmentHealth>> environment = probeEnvironment
                ? fetch("environment health", () -> environmentProbe.probe(change), deadline)
                : CompletableFuture.completedFuture(Outcome.of(environmentProbe.skipped()));
        CompletableFuture<Outcome<ChangeContext>> context =
                fetch("change context", () -> loadChangeContext(change), deadline);
        CompletableFuture<Outcome<ComponentOutcome>> component = source
                .filter(s -> change.componentId() != null)
                .map(s -> fetch("component " + type, () -> fetchComponent(s, change.componentId()), deadline))
                .orElseGet(() -> CompletableFuture.completedFuture(Outcome.of(null)));

        awaitAll(deadline, environment, context, component);

        List<String> errors = new ArrayList<>();

        Outcome<EnvironmentHealth> env = settle(environment, "environment health");
        EnvironmentHealth health = env.value() != null ? env.value() : environmentProbe.failed(env.error());
        env.errorTo(errors);

        Outcome<ChangeContext> ctx = settle(context, "change context");
        ChangeContext changeContext = ctx.value() != null ? ctx.value() : archivedContext(change);
        ctx.errorTo(errors);

        Map<String, Boolean> checks = new LinkedHashMap<>();
        ComponentFacts facts;
        if (source.isEmpty()) {
            log.info("No fact source for component type '{}'", type);
            facts = new UnrecognizedComponentFacts(type);
        } else if (change.componentId() == null) {
            errors.add("No component id supplied for " + type);
            facts = new UnavailableComponentFacts(type, null, "No component id supplied");
            source.get().checkNames().forEach(name -> checks.put(name, false));
        } else {
            Outcome<ComponentOutcome> comp = settle(component, "component " + type);
            ComponentOutcome result = comp.value();
            if (result != null && result.facts() != null) {
                facts = result.facts();
                source.get().checkNames().forEach(name ->
                        checks.put(name, Boolean.TRUE.equals(result.checks().get(name))));
            } else {
                String reason = comp.error() != null ? comp.error()
                        : "%s %s not found".formatted(type, change.componentId());
                errors.add(reason);
                facts = new UnavailableComponentFacts(type, change.componentId(), reason);
                source.get().checkNames().forEach(name -> checks.put(name, false));
            }
        }

        if (probeEnvironment) {
            checks.put(CLONE_CHECK, Boolean.TRUE.equals(health.fresh()));
        }

        if (!errors.isEmpty()) {
            log.warn("Fact collection for change {} finished with {} error(s): {}",
                    change.changeNumber(), errors.size(), errors);
        }
        return new FactBundle(type, change.componentId(), errors, health, changeContext, facts, checks);
    }

    private <T> CompletableFuture<Outcome<T>> fetch(String what, Supplier<T> task, Deadline deadline) {
        Duration budget = deadline.cap(properties.fetchTimeout());
        return CompletableFuture.supplyAsync(task, executor)
                .orTimeout(budget.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, ex) -> {
                    if (ex == null) return Outcome.of(value);
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        cause = new CollectionTimeoutException(what, budget);
                    }
                    log.debug("{} fetch failed", what, cause);
                    return Outcome.failed(what, cause);
                });
    }

    private void awaitAll(Deadline deadline, CompletableFuture<?>... futures) {
        try {
            CompletableFuture.allOf(futures).get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Collection deadline reached; keeping completed fetches and abandoning the rest");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while collecting facts");
        } catch (ExecutionException e) {
            // each fetch already maps its own failure into an Outcome
            log.debug("Unexpected collection failure", e);
        }
    }

    private static <T> Outcome<T> settle(CompletableFuture<Outcome<T>> future, String what) {
        if (!future.isDone()) {
            future.cancel(true);
            return Outcome.failed(what, CollectionTimeoutException.atDeadline(what));
        }
        return future.getNow(Outcome.failed(what, new IllegalStateException("fetch did not complete")));
    }

    private ChangeContext loadChangeContext(ChangeSnapshot change) {
        Optional<TicketRecord> record = ticketClient.getRecord(CHANGE_TABLE, change.changeId(), CHANGE_FIELDS);
        if (record.isEmpty()) {
            throw new IllegalStateException("change record %s not found".formatted(change.changeId()));
        }
        TicketRecord r = record.get();
        DocumentationFields live = new DocumentationFields(r.text("implementation_plan"), r.text("backout_plan"),
                r.text("test_plan"), r.text("justification"));
        return new ChangeContext(
                r.text("number") != null ? r.text("number") : change.changeNumber(),
                r.text("state"),
                r.text("short_description") != null ? r.text("short_description") : change.shortDescription(),
                r.text("risk"),
                live.orElse(change.archivedDocumentation()),
                ChangeContext.LIVE);
    }

    private static ChangeContext archivedContext(ChangeSnapshot change) {
        return new ChangeContext(change.changeNumber(), null, change.shortDescription(), null,
                change.archivedDocumentation(), ChangeContext.ARCHIVED);
    }

    private static <F extends ComponentFacts> ComponentOutcome fetchComponent(ComponentFactSource<F> source,
                                                                              String componentId) {
        return source.fetch(componentId)
                .map(facts -> new ComponentOutcome(facts, source.deriveChecks(facts)))
                .orElse(null);
    }

    private record ComponentOutcome(ComponentFacts facts, Map<String, Boolean> checks) {
    }

    /** Value of a fetch, or the message describing why there is none. */
    private record Outcome<T>(T value, String error) {
        static <T> Outcome<T> of(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failed(String what, Throwable cause) {
            String error = cause instanceof CollectionTimeoutException
                    ? cause.getMessage()
                    : "%s fetch failed: %s".formatted(what, cause.getMessage());
            return new Outcome<>(null, error);
        }

        void errorTo(List<String> errors) {
            if (error != null) errors.add(error);
        }
    }
}
