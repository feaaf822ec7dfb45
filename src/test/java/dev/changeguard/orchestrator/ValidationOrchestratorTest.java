package dev.changeguard.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.changeguard.collector.FactCollector;
import dev.changeguard.config.ValidationProperties;
import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.OverallStatus;
import dev.changeguard.domain.enums.ValidationStatus;
import dev.changeguard.domain.enums.VerdictSource;
import dev.changeguard.domain.valueobject.ChangeContext;
import dev.changeguard.domain.valueobject.ChangeSnapshot;
import dev.changeguard.domain.valueobject.EnvironmentHealth;
import dev.changeguard.domain.valueobject.FactBundle;
import dev.changeguard.domain.valueobject.Verdict;
import dev.changeguard.domain.valueobject.facts.UnavailableComponentFacts;
import dev.changeguard.dto.request.ChangeWebhookPayload;
import dev.changeguard.exception.PayloadValidationException;
import dev.changeguard.exception.PostingException;
import dev.changeguard.exception.ValidationNotFoundException;
import dev.changeguard.exception.ValidationProcessingException;
import dev.changeguard.infrastructure.servicenow.TicketClient;
import dev.changeguard.synthesis.Synthesizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidationOrchestratorTest {

    private static final String RAW = """
            {"change_sys_id": "chg-1", "change_number": "CHG0001", "state": "assess",
             "component_type": "catalog_item", "component_sys_id": "cat-1",
             "short_description": "Update laptop item", "implementation_plan": "deploy"}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FactCollector collector = mock(FactCollector.class);
    private final Synthesizer synthesizer = mock(Synthesizer.class);
    private final TicketClient ticketClient = mock(TicketClient.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private InMemoryValidationStore store;
    private ValidationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryValidationStore();
        orchestrator = new ValidationOrchestrator(store, collector, synthesizer, ticketClient,
                new WorkNoteFormatter(), ValidationProperties.defaults(), objectMapper, meterRegistry);
    }

    private ChangeWebhookPayload payload(String raw) throws Exception {
        return objectMapper.readValue(raw, ChangeWebhookPayload.class);
    }

    private static FactBundle facts() {
        return new FactBundle("catalog_item", "cat-1", List.of(), EnvironmentHealth.skipped(null, null, "n/a"),
                new ChangeContext("CHG0001", null, null, null, null, ChangeContext.LIVE),
                new UnavailableComponentFacts("catalog_item", "cat-1", "x"), Map.of("has_name", false));
    }

    private static Verdict failedVerdict() {
        return new Verdict(OverallStatus.FAILED, Map.of("has_name", false), "Change validation failed.",
                List.of("Resolve configuration gap: has name"), List.of("has name"), null, VerdictSource.RULES);
    }

    private void receiveDefault() throws Exception {
        orchestrator.receive(payload(RAW), RAW, "sig", "alice");
    }

    @Nested
    @DisplayName("receive")
    class Receive {

        @Test
        @DisplayName("stores a new RECEIVED request")
        void storesRequest() throws Exception {
            ValidationOrchestrator.Receipt receipt = orchestrator.receive(payload(RAW), RAW, "sig", "alice");

            assertThat(receipt.duplicate()).isFalse();
            ValidationRequest request = receipt.request();
            assertThat(request.getStatus()).isEqualTo(ValidationStatus.RECEIVED);
            assertThat(request.getComponentId()).isEqualTo("cat-1");
            assertThat(request.getRequestSignature()).isEqualTo("sig");
            assertThat(request.getRawPayload()).isEqualTo(RAW);
        }

        @Test
        @DisplayName("a repeated change id returns the stored request unchanged")
        void idempotent() throws Exception {
            ValidationRequest first = orchestrator.receive(payload(RAW), RAW, "sig", "alice").request();
            ValidationOrchestrator.Receipt second = orchestrator.receive(payload(RAW), RAW, "other", "bob");

            assertThat(second.duplicate()).isTrue();
            assertThat(second.request()).isSameAs(first);
            assertThat(second.request().getRequestSignature()).isEqualTo("sig");
            assertThat(store.creates).isEqualTo(1);
        }

        @Test
        @DisplayName("missing required fields are all reported and nothing is stored")
        void missingFields() throws Exception {
            String raw = "{\"change_number\": \"CHG0002\", \"component_type\": \"\"}";

            assertThatThrownBy(() -> orchestrator.receive(payload(raw), raw, null, null))
                    .isInstanceOfSatisfying(PayloadValidationException.class, e ->
                            assertThat(e.getMissingFields()).containsExactly("change_sys_id", "state", "component_type"));
            assertThat(store.creates).isZero();
        }
    }

    @Nested
    @DisplayName("process")
    class Process {

        @Test
        @DisplayName("completes the request and posts a work note")
        void completes() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any())).thenReturn(facts());
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());

            Verdict verdict = orchestrator.process("chg-1");

            assertThat(verdict.overallStatus()).isEqualTo(OverallStatus.FAILED);
            ValidationRequest stored = store.findByChangeId("chg-1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(ValidationStatus.COMPLETED);
            assertThat(stored.getVerdict()).isEqualTo(verdict);
            assertThat(stored.getProcessingDurationMs()).isNotNull();

            ArgumentCaptor<String> note = ArgumentCaptor.forClass(String.class);
            verify(ticketClient).postNote(eq("chg-1"), note.capture());
            assertThat(note.getValue()).contains("Automated Validation Result: FAILED");
            assertThat(meterRegistry.counter("changeguard.validation.verdicts", "status", "FAILED").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("the snapshot carries the archived documentation from the payload")
        void snapshotFromPayload() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any())).thenReturn(facts());
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());

            orchestrator.process("chg-1");

            ArgumentCaptor<ChangeSnapshot> snapshot = ArgumentCaptor.forClass(ChangeSnapshot.class);
            verify(collector).collect(snapshot.capture(), any());
            assertThat(snapshot.getValue().shortDescription()).isEqualTo("Update laptop item");
            assertThat(snapshot.getValue().archivedDocumentation().implementationPlan()).isEqualTo("deploy");
            assertThat(snapshot.getValue().requestedBy()).isEqualTo("alice");
        }

        @Test
        @DisplayName("a work note failure does not undo completion")
        void postingFailureIsolated() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any())).thenReturn(facts());
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());
            doThrow(new PostingException("503", new RuntimeException("unavailable")))
                    .when(ticketClient).postNote(anyString(), anyString());

            Verdict verdict = orchestrator.process("chg-1");

            assertThat(verdict).isNotNull();
            assertThat(store.findByChangeId("chg-1").orElseThrow().getStatus()).isEqualTo(ValidationStatus.COMPLETED);
            assertThat(meterRegistry.counter("changeguard.worknote.failures").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an unknown change id is a not-found error")
        void unknownChange() {
            assertThatThrownBy(() -> orchestrator.process("nope"))
                    .isInstanceOf(ValidationNotFoundException.class);
        }

        @Test
        @DisplayName("a completed request returns its stored verdict without reprocessing")
        void completedIsNotReprocessed() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any())).thenReturn(facts());
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());
            Verdict first = orchestrator.process("chg-1");

            Verdict again = orchestrator.process("chg-1");

            assertThat(again).isEqualTo(first);
            verify(collector, times(1)).collect(any(), any());
            verify(ticketClient, times(1)).postNote(anyString(), anyString());
        }

        @Test
        @DisplayName("a failure marks the request FAILED and a later attempt retries it")
        void failureThenRetry() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any()))
                    .thenThrow(new IllegalStateException("executor rejected"))
                    .thenReturn(facts());
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());

            assertThatThrownBy(() -> orchestrator.process("chg-1"))
                    .isInstanceOfSatisfying(ValidationProcessingException.class,
                            e -> assertThat(e.getChangeId()).isEqualTo("chg-1"));
            ValidationRequest failed = store.findByChangeId("chg-1").orElseThrow();
            assertThat(failed.getStatus()).isEqualTo(ValidationStatus.FAILED);
            assertThat(failed.getFailureReason()).isEqualTo("IllegalStateException: executor rejected");
            verify(ticketClient, never()).postNote(anyString(), anyString());

            orchestrator.process("chg-1");

            ValidationRequest retried = store.findByChangeId("chg-1").orElseThrow();
            assertThat(retried.getStatus()).isEqualTo(ValidationStatus.COMPLETED);
            assertThat(retried.getRetryCount()).isEqualTo(1);
            assertThat(retried.getFailureReason()).isNull();
        }

        @Test
        @DisplayName("an attempt overtaken by a concurrent completion returns the stored verdict and posts nothing")
        void concurrentCompletionWins() throws Exception {
            receiveDefault();
            Verdict passed = new Verdict(OverallStatus.PASSED, Map.of("has_name", true),
                    "Change validation passed.", List.of(), List.of(), null, VerdictSource.RULES);
            when(collector.collect(any(), any())).thenAnswer(invocation -> {
                store.markCompleted("chg-1", passed, 5);
                return facts();
            });
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());

            Verdict verdict = orchestrator.process("chg-1");

            assertThat(verdict).isEqualTo(passed);
            assertThat(store.findByChangeId("chg-1").orElseThrow().getVerdict()).isEqualTo(passed);
            verify(ticketClient, never()).postNote(anyString(), anyString());
            assertThat(meterRegistry.counter("changeguard.validation.verdicts", "status", "FAILED").count())
                    .isZero();
        }

        @Test
        @DisplayName("an attempt overtaken by a concurrent failure surfaces a processing error")
        void concurrentFailureWins() throws Exception {
            receiveDefault();
            when(collector.collect(any(), any())).thenAnswer(invocation -> {
                store.markFailed("chg-1", "worker lost", 5);
                return facts();
            });
            when(synthesizer.synthesize(any(), any())).thenReturn(failedVerdict());

            assertThatThrownBy(() -> orchestrator.process("chg-1"))
                    .isInstanceOf(ValidationProcessingException.class)
                    .hasMessageContaining("verdict not recorded");
            assertThat(store.findByChangeId("chg-1").orElseThrow().getFailureReason()).isEqualTo("worker lost");
            verify(ticketClient, never()).postNote(anyString(), anyString());
        }
    }
}
