package io.agentloom.core.policy.security;

import static io.agentloom.core.testing.TestPlans.agentContext;
import static io.agentloom.core.testing.TestPlans.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentloom.core.AgentloomConfig;
import io.agentloom.core.policy.ApprovalDecision;
import io.agentloom.core.policy.ApprovalHandler;
import io.agentloom.core.policy.PolicyHook;
import io.agentloom.core.policy.PolicyPipeline;
import io.agentloom.core.runtime.AgentContext;
import io.agentloom.core.testing.StubCapability;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AuditLogHookTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final AgentloomConfig config =
            AgentloomConfig.builder().capabilityRetryBackoff(Duration.ZERO).build();

    private final AuditLogHook audit = new AuditLogHook(100, Clock.fixed(NOW, ZoneOffset.UTC));

    private final PermissionPolicyHook permissions = PermissionPolicyHook.builder()
            .deny("delete")
            .ask("pay")
            .build();

    private final StubCapability search = StubCapability.returning("search", "found");
    private final StubCapability delete = StubCapability.returning("delete", "gone");
    private final StubCapability pay = StubCapability.returning("pay", "paid");
    private final StubCapability broken = StubCapability.failing("broken", new IOException("disk full"));

    private void run(ApprovalHandler handler, String... names) {
        PolicyPipeline pipeline = new PolicyPipeline(List.<PolicyHook>of(permissions, audit), handler, config);
        AgentContext context = agentContext(search, delete, pay, broken);
        for (int i = 0; i < names.length; i++) {
            pipeline.execute(call("c" + i, names[i]), context);
        }
    }

    @Nested
    class Recording {

        @Test
        void shouldClassifyEveryAttempt() {
            run(null, "search", "delete", "broken", "pay");

            assertThat(audit.query(AuditFilter.any()))
                    .extracting(AuditEntry::capability, AuditEntry::outcome)
                    .containsExactly(
                            tuple("pay", AuditOutcome.ESCALATED),
                            tuple("broken", AuditOutcome.FAILED),
                            tuple("delete", AuditOutcome.BLOCKED),
                            tuple("search", AuditOutcome.SUCCEEDED));
        }

        @Test
        void shouldCarryTaskAgentAndErrorDetails() {
            run(null, "broken");

            AuditEntry entry = audit.query(AuditFilter.any()).get(0);
            assertThat(entry.taskId()).isEqualTo("task-1");
            assertThat(entry.agentId()).isEqualTo("task-1-00");
            assertThat(entry.agentName()).isEqualTo("Browser");
            assertThat(entry.callId()).isEqualTo("c0");
            assertThat(entry.error()).isEqualTo("disk full");
            assertThat(entry.loggedAt()).isEqualTo(NOW);
        }

        @Test
        void shouldRecordApprovalDecisions() {
            run(null, "pay");
            run((request, context) -> ApprovalDecision.approve("alice"), "pay");

            List<AuditEntry> entries = audit.query(AuditFilter.any().forCapability("pay"));

            assertThat(entries).extracting(AuditEntry::approval).containsExactly("approved", "unavailable");
            assertThat(entries.get(0).outcome()).isEqualTo(AuditOutcome.SUCCEEDED);
            assertThat(audit.statistics().approvalRate()).isEqualTo(50.0);
        }

        @Test
        void shouldKeepOnlyNewestEntries() {
            AuditLogHook small = new AuditLogHook(2, Clock.fixed(NOW, ZoneOffset.UTC));
            PolicyPipeline pipeline = new PolicyPipeline(List.of(small), null, config);
            AgentContext context = agentContext(search);

            for (int i = 0; i < 3; i++) {
                pipeline.execute(call("c" + i, "search"), context);
            }

            assertThat(small.size()).isEqualTo(2);
            assertThat(small.query(AuditFilter.any())).extracting(AuditEntry::callId).containsExactly("c2", "c1");
        }

        @Test
        void shouldRejectNonPositiveCapacity() {
            assertThatThrownBy(() -> new AuditLogHook(0, Clock.systemUTC()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Query {

        @Test
        void shouldFilterByOutcomeAndLimit() {
            run(null, "search", "delete", "search", "search");

            assertThat(audit.query(AuditFilter.any().withOutcome(AuditOutcome.SUCCEEDED).limit(2)))
                    .extracting(AuditEntry::callId)
                    .containsExactly("c3", "c2");
            assertThat(audit.query(AuditFilter.any().withOutcome(AuditOutcome.BLOCKED)))
                    .extracting(AuditEntry::callId)
                    .containsExactly("c1");
        }

        @Test
        void shouldFilterByTaskAgentAndTime() {
            run(null, "search");

            assertThat(audit.query(AuditFilter.any().forTask("task-1").forAgent("Browser"))).hasSize(1);
            assertThat(audit.query(AuditFilter.any().forTask("task-2"))).isEmpty();
            assertThat(audit.query(AuditFilter.any().between(NOW, NOW))).hasSize(1);
            assertThat(audit.query(AuditFilter.any().between(NOW.plusSeconds(1), null))).isEmpty();
        }

        @Test
        void shouldRejectNonPositiveLimit() {
            assertThatThrownBy(() -> AuditFilter.any().limit(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Reporting {

        @Test
        void shouldCountOutcomes() {
            run(null, "search", "search", "delete", "broken", "pay");

            AuditLogHook.Statistics statistics = audit.statistics();

            assertThat(statistics).isEqualTo(new AuditLogHook.Statistics(5, 2, 1, 0, 1, 1, 0.0));
        }

        @Test
        void shouldExportJsonOldestFirst() throws IOException {
            run(null, "search", "delete");

            JsonNode exported = new ObjectMapper().readTree(audit.exportJson());

            assertThat(exported.isArray()).isTrue();
            assertThat(exported.get(0).path("capability").asText()).isEqualTo("search");
            assertThat(exported.get(1).path("outcome").asText()).isEqualTo("BLOCKED");
            assertThat(exported.get(1).path("loggedAt").asText()).isEqualTo("2026-03-01T12:00:00Z");
            assertThat(exported.get(1).path("stages").get(0).path("stage").asText()).isEqualTo("PRE_INVOCATION");
        }

        @Test
        void shouldExportQuotedCsv() {
            run(null, "delete");

            String[] lines = audit.exportCsv().split("\n");

            assertThat(lines).hasSize(2);
            assertThat(lines[0]).isEqualTo(
                    "\"id\",\"taskId\",\"agent\",\"capability\",\"outcome\",\"approval\",\"durationMillis\",\"loggedAt\"");
            assertThat(lines[1]).contains("\"task-1\",\"Browser\",\"delete\",\"BLOCKED\",\"\",");
            assertThat(lines[1]).endsWith("\"2026-03-01T12:00:00Z\"");
        }

        @Test
        void shouldClearEntries() {
            run(null, "search");

            audit.clear();

            assertThat(audit.size()).isZero();
            assertThat(audit.statistics().total()).isZero();
        }
    }
}
