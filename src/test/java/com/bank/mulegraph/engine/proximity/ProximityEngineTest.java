package com.bank.mulegraph.engine.proximity;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.engine.CancellationToken;
import com.bank.mulegraph.engine.projection.ProjectedGraph;
import com.bank.mulegraph.engine.projection.ProjectionBuilder;
import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.AccountLabel;
import com.bank.mulegraph.model.ProjectedEdge;
import com.bank.mulegraph.model.ProximityResult;
import com.bank.mulegraph.model.TransactionEdge;
import com.bank.mulegraph.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.bank.mulegraph.testutil.TestDataFactory.createAccount;
import static com.bank.mulegraph.testutil.TestDataFactory.createEdge;
import static com.bank.mulegraph.testutil.TestDataFactory.createMule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProximityEngineTest {

    private ProximityEngine engine;
    private ProjectionBuilder projectionBuilder;

    @BeforeEach
    void setUp() {
        engine = new ProximityEngine(TestDataFactory.createConfig());
        projectionBuilder = new ProjectionBuilder();
    }

    @Test
    void computeProximity_chainToMule() {
        List<Account> accounts = List.of(
                createAccount(1, "A"), createAccount(2, "B"), createAccount(3, "C"), createMule(4));
        ProjectedGraph graph = projectionBuilder.build(accounts, List.of(createEdge(1, 2, 10.0), createEdge(2, 4, 5.0)));

        Map<Long, ProximityResult> result = engine.computeProximity(graph, Set.of(4L), 10);

        assertThat(result.get(1L).distanceToMule()).isEqualTo(2);
        assertThat(result.get(2L).distanceToMule()).isEqualTo(1);
        assertThat(result.get(4L).distanceToMule()).isEqualTo(0);
        assertThat(result.get(4L).nearestMuleId()).isEqualTo(4L);
        assertThat(result.get(3L).distanceToMule()).isNull();
        assertThat(result.get(3L).nearestMuleId()).isNull();
        assertThat(result.get(1L).nearestMuleAccountNumber()).isEqualTo("MULE_4");
    }

    @Test
    void computeProximity_respectsMaxDepth() {
        List<Account> accounts = List.of(
                createAccount(1, "A"), createAccount(2, "B"), createAccount(3, "C"), createMule(4));
        ProjectedGraph graph = projectionBuilder.build(accounts,
                List.of(createEdge(1, 2, 1.0), createEdge(2, 3, 1.0), createEdge(3, 4, 1.0)));

        Map<Long, ProximityResult> result = engine.computeProximity(graph, Set.of(4L), 2);

        assertThat(result.get(2L).distanceToMule()).isEqualTo(2);
        assertThat(result.get(1L).isReached()).isFalse();
        assertThat(engine.computeProximity(graph, Set.of(4L), 0).get(3L).isReached()).isFalse();
    }

    @Test
    void computeProximity_keepsAllTiedMulesAndPicksLowestAccountNumber() {
        List<Account> accounts = List.of(
                createAccount(1, "A"),
                createAccount(2, "HOP_1"),
                createAccount(3, "HOP_2"),
                createAccount(10, "MULE_Z", AccountLabel.CONFIRMED_MULE),
                createAccount(11, "MULE_B", AccountLabel.CONFIRMED_MULE),
                createAccount(12, "MULE_FAR", AccountLabel.CONFIRMED_MULE));
        List<TransactionEdge> edges = List.of(
                createEdge(1, 2, 1.0), createEdge(1, 3, 1.0),
                createEdge(2, 10, 1.0), createEdge(3, 11, 1.0),
                createEdge(10, 12, 1.0));
        ProjectedGraph graph = projectionBuilder.build(accounts, edges);

        ProximityResult a = engine.computeProximity(graph, Set.of(10L, 11L, 12L), 10, true, CancellationToken.none())
                .get(1L);

        assertThat(a.distanceToMule()).isEqualTo(2);
        assertThat(a.tiedMuleAccountNumbers()).containsExactly("MULE_B", "MULE_Z");
        assertThat(a.nearestMuleId()).isEqualTo(11L);
        assertThat(a.path()).containsExactly("A", "HOP_2", "MULE_B");
    }

    @Test
    void computeProximity_matchesBruteForceOnRandomGraphs() {
        for (long seed = 1; seed <= 5; seed++) {
            Random random = new Random(seed);
            List<Account> accounts = new ArrayList<>();
            Set<Long> mules = new TreeSet<>();
            for (long id = 1; id <= 25; id++) {
                if (random.nextInt(6) == 0) {
                    accounts.add(createMule(id));
                    mules.add(id);
                } else {
                    accounts.add(createAccount(id));
                }
            }
            List<TransactionEdge> edges = new ArrayList<>();
            for (int e = 0; e < 30; e++) {
                edges.add(createEdge(1 + random.nextInt(25), 1 + random.nextInt(25), 1.0));
            }
            ProjectedGraph graph = projectionBuilder.build(accounts, edges);
            GraphFeatureConfig parallel = TestDataFactory.createConfig();
            parallel.getBatch().setParallelThreshold(1);

            Map<Long, ProximityResult> result = new ProximityEngine(parallel)
                    .computeProximity(graph, mules, 10, true, CancellationToken.none());
            Map<Long, List<Long>> adjacency = adjacency(graph);

            for (Account account : accounts) {
                long id = account.getAccountId();
                ProximityResult actual = result.get(id);
                Map<Long, Integer> dist = bfs(adjacency, id);
                Integer expected = mules.stream()
                        .filter(dist::containsKey)
                        .map(dist::get)
                        .filter(d -> d <= 10)
                        .min(Integer::compare)
                        .orElse(null);

                assertThat(actual.distanceToMule()).as("distance of %d (seed %d)", id, seed).isEqualTo(expected);
                if (expected != null) {
                    List<String> tied = mules.stream()
                            .filter(m -> expected.equals(dist.get(m)))
                            .map(m -> "MULE_" + m)
                            .sorted()
                            .toList();
                    assertThat(actual.tiedMuleAccountNumbers()).isEqualTo(tied);
                    assertThat(actual.nearestMuleAccountNumber()).isEqualTo(tied.get(0));
                    assertValidPath(graph, actual);

                    ProximityResult single = engine.computeForAccount(graph, id, 10);
                    assertThat(single.distanceToMule()).isEqualTo(expected);
                    assertThat(single.tiedMuleAccountNumbers()).isEqualTo(tied);
                }
            }
        }
    }

    @Test
    void computeForAccount_returnsPathToNearestMule() {
        List<Account> accounts = List.of(
                createAccount(1, "A"), createAccount(2, "B"), createAccount(3, "C"), createMule(4));
        ProjectedGraph graph = projectionBuilder.build(accounts, List.of(createEdge(1, 2, 10.0), createEdge(2, 4, 5.0)));

        ProximityResult a = engine.computeForAccount(graph, 1L, 10);
        ProximityResult mule = engine.computeForAccount(graph, 4L, 10);

        assertThat(a.distanceToMule()).isEqualTo(2);
        assertThat(a.path()).containsExactly("A", "B", "MULE_4");
        assertThat(mule.distanceToMule()).isZero();
        assertThat(engine.computeForAccount(graph, 3L, 10).isReached()).isFalse();
        assertThat(engine.computeForAccount(graph, 99L, 10).isReached()).isFalse();
    }

    @Test
    void computeProximity_noMules_everyAccountUnreached() {
        ProjectedGraph graph = projectionBuilder.build(List.of(createAccount(1), createAccount(2)),
                List.of(createEdge(1, 2, 1.0)));

        assertThat(engine.computeProximity(graph, Set.of(), 10).values())
                .allSatisfy(r -> assertThat(r.isReached()).isFalse());
    }

    @Test
    void computeProximity_negativeDepth_rejected() {
        ProjectedGraph graph = projectionBuilder.build(List.of(createMule(1)), List.of());

        assertThatThrownBy(() -> engine.computeProximity(graph, Set.of(1L), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void assertValidPath(ProjectedGraph graph, ProximityResult result) {
        List<String> path = result.path();
        assertThat(path).hasSize(result.distanceToMule() + 1);
        assertThat(path.get(path.size() - 1)).isEqualTo(result.nearestMuleAccountNumber());
        for (int i = 0; i + 1 < path.size(); i++) {
            long from = graph.accountId(indexOfNumber(graph, path.get(i)));
            long to = graph.accountId(indexOfNumber(graph, path.get(i + 1)));
            assertThat(graph.weight(from, to)).as("hop %s -> %s", path.get(i), path.get(i + 1)).isPositive();
        }
    }

    private int indexOfNumber(ProjectedGraph graph, String accountNumber) {
        for (int v = 0; v < graph.nodeCount(); v++) {
            if (graph.accountNumber(v).equals(accountNumber)) return v;
        }
        throw new IllegalArgumentException(accountNumber);
    }

    private Map<Long, List<Long>> adjacency(ProjectedGraph graph) {
        Map<Long, List<Long>> adjacency = new TreeMap<>();
        for (int v = 0; v < graph.nodeCount(); v++) {
            adjacency.put(graph.accountId(v), new ArrayList<>());
        }
        for (ProjectedEdge edge : graph.edges()) {
            adjacency.get(edge.lowAccountId()).add(edge.highAccountId());
            adjacency.get(edge.highAccountId()).add(edge.lowAccountId());
        }
        return adjacency;
    }

    private Map<Long, Integer> bfs(Map<Long, List<Long>> adjacency, long source) {
        Map<Long, Integer> dist = new HashMap<>();
        Deque<Long> queue = new ArrayDeque<>();
        dist.put(source, 0);
        queue.add(source);
        while (!queue.isEmpty()) {
            long u = queue.poll();
            for (long v : adjacency.get(u)) {
                if (!dist.containsKey(v)) {
                    dist.put(v, dist.get(u) + 1);
                    queue.add(v);
                }
            }
        }
        return dist;
    }
}
