package com.bank.mulegraph.engine.projection;

import com.bank.mulegraph.exception.GraphLoadException;
import com.bank.mulegraph.model.Account;
import com.bank.mulegraph.model.ProjectedEdge;
import com.bank.mulegraph.model.TransactionEdge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.bank.mulegraph.testutil.TestDataFactory.createAccount;
import static com.bank.mulegraph.testutil.TestDataFactory.createEdge;
import static com.bank.mulegraph.testutil.TestDataFactory.createMerchantPayment;
import static com.bank.mulegraph.testutil.TestDataFactory.createMule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProjectionBuilderTest {

    private ProjectionBuilder builder;
    private List<Account> accounts;

    @BeforeEach
    void setUp() {
        builder = new ProjectionBuilder();
        accounts = List.of(createAccount(3), createAccount(1), createAccount(2), createMule(4));
    }

    @Test
    void build_sumsAmountsInBothDirections() {
        ProjectedGraph graph = builder.build(accounts, List.of(
                createEdge(1, 2, 10.0),
                createEdge(2, 1, 5.0),
                createEdge(1, 2, 2.5)));

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.weight(1, 2)).isCloseTo(17.5, within(1e-9));
        assertThat(graph.weight(2, 1)).isEqualTo(graph.weight(1, 2));
        assertThat(graph.totalWeight()).isCloseTo(17.5, within(1e-9));
    }

    @Test
    void build_ordersNodesByAccountId() {
        ProjectedGraph graph = builder.build(accounts, List.of());

        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.accountId(0)).isEqualTo(1L);
        assertThat(graph.accountId(3)).isEqualTo(4L);
        assertThat(graph.isConfirmedMule(3)).isTrue();
        assertThat(graph.indexOf(99L)).isEqualTo(-1);
    }

    @Test
    void build_skipsSelfTransfersAndNonAccountParticipants() {
        ProjectedGraph graph = builder.build(accounts, List.of(
                createEdge(1, 1, 100.0),
                createMerchantPayment(1, 500, 40.0),
                createEdge(3, 4, 7.0)));

        assertThat(graph.edges()).containsExactly(new ProjectedEdge(3, 4, 7.0));
        assertThat(graph.degree(graph.indexOf(1))).isZero();
    }

    @Test
    void build_dropsPairsWhoseAmountsSumToZero() {
        ProjectedGraph graph = builder.build(accounts, List.of(createEdge(1, 2, 0.0), createEdge(2, 1, 0.0)));

        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.weight(1, 2)).isZero();
    }

    @Test
    void build_isIndependentOfEdgeOrder() {
        List<TransactionEdge> edges = new ArrayList<>(List.of(
                createEdge(1, 2, 0.1), createEdge(2, 3, 0.2), createEdge(1, 2, 0.3),
                createEdge(3, 4, 1.7), createEdge(2, 1, 0.7), createEdge(4, 1, 3.3)));

        List<ProjectedEdge> forward = builder.build(accounts, edges).edges();
        Collections.reverse(edges);
        List<ProjectedEdge> reversed = builder.build(accounts, edges).edges();

        assertThat(reversed).isEqualTo(forward);
        assertThat(forward).extracting(ProjectedEdge::lowAccountId)
                .containsExactly(1L, 1L, 2L, 3L);
    }

    @Test
    void build_unknownAccountReference_throwsGraphLoadException() {
        assertThatThrownBy(() -> builder.build(accounts, List.of(createEdge(1, 42, 5.0))))
                .isInstanceOf(GraphLoadException.class)
                .hasMessageContaining("unknown account id 42");
    }

    @Test
    void build_merchantPaymentFromUnknownAccount_throwsGraphLoadException() {
        List<TransactionEdge> edges = List.of(createEdge(1, 2, 5.0), createMerchantPayment(404, 999, 5.0));

        assertThatThrownBy(() -> builder.build(accounts, edges))
                .isInstanceOf(GraphLoadException.class)
                .hasMessageContaining("unknown account id 404");
    }

    @Test
    void build_negativeAmount_throwsGraphLoadException() {
        assertThatThrownBy(() -> builder.build(accounts, List.of(createEdge(1, 2, -1.0))))
                .isInstanceOf(GraphLoadException.class)
                .hasMessageContaining("invalid amount");
    }

    @Test
    void build_duplicateAccountNumber_throwsGraphLoadException() {
        List<Account> duplicated = List.of(createAccount(1, "ACC_X"), createAccount(2, "ACC_X"));

        assertThatThrownBy(() -> builder.build(duplicated, List.of()))
                .isInstanceOf(GraphLoadException.class)
                .hasMessageContaining("ACC_X");
    }
}
