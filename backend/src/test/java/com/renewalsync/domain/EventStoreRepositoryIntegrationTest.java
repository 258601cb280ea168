package com.renewalsync.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "renewalsync.ledger.rpc.contract-address=CTESTCONTRACT",
        "renewalsync.ledger.poller.enabled=false"
})
@Testcontainers(disabledWithoutDocker = true)
class EventStoreRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    EventCursorRepository cursorRepository;
    @Autowired
    ContractEventRepository contractEventRepository;
    @Autowired
    RenewalApprovalRepository approvalRepository;
    @Autowired
    ObjectMapper objectMapper;
    @Autowired
    JdbcTemplate jdbc;

    @BeforeEach
    void clean() {
        jdbc.update("TRUNCATE event_cursor, contract_events, renewal_approvals");
    }

    @Test
    void cursor_missingRow_readsAsZero() {
        assertThat(cursorRepository.find()).isEmpty();
        assertThat(cursorRepository.findLastLedger()).isZero();
    }

    @Test
    @DisplayName("cursor only moves forward through advance")
    void advance_isConditional() {
        assertThat(cursorRepository.advance(100L)).isTrue();
        assertThat(cursorRepository.advance(150L)).isTrue();
        assertThat(cursorRepository.advance(120L)).isFalse();
        assertThat(cursorRepository.advance(150L)).isTrue();

        assertThat(cursorRepository.findLastLedger()).isEqualTo(150L);
    }

    @Test
    @DisplayName("cursor only moves backward through rewindTo")
    void rewindTo_onlyLowers() {
        cursorRepository.advance(150L);

        assertThat(cursorRepository.rewindTo(89L)).isTrue();
        assertThat(cursorRepository.rewindTo(89L)).isFalse();
        assertThat(cursorRepository.rewindTo(120L)).isFalse();

        assertThat(cursorRepository.findLastLedger()).isEqualTo(89L);
    }

    @Test
    @DisplayName("replayed audit rows are skipped on (tx_hash, event_type, sub_id)")
    void insertAll_skipsDuplicates() throws Exception {
        ContractEventRecord a = ContractEventRecord.of(7L, ContractEventType.RENEWAL_FAILED, 101L, "tx1",
                objectMapper.readTree("{\"sub_id\":7,\"failure_count\":2}"));
        ContractEventRecord b = ContractEventRecord.of(7L, ContractEventType.RENEWAL_SUCCESS, 103L, "tx2",
                objectMapper.readTree("{\"sub_id\":7}"));

        assertThat(contractEventRepository.insertAll(List.of(a, b))).isEqualTo(2);
        assertThat(contractEventRepository.insertAll(List.of(a, b))).isZero();

        List<ContractEventRecord> rows = contractEventRepository.findBySubId(7L);
        assertThat(rows).extracting(ContractEventRecord::getLedger).containsExactly(101L, 103L);
        assertThat(rows.get(0).getEventData().path("failure_count").asInt()).isEqualTo(2);
        assertThat(rows.get(0).getProcessedAt()).isNotNull();
    }

    @Test
    void findLatestBefore_returnsNearestMatchingRow() throws Exception {
        contractEventRepository.insertAll(List.of(
                ContractEventRecord.of(5L, ContractEventType.RENEWAL_FAILED, 60L, "t60", objectMapper.readTree("{}")),
                ContractEventRecord.of(5L, ContractEventType.DUPLICATE_RENEWAL_REJECTED, 70L, "t70", objectMapper.readTree("{}")),
                ContractEventRecord.of(5L, ContractEventType.STATE_TRANSITION, 95L, "t95", objectMapper.readTree("{}")),
                ContractEventRecord.of(6L, ContractEventType.RENEWAL_SUCCESS, 80L, "t80", objectMapper.readTree("{}"))));

        List<String> statusTypes = List.of("state_transition", "renewal_success", "renewal_failed");

        assertThat(contractEventRepository.findLatestBefore(5L, 95L, statusTypes))
                .get().extracting(ContractEventRecord::getLedger).isEqualTo(60L);
        assertThat(contractEventRepository.findLatestBefore(5L, 60L, statusTypes)).isEmpty();
    }

    @Test
    void findAndDeleteFromLedger_coverTheSameRows() throws Exception {
        contractEventRepository.insertAll(List.of(
                ContractEventRecord.of(1L, ContractEventType.RENEWAL_SUCCESS, 89L, "a", objectMapper.readTree("{}")),
                ContractEventRecord.of(1L, ContractEventType.RENEWAL_SUCCESS, 90L, "b", objectMapper.readTree("{}")),
                ContractEventRecord.of(1L, ContractEventType.RENEWAL_SUCCESS, 99L, "c", objectMapper.readTree("{}"))));

        assertThat(contractEventRepository.findByLedgerGreaterThanEqual(90L))
                .extracting(ContractEventRecord::getLedger).containsExactly(99L, 90L);
        assertThat(contractEventRepository.deleteByLedgerGreaterThanEqual(90L)).isEqualTo(2);
        assertThat(contractEventRepository.findBySubId(1L)).extracting(ContractEventRecord::getLedger).containsExactly(89L);
    }

    @Test
    void approvals_insertIsIdempotent_andRejectionIsReversible() {
        RenewalApproval approval = new RenewalApproval();
        approval.setBlockchainSubId(3L);
        approval.setApprovalId(11L);
        approval.setMaxSpend(5_000_000L);
        approval.setExpiresAt(1_767_225_600L);

        assertThat(approvalRepository.insertIfAbsent(approval)).isEqualTo(1);
        assertThat(approvalRepository.insertIfAbsent(approval)).isZero();

        approvalRepository.markRejected(3L, 11L, 2);
        assertThat(approvalRepository.find(3L, 11L)).get()
                .satisfies(a -> {
                    assertThat(a.isRejected()).isTrue();
                    assertThat(a.getRejectionReason()).isEqualTo(2);
                });

        approvalRepository.clearRejection(3L, 11L);
        assertThat(approvalRepository.find(3L, 11L)).get()
                .satisfies(a -> {
                    assertThat(a.isRejected()).isFalse();
                    assertThat(a.getRejectionReason()).isNull();
                });

        assertThat(approvalRepository.delete(3L, 11L)).isEqualTo(1);
        assertThat(approvalRepository.find(3L, 11L)).isEmpty();
    }
}
