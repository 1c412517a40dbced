package com.tazrim.ledger.counterparty;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tazrim.ledger.entity.CounterpartyEntity;
import com.tazrim.ledger.ingest.ParsedActivity;
import com.tazrim.ledger.repository.JpaCounterpartyRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionOperations;

class CounterpartyResolverTest {

    @Mock
    private JpaCounterpartyRepository counterpartyRepository;

    private CounterpartyResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        resolver = new CounterpartyResolver(counterpartyRepository, TransactionOperations.withoutTransaction());
        when(counterpartyRepository.saveAndFlush(any(CounterpartyEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void createsOneCounterpartyPerKeyUsingFirstRawName() {
        when(counterpartyRepository.findByNormalizedKeyIn(anyCollection())).thenReturn(List.of());

        CounterpartyResolver.Resolution resolution = resolver.resolve(List.of(
                row("Super-Pharm"),
                row("SUPER PHARM!"),
                row("Cafe Nero")
        ));

        ArgumentCaptor<CounterpartyEntity> saved = ArgumentCaptor.forClass(CounterpartyEntity.class);
        verify(counterpartyRepository, times(2)).saveAndFlush(saved.capture());
        assertThat(saved.getAllValues()).extracting(CounterpartyEntity::getDisplayName).containsExactly("Super-Pharm", "Cafe Nero");
        assertThat(resolution.idsByKey()).containsOnlyKeys("super pharm", "cafe nero");
        assertThat(resolution.newEntities()).isEqualTo(2);
    }

    @Test
    void reusesExistingCounterparties() {
        UUID existingId = UUID.randomUUID();
        when(counterpartyRepository.findByNormalizedKeyIn(anyCollection()))
                .thenReturn(List.of(new CounterpartyEntity(existingId, "cafe nero", "CAFE NERO", Instant.now())));

        CounterpartyResolver.Resolution resolution = resolver.resolve(List.of(row("Cafe-Nero")));

        verify(counterpartyRepository, never()).saveAndFlush(any());
        assertThat(resolution.idFor("cafe nero")).isEqualTo(existingId);
        assertThat(resolution.createdKeys()).isEmpty();
    }

    @Test
    void rereadsKeyWhenConcurrentInsertWins() {
        UUID winnerId = UUID.randomUUID();
        when(counterpartyRepository.findByNormalizedKeyIn(anyCollection())).thenReturn(List.of());
        when(counterpartyRepository.saveAndFlush(any(CounterpartyEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));
        when(counterpartyRepository.findByNormalizedKey("cafe nero"))
                .thenReturn(Optional.of(new CounterpartyEntity(winnerId, "cafe nero", "Cafe Nero", Instant.now())));

        CounterpartyResolver.Resolution resolution = resolver.resolve(List.of(row("Cafe Nero")));

        assertThat(resolution.idFor("cafe nero")).isEqualTo(winnerId);
        assertThat(resolution.newEntities()).isZero();
    }

    private static ParsedActivity row(String counterparty) {
        return new ParsedActivity(2, LocalDate.of(2024, 1, 1), null, counterparty, null,
                null, null, new BigDecimal("10.00"), null, null, null, "ILS", null,
                counterparty, CounterpartyKeys.canonicalize(counterparty));
    }
}
