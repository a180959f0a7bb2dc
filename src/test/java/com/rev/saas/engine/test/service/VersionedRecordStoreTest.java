package com.rev.saas.engine.test.service;

import com.rev.saas.engine.common.exception.ConflictException;
import com.rev.saas.engine.common.exception.EntityNotFoundException;
import com.rev.saas.engine.config.DecisionEngineConfig;
import com.rev.saas.engine.model.ContextField;
import com.rev.saas.engine.model.DecisionContext;
import com.rev.saas.engine.model.documents.Decision;
import com.rev.saas.engine.model.versioning.VersionEntry;
import com.rev.saas.engine.model.versioning.VersionedField;
import com.rev.saas.engine.repo.documents.DecisionRepo;
import com.rev.saas.engine.service.decision.VersionedRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VersionedRecordStoreTest {

    @Mock
    DecisionRepo decisionRepo;

    DecisionEngineConfig config;
    VersionedRecordStore store;

    DecisionContext context;

    @BeforeEach
    void setUp() {
        config = new DecisionEngineConfig();
        config.setVersionAppendMaxAttempts(3);
        store = new VersionedRecordStore(decisionRepo, config);
        context = DecisionContext.builder()
                .companyStage(ContextField.builder().value("growth").build())
                .build();
    }

    private static Decision atContextVersion(int v) {
        return Decision.builder().id("d1").userId("u1").contextVersion(v).build();
    }

    @Test
    void appendsNextVersionInOneWrite() {
        Decision updated = atContextVersion(2);
        when(decisionRepo.findActive("d1", "u1")).thenReturn(Optional.of(atContextVersion(1)));
        when(decisionRepo.appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(1), any(), anyMap(), any()))
                .thenReturn(Optional.of(updated));

        Decision result = store.append("d1", "u1", VersionedField.CONTEXT, context, "u1", "stage changed");

        assertThat(result).isSameAs(updated);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<VersionEntry<DecisionContext>> entry = ArgumentCaptor.forClass(VersionEntry.class);
        verify(decisionRepo).appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(1), entry.capture(),
                eq(Map.of()), any());
        assertThat(entry.getValue().getVersion()).isEqualTo(2);
        assertThat(entry.getValue().getValue()).isEqualTo(context);
        assertThat(entry.getValue().getCreatedBy()).isEqualTo("u1");
        assertThat(entry.getValue().getReason()).isEqualTo("stage changed");
    }

    @Test
    void lostRaceRetriesWithFreshCounter() {
        Decision updated = atContextVersion(3);
        when(decisionRepo.findActive("d1", "u1"))
                .thenReturn(Optional.of(atContextVersion(1)))
                .thenReturn(Optional.of(atContextVersion(2)));
        when(decisionRepo.appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(1), any(), anyMap(), any()))
                .thenReturn(Optional.empty());
        when(decisionRepo.appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(2), any(), anyMap(), any()))
                .thenReturn(Optional.of(updated));

        Decision result = store.append("d1", "u1", VersionedField.CONTEXT, context, "u1", null);

        assertThat(result.getContextVersion()).isEqualTo(3);
        verify(decisionRepo, times(2)).findActive("d1", "u1");
    }

    @Test
    void givesUpWithConflictAfterMaxAttempts() {
        when(decisionRepo.findActive("d1", "u1")).thenReturn(Optional.of(atContextVersion(4)));
        when(decisionRepo.appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), anyInt(), any(), anyMap(), any()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.append("d1", "u1", VersionedField.CONTEXT, context, "u1", null))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("3 attempts");
        verify(decisionRepo, times(3))
                .appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(4), any(), anyMap(), any());
    }

    @Test
    void vanishedDecisionIsNotFound() {
        when(decisionRepo.findActive("d1", "u1"))
                .thenReturn(Optional.of(atContextVersion(1)))
                .thenReturn(Optional.empty());
        when(decisionRepo.appendVersion(eq("d1"), eq("u1"), eq(VersionedField.CONTEXT), eq(1), any(), anyMap(), any()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.append("d1", "u1", VersionedField.CONTEXT, context, "u1", null))
                .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void unknownDecisionNeverWrites() {
        when(decisionRepo.findActive("nope", "u1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.append("nope", "u1", VersionedField.CONTEXT, context, "u1", null))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("nope");
    }
}
