package org.pivotspec.predicate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("PatchSignatureGuard")
class PatchSignatureGuardTest {

    @Test
    @DisplayName("Identical patches are emitted once")
    void suppressesRepeats() {
        PatchSignatureGuard guard = new PatchSignatureGuard();
        WherePatch patch = WherePatch.builder().delete("f__gte").set("f", List.of("a")).build();

        assertThat(guard.shouldEmit("f", patch)).isTrue();
        assertThat(guard.shouldEmit("f", WherePatch.builder().delete("f__gte").set("f", List.of("a")).build())).isFalse();
        assertThat(guard.shouldEmit("f", WherePatch.builder().set("f", List.of("b")).build())).isTrue();
    }

    @Test
    @DisplayName("Fields are tracked independently and can be reset")
    void perFieldAndReset() {
        PatchSignatureGuard guard = new PatchSignatureGuard();
        WherePatch patch = WherePatch.builder().set("x", 1).build();

        assertThat(guard.shouldEmit("a", patch)).isTrue();
        assertThat(guard.shouldEmit("b", patch)).isTrue();

        guard.reset("a");

        assertThat(guard.shouldEmit("a", patch)).isTrue();
        assertThat(guard.shouldEmit("b", patch)).isFalse();
    }

    @Test
    @DisplayName("Checking a patch does not record it")
    void checkWithoutRecording() {
        PatchSignatureGuard guard = new PatchSignatureGuard();
        WherePatch patch = WherePatch.builder().set("f", List.of("a")).build();

        assertThat(guard.isUnchanged("f", patch)).isFalse();
        assertThat(guard.isUnchanged("f", patch)).isFalse();

        guard.record("f", patch);

        assertThat(guard.isUnchanged("f", patch)).isTrue();
    }

    @Test
    @DisplayName("Signatures distinguish deletions from assignments")
    void signatureIncludesDeletions() {
        WherePatch deleting = WherePatch.builder().delete("f").build();
        WherePatch empty = WherePatch.builder().build();

        assertThat(deleting.signature()).isNotEqualTo(empty.signature());
        assertThat(deleting.signature()).contains("null");
    }
}
