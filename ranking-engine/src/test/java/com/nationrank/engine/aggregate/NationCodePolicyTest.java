package com.nationrank.engine.aggregate;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NationCodePolicyTest {

    @Test
    void twoLetterCodesResolveNormalized() {
        NationCodePolicy policy = NationCodePolicy.permissive();

        assertEquals(Optional.of("DE"), policy.resolve(" de "));
        assertEquals(Optional.of("US"), policy.resolve("US"));
    }

    @Test
    void placeholdersAndMalformedCodesDoNotResolve() {
        NationCodePolicy policy = NationCodePolicy.permissive();

        assertFalse(policy.isResolvable(null));
        assertFalse(policy.isResolvable(""));
        assertFalse(policy.isResolvable("??"));
        assertFalse(policy.isResolvable("USA"));
        assertFalse(policy.isResolvable("1A"));
    }

    @Test
    void factionCodesBypassTheFormatCheck() {
        NationCodePolicy policy = new NationCodePolicy(Set.of(), Set.of("EU", "ARM"));

        assertEquals(Optional.of("ARM"), policy.resolve("arm"));
    }

    @Test
    void knownCodeListRestrictsTwoLetterCodes() {
        NationCodePolicy policy = new NationCodePolicy(Set.of("DE", "FR"), Set.of());

        assertTrue(policy.isResolvable("fr"));
        assertFalse(policy.isResolvable("XX"));
    }
}
