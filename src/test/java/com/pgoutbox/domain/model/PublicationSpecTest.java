package com.pgoutbox.domain.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PublicationSpecTest {

    private final TableDescriptor table = TableDescriptor.defaults();

    @Test
    void rowFilterIsEmptyWhenFilteringIsOff() {
        PublicationSpec spec = new PublicationSpec("outbox_pub", table, Set.of("a"), false);

        assertTrue(spec.rowFilter().isEmpty());
    }

    @Test
    void rowFilterIsEmptyWithoutDiscriminators() {
        PublicationSpec spec = new PublicationSpec("outbox_pub", table, Set.of(), true);

        assertTrue(spec.rowFilter().isEmpty());
    }

    @Test
    void rowFilterListsSortedEscapedDiscriminators() {
        PublicationSpec spec = new PublicationSpec("outbox_pub", table, Set.of("user.deleted.v1", "it's", "user.created.v1"), true);

        assertEquals("(\"message_type\" IN ('it''s', 'user.created.v1', 'user.deleted.v1'))", spec.rowFilter().orElseThrow());
    }

    @Test
    void rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new PublicationSpec(" ", table, Set.of(), false));
    }

    @Test
    void discriminatorsAreCopied() {
        Set<String> discriminators = new HashSet<>(Set.of("a"));
        PublicationSpec spec = new PublicationSpec("outbox_pub", table, discriminators, false);

        discriminators.add("b");

        assertEquals(Set.of("a"), spec.discriminators());
        assertEquals("\"outbox_pub\"", spec.quotedName());
    }
}
