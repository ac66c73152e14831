package org.symforge.model.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class AddressPointIndexTest {

    @Test
    @DisplayName("Nearest lookup returns the closest address at or below the query")
    void findNearestAtOrBefore_returnsFloorEntry() {
        AddressPointIndex index = new AddressPointIndex();
        index.insert(0x1000, 1);
        index.insert(0x2000, 2);

        Optional<AddressPointIndex.PointMatch> match = index.findNearestAtOrBefore(0x1fff);

        assertTrue(match.isPresent());
        assertEquals(0x1000, match.get().address());
        assertThat(match.get().ids().toLongArray()).containsExactly(1L);
        assertThat(index.findNearestAtOrBefore(0x2000).get().ids().toLongArray()).containsExactly(2L);
        assertFalse(index.findNearestAtOrBefore(0xfff).isPresent());
    }

    @Test
    @DisplayName("Several ids can share one address")
    void insert_sharedAddress() {
        AddressPointIndex index = new AddressPointIndex();
        index.insert(0x40, 1);
        index.insert(0x40, 2);

        assertThat(index.findAt(0x40).toLongArray()).containsExactly(1L, 2L);
        assertEquals(1, index.size());

        assertTrue(index.remove(0x40, 1));
        assertThat(index.findAt(0x40).toLongArray()).containsExactly(2L);
        assertTrue(index.remove(0x40, 2));
        assertEquals(0, index.size());
        assertFalse(index.remove(0x40, 2));
    }
}
