package com.example.chunker.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnMapTest {

    @Test
    void keepsFirstIndexPerRole() {
        ColumnMap map = ColumnMap.builder(4)
                .map(ColumnRole.DATE, 0)
                .map(ColumnRole.DATE, 2)
                .map(ColumnRole.UNKNOWN, 3)
                .build();

        assertThat(map.indexOf(ColumnRole.DATE)).hasValue(0);
        assertThat(map.contains(ColumnRole.UNKNOWN)).isFalse();
        assertThat(map.indexOrDefault(ColumnRole.BALANCE, 7)).isEqualTo(7);
    }

    @Test
    void rejectsIndicesOutsideTheHeader() {
        assertThatThrownBy(() -> ColumnMap.builder(2).map(ColumnRole.DEBIT, 2))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
