package com.crossfire.materializer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnNamesTest {

    @Test
    void stripsMeasuresPrefix() {
        assertThat(ColumnNames.extract("[Measures].[Sales Amount]")).isEqualTo("Sales Amount");
    }

    @Test
    void stripsMemberCaptionSuffix() {
        assertThat(ColumnNames.extract("[Date].[Year].[Year].[MEMBER_CAPTION]")).isEqualTo("Year");
    }

    @Test
    void dropsMemberKeySegments() {
        assertThat(ColumnNames.extract("[Product].[Category].&[Fruit]")).isEqualTo("Category");
    }

    @Test
    void plainNamesPassThrough() {
        assertThat(ColumnNames.extract("Region")).isEqualTo("Region");
    }

    @Test
    void nothingLeftGivesEmptyName() {
        assertThat(ColumnNames.extract("&[2020]")).isEmpty();
    }
}
