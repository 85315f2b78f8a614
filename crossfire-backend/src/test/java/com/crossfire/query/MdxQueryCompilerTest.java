package com.crossfire.query;

import com.crossfire.api.QueryRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdxQueryCompilerTest {

    private static QueryRequest.QueryRequestBuilder salesQuery() {
        return QueryRequest.builder()
                .queryValues(List.of("[Measures].[Sales Amount]", "[Measures].[Sales Count]"))
                .modelName("test-model");
    }

    @Test
    void valuesOnly() {
        assertThat(MdxQueryCompiler.compile(salesQuery().build())).isEqualTo(
                " select non empty { [Measures].[Sales Amount], [Measures].[Sales Count] } on 0"
                        + " from ( select  from [test-model] )");
    }

    @Test
    void filtersGoIntoSubselect() {
        QueryRequest request = salesQuery().queryFilters(List.of("[Product].[Product].&[Apple]")).build();

        assertThat(MdxQueryCompiler.compile(request)).isEqualTo(
                " select non empty { [Measures].[Sales Amount], [Measures].[Sales Count] } on 0"
                        + " from ( select [Product].[Product].&[Apple] on 0 from [test-model] )");
    }

    @Test
    void eachFilterGetsItsOwnAxis() {
        QueryRequest request = salesQuery()
                .queryFilters(List.of("{[Product].[Product].&[Apple]}", "{[Date].[Year].&[2020]}"))
                .build();

        assertThat(MdxQueryCompiler.compile(request))
                .contains("( select {[Product].[Product].&[Apple]} on 0, {[Date].[Year].&[2020]} on 1 from [test-model] )");
    }

    @Test
    void slicesGoOnRows() {
        QueryRequest request = salesQuery()
                .querySlices(List.of("[Product].[Product].[Product]", "[Date].[Year].[Year]"))
                .build();

        assertThat(MdxQueryCompiler.compile(request)).isEqualTo(
                " select non empty { [Measures].[Sales Amount], [Measures].[Sales Count] } on 0"
                        + ", ([Product].[Product].[Product], [Date].[Year].[Year]) on 1"
                        + " from ( select  from [test-model] )");
    }

    @Test
    void defaultMeasureWrapsSlicesInNonEmpty() {
        QueryRequest request = salesQuery()
                .querySlices(List.of("[Product].[Product].[Product]"))
                .defaultMeasure("[Measures].[Sales Count]")
                .build();

        assertThat(MdxQueryCompiler.compile(request))
                .contains(", nonempty( ([Product].[Product].[Product]), [Measures].[Sales Count]) on 1 from");
    }

    @Test
    void defaultMeasureWithoutSlicesIsIgnored() {
        QueryRequest request = salesQuery().defaultMeasure("[Measures].[Sales Count]").build();

        assertThat(MdxQueryCompiler.compile(request)).isEqualTo(MdxQueryCompiler.compile(salesQuery().build()));
    }

    @Test
    void customSetsPrecedeCustomMembers() {
        QueryRequest request = salesQuery()
                .customMembers(List.of("[Measures].[Margin] as [Measures].[Sales Amount] * 0.2"))
                .customSets(List.of("[Top] as topcount([Product].[Product].[Product], 5)"))
                .build();

        String expectedPrefix = "with \n"
                + "set [Top] as topcount([Product].[Product].[Product], 5)\n"
                + "member [Measures].[Margin] as [Measures].[Sales Amount] * 0.2\n"
                + " select non empty {";
        assertThat(MdxQueryCompiler.compile(request)).startsWith(expectedPrefix);
    }

    @Test
    void emptyListsRenderLikeAbsentOnes() {
        QueryRequest request = salesQuery()
                .queryFilters(List.of())
                .querySlices(List.of())
                .customSets(List.of())
                .customMembers(List.of())
                .build();

        assertThat(MdxQueryCompiler.compile(request)).isEqualTo(MdxQueryCompiler.compile(salesQuery().build()));
    }

    @Test
    void valuesAreRequired() {
        QueryRequest request = QueryRequest.builder().modelName("test-model").build();

        assertThatThrownBy(() -> MdxQueryCompiler.compile(request)).isInstanceOf(NullPointerException.class);
    }
}
