package com.crossfire.materializer;

import com.crossfire.api.OutputFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultMaterializerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResultMaterializer materializer = new ResultMaterializer(objectMapper);

    private static TabularCursor salesByProduct() {
        return new ListTabularCursor(
                List.of("[Product].[Product].[Product].[MEMBER_CAPTION]", "[Measures].[Sales Amount]", "[Measures].[Sales Count]"),
                List.of(
                        Arrays.asList("Apple", 10, 2),
                        Arrays.asList("Pear", 7, null)));
    }

    private static TabularCursor unpivotInput() {
        return new ListTabularCursor(
                List.of("[Product].[Product].[Product].[MEMBER_CAPTION]", "[Date].[Year].[Year].[MEMBER_CAPTION]", "[Measures].[Sales Amount]"),
                List.of(
                        Arrays.asList("Apple", "2020", 10),
                        Arrays.asList("Apple", "2021", 12),
                        Arrays.asList("Pear", "2021", 7),
                        Arrays.asList("Apple", "2022", 15),
                        Arrays.asList("Pear", "2022", 9),
                        Arrays.asList("Pear", "2020", 3)));
    }

    @Test
    void tableKeepsNativeTypesAndNulls() throws Exception {
        JsonNode json = objectMapper.readTree(materializer.materialize(salesByProduct(), OutputFormat.TABLE));

        assertThat(json).isEqualTo(objectMapper.readTree(
                "[{\"Product\":\"Apple\",\"Sales Amount\":10,\"Sales Count\":2},"
                        + "{\"Product\":\"Pear\",\"Sales Amount\":7,\"Sales Count\":null}]"));
    }

    @Test
    void dictionaryCoercesValuesToStrings() {
        Map<String, List<String>> dictionary = materializer.toDictionary(salesByProduct());

        assertThat(dictionary).containsOnlyKeys("Product", "Sales Amount", "Sales Count");
        assertThat(dictionary.keySet()).containsExactly("Product", "Sales Amount", "Sales Count");
        assertThat(dictionary.get("Product")).containsExactly("Apple", "Pear");
        assertThat(dictionary.get("Sales Amount")).containsExactly("10", "7");
        assertThat(dictionary.get("Sales Count")).containsExactly("2", null);
    }

    @Test
    void dictionaryRejectsDuplicateColumnNames() {
        TabularCursor cursor = new ListTabularCursor(
                List.of("[Measures].[Sales Amount]", "[Finance].[Sales Amount]"),
                List.of());

        assertThatThrownBy(() -> materializer.toDictionary(cursor))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sales Amount");
    }

    @Test
    void keyValueArrayUsesFirstTwoColumns() throws Exception {
        JsonNode json = objectMapper.readTree(materializer.materialize(salesByProduct(), OutputFormat.KEY_VALUE_ARRAY));

        assertThat(json).isEqualTo(objectMapper.readTree(
                "[{\"key\":\"Apple\",\"value\":\"10\"},{\"key\":\"Pear\",\"value\":\"7\"}]"));
    }

    @Test
    void keyValueArrayRequiresTwoColumns() {
        assertThatThrownBy(() -> materializer.materialize(
                new ListTabularCursor(List.of("[Measures].[Sales Amount]"), List.of(List.of(10))), OutputFormat.KEY_VALUE_ARRAY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 2 columns")
                .hasMessageEndingWith("got 1");
    }

    @Test
    void twoDimensionalArrayStartsWithHeader() {
        List<List<String>> rows = materializer.toTwoDimensionalArray(salesByProduct());

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly("Product", "Sales Amount", "Sales Count");
        assertThat(rows.get(1)).containsExactly("Apple", "10", "2");
        assertThat(rows.get(2)).containsExactly("Pear", "7", null);
    }

    @Test
    void twoDimensionalArrayOfEmptyResultIsHeaderOnly() {
        TabularCursor cursor = new ListTabularCursor(List.of("[Measures].[Sales Amount]"), List.of());

        assertThat(materializer.toTwoDimensionalArray(cursor)).containsExactly(List.of("Sales Amount"));
    }

    @Test
    void unpivotBuildsOneRowPerKeyAndOneColumnPerLabel() {
        ResultTable table = materializer.toSimpleUnpivotedTable(unpivotInput());

        assertThat(table.getColumns()).containsExactly("Product", "2020", "2021", "2022");
        assertThat(table.getRows()).hasSize(2);
        assertThat(table.getRows().get(0)).containsExactly(
                Map.entry("Product", "Apple"), Map.entry("2020", "10"), Map.entry("2021", "12"), Map.entry("2022", "15"));
        assertThat(table.getRows().get(1)).containsExactly(
                Map.entry("Product", "Pear"), Map.entry("2020", "3"), Map.entry("2021", "7"), Map.entry("2022", "9"));
    }

    @Test
    void unpivotLeavesMissingCombinationsAbsent() throws Exception {
        TabularCursor cursor = new ListTabularCursor(
                List.of("[Product].[Product].[Product]", "[Date].[Year].[Year]", "[Measures].[Sales Amount]"),
                List.of(
                        Arrays.asList("Apple", "2020", 10),
                        Arrays.asList("Pear", "2021", 7)));

        JsonNode json = objectMapper.readTree(materializer.materialize(cursor, OutputFormat.SIMPLE_UNPIVOTED_TABLE));

        assertThat(json).isEqualTo(objectMapper.readTree(
                "[{\"Product\":\"Apple\",\"2020\":\"10\"},{\"Product\":\"Pear\",\"2021\":\"7\"}]"));
    }

    @Test
    void unpivotRequiresThreeColumns() {
        assertThatThrownBy(() -> materializer.materialize(
                new ListTabularCursor(List.of("a", "b"), List.of()), OutputFormat.SIMPLE_UNPIVOTED_TABLE))
                .isInstanceOf(UnpivotShapeException.class)
                .hasMessageContaining("3 columns");
        assertThatThrownBy(() -> materializer.toSimpleUnpivotedTable(
                new ListTabularCursor(List.of("a", "b", "c", "d"), List.of())))
                .isInstanceOf(UnpivotShapeException.class);
    }

    @Test
    void unpivotRejectsRepeatedKeyLabelPair() {
        TabularCursor cursor = new ListTabularCursor(
                List.of("Product", "Year", "Sales"),
                List.of(
                        Arrays.asList("Apple", "2020", 10),
                        Arrays.asList("Apple", "2020", 11)));

        assertThatThrownBy(() -> materializer.toSimpleUnpivotedTable(cursor))
                .isInstanceOf(UnpivotShapeException.class)
                .hasMessageContaining("Apple/2020");
    }

    @ParameterizedTest
    @EnumSource(OutputFormat.class)
    void missingCursorGivesEmptyResponse(OutputFormat format) {
        assertThat(materializer.materialize(null, format)).isEqualTo(ResultMaterializer.EMPTY_RESPONSE);
    }

    @Test
    void sameInputGivesSameOutput() {
        assertThat(materializer.materialize(salesByProduct(), OutputFormat.DICTIONARY))
                .isEqualTo(materializer.materialize(salesByProduct(), OutputFormat.DICTIONARY));
    }
}
